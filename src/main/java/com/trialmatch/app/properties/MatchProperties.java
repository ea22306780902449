package com.trialmatch.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "match")
public class MatchProperties {
    private int concurrency = 4;
    private int deadlineSec = 300;
}
