package com.trialmatch.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {
    private boolean enabled = true;
    private String dir = "trials_cache";
    private int ttlHours = 24;
}
