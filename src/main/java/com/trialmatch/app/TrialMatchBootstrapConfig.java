package com.trialmatch.app;

import com.trialmatch.app.properties.CacheProperties;
import com.trialmatch.app.properties.MatchProperties;
import com.trialmatch.cache.CacheStore;
import com.trialmatch.cache.FileCacheStore;
import com.trialmatch.cache.InMemoryCacheStore;
import com.trialmatch.config.Config;
import com.trialmatch.data.http.HttpClientEx;
import com.trialmatch.matching.CriteriaFormatter;
import com.trialmatch.matching.MatchOrchestrator;
import com.trialmatch.matching.MatchResponseParser;
import com.trialmatch.matching.ReasoningProvider;
import com.trialmatch.matching.ReasoningProviders;
import com.trialmatch.registry.ClinicalTrialsGovClient;
import com.trialmatch.registry.TrialRegistryClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Spring wiring for embedding the matching engine in a host application.
 * The cache stores and the orchestrator are closed when the context shuts down.
 */
@Configuration
@EnableConfigurationProperties({MatchProperties.class, CacheProperties.class})
public class TrialMatchBootstrapConfig {

    @Bean
    public Config trialMatchConfig(Environment environment) {
        Map<String, Object> raw = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, raw);
    }

    @Bean
    public HttpClientEx httpClient(Config config) {
        return new HttpClientEx(config.getString("registry.user_agent", "TrialMatch/1.0"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public CacheStore searchCache(Config config, CacheProperties cacheProperties, Clock clock) {
        Duration ttl = Duration.ofHours(Math.max(1, cacheProperties.getTtlHours()));
        if (!cacheProperties.isEnabled()) {
            return new InMemoryCacheStore(Duration.ZERO, clock);
        }
        return new FileCacheStore(config.workingDir().resolve(cacheProperties.getDir()).normalize(), ttl, clock);
    }

    @Bean(destroyMethod = "close")
    public CacheStore trialCache(CacheProperties cacheProperties, Clock clock) {
        Duration ttl = cacheProperties.isEnabled() ? Duration.ofHours(Math.max(1, cacheProperties.getTtlHours())) : Duration.ZERO;
        return new InMemoryCacheStore(ttl, clock);
    }

    @Bean
    public TrialRegistryClient trialRegistryClient(
            Config config,
            HttpClientEx httpClient,
            @Qualifier("searchCache") CacheStore searchCache,
            @Qualifier("trialCache") CacheStore trialCache
    ) {
        return new ClinicalTrialsGovClient(config, httpClient, searchCache, trialCache);
    }

    @Bean
    @Lazy
    public ReasoningProvider reasoningProvider(Config config, HttpClientEx httpClient) {
        return ReasoningProviders.fromConfig(config, httpClient);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public MatchOrchestrator matchOrchestrator(
            TrialRegistryClient trialRegistryClient,
            ReasoningProvider reasoningProvider,
            MatchProperties matchProperties
    ) {
        return new MatchOrchestrator(
                trialRegistryClient,
                new CriteriaFormatter(),
                reasoningProvider,
                new MatchResponseParser(),
                Math.max(1, matchProperties.getConcurrency()),
                Duration.ofSeconds(Math.max(1, matchProperties.getDeadlineSec()))
        );
    }
}
