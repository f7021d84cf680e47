package com.talentpilot.tracker.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    /**
     * Bounded pool for per-candidate dispatch. Its size is the fan-out limit
     * of every bulk operation.
     */
    @Bean(name = "outreachExecutor", destroyMethod = "shutdown")
    public MdcPropagatingExecutor outreachExecutor(TrackerProperties properties) {
        return new MdcPropagatingExecutor(
                Executors.newFixedThreadPool(properties.getBulk().getMaxConcurrency()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
