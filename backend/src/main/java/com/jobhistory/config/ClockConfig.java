package com.jobhistory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for duration and recurrence computations; tests replace it with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(JobHistoryProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
