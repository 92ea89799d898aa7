package com.library.lending.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LendingProperties.class)
public class LendingConfig {

    /** Source of "today" for due dates and the overdue projection. Replaced in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
