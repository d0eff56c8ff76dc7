package com.company.placeholder.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PlaceholderProperties.class)
public class PlaceholderConfig {

    /**
     * Single source of "now" for time inference, cache expiry and hit accounting
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
