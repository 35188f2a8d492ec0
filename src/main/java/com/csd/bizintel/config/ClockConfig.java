package com.csd.bizintel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // replaced by a fixed or mutable clock in tests
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
