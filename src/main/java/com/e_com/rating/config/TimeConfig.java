package com.e_com.rating.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Source of "today" for review submission dates.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock appClock() {
        return Clock.systemUTC();
    }
}
