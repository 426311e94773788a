package com.familybudget.budget.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /**
     * Anchors "now" for the trailing analytics windows.
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
