package org.caureq.caureqsensorhub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Arrival-time source for the gateway and query windows; tests swap in a fixed clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
