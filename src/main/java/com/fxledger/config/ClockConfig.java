package com.fxledger.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Supplies the clock used for "today" defaults when a trade table lacks its date columns. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock settlementClock() {
        return Clock.systemDefaultZone();
    }
}
