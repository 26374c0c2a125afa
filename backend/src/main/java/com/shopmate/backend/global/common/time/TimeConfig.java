package com.shopmate.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared clock so every module stamps sessions in the shop's time zone.
 * Ledger timestamps are local date-times, so the zone must not change between restarts.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock shopClock(@Value("${shopmate.time-zone:UTC}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
