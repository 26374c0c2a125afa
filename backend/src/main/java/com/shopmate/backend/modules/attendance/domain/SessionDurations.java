package com.shopmate.backend.modules.attendance.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Elapsed-time arithmetic for attendance sessions. Hours are rounded half-up to two decimals.
 */
public final class SessionDurations {

    public static final BigDecimal ZERO_HOURS = new BigDecimal("0.0");

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private SessionDurations() {
    }

    public static BigDecimal hoursBetween(LocalDateTime checkIn, LocalDateTime checkOut) {
        if (checkIn == null || checkOut == null) {
            throw new IllegalArgumentException("checkIn and checkOut are required");
        }
        long seconds = Duration.between(checkIn, checkOut).getSeconds();
        if (seconds < 0) {
            throw new IllegalArgumentException("checkOut precedes checkIn: " + checkIn + " > " + checkOut);
        }
        return BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP);
    }
}
