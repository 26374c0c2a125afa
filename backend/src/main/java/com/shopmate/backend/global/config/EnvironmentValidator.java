package com.shopmate.backend.global.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks the shopmate settings once the application is up and refuses to keep running
 * with a configuration that would misroute notifications or misjudge stale sessions.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        String[] requiredVars = {
            "shopmate.attendance.ledger-path",
            "shopmate.members.path"
        };
        for (String var : requiredVars) {
            if (value(var).isEmpty()) {
                missingVars.add(var);
            }
        }

        requirePositiveDuration("shopmate.attendance.stale-threshold", invalidVars);
        requirePositiveDuration("shopmate.escalation.lookback", invalidVars);

        value("shopmate.notification.backoff").ifPresent(raw -> {
            Optional<Duration> backoff = parseDuration(raw);
            if (backoff.isEmpty() || backoff.get().isNegative()) {
                invalidVars.add("shopmate.notification.backoff: must be a non-negative ISO-8601 duration");
            }
        });

        value("shopmate.notification.max-attempts").ifPresent(raw -> {
            try {
                if (Integer.parseInt(raw) < 1) {
                    invalidVars.add("shopmate.notification.max-attempts: must be at least 1");
                }
            } catch (NumberFormatException e) {
                invalidVars.add("shopmate.notification.max-attempts: must be a number");
            }
        });

        value("shopmate.time-zone").ifPresent(raw -> {
            try {
                ZoneId.of(raw);
            } catch (DateTimeException e) {
                invalidVars.add("shopmate.time-zone: unknown zone " + raw);
            }
        });

        value("shopmate.chat.webhook-url").ifPresent(raw -> {
            try {
                if (!new URI(raw).isAbsolute()) {
                    invalidVars.add("shopmate.chat.webhook-url: must be an absolute URL");
                }
            } catch (URISyntaxException e) {
                invalidVars.add("shopmate.chat.webhook-url: " + e.getMessage());
            }
        });

        if (Boolean.parseBoolean(environment.getProperty("shopmate.card-reader.enabled", "false"))
                && value("shopmate.card-reader.device").isEmpty()) {
            missingVars.add("shopmate.card-reader.device");
        }

        if (value("shopmate.admin-handle").isEmpty()) {
            log.warn("shopmate.admin-handle is not set; escalations without a lead will not be delivered");
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(v -> log.error("Invalid setting: {}", v));
            throw new IllegalStateException("Configuration validation failed: missing=" + missingVars
                    + ", invalid=" + invalidVars);
        }

        log.info("Configuration validated");
    }

    private void requirePositiveDuration(String key, List<String> invalidVars) {
        value(key).ifPresent(raw -> {
            Optional<Duration> duration = parseDuration(raw);
            if (duration.isEmpty() || duration.get().isNegative() || duration.get().isZero()) {
                invalidVars.add(key + ": must be a positive ISO-8601 duration");
            }
        });
    }

    private Optional<String> value(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }

    private static Optional<Duration> parseDuration(String raw) {
        try {
            return Optional.of(Duration.parse(raw));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
