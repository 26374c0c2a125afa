package com.shopmate.backend.modules.attendance.infrastructure;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the ledger as UP when a full read succeeds. Contributes as {@code ledger}.
 */
@Component("ledger")
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerStore ledgerStore;
    private final LedgerLock ledgerLock;

    public LedgerHealthIndicator(LedgerStore ledgerStore, LedgerLock ledgerLock) {
        this.ledgerStore = ledgerStore;
        this.ledgerLock = ledgerLock;
    }

    @Override
    public Health health() {
        try {
            int sessions = ledgerLock.withLock(() -> ledgerStore.read().size());
            return Health.up().withDetail("sessions", sessions).build();
        } catch (LedgerStoreException ex) {
            return Health.down(ex).build();
        }
    }
}
