package com.shopmate.backend.modules.attendance.domain;

import java.util.Locale;

public enum ApprovalState {
    PENDING,
    APPROVED;

    public boolean isPending() {
        return this == PENDING;
    }

    /**
     * Ledger flag text. Blank, {@code none} and {@code false} all mean pending.
     */
    public static ApprovalState fromFlag(String flag) {
        if (flag == null) {
            return PENDING;
        }
        return switch (flag.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> APPROVED;
            case "", "false", "none" -> PENDING;
            default -> throw new IllegalArgumentException("Unknown approval flag: " + flag);
        };
    }

    public String toFlag() {
        return this == APPROVED ? "True" : "False";
    }
}
