package com.shopmate.backend.modules.member.domain;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered shop member.
 *
 * @param handle      chat identity, unique across the registry
 * @param displayName name recorded on attendance sessions
 * @param cardUid     normalized card identifier, may be blank for members without a card
 * @param seniority   1 (most senior) to 5 (least senior)
 * @param leadHandle  handle of the member's lead, or {@code null}
 */
public record Member(String handle, String displayName, String cardUid, int seniority, String leadHandle) {

    public static final int MOST_SENIOR = 1;
    public static final int LEAST_SENIOR = 5;

    /** Most senior first, then by display name for a deterministic pick. */
    public static final Comparator<Member> BY_SENIORITY = Comparator
            .comparingInt(Member::seniority)
            .thenComparing(Member::displayName);

    public Member {
        Objects.requireNonNull(handle, "handle is required");
        Objects.requireNonNull(displayName, "displayName is required");
        cardUid = normalizeCardUid(cardUid);
        if (seniority < MOST_SENIOR || seniority > LEAST_SENIOR) {
            seniority = LEAST_SENIOR;
        }
        leadHandle = (leadHandle == null || leadHandle.isBlank()) ? null : leadHandle.trim();
    }

    public Optional<String> lead() {
        return Optional.ofNullable(leadHandle);
    }

    public boolean isMoreSeniorThan(Member other) {
        return seniority < other.seniority;
    }

    public boolean isLeadOf(Member other) {
        return other.leadHandle != null && other.leadHandle.equals(handle);
    }

    public boolean hasName(String name) {
        return name != null && normalizeName(displayName).equals(normalizeName(name));
    }

    public static int parseSeniority(String raw) {
        if (raw == null || raw.isBlank()) {
            return LEAST_SENIOR;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return (value < MOST_SENIOR || value > LEAST_SENIOR) ? LEAST_SENIOR : value;
        } catch (NumberFormatException ex) {
            return LEAST_SENIOR;
        }
    }

    public static String normalizeCardUid(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
