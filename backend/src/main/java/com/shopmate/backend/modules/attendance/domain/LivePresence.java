package com.shopmate.backend.modules.attendance.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shopmate.backend.modules.member.domain.Member;

/**
 * Names of the members currently in the shop. A derived cache of the ledger: it is never
 * persisted and is rebuilt by reconciliation on every start. Not thread-safe; callers
 * mutate it only while holding the ledger lock.
 *
 * <p>Entries are keyed by {@link Member#normalizeName(String)}, the same way ledger rows are
 * matched to members, and keep the name they were added under for display.
 */
public final class LivePresence {

    private final Map<String, String> present = new LinkedHashMap<>();

    public boolean contains(String memberName) {
        return present.containsKey(Member.normalizeName(memberName));
    }

    public boolean isEmpty() {
        return present.isEmpty();
    }

    public int size() {
        return present.size();
    }

    /**
     * @return {@code true} if the member was not already present
     */
    public boolean add(String memberName) {
        return present.put(Member.normalizeName(memberName), memberName) == null;
    }

    /**
     * @return {@code true} if the member was present
     */
    public boolean remove(String memberName) {
        return present.remove(Member.normalizeName(memberName)) != null;
    }

    public void replaceWith(Collection<String> memberNames) {
        present.clear();
        memberNames.forEach(this::add);
    }

    /** Sorted, immutable copy of the display names. */
    public List<String> snapshot() {
        return present.values().stream().sorted(Comparator.naturalOrder()).toList();
    }
}
