package com.shopmate.backend.modules.attendance.application;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.member.domain.Member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Derives the live presence set from the ledger. For every member only the most recent
 * open session counts; one older than the staleness threshold is reported instead of
 * restored. The ledger itself is never modified here.
 */
@Component
public class PresenceReconciler {

    private static final Logger log = LoggerFactory.getLogger(PresenceReconciler.class);

    private final Duration staleThreshold;

    public PresenceReconciler(@Value("${shopmate.attendance.stale-threshold:PT12H}") Duration staleThreshold) {
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("stale-threshold must be positive: " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public ReconciliationReport reconcile(List<AttendanceSession> sessions, LocalDateTime now) {
        Map<String, AttendanceSession> latestOpen = new LinkedHashMap<>();
        for (AttendanceSession session : sessions) {
            if (!session.isOpen()) {
                continue;
            }
            AttendanceSession previous = latestOpen.put(Member.normalizeName(session.memberName()), session);
            if (previous != null) {
                log.warn("Member {} has more than one open session; using the one from {} and ignoring {}",
                        session.memberName(), session.checkIn(), previous.checkIn());
            }
        }

        List<RecoveredMember> recovered = new ArrayList<>();
        List<StaleSession> stale = new ArrayList<>();
        for (AttendanceSession session : latestOpen.values()) {
            Duration age = Duration.between(session.checkIn(), now);
            if (age.compareTo(staleThreshold) > 0) {
                stale.add(new StaleSession(session.memberName(), session.checkIn(), age));
            } else {
                recovered.add(new RecoveredMember(session.memberName(), session.checkIn()));
            }
        }
        return new ReconciliationReport(List.copyOf(recovered), List.copyOf(stale));
    }

    public record ReconciliationReport(List<RecoveredMember> recovered, List<StaleSession> stale) {

        public List<String> recoveredNames() {
            return recovered.stream().map(RecoveredMember::memberName).toList();
        }

        public boolean isEmpty() {
            return recovered.isEmpty() && stale.isEmpty();
        }
    }

    public record RecoveredMember(String memberName, LocalDateTime checkIn) {
    }

    public record StaleSession(String memberName, LocalDateTime checkIn, Duration age) {
    }
}
