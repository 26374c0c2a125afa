package com.shopmate.backend.modules.notification.application;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStore;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStoreException;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.member.infrastructure.MemberRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Picks the one member to notify when someone checks out:
 * <ol>
 *   <li>the most senior member still in the shop;</li>
 *   <li>otherwise the most senior member whose session overlapped the departing one,
 *       looking back a bounded window from the check-out;</li>
 *   <li>otherwise the departing member's lead;</li>
 *   <li>otherwise the administrator.</li>
 * </ol>
 * Seniority ties go to the alphabetically first name.
 */
@Component
public class EscalationResolver {

    private static final Logger log = LoggerFactory.getLogger(EscalationResolver.class);

    private final LedgerStore ledgerStore;
    private final MemberRegistry memberRegistry;
    private final Duration lookback;
    private final String adminHandle;

    public EscalationResolver(
            LedgerStore ledgerStore,
            MemberRegistry memberRegistry,
            @Value("${shopmate.escalation.lookback:PT24H}") Duration lookback,
            @Value("${shopmate.admin-handle:}") String adminHandle
    ) {
        this.ledgerStore = ledgerStore;
        this.memberRegistry = memberRegistry;
        this.lookback = lookback;
        this.adminHandle = adminHandle;
    }

    public Optional<String> resolve(
            AttendanceSession session,
            LocalDateTime checkOutTime,
            Member departing,
            Collection<String> presentAfterDeparture
    ) {
        Optional<Member> seniorPresent = presentAfterDeparture.stream()
                .filter(name -> !departing.hasName(name))
                .map(memberRegistry::findByName)
                .flatMap(Optional::stream)
                .min(Member.BY_SENIORITY);
        if (seniorPresent.isPresent()) {
            return Optional.of(seniorPresent.get().handle());
        }

        Optional<Member> seniorCoPresent = findCoPresent(session, checkOutTime, departing).stream()
                .min(Member.BY_SENIORITY);
        if (seniorCoPresent.isPresent()) {
            return Optional.of(seniorCoPresent.get().handle());
        }

        if (departing.lead().isPresent()) {
            log.info("No co-present members found for {}; notifying lead {}", departing.displayName(), departing.leadHandle());
            return departing.lead();
        }

        log.info("No lead set for {}; falling back to admin", departing.displayName());
        return (adminHandle == null || adminHandle.isBlank()) ? Optional.empty() : Optional.of(adminHandle);
    }

    private List<Member> findCoPresent(AttendanceSession session, LocalDateTime checkOutTime, Member departing) {
        List<AttendanceSession> ledger;
        try {
            ledger = ledgerStore.read();
        } catch (LedgerStoreException ex) {
            log.error("Could not scan the ledger for co-present members of {}", departing.displayName(), ex);
            return List.of();
        }

        LocalDateTime windowStart = checkOutTime.minus(lookback);
        LocalDateTime overlapStart = session.checkIn().isAfter(windowStart) ? session.checkIn() : windowStart;

        return ledger.stream()
                .filter(other -> !other.belongsTo(departing.displayName()))
                .filter(other -> overlaps(other, overlapStart, windowStart, checkOutTime))
                .map(other -> memberRegistry.findByName(other.memberName()))
                .flatMap(Optional::stream)
                .filter(member -> !Objects.equals(member.handle(), departing.handle()))
                .distinct()
                .toList();
    }

    private static boolean overlaps(
            AttendanceSession other,
            LocalDateTime overlapStart,
            LocalDateTime windowStart,
            LocalDateTime checkOutTime
    ) {
        if (!other.checkIn().isBefore(checkOutTime)) {
            return false;
        }
        if (other.isOpen()) {
            return !other.checkIn().isBefore(windowStart);
        }
        return other.checkOut().isAfter(overlapStart);
    }
}
