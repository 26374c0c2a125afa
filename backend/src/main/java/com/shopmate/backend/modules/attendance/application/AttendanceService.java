package com.shopmate.backend.modules.attendance.application;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.modules.attendance.application.PresenceReconciler.ReconciliationReport;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.attendance.domain.LivePresence;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerLock;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStore;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStoreException;
import com.shopmate.backend.modules.member.domain.Member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Opens and closes attendance sessions and owns the live presence set. Every operation
 * runs under the {@link LedgerLock}, so the ledger and the presence set change together.
 */
@Service
public class AttendanceService {

    private static final Logger log = LoggerFactory.getLogger(AttendanceService.class);
    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LedgerStore ledgerStore;
    private final LedgerLock ledgerLock;
    private final PresenceReconciler presenceReconciler;
    private final Clock clock;
    private final LivePresence livePresence = new LivePresence();

    public AttendanceService(
            LedgerStore ledgerStore,
            LedgerLock ledgerLock,
            PresenceReconciler presenceReconciler,
            Clock clock
    ) {
        this.ledgerStore = ledgerStore;
        this.ledgerLock = ledgerLock;
        this.presenceReconciler = presenceReconciler;
        this.clock = clock;
    }

    /**
     * Rebuilds the presence set from the ledger. Runs once before any command is accepted.
     *
     * @throws LedgerStoreException if the ledger cannot be read
     */
    public ReconciliationReport recoverPresence() {
        return ledgerLock.withLock(() -> {
            ReconciliationReport report = presenceReconciler.reconcile(ledgerStore.read(), LocalDateTime.now(clock));
            livePresence.replaceWith(report.recoveredNames());
            return report;
        });
    }

    public CheckInResult checkIn(Member member) {
        return ledgerLock.withLock(() -> {
            List<AttendanceSession> sessions = readLedger();
            int openIndex = lastIndexOf(sessions, session -> session.isOpen() && session.belongsToCard(member.cardUid()));
            if (openIndex >= 0) {
                String since = SINCE_FORMAT.format(sessions.get(openIndex).checkIn());
                throw new ProblemException(HttpStatus.CONFLICT, AttendanceProblems.ALREADY_CHECKED_IN,
                        "You are already checked in since " + since + ". Please `check out` first.");
            }
            if (livePresence.contains(member.displayName())) {
                throw new ProblemException(HttpStatus.CONFLICT, AttendanceProblems.ALREADY_CHECKED_IN,
                        "You are already checked in. Please `check out` first.");
            }

            boolean wasEmpty = livePresence.isEmpty();
            AttendanceSession session = AttendanceSession.open(member, LocalDateTime.now(clock));
            try {
                ledgerStore.append(session);
            } catch (LedgerStoreException ex) {
                log.error("Failed to append check-in of {}", member.displayName(), ex);
                throw AttendanceProblems.ledgerFailure(ex);
            }
            livePresence.add(member.displayName());
            log.info("{} checked in at {} ({} in shop)", member.displayName(), session.checkIn(), livePresence.size());
            return new CheckInResult(session, wasEmpty, livePresence.snapshot());
        });
    }

    public CheckOutResult checkOut(Member member) {
        return ledgerLock.withLock(() -> {
            List<AttendanceSession> sessions = new ArrayList<>(readLedger());
            int index = lastIndexOf(sessions, session -> session.isOpen() && session.belongsToCard(member.cardUid()));
            if (index < 0) {
                index = lastIndexOf(sessions, session -> session.isOpen() && session.belongsTo(member.displayName()));
            }

            if (index < 0) {
                if (livePresence.remove(member.displayName())) {
                    log.warn("{} was marked present without an open ledger session; cleared live state",
                            member.displayName());
                    throw new ProblemException(HttpStatus.CONFLICT, AttendanceProblems.INCONSISTENT_STATE,
                            "Inconsistency detected: you were marked as checked in but no open session was found. "
                                    + "Your live state has been cleared - please check in again.");
                }
                throw new ProblemException(HttpStatus.CONFLICT, AttendanceProblems.NOT_CHECKED_IN,
                        "You're not currently checked in.");
            }

            AttendanceSession open = sessions.get(index);
            LocalDateTime now = LocalDateTime.now(clock);
            if (now.isBefore(open.checkIn())) {
                log.warn("Clock is behind the check-in of {} ({} < {}); closing with zero duration",
                        member.displayName(), now, open.checkIn());
                now = open.checkIn();
            }
            AttendanceSession closed = open.close(now);
            sessions.set(index, closed);
            try {
                ledgerStore.write(sessions);
            } catch (LedgerStoreException ex) {
                log.error("Failed to record check-out of {}", member.displayName(), ex);
                throw AttendanceProblems.ledgerFailure(ex);
            }
            // the ledger row may carry a name the registry has since changed
            livePresence.remove(open.memberName());
            livePresence.remove(member.displayName());
            log.info("{} checked out after {} hours ({} in shop)",
                    member.displayName(), closed.hours(), livePresence.size());
            return new CheckOutResult(closed, livePresence.isEmpty(), livePresence.snapshot());
        });
    }

    /**
     * Whether a scan or command from this member should be treated as a check-out.
     */
    public boolean isCheckedIn(Member member) {
        return ledgerLock.withLock(() -> {
            if (livePresence.contains(member.displayName())) {
                return true;
            }
            return lastIndexOf(readLedger(), session -> session.isOpen()
                    && (session.belongsToCard(member.cardUid()) || session.belongsTo(member.displayName()))) >= 0;
        });
    }

    public List<String> presentMembers() {
        return ledgerLock.withLock(livePresence::snapshot);
    }

    private List<AttendanceSession> readLedger() {
        try {
            return ledgerStore.read();
        } catch (LedgerStoreException ex) {
            log.error("Failed to read attendance ledger", ex);
            throw AttendanceProblems.ledgerFailure(ex);
        }
    }

    static int lastIndexOf(List<AttendanceSession> sessions, Predicate<AttendanceSession> predicate) {
        for (int i = sessions.size() - 1; i >= 0; i--) {
            if (predicate.test(sessions.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param shopOpened    the shop went from empty to occupied with this check-in
     * @param presentMembers everyone present after the check-in, sorted
     */
    public record CheckInResult(AttendanceSession session, boolean shopOpened, List<String> presentMembers) {
    }

    /**
     * @param shopClosed     the departing member was the last one in the shop
     * @param presentMembers everyone still present, sorted
     */
    public record CheckOutResult(AttendanceSession session, boolean shopClosed, List<String> presentMembers) {

        public LocalDateTime checkOutTime() {
            return session.checkOut();
        }
    }
}
