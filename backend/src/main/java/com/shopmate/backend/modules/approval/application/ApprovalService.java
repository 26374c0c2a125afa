package com.shopmate.backend.modules.approval.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.shopmate.backend.modules.attendance.application.AttendanceProblems;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerLock;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStore;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStoreException;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.member.infrastructure.MemberRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Approves or removes closed sessions. A member may act on another member's sessions when
 * strictly more senior, or when registered as that member's lead.
 * <p>
 * Display indexes are positions in the pending list at the time of the call; the list is
 * re-derived under the ledger lock for every mutation.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final LedgerStore ledgerStore;
    private final LedgerLock ledgerLock;
    private final MemberRegistry memberRegistry;

    public ApprovalService(LedgerStore ledgerStore, LedgerLock ledgerLock, MemberRegistry memberRegistry) {
        this.ledgerStore = ledgerStore;
        this.ledgerLock = ledgerLock;
        this.memberRegistry = memberRegistry;
    }

    public boolean isAuthorized(String approverHandle, String targetName) {
        Optional<Member> approver = memberRegistry.findByHandle(approverHandle);
        Optional<Member> target = memberRegistry.findByName(targetName);
        if (approver.isEmpty() || target.isEmpty()) {
            return false;
        }
        return approver.get().isMoreSeniorThan(target.get()) || approver.get().isLeadOf(target.get());
    }

    public List<PendingSession> listPending(String targetName) {
        return ledgerLock.withLock(() -> pendingOf(readLedger(), targetName));
    }

    public List<PendingSession> listPending(String approverHandle, String targetName) {
        authorize(approverHandle, targetName, "view pending sessions");
        return listPending(targetName);
    }

    public AttendanceSession approve(String approverHandle, String targetName, int displayIndex) {
        requirePositive(displayIndex);
        authorize(approverHandle, targetName, "approve/disapprove sessions");
        return ledgerLock.withLock(() -> {
            List<AttendanceSession> sessions = new ArrayList<>(readLedger());
            PendingSession pending = select(sessions, targetName, displayIndex);
            AttendanceSession approved = pending.session().approve();
            sessions.set(pending.ledgerPosition(), approved);
            writeLedger(sessions);
            log.info("{} approved session #{} of {} ({} hours)", approverHandle, displayIndex, targetName, approved.hours());
            return approved;
        });
    }

    public AttendanceSession disapprove(String approverHandle, String targetName, int displayIndex) {
        requirePositive(displayIndex);
        authorize(approverHandle, targetName, "approve/disapprove sessions");
        return ledgerLock.withLock(() -> {
            List<AttendanceSession> sessions = new ArrayList<>(readLedger());
            PendingSession pending = select(sessions, targetName, displayIndex);
            sessions.remove(pending.ledgerPosition());
            writeLedger(sessions);
            log.info("{} removed session #{} of {} (checked in {})",
                    approverHandle, displayIndex, targetName, pending.session().checkIn());
            return pending.session();
        });
    }

    /**
     * @return the number of sessions approved; the ledger is not rewritten when it is 0
     */
    public int approveAll(String approverHandle, String targetName) {
        authorize(approverHandle, targetName, "approve hours");
        return ledgerLock.withLock(() -> {
            List<AttendanceSession> sessions = new ArrayList<>(readLedger());
            List<PendingSession> pending = pendingOf(sessions, targetName);
            if (pending.isEmpty()) {
                return 0;
            }
            for (PendingSession entry : pending) {
                sessions.set(entry.ledgerPosition(), entry.session().approve());
            }
            writeLedger(sessions);
            log.info("{} approved {} session(s) of {}", approverHandle, pending.size(), targetName);
            return pending.size();
        });
    }

    private void authorize(String approverHandle, String targetName, String action) {
        if (!isAuthorized(approverHandle, targetName)) {
            log.warn("{} is not authorized to {} for {}", approverHandle, action, targetName);
            throw ApprovalProblems.unauthorized(action);
        }
    }

    private static void requirePositive(int displayIndex) {
        if (displayIndex < 1) {
            throw ApprovalProblems.nonPositiveIndex();
        }
    }

    private static PendingSession select(List<AttendanceSession> sessions, String targetName, int displayIndex) {
        List<PendingSession> pending = pendingOf(sessions, targetName);
        if (displayIndex > pending.size()) {
            throw ApprovalProblems.invalidIndex(targetName, pending.size());
        }
        return pending.get(displayIndex - 1);
    }

    static List<PendingSession> pendingOf(List<AttendanceSession> sessions, String targetName) {
        List<PendingSession> pending = new ArrayList<>();
        for (int i = 0; i < sessions.size(); i++) {
            AttendanceSession session = sessions.get(i);
            if (session.belongsTo(targetName) && session.isPendingApproval()) {
                pending.add(new PendingSession(pending.size() + 1, i, session));
            }
        }
        return pending;
    }

    private List<AttendanceSession> readLedger() {
        try {
            return ledgerStore.read();
        } catch (LedgerStoreException ex) {
            log.error("Failed to read attendance ledger", ex);
            throw AttendanceProblems.ledgerFailure(ex);
        }
    }

    private void writeLedger(List<AttendanceSession> sessions) {
        try {
            ledgerStore.write(sessions);
        } catch (LedgerStoreException ex) {
            log.error("Failed to write attendance ledger", ex);
            throw AttendanceProblems.ledgerFailure(ex);
        }
    }

    /**
     * @param displayIndex   1-based position shown to the approver
     * @param ledgerPosition 0-based row in the ledger when the list was derived
     */
    public record PendingSession(int displayIndex, int ledgerPosition, AttendanceSession session) {
    }
}
