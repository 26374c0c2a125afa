package com.shopmate.backend.modules.attendance.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import com.shopmate.backend.modules.member.domain.Member;

/**
 * One continuous presence interval of a member. Immutable; state changes produce a new
 * instance that the caller writes back to the ledger.
 *
 * @param checkOut {@code null} while the session is open
 */
public record AttendanceSession(
        String cardUid,
        String memberName,
        LocalDateTime checkIn,
        LocalDateTime checkOut,
        BigDecimal hours,
        ApprovalState approval
) {

    public AttendanceSession {
        Objects.requireNonNull(memberName, "memberName is required");
        Objects.requireNonNull(checkIn, "checkIn is required");
        cardUid = Member.normalizeCardUid(cardUid);
        checkIn = checkIn.truncatedTo(ChronoUnit.SECONDS);
        checkOut = checkOut == null ? null : checkOut.truncatedTo(ChronoUnit.SECONDS);
        hours = hours == null ? SessionDurations.ZERO_HOURS : hours;
        approval = approval == null ? ApprovalState.PENDING : approval;
    }

    public static AttendanceSession open(Member member, LocalDateTime checkIn) {
        return new AttendanceSession(
                member.cardUid(),
                member.displayName(),
                checkIn,
                null,
                SessionDurations.ZERO_HOURS,
                ApprovalState.PENDING
        );
    }

    public boolean isOpen() {
        return checkOut == null;
    }

    public boolean isPendingApproval() {
        return !isOpen() && approval.isPending();
    }

    public boolean belongsToCard(String uid) {
        String normalized = Member.normalizeCardUid(uid);
        return !normalized.isEmpty() && cardUid.equals(normalized);
    }

    public boolean belongsTo(String name) {
        return Member.normalizeName(memberName).equals(Member.normalizeName(name));
    }

    /**
     * Closes the session at {@code checkOutTime}; approval goes back to pending.
     */
    public AttendanceSession close(LocalDateTime checkOutTime) {
        if (!isOpen()) {
            throw new IllegalStateException("Session already closed: " + this);
        }
        LocalDateTime checkOutSeconds = checkOutTime.truncatedTo(ChronoUnit.SECONDS);
        return new AttendanceSession(
                cardUid,
                memberName,
                checkIn,
                checkOutSeconds,
                SessionDurations.hoursBetween(checkIn, checkOutSeconds),
                ApprovalState.PENDING
        );
    }

    public AttendanceSession approve() {
        return new AttendanceSession(cardUid, memberName, checkIn, checkOut, hours, ApprovalState.APPROVED);
    }
}
