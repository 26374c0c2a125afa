package com.shopmate.backend.modules.attendance.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.shopmate.backend.modules.approval.application.ApprovalService.PendingSession;

public record PendingSessionResponse(
        int number,
        String memberName,
        LocalDateTime checkIn,
        LocalDateTime checkOut,
        BigDecimal hours
) {

    public static PendingSessionResponse from(PendingSession pending) {
        return new PendingSessionResponse(
                pending.displayIndex(),
                pending.session().memberName(),
                pending.session().checkIn(),
                pending.session().checkOut(),
                pending.session().hours()
        );
    }
}
