package com.shopmate.backend.modules.attendance.presentation;

import java.util.List;

import com.shopmate.backend.modules.approval.application.ApprovalService;
import com.shopmate.backend.modules.attendance.application.AttendanceService;
import com.shopmate.backend.modules.attendance.presentation.dto.PendingSessionResponse;
import com.shopmate.backend.modules.attendance.presentation.dto.PresenceResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance")
public class AttendanceController {

    private final AttendanceService attendanceService;
    private final ApprovalService approvalService;

    public AttendanceController(AttendanceService attendanceService, ApprovalService approvalService) {
        this.attendanceService = attendanceService;
        this.approvalService = approvalService;
    }

    @Operation(summary = "Current presence", description = "Members currently checked in, sorted by name.")
    @GetMapping("/presence")
    public ResponseEntity<PresenceResponse> getPresence() {
        return ResponseEntity.ok(PresenceResponse.of(attendanceService.presentMembers()));
    }

    @Operation(summary = "Pending sessions of a member", description = "Closed sessions awaiting approval, numbered as the approve commands expect.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pending list"),
            @ApiResponse(responseCode = "403", description = "Approver may not act for this member")
    })
    @GetMapping("/members/{name}/pending")
    public ResponseEntity<List<PendingSessionResponse>> getPendingSessions(
            @PathVariable String name,
            @RequestParam String approver
    ) {
        List<PendingSessionResponse> body = approvalService.listPending(approver, name).stream()
                .map(PendingSessionResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }
}
