package com.shopmate.backend.modules.attendance.application;

import org.springframework.http.HttpStatus;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerStoreException;

/**
 * Problem codes raised by the attendance and approval flows.
 */
public final class AttendanceProblems {

    public static final String MEMBER_NOT_FOUND = "member.not_found";
    public static final String ALREADY_CHECKED_IN = "attendance.already_checked_in";
    public static final String NOT_CHECKED_IN = "attendance.not_checked_in";
    public static final String INCONSISTENT_STATE = "attendance.inconsistent_state";
    public static final String LEDGER_IO_FAILURE = "ledger.io_failure";

    private AttendanceProblems() {
    }

    public static ProblemException memberNotFound(String detail) {
        return new ProblemException(HttpStatus.NOT_FOUND, MEMBER_NOT_FOUND, detail);
    }

    /**
     * The caller is expected to have logged {@code cause} with full detail; the returned
     * problem carries only a generic message.
     */
    public static ProblemException ledgerFailure(LedgerStoreException cause) {
        return new ProblemException(
                HttpStatus.INTERNAL_SERVER_ERROR,
                LEDGER_IO_FAILURE,
                "Failed to update the attendance ledger. Please try again or contact an admin.",
                cause
        );
    }
}
