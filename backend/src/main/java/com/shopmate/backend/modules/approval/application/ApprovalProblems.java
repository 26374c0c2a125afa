package com.shopmate.backend.modules.approval.application;

import org.springframework.http.HttpStatus;

import com.shopmate.backend.global.error.ProblemException;

final class ApprovalProblems {

    static final String UNAUTHORIZED = "approval.unauthorized";
    static final String INVALID_INDEX = "approval.invalid_index";

    private ApprovalProblems() {
    }

    static ProblemException unauthorized(String action) {
        return new ProblemException(HttpStatus.FORBIDDEN, UNAUTHORIZED,
                "You're not authorized to " + action + " for that member.");
    }

    static ProblemException invalidIndex(String targetName, int pendingCount) {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_INDEX,
                "Invalid session number - " + targetName + " has " + pendingCount + " pending session(s).");
    }

    static ProblemException nonPositiveIndex() {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_INDEX, "Session number must be 1 or greater.");
    }
}
