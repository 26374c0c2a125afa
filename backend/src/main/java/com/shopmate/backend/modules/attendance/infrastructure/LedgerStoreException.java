package com.shopmate.backend.modules.attendance.infrastructure;

public class LedgerStoreException extends RuntimeException {

    public LedgerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
