package com.shopmate.backend.modules.cardscan.domain;

public enum ScanOutcome {
    CHECKED_IN,
    CHECKED_OUT,
    UNKNOWN_CARD
}
