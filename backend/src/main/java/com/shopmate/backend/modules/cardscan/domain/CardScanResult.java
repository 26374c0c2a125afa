package com.shopmate.backend.modules.cardscan.domain;

/**
 * @param displayLine text for the reader's display
 * @param memberName  {@code null} for unknown cards
 */
public record CardScanResult(String cardUid, ScanOutcome outcome, String memberName, String displayLine) {

    public static CardScanResult unknown(String cardUid) {
        return new CardScanResult(cardUid, ScanOutcome.UNKNOWN_CARD, null, "Unknown card");
    }

    public static CardScanResult checkedIn(String cardUid, String memberName) {
        return new CardScanResult(cardUid, ScanOutcome.CHECKED_IN, memberName, "Welcome " + memberName);
    }

    public static CardScanResult checkedOut(String cardUid, String memberName) {
        return new CardScanResult(cardUid, ScanOutcome.CHECKED_OUT, memberName, "Goodbye " + memberName);
    }
}
