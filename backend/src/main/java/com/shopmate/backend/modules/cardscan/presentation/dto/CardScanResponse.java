package com.shopmate.backend.modules.cardscan.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shopmate.backend.modules.cardscan.domain.CardScanResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardScanResponse(
        String cardUid,
        String outcome,
        String memberName,
        String display
) {

    public static CardScanResponse from(CardScanResult result) {
        return new CardScanResponse(result.cardUid(), result.outcome().name(), result.memberName(), result.displayLine());
    }
}
