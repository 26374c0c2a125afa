package com.shopmate.backend.modules.cardscan.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CardScanRequest(
        @NotBlank @Size(max = 64) String cardUid
) {
}
