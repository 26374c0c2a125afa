package com.shopmate.backend.modules.cardscan.presentation;

import com.shopmate.backend.modules.cardscan.application.CardScanService;
import com.shopmate.backend.modules.cardscan.presentation.dto.CardScanRequest;
import com.shopmate.backend.modules.cardscan.presentation.dto.CardScanResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/card-scans")
public class CardScanController {

    private final CardScanService cardScanService;

    public CardScanController(CardScanService cardScanService) {
        this.cardScanService = cardScanService;
    }

    @Operation(summary = "Record a card scan", description = "Checks the card owner in, or out if already present.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scan handled, including unknown cards"),
            @ApiResponse(responseCode = "409", description = "Attendance state conflict"),
            @ApiResponse(responseCode = "500", description = "Ledger could not be updated")
    })
    @PostMapping
    public ResponseEntity<CardScanResponse> scan(@Valid @RequestBody CardScanRequest request) {
        return ResponseEntity.ok(CardScanResponse.from(cardScanService.scan(request.cardUid())));
    }
}
