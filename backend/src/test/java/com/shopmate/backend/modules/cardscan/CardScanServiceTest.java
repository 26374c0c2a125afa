package com.shopmate.backend.modules.cardscan;

import static com.shopmate.backend.support.TestMembers.ALICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;

import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckInResult;
import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckOutResult;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.cardscan.application.CardScanService;
import com.shopmate.backend.modules.cardscan.domain.CardScanResult;
import com.shopmate.backend.modules.cardscan.domain.ScanOutcome;
import com.shopmate.backend.modules.shop.application.ShopActivityService;
import com.shopmate.backend.modules.shop.application.ShopActivityService.Toggle;
import com.shopmate.backend.support.TestMembers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CardScanServiceTest {

    private static final LocalDateTime NINE = LocalDateTime.parse("2025-03-01T09:00:00");

    @Mock
    private ShopActivityService shopActivityService;

    private CardScanService cardScanService;

    @BeforeEach
    void setUp() {
        cardScanService = new CardScanService(TestMembers.registry(), shopActivityService);
    }

    @Test
    @DisplayName("an unknown card is reported without touching attendance")
    void unknownCard() {
        CardScanResult result = cardScanService.scan("deadbeef");

        assertThat(result.outcome()).isEqualTo(ScanOutcome.UNKNOWN_CARD);
        assertThat(result.displayLine()).isEqualTo("Unknown card");
        assertThat(result.cardUid()).isEqualTo("DEADBEEF");
        verify(shopActivityService, never()).toggle(any());
    }

    @Test
    @DisplayName("a blank scan is treated as an unknown card")
    void blankCard() {
        assertThat(cardScanService.scan("   ").outcome()).isEqualTo(ScanOutcome.UNKNOWN_CARD);
    }

    @Test
    @DisplayName("a card of an absent member checks them in")
    void scanChecksIn() {
        AttendanceSession open = AttendanceSession.open(ALICE, NINE);
        when(shopActivityService.toggle(ALICE)).thenReturn(new Toggle(new CheckInResult(open, true, List.of("Alice")), null));

        CardScanResult result = cardScanService.scan(" a1a1a1a1 ");

        assertThat(result.outcome()).isEqualTo(ScanOutcome.CHECKED_IN);
        assertThat(result.displayLine()).isEqualTo("Welcome Alice");
    }

    @Test
    @DisplayName("a card of a present member checks them out")
    void scanChecksOut() {
        AttendanceSession closed = AttendanceSession.open(ALICE, NINE).close(NINE.plusHours(2));
        when(shopActivityService.toggle(ALICE)).thenReturn(new Toggle(null, new CheckOutResult(closed, true, List.of())));

        CardScanResult result = cardScanService.scan("A1A1A1A1");

        assertThat(result.outcome()).isEqualTo(ScanOutcome.CHECKED_OUT);
        assertThat(result.displayLine()).isEqualTo("Goodbye Alice");
        assertThat(result.memberName()).isEqualTo("Alice");
    }
}
