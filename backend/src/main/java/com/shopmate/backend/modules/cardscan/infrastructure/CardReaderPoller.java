package com.shopmate.backend.modules.cardscan.infrastructure;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.modules.cardscan.application.CardScanService;
import com.shopmate.backend.modules.cardscan.domain.CardScanResult;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the card reader on a fixed delay and feeds every identifier to the scan flow.
 */
@Component
@ConditionalOnProperty(prefix = "shopmate.card-reader", name = "enabled", havingValue = "true")
public class CardReaderPoller {

    private static final Logger log = LoggerFactory.getLogger(CardReaderPoller.class);

    private final CardScanService cardScanService;
    private final CardReader cardReader;

    @Autowired
    public CardReaderPoller(CardScanService cardScanService, @Value("${shopmate.card-reader.device}") Path device) {
        this(cardScanService, new LineCardReader(device));
        log.info("Card reader polling enabled on {}", device);
    }

    CardReaderPoller(CardScanService cardScanService, CardReader cardReader) {
        this.cardScanService = cardScanService;
        this.cardReader = cardReader;
    }

    @Scheduled(fixedDelayString = "${shopmate.card-reader.poll-interval:PT0.2S}")
    public void pollOnce() {
        Optional<String> uid;
        try {
            uid = cardReader.poll();
        } catch (UncheckedIOException ex) {
            log.error("Card reader failed; will reopen on next poll", ex);
            return;
        }
        uid.ifPresent(this::handleScan);
    }

    private void handleScan(String uid) {
        try {
            CardScanResult result = cardScanService.scan(uid);
            log.info("[display] {}", result.displayLine());
        } catch (ProblemException ex) {
            log.warn("[display] {} (card {}: {})", ex.getDetailMessage(), uid, ex.getCode());
        }
    }

    @PreDestroy
    public void close() throws IOException {
        if (cardReader instanceof Closeable closeable) {
            closeable.close();
        }
    }
}
