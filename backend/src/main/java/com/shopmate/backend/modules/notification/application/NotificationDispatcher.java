package com.shopmate.backend.modules.notification.application;

import java.time.Duration;

import com.shopmate.backend.global.error.RetryableProblemException;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerLock;
import com.shopmate.backend.modules.notification.infrastructure.ChatTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Delivers chat posts with a bounded number of attempts. A failed notification never fails
 * the command that triggered it; it is logged as an alert instead.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ChatTransport chatTransport;
    private final LedgerLock ledgerLock;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration maxRetryAfter;

    public NotificationDispatcher(
            ChatTransport chatTransport,
            LedgerLock ledgerLock,
            @Value("${shopmate.notification.max-attempts:3}") int maxAttempts,
            @Value("${shopmate.notification.backoff:PT1S}") Duration backoff,
            @Value("${shopmate.notification.max-retry-after:PT30S}") Duration maxRetryAfter
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be >= 1");
        }
        this.chatTransport = chatTransport;
        this.ledgerLock = ledgerLock;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.maxRetryAfter = maxRetryAfter;
    }

    /**
     * @return {@code true} if the transport accepted the post
     */
    public boolean post(String recipientOrChannel, String text) {
        if (ledgerLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Notifications must not be sent while holding the ledger lock");
        }
        if (recipientOrChannel == null || recipientOrChannel.isBlank()) {
            log.warn("Dropping notification without recipient: {}", text);
            return false;
        }

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration wait = backoff;
            try {
                chatTransport.post(recipientOrChannel, text);
                return true;
            } catch (RetryableProblemException ex) {
                lastFailure = ex;
                Duration hinted = Duration.ofSeconds(ex.getRetryAfterSeconds());
                wait = hinted.compareTo(maxRetryAfter) > 0 ? maxRetryAfter : hinted;
                log.warn("Post to {} rate limited (attempt {}/{}), retrying in {}",
                        recipientOrChannel, attempt, maxAttempts, wait);
            } catch (RuntimeException ex) {
                lastFailure = ex;
                log.warn("Post to {} failed (attempt {}/{}): {}",
                        recipientOrChannel, attempt, maxAttempts, ex.getMessage());
            }
            if (attempt < maxAttempts && !pause(wait)) {
                break;
            }
        }
        log.warn("[ALERT][Chat] target={} attempts={} detail={}",
                recipientOrChannel,
                maxAttempts,
                lastFailure == null ? "interrupted" : lastFailure.getMessage(),
                lastFailure);
        return false;
    }

    private boolean pause(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry a chat post");
            return false;
        }
    }
}
