package com.shopmate.backend.modules.notification.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no chat webhook is configured: posts end up in the application log only.
 */
public class LoggingChatTransport implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatTransport.class);

    @Override
    public void post(String recipientOrChannel, String text) {
        log.info("[chat -> {}] {}", recipientOrChannel, text);
    }
}
