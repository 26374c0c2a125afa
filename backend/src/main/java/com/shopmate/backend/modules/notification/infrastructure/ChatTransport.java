package com.shopmate.backend.modules.notification.infrastructure;

/**
 * Outbound side of the chat integration: delivers plain text to a user handle or channel.
 */
public interface ChatTransport {

    /**
     * @throws com.shopmate.backend.global.error.RetryableProblemException when the
     *         transport asks the caller to retry later
     * @throws RuntimeException on any other delivery failure
     */
    void post(String recipientOrChannel, String text);
}
