package com.shopmate.backend.modules.notification.infrastructure;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Posts messages as JSON ({@code {"channel": ..., "text": ...}}) to a chat webhook.
 * A 429 answer becomes a {@link RetryableProblemException} carrying the server's
 * {@code Retry-After} hint.
 */
public class WebhookChatTransport implements ChatTransport {

    static final int DEFAULT_RETRY_AFTER_SECONDS = 20;

    private final RestClient restClient;
    private final String webhookUrl;

    public WebhookChatTransport(RestClient.Builder restClientBuilder, String webhookUrl, String botToken) {
        this.webhookUrl = webhookUrl;
        RestClient.Builder builder = restClientBuilder.clone();
        if (botToken != null && !botToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + botToken);
        }
        this.restClient = builder.build();
    }

    @Override
    public void post(String recipientOrChannel, String text) {
        restClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ChatPostPayload(recipientOrChannel, text))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    if (response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                        throw new RetryableProblemException(
                                HttpStatus.TOO_MANY_REQUESTS,
                                "chat.rate_limited",
                                "Chat transport rate limited the post to " + recipientOrChannel,
                                parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                        );
                    }
                    throw new ProblemException(
                            HttpStatus.BAD_GATEWAY,
                            "chat.post_failed",
                            "Chat transport answered " + response.getStatusCode().value() + " for " + recipientOrChannel
                    );
                })
                .toBodilessEntity();
    }

    static int parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            return Math.max(0, Integer.parseInt(header.trim()));
        } catch (NumberFormatException ex) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    public record ChatPostPayload(String channel, String text) {
    }
}
