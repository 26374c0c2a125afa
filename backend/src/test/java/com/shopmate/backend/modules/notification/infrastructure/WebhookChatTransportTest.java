package com.shopmate.backend.modules.notification.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.global.error.RetryableProblemException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class WebhookChatTransportTest {

    private static final String WEBHOOK = "https://chat.example.test/api/post";

    private MockRestServiceServer server;
    private WebhookChatTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new WebhookChatTransport(builder, WEBHOOK, "xoxb-test");
    }

    @Test
    @DisplayName("posts the channel and text as JSON with the bot token")
    void postsJson() {
        server.expect(requestTo(WEBHOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer xoxb-test"))
                .andExpect(jsonPath("$.channel").value("U-ALICE"))
                .andExpect(jsonPath("$.text").value("Bob checked out. Hours worked: 1.50"))
                .andRespond(withSuccess());

        transport.post("U-ALICE", "Bob checked out. Hours worked: 1.50");

        server.verify();
    }

    @Test
    @DisplayName("429 becomes a retryable problem with the server's hint")
    void rateLimitIsRetryable() {
        server.expect(requestTo(WEBHOOK))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "7"));

        assertThatThrownBy(() -> transport.post("C-ANNOUNCE", "Shop closed. Last person out: Bob"))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("chat.rate_limited");
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(7);
                });
    }

    @Test
    @DisplayName("other error answers become a bad gateway problem")
    void serverErrorIsProblem() {
        server.expect(requestTo(WEBHOOK)).andRespond(withServerError());

        assertThatThrownBy(() -> transport.post("U-ALICE", "hello"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex).isNotInstanceOf(RetryableProblemException.class);
                    assertThat(ex.getCode()).isEqualTo("chat.post_failed");
                });
    }

    @Test
    @DisplayName("missing or unreadable Retry-After falls back to the default wait")
    void parseRetryAfter() {
        assertThat(WebhookChatTransport.parseRetryAfter(null)).isEqualTo(WebhookChatTransport.DEFAULT_RETRY_AFTER_SECONDS);
        assertThat(WebhookChatTransport.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"))
                .isEqualTo(WebhookChatTransport.DEFAULT_RETRY_AFTER_SECONDS);
        assertThat(WebhookChatTransport.parseRetryAfter(" 3 ")).isEqualTo(3);
        assertThat(WebhookChatTransport.parseRetryAfter("-4")).isZero();
    }
}
