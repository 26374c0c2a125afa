package com.shopmate.backend.modules.notification.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration(proxyBeanMethods = false)
public class ChatTransportConfig {

    private static final Logger log = LoggerFactory.getLogger(ChatTransportConfig.class);

    @Bean
    public ChatTransport chatTransport(
            RestClient.Builder restClientBuilder,
            @Value("${shopmate.chat.webhook-url:}") String webhookUrl,
            @Value("${shopmate.chat.bot-token:}") String botToken
    ) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("No chat webhook configured; outbound messages are only logged");
            return new LoggingChatTransport();
        }
        log.info("Posting chat messages to {}", webhookUrl);
        return new WebhookChatTransport(restClientBuilder, webhookUrl, botToken);
    }
}
