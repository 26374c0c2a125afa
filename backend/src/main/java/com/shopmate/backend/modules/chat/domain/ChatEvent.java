package com.shopmate.backend.modules.chat.domain;

/**
 * An inbound human chat message. Bot messages are filtered out before this point.
 */
public record ChatEvent(String senderHandle, ChannelKind channelKind, String channel, String text) {

    public ChatEvent {
        text = text == null ? "" : text.strip();
    }

    public boolean isDirect() {
        return channelKind == ChannelKind.DIRECT;
    }
}
