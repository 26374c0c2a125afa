package com.shopmate.backend.modules.chat.presentation.dto;

import com.shopmate.backend.modules.chat.domain.ChannelKind;
import com.shopmate.backend.modules.chat.domain.ChatEvent;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ChatEventRequest(
        String senderHandle,
        @NotNull ChannelKind channelKind,
        String channel,
        @NotNull @Size(max = 4000) String text,
        boolean fromBot
) {

    public ChatEvent toEvent() {
        return new ChatEvent(senderHandle, channelKind, channel, text);
    }
}
