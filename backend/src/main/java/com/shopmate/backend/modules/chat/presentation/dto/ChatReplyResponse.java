package com.shopmate.backend.modules.chat.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatReplyResponse(
        boolean replied,
        String channel,
        String text
) {

    public static ChatReplyResponse none() {
        return new ChatReplyResponse(false, null, null);
    }
}
