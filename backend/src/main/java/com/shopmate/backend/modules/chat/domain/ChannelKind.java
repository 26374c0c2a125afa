package com.shopmate.backend.modules.chat.domain;

/**
 * Where a chat message was posted. Commands are only accepted in direct messages.
 */
public enum ChannelKind {
    DIRECT,
    PUBLIC
}
