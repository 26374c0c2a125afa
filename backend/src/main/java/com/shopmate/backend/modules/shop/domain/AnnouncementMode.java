package com.shopmate.backend.modules.shop.domain;

public enum AnnouncementMode {
    CASUAL,
    FORMAL
}
