package com.shopmate.backend.modules.attendance.presentation.dto;

import java.util.List;

public record PresenceResponse(
        boolean shopOpen,
        int count,
        List<String> members
) {

    public static PresenceResponse of(List<String> members) {
        return new PresenceResponse(!members.isEmpty(), members.size(), members);
    }
}
