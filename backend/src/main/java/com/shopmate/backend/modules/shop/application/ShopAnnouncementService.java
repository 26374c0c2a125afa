package com.shopmate.backend.modules.shop.application;

import java.util.List;
import java.util.Random;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.modules.notification.application.NotificationDispatcher;
import com.shopmate.backend.modules.shop.domain.AnnouncementMode;
import com.shopmate.backend.modules.shop.domain.ShopOpenMessages;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Shop-open and shop-closed broadcasts, and the texts answering "is the shop open".
 */
@Service
public class ShopAnnouncementService {

    private static final Logger log = LoggerFactory.getLogger(ShopAnnouncementService.class);

    public static final String FORBIDDEN_CODE = "shop.announcement_forbidden";

    private final NotificationDispatcher notificationDispatcher;
    private final String announceChannel;
    private final String adminHandle;
    private final Random random;

    private volatile AnnouncementMode mode = AnnouncementMode.CASUAL;

    @Autowired
    public ShopAnnouncementService(
            NotificationDispatcher notificationDispatcher,
            @Value("${shopmate.announce-channel:}") String announceChannel,
            @Value("${shopmate.admin-handle:}") String adminHandle
    ) {
        this(notificationDispatcher, announceChannel, adminHandle, new Random());
    }

    ShopAnnouncementService(
            NotificationDispatcher notificationDispatcher,
            String announceChannel,
            String adminHandle,
            Random random
    ) {
        this.notificationDispatcher = notificationDispatcher;
        this.announceChannel = announceChannel;
        this.adminHandle = adminHandle;
        this.random = random;
    }

    public AnnouncementMode getMode() {
        return mode;
    }

    public String switchMode(String requesterHandle, AnnouncementMode newMode) {
        if (adminHandle == null || adminHandle.isBlank() || !adminHandle.equals(requesterHandle)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, FORBIDDEN_CODE,
                    "You're not authorized to use this command.");
        }
        mode = newMode;
        log.info("Announcement mode set to {} by {}", newMode, requesterHandle);
        if (newMode == AnnouncementMode.FORMAL) {
            return "Formal mode enabled. All future shop-open announcements will use:\n\""
                    + ShopOpenMessages.FORMAL + "\"";
        }
        return "Casual mode restored. Shop-open announcements will use random messages again.";
    }

    public void announceOpened(String memberName) {
        broadcast(ShopOpenMessages.openLine(mode, random) + " " + memberName + " checked in.");
    }

    public void announceClosed(String lastMemberName) {
        broadcast("Shop closed. Last person out: " + lastMemberName);
    }

    public static String openStatus(List<String> presentMembers) {
        if (presentMembers.isEmpty()) {
            return "No, the shop is currently closed.";
        }
        return "Yes, the shop is open. Currently checked in:\n- " + String.join("\n- ", presentMembers);
    }

    public static String whoIsInStatus(List<String> presentMembers) {
        if (presentMembers.isEmpty()) {
            return "No one is currently checked in.";
        }
        return "Currently checked in:\n- " + String.join("\n- ", presentMembers);
    }

    public static String channelSummary(List<String> presentMembers) {
        if (presentMembers.isEmpty()) {
            return "The shop is currently empty.";
        }
        return "Currently in shop: " + String.join(", ", presentMembers);
    }

    private void broadcast(String text) {
        if (announceChannel == null || announceChannel.isBlank()) {
            log.info("No announce channel configured; skipping broadcast: {}", text);
            return;
        }
        notificationDispatcher.post(announceChannel, text);
    }
}
