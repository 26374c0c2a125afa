package com.shopmate.backend.modules.chat.application;

import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.shopmate.backend.global.error.ProblemException;
import com.shopmate.backend.modules.approval.application.ApprovalService;
import com.shopmate.backend.modules.approval.application.ApprovalService.PendingSession;
import com.shopmate.backend.modules.attendance.application.AttendanceService;
import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckInResult;
import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckOutResult;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.chat.domain.ChatEvent;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.member.infrastructure.MemberRegistry;
import com.shopmate.backend.modules.shop.application.ShopActivityService;
import com.shopmate.backend.modules.shop.application.ShopAnnouncementService;
import com.shopmate.backend.modules.shop.domain.AnnouncementMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Interprets chat text. Returns the reply to post in the originating conversation, or
 * empty when the message is not addressed to the bot.
 */
@Service
public class ChatCommandService {

    private static final Logger log = LoggerFactory.getLogger(ChatCommandService.class);

    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    static final String NOT_REGISTERED = "You are not registered as a shop member.";

    static final String HELP = "Available commands:\n"
            + "- `check in` / `check out`\n"
            + "- `who is in` / `is shop open`\n"
            + "- `approve pending <name>`\n"
            + "- `approve <name> <number>`\n"
            + "- `approve all <name>`\n"
            + "- `disapprove <name> <number>`\n"
            + "- `announcement formal` / `announcement casual` (admin only)";

    static final String APPROVAL_USAGE = "Usage:\n"
            + "- `approve pending <name>`\n"
            + "- `approve <name> <number>`\n"
            + "- `approve all <name>`\n"
            + "- `disapprove <name> <number>`";

    private static final List<String> WHO_IS_IN_SHOP = List.of(
            "who is in shop", "who's in shop", "who is in the shop", "who's in the shop");

    private final MemberRegistry memberRegistry;
    private final ShopActivityService shopActivityService;
    private final ShopAnnouncementService shopAnnouncementService;
    private final AttendanceService attendanceService;
    private final ApprovalService approvalService;

    public ChatCommandService(
            MemberRegistry memberRegistry,
            ShopActivityService shopActivityService,
            ShopAnnouncementService shopAnnouncementService,
            AttendanceService attendanceService,
            ApprovalService approvalService
    ) {
        this.memberRegistry = memberRegistry;
        this.shopActivityService = shopActivityService;
        this.shopAnnouncementService = shopAnnouncementService;
        this.attendanceService = attendanceService;
        this.approvalService = approvalService;
    }

    public Optional<String> handle(ChatEvent event) {
        String lower = event.text().toLowerCase(Locale.ROOT);
        if (!event.isDirect()) {
            return handlePublic(lower);
        }
        if (event.senderHandle() == null || event.senderHandle().isBlank()) {
            return Optional.empty();
        }

        Optional<Member> sender = memberRegistry.findByHandle(event.senderHandle());
        if (sender.isEmpty()) {
            log.info("Ignoring command from unregistered handle {}", event.senderHandle());
            return Optional.of(NOT_REGISTERED);
        }

        try {
            return Optional.of(dispatch(sender.get(), event.text(), lower));
        } catch (ProblemException ex) {
            log.info("Command '{}' from {} rejected: {}", event.text(), event.senderHandle(), ex.getCode());
            return Optional.of(ex.getDetailMessage());
        }
    }

    private Optional<String> handlePublic(String lower) {
        if (WHO_IS_IN_SHOP.stream().anyMatch(lower::contains)) {
            return Optional.of(ShopAnnouncementService.channelSummary(attendanceService.presentMembers()));
        }
        if (asksIfOpen(lower)) {
            return Optional.of(ShopAnnouncementService.openStatus(attendanceService.presentMembers()));
        }
        return Optional.empty();
    }

    private String dispatch(Member sender, String text, String lower) {
        if (lower.contains("check in")) {
            CheckInResult result = shopActivityService.checkIn(sender);
            return "Checked in at " + CLOCK_FORMAT.format(result.session().checkIn()) + ".";
        }
        if (lower.contains("check out")) {
            CheckOutResult result = shopActivityService.checkOut(sender);
            return "Checked out at " + CLOCK_FORMAT.format(result.checkOutTime()) + ".";
        }
        if (lower.startsWith("approve ") || lower.startsWith("disapprove ")) {
            return handleApproval(sender, text);
        }
        if (lower.equals("announcement formal")) {
            return shopAnnouncementService.switchMode(sender.handle(), AnnouncementMode.FORMAL);
        }
        if (lower.equals("announcement casual")) {
            return shopAnnouncementService.switchMode(sender.handle(), AnnouncementMode.CASUAL);
        }
        if (asksIfOpen(lower)) {
            return ShopAnnouncementService.openStatus(attendanceService.presentMembers());
        }
        if (lower.contains("who is in") || lower.contains("who's in")) {
            return ShopAnnouncementService.whoIsInStatus(attendanceService.presentMembers());
        }
        return HELP;
    }

    private String handleApproval(Member sender, String text) {
        String[] parts = text.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        if (parts.length < 3) {
            return APPROVAL_USAGE;
        }
        String second = parts[1].toLowerCase(Locale.ROOT);

        if (second.equals("pending")) {
            String target = joinFrom(parts, 2, parts.length);
            return pendingListing(target, approvalService.listPending(sender.handle(), target));
        }
        if (command.equals("approve") && second.equals("all")) {
            String target = joinFrom(parts, 2, parts.length);
            int count = approvalService.approveAll(sender.handle(), target);
            return "Approved " + count + " session(s) for " + target + ".";
        }

        String last = parts[parts.length - 1];
        if (!last.chars().allMatch(Character::isDigit)) {
            return APPROVAL_USAGE;
        }
        int number;
        try {
            number = Integer.parseInt(last);
        } catch (NumberFormatException ex) {
            return "Session number is too large.";
        }
        String target = joinFrom(parts, 1, parts.length - 1);
        if (command.equals("approve")) {
            approvalService.approve(sender.handle(), target, number);
            return "Approved session #" + number + " for " + target + ".";
        }
        approvalService.disapprove(sender.handle(), target, number);
        return "Removed session #" + number + " for " + target + ".";
    }

    static String pendingListing(String target, List<PendingSession> pending) {
        if (pending.isEmpty()) {
            return "No pending sessions for " + target + ".";
        }
        StringBuilder text = new StringBuilder("Pending sessions for ").append(target).append(':');
        for (PendingSession entry : pending) {
            AttendanceSession session = entry.session();
            text.append('\n')
                    .append(entry.displayIndex())
                    .append(". check_in: ")
                    .append(SESSION_FORMAT.format(session.checkIn()))
                    .append("  check_out: ")
                    .append(SESSION_FORMAT.format(session.checkOut()))
                    .append("  hours: ")
                    .append(session.hours());
        }
        text.append("\n\n- `approve ").append(target).append(" <number>` to approve")
                .append("\n- `disapprove ").append(target).append(" <number>` to remove");
        return text.toString();
    }

    private static boolean asksIfOpen(String lower) {
        return lower.contains("is shop open") || lower.contains("is the shop open");
    }

    private static String joinFrom(String[] parts, int from, int to) {
        return String.join(" ", Arrays.copyOfRange(parts, from, to));
    }
}
