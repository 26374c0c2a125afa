package com.shopmate.backend.modules.chat;

import static com.shopmate.backend.support.TestMembers.ADMIN_HANDLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.shopmate.backend.modules.approval.application.ApprovalService;
import com.shopmate.backend.modules.attendance.application.AttendanceService;
import com.shopmate.backend.modules.attendance.application.PresenceReconciler;
import com.shopmate.backend.modules.attendance.domain.ApprovalState;
import com.shopmate.backend.modules.attendance.infrastructure.CsvLedgerStore;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerLock;
import com.shopmate.backend.modules.chat.application.ChatCommandService;
import com.shopmate.backend.modules.chat.domain.ChannelKind;
import com.shopmate.backend.modules.chat.domain.ChatEvent;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.member.infrastructure.MemberRegistry;
import com.shopmate.backend.modules.notification.application.CheckoutNotificationService;
import com.shopmate.backend.modules.notification.application.EscalationResolver;
import com.shopmate.backend.modules.notification.application.NotificationDispatcher;
import com.shopmate.backend.modules.shop.application.ShopActivityService;
import com.shopmate.backend.modules.shop.application.ShopAnnouncementService;
import com.shopmate.backend.support.MutableClock;
import com.shopmate.backend.support.TestMembers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatCommandServiceTest {

    private static final Member ADMIN = new Member(ADMIN_HANDLE, "Admin", "AD00", 1, null);

    @TempDir
    Path tempDir;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private MutableClock clock;
    private CsvLedgerStore ledgerStore;
    private ChatCommandService chatCommandService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T09:00:00");
        List<Member> members = new ArrayList<>(TestMembers.ALL);
        members.add(ADMIN);
        MemberRegistry registry = TestMembers.registry(members);

        LedgerLock ledgerLock = new LedgerLock();
        ledgerStore = new CsvLedgerStore(tempDir.resolve("attendance.csv"));
        AttendanceService attendanceService = new AttendanceService(
                ledgerStore, ledgerLock, new PresenceReconciler(Duration.ofHours(12)), clock);
        ShopAnnouncementService announcements = new ShopAnnouncementService(
                notificationDispatcher, "C-ANNOUNCE", ADMIN_HANDLE);
        CheckoutNotificationService checkoutNotifications = new CheckoutNotificationService(
                new EscalationResolver(ledgerStore, registry, Duration.ofHours(24), ADMIN_HANDLE),
                notificationDispatcher);
        ShopActivityService shopActivity = new ShopActivityService(
                attendanceService, announcements, checkoutNotifications);
        ApprovalService approvalService = new ApprovalService(ledgerStore, ledgerLock, registry);

        chatCommandService = new ChatCommandService(
                registry, shopActivity, announcements, attendanceService, approvalService);
    }

    private String dm(String handle, String text) {
        return chatCommandService.handle(new ChatEvent(handle, ChannelKind.DIRECT, "D-" + handle, text)).orElseThrow();
    }

    @Test
    @DisplayName("unregistered users are told so")
    void unregisteredSender() {
        assertThat(dm("U-STRANGER", "check in")).isEqualTo("You are not registered as a shop member.");
    }

    @Test
    @DisplayName("check in replies with the time and announces the open shop")
    void checkIn() {
        assertThat(dm("U-CAROL", "check in")).isEqualTo("Checked in at 09:00:00.");

        verify(notificationDispatcher).post(eq("C-ANNOUNCE"), endsWith(". Carol checked in."));
        assertThat(dm("U-CAROL", "Check In please")).isEqualTo(
                "You are already checked in since 2025-03-01 09:00:00. Please `check out` first.");
    }

    @Test
    @DisplayName("check out prompts the lead of the last member out and closes the shop")
    void checkOutNotifiesLead() {
        dm("U-CAROL", "check in");
        clock.advance(Duration.ofMinutes(90));

        assertThat(dm("U-CAROL", "check out")).isEqualTo("Checked out at 10:30:00.");

        verify(notificationDispatcher).post("U-ALICE", "Carol checked out. Hours worked: 1.50\n"
                + "- `approve pending Carol` to view pending sessions\n"
                + "- `approve Carol <number>` to approve a specific session\n"
                + "- `disapprove Carol <number>` to remove a specific session");
        verify(notificationDispatcher).post("C-ANNOUNCE", "Shop closed. Last person out: Carol");
    }

    @Test
    @DisplayName("check out while others remain prompts the most senior of them")
    void checkOutNotifiesSeniorPresent() {
        dm("U-BOB", "check in");
        dm("U-EVAN", "check in");
        clock.advance(Duration.ofHours(1));

        dm("U-EVAN", "check out");

        verify(notificationDispatcher).post(eq("U-BOB"), startsWith("Evan checked out. Hours worked: 1.00"));
        verify(notificationDispatcher, never()).post(eq("C-ANNOUNCE"), startsWith("Shop closed"));
    }

    @Test
    @DisplayName("check out without check in is refused")
    void checkOutWithoutCheckIn() {
        assertThat(dm("U-BOB", "check out")).isEqualTo("You're not currently checked in.");
    }

    @Test
    @DisplayName("an approver lists, approves and removes pending sessions")
    void approvalFlow() {
        for (int i = 0; i < 3; i++) {
            dm("U-CAROL", "check in");
            clock.advance(Duration.ofHours(1));
            dm("U-CAROL", "check out");
        }

        String listing = dm("U-ALICE", "approve pending Carol");
        assertThat(listing).startsWith("Pending sessions for Carol:\n1. check_in: 2025-03-01T09:00:00  check_out: 2025-03-01T10:00:00  hours: 1.00");
        assertThat(listing).contains("\n3. check_in: 2025-03-01T11:00:00");

        assertThat(dm("U-ALICE", "approve Carol 2")).isEqualTo("Approved session #2 for Carol.");
        assertThat(dm("U-ALICE", "disapprove Carol 1")).isEqualTo("Removed session #1 for Carol.");
        assertThat(dm("U-ALICE", "disapprove Carol 5")).isEqualTo("Invalid session number - Carol has 1 pending session(s).");
        assertThat(dm("U-ALICE", "approve all Carol")).isEqualTo("Approved 1 session(s) for Carol.");
        assertThat(dm("U-ALICE", "approve all Carol")).isEqualTo("Approved 0 session(s) for Carol.");
        assertThat(dm("U-ALICE", "approve pending Carol")).isEqualTo("No pending sessions for Carol.");

        assertThat(ledgerStore.read()).hasSize(2)
                .allSatisfy(session -> assertThat(session.approval()).isEqualTo(ApprovalState.APPROVED));
    }

    @Test
    @DisplayName("juniors cannot approve and bad numbers are explained")
    void approvalRejections() {
        assertThat(dm("U-EVAN", "approve Carol 1"))
                .isEqualTo("You're not authorized to approve/disapprove sessions for that member.");
        assertThat(dm("U-EVAN", "approve pending Carol"))
                .isEqualTo("You're not authorized to view pending sessions for that member.");
        assertThat(dm("U-EVAN", "approve all Carol")).isEqualTo("You're not authorized to approve hours for that member.");
        assertThat(dm("U-ALICE", "approve Carol 0")).isEqualTo("Session number must be 1 or greater.");
        assertThat(dm("U-ALICE", "approve Carol")).startsWith("Usage:");
        assertThat(dm("U-ALICE", "approve Carol soon")).startsWith("Usage:");
    }

    @Test
    @DisplayName("only the admin can change the announcement mode")
    void announcementMode() {
        assertThat(dm("U-ALICE", "announcement formal")).isEqualTo("You're not authorized to use this command.");
        assertThat(dm(ADMIN_HANDLE, "announcement formal")).startsWith("Formal mode enabled.");

        dm("U-BOB", "check in");

        verify(notificationDispatcher).post("C-ANNOUNCE", "The shop is now open. Bob checked in.");
        assertThat(dm(ADMIN_HANDLE, "Announcement Casual")).startsWith("Casual mode restored.");
    }

    @Test
    @DisplayName("status questions work in direct messages")
    void directStatus() {
        assertThat(dm("U-BOB", "is shop open?")).isEqualTo("No, the shop is currently closed.");
        dm("U-BOB", "check in");
        assertThat(dm("U-EVAN", "who is in")).isEqualTo("Currently checked in:\n- Bob");
    }

    @Test
    @DisplayName("public channels only answer presence questions")
    void publicChannel() {
        dm("U-BOB", "check in");
        dm("U-ALICE", "check in");

        assertThat(chatCommandService.handle(new ChatEvent("U-X", ChannelKind.PUBLIC, "C-GEN", "hey who's in the shop?")))
                .contains("Currently in shop: Alice, Bob");
        assertThat(chatCommandService.handle(new ChatEvent("U-X", ChannelKind.PUBLIC, "C-GEN", "Is the shop open")))
                .contains("Yes, the shop is open. Currently checked in:\n- Alice\n- Bob");
        assertThat(chatCommandService.handle(new ChatEvent("U-BOB", ChannelKind.PUBLIC, "C-GEN", "check out")))
                .isEmpty();
    }

    @Test
    @DisplayName("anything else gets the command list")
    void help() {
        assertThat(dm("U-BOB", "hello")).startsWith("Available commands:");
        verify(notificationDispatcher, never()).post(anyString(), anyString());
    }
}
