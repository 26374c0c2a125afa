package com.shopmate.backend.modules.notification.application;

import java.util.Optional;

import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckOutResult;
import com.shopmate.backend.modules.member.domain.Member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends the approval prompt for a finished session to whoever the escalation chain picks.
 */
@Service
public class CheckoutNotificationService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutNotificationService.class);

    private final EscalationResolver escalationResolver;
    private final NotificationDispatcher notificationDispatcher;

    public CheckoutNotificationService(EscalationResolver escalationResolver, NotificationDispatcher notificationDispatcher) {
        this.escalationResolver = escalationResolver;
        this.notificationDispatcher = notificationDispatcher;
    }

    public Optional<String> notifyApprover(Member member, CheckOutResult result) {
        Optional<String> target = escalationResolver.resolve(
                result.session(),
                result.checkOutTime(),
                member,
                result.presentMembers()
        );
        if (target.isEmpty()) {
            log.warn("No recipient for the check-out of {}; no admin handle configured", member.displayName());
            return target;
        }
        notificationDispatcher.post(target.get(), approvalPrompt(member.displayName(), result));
        return target;
    }

    static String approvalPrompt(String name, CheckOutResult result) {
        return name + " checked out. Hours worked: " + result.session().hours() + "\n"
                + "- `approve pending " + name + "` to view pending sessions\n"
                + "- `approve " + name + " <number>` to approve a specific session\n"
                + "- `disapprove " + name + " <number>` to remove a specific session";
    }
}
