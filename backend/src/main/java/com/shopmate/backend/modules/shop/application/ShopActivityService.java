package com.shopmate.backend.modules.shop.application;

import com.shopmate.backend.modules.attendance.application.AttendanceService;
import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckInResult;
import com.shopmate.backend.modules.attendance.application.AttendanceService.CheckOutResult;
import com.shopmate.backend.modules.member.domain.Member;
import com.shopmate.backend.modules.notification.application.CheckoutNotificationService;

import org.springframework.stereotype.Service;

/**
 * Entry point for check-in and check-out from any source. The ledger work finishes and
 * releases the lock before any broadcast or approval prompt is sent.
 */
@Service
public class ShopActivityService {

    private final AttendanceService attendanceService;
    private final ShopAnnouncementService shopAnnouncementService;
    private final CheckoutNotificationService checkoutNotificationService;

    public ShopActivityService(
            AttendanceService attendanceService,
            ShopAnnouncementService shopAnnouncementService,
            CheckoutNotificationService checkoutNotificationService
    ) {
        this.attendanceService = attendanceService;
        this.shopAnnouncementService = shopAnnouncementService;
        this.checkoutNotificationService = checkoutNotificationService;
    }

    public CheckInResult checkIn(Member member) {
        CheckInResult result = attendanceService.checkIn(member);
        if (result.shopOpened()) {
            shopAnnouncementService.announceOpened(member.displayName());
        }
        return result;
    }

    public CheckOutResult checkOut(Member member) {
        CheckOutResult result = attendanceService.checkOut(member);
        checkoutNotificationService.notifyApprover(member, result);
        if (result.shopClosed()) {
            shopAnnouncementService.announceClosed(member.displayName());
        }
        return result;
    }

    /**
     * Check out if the member is present, otherwise check in.
     */
    public Toggle toggle(Member member) {
        if (attendanceService.isCheckedIn(member)) {
            return new Toggle(null, checkOut(member));
        }
        return new Toggle(checkIn(member), null);
    }

    public record Toggle(CheckInResult checkIn, CheckOutResult checkOut) {

        public boolean isCheckIn() {
            return checkIn != null;
        }
    }
}
