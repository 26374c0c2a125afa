package com.shopmate.backend.modules.notification.application;

import java.time.Duration;
import java.time.format.DateTimeFormatter;

import com.shopmate.backend.modules.attendance.application.PresenceReconciler.ReconciliationReport;
import com.shopmate.backend.modules.attendance.application.PresenceReconciler.StaleSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Messages for the shop administrator.
 */
@Service
public class OperatorAlertService {

    private static final Logger log = LoggerFactory.getLogger(OperatorAlertService.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final NotificationDispatcher notificationDispatcher;
    private final String adminHandle;

    public OperatorAlertService(
            NotificationDispatcher notificationDispatcher,
            @Value("${shopmate.admin-handle:}") String adminHandle
    ) {
        this.notificationDispatcher = notificationDispatcher;
        this.adminHandle = adminHandle;
    }

    public void reportRecovery(ReconciliationReport report) {
        if (report.isEmpty()) {
            return;
        }
        if (!report.recovered().isEmpty()) {
            alert("Restarted with members still checked in: " + String.join(", ", report.recoveredNames()));
        }
        if (!report.stale().isEmpty()) {
            StringBuilder text = new StringBuilder("Stale open sessions need manual review:");
            for (StaleSession stale : report.stale()) {
                text.append("\n- ")
                        .append(stale.memberName())
                        .append(" checked in ")
                        .append(TIME_FORMAT.format(stale.checkIn()))
                        .append(" (")
                        .append(formatAge(stale.age()))
                        .append(" ago)");
            }
            alert(text.toString());
        }
    }

    public void alert(String text) {
        if (adminHandle == null || adminHandle.isBlank()) {
            log.warn("[ALERT][Operator] no admin handle configured: {}", text);
            return;
        }
        notificationDispatcher.post(adminHandle, text);
    }

    static String formatAge(Duration age) {
        long hours = age.toHours();
        long minutes = age.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
