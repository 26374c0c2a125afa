package com.shopmate.backend.modules.attendance.application;

import com.shopmate.backend.modules.attendance.application.PresenceReconciler.ReconciliationReport;
import com.shopmate.backend.modules.notification.application.OperatorAlertService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Restores live presence once every bean exists, which is before the web server and the
 * card reader poller start taking commands.
 */
@Component
public class PresenceRecoveryInitializer implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(PresenceRecoveryInitializer.class);

    private final AttendanceService attendanceService;
    private final OperatorAlertService operatorAlertService;

    public PresenceRecoveryInitializer(AttendanceService attendanceService, OperatorAlertService operatorAlertService) {
        this.attendanceService = attendanceService;
        this.operatorAlertService = operatorAlertService;
    }

    @Override
    public void afterSingletonsInstantiated() {
        ReconciliationReport report = attendanceService.recoverPresence();
        log.info("Presence recovered: {} present, {} stale open sessions",
                report.recovered().size(), report.stale().size());
        report.stale().forEach(stale -> log.warn("Stale open session for {} since {} ({} old); left for manual review",
                stale.memberName(), stale.checkIn(), stale.age()));
        operatorAlertService.reportRecovery(report);
    }
}
