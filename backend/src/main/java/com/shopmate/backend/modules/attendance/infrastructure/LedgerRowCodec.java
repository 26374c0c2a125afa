package com.shopmate.backend.modules.attendance.infrastructure;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.shopmate.backend.modules.attendance.domain.ApprovalState;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.attendance.domain.SessionDurations;

/**
 * Validated conversion between ledger text and {@link AttendanceSession}.
 * Timestamps are written at second precision; reading also accepts fractional seconds
 * and a space instead of the {@code T} separator, as older ledgers contain both.
 */
final class LedgerRowCodec {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private LedgerRowCodec() {
    }

    static AttendanceSession decode(LedgerCsvRow row) throws MalformedRowException {
        if (isBlank(row.memberName())) {
            throw new MalformedRowException("member_name is empty");
        }
        LocalDateTime checkIn = parseTimestamp("check_in", row.checkIn());
        if (checkIn == null) {
            throw new MalformedRowException("check_in is empty");
        }
        LocalDateTime checkOut = parseTimestamp("check_out", row.checkOut());
        BigDecimal hours = parseHours(row.hours());
        ApprovalState approval;
        try {
            approval = ApprovalState.fromFlag(row.approved());
        } catch (IllegalArgumentException ex) {
            throw new MalformedRowException(ex.getMessage());
        }
        return new AttendanceSession(row.cardUid(), row.memberName().trim(), checkIn, checkOut, hours, approval);
    }

    static LedgerCsvRow encode(AttendanceSession session) {
        return new LedgerCsvRow(
                session.cardUid(),
                session.memberName(),
                TIMESTAMP_FORMAT.format(session.checkIn()),
                session.checkOut() == null ? "" : TIMESTAMP_FORMAT.format(session.checkOut()),
                session.hours().toPlainString(),
                session.approval().toFlag()
        );
    }

    private static LocalDateTime parseTimestamp(String column, String raw) throws MalformedRowException {
        if (isBlank(raw)) {
            return null;
        }
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException ex) {
            throw new MalformedRowException(column + " is not a timestamp: '" + raw + "'");
        }
    }

    private static BigDecimal parseHours(String raw) throws MalformedRowException {
        if (isBlank(raw)) {
            return SessionDurations.ZERO_HOURS;
        }
        try {
            BigDecimal hours = new BigDecimal(raw.trim());
            if (hours.signum() < 0) {
                throw new MalformedRowException("hours is negative: '" + raw + "'");
            }
            return hours;
        } catch (NumberFormatException ex) {
            throw new MalformedRowException("hours is not a number: '" + raw + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static final class MalformedRowException extends Exception {

        MalformedRowException(String message) {
            super(message);
        }
    }
}
