package com.shopmate.backend.modules.attendance.infrastructure;

import java.util.ArrayList;
import java.util.List;

import com.shopmate.backend.modules.attendance.domain.AttendanceSession;

/**
 * Durable, ordered table of attendance sessions. Insertion order is significant: "most
 * recent" always means the highest position.
 *
 * <p>Every mutation replaces the whole table atomically; a failed {@link #write} or
 * {@link #append} leaves the previously committed contents readable and unchanged.
 * Callers that read, modify and write back must hold the {@link LedgerLock}.
 */
public interface LedgerStore {

    /**
     * @return the sessions of the last committed write, in ledger order
     * @throws LedgerStoreException if the ledger cannot be read
     */
    List<AttendanceSession> read();

    /**
     * Replaces the entire ledger.
     *
     * @throws LedgerStoreException if the new contents could not be committed
     */
    void write(List<AttendanceSession> sessions);

    /**
     * Adds one session at the end of the ledger, with the same guarantees as {@link #write}.
     */
    default void append(AttendanceSession session) {
        List<AttendanceSession> sessions = new ArrayList<>(read());
        sessions.add(session);
        write(sessions);
    }
}
