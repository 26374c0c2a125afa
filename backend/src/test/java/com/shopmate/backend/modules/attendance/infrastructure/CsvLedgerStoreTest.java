package com.shopmate.backend.modules.attendance.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

import com.shopmate.backend.modules.attendance.domain.ApprovalState;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvLedgerStoreTest {

    private static final String HEADER = "card_uid,member_name,check_in,check_out,hours,approved";

    @TempDir
    Path tempDir;

    private Path ledgerFile;
    private CsvLedgerStore store;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("attendance.csv");
        store = new CsvLedgerStore(ledgerFile);
    }

    @Test
    @DisplayName("a missing ledger is created with only the header")
    void firstTouchCreatesHeaderOnlyLedger() throws IOException {
        assertThat(store.read()).isEmpty();

        assertThat(Files.readAllLines(ledgerFile, StandardCharsets.UTF_8)).containsExactly(HEADER);
    }

    @Test
    @DisplayName("missing parent directories are created on first touch")
    void firstTouchCreatesParentDirectories() {
        CsvLedgerStore nested = new CsvLedgerStore(tempDir.resolve("data/ledgers/attendance.csv"));

        assertThat(nested.read()).isEmpty();
        assertThat(Files.exists(tempDir.resolve("data/ledgers/attendance.csv"))).isTrue();
    }

    @Test
    @DisplayName("writing zero sessions leaves a readable, empty ledger")
    void writeEmptyLedger() {
        store.write(List.of());

        assertThat(store.read()).isEmpty();
    }

    @Test
    @DisplayName("one open session survives a write and a read")
    void singleOpenSessionRoundTrip() throws IOException {
        AttendanceSession open = session("a1b2", "Alice", "2025-03-01T09:00:00", null, "0.0", ApprovalState.PENDING);

        store.write(List.of(open));

        assertThat(store.read()).containsExactly(open);
        assertThat(Files.readAllLines(ledgerFile, StandardCharsets.UTF_8))
                .containsExactly(HEADER, "A1B2,Alice,2025-03-01T09:00:00,,0.0,False");
    }

    @Test
    @DisplayName("several sessions keep their order and values")
    void manySessionsRoundTrip() {
        List<AttendanceSession> sessions = List.of(
                session("A1", "Alice", "2025-03-01T09:00:00", "2025-03-01T10:30:00", "1.50", ApprovalState.APPROVED),
                session("B2", "Bob", "2025-03-01T09:15:00", "2025-03-01T12:00:00", "2.75", ApprovalState.PENDING),
                session("", "Carol, Jr.", "2025-03-01T11:00:00", null, "0.0", ApprovalState.PENDING)
        );

        store.write(sessions);

        assertThat(store.read()).containsExactlyElementsOf(sessions);
    }

    @Test
    @DisplayName("append adds the session after the existing ones")
    void appendKeepsInsertionOrder() {
        AttendanceSession first = session("A1", "Alice", "2025-03-01T09:00:00", null, "0.0", ApprovalState.PENDING);
        AttendanceSession second = session("B2", "Bob", "2025-03-01T09:05:00", null, "0.0", ApprovalState.PENDING);

        store.append(first);
        store.append(second);

        assertThat(store.read()).containsExactly(first, second);
    }

    @Test
    @DisplayName("older timestamp and flag spellings are read")
    void readsLegacyFormats() throws IOException {
        Files.writeString(ledgerFile, HEADER + "\n"
                + "a1,Alice,2025-03-01 09:00:00.123456,2025-03-01T10:00:00,1.0,none\n"
                + "b2,Bob,2025-03-01T09:00:00,,,\n"
                + "c3,Carol,2025-03-01T08:00:00,2025-03-01T09:00:00,1.0,TRUE\n", StandardCharsets.UTF_8);

        List<AttendanceSession> sessions = store.read();

        assertThat(sessions).hasSize(3);
        assertThat(sessions.get(0).checkIn()).isEqualTo(LocalDateTime.parse("2025-03-01T09:00:00"));
        assertThat(sessions.get(0).approval()).isEqualTo(ApprovalState.PENDING);
        assertThat(sessions.get(1).isOpen()).isTrue();
        assertThat(sessions.get(1).hours()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(sessions.get(2).approval()).isEqualTo(ApprovalState.APPROVED);
    }

    @Test
    @DisplayName("malformed rows are moved to the rejected file and dropped from the ledger")
    void quarantinesMalformedRows() throws IOException {
        Files.writeString(ledgerFile, HEADER + "\n"
                + "A1,Alice,2025-03-01T09:00:00,2025-03-01T10:00:00,1.0,False\n"
                + "B2,Bob,yesterday,,0.0,False\n"
                + "C3,,2025-03-01T09:00:00,,0.0,False\n"
                + "D4,Dana,2025-03-01T09:00:00,,abc,False\n"
                + "E5,Evan,2025-03-01T11:00:00,,0.0,maybe\n"
                + "F6,Finn,2025-03-01T12:00:00,,0.0,False\n", StandardCharsets.UTF_8);

        List<AttendanceSession> sessions = store.read();

        assertThat(sessions).extracting(AttendanceSession::memberName).containsExactly("Alice", "Finn");
        assertThat(store.getRejectedFile()).isEqualTo(tempDir.resolve("attendance.rejected.csv"));
        List<String> rejected = Files.readAllLines(store.getRejectedFile(), StandardCharsets.UTF_8);
        assertThat(rejected).hasSize(5);
        assertThat(rejected.get(0)).isEqualTo(HEADER);
        assertThat(rejected.get(1)).startsWith("B2,Bob,yesterday");

        // second read sees a clean ledger and quarantines nothing more
        assertThat(store.read()).hasSize(2);
        assertThat(Files.readAllLines(store.getRejectedFile(), StandardCharsets.UTF_8)).hasSize(5);
        assertThat(Files.readAllLines(ledgerFile, StandardCharsets.UTF_8)).hasSize(3);
    }

    @Test
    @DisplayName("an unwritable rejected file still returns the valid rows and keeps the bad ones")
    void quarantineFailureDoesNotFailRead() throws IOException {
        String ledger = HEADER + "\n"
                + "A1,Alice,2025-03-01T09:00:00,2025-03-01T10:00:00,1.0,False\n"
                + "B2,Bob,not-a-time,,0.0,False\n";
        Files.writeString(ledgerFile, ledger, StandardCharsets.UTF_8);
        Files.createDirectories(store.getRejectedFile());

        List<AttendanceSession> sessions = store.read();

        assertThat(sessions).extracting(AttendanceSession::memberName).containsExactly("Alice");
        assertThat(Files.readString(ledgerFile, StandardCharsets.UTF_8)).isEqualTo(ledger);
        assertThat(Files.isDirectory(store.getRejectedFile())).isTrue();
        assertThat(store.read()).hasSize(1);
    }

    @Test
    @DisplayName("extra trailing columns are ignored")
    void ignoresExtraColumns() throws IOException {
        Files.writeString(ledgerFile, HEADER + ",note\n"
                + "A1,Alice,2025-03-01T09:00:00,,0.0,False,left early\n", StandardCharsets.UTF_8);

        assertThat(store.read()).extracting(AttendanceSession::memberName).containsExactly("Alice");
    }

    @Test
    @DisplayName("a failed commit leaves the target untouched and removes the scratch file")
    void failedCommitCleansUp() throws IOException {
        Path blocked = tempDir.resolve("blocked.csv");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep.txt"), "keep");
        CsvLedgerStore blockedStore = new CsvLedgerStore(blocked);

        assertThatThrownBy(() -> blockedStore.write(List.of(
                session("A1", "Alice", "2025-03-01T09:00:00", null, "0.0", ApprovalState.PENDING))))
                .isInstanceOf(LedgerStoreException.class);

        assertThat(Files.readString(blocked.resolve("keep.txt"))).isEqualTo("keep");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    @DisplayName("a rewrite replaces the previous contents entirely")
    void writeReplacesContents() {
        store.write(List.of(
                session("A1", "Alice", "2025-03-01T09:00:00", null, "0.0", ApprovalState.PENDING),
                session("B2", "Bob", "2025-03-01T09:00:00", null, "0.0", ApprovalState.PENDING)));
        AttendanceSession only = session("C3", "Carol", "2025-03-02T09:00:00", null, "0.0", ApprovalState.PENDING);

        store.write(List.of(only));

        assertThat(store.read()).containsExactly(only);
    }

    private static AttendanceSession session(
            String uid,
            String name,
            String checkIn,
            String checkOut,
            String hours,
            ApprovalState approval
    ) {
        return new AttendanceSession(
                uid,
                name,
                LocalDateTime.parse(checkIn),
                checkOut == null ? null : LocalDateTime.parse(checkOut),
                new BigDecimal(hours),
                approval
        );
    }
}
