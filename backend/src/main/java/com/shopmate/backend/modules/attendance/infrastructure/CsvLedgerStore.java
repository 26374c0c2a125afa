package com.shopmate.backend.modules.attendance.infrastructure;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.shopmate.backend.modules.attendance.domain.AttendanceSession;
import com.shopmate.backend.modules.attendance.infrastructure.LedgerRowCodec.MalformedRowException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Ledger kept as a CSV file. Writes go to a scratch file in the same directory, are
 * forced to disk, and then moved over the ledger in one rename, so a reader only ever sees
 * a complete table.
 *
 * <p>Rows that fail validation are quarantined: appended verbatim to
 * {@code <ledger>.rejected.csv} and dropped from the ledger in the same read.
 */
@Component
public class CsvLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(CsvLedgerStore.class);

    private static final String HEADER_LINE = String.join(",", LedgerCsvRow.COLUMNS) + "\n";
    private static final String REJECTED_SUFFIX = ".rejected.csv";

    private final Path ledgerFile;
    private final Path rejectedFile;
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();
    private final CsvSchema rowSchema = csvMapper.schemaFor(LedgerCsvRow.class).withoutHeader();

    public CsvLedgerStore(@Value("${shopmate.attendance.ledger-path:attendance.csv}") Path ledgerFile) {
        this.ledgerFile = ledgerFile.toAbsolutePath();
        this.rejectedFile = this.ledgerFile.resolveSibling(stripExtension(this.ledgerFile.getFileName().toString()) + REJECTED_SUFFIX);
    }

    public Path getLedgerFile() {
        return ledgerFile;
    }

    public Path getRejectedFile() {
        return rejectedFile;
    }

    @Override
    public synchronized List<AttendanceSession> read() {
        ensureInitialized();

        List<AttendanceSession> sessions = new ArrayList<>();
        List<LedgerCsvRow> rejected = new ArrayList<>();
        try (MappingIterator<LedgerCsvRow> rows = csvMapper.readerFor(LedgerCsvRow.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(ledgerFile.toFile())) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                LedgerCsvRow row = rows.next();
                try {
                    sessions.add(LedgerRowCodec.decode(row));
                } catch (MalformedRowException ex) {
                    log.warn("Quarantining ledger line {} of {}: {}", line, ledgerFile, ex.getMessage());
                    rejected.add(row);
                }
            }
        } catch (IOException | RuntimeException ex) {
            throw new LedgerStoreException("Failed to read ledger " + ledgerFile, ex);
        }

        if (!rejected.isEmpty()) {
            quarantine(rejected, sessions);
        }
        return List.copyOf(sessions);
    }

    @Override
    public synchronized void write(List<AttendanceSession> sessions) {
        List<LedgerCsvRow> rows = sessions.stream().map(LedgerRowCodec::encode).toList();
        byte[] content;
        try {
            content = (HEADER_LINE + csvMapper.writer(rowSchema).writeValueAsString(rows))
                    .getBytes(StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LedgerStoreException("Failed to encode ledger rows", ex);
        }
        replaceAtomically(content);
    }

    private void ensureInitialized() {
        if (Files.exists(ledgerFile)) {
            return;
        }
        try {
            Path parent = ledgerFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new LedgerStoreException("Failed to create ledger directory for " + ledgerFile, ex);
        }
        log.info("Creating empty attendance ledger {}", ledgerFile);
        replaceAtomically(HEADER_LINE.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Copies rejected rows aside and rewrites the ledger without them. A failure here is
     * logged and never fails the read: the malformed rows stay in the ledger file until a
     * later read manages to move them.
     */
    private void quarantine(List<LedgerCsvRow> rejected, List<AttendanceSession> kept) {
        String rejectedRows;
        try {
            rejectedRows = csvMapper.writer(rowSchema).writeValueAsString(rejected);
        } catch (IOException ex) {
            log.error("Failed to encode {} malformed ledger rows; leaving them in {}", rejected.size(), ledgerFile, ex);
            return;
        }
        try {
            String text = Files.exists(rejectedFile) ? rejectedRows : HEADER_LINE + rejectedRows;
            Files.writeString(
                    rejectedFile,
                    text,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            );
        } catch (IOException ex) {
            log.error("Failed to quarantine {} ledger rows to {}; leaving them in {}:\n{}",
                    rejected.size(), rejectedFile, ledgerFile, rejectedRows, ex);
            return;
        }
        try {
            write(kept);
        } catch (LedgerStoreException ex) {
            log.error("Copied {} malformed rows to {} but could not drop them from {}",
                    rejected.size(), rejectedFile, ledgerFile, ex);
            return;
        }
        log.warn("Moved {} malformed ledger rows to {}", rejected.size(), rejectedFile);
    }

    private void replaceAtomically(byte[] content) {
        Path directory = ledgerFile.getParent();
        Path scratch;
        try {
            scratch = Files.createTempFile(directory, "." + ledgerFile.getFileName(), ".tmp");
        } catch (IOException ex) {
            throw new LedgerStoreException("Failed to create scratch file next to " + ledgerFile, ex);
        }
        try {
            try (FileChannel channel = FileChannel.open(scratch, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(scratch);
        } catch (IOException | RuntimeException ex) {
            discardScratch(scratch);
            throw new LedgerStoreException("Failed to commit ledger " + ledgerFile, ex);
        }
    }

    private void moveIntoPlace(Path scratch) throws IOException {
        try {
            Files.move(scratch, ledgerFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("File system does not support atomic moves for {}; falling back to replace", ledgerFile);
            Files.move(scratch, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discardScratch(Path scratch) {
        try {
            Files.deleteIfExists(scratch);
        } catch (IOException ex) {
            log.warn("Failed to delete scratch file {}", scratch, ex);
        }
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
