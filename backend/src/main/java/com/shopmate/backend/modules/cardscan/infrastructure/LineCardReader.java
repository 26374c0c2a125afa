package com.shopmate.backend.modules.cardscan.infrastructure;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads one card identifier per line from a device node, FIFO or plain file, as written
 * by a reader bridge process.
 */
public class LineCardReader implements CardReader, Closeable {

    private final Path device;
    private BufferedReader reader;

    public LineCardReader(Path device) {
        this.device = device;
    }

    @Override
    public synchronized Optional<String> poll() {
        try {
            if (reader == null) {
                reader = Files.newBufferedReader(device, StandardCharsets.UTF_8);
            }
            while (reader.ready()) {
                String line = reader.readLine();
                if (line == null) {
                    return Optional.empty();
                }
                if (!line.isBlank()) {
                    return Optional.of(line.trim());
                }
            }
            return Optional.empty();
        } catch (IOException ex) {
            closeQuietly();
            throw new UncheckedIOException("Failed to read card reader " + device, ex);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException suppressed) {
            reader = null;
        }
    }
}
