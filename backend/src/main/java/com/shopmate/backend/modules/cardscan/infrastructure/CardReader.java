package com.shopmate.backend.modules.cardscan.infrastructure;

import java.util.Optional;

/**
 * Source of raw card identifiers.
 */
public interface CardReader {

    /**
     * Returns the next scanned identifier without blocking, or empty if none is waiting.
     */
    Optional<String> poll();
}
