package com.poisearch.repository;

import lombok.Value;

/**
 * Tombstone left by a committed removal, ordered like records by (removedAt, sequence)
 */
@Value
public class PoiRemoval {

    long sequence;
    long poiId;
    long removedAt;

    public ScanPosition position() {
        return new ScanPosition(removedAt, sequence);
    }
}
