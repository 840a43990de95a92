package com.poisearch.repository;

import com.poisearch.model.PointOfInterest;
import lombok.Value;

import java.util.Comparator;

/**
 * Position of a cursor over the (lastModified, id) ordering of stored points.
 * A scan from a position returns only records strictly after it.
 */
@Value
public class ScanPosition implements Comparable<ScanPosition> {

    /**
     * Before every record
     */
    public static final ScanPosition ORIGIN = new ScanPosition(Long.MIN_VALUE, Long.MIN_VALUE);

    private static final Comparator<ScanPosition> ORDER = Comparator
            .comparingLong(ScanPosition::getLastModified)
            .thenComparingLong(ScanPosition::getId);

    long lastModified;
    long id;

    public static ScanPosition of(PointOfInterest poi) {
        return new ScanPosition(poi.getLastModified(), poi.getId());
    }

    public boolean isOrigin() {
        return ORIGIN.equals(this);
    }

    /**
     * Later of this position and the given one
     */
    public ScanPosition max(ScanPosition other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * Position preceding every record saved within {@code millis} before this one
     */
    public ScanPosition rewind(long millis) {
        if (millis <= 0 || isOrigin()) {
            return this;
        }
        return new ScanPosition(lastModified - millis, Long.MIN_VALUE);
    }

    @Override
    public int compareTo(ScanPosition other) {
        return ORDER.compare(this, other);
    }
}
