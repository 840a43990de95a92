package com.poisearch.repository;

import com.poisearch.model.Category;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.Position;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistent store of points of interest.
 * <p>
 * Mutations join the caller's transaction when there is one; their effects become
 * visible to other readers only once it commits.
 */
public interface PoiStore {

    /**
     * Logical name of the store; the process keeps one index per name
     */
    String getName();

    /**
     * Persist a new point of interest, assigning its identifier and last save timestamp
     */
    PointOfInterest create(String name, Position position, Category category);

    /**
     * Look up a point of interest by identifier
     */
    Optional<PointOfInterest> get(long id);

    /**
     * Remove a point of interest and leave a tombstone for index refreshes
     *
     * @return false if no such point exists
     */
    boolean markForRemoval(long id);

    /**
     * Lazily scan records strictly after {@code from}, ordered by (lastModified, id),
     * fetching {@code batchSize} records per round trip.
     * <p>
     * Rows that violate entity invariants surface as
     * {@link com.poisearch.exception.MalformedRecordException} while iterating.
     */
    Stream<PointOfInterest> scanSince(ScanPosition from, int batchSize);

    /**
     * Position of the latest tombstone, {@link ScanPosition#ORIGIN} when nothing was ever removed
     */
    ScanPosition latestRemovalPosition();

    /**
     * Lazily scan tombstones strictly after {@code from}, ordered by (removedAt, sequence)
     */
    Stream<PoiRemoval> scanRemovalsSince(ScanPosition from, int batchSize);
}
