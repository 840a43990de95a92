package com.poisearch.index;

import com.poisearch.config.PoiSearchProperties;
import com.poisearch.exception.IndexBuildException;
import com.poisearch.model.PointOfInterest;
import com.poisearch.model.SearchCriteria;
import com.poisearch.model.result.IndexStats;
import com.poisearch.repository.PoiRemoval;
import com.poisearch.repository.PoiStore;
import com.poisearch.repository.ScanPosition;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Spatial-categorical index over the points of one store, refreshed incrementally.
 * <p>
 * The index is built on the first search. Afterwards a search arriving once the
 * staleness window has elapsed catches up with the store by scanning records saved
 * after the high-water mark and tombstones left after the removal mark, merging
 * both into a new snapshot.
 * <p>
 * Builds and refreshes are serialized by one lock. Searches read the published
 * snapshot through a volatile reference, so they never see a partial merge and are
 * never blocked by a refresh; only searches arriving before the first snapshot
 * exists wait for it.
 */
public class PoiIndex {

    private static final Logger logger = LoggerFactory.getLogger(PoiIndex.class);

    private final String name;
    private final PoiStore store;
    private final Clock clock;
    private final int batchSize;
    private final long stalenessMillis;
    private final long refreshOverlapMillis;
    private final long buildTimeoutMillis;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicLong refreshCount = new AtomicLong();
    private final AtomicLong failedRefreshCount = new AtomicLong();

    private volatile IndexSnapshot snapshot;
    private volatile Instant lastRefreshed;

    public PoiIndex(PoiStore store, PoiSearchProperties.Index settings, Clock clock) {
        if (settings.getBatchSize() < 1) {
            throw new IllegalArgumentException("Index batch size must be positive: " + settings.getBatchSize());
        }
        this.name = settings.getName();
        this.store = store;
        this.clock = clock;
        this.batchSize = settings.getBatchSize();
        this.stalenessMillis = TimeUnit.SECONDS.toMillis(settings.getStalenessSeconds());
        this.refreshOverlapMillis = settings.getRefreshOverlapMillis();
        this.buildTimeoutMillis = TimeUnit.SECONDS.toMillis(settings.getBuildTimeoutSeconds());
    }

    /**
     * Return up to {@code limit} points matching the criteria, and whether more exist.
     *
     * @throws IndexBuildException if the build or refresh triggered by this call fails
     */
    public IndexSearchResult search(SearchCriteria criteria, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Search limit must be at least 1: " + limit);
        }
        return currentSnapshot().search(criteria, limit);
    }

    /**
     * Snapshot to serve now, building or refreshing it first when due
     */
    IndexSnapshot currentSnapshot() {
        IndexSnapshot current = snapshot;
        if (current == null) {
            return awaitInitialBuild();
        }
        if (isStale()) {
            return tryRefresh(current);
        }
        return current;
    }

    public boolean isBuilt() {
        return snapshot != null;
    }

    public boolean isStale() {
        Instant last = lastRefreshed;
        return last == null || !clock.instant().isBefore(last.plusMillis(stalenessMillis));
    }

    /**
     * Whether a build or refresh is running right now
     */
    public boolean isRefreshing() {
        return refreshLock.isLocked();
    }

    /**
     * Wait for a build or refresh in progress to finish
     *
     * @return false if it is still running after the build timeout
     */
    boolean awaitIdle() {
        try {
            if (!refreshLock.tryLock(buildTimeoutMillis, TimeUnit.MILLISECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        refreshLock.unlock();
        return true;
    }

    public String getName() {
        return name;
    }

    public String getStoreName() {
        return store.getName();
    }

    public IndexStats stats() {
        IndexSnapshot current = snapshot;
        IndexStats.IndexStatsBuilder stats = IndexStats.builder()
                .name(name)
                .store(store.getName())
                .built(current != null)
                .refreshing(isRefreshing())
                .lastRefreshed(lastRefreshed)
                .refreshCount(refreshCount.get())
                .failedRefreshCount(failedRefreshCount.get());
        if (current != null) {
            stats.size(current.size())
                 .highWaterMark(current.getHighWaterMark().isOrigin() ? null : current.getHighWaterMark().getLastModified())
                 .removalMark(current.getRemovalMark().isOrigin() ? null : current.getRemovalMark().getLastModified());
        }
        return stats.build();
    }

    private IndexSnapshot awaitInitialBuild() {
        acquireForBuild();
        try {
            IndexSnapshot current = snapshot;
            if (current != null) {
                // Built by another caller while this one waited
                return current;
            }
            return build();
        } finally {
            refreshLock.unlock();
        }
    }

    private void acquireForBuild() {
        try {
            if (!refreshLock.tryLock(buildTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new IndexBuildException(
                        "Timed out after " + buildTimeoutMillis + "ms waiting for index '" + name + "' to be built", true);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexBuildException("Interrupted while waiting for index '" + name + "' to be built", true, e);
        }
    }

    private IndexSnapshot tryRefresh(IndexSnapshot current) {
        if (!refreshLock.tryLock()) {
            logger.debug("Index '{}' is being refreshed by another caller, serving current snapshot", name);
            return current;
        }
        try {
            IndexSnapshot latest = snapshot;
            if (!isStale()) {
                return latest;
            }
            return refresh(latest);
        } finally {
            refreshLock.unlock();
        }
    }

    private IndexSnapshot build() {
        logger.info("Building index '{}' from store '{}' in batches of {}", name, store.getName(), batchSize);
        long startTime = System.currentTimeMillis();

        try {
            // Read the removal mark first: removals committed while scanning are replayed by the next refresh
            ScanPosition removalMark = store.latestRemovalPosition();
            Map<Long, IndexedPoi> entries = new HashMap<>();
            ScanPosition highWaterMark = ScanPosition.ORIGIN;

            try (Stream<PointOfInterest> scan = store.scanSince(ScanPosition.ORIGIN, batchSize)) {
                Iterator<PointOfInterest> records = scan.iterator();
                while (records.hasNext()) {
                    PointOfInterest poi = records.next();
                    entries.put(poi.getId(), IndexedPoi.from(poi));
                    highWaterMark = highWaterMark.max(ScanPosition.of(poi));
                }
            }

            IndexSnapshot built = IndexSnapshot.of(entries, highWaterMark, removalMark, clock.instant());
            publish(built);

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Built index '{}' with {} points in {}ms", name, built.size(), duration);
            return built;
        } catch (RuntimeException e) {
            throw failure("build", e);
        }
    }

    private IndexSnapshot refresh(IndexSnapshot current) {
        long startTime = System.currentTimeMillis();

        try {
            Map<Long, IndexedPoi> upserts = new HashMap<>();
            ScanPosition highWaterMark = current.getHighWaterMark();
            try (Stream<PointOfInterest> scan = store.scanSince(highWaterMark.rewind(refreshOverlapMillis), batchSize)) {
                Iterator<PointOfInterest> records = scan.iterator();
                while (records.hasNext()) {
                    PointOfInterest poi = records.next();
                    upserts.put(poi.getId(), IndexedPoi.from(poi));
                    highWaterMark = highWaterMark.max(ScanPosition.of(poi));
                }
            }

            Set<Long> removals = new HashSet<>();
            ScanPosition removalMark = current.getRemovalMark();
            try (Stream<PoiRemoval> scan = store.scanRemovalsSince(removalMark.rewind(refreshOverlapMillis), batchSize)) {
                Iterator<PoiRemoval> tombstones = scan.iterator();
                while (tombstones.hasNext()) {
                    PoiRemoval removal = tombstones.next();
                    removals.add(removal.getPoiId());
                    removalMark = removalMark.max(removal.position());
                }
            }

            IndexSnapshot next = current.merge(upserts.values(), removals, highWaterMark, removalMark, clock.instant());
            publish(next);

            long duration = System.currentTimeMillis() - startTime;
            if (next.getTree() != current.getTree()) {
                logger.info("Refreshed index '{}' in {}ms: {} scanned, {} tombstones, {} points",
                        name, duration, upserts.size(), removals.size(), next.size());
            } else {
                logger.debug("Refreshed index '{}' in {}ms: no changes", name, duration);
            }
            return next;
        } catch (RuntimeException e) {
            throw failure("refresh", e);
        }
    }

    private void publish(IndexSnapshot next) {
        snapshot = next;
        lastRefreshed = clock.instant();
        refreshCount.incrementAndGet();
    }

    private IndexBuildException failure(String phase, RuntimeException cause) {
        failedRefreshCount.incrementAndGet();
        boolean retryable = cause instanceof TransientDataAccessException
                || cause instanceof DataAccessResourceFailureException;
        logger.error("Index '{}' {} from store '{}' failed, keeping previous snapshot", name, phase, store.getName(), cause);
        return new IndexBuildException("Index '" + name + "' " + phase + " failed: " + cause.getMessage(), retryable, cause);
    }
}
