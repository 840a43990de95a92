package com.poisearch.index;

import com.poisearch.model.SearchCriteria;
import com.poisearch.repository.ScanPosition;
import lombok.Getter;
import org.locationtech.jts.geom.Envelope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, queryable view of the indexed points.
 * <p>
 * Snapshots are never modified once published; a refresh produces a new one. The
 * high-water mark is the (lastModified, id) of the most recent ingested record and
 * the removal mark that of the most recent applied tombstone.
 */
@Getter
public final class IndexSnapshot {

    private final Map<Long, IndexedPoi> entries;
    private final KdTree tree;
    private final Envelope bounds;
    private final ScanPosition highWaterMark;
    private final ScanPosition removalMark;
    private final Instant builtAt;

    private IndexSnapshot(Map<Long, IndexedPoi> entries, KdTree tree, Envelope bounds,
                          ScanPosition highWaterMark, ScanPosition removalMark, Instant builtAt) {
        this.entries = entries;
        this.tree = tree;
        this.bounds = bounds;
        this.highWaterMark = highWaterMark;
        this.removalMark = removalMark;
        this.builtAt = builtAt;
    }

    /**
     * Build a snapshot owning a private copy of {@code entries}
     */
    public static IndexSnapshot of(Map<Long, IndexedPoi> entries, ScanPosition highWaterMark,
                                   ScanPosition removalMark, Instant builtAt) {
        Map<Long, IndexedPoi> owned = Collections.unmodifiableMap(new HashMap<>(entries));
        Envelope bounds = new Envelope();
        for (IndexedPoi poi : owned.values()) {
            bounds.expandToInclude(poi.getLongitude(), poi.getLatitude());
        }
        return new IndexSnapshot(owned, KdTree.build(owned.values()), bounds,
                highWaterMark, removalMark, builtAt);
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(long id) {
        return entries.containsKey(id);
    }

    /**
     * Probe for {@code limit + 1} matches so that "exactly limit" and "more than limit"
     * are told apart in one pass. With {@code Integer.MAX_VALUE} as limit the probe
     * stays at that value, which no snapshot can exceed.
     */
    public IndexSearchResult search(SearchCriteria criteria, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Search limit must be at least 1: " + limit);
        }
        if (!bounds.intersects(criteria.toEnvelope())) {
            return new IndexSearchResult(Collections.emptyList(), false);
        }
        int probe = limit == Integer.MAX_VALUE ? limit : limit + 1;
        List<IndexedPoi> found = new ArrayList<>(Math.min(probe, tree.size()));
        tree.search(criteria, probe, found);
        if (found.size() > limit) {
            return new IndexSearchResult(Collections.unmodifiableList(found.subList(0, limit)), true);
        }
        return new IndexSearchResult(Collections.unmodifiableList(found), false);
    }

    /**
     * Apply upserts, then removals, on top of this snapshot.
     * When neither changes any entry the tree is shared with the result.
     */
    public IndexSnapshot merge(Collection<IndexedPoi> upserts, Collection<Long> removals,
                               ScanPosition newHighWaterMark, ScanPosition newRemovalMark, Instant now) {
        Map<Long, IndexedPoi> next = null;
        for (IndexedPoi poi : upserts) {
            if (!poi.equals(entries.get(poi.getId()))) {
                if (next == null) {
                    next = new HashMap<>(entries);
                }
                next.put(poi.getId(), poi);
            }
        }
        for (Long id : removals) {
            Map<Long, IndexedPoi> current = next != null ? next : entries;
            if (current.containsKey(id)) {
                if (next == null) {
                    next = new HashMap<>(entries);
                }
                next.remove(id);
            }
        }
        ScanPosition highWater = highWaterMark.max(newHighWaterMark);
        ScanPosition removal = removalMark.max(newRemovalMark);
        if (next == null) {
            return new IndexSnapshot(entries, tree, bounds, highWater, removal, now);
        }
        return of(next, highWater, removal, now);
    }
}
