package com.poisearch.index;

import com.poisearch.model.SearchCriteria;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable balanced k-d tree over (latitude, longitude, category).
 * <p>
 * The tree is stored implicitly in an array: the node of the sub-range [lo, hi) is
 * the element at its midpoint, split on dimension {@code depth % 3}. Every element
 * left of the midpoint has a key lower than or equal to the split key, every element
 * right of it a key greater than or equal to it.
 */
public final class KdTree {

    private static final int DIMENSIONS = 3;

    private static final List<Comparator<IndexedPoi>> BY_DIMENSION = List.of(
            Comparator.comparingDouble(IndexedPoi::getLatitude),
            Comparator.comparingDouble(IndexedPoi::getLongitude),
            Comparator.comparingInt((IndexedPoi p) -> p.getCategory().getCode()));

    static final KdTree EMPTY = new KdTree(new IndexedPoi[0]);

    private final IndexedPoi[] nodes;

    private KdTree(IndexedPoi[] nodes) {
        this.nodes = nodes;
    }

    public static KdTree build(Collection<IndexedPoi> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        IndexedPoi[] nodes = points.toArray(new IndexedPoi[0]);
        partition(nodes, 0, nodes.length, 0);
        return new KdTree(nodes);
    }

    private static void partition(IndexedPoi[] nodes, int lo, int hi, int depth) {
        if (hi - lo <= 1) {
            return;
        }
        Arrays.sort(nodes, lo, hi, BY_DIMENSION.get(depth % DIMENSIONS));
        int mid = (lo + hi) >>> 1;
        partition(nodes, lo, mid, depth + 1);
        partition(nodes, mid + 1, hi, depth + 1);
    }

    public int size() {
        return nodes.length;
    }

    /**
     * Collect points matching all three criteria into {@code out}, stopping as soon as
     * it holds {@code max} elements. Order is unspecified.
     *
     * @return number of points added
     */
    public int search(SearchCriteria criteria, int max, List<IndexedPoi> out) {
        if (max < 1 || nodes.length == 0) {
            return 0;
        }
        double category = criteria.getCategory().getCode();
        double[] low = {criteria.getLatitude().getMin(), criteria.getLongitude().getMin(), category};
        double[] high = {criteria.getLatitude().getMax(), criteria.getLongitude().getMax(), category};
        int before = out.size();
        long capacity = (long) before + max;
        search(0, nodes.length, 0, criteria, low, high, capacity, out);
        return out.size() - before;
    }

    /**
     * @return true once {@code out} is full
     */
    private boolean search(int lo, int hi, int depth, SearchCriteria criteria, double[] low, double[] high,
                           long capacity, List<IndexedPoi> out) {
        if (lo >= hi) {
            return false;
        }
        int mid = (lo + hi) >>> 1;
        int dimension = depth % DIMENSIONS;
        IndexedPoi node = nodes[mid];
        double split = node.key(dimension);

        if (low[dimension] <= split && search(lo, mid, depth + 1, criteria, low, high, capacity, out)) {
            return true;
        }
        if (criteria.matches(node.getLatitude(), node.getLongitude(), node.getCategory())) {
            out.add(node);
            if (out.size() >= capacity) {
                return true;
            }
        }
        return high[dimension] >= split && search(mid + 1, hi, depth + 1, criteria, low, high, capacity, out);
    }
}
