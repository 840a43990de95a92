package com.poisearch.repository;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy iterator over a keyset-paginated query.
 * <p>
 * Each page is fetched with the key of the last element of the previous page and
 * must return elements strictly after it, in key order. Iteration ends on the first
 * page shorter than the batch size. No connection is held between pages.
 *
 * @param <K> cursor key type
 * @param <T> element type
 */
public class KeysetCursor<K, T> implements Iterator<T> {

    private final BiFunction<K, Integer, List<T>> pageFetcher;
    private final Function<T, K> keyExtractor;
    private final int batchSize;

    private K key;
    private List<T> page = Collections.emptyList();
    private int offset;
    private boolean exhausted;

    public KeysetCursor(K start, int batchSize,
                        BiFunction<K, Integer, List<T>> pageFetcher,
                        Function<T, K> keyExtractor) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.key = start;
        this.batchSize = batchSize;
        this.pageFetcher = pageFetcher;
        this.keyExtractor = keyExtractor;
    }

    public static <K, T> Stream<T> stream(K start, int batchSize,
                                          BiFunction<K, Integer, List<T>> pageFetcher,
                                          Function<T, K> keyExtractor) {
        KeysetCursor<K, T> cursor = new KeysetCursor<>(start, batchSize, pageFetcher, keyExtractor);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public boolean hasNext() {
        if (offset < page.size()) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        page = pageFetcher.apply(key, batchSize);
        offset = 0;
        if (page.size() < batchSize) {
            exhausted = true;
        }
        if (!page.isEmpty()) {
            key = keyExtractor.apply(page.get(page.size() - 1));
        }
        return !page.isEmpty();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.get(offset++);
    }
}
