package com.poisearch.index;

import com.poisearch.config.PoiSearchProperties;
import com.poisearch.repository.PoiStore;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide index of each logical store.
 * <p>
 * An index is created on first acquisition and built on its first search. Dropping it
 * with {@link #reset(String)} makes the next acquisition start from scratch; the drop
 * waits for a build or refresh in progress, so two builds of one store never overlap.
 */
@Slf4j
@Component
public class PoiIndexRegistry {

    private final Map<String, PoiIndex> indexes = new ConcurrentHashMap<>();
    private final PoiSearchProperties properties;
    private final Clock clock;

    public PoiIndexRegistry(PoiSearchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Index of the given store, created if absent. Every caller gets the same instance
     * until the index is reset.
     */
    public PoiIndex acquire(PoiStore store) {
        return indexes.computeIfAbsent(store.getName(), storeName -> {
            log.info("Registering index '{}' for store '{}'", properties.getIndex().getName(), storeName);
            return new PoiIndex(store, properties.getIndex(), clock);
        });
    }

    public Optional<PoiIndex> find(String storeName) {
        return Optional.ofNullable(indexes.get(storeName));
    }

    /**
     * Drop the index of a store
     *
     * @return true if there was one
     */
    public boolean reset(String storeName) {
        AtomicReference<PoiIndex> removed = new AtomicReference<>();
        // Creation of a replacement for the same store waits until the entry is gone
        indexes.computeIfPresent(storeName, (name, index) -> {
            if (!index.awaitIdle()) {
                log.warn("Index '{}' of store '{}' still busy after the build timeout, dropping it anyway",
                        index.getName(), name);
            }
            removed.set(index);
            return null;
        });
        if (removed.get() != null) {
            log.info("Dropped index '{}' of store '{}'", removed.get().getName(), storeName);
        }
        return removed.get() != null;
    }

    public void resetAll() {
        indexes.keySet().forEach(this::reset);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Releasing {} index(es)", indexes.size());
        indexes.clear();
    }
}
