package com.poisearch.index;

import com.poisearch.config.PoiSearchProperties;
import com.poisearch.model.Category;
import com.poisearch.model.Position;
import com.poisearch.model.SearchCriteria;
import com.poisearch.support.InMemoryPoiStore;
import com.poisearch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PoiIndexRegistryTest {

    private MutableClock clock;
    private PoiIndexRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        registry = new PoiIndexRegistry(new PoiSearchProperties(), clock);
    }

    @Test
    void testSameStoreSharesOneIndex() {
        InMemoryPoiStore store = new InMemoryPoiStore("hx2a", clock);

        PoiIndex first = registry.acquire(store);
        PoiIndex second = registry.acquire(store);

        assertSame(first, second);
        assertEquals("poi kdcache", first.getName());
        assertEquals("hx2a", first.getStoreName());
        assertTrue(registry.find("hx2a").isPresent());
    }

    @Test
    void testStoresAreKeyedByName() {
        PoiIndex a = registry.acquire(new InMemoryPoiStore("a", clock));
        PoiIndex b = registry.acquire(new InMemoryPoiStore("b", clock));

        assertNotSame(a, b);
        assertSame(a, registry.acquire(new InMemoryPoiStore("a", clock)));
    }

    @Test
    void testResetDropsIndex() {
        InMemoryPoiStore store = new InMemoryPoiStore("hx2a", clock);
        PoiIndex before = registry.acquire(store);

        assertTrue(registry.reset("hx2a"));
        assertFalse(registry.reset("hx2a"));
        assertTrue(registry.find("hx2a").isEmpty());
        assertNotSame(before, registry.acquire(store));
    }

    @Test
    void testResetWaitsForBuildInProgress() throws Exception {
        // Given
        InMemoryPoiStore store = new InMemoryPoiStore("hx2a", clock);
        store.create("Louvre", Position.of(48.8606, 2.3376), Category.MUSEUM);
        store.setScanDelayMillis(300);
        PoiIndex first = registry.acquire(store);
        SearchCriteria paris = SearchCriteria.of(48.8, 48.9, 2.2, 2.4, Category.MUSEUM);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<IndexSearchResult> building = executor.submit(() -> first.search(paris, 10));
            long deadline = System.currentTimeMillis() + 5_000;
            while (!first.isRefreshing() && System.currentTimeMillis() < deadline) {
                Thread.sleep(1);
            }
            assertTrue(first.isRefreshing());

            // When
            assertTrue(registry.reset("hx2a"));

            // Then the build finished before the index was dropped
            assertTrue(first.isBuilt());
            assertFalse(first.isRefreshing());
            assertEquals(1, store.getScanCount());
            assertNotSame(first, registry.acquire(store));
            assertEquals(1, building.get(5, TimeUnit.SECONDS).getMatches().size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testResetAll() {
        registry.acquire(new InMemoryPoiStore("a", clock));
        registry.acquire(new InMemoryPoiStore("b", clock));

        registry.resetAll();

        assertTrue(registry.find("a").isEmpty());
        assertTrue(registry.find("b").isEmpty());
    }
}
