package net.vortexdevelopment.vattribute.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StaticCacheTest {

    @Test
    void testHitsAndMisses() {
        StaticCache<String, String> cache = new StaticCache<>();

        assertThat(cache.get("k1")).isNull();
        cache.put("k1", "v1");
        assertThat(cache.get("k1")).isEqualTo("v1");
        assertThat(cache.get("k1")).isEqualTo("v1");

        assertThat(cache.getHits()).isEqualTo(2);
        assertThat(cache.getMisses()).isEqualTo(1);
        assertThat(cache.getEntry("k1").getAccessCount().get()).isEqualTo(2);
    }

    @Test
    void testLastWriteWins() {
        StaticCache<String, String> cache = new StaticCache<>();

        cache.put("k1", "first");
        cache.put("k1", "second");

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("k1")).isEqualTo("second");
    }

    @Test
    void testLoaderRunsOnlyOnMiss() {
        StaticCache<String, Integer> cache = new StaticCache<>();
        AtomicInteger loads = new AtomicInteger();

        assertThat(cache.get("a", key -> loads.incrementAndGet())).isEqualTo(1);
        assertThat(cache.get("a", key -> loads.incrementAndGet())).isEqualTo(1);
        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void testInvalidate() {
        StaticCache<String, String> cache = new StaticCache<>();
        cache.put("k1", "v1");
        cache.put("k2", "v2");

        cache.invalidate();

        assertThat(cache.size()).isEqualTo(0);
        assertThat(cache.contains("k1")).isFalse();
    }
}
