package com.github.lruttl.cache;

import com.github.lruttl.error.InvalidCacheConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LruTtlCacheTest {

    private static final Duration TTL = Duration.ofMillis(300);

    @ParameterizedTest
    @EnumSource(StoreType.class)
    @DisplayName("容量1、TTL 300ms 的完整流程")
    public void testEndToEndScenario(StoreType type) throws InterruptedException {
        LruTtlCache<String, Integer> cache = new LruTtlCache<>(1, TTL, type, null);

        cache.add("a", 1);
        cache.add("b", 2); // 容量为1，a被驱逐

        Lookup<Integer> a = cache.get("a");
        assertFalse(a.isFound());
        assertFalse(a.isExpired(), "a是被驱逐而不是过期");

        assertEquals(Lookup.hit(2), cache.get("b"));

        Thread.sleep(500);
        Lookup<Integer> b = cache.get("b");
        assertFalse(b.isFound(), "500ms后应已过期");
        assertEquals(2, b.value(), "过期时仍返回旧值");
        assertEquals(0, cache.size());
    }

    @Test
    public void testGetRemovesExpiredEntry() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, TTL);
        cache.add("k", "v");
        assertEquals(Lookup.hit("v"), cache.get("k"));

        Thread.sleep(500);
        assertEquals(1, cache.storedSize(), "惰性过期：未访问前条目仍在存储中");
        assertEquals(0, cache.size(), "size 不统计过期条目");
        assertTrue(cache.keys().isEmpty());

        assertEquals(Lookup.expired("v"), cache.get("k"));
        assertEquals(0, cache.storedSize(), "get 发现过期后删除");
        assertEquals(Lookup.absent(), cache.get("k"));
    }

    @Test
    public void testPeekNeverRemovesExpiredEntry() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, TTL);
        cache.add("k", "v");
        assertEquals(Lookup.hit("v"), cache.peek("k"));

        Thread.sleep(500);
        for (int i = 0; i < 3; i++) {
            Lookup<String> lookup = cache.peek("k");
            assertFalse(lookup.isFound());
            assertTrue(lookup.isExpired());
            assertEquals("v", lookup.value(), "第" + i + "次peek仍返回旧值");
        }
        assertEquals(1, cache.storedSize());

        assertFalse(cache.get("k").isFound());
        assertEquals(Lookup.absent(), cache.peek("k"), "get 之后才真正删除");
    }

    @Test
    public void testPerCallTtlOverridesDefault() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, Duration.ofMinutes(1));
        cache.add("short", "1", Duration.ofMillis(100));
        cache.add("default", "2", null);

        Thread.sleep(300);
        assertFalse(cache.get("short").isFound());
        assertTrue(cache.get("default").isFound());
    }

    @Test
    public void testTtlSentinels() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, Duration.ofMinutes(1));
        Duration itemTtl = Duration.ofMillis(100);

        assertEquals(ExpiringCache.TTL_ABSENT, cache.ttl("test"));

        cache.add("test", "a", itemTtl);
        Duration ttl = cache.ttl("test");
        assertTrue(ttl.compareTo(itemTtl.dividedBy(2)) > 0 && ttl.compareTo(itemTtl) <= 0, "ttl=" + ttl);

        Thread.sleep(itemTtl.multipliedBy(2).toMillis());
        assertEquals(ExpiringCache.TTL_EXPIRED, cache.ttl("test"));
        assertNotEquals(ExpiringCache.TTL_ABSENT, ExpiringCache.TTL_EXPIRED);
        assertTrue(cache.peek("test").isExpired(), "ttl 使用 peek 语义，不删除条目");
    }

    @Test
    public void testAddResetsExpiry() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, TTL);
        cache.add("k", "v1");
        Thread.sleep(200);
        cache.add("k", "v2");
        Thread.sleep(200);
        assertEquals(Lookup.hit("v2"), cache.get("k"), "覆盖写重新计算过期时间");
    }

    @Test
    public void testKeysAndSizeSkipExpired() throws InterruptedException {
        LruTtlCache<Integer, Integer> cache = new LruTtlCache<>(10, Duration.ofMinutes(1));
        for (int i = 0; i < 20; i++) {
            cache.add(i, i);
        }
        assertEquals(10, cache.size());
        assertEquals(10, cache.keys().size());
        assertEquals(19, cache.keys().get(0), "keys 按 MRU -> LRU");

        cache.add(100, 100, Duration.ofMillis(50));
        Thread.sleep(150);
        assertFalse(cache.keys().contains(100));

        List<Integer> visited = new ArrayList<>();
        cache.forEach((k, v) -> visited.add(k));
        assertFalse(visited.contains(100));
        assertEquals(10, cache.storedSize(), "过期条目仍占用一个槽位");
        assertEquals(9, cache.size());
    }

    @Test
    public void testRemove() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(1, TTL);
        cache.add("foo", "bar");
        assertEquals(1, cache.size());
        assertTrue(cache.remove("foo"));
        assertEquals(0, cache.size());
        assertFalse(cache.remove("foo"));
    }

    @Test
    public void testClear() throws InterruptedException {
        List<String> evicted = new ArrayList<>();
        LruTtlCache<String, String> cache = new LruTtlCache<>(3, TTL, StoreType.LINKED, (k, v) -> evicted.add(k));
        cache.add("expired", "x", Duration.ofMillis(50));
        cache.add("a", "1");
        cache.add("b", "2");
        Thread.sleep(100);

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(0, cache.storedSize(), "已过期未清除的条目也一并删除");
        assertEquals(ExpiringCache.TTL_ABSENT, cache.ttl("a"));
        assertTrue(evicted.isEmpty(), "clear 不触发驱逐回调");

        cache.add("c", "3");
        assertEquals(Lookup.hit("3"), cache.get("c"));
    }

    @Test
    public void testGetIfPresent() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(2, TTL);
        cache.add("k", "v");
        assertEquals("v", cache.getIfPresent("k"));
        assertNull(cache.getIfPresent("missing"));
        Thread.sleep(500);
        assertNull(cache.getIfPresent("k"), "过期不返回旧值");
    }

    @Nested
    class EvictionListenerTests {

        @Test
        public void testFiresOnlyForCapacityEviction() throws InterruptedException {
            List<Map.Entry<String, String>> evicted = new ArrayList<>();
            LruTtlCache<String, String> cache = new LruTtlCache<>(1, TTL, StoreType.LINKED,
                    (k, v) -> evicted.add(Map.entry(k, v)));

            cache.add("test1", "value1");
            cache.add("test2", "value2");
            assertEquals(List.of(Map.entry("test1", "value1")), evicted, "回调拿到的是用户值");

            Thread.sleep(500);
            cache.get("test2"); // 过期清除
            cache.add("test3", "value3");
            cache.remove("test3"); // 显式删除

            assertEquals(1, evicted.size(), "过期和显式删除都不触发回调");
        }

        @Test
        public void testListenerNotCalledForFollowingInsertsWithoutPressure() {
            List<Integer> evicted = new ArrayList<>();
            int n = 5;
            LruTtlCache<Integer, Integer> cache = new LruTtlCache<>(n, Duration.ofMinutes(1),
                    StoreType.LINKED, (k, v) -> evicted.add(k));

            for (int i = 0; i <= n; i++) {
                cache.add(i, i);
            }
            assertEquals(List.of(0), evicted, "第 N+1 个key驱逐最早的key");

            for (int i = 1; i < n; i++) {
                cache.add(i, i * 10); // 覆盖已有key，不产生驱逐
            }
            assertEquals(List.of(0), evicted);
        }
    }

    @Test
    public void testStats() throws InterruptedException {
        LruTtlCache<String, String> cache = new LruTtlCache<>(1, Duration.ofMillis(100));
        cache.add("a", "1");
        cache.get("a");
        cache.get("missing");
        cache.add("b", "2"); // 驱逐a
        Thread.sleep(200);
        cache.get("b");
        cache.peek("b"); // peek 不计入统计

        CacheStats stats = cache.stats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.expireCount());
        assertEquals(1, stats.evictionCount());
        assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
    }

    @Test
    public void testConstructionValidation() {
        assertThrows(InvalidCacheConfigException.class, () -> new LruTtlCache<>(0, TTL));
        assertThrows(InvalidCacheConfigException.class, () -> new LruTtlCache<>(-1, TTL));
        assertThrows(InvalidCacheConfigException.class, () -> new LruTtlCache<>(1, Duration.ZERO));
        assertThrows(InvalidCacheConfigException.class, () -> new LruTtlCache<>(1, Duration.ofSeconds(-1)));
        assertThrows(InvalidCacheConfigException.class, () -> new LruTtlCache<>(1, null));
        assertThrows(IllegalArgumentException.class, () -> LruTtl.newBuilder().build(),
                "未设置参数同样拒绝");
    }

    @Test
    public void testAccessors() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(7, Duration.ofSeconds(3));
        assertEquals(7, cache.capacity());
        assertEquals(Duration.ofSeconds(3), cache.defaultTtl());
    }
}
