package com.github.lruttl.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SynchronizedExpiringCacheTest {

    @Test
    public void testBuilderChoosesSynchronization() {
        ExpiringCache<String, String> locked = LruTtl.<String, String>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(1, TimeUnit.SECONDS)
                .build();
        ExpiringCache<String, String> unlocked = LruTtl.<String, String>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(Duration.ofSeconds(1))
                .synchronize(false)
                .build();

        assertInstanceOf(SynchronizedExpiringCache.class, locked);
        assertInstanceOf(LruTtlCache.class, unlocked);
        assertEquals(Duration.ofSeconds(1), locked.defaultTtl());
        assertEquals(10, locked.capacity());
    }

    @Test
    public void testRejectsDoubleWrapping() {
        ExpiringCache<String, String> locked = new SynchronizedExpiringCache<>(
                new LruTtlCache<>(10, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new SynchronizedExpiringCache<>(locked));
    }

    @Test
    public void testClearUnderLock() {
        List<String> evicted = new ArrayList<>();
        ExpiringCache<String, String> cache = LruTtl.<String, String>newBuilder()
                .maximumSize(2)
                .expireAfterWrite(Duration.ofSeconds(1))
                .evictionListener((k, v) -> evicted.add(k))
                .build();
        cache.add("a", "1");
        cache.add("b", "2");

        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.keys().isEmpty());
        assertTrue(evicted.isEmpty());

        cache.add("c", "3");
        assertEquals("3", cache.getIfPresent("c"));
    }

    @Test
    @Timeout(10)
    public void testParallelAdd() throws InterruptedException {
        ExpiringCache<String, String> cache = LruTtl.<String, String>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(Duration.ofSeconds(1))
                .build();

        runConcurrently(100, i -> {
            if (i % 2 == 0) {
                cache.add("1", "value1");
            } else {
                cache.add("2", "value2");
            }
        });

        assertEquals(Lookup.hit("value1"), cache.get("1"));
        assertEquals(Lookup.hit("value2"), cache.get("2"));
    }

    @Test
    @Timeout(10)
    public void testParallelGetAndPeek() throws InterruptedException {
        ExpiringCache<String, String> cache = LruTtl.<String, String>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(Duration.ofSeconds(5))
                .build();
        cache.add("1", "value1");
        cache.add("2", "value2");

        AtomicInteger failures = new AtomicInteger();
        runConcurrently(200, i -> {
            String key = String.valueOf(i % 2 + 1);
            Lookup<String> lookup = (i % 4 < 2) ? cache.get(key) : cache.peek(key);
            if (!lookup.isFound() || !("value" + key).equals(lookup.value())) {
                failures.incrementAndGet();
            }
        });
        assertEquals(0, failures.get());
    }

    @Test
    @Timeout(30)
    public void testCapacityHoldsUnderContention() throws InterruptedException {
        int capacity = 64;
        AtomicInteger evictions = new AtomicInteger();
        ExpiringCache<Integer, Integer> cache = LruTtl.<Integer, Integer>newBuilder()
                .maximumSize(capacity)
                .expireAfterWrite(Duration.ofMinutes(1))
                .evictionListener((k, v) -> evictions.incrementAndGet())
                .build();

        int threads = 8;
        int opsPerThread = 5_000;
        runConcurrently(threads, t -> {
            for (int i = 0; i < opsPerThread; i++) {
                int key = t * opsPerThread + i;
                cache.add(key, key);
                cache.get(key);
                assertTrue(cache.size() <= capacity);
            }
        });

        assertEquals(capacity, cache.size());
        assertEquals(threads * opsPerThread - capacity, evictions.get(),
                "每个超出容量的写入恰好驱逐一次");
        assertEquals(evictions.get(), cache.stats().evictionCount());
    }

    @Test
    @Timeout(5)
    public void testForEachVisitorMayCallBackIntoCache() {
        ExpiringCache<String, Integer> cache = LruTtl.<String, Integer>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(Duration.ofSeconds(5))
                .build();
        cache.add("a", 1);
        cache.add("b", 2);

        List<String> visited = new ArrayList<>();
        // forEach 在锁外回调，visitor 中获取写锁不会死锁
        cache.forEach((k, v) -> {
            visited.add(k);
            cache.remove(k);
        });

        assertEquals(List.of("b", "a"), visited);
        assertEquals(0, cache.size());
    }

    private static void runConcurrently(int tasks, TaskBody body) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(tasks, 16));
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(tasks);
        List<Throwable> errors = new ArrayList<>();
        for (int t = 0; t < tasks; t++) {
            final int id = t;
            pool.submit(() -> {
                try {
                    start.await();
                    body.run(id);
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        done.await();
        pool.shutdown();
        assertTrue(errors.isEmpty(), "并发任务失败: " + errors);
    }

    @FunctionalInterface
    private interface TaskBody {
        void run(int id) throws Exception;
    }
}
