package site.respkv.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.datastructure.RedisBytes;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyLockManager单元测试")
class KeyLockManagerTest {

    @Test
    void testStripeCountRoundsUp() {
        assertEquals(1024, new KeyLockManager(1000).getStripeCount());
        assertEquals(1, new KeyLockManager(1).getStripeCount());
        assertEquals(8, new KeyLockManager(8).getStripeCount());
        assertThrows(IllegalArgumentException.class, () -> new KeyLockManager(0));
    }

    @Test
    @DisplayName("同一分段的读写合并为独占")
    void testModesMergePerStripe() {
        KeyLockManager manager = new KeyLockManager(16);
        RedisBytes key = RedisBytes.fromString("k");
        try (KeyLockManager.LockHandle handle = manager.request()
                .add(0, key, false).add(0, key, true).acquire()) {
            assertEquals(1, handle.size());
        }
        try (KeyLockManager.LockHandle all = manager.acquireAll(false)) {
            assertEquals(16, all.size());
        }
    }

    @Test
    @DisplayName("独占锁排斥同键的读者")
    void testWriteExcludesReaders() throws Exception {
        KeyLockManager manager = new KeyLockManager(64);
        RedisBytes key = RedisBytes.fromString("k");
        AtomicBoolean readerEntered = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            try (KeyLockManager.LockHandle ignored = manager.request().add(0, key, true).acquire()) {
                executor.submit(() -> {
                    try (KeyLockManager.LockHandle r = manager.request().add(0, key, false).acquire()) {
                        readerEntered.set(true);
                    }
                    done.countDown();
                });
                Thread.sleep(100);
                assertFalse(readerEntered.get());
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(readerEntered.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("交叉顺序请求多个键不会死锁")
    void testNoDeadlockAcrossOrder() throws Exception {
        KeyLockManager manager = new KeyLockManager(1024);
        RedisBytes a = RedisBytes.fromString("a");
        RedisBytes b = RedisBytes.fromString("b");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger counter = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            final boolean reversed = t % 2 == 0;
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    KeyLockManager.LockRequest request = manager.request();
                    if (reversed) {
                        request.add(0, b, true).add(0, a, true);
                    } else {
                        request.add(0, a, true).add(0, b, true);
                    }
                    try (KeyLockManager.LockHandle ignored = request.acquire()) {
                        counter.incrementAndGet();
                    }
                }
                latch.countDown();
            });
        }
        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(4000, counter.get());
        executor.shutdownNow();
    }
}
