package com.aiinpocket.combat.service.combat.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class SessionLockRegistryTest {

    private final SessionLockRegistry registry = new SessionLockRegistry();
    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsTaskResult() {
        assertEquals("ok", registry.withLock("s-1", () -> "ok"));
    }

    @Test
    void sameThreadCanReenter() {
        String result = registry.withLock("s-1", () -> registry.withLock("s-1", () -> "nested"));

        assertEquals("nested", result);
    }

    @Test
    void actionsOnOneSessionRunOneAtATime() throws Exception {
        int[] counter = {0};
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 1_000; i++) {
                    registry.runWithLock("s-1", () -> counter[0]++);
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }

        assertEquals(4_000, counter[0]);
    }

    @Test
    void differentSessionsDoNotBlockEachOther() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> registry.runWithLock("s-1", () -> {
            held.countDown();
            await(release);
        }));
        assertTrue(held.await(5, TimeUnit.SECONDS));

        Future<String> other = pool.submit(() -> registry.withLock("s-2", () -> "free"));
        assertEquals("free", other.get(1, TimeUnit.SECONDS));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void lockIsReleasedWhenTaskThrows() throws Exception {
        assertThrows(IllegalStateException.class, () -> registry.runWithLock("s-1", () -> {
            throw new IllegalStateException("boom");
        }));

        Future<String> next = pool.submit(() -> registry.withLock("s-1", () -> "after"));
        assertEquals("after", next.get(1, TimeUnit.SECONDS));
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
