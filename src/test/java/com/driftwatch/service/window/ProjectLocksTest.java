package com.driftwatch.service.window;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ProjectLocksTest {

    private final ProjectLocks locks = new ProjectLocks();

    @Test
    void lockIsHeldOnlyWhileActionRuns() {
        boolean heldInside = locks.withLock(7L, () -> locks.isHeld(7L));

        assertThat(heldInside).isTrue();
        assertThat(locks.isHeld(7L)).isFalse();
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        assertThatThrownBy(() -> locks.withLock(3L, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.isHeld(3L)).isFalse();
    }

    @Test
    void sameProject_serialisesActions() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return locks.withLock(1L, () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.onSpinWait();
                        return inside.decrementAndGet();
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentProjects_doNotBlockEachOther() {
        Integer nested = locks.withLock(1L, () -> locks.withLock(2L, () -> locks.isHeld(1L) && locks.isHeld(2L) ? 1 : 0));
        assertThat(nested).isEqualTo(1);
    }
}
