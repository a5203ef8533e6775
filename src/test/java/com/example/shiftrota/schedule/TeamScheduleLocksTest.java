package com.example.shiftrota.schedule;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamScheduleLocksTest {

    private final TeamScheduleLocks locks = new TeamScheduleLocks();

    @Test
    void withLock_serializesWritersOfTheSameTeam() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return locks.withLock(1L, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return inside.decrementAndGet();
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.isLocked(1L)).isFalse();
    }

    @Test
    void withLock_doesNotBlockOtherTeams() throws Exception {
        CountDownLatch otherTeamDone = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            boolean finished = locks.withLock(1L, () -> {
                pool.submit(() -> locks.withLock(2L, () -> {
                    otherTeamDone.countDown();
                    return null;
                }));
                try {
                    return otherTeamDone.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });
            assertThat(finished).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void withLock_releasesOnException() {
        assertThatThrownBy(() -> locks.withLock(3L, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(locks.isLocked(3L)).isFalse();
    }
}
