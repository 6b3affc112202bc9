/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.hbc.anomaly.state;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class SubjectStateStoreTest {

    private static class MutableClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static int increment(AtomicInteger counter) {
        return counter.incrementAndGet();
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> SubjectStateStore.builder().maxSubjects(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> SubjectStateStore.builder().idleTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SubjectStateStore.builder().idleTimeout(Duration.ofSeconds(-5)).build());
        assertThrows(NullPointerException.class, () -> SubjectStateStore.builder().clock(null).build());
    }

    @Test
    public void testComputeCreatesStateOnce() {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().build();
        AtomicInteger created = new AtomicInteger();
        for (int i = 1; i <= 3; i++) {
            int value = store.compute("a", () -> {
                created.incrementAndGet();
                return new AtomicInteger();
            }, SubjectStateStoreTest::increment);
            assertEquals(i, value);
        }
        assertEquals(1, created.get());
        assertEquals(1, store.size());
        assertTrue(store.contains("a"));
    }

    @Test
    public void testReadDoesNotCreateState() {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().build();
        assertEquals(Optional.empty(), store.read("a", AtomicInteger::get));
        assertFalse(store.contains("a"));

        store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
        assertEquals(Optional.of(1), store.read("a", AtomicInteger::get));
    }

    @Test
    public void testNullArguments() {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().build();
        assertThrows(NullPointerException.class,
                () -> store.compute(null, AtomicInteger::new, SubjectStateStoreTest::increment));
        assertThrows(NullPointerException.class, () -> store.compute("a", () -> null, AtomicInteger::get));
        assertThrows(NullPointerException.class, () -> store.read(null, AtomicInteger::get));
        assertEquals(0, store.size());
    }

    @Test
    public void testLeastRecentlyUpdatedSubjectIsDropped() {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().maxSubjects(2).build();
        store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
        store.compute("b", AtomicInteger::new, SubjectStateStoreTest::increment);
        store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
        // reading b does not make it recent
        store.read("b", AtomicInteger::get);
        store.compute("c", AtomicInteger::new, SubjectStateStoreTest::increment);

        assertThat(store.subjects(), contains("a", "c"));
        assertEquals(Optional.of(2), store.read("a", AtomicInteger::get));

        // a dropped subject starts over
        store.compute("b", AtomicInteger::new, SubjectStateStoreTest::increment);
        assertEquals(Optional.of(1), store.read("b", AtomicInteger::get));
        assertThat(store.subjects(), contains("c", "b"));
    }

    @Test
    public void testIdleSubjectsExpire() {
        MutableClock clock = new MutableClock();
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().idleTimeout(Duration.ofMinutes(10))
                .clock(clock).build();
        store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
        clock.advance(Duration.ofMinutes(6));
        store.compute("b", AtomicInteger::new, SubjectStateStoreTest::increment);

        clock.advance(Duration.ofMinutes(4));
        assertEquals(2, store.size());

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.subjects(), contains("b"));
        assertFalse(store.contains("a"));

        clock.advance(Duration.ofMinutes(6));
        assertEquals(0, store.size());
    }

    @Test
    public void testUpdateRefreshesIdleTimer() {
        MutableClock clock = new MutableClock();
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().idleTimeout(Duration.ofMinutes(10))
                .clock(clock).build();
        for (int i = 0; i < 5; i++) {
            store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
            clock.advance(Duration.ofMinutes(9));
        }
        assertEquals(Optional.of(5), store.read("a", AtomicInteger::get));
    }

    @Test
    public void testRemoveAndClear() {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().build();
        store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment);
        store.compute("b", AtomicInteger::new, SubjectStateStoreTest::increment);
        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertEquals(1, store.size());
        store.clear();
        assertEquals(0, store.size());
        assertTrue(store.subjects().isEmpty());
    }

    @Test
    public void testUpdateWaitingOnRemovedSubjectIsKept() throws Exception {
        SubjectStateStore<AtomicInteger> store = SubjectStateStore.builder().build();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> store.compute("a", AtomicInteger::new, counter -> {
            holding.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return counter.incrementAndGet();
        }));
        holder.start();
        assertTrue(holding.await(30, TimeUnit.SECONDS));

        AtomicInteger waiterResult = new AtomicInteger();
        Thread waiter = new Thread(
                () -> waiterResult.set(store.compute("a", AtomicInteger::new, SubjectStateStoreTest::increment)));
        waiter.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        while (waiter.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(1);
        }
        assertEquals(Thread.State.WAITING, waiter.getState());

        // the waiter found the entry of "a" and is blocked on its lock
        assertTrue(store.remove("a"));
        release.countDown();
        holder.join(30_000);
        waiter.join(30_000);

        assertEquals(1, waiterResult.get());
        assertEquals(Optional.of(1), store.read("a", AtomicInteger::get));
    }

    @Test
    public void testConcurrentUpdatesOfOneSubjectAreSerialized() throws Exception {
        SubjectStateStore<int[]> store = SubjectStateStore.builder().build();
        int threads = 8;
        int updates = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String other = "subject-" + t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < updates; i++) {
                        // a plain array is only safe if the function runs under the subject lock
                        store.compute("shared", () -> new int[1], counter -> ++counter[0]);
                        store.compute(other, () -> new int[1], counter -> ++counter[0]);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(Optional.of(threads * updates), store.read("shared", counter -> counter[0]));
        assertEquals(Optional.of(updates), store.read("subject-0", counter -> counter[0]));
        assertEquals(threads + 1, store.size());
    }
}
