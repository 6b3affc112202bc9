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

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.util.AutoCloseableLock;

/**
 * Holds the per-subject state of one tracker. States are created lazily on a
 * subject's first update and are retained until they are removed explicitly or
 * dropped by the retention policy:
 * <ul>
 * <li>{@code maxSubjects}: once more subjects than this are held, the least
 * recently updated subject is dropped;</li>
 * <li>{@code idleTimeout}: subjects that have not been updated for longer than
 * this are dropped on the next access to the store.</li>
 * </ul>
 * Without either option the store retains every subject it has seen.
 *
 * The map itself is guarded by a single lock which is held only to find or
 * create an entry. The function applied to a state runs under the lock of that
 * subject alone, so subjects are updated concurrently while updates of one
 * subject are serialized. An update whose entry is dropped between the lookup
 * and the acquisition of the subject lock is applied to a freshly created
 * state instead, so no update is lost to a concurrent removal.
 *
 * @param <S> the per-subject state type
 */
public class SubjectStateStore<S> {

    private static final Logger LOG = LoggerFactory.getLogger(SubjectStateStore.class);

    public static final int UNBOUNDED = 0;

    // 0 means no limit
    private final int maxSubjects;

    private final Optional<Duration> idleTimeout;

    private final Clock clock;

    private final ReentrantLock mapLock = new ReentrantLock();

    // insertion ordered; an update moves the subject to the tail, so the head is
    // always the least recently updated subject
    private final LinkedHashMap<String, Entry<S>> entries = new LinkedHashMap<>();

    protected SubjectStateStore(Builder builder) {
        checkArgument(builder.maxSubjects >= 0, "maxSubjects cannot be negative");
        builder.idleTimeout.ifPresent(timeout -> checkArgument(!timeout.isNegative() && !timeout.isZero(),
                "idleTimeout must be positive"));
        this.maxSubjects = builder.maxSubjects;
        this.idleTimeout = builder.idleTimeout;
        this.clock = checkNotNull(builder.clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Applies a function to the state of a subject, creating the state first if
     * the subject is not present. The function runs while holding the subject's
     * lock and counts as an update for the retention policy.
     *
     * @param subject  the subject key
     * @param factory  creates the initial state of a new subject
     * @param function the state transition, returning the result of the update
     * @param <R>      the result type
     * @return the value returned by the function
     */
    public <R> R compute(String subject, Supplier<S> factory, Function<S, R> function) {
        checkNotNull(subject, "subject must not be null");
        checkNotNull(factory, "factory must not be null");
        checkNotNull(function, "function must not be null");

        while (true) {
            Entry<S> entry = touch(subject, factory);
            try (AutoCloseableLock ignored = new AutoCloseableLock(entry.lock)) {
                if (isCurrent(subject, entry)) {
                    return function.apply(entry.state);
                }
            }
            // the entry was removed, evicted or expired before its lock was acquired
            LOG.debug("retrying update of subject {} on a new state", subject);
        }
    }

    // finds or creates the entry of a subject and marks it as the most recently
    // updated one
    private Entry<S> touch(String subject, Supplier<S> factory) {
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            Instant now = clock.instant();
            expireIdleSubjects(now);
            Entry<S> entry = entries.remove(subject);
            if (entry == null) {
                entry = new Entry<>(checkNotNull(factory.get(), "factory must not return null"));
            }
            entry.lastUpdate = now;
            entries.put(subject, entry);
            evictLeastRecentlyUpdated();
            return entry;
        }
    }

    // caller holds the entry lock; no entry lock is ever acquired while mapLock
    // is held
    private boolean isCurrent(String subject, Entry<S> entry) {
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            return entries.get(subject) == entry;
        }
    }

    /**
     * Applies a read-only function to the state of a subject without creating it
     * and without counting as an update.
     *
     * @param subject  the subject key
     * @param function reads the state
     * @param <R>      the result type
     * @return the value returned by the function, or empty if the subject is not
     *         present
     */
    public <R> Optional<R> read(String subject, Function<S, R> function) {
        checkNotNull(subject, "subject must not be null");
        checkNotNull(function, "function must not be null");

        Entry<S> entry;
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            expireIdleSubjects(clock.instant());
            entry = entries.get(subject);
        }
        if (entry == null) {
            return Optional.empty();
        }
        try (AutoCloseableLock ignored = new AutoCloseableLock(entry.lock)) {
            return Optional.ofNullable(function.apply(entry.state));
        }
    }

    /**
     * @param subject the subject key
     * @return true if the subject was present
     */
    public boolean remove(String subject) {
        checkNotNull(subject, "subject must not be null");
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            return entries.remove(subject) != null;
        }
    }

    public boolean contains(String subject) {
        checkNotNull(subject, "subject must not be null");
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            expireIdleSubjects(clock.instant());
            return entries.containsKey(subject);
        }
    }

    public int size() {
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            expireIdleSubjects(clock.instant());
            return entries.size();
        }
    }

    /**
     * @return the subjects currently held, least recently updated first
     */
    public Set<String> subjects() {
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            expireIdleSubjects(clock.instant());
            return new LinkedHashSet<>(entries.keySet());
        }
    }

    public void clear() {
        try (AutoCloseableLock ignored = new AutoCloseableLock(mapLock)) {
            entries.clear();
        }
    }

    public int getMaxSubjects() {
        return maxSubjects;
    }

    public Optional<Duration> getIdleTimeout() {
        return idleTimeout;
    }

    // caller holds mapLock
    private void expireIdleSubjects(Instant now) {
        if (idleTimeout.isEmpty()) {
            return;
        }
        Instant cutoff = now.minus(idleTimeout.get());
        Iterator<Map.Entry<String, Entry<S>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Entry<S>> eldest = iterator.next();
            if (!eldest.getValue().lastUpdate.isBefore(cutoff)) {
                break;
            }
            iterator.remove();
            LOG.debug("dropped subject {} after {} without updates", eldest.getKey(), idleTimeout.get());
        }
    }

    // caller holds mapLock
    private void evictLeastRecentlyUpdated() {
        if (maxSubjects == UNBOUNDED) {
            return;
        }
        Iterator<String> iterator = entries.keySet().iterator();
        while (entries.size() > maxSubjects && iterator.hasNext()) {
            String eldest = iterator.next();
            iterator.remove();
            LOG.debug("dropped least recently updated subject {}, limit is {} subjects", eldest, maxSubjects);
        }
    }

    static class Entry<S> {

        final ReentrantLock lock = new ReentrantLock();

        final S state;

        Instant lastUpdate;

        Entry(S state) {
            this.state = state;
        }
    }

    public static class Builder {

        private int maxSubjects = UNBOUNDED;
        private Optional<Duration> idleTimeout = Optional.empty();
        private Clock clock = Clock.systemUTC();

        public Builder maxSubjects(int maxSubjects) {
            this.maxSubjects = maxSubjects;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Optional.ofNullable(idleTimeout);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public <S> SubjectStateStore<S> build() {
            return new SubjectStateStore<>(this);
        }
    }
}
