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

package com.hbc.anomaly.tracker;

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import com.hbc.anomaly.ISubjectTracker;
import com.hbc.anomaly.state.SubjectStateStore;

/**
 * Common plumbing of the trackers: the window size and the store holding the
 * per-subject state.
 *
 * @param <S> the per-subject state type
 * @param <R> the result type
 */
public abstract class AbstractSubjectTracker<S, R> implements ISubjectTracker<R> {

    public static final int DEFAULT_WINDOW_SIZE = 500;

    // capacity of every window kept per subject
    protected final int windowSize;

    protected final SubjectStateStore<S> states;

    protected AbstractSubjectTracker(Builder<?> builder) {
        checkArgument(builder.windowSize > 0, "windowSize must be greater than 0");
        checkArgument(builder.maxSubjects >= 0, "maxSubjects cannot be negative");
        this.windowSize = builder.windowSize;
        this.states = SubjectStateStore.builder().maxSubjects(builder.maxSubjects)
                .idleTimeout(builder.idleTimeout.orElse(null)).clock(builder.clock).build();
    }

    /**
     * @param state a subject's state
     * @return the number of observations held in the state
     */
    protected abstract int countObservations(S state);

    @Override
    public int getObservationCount(String subject) {
        return states.read(checkNotNull(subject, "subject must not be null"), this::countObservations).orElse(0);
    }

    @Override
    public int getSubjectCount() {
        return states.size();
    }

    @Override
    public Set<String> getSubjects() {
        return states.subjects();
    }

    @Override
    public boolean forget(String subject) {
        return states.remove(subject);
    }

    @Override
    public void clear() {
        states.clear();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public static class Builder<T extends Builder<T>> {

        private int windowSize = DEFAULT_WINDOW_SIZE;
        private int maxSubjects = SubjectStateStore.UNBOUNDED;
        private Optional<Duration> idleTimeout = Optional.empty();
        private Clock clock = Clock.systemUTC();

        public T windowSize(int windowSize) {
            this.windowSize = windowSize;
            return (T) this;
        }

        /**
         * Bounds the number of subjects retained; the least recently updated subject
         * is dropped when the bound is exceeded. 0 keeps every subject.
         *
         * @param maxSubjects the bound
         * @return this builder
         */
        public T maxSubjects(int maxSubjects) {
            this.maxSubjects = maxSubjects;
            return (T) this;
        }

        public T idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Optional.ofNullable(idleTimeout);
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }
    }
}
