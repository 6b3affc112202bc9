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

package com.hbc.anomaly.executor;

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;
import static com.hbc.anomaly.CommonUtils.checkState;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.LayeredAnomalyDetector;
import com.hbc.anomaly.returntypes.LayeredAnomalyResult;

/**
 * Delivers observations to a {@link LayeredAnomalyDetector} with a single
 * writer per subject. Each subject is bound to one of a fixed number of lanes,
 * each lane is a single thread, so the observations of a subject are applied in
 * the order they were submitted while subjects on different lanes are
 * processed in parallel.
 */
public class SubjectSequencedExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SubjectSequencedExecutor.class);

    public static final int DEFAULT_LANES = Runtime.getRuntime().availableProcessors();

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final LayeredAnomalyDetector detector;

    private final ExecutorService[] lanes;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SubjectSequencedExecutor(LayeredAnomalyDetector detector, int numberOfLanes) {
        this.detector = checkNotNull(detector, "detector must not be null");
        checkArgument(numberOfLanes > 0, "numberOfLanes must be greater than 0");
        lanes = new ExecutorService[numberOfLanes];
        for (int i = 0; i < numberOfLanes; i++) {
            final int lane = i;
            lanes[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "subject-lane-" + lane);
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    public SubjectSequencedExecutor(LayeredAnomalyDetector detector) {
        this(detector, DEFAULT_LANES);
    }

    /**
     * Queues an observation on the lane of its subject.
     *
     * @param subject  the subject key, not null
     * @param value    the scalar reading
     * @param features the feature vector, or null
     * @return a future completed with the results of the three layers
     * @throws IllegalStateException if the executor has been closed
     */
    public CompletableFuture<LayeredAnomalyResult> submit(String subject, double value, double[] features) {
        checkNotNull(subject, "subject must not be null");
        checkState(!closed.get(), "executor has been closed");
        double[] copy = (features == null) ? null : Arrays.copyOf(features, features.length);
        try {
            return CompletableFuture.supplyAsync(() -> detector.update(subject, value, copy),
                    lanes[laneOf(subject)]);
        } catch (RejectedExecutionException e) {
            // close() ran after the check above
            throw new IllegalStateException("executor has been closed", e);
        }
    }

    public CompletableFuture<LayeredAnomalyResult> submit(String subject, double value) {
        return submit(subject, value, null);
    }

    /**
     * @param subject the subject key
     * @return the lane the subject is bound to
     */
    public int laneOf(String subject) {
        return Math.floorMod(subject.hashCode(), lanes.length);
    }

    public int getNumberOfLanes() {
        return lanes.length;
    }

    public LayeredAnomalyDetector getDetector() {
        return detector;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops accepting observations and waits for the queued ones to be applied.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        try {
            for (ExecutorService lane : lanes) {
                if (!lane.awaitTermination(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("lane did not drain within {} seconds, dropping queued observations",
                            DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
                    lane.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Arrays.stream(lanes).forEach(ExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while draining lanes", e);
        }
    }
}
