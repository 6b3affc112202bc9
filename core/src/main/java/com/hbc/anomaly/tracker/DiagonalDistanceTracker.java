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
import static com.hbc.anomaly.CommonUtils.clampToFinite;
import static com.hbc.anomaly.CommonUtils.isFiniteVector;
import static com.hbc.anomaly.CommonUtils.toFlag;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.config.DimensionChangePolicy;
import com.hbc.anomaly.inputtypes.Observation;
import com.hbc.anomaly.returntypes.DiagonalDistanceResult;
import com.hbc.anomaly.statistics.PopulationStatistics;
import com.hbc.anomaly.window.BoundedWindow;

/**
 * Third layer: a Mahalanobis style distance with a diagonal covariance. Each
 * subject keeps a window of feature vectors; a new vector scores
 * {@code sum_i ((x_i - mu_i) / sigma_i)^2} with the per dimension population
 * mean and deviation of the window, and is an anomaly when the score exceeds
 * {@code distanceThreshold}.
 *
 * Scoring starts once the window holds at least {@code d + 1} vectors, where d
 * is the dimension of the subject; before that the score is 0. A dimension
 * without spread is scaled by a deviation of 1, unlike the scalar layers which
 * report a z-score of 0 in that case.
 */
public class DiagonalDistanceTracker
        extends AbstractSubjectTracker<DiagonalDistanceTracker.VectorState, DiagonalDistanceResult> {

    private static final Logger LOG = LoggerFactory.getLogger(DiagonalDistanceTracker.class);

    public static final double DEFAULT_DISTANCE_THRESHOLD = 15.0;

    public static final DimensionChangePolicy DEFAULT_DIMENSION_CHANGE_POLICY = DimensionChangePolicy.REJECT;

    // deviation used for a dimension whose variance is not positive
    static final double DEGENERATE_DEVIATION = 1.0;

    private final double distanceThreshold;

    private final DimensionChangePolicy dimensionChangePolicy;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected DiagonalDistanceTracker(Builder<?> builder) {
        super(builder);
        checkArgument(builder.distanceThreshold > 0 && Double.isFinite(builder.distanceThreshold),
                "distanceThreshold must be a positive finite number");
        this.distanceThreshold = builder.distanceThreshold;
        this.dimensionChangePolicy = checkNotNull(builder.dimensionChangePolicy,
                "dimensionChangePolicy must not be null");
    }

    @Override
    public DiagonalDistanceResult update(String subject, Observation observation) {
        checkNotNull(subject, "subject must not be null");
        if (observation == null || observation.isScalar()) {
            LOG.debug("ignoring non vector observation {} for subject {}", observation, subject);
            return getEmptyResult();
        }
        return update(subject, ((Observation.Vector) observation).getValues());
    }

    /**
     * Folds a feature vector into the window of a subject and scores it.
     *
     * @param subject the subject key, not null
     * @param vector  the feature vector; a null or empty vector, or one with a
     *                non-finite component, yields the empty result
     * @return the squared distance and flag of this vector
     */
    public DiagonalDistanceResult update(String subject, double[] vector) {
        checkNotNull(subject, "subject must not be null");
        if (!isFiniteVector(vector)) {
            LOG.debug("ignoring malformed feature vector {} for subject {}", Arrays.toString(vector), subject);
            return getEmptyResult();
        }
        double[] point = Arrays.copyOf(vector, vector.length);
        // the first vector of a subject fixes its dimension
        return states.compute(subject, () -> new VectorState(windowSize, point.length),
                state -> classify(subject, state, point));
    }

    DiagonalDistanceResult classify(String subject, VectorState state, double[] point) {
        if (point.length != state.dimensions) {
            if (dimensionChangePolicy == DimensionChangePolicy.REJECT) {
                LOG.warn("rejecting feature vector of dimension {} for subject {} which has dimension {}",
                        point.length, subject, state.dimensions);
                return getEmptyResult();
            }
            LOG.warn("resetting history of subject {}, dimension changed from {} to {}", subject,
                    state.dimensions, point.length);
            state.window.clear();
            state.dimensions = point.length;
        }

        state.window.push(point);
        int n = state.window.size();
        int d = state.dimensions;
        if (n < d + 1) {
            return getEmptyResult();
        }

        double score = 0;
        for (int i = 0; i < d; i++) {
            double z = PopulationStatistics.ofDimension(state.window, i).zscore(point[i], DEGENERATE_DEVIATION);
            score = clampToFinite(score + z * z);
        }

        return DiagonalDistanceResult.builder().score(score).anomaly(toFlag(score > distanceThreshold)).build();
    }

    @Override
    public DiagonalDistanceResult getEmptyResult() {
        return DiagonalDistanceResult.empty();
    }

    @Override
    protected int countObservations(VectorState state) {
        return state.window.size();
    }

    /**
     * @param subject the subject key
     * @return the dimension fixed for the subject, 0 if the subject is unknown
     */
    public int getDimensions(String subject) {
        checkNotNull(subject, "subject must not be null");
        return states.read(subject, state -> state.dimensions).orElse(0);
    }

    public double getDistanceThreshold() {
        return distanceThreshold;
    }

    public DimensionChangePolicy getDimensionChangePolicy() {
        return dimensionChangePolicy;
    }

    static class VectorState {

        final BoundedWindow<double[]> window;

        int dimensions;

        VectorState(int windowSize, int dimensions) {
            this.window = new BoundedWindow<>(windowSize);
            this.dimensions = dimensions;
        }
    }

    public static class Builder<T extends Builder<T>> extends AbstractSubjectTracker.Builder<T> {

        private double distanceThreshold = DEFAULT_DISTANCE_THRESHOLD;
        private DimensionChangePolicy dimensionChangePolicy = DEFAULT_DIMENSION_CHANGE_POLICY;

        public T distanceThreshold(double distanceThreshold) {
            this.distanceThreshold = distanceThreshold;
            return (T) this;
        }

        public T dimensionChangePolicy(DimensionChangePolicy dimensionChangePolicy) {
            this.dimensionChangePolicy = dimensionChangePolicy;
            return (T) this;
        }

        public DiagonalDistanceTracker build() {
            return new DiagonalDistanceTracker(this);
        }
    }
}
