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
import static com.hbc.anomaly.CommonUtils.toFlag;
import static java.lang.Math.abs;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.inputtypes.Observation;
import com.hbc.anomaly.returntypes.StaticZScoreResult;
import com.hbc.anomaly.statistics.PopulationStatistics;
import com.hbc.anomaly.window.BoundedWindow;

/**
 * First layer: empirical percentile bounds and a rolling z-score over the most
 * recent values of each subject.
 *
 * A value is a static anomaly when it falls outside the values found at the
 * low and high percentiles of the sorted window (the window includes the value
 * itself), and a z-score anomaly when its distance from the window mean exceeds
 * {@code zscoreK} population standard deviations. A window without spread has a
 * z-score of 0.
 */
public class StaticZScoreTracker extends AbstractSubjectTracker<BoundedWindow<Double>, StaticZScoreResult> {

    private static final Logger LOG = LoggerFactory.getLogger(StaticZScoreTracker.class);

    public static final double DEFAULT_PERCENTILE_LOW = 5.0;

    public static final double DEFAULT_PERCENTILE_HIGH = 95.0;

    public static final double DEFAULT_ZSCORE_K = 2.5;

    private final double percentileLow;

    private final double percentileHigh;

    private final double zscoreK;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected StaticZScoreTracker(Builder<?> builder) {
        super(builder);
        checkArgument(builder.percentileLow >= 0 && builder.percentileLow <= 100,
                "percentileLow must be in [0, 100]");
        checkArgument(builder.percentileHigh >= 0 && builder.percentileHigh <= 100,
                "percentileHigh must be in [0, 100]");
        checkArgument(builder.percentileLow < builder.percentileHigh,
                "percentileLow must be smaller than percentileHigh");
        checkArgument(builder.zscoreK > 0 && Double.isFinite(builder.zscoreK),
                "zscoreK must be a positive finite number");
        this.percentileLow = builder.percentileLow;
        this.percentileHigh = builder.percentileHigh;
        this.zscoreK = builder.zscoreK;
    }

    @Override
    public StaticZScoreResult update(String subject, Observation observation) {
        checkNotNull(subject, "subject must not be null");
        if (observation == null || !observation.isScalar()) {
            LOG.debug("ignoring non scalar observation {} for subject {}", observation, subject);
            return getEmptyResult();
        }
        return update(subject, ((Observation.Scalar) observation).getValue());
    }

    /**
     * Folds a value into the window of a subject and classifies it.
     *
     * @param subject the subject key, not null
     * @param value   the new value; a non-finite value yields the empty result
     * @return the bounds, z-score and flags of this value
     */
    public StaticZScoreResult update(String subject, double value) {
        checkNotNull(subject, "subject must not be null");
        if (!Double.isFinite(value)) {
            LOG.debug("ignoring non finite value {} for subject {}", value, subject);
            return getEmptyResult();
        }
        return states.compute(subject, this::newState, window -> classify(window, value));
    }

    StaticZScoreResult classify(BoundedWindow<Double> window, double value) {
        window.push(value);
        int n = window.size();
        if (n < 2) {
            return StaticZScoreResult.builder().staticUpperBound(value).staticLowerBound(value).build();
        }

        double[] values = PopulationStatistics.toArray(window);
        PopulationStatistics statistics = PopulationStatistics.of(values);

        Arrays.sort(values);
        double lower = values[PopulationStatistics.percentileIndex(percentileLow, n)];
        double upper = values[PopulationStatistics.percentileIndex(percentileHigh, n)];

        double zscore = statistics.zscore(value);

        return StaticZScoreResult.builder().staticUpperBound(upper).staticLowerBound(lower)
                .staticAnomaly(toFlag(value < lower || value > upper)).zscore(zscore)
                .zscoreAnomaly(toFlag(abs(zscore) > zscoreK)).build();
    }

    @Override
    public StaticZScoreResult getEmptyResult() {
        return StaticZScoreResult.empty();
    }

    BoundedWindow<Double> newState() {
        return new BoundedWindow<>(windowSize);
    }

    @Override
    protected int countObservations(BoundedWindow<Double> window) {
        return window.size();
    }

    public double getPercentileLow() {
        return percentileLow;
    }

    public double getPercentileHigh() {
        return percentileHigh;
    }

    public double getZscoreK() {
        return zscoreK;
    }

    public static class Builder<T extends Builder<T>> extends AbstractSubjectTracker.Builder<T> {

        private double percentileLow = DEFAULT_PERCENTILE_LOW;
        private double percentileHigh = DEFAULT_PERCENTILE_HIGH;
        private double zscoreK = DEFAULT_ZSCORE_K;

        public T percentileLow(double percentileLow) {
            this.percentileLow = percentileLow;
            return (T) this;
        }

        public T percentileHigh(double percentileHigh) {
            this.percentileHigh = percentileHigh;
            return (T) this;
        }

        public T zscoreK(double zscoreK) {
            this.zscoreK = zscoreK;
            return (T) this;
        }

        public StaticZScoreTracker build() {
            return new StaticZScoreTracker(this);
        }
    }
}
