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
import static com.hbc.anomaly.CommonUtils.toFlag;
import static java.lang.Math.abs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.inputtypes.Observation;
import com.hbc.anomaly.returntypes.SeasonalResidualResult;
import com.hbc.anomaly.statistics.PopulationStatistics;
import com.hbc.anomaly.window.BoundedWindow;

/**
 * Second layer: an exponentially weighted moving average serves as a slow
 * baseline of each subject. A value is a seasonal anomaly when it leaves the
 * band of {@code bandK} standard deviations (of the recent values) around the
 * baseline, and a residual anomaly when its residual from the baseline is more
 * than {@code residualK} standard deviations away from the mean of the recent
 * residuals.
 *
 * The baseline folds every value into its predecessor, so results depend on
 * the order in which the values of a subject arrive.
 */
public class SeasonalResidualTracker
        extends AbstractSubjectTracker<SeasonalResidualTracker.SeasonalState, SeasonalResidualResult> {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalResidualTracker.class);

    public static final double DEFAULT_EWMA_ALPHA = 0.1;

    public static final double DEFAULT_BAND_K = 2.0;

    public static final double DEFAULT_RESIDUAL_K = 2.5;

    // weight of the newest value in the baseline
    private final double ewmaAlpha;

    private final double bandK;

    private final double residualK;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected SeasonalResidualTracker(Builder<?> builder) {
        super(builder);
        checkArgument(builder.ewmaAlpha > 0 && builder.ewmaAlpha <= 1, "ewmaAlpha must be in (0, 1]");
        checkArgument(builder.bandK > 0 && Double.isFinite(builder.bandK), "bandK must be a positive finite number");
        checkArgument(builder.residualK > 0 && Double.isFinite(builder.residualK),
                "residualK must be a positive finite number");
        this.ewmaAlpha = builder.ewmaAlpha;
        this.bandK = builder.bandK;
        this.residualK = builder.residualK;
    }

    @Override
    public SeasonalResidualResult update(String subject, Observation observation) {
        checkNotNull(subject, "subject must not be null");
        if (observation == null || !observation.isScalar()) {
            LOG.debug("ignoring non scalar observation {} for subject {}", observation, subject);
            return getEmptyResult();
        }
        return update(subject, ((Observation.Scalar) observation).getValue());
    }

    /**
     * Folds a value into the baseline and windows of a subject and classifies it.
     *
     * @param subject the subject key, not null
     * @param value   the new value; a non-finite value yields the empty result
     * @return the baseline, bands, residual and flags of this value
     */
    public SeasonalResidualResult update(String subject, double value) {
        checkNotNull(subject, "subject must not be null");
        if (!Double.isFinite(value)) {
            LOG.debug("ignoring non finite value {} for subject {}", value, subject);
            return getEmptyResult();
        }
        return states.compute(subject, this::newState, state -> classify(state, value));
    }

    SeasonalResidualResult classify(SeasonalState state, double value) {
        // the first value of a subject is its baseline
        double baseline = state.hasBaseline
                ? clampToFinite(ewmaAlpha * value + (1.0 - ewmaAlpha) * state.baseline)
                : value;
        state.baseline = baseline;
        state.hasBaseline = true;

        double residual = clampToFinite(value - baseline);
        state.values.push(value);
        state.residuals.push(residual);
        int n = state.values.size();

        if (n < 2) {
            return SeasonalResidualResult.builder().baseline(baseline).upperBand(baseline).lowerBand(baseline)
                    .residual(residual).build();
        }

        double bandHalf = clampToFinite(bandK * PopulationStatistics.of(state.values).getDeviation());
        double upperBand = clampToFinite(baseline + bandHalf);
        double lowerBand = clampToFinite(baseline - bandHalf);

        double residualZscore = PopulationStatistics.of(state.residuals).zscore(residual);

        return SeasonalResidualResult.builder().baseline(baseline).upperBand(upperBand).lowerBand(lowerBand)
                .residual(residual).residualZscore(residualZscore)
                .seasonalAnomaly(toFlag(value < lowerBand || value > upperBand))
                .residualAnomaly(toFlag(abs(residualZscore) > residualK)).build();
    }

    @Override
    public SeasonalResidualResult getEmptyResult() {
        return SeasonalResidualResult.empty();
    }

    SeasonalState newState() {
        return new SeasonalState(windowSize);
    }

    @Override
    protected int countObservations(SeasonalState state) {
        return state.values.size();
    }

    /**
     * @param subject the subject key
     * @return the current baseline of the subject, NaN if the subject is unknown
     */
    public double getBaseline(String subject) {
        checkNotNull(subject, "subject must not be null");
        return states.read(subject, state -> state.baseline).orElse(Double.NaN);
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public double getBandK() {
        return bandK;
    }

    public double getResidualK() {
        return residualK;
    }

    static class SeasonalState {

        double baseline;

        boolean hasBaseline;

        final BoundedWindow<Double> values;

        final BoundedWindow<Double> residuals;

        SeasonalState(int windowSize) {
            values = new BoundedWindow<>(windowSize);
            residuals = new BoundedWindow<>(windowSize);
        }
    }

    public static class Builder<T extends Builder<T>> extends AbstractSubjectTracker.Builder<T> {

        private double ewmaAlpha = DEFAULT_EWMA_ALPHA;
        private double bandK = DEFAULT_BAND_K;
        private double residualK = DEFAULT_RESIDUAL_K;

        public T ewmaAlpha(double ewmaAlpha) {
            this.ewmaAlpha = ewmaAlpha;
            return (T) this;
        }

        public T bandK(double bandK) {
            this.bandK = bandK;
            return (T) this;
        }

        public T residualK(double residualK) {
            this.residualK = residualK;
            return (T) this;
        }

        public SeasonalResidualTracker build() {
            return new SeasonalResidualTracker(this);
        }
    }
}
