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

package com.hbc.anomaly.statistics;

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;
import static com.hbc.anomaly.CommonUtils.clampToFinite;
import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.lang.Math.sqrt;

import java.util.Arrays;

import com.hbc.anomaly.window.BoundedWindow;

/**
 * Population mean and variance of the values held in a window. The values are
 * divided by their largest magnitude before they are summed, so any window of
 * finite values has a finite mean and deviation. The variance is computed in
 * two passes, sum of squared deviations from the mean divided by the number of
 * values, so that a constant window has a variance of exactly zero.
 */
public class PopulationStatistics {

    private final int count;

    // largest magnitude of the values, 0 if all values are 0
    private final double scale;

    // mean and variance of the values divided by scale
    private final double scaledMean;

    private final double scaledVariance;

    PopulationStatistics(int count, double scale, double scaledMean, double scaledVariance) {
        this.count = count;
        this.scale = scale;
        this.scaledMean = scaledMean;
        this.scaledVariance = scaledVariance;
    }

    public static PopulationStatistics of(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "incorrect invocation for empty values");
        int n = values.length;
        double scale = 0;
        for (double value : values) {
            scale = max(scale, abs(value));
        }
        if (scale == 0) {
            return new PopulationStatistics(n, 0, 0, 0);
        }
        double sum = 0;
        for (double value : values) {
            sum += value / scale;
        }
        double mean = sum / n;
        double squared = 0;
        for (double value : values) {
            double deviation = value / scale - mean;
            squared += deviation * deviation;
        }
        return new PopulationStatistics(n, scale, mean, squared / n);
    }

    public static PopulationStatistics of(BoundedWindow<Double> window) {
        return of(toArray(window));
    }

    /**
     * statistics of one coordinate across a window of vectors
     *
     * @param window    the window of vectors, all of the same length
     * @param dimension the coordinate
     * @return the statistics of that coordinate
     */
    public static PopulationStatistics ofDimension(BoundedWindow<double[]> window, int dimension) {
        checkNotNull(window, "window must not be null");
        double[] column = new double[window.size()];
        for (int i = 0; i < column.length; i++) {
            column[i] = window.get(i)[dimension];
        }
        return of(column);
    }

    public static double[] toArray(BoundedWindow<Double> window) {
        checkNotNull(window, "window must not be null");
        double[] values = new double[window.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = window.get(i);
        }
        return values;
    }

    /**
     * The index of an empirical percentile in a sorted array of n values, that is
     * floor(p/100 * (n - 1)) clamped to [0, n - 1].
     *
     * @param percentile a value in [0,100]
     * @param n          number of values, at least 1
     * @return the index
     */
    public static int percentileIndex(double percentile, int n) {
        checkArgument(n > 0, "n must be greater than 0");
        int index = (int) Math.floor(percentile / 100.0 * (n - 1));
        return min(n - 1, max(0, index));
    }

    /**
     * @param values     unsorted values; not modified
     * @param percentile a value in [0,100]
     * @return the empirical percentile of the values
     */
    public static double percentile(double[] values, double percentile) {
        checkNotNull(values, "values must not be null");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted[percentileIndex(percentile, sorted.length)];
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return clampToFinite(scaledMean * scale);
    }

    /**
     * @return the population variance; may be infinite for values beyond the
     *         square root of {@link Double#MAX_VALUE}, use
     *         {@link #getDeviation()} or {@link #zscore(double)} for scoring
     */
    public double getVariance() {
        return scaledVariance * scale * scale;
    }

    /**
     * @return the standard deviation, or 0 when the variance is not positive
     */
    public double getDeviation() {
        return getDeviation(0);
    }

    /**
     * @param fallback the value to use when the variance is not positive
     * @return the standard deviation, or the fallback
     */
    public double getDeviation(double fallback) {
        return (scaledVariance > 0) ? clampToFinite(sqrt(scaledVariance) * scale) : fallback;
    }

    /**
     * @param value a value of the window
     * @return the distance of the value from the mean in standard deviations, 0
     *         when the variance is not positive
     */
    public double zscore(double value) {
        return zscore(value, 0);
    }

    /**
     * @param value    a value of the window
     * @param fallback the deviation to use when the variance is not positive; 0
     *                 reports a z-score of 0 in that case
     * @return the distance of the value from the mean in standard deviations,
     *         clamped to a finite number
     */
    public double zscore(double value, double fallback) {
        if (scaledVariance > 0) {
            return clampToFinite((value / scale - scaledMean) / sqrt(scaledVariance));
        }
        return (fallback > 0) ? clampToFinite((value - getMean()) / fallback) : 0;
    }
}
