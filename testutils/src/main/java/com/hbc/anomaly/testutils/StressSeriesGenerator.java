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

package com.hbc.anomaly.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Generates daily stress readings from a mixture of two normal distributions:
 * a calm regime and a stressed regime, with random transitions between the
 * two. The generator is fully determined by its seed, so a series can be
 * replayed exactly.
 */
public class StressSeriesGenerator {

    private final double calmMu;
    private final double calmSigma;
    private final double stressMu;
    private final double stressSigma;
    private final double transitionToStressProbability;
    private final double transitionToCalmProbability;

    public StressSeriesGenerator(double calmMu, double calmSigma, double stressMu, double stressSigma,
            double transitionToStressProbability, double transitionToCalmProbability) {
        this.calmMu = calmMu;
        this.calmSigma = calmSigma;
        this.stressMu = stressMu;
        this.stressSigma = stressSigma;
        this.transitionToStressProbability = transitionToStressProbability;
        this.transitionToCalmProbability = transitionToCalmProbability;
    }

    public StressSeriesGenerator() {
        this(0.4, 0.05, 0.8, 0.1, 0.01, 0.3);
    }

    /**
     * @param length number of daily readings
     * @param seed   random seed
     * @return scalar readings and the days on which the regime changed
     */
    public StressSeries generateSeries(int length, long seed) {
        StressSeries rows = generateFeatures(length, 1, seed);
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = rows.getFeatures()[i][0];
        }
        return new StressSeries(values, null, rows.getChangeIndices());
    }

    /**
     * @param length     number of daily readings
     * @param dimensions number of features per reading
     * @param seed       random seed
     * @return feature vectors and the days on which the regime changed; the scalar
     *         values are the mean of each vector
     */
    public StressSeries generateFeatures(int length, int dimensions, long seed) {
        double[][] features = new double[length][dimensions];
        double[] values = new double[length];
        int[] changes = new int[length];
        int numberOfChanges = 0;
        boolean stressed = false;

        Random random = new Random(seed);
        NormalDistribution dist = new NormalDistribution(new Random(seed + 1));

        for (int i = 0; i < length; i++) {
            if (!stressed) {
                fillRow(features[i], dist, calmMu, calmSigma);
                if (random.nextDouble() < transitionToStressProbability) {
                    changes[numberOfChanges++] = i + 1; // next reading is in the other regime
                    stressed = true;
                }
            } else {
                fillRow(features[i], dist, stressMu, stressSigma);
                if (random.nextDouble() < transitionToCalmProbability) {
                    changes[numberOfChanges++] = i + 1;
                    stressed = false;
                }
            }
            values[i] = Arrays.stream(features[i]).average().orElse(0);
        }

        return new StressSeries(values, features, Arrays.copyOf(changes, numberOfChanges));
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller, two variates per pair of uniforms
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(1 - u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
