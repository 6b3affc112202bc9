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

package com.hbc.anomaly.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.hbc.anomaly.LayeredAnomalyDetector;
import com.hbc.anomaly.returntypes.DiagonalDistanceResult;
import com.hbc.anomaly.returntypes.LayeredAnomalyResult;
import com.hbc.anomaly.returntypes.SeasonalResidualResult;
import com.hbc.anomaly.returntypes.StaticZScoreResult;

/**
 * A command-line application that runs the three anomaly layers over rows of
 * {@code subject,value[,feature...]}. Rows are read from STDIN and output is
 * written to STDOUT. Output consists of the original row with the metrics of
 * every layer appended.
 */
public class LayeredAnomalyRunner extends SimpleRunner {

    public LayeredAnomalyRunner() {
        super(LayeredAnomalyRunner.class.getName(),
                "Compute static, seasonal and multivariate anomaly metrics per subject and append them to the "
                        + "output rows.",
                LayeredAnomalyTransformer::new);
    }

    public static void main(String... args) throws IOException {
        LayeredAnomalyRunner runner = new LayeredAnomalyRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public static class LayeredAnomalyTransformer implements LineTransformer {

        static final List<String> COLUMN_NAMES = Collections.unmodifiableList(Arrays.asList("static_upper_bound",
                "static_lower_bound", "static_anomaly", "zscore", "zscore_anomaly", "baseline", "upper_band",
                "lower_band", "residual", "residual_zscore", "seasonal_anomaly", "residual_anomaly", "md_score",
                "md_anomaly"));

        private final LayeredAnomalyDetector detector;

        public LayeredAnomalyTransformer(LayeredAnomalyDetector detector) {
            this.detector = detector;
        }

        @Override
        public List<String> getResultValues(String subject, double value, double[] features) {
            return toColumns(detector.update(subject, value, features));
        }

        @Override
        public List<String> getEmptyResultValue() {
            return toColumns(new LayeredAnomalyResult(null, StaticZScoreResult.empty(),
                    SeasonalResidualResult.empty(), DiagonalDistanceResult.empty()));
        }

        @Override
        public List<String> getResultColumnNames() {
            return COLUMN_NAMES;
        }

        @Override
        public LayeredAnomalyDetector getDetector() {
            return detector;
        }

        static List<String> toColumns(LayeredAnomalyResult result) {
            StaticZScoreResult staticResult = result.getStaticZScore();
            SeasonalResidualResult seasonalResult = result.getSeasonalResidual();
            DiagonalDistanceResult distanceResult = result.getDiagonalDistance();
            return Arrays.asList(Double.toString(staticResult.getStaticUpperBound()),
                    Double.toString(staticResult.getStaticLowerBound()),
                    Integer.toString(staticResult.getStaticAnomaly()), Double.toString(staticResult.getZscore()),
                    Integer.toString(staticResult.getZscoreAnomaly()), Double.toString(seasonalResult.getBaseline()),
                    Double.toString(seasonalResult.getUpperBand()), Double.toString(seasonalResult.getLowerBand()),
                    Double.toString(seasonalResult.getResidual()),
                    Double.toString(seasonalResult.getResidualZscore()),
                    Integer.toString(seasonalResult.getSeasonalAnomaly()),
                    Integer.toString(seasonalResult.getResidualAnomaly()),
                    Double.toString(distanceResult.getScore()), Integer.toString(distanceResult.getAnomaly()));
        }
    }
}
