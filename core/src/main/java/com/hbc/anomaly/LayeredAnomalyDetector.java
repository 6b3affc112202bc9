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

package com.hbc.anomaly;

import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.LinkedHashSet;
import java.util.Set;

import com.hbc.anomaly.returntypes.DiagonalDistanceResult;
import com.hbc.anomaly.returntypes.LayeredAnomalyResult;
import com.hbc.anomaly.returntypes.SeasonalResidualResult;
import com.hbc.anomaly.returntypes.StaticZScoreResult;
import com.hbc.anomaly.tracker.DiagonalDistanceTracker;
import com.hbc.anomaly.tracker.SeasonalResidualTracker;
import com.hbc.anomaly.tracker.StaticZScoreTracker;

/**
 * Runs the three layers side by side. The scalar reading of a subject goes to
 * the static and seasonal layers, its feature vector (when there is one) to
 * the multivariate layer. The layers share nothing; each keeps its own history
 * of the subject and can also be used on its own.
 */
public class LayeredAnomalyDetector {

    private final StaticZScoreTracker staticZScoreTracker;

    private final SeasonalResidualTracker seasonalResidualTracker;

    private final DiagonalDistanceTracker diagonalDistanceTracker;

    public LayeredAnomalyDetector(StaticZScoreTracker staticZScoreTracker,
            SeasonalResidualTracker seasonalResidualTracker, DiagonalDistanceTracker diagonalDistanceTracker) {
        this.staticZScoreTracker = checkNotNull(staticZScoreTracker, "staticZScoreTracker must not be null");
        this.seasonalResidualTracker = checkNotNull(seasonalResidualTracker,
                "seasonalResidualTracker must not be null");
        this.diagonalDistanceTracker = checkNotNull(diagonalDistanceTracker,
                "diagonalDistanceTracker must not be null");
    }

    /**
     * @return a detector whose layers all use their default configuration
     */
    public static LayeredAnomalyDetector withDefaults() {
        return new LayeredAnomalyDetector(StaticZScoreTracker.builder().build(),
                SeasonalResidualTracker.builder().build(), DiagonalDistanceTracker.builder().build());
    }

    /**
     * Feeds one observation of a subject to every layer.
     *
     * @param subject  the subject key, not null
     * @param value    the scalar reading
     * @param features the feature vector, or null when the subject has none; the
     *                 multivariate layer then reports its empty result and keeps
     *                 its history unchanged
     * @return the results of the three layers
     */
    public LayeredAnomalyResult update(String subject, double value, double[] features) {
        checkNotNull(subject, "subject must not be null");
        StaticZScoreResult staticResult = staticZScoreTracker.update(subject, value);
        SeasonalResidualResult seasonalResult = seasonalResidualTracker.update(subject, value);
        DiagonalDistanceResult distanceResult = (features == null) ? diagonalDistanceTracker.getEmptyResult()
                : diagonalDistanceTracker.update(subject, features);
        return new LayeredAnomalyResult(subject, staticResult, seasonalResult, distanceResult);
    }

    public LayeredAnomalyResult update(String subject, double value) {
        return update(subject, value, null);
    }

    /**
     * Drops the history of a subject from every layer.
     *
     * @param subject the subject key
     * @return true if any layer knew the subject
     */
    public boolean forget(String subject) {
        boolean removed = staticZScoreTracker.forget(subject);
        removed |= seasonalResidualTracker.forget(subject);
        removed |= diagonalDistanceTracker.forget(subject);
        return removed;
    }

    /**
     * @return the subjects known to at least one layer
     */
    public Set<String> getSubjects() {
        Set<String> subjects = new LinkedHashSet<>(staticZScoreTracker.getSubjects());
        subjects.addAll(seasonalResidualTracker.getSubjects());
        subjects.addAll(diagonalDistanceTracker.getSubjects());
        return subjects;
    }

    public StaticZScoreTracker getStaticZScoreTracker() {
        return staticZScoreTracker;
    }

    public SeasonalResidualTracker getSeasonalResidualTracker() {
        return seasonalResidualTracker;
    }

    public DiagonalDistanceTracker getDiagonalDistanceTracker() {
        return diagonalDistanceTracker;
    }
}
