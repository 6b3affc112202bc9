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

package com.hbc.anomaly.returntypes;

import static com.hbc.anomaly.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * The results of all three layers for one observation of a subject.
 */
@Getter
public class LayeredAnomalyResult {

    private final String subject;

    private final StaticZScoreResult staticZScore;

    private final SeasonalResidualResult seasonalResidual;

    private final DiagonalDistanceResult diagonalDistance;

    public LayeredAnomalyResult(String subject, StaticZScoreResult staticZScore,
            SeasonalResidualResult seasonalResidual, DiagonalDistanceResult diagonalDistance) {
        this.subject = subject;
        this.staticZScore = checkNotNull(staticZScore, "staticZScore must not be null");
        this.seasonalResidual = checkNotNull(seasonalResidual, "seasonalResidual must not be null");
        this.diagonalDistance = checkNotNull(diagonalDistance, "diagonalDistance must not be null");
    }

    /**
     * @return the number of layers (0 to 3) that raised at least one flag
     */
    public int getAnomalyLayerCount() {
        int count = 0;
        if (staticZScore.isAnomaly()) {
            count++;
        }
        if (seasonalResidual.isAnomaly()) {
            count++;
        }
        if (diagonalDistance.isAnomaly()) {
            count++;
        }
        return count;
    }

    public boolean isAnomaly() {
        return getAnomalyLayerCount() > 0;
    }
}
