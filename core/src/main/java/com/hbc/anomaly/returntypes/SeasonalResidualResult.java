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

import lombok.Builder;
import lombok.Getter;

/**
 * Result of one update of the seasonal baseline tracker. The baseline is the
 * exponentially weighted average after folding in the current value, the bands
 * are centered on it and the residual is the distance of the value from it.
 */
@Getter
@Builder
public class SeasonalResidualResult {

    private static final SeasonalResidualResult EMPTY = builder().build();

    private final double baseline;

    private final double upperBand;

    private final double lowerBand;

    private final double residual;

    private final double residualZscore;

    // 1 if the value is outside [lowerBand, upperBand]
    private final int seasonalAnomaly;

    // 1 if the residual z-score exceeds the configured factor in absolute value
    private final int residualAnomaly;

    public static SeasonalResidualResult empty() {
        return EMPTY;
    }

    public boolean isAnomaly() {
        return seasonalAnomaly == 1 || residualAnomaly == 1;
    }
}
