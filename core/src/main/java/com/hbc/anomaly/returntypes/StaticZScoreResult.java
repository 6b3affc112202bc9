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
 * Result of one update of the static bound and z-score tracker. Flags are 0 or
 * 1.
 */
@Getter
@Builder
public class StaticZScoreResult {

    private static final StaticZScoreResult EMPTY = builder().build();

    // the value at the upper percentile of the window
    private final double staticUpperBound;

    // the value at the lower percentile of the window
    private final double staticLowerBound;

    private final int staticAnomaly;

    private final double zscore;

    private final int zscoreAnomaly;

    /**
     * @return the result reported for malformed input: zero bounds, zero score
     *         and no flags
     */
    public static StaticZScoreResult empty() {
        return EMPTY;
    }

    public boolean isAnomaly() {
        return staticAnomaly == 1 || zscoreAnomaly == 1;
    }
}
