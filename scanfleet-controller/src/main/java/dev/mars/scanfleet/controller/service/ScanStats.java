/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.scanfleet.controller.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution statistics of one scan configuration.
 *
 * @param resultCount    executions recorded for the configuration
 * @param completedCount executions that ended {@code completed}
 */
public record ScanStats(
        @JsonProperty("result_count") int resultCount,
        @JsonProperty("completed_count") int completedCount) {

    public static final ScanStats EMPTY = new ScanStats(0, 0);

    /**
     * Completed executions as a percentage of all executions, 0 when there are none.
     */
    @JsonProperty("success_rate")
    public double successRate() {
        return resultCount == 0 ? 0.0 : completedCount * 100.0 / resultCount;
    }
}
