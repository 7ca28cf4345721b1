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

package dev.mars.scanfleet.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary figures an agent attaches to a submission. Only {@code errorTargets}
 * feeds the aggregated counters; the rest is informational.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SummaryStats(
        @JsonProperty("total_targets") int totalTargets,
        @JsonProperty("up_targets") int upTargets,
        @JsonProperty("down_targets") int downTargets,
        @JsonProperty("error_targets") int errorTargets,
        @JsonProperty("total_open_ports") int totalOpenPorts) {

    public static final SummaryStats EMPTY = new SummaryStats(0, 0, 0, 0, 0);
}
