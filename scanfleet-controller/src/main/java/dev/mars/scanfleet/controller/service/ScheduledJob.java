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

import java.time.Instant;

/**
 * A recurring scan the scheduler currently holds a timer for.
 */
public record ScheduledJob(
        @JsonProperty("id") String jobId,
        @JsonProperty("scan_id") String scanConfigId,
        @JsonProperty("name") String name,
        @JsonProperty("interval_minutes") int intervalMinutes,
        @JsonProperty("next_run_time") Instant nextRun) {

    static String jobIdFor(String scanConfigId) {
        return "scan_" + scanConfigId;
    }
}
