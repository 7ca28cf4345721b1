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

import java.time.LocalDate;
import java.util.List;

/**
 * Totals of delta report counts for one scan configuration over a window of days.
 */
public record ChangeSummary(
        @JsonProperty("scan_id") String scanConfigId,
        @JsonProperty("days") int days,
        @JsonProperty("total_reports") int totalReports,
        @JsonProperty("reports_with_changes") int reportsWithChanges,
        @JsonProperty("total_new_ports") int totalNewPorts,
        @JsonProperty("total_closed_ports") int totalClosedPorts,
        @JsonProperty("total_changed_services") int totalChangedServices,
        @JsonProperty("total_new_hosts") int totalNewHosts,
        @JsonProperty("total_removed_hosts") int totalRemovedHosts,
        @JsonProperty("timeline") List<Day> timeline) {

    public ChangeSummary {
        timeline = List.copyOf(timeline);
    }

    /**
     * Counts for one UTC calendar day. Days without reports are omitted.
     */
    public record Day(
            @JsonProperty("date") LocalDate date,
            @JsonProperty("reports") int reports,
            @JsonProperty("new_ports") int newPorts,
            @JsonProperty("closed_ports") int closedPorts,
            @JsonProperty("changed_services") int changedServices) {
    }
}
