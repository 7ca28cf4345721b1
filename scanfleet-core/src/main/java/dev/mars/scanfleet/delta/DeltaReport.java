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

package dev.mars.scanfleet.delta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable comparison artifact between two aggregated results of the same scan
 * configuration. Created once per (baseline, current) pair and never modified.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class DeltaReport {

    private final String id;
    private final String scanConfigId;
    private final String baselineResultId;
    private final String currentResultId;
    private final Instant createdAt;
    private final DeltaPayload delta;

    public DeltaReport(String id, String scanConfigId, String baselineResultId, String currentResultId,
                       Instant createdAt, DeltaPayload delta) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.scanConfigId = Objects.requireNonNull(scanConfigId, "scanConfigId must not be null");
        this.baselineResultId = Objects.requireNonNull(baselineResultId, "baselineResultId must not be null");
        this.currentResultId = Objects.requireNonNull(currentResultId, "currentResultId must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("scan_id")
    public String getScanConfigId() {
        return scanConfigId;
    }

    @JsonProperty("baseline_result_id")
    public String getBaselineResultId() {
        return baselineResultId;
    }

    @JsonProperty("current_result_id")
    public String getCurrentResultId() {
        return currentResultId;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("new_ports_count")
    public int getNewPortsCount() {
        return delta.newPorts().size();
    }

    @JsonProperty("closed_ports_count")
    public int getClosedPortsCount() {
        return delta.closedPorts().size();
    }

    @JsonProperty("changed_services_count")
    public int getChangedServicesCount() {
        return delta.changedServices().size();
    }

    @JsonProperty("new_hosts_count")
    public int getNewHostsCount() {
        return delta.newHosts().size();
    }

    @JsonProperty("removed_hosts_count")
    public int getRemovedHostsCount() {
        return delta.removedHosts().size();
    }

    @JsonProperty("has_changes")
    public boolean hasChanges() {
        return delta.hasChanges();
    }

    @JsonProperty("delta")
    public DeltaPayload getDelta() {
        return delta;
    }

    /**
     * Newly opened ports that fall in {@link DeltaComparator#CRITICAL_PORTS}.
     */
    @JsonIgnore
    public List<PortChange> criticalPortsOpened() {
        return delta.portsOpenedIn(DeltaComparator.CRITICAL_PORTS);
    }

    @Override
    public String toString() {
        return "DeltaReport{id='" + id + "', baseline='" + baselineResultId + "', current='" + currentResultId
                + "', newPorts=" + getNewPortsCount() + ", closedPorts=" + getClosedPortsCount()
                + ", changedServices=" + getChangedServicesCount() + ", newHosts=" + getNewHostsCount()
                + ", removedHosts=" + getRemovedHostsCount() + '}';
    }
}
