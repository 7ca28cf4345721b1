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

package dev.mars.scanfleet.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import dev.mars.scanfleet.network.Ipv4;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The merged, logical outcome of one execution of a scan configuration across
 * every agent that contributed to it.
 *
 * <p>Instances are mutated only by the result aggregator, which serialises all
 * merges for a given id. Readers get immutable snapshots of the collections.
 * Once {@link #getStatus()} is terminal the aggregator refuses further merges.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregatedResult {

    @JsonProperty("id")
    private String id;

    @JsonProperty("scan_id")
    private String scanConfigId;

    @JsonProperty("task_group_id")
    private String taskGroupId;

    @JsonProperty("status")
    private volatile ResultStatus status = ResultStatus.PENDING;

    @JsonProperty("coverage")
    private volatile Coverage coverage = Coverage.FULL;

    private volatile SortedMap<String, HostResult> hosts =
            Collections.unmodifiableSortedMap(new TreeMap<>(Ipv4.ADDRESS_ORDER));

    private volatile ResultCounters counters = ResultCounters.EMPTY;

    private final Set<String> contributingAgents = Collections.synchronizedSet(new TreeSet<>());

    private final Map<String, Integer> reportedErrorTargets = new HashMap<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private volatile Instant startedAt;

    @JsonProperty("completed_at")
    private volatile Instant completedAt;

    @JsonProperty("error_message")
    private volatile String errorMessage;

    public AggregatedResult() {
    }

    public AggregatedResult(String id, String scanConfigId, String taskGroupId, Instant createdAt) {
        this.id = id;
        this.scanConfigId = scanConfigId;
        this.taskGroupId = taskGroupId;
        this.createdAt = createdAt;
    }

    /**
     * Moves this result to a new status. Leaving {@code PENDING} stamps
     * {@code completedAt}.
     *
     * @throws InvalidTransitionException if the result is already terminal
     */
    public synchronized void transitionTo(ResultStatus target, Instant at) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        if (target.isTerminal()) {
            completedAt = at;
        }
        status = target;
    }

    public String getId() {
        return id;
    }

    public String getScanConfigId() {
        return scanConfigId;
    }

    public String getTaskGroupId() {
        return taskGroupId;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public Coverage getCoverage() {
        return coverage;
    }

    public void setCoverage(Coverage coverage) {
        this.coverage = coverage;
    }

    @JsonProperty("hosts")
    public SortedMap<String, HostResult> getHosts() {
        return hosts;
    }

    /**
     * Replaces the per-target map with a merged snapshot.
     */
    public void replaceHosts(Map<String, HostResult> merged) {
        TreeMap<String, HostResult> copy = new TreeMap<>(Ipv4.ADDRESS_ORDER);
        copy.putAll(merged);
        this.hosts = Collections.unmodifiableSortedMap(copy);
    }

    @JsonIgnore
    public ResultCounters getCounters() {
        return counters;
    }

    public void applyCounters(ResultCounters counters) {
        this.counters = counters;
    }

    @JsonProperty("total_targets")
    public int getTotalTargets() {
        return counters.totalTargets();
    }

    @JsonProperty("completed_targets")
    public int getCompletedTargets() {
        return counters.completedTargets();
    }

    @JsonProperty("failed_targets")
    public int getFailedTargets() {
        return counters.failedTargets();
    }

    @JsonProperty("total_open_ports")
    public int getTotalOpenPorts() {
        return counters.totalOpenPorts();
    }

    @JsonProperty("contributing_clients")
    public Set<String> getContributingAgents() {
        synchronized (contributingAgents) {
            return Collections.unmodifiableSet(new TreeSet<>(contributingAgents));
        }
    }

    /**
     * @return true if the agent was not already recorded as a contributor
     */
    public boolean addContributingAgent(String agentId) {
        return contributingAgents.add(agentId);
    }

    /**
     * Records the error-target count an agent reported in its latest summary.
     * Later reports from the same agent replace earlier ones.
     */
    public synchronized void recordReportedErrors(String agentId, int errorTargets) {
        reportedErrorTargets.put(agentId, errorTargets);
    }

    @JsonIgnore
    public synchronized int getReportedErrorTargets() {
        int total = 0;
        for (int count : reportedErrorTargets.values()) {
            total += count;
        }
        return total;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void markStarted(Instant at) {
        if (startedAt == null) {
            startedAt = at;
        }
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    @Override
    public String toString() {
        return "AggregatedResult{id='" + id + "', scan='" + scanConfigId + "', status=" + status
                + ", hosts=" + hosts.size() + '}';
    }
}
