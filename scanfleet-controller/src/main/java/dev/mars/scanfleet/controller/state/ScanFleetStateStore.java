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

package dev.mars.scanfleet.controller.state;

import dev.mars.scanfleet.agent.AgentInfo;
import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.ScanTask;
import dev.mars.scanfleet.core.TaskStatus;
import dev.mars.scanfleet.delta.DeltaReport;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store for every entity the controller owns: agents, scan
 * configurations, tasks, aggregated results and delta reports.
 *
 * <p>Maps are concurrent; the store does no cross-entity locking. Services that
 * need a consistent multi-entity update (the aggregator merging a submission,
 * the registry mutating an agent) hold their own locks around it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */
public class ScanFleetStateStore {

    private static final Logger logger = LoggerFactory.getLogger(ScanFleetStateStore.class);
    private static final AttributeKey<String> STATE_KEY = AttributeKey.stringKey("state");

    private final Map<String, AgentInfo> agents = new ConcurrentHashMap<>();
    private final Map<String, ScanConfig> scanConfigs = new ConcurrentHashMap<>();
    private final Map<String, ScanTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, AggregatedResult> results = new ConcurrentHashMap<>();
    private final Map<String, DeltaReport> deltaReports = new ConcurrentHashMap<>();
    private final Map<String, String> deltaReportsByPair = new ConcurrentHashMap<>();
    private final AtomicLong registrationSequence = new AtomicLong();

    public ScanFleetStateStore() {
        Meter meter = GlobalOpenTelemetry.getMeter("scanfleet-controller");

        meter.gaugeBuilder("scanfleet.agents.total")
                .setDescription("Number of agents by lifecycle state")
                .ofLongs()
                .buildWithCallback(measurement -> {
                    for (AgentState state : AgentState.values()) {
                        long count = agents.values().stream().filter(a -> a.getState() == state).count();
                        measurement.record(count, Attributes.of(STATE_KEY, state.getValue()));
                    }
                });

        meter.gaugeBuilder("scanfleet.scans.total")
                .setDescription("Number of scan configurations")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(scanConfigs.size()));

        meter.gaugeBuilder("scanfleet.results.pending")
                .setDescription("Aggregated results still waiting on agents")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(
                        results.values().stream().filter(r -> !r.getStatus().isTerminal()).count()));

        meter.gaugeBuilder("scanfleet.deltas.total")
                .setDescription("Number of stored delta reports")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(deltaReports.size()));
    }

    // ── Agents ─────────────────────────────────────────────────────────

    /**
     * Inserts the agent if no agent with its id exists yet, stamping its
     * registration sequence.
     *
     * @return the stored agent, which is the existing one if there was a race
     */
    public AgentInfo putAgentIfAbsent(AgentInfo agent) {
        return agents.computeIfAbsent(agent.getAgentId(), id -> {
            agent.setRegistrationSequence(registrationSequence.incrementAndGet());
            logger.debug("Stored new agent: agentId={}, sequence={}", id, agent.getRegistrationSequence());
            return agent;
        });
    }

    public Optional<AgentInfo> findAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * @return all agents in registration order
     */
    public List<AgentInfo> agentsInRegistrationOrder() {
        return agents.values().stream()
                .sorted(Comparator.comparingLong(AgentInfo::getRegistrationSequence))
                .toList();
    }

    public boolean removeAgent(String agentId) {
        return agents.remove(agentId) != null;
    }

    // ── Scan configurations ────────────────────────────────────────────

    public void putScanConfig(ScanConfig config) {
        scanConfigs.put(config.getId(), config);
    }

    public Optional<ScanConfig> findScanConfig(String id) {
        return Optional.ofNullable(scanConfigs.get(id));
    }

    public boolean removeScanConfig(String id) {
        return scanConfigs.remove(id) != null;
    }

    public List<ScanConfig> scanConfigs() {
        return scanConfigs.values().stream()
                .sorted(Comparator.comparing(ScanConfig::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(ScanConfig::getId))
                .toList();
    }

    // ── Tasks ──────────────────────────────────────────────────────────

    public void putTasks(Collection<ScanTask> newTasks) {
        for (ScanTask task : newTasks) {
            tasks.put(task.getId(), task);
        }
    }

    public Optional<ScanTask> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public List<ScanTask> tasksForResult(String resultId) {
        return tasks.values().stream()
                .filter(t -> resultId.equals(t.getResultId()))
                .sorted(Comparator.comparing(ScanTask::getCreatedAt).thenComparing(ScanTask::getId))
                .toList();
    }

    public List<ScanTask> tasks() {
        return List.copyOf(tasks.values());
    }

    public long countTasks(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.getStatus() == status).count();
    }

    /**
     * Removes every task in a group. Only used to roll back a dispatch that
     * reached no agent at all.
     */
    public int removeTaskGroup(String taskGroupId) {
        int before = tasks.size();
        tasks.values().removeIf(t -> taskGroupId.equals(t.getTaskGroupId()));
        return before - tasks.size();
    }

    // ── Aggregated results ─────────────────────────────────────────────

    public void putResult(AggregatedResult result) {
        results.put(result.getId(), result);
    }

    public Optional<AggregatedResult> findResult(String resultId) {
        return Optional.ofNullable(results.get(resultId));
    }

    public boolean removeResult(String resultId) {
        return results.remove(resultId) != null;
    }

    /**
     * @return results of one configuration, oldest first
     */
    public List<AggregatedResult> resultsForScan(String scanConfigId) {
        return results.values().stream()
                .filter(r -> scanConfigId.equals(r.getScanConfigId()))
                .sorted(Comparator.comparing(AggregatedResult::getCreatedAt).thenComparing(AggregatedResult::getId))
                .toList();
    }

    public List<AggregatedResult> results() {
        return List.copyOf(results.values());
    }

    // ── Delta reports ──────────────────────────────────────────────────

    /**
     * Stores a report unless one already exists for the same (baseline, current)
     * pair.
     *
     * @return the stored report, which is the pre-existing one on a duplicate
     */
    public DeltaReport putDeltaReportIfAbsent(DeltaReport report) {
        String pairKey = report.getBaselineResultId() + "->" + report.getCurrentResultId();
        String existingId = deltaReportsByPair.putIfAbsent(pairKey, report.getId());
        if (existingId != null) {
            DeltaReport existing = deltaReports.get(existingId);
            if (existing != null) {
                return existing;
            }
            deltaReportsByPair.put(pairKey, report.getId());
        }
        deltaReports.put(report.getId(), report);
        return report;
    }

    public Optional<DeltaReport> findDeltaReport(String id) {
        return Optional.ofNullable(deltaReports.get(id));
    }

    public Optional<DeltaReport> findDeltaReport(String baselineResultId, String currentResultId) {
        String id = deltaReportsByPair.get(baselineResultId + "->" + currentResultId);
        return id == null ? Optional.empty() : Optional.ofNullable(deltaReports.get(id));
    }

    public boolean removeDeltaReport(String id) {
        DeltaReport removed = deltaReports.remove(id);
        if (removed == null) {
            return false;
        }
        deltaReportsByPair.remove(removed.getBaselineResultId() + "->" + removed.getCurrentResultId(), id);
        return true;
    }

    /**
     * @return reports of one configuration, newest first
     */
    public List<DeltaReport> deltaReportsForScan(String scanConfigId) {
        return deltaReports.values().stream()
                .filter(d -> scanConfigId.equals(d.getScanConfigId()))
                .sorted(Comparator.comparing(DeltaReport::getCreatedAt).reversed()
                        .thenComparing(DeltaReport::getId))
                .toList();
    }
}
