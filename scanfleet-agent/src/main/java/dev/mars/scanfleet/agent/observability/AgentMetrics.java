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

package dev.mars.scanfleet.agent.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the ScanFleet agent.
 *
 * Provides:
 * - scanfleet.agent.status (gauge) - Agent status (0=stopped, 1=pending approval, 2=approved)
 * - scanfleet.agent.heartbeats.total (counter) - Heartbeats sent, by outcome
 * - scanfleet.agent.work_orders.total (counter) - Work orders received, by outcome
 * - scanfleet.agent.scans.active (gauge) - Scans currently running
 * - scanfleet.agent.scans.completed (counter) - Finished scans, by final status
 * - scanfleet.agent.targets.scanned (counter) - Target addresses probed
 * - scanfleet.agent.submissions.total (counter) - Result submission attempts, by outcome
 *
 * <p>Records against {@link GlobalOpenTelemetry}, which is a no-op until an SDK is registered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "scanfleet-agent";

    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");

    private final LongCounter heartbeatsTotal;
    private final LongCounter workOrdersTotal;
    private final LongCounter scansCompleted;
    private final LongCounter targetsScanned;
    private final LongCounter submissionsTotal;

    private final AtomicLong agentStatus = new AtomicLong(0);
    private final AtomicLong activeScans = new AtomicLong(0);

    private final String agentId;

    public AgentMetrics(String agentId) {
        this.agentId = agentId;

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        heartbeatsTotal = meter.counterBuilder("scanfleet.agent.heartbeats.total")
                .setDescription("Heartbeats sent to the controller")
                .setUnit("1")
                .build();

        workOrdersTotal = meter.counterBuilder("scanfleet.agent.work_orders.total")
                .setDescription("Work orders received from the controller")
                .setUnit("1")
                .build();

        scansCompleted = meter.counterBuilder("scanfleet.agent.scans.completed")
                .setDescription("Scans finished by this agent")
                .setUnit("1")
                .build();

        targetsScanned = meter.counterBuilder("scanfleet.agent.targets.scanned")
                .setDescription("Target addresses probed")
                .setUnit("1")
                .build();

        submissionsTotal = meter.counterBuilder("scanfleet.agent.submissions.total")
                .setDescription("Result submission attempts")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("scanfleet.agent.status")
                .setDescription("Agent status (0=stopped, 1=pending approval, 2=approved)")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(agentStatus.get(), Attributes.of(AGENT_ID_KEY, agentId)));

        meter.gaugeBuilder("scanfleet.agent.scans.active")
                .setDescription("Scans currently running")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(activeScans.get(), Attributes.of(AGENT_ID_KEY, agentId)));

        logger.info("AgentMetrics initialized for agent: {}", agentId);
    }

    public void setStatusStopped() {
        agentStatus.set(0);
    }

    public void setStatusPending() {
        agentStatus.set(1);
    }

    public void setStatusApproved() {
        agentStatus.set(2);
    }

    public void recordHeartbeat(String outcome) {
        heartbeatsTotal.add(1, Attributes.of(AGENT_ID_KEY, agentId, OUTCOME_KEY, outcome));
    }

    public void recordWorkOrder(String outcome) {
        workOrdersTotal.add(1, Attributes.of(AGENT_ID_KEY, agentId, OUTCOME_KEY, outcome));
    }

    public void scanStarted() {
        activeScans.incrementAndGet();
    }

    public void scanFinished(String status) {
        activeScans.decrementAndGet();
        scansCompleted.add(1, Attributes.of(AGENT_ID_KEY, agentId, STATUS_KEY, status));
    }

    public void recordTargetsScanned(int count) {
        targetsScanned.add(count, Attributes.of(AGENT_ID_KEY, agentId));
    }

    public void recordSubmission(String outcome) {
        submissionsTotal.add(1, Attributes.of(AGENT_ID_KEY, agentId, OUTCOME_KEY, outcome));
    }
}
