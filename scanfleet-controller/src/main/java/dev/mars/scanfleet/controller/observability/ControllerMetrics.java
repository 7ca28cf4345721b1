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

package dev.mars.scanfleet.controller.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry counters for the controller's scan pipeline.
 *
 * <p>Provides the following metrics:
 * <ul>
 *   <li>scanfleet.dispatch.executions (counter, by outcome) - dispatch attempts</li>
 *   <li>scanfleet.dispatch.tasks (counter) - work orders accepted by agents</li>
 *   <li>scanfleet.dispatch.unreachable (counter) - work orders that failed</li>
 *   <li>scanfleet.results.submissions (counter, by outcome) - agent result submissions</li>
 *   <li>scanfleet.deltas.generated (counter) - delta reports written</li>
 *   <li>scanfleet.heartbeats (counter, by approval) - agent heartbeats</li>
 *   <li>scanfleet.agents.demoted (counter) - agents demoted by the heartbeat monitor</li>
 * </ul>
 *
 * <p>Gauges over the stored entities live in the state store. Local totals are kept
 * alongside each counter so the stats endpoint can report them without an exporter.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-01-30
 */
public class ControllerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ControllerMetrics.class);
    private static final String METER_NAME = "scanfleet-controller";

    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<Boolean> APPROVED_KEY = AttributeKey.booleanKey("approved");

    private final LongCounter dispatchCounter;
    private final LongCounter tasksDispatchedCounter;
    private final LongCounter unreachableCounter;
    private final LongCounter submissionCounter;
    private final LongCounter deltaCounter;
    private final LongCounter heartbeatCounter;
    private final LongCounter demotedCounter;

    private final AtomicLong dispatches = new AtomicLong();
    private final AtomicLong submissions = new AtomicLong();
    private final AtomicLong deltasGenerated = new AtomicLong();
    private final AtomicLong agentsDemoted = new AtomicLong();

    public ControllerMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public ControllerMetrics(Meter meter) {
        dispatchCounter = meter.counterBuilder("scanfleet.dispatch.executions")
                .setDescription("Scan dispatch attempts by outcome")
                .setUnit("1")
                .build();

        tasksDispatchedCounter = meter.counterBuilder("scanfleet.dispatch.tasks")
                .setDescription("Work orders accepted by agents")
                .setUnit("1")
                .build();

        unreachableCounter = meter.counterBuilder("scanfleet.dispatch.unreachable")
                .setDescription("Work orders that could not be delivered")
                .setUnit("1")
                .build();

        submissionCounter = meter.counterBuilder("scanfleet.results.submissions")
                .setDescription("Result submissions by outcome")
                .setUnit("1")
                .build();

        deltaCounter = meter.counterBuilder("scanfleet.deltas.generated")
                .setDescription("Delta reports generated")
                .setUnit("1")
                .build();

        heartbeatCounter = meter.counterBuilder("scanfleet.heartbeats")
                .setDescription("Agent heartbeats received")
                .setUnit("1")
                .build();

        demotedCounter = meter.counterBuilder("scanfleet.agents.demoted")
                .setDescription("Agents demoted to offline after missing heartbeats")
                .setUnit("1")
                .build();

        logger.debug("ControllerMetrics initialized");
    }

    public void recordDispatch(String outcome) {
        dispatches.incrementAndGet();
        dispatchCounter.add(1, Attributes.of(OUTCOME_KEY, outcome));
    }

    public void recordTaskDispatched() {
        tasksDispatchedCounter.add(1);
    }

    public void recordAgentUnreachable() {
        unreachableCounter.add(1);
    }

    public void recordSubmission(String outcome) {
        submissions.incrementAndGet();
        submissionCounter.add(1, Attributes.of(OUTCOME_KEY, outcome));
    }

    public void recordDeltaGenerated() {
        deltasGenerated.incrementAndGet();
        deltaCounter.add(1);
    }

    public void recordHeartbeat(boolean approved) {
        heartbeatCounter.add(1, Attributes.of(APPROVED_KEY, approved));
    }

    public void recordAgentsDemoted(int count) {
        if (count > 0) {
            agentsDemoted.addAndGet(count);
            demotedCounter.add(count);
        }
    }

    public long getDispatches() {
        return dispatches.get();
    }

    public long getSubmissions() {
        return submissions.get();
    }

    public long getDeltasGenerated() {
        return deltasGenerated.get();
    }

    public long getAgentsDemoted() {
        return agentsDemoted.get();
    }
}
