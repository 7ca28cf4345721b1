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

import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import dev.mars.scanfleet.controller.service.AgentRegistryService.EligibleAgent;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.Coverage;
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.ScanTask;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.network.TargetSpec;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Splits a scan's target set across the eligible agents and sends each agent its
 * work order.
 *
 * <p>Assignment is greedy in registration order: every agent takes the still
 * unassigned targets inside its owned range, so overlapping ranges go to the agent
 * that registered first and no target is sent twice. Targets no eligible agent owns
 * stay unscanned and the result is marked {@link Coverage#PARTIAL}.</p>
 *
 * <p>Result and task records exist before the first work order leaves, so a fast
 * agent can submit before its work-order reply has arrived.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class TaskDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(TaskDispatcher.class);

    static final String WORK_ORDER_PATH = "/scan";

    private final WebClient webClient;
    private final ScanFleetStateStore store;
    private final AgentRegistryService registry;
    private final ResultAggregator aggregator;
    private final ControllerMetrics metrics;
    private final Clock clock;
    private final long dispatchTimeoutMs;
    private final int maxTargetAddresses;

    public TaskDispatcher(WebClient webClient, ScanFleetStateStore store, AgentRegistryService registry,
                          ResultAggregator aggregator, ControllerMetrics metrics, Clock clock,
                          long dispatchTimeoutMs, int maxTargetAddresses) {
        this.webClient = webClient;
        this.store = store;
        this.registry = registry;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.clock = clock;
        this.dispatchTimeoutMs = dispatchTimeoutMs;
        this.maxTargetAddresses = maxTargetAddresses;
    }

    /**
     * Dispatches one execution of a scan configuration. The returned future always
     * succeeds; every failure mode is a {@link DispatchOutcome} kind.
     */
    public Future<DispatchOutcome> dispatch(ScanConfig config) {
        TargetSpec target;
        List<String> addresses;
        try {
            target = TargetSpec.parse(config.getTarget());
            addresses = target.enumerate(maxTargetAddresses);
        } catch (ValidationException e) {
            logger.warn("Cannot dispatch scan {}: {}", config.getId(), e.getMessage());
            metrics.recordDispatch("invalid_target");
            return Future.succeededFuture(DispatchOutcome.invalidTarget(config.getId(), e.getMessage()));
        }

        List<Assignment> assignments = assign(addresses, registry.eligibleAgents(target));
        if (assignments.isEmpty()) {
            logger.warn("No eligible agents for scan {} (target={})", config.getId(), config.getTarget());
            metrics.recordDispatch("no_eligible_agents");
            return Future.succeededFuture(DispatchOutcome.noEligibleAgents(config.getId(), addresses.size()));
        }

        Instant now = clock.instant();
        String taskGroupId = UUID.randomUUID().toString();
        AggregatedResult result = new AggregatedResult(UUID.randomUUID().toString(), config.getId(), taskGroupId, now);
        List<ScanTask> tasks = new ArrayList<>();
        for (Assignment assignment : assignments) {
            tasks.add(new ScanTask(UUID.randomUUID().toString(), taskGroupId, config.getId(), result.getId(),
                    assignment.agent().agentId(), assignment.targets(), now));
        }
        store.putResult(result);
        store.putTasks(tasks);

        logger.info("Dispatching scan {}: result={}, targets={}, agents={}",
                config.getId(), result.getId(), addresses.size(), tasks.size());

        List<Future<Delivery>> deliveries = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            deliveries.add(sendWorkOrder(config, assignments.get(i).agent(), tasks.get(i)));
        }

        return Future.join(deliveries).map(joined -> {
            List<String> dispatched = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            int assignedTargets = 0;
            for (Future<Delivery> future : deliveries) {
                Delivery delivery = future.result();
                if (delivery.accepted()) {
                    dispatched.add(delivery.task().getAgentId());
                    assignedTargets += delivery.task().getTargets().size();
                } else {
                    failed.add(delivery.task().getAgentId());
                }
            }
            return complete(config, result, addresses.size(), assignedTargets, dispatched, failed);
        });
    }

    /**
     * Greedy assignment of the enumerated targets to agents in registry order.
     */
    static List<Assignment> assign(List<String> addresses, List<EligibleAgent> agents) {
        Set<String> residual = new LinkedHashSet<>(addresses);
        List<Assignment> assignments = new ArrayList<>();
        for (EligibleAgent agent : agents) {
            if (residual.isEmpty()) {
                break;
            }
            List<String> owned = residual.stream().filter(agent.ownedRange()::contains).toList();
            if (owned.isEmpty()) {
                continue;
            }
            owned.forEach(residual::remove);
            assignments.add(new Assignment(agent, owned));
        }
        return assignments;
    }

    private Future<Delivery> sendWorkOrder(ScanConfig config, EligibleAgent agent, ScanTask task) {
        JsonObject workOrder = new JsonObject()
                .put("scan_id", config.getId())
                .put("task_id", task.getId())
                .put("result_id", task.getResultId())
                .put("targets", new JsonArray(task.getTargets()))
                .put("ports", config.getPorts())
                .put("scan_arguments", config.getScanArguments());

        String url = agent.agent().getBaseUrl() + WORK_ORDER_PATH;
        return webClient.postAbs(url)
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(workOrder)
                .timeout(dispatchTimeoutMs, TimeUnit.MILLISECONDS)
                .map(response -> {
                    if (response.statusCode() / 100 == 2) {
                        aggregator.markAssigned(task.getResultId(), task.getId());
                        registry.markScanning(task.getAgentId());
                        metrics.recordTaskDispatched();
                        logger.debug("Work order accepted: agentId={}, taskId={}, targets={}",
                                task.getAgentId(), task.getId(), task.getTargets().size());
                        return new Delivery(task, true);
                    }
                    return unreachable(task, "Agent replied HTTP " + response.statusCode());
                })
                .recover(err -> Future.succeededFuture(unreachable(task, "Agent unreachable: " + err.getMessage())));
    }

    private Delivery unreachable(ScanTask task, String error) {
        logger.warn("Work order failed: agentId={}, taskId={}: {}", task.getAgentId(), task.getId(), error);
        metrics.recordAgentUnreachable();
        aggregator.markDispatchFailed(task.getResultId(), task.getId(), error);
        return new Delivery(task, false);
    }

    private DispatchOutcome complete(ScanConfig config, AggregatedResult result, int totalTargets,
                                     int assignedTargets, List<String> dispatched, List<String> failed) {
        if (dispatched.isEmpty()) {
            if (aggregator.discard(result.getId(), result.getTaskGroupId())) {
                logger.warn("Dispatch of scan {} reached no agent, rolled back result {}",
                        config.getId(), result.getId());
            } else {
                logger.warn("Work order replies for scan {} failed after result {} finished, keeping it",
                        config.getId(), result.getId());
            }
            metrics.recordDispatch("dispatch_failed");
            return DispatchOutcome.dispatchFailed(config.getId(), totalTargets, failed);
        }

        Coverage coverage = assignedTargets == totalTargets ? Coverage.FULL : Coverage.PARTIAL;
        result.setCoverage(coverage);
        aggregator.refreshStatus(result.getId());

        logger.info("Scan {} dispatched: result={}, agents={}, failed={}, coverage={} ({}/{} targets)",
                config.getId(), result.getId(), dispatched, failed, coverage, assignedTargets, totalTargets);
        metrics.recordDispatch("dispatched");
        return DispatchOutcome.dispatched(config.getId(), result.getId(), result.getTaskGroupId(),
                totalTargets, assignedTargets, dispatched, failed, coverage);
    }

    record Assignment(EligibleAgent agent, List<String> targets) {
    }

    private record Delivery(ScanTask task, boolean accepted) {
    }
}
