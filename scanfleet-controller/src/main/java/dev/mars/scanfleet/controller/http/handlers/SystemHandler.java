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

package dev.mars.scanfleet.controller.http.handlers;

import dev.mars.scanfleet.agent.AgentInfo;
import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.controller.http.ApiJson;
import dev.mars.scanfleet.controller.http.DrainModeHandler;
import dev.mars.scanfleet.controller.http.ErrorCode;
import dev.mars.scanfleet.controller.http.ScanFleetApiException;
import dev.mars.scanfleet.controller.service.ScanScheduler;
import dev.mars.scanfleet.controller.service.ScheduledJob;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.ResultStatus;
import dev.mars.scanfleet.core.ScanTask;
import dev.mars.scanfleet.core.TaskStatus;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for health, statistics and the schedule view.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health} and {@code GET /api/v1/health} - liveness with agent and task counts</li>
 *   <li>{@code GET /api/v1/stats?hours=24} - task and result counts in a time window</li>
 *   <li>{@code GET /api/v1/schedule} - recurring scans and their next run</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class SystemHandler {

    static final int DEFAULT_STATS_HOURS = 24;

    private final ScanFleetStateStore store;
    private final ScanScheduler scheduler;
    private final DrainModeHandler drainMode;
    private final Clock clock;
    private final String version;

    public SystemHandler(ScanFleetStateStore store, ScanScheduler scheduler, DrainModeHandler drainMode,
                         Clock clock, String version) {
        this.store = store;
        this.scheduler = scheduler;
        this.drainMode = drainMode;
        this.clock = clock;
        this.version = version;
    }

    /**
     * Handles {@code GET /health}. Reports {@code draining} while the controller shuts down.
     */
    public Handler<RoutingContext> handleHealth() {
        return ctx -> {
            Map<AgentState, Integer> agents = countAgents(store.agentsInRegistrationOrder());
            ctx.json(new JsonObject()
                    .put("status", drainMode.isDraining() ? "draining" : "healthy")
                    .put("timestamp", clock.instant().toString())
                    .put("version", version)
                    .put("stats", new JsonObject()
                            .put("total_agents", agents.values().stream().mapToInt(Integer::intValue).sum())
                            .put("online_agents", agents.get(AgentState.ONLINE))
                            .put("scanning_agents", agents.get(AgentState.SCANNING))
                            .put("offline_agents", agents.get(AgentState.OFFLINE))
                            .put("pending_agents", agents.get(AgentState.PENDING_APPROVAL))
                            .put("pending_tasks", store.countTasks(TaskStatus.PENDING))
                            .put("assigned_tasks", store.countTasks(TaskStatus.ASSIGNED))));
        };
    }

    /**
     * Handles {@code GET /api/v1/stats}. Task totals cover tasks created in the
     * window; completed and failed counts go by completion time. Outstanding
     * tasks are counted regardless of age.
     */
    public Handler<RoutingContext> handleStats() {
        return ctx -> {
            int hours = ApiJson.intParam(ctx, "hours", DEFAULT_STATS_HOURS);
            if (hours < 1) {
                throw ScanFleetApiException.badRequest(ErrorCode.VALIDATION_ERROR, "hours must be at least 1");
            }
            Instant since = clock.instant().minus(Duration.ofHours(hours));

            List<AgentInfo> agentList = store.agentsInRegistrationOrder();
            Map<AgentState, Integer> agents = countAgents(agentList);

            List<ScanTask> tasks = store.tasks();
            long tasksInWindow = tasks.stream().filter(t -> !t.getCreatedAt().isBefore(since)).count();
            long completedTasks = finishedSince(tasks, TaskStatus.COMPLETED, since);
            long failedTasks = finishedSince(tasks, TaskStatus.FAILED, since);

            List<AggregatedResult> results = store.results().stream()
                    .filter(r -> !r.getCreatedAt().isBefore(since))
                    .toList();
            JsonObject resultCounts = new JsonObject().put("total", results.size());
            for (ResultStatus status : ResultStatus.values()) {
                resultCounts.put(status.getValue(), results.stream().filter(r -> r.getStatus() == status).count());
            }

            ctx.json(new JsonObject()
                    .put("status", "success")
                    .put("period_hours", hours)
                    .put("since", since.toString())
                    .put("stats", new JsonObject()
                            .put("agents", new JsonObject()
                                    .put("total", agentList.size())
                                    .put("online", agents.get(AgentState.ONLINE))
                                    .put("scanning", agents.get(AgentState.SCANNING))
                                    .put("offline", agents.get(AgentState.OFFLINE))
                                    .put("pending_approval", agents.get(AgentState.PENDING_APPROVAL)))
                            .put("tasks", new JsonObject()
                                    .put("total", tasksInWindow)
                                    .put("pending", store.countTasks(TaskStatus.PENDING))
                                    .put("assigned", store.countTasks(TaskStatus.ASSIGNED))
                                    .put("completed", completedTasks)
                                    .put("failed", failedTasks))
                            .put("results", resultCounts)));
        };
    }

    /**
     * Handles {@code GET /api/v1/schedule}.
     */
    public Handler<RoutingContext> handleSchedule() {
        return ctx -> {
            List<ScheduledJob> jobs = scheduler.scheduledJobs();
            ApiJson.respond(ctx, 200, Map.of("jobs", jobs, "total", jobs.size()));
        };
    }

    private static Map<AgentState, Integer> countAgents(List<AgentInfo> agents) {
        Map<AgentState, Integer> counts = new EnumMap<>(AgentState.class);
        for (AgentState state : AgentState.values()) {
            counts.put(state, 0);
        }
        for (AgentInfo agent : agents) {
            counts.merge(agent.getState(), 1, Integer::sum);
        }
        return counts;
    }

    private static long finishedSince(List<ScanTask> tasks, TaskStatus status, Instant since) {
        return tasks.stream()
                .filter(t -> t.getStatus() == status)
                .filter(t -> t.getCompletedAt() != null && !t.getCompletedAt().isBefore(since))
                .count();
    }
}
