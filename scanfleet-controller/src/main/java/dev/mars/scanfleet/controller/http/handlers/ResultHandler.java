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

import dev.mars.scanfleet.controller.config.ControllerSettings;
import dev.mars.scanfleet.controller.http.ApiJson;
import dev.mars.scanfleet.controller.http.ErrorCode;
import dev.mars.scanfleet.controller.http.ScanFleetApiException;
import dev.mars.scanfleet.controller.service.ResultAggregator;
import dev.mars.scanfleet.controller.service.SubmissionSummary;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.exceptions.ScanFleetException;
import dev.mars.scanfleet.result.ResultSubmission;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP handler for agent result submissions and result lookups.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/agents/:agentId/results} - merge a partial or final submission</li>
 *   <li>{@code GET /api/v1/results/:resultId} - get one aggregated result</li>
 * </ul>
 *
 * <p>Merging runs on a worker thread under a deadline that grows with the number
 * of targets in the submission. A missed deadline answers {@code 504}; the merge
 * itself is not interrupted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ResultHandler {

    private static final Logger logger = LoggerFactory.getLogger(ResultHandler.class);

    private final ResultAggregator aggregator;
    private final ControllerSettings settings;

    public ResultHandler(ResultAggregator aggregator, ControllerSettings settings) {
        this.aggregator = aggregator;
        this.settings = settings;
    }

    /**
     * Handles {@code POST /api/v1/agents/:agentId/results}.
     */
    public Handler<RoutingContext> handleSubmit() {
        return ctx -> {
            String agentId = ctx.pathParam("agentId");
            ResultSubmission submission = ApiJson.readBody(ctx, ResultSubmission.class);
            if (submission.agentId() != null && !submission.agentId().equals(agentId)) {
                throw ScanFleetApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                        "agent_id '" + submission.agentId() + "' does not match path agent '" + agentId + "'");
            }
            ResultSubmission attributed = submission.withAgentId(agentId);
            int targets = Math.max(attributed.parsedResults().size(), attributed.summaryStats().totalTargets());
            long timeoutMs = settings.resultProcessingTimeoutMs(targets);

            ctx.vertx().executeBlocking(() -> aggregator.submit(attributed), false)
                    .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .onSuccess(summary -> ctx.json(toJson(summary)))
                    .onFailure(err -> {
                        if (err instanceof TimeoutException) {
                            logger.warn("Result processing timed out: resultId={}, agentId={}, timeoutMs={}",
                                    attributed.resultId(), agentId, timeoutMs);
                            ctx.fail(new ScanFleetApiException(ErrorCode.TIMEOUT,
                                    ErrorCode.TIMEOUT.formatMessage("result processing exceeded " + timeoutMs + " ms"),
                                    err));
                        } else if (err instanceof ScanFleetException domain) {
                            ctx.fail(ScanFleetApiException.from(domain));
                        } else {
                            ctx.fail(err);
                        }
                    });
        };
    }

    /**
     * Handles {@code GET /api/v1/results/:resultId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String resultId = ctx.pathParam("resultId");
            AggregatedResult result = aggregator.find(resultId)
                    .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.RESULT_NOT_FOUND, resultId));
            ApiJson.respond(ctx, 200, result);
        };
    }

    private static JsonObject toJson(SubmissionSummary summary) {
        return new JsonObject()
                .put("message", "Results received")
                .put("result_id", summary.resultId())
                .put("status", summary.status().getValue())
                .put("summary", new JsonObject()
                        .put("total_targets", summary.totalTargets())
                        .put("completed_targets", summary.completedTargets())
                        .put("failed_targets", summary.failedTargets())
                        .put("total_open_ports", summary.totalOpenPorts())
                        .put("contributing_clients", new JsonArray(summary.contributingAgents())));
    }
}
