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

import dev.mars.scanfleet.controller.http.ApiJson;
import dev.mars.scanfleet.controller.http.CorrelationIdHandler;
import dev.mars.scanfleet.controller.http.ErrorCode;
import dev.mars.scanfleet.controller.http.ErrorResponse;
import dev.mars.scanfleet.controller.http.ScanFleetApiException;
import dev.mars.scanfleet.controller.service.DispatchOutcome;
import dev.mars.scanfleet.controller.service.ScanConfigChanges;
import dev.mars.scanfleet.controller.service.ScanConfigService;
import dev.mars.scanfleet.controller.service.ScanScheduler;
import dev.mars.scanfleet.controller.service.ScanStats;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * HTTP handler for scan configurations and on-demand execution.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/scans} - create a configuration</li>
 *   <li>{@code GET /api/v1/scans} - list configurations</li>
 *   <li>{@code GET /api/v1/scans/:scanId} - get one configuration; the newest delta
 *       report is attached with {@code include_latest_delta=true}</li>
 *   <li>{@code PUT /api/v1/scans/:scanId} - update a configuration</li>
 *   <li>{@code DELETE /api/v1/scans/:scanId} - delete a configuration, keeping its results</li>
 *   <li>{@code POST /api/v1/scans/:scanId/execute} - dispatch now</li>
 *   <li>{@code POST /api/v1/scans/:scanId/toggle} - flip {@code is_active}</li>
 *   <li>{@code PUT /api/v1/scans/:scanId/schedule} - change interval or recurrence</li>
 *   <li>{@code GET /api/v1/scans/:scanId/results} - executions of a configuration</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class ScanHandler {

    private static final Logger logger = LoggerFactory.getLogger(ScanHandler.class);

    private final ScanConfigService scanConfigs;
    private final ScanScheduler scheduler;

    public ScanHandler(ScanConfigService scanConfigs, ScanScheduler scheduler) {
        this.scanConfigs = scanConfigs;
        this.scheduler = scheduler;
    }

    /**
     * Handles {@code POST /api/v1/scans}.
     */
    public Handler<RoutingContext> handleCreate() {
        return ctx -> {
            ScanConfigChanges request = ApiJson.readBody(ctx, ScanConfigChanges.class);
            ScanConfig created;
            try {
                created = scanConfigs.create(request);
            } catch (ValidationException e) {
                throw invalid(e);
            }
            ApiJson.respond(ctx, 201, created);
        };
    }

    /**
     * Handles {@code GET /api/v1/scans}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> {
            List<ScanConfig> configs = scanConfigs.list();
            JsonArray scans = new JsonArray();
            configs.forEach(config -> scans.add(view(config)));
            ctx.json(new JsonObject().put("scans", scans).put("total", configs.size()));
        };
    }

    /**
     * Handles {@code GET /api/v1/scans/:scanId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            ScanConfig config = requireConfig(ctx.pathParam("scanId"));
            JsonObject json = view(config);
            if (ApiJson.boolParam(ctx, "include_latest_delta")) {
                json.put("latest_delta_report", scanConfigs.latestDeltaReport(config.getId())
                        .map(report -> {
                            JsonObject summary = ApiJson.toJsonObject(report);
                            summary.remove("delta");
                            return summary;
                        })
                        .orElse(null));
            }
            ctx.json(json);
        };
    }

    /**
     * Handles {@code PUT /api/v1/scans/:scanId}.
     */
    public Handler<RoutingContext> handleUpdate() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            ScanConfigChanges changes = ApiJson.readBody(ctx, ScanConfigChanges.class);
            ScanConfig updated;
            try {
                updated = scanConfigs.update(scanId, changes)
                        .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, scanId));
            } catch (ValidationException e) {
                throw invalid(e);
            }
            ApiJson.respond(ctx, 200, updated);
        };
    }

    /**
     * Handles {@code DELETE /api/v1/scans/:scanId}.
     */
    public Handler<RoutingContext> handleDelete() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            if (!scanConfigs.delete(scanId)) {
                throw ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, scanId);
            }
            ctx.json(new JsonObject()
                    .put("message", "Scan deleted")
                    .put("scan_id", scanId));
        };
    }

    /**
     * Handles {@code POST /api/v1/scans/:scanId/execute}. Answers {@code 202} once at
     * least one agent accepted its work order; the outcome is attached to the error
     * body when nothing was dispatched.
     */
    public Handler<RoutingContext> handleExecute() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            ScanConfig config = requireConfig(scanId);
            if (!config.isActive()) {
                throw ScanFleetApiException.badRequest(ErrorCode.SCAN_INACTIVE, scanId);
            }
            Future<DispatchOutcome> dispatch;
            try {
                dispatch = scheduler.runNow(config);
            } catch (ValidationException e) {
                throw ScanFleetApiException.badRequest(ErrorCode.SCAN_INACTIVE, scanId);
            }
            dispatch.onSuccess(outcome -> respondOutcome(ctx, outcome))
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code POST /api/v1/scans/:scanId/toggle}.
     */
    public Handler<RoutingContext> handleToggle() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            ScanConfig toggled = scanConfigs.toggleActive(scanId)
                    .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, scanId));
            ApiJson.respond(ctx, 200, toggled);
        };
    }

    /**
     * Handles {@code PUT /api/v1/scans/:scanId/schedule} with
     * {@code {interval_minutes, is_scheduled}}, either of which may be omitted.
     */
    public Handler<RoutingContext> handleSchedule() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            JsonObject body = ApiJson.requireJsonObject(ctx);
            Integer interval;
            Boolean recurring;
            try {
                interval = body.getInteger("interval_minutes");
                recurring = body.getBoolean("is_scheduled");
            } catch (ClassCastException e) {
                throw new ScanFleetApiException(ErrorCode.VALIDATION_ERROR,
                        ErrorCode.VALIDATION_ERROR.formatMessage("interval_minutes must be an integer and is_scheduled a boolean"), e);
            }
            if (interval == null && recurring == null) {
                throw ScanFleetApiException.badRequest(ErrorCode.MISSING_REQUIRED_FIELD, "interval_minutes");
            }
            ScanConfig updated;
            try {
                updated = scanConfigs.updateSchedule(scanId, interval, recurring)
                        .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, scanId));
            } catch (ValidationException e) {
                throw invalid(e);
            }
            ApiJson.respond(ctx, 200, updated);
        };
    }

    /**
     * Handles {@code GET /api/v1/scans/:scanId/results}.
     */
    public Handler<RoutingContext> handleResults() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            requireConfig(scanId);
            List<AggregatedResult> results = scanConfigs.results(scanId);
            ApiJson.respond(ctx, 200, Map.of("scan_id", scanId, "results", results, "total", results.size()));
        };
    }

    private JsonObject view(ScanConfig config) {
        ScanStats stats = scanConfigs.stats(config.getId());
        return ApiJson.toJsonObject(config)
                .put("result_count", stats.resultCount())
                .put("success_rate", stats.successRate());
    }

    private ScanConfig requireConfig(String scanId) {
        return scanConfigs.get(scanId)
                .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.SCAN_NOT_FOUND, scanId));
    }

    private static ScanFleetApiException invalid(ValidationException e) {
        return new ScanFleetApiException(ErrorCode.SCAN_INVALID, ErrorCode.SCAN_INVALID.formatMessage(e.getMessage()), e);
    }

    private static void respondOutcome(RoutingContext ctx, DispatchOutcome outcome) {
        switch (outcome.kind()) {
            case DISPATCHED -> ApiJson.respond(ctx, 202, outcome);
            case INVALID_TARGET -> ctx.fail(ScanFleetApiException.badRequest(ErrorCode.SCAN_INVALID, outcome.message()));
            case NO_ELIGIBLE_AGENTS -> unavailable(ctx, ErrorCode.NO_ELIGIBLE_AGENTS, outcome);
            case DISPATCH_FAILED -> unavailable(ctx, ErrorCode.DISPATCH_FAILED, outcome);
        }
    }

    private static void unavailable(RoutingContext ctx, ErrorCode code, DispatchOutcome outcome) {
        logger.warn("Scan {} not dispatched: {}", outcome.scanConfigId(), outcome.message());
        JsonObject body = ErrorResponse.of(code, ctx.request().path(),
                        CorrelationIdHandler.getRequestId(ctx), outcome.scanConfigId())
                .toJson()
                .put("dispatch", ApiJson.toJsonObject(outcome));
        ctx.response()
                .setStatusCode(code.httpStatus())
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}
