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
import dev.mars.scanfleet.controller.http.ErrorCode;
import dev.mars.scanfleet.controller.http.ScanFleetApiException;
import dev.mars.scanfleet.controller.service.DeltaReportService;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.delta.DeltaReport;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * HTTP handler for delta reports.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/v1/scans/:scanId/deltas?page&per_page&only_changes} - paginated reports, newest first</li>
 *   <li>{@code GET /api/v1/scans/:scanId/deltas/summary?days} - change totals and a per-day timeline</li>
 *   <li>{@code GET /api/v1/deltas/:deltaId?include_data} - one report, with or without the detail</li>
 *   <li>{@code DELETE /api/v1/deltas/:deltaId} - delete a report</li>
 *   <li>{@code POST /api/v1/deltas/compare} - compare two finished results of one scan</li>
 * </ul>
 *
 * <p>Reports are addressed by scan id even after the scan configuration is
 * deleted, so listing an unknown scan yields an empty page rather than 404.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class DeltaHandler {

    private static final int DEFAULT_PER_PAGE = 20;

    private final DeltaReportService deltaReports;

    public DeltaHandler(DeltaReportService deltaReports) {
        this.deltaReports = deltaReports;
    }

    /**
     * Handles {@code GET /api/v1/scans/:scanId/deltas}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            int page = ApiJson.intParam(ctx, "page", 1);
            int perPage = ApiJson.intParam(ctx, "per_page", DEFAULT_PER_PAGE);
            boolean onlyChanges = ApiJson.boolParam(ctx, "only_changes");
            ApiJson.respond(ctx, 200, deltaReports.listReports(scanId, page, perPage, onlyChanges));
        };
    }

    /**
     * Handles {@code GET /api/v1/scans/:scanId/deltas/summary}.
     */
    public Handler<RoutingContext> handleSummary() {
        return ctx -> {
            String scanId = ctx.pathParam("scanId");
            int days = ApiJson.intParam(ctx, "days", DeltaReportService.DEFAULT_SUMMARY_DAYS);
            ApiJson.respond(ctx, 200, deltaReports.changeSummary(scanId, days));
        };
    }

    /**
     * Handles {@code GET /api/v1/deltas/:deltaId}. The {@code delta} detail is only
     * included when {@code include_data=true}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String deltaId = ctx.pathParam("deltaId");
            DeltaReport report = deltaReports.getReport(deltaId)
                    .orElseThrow(() -> ScanFleetApiException.notFound(ErrorCode.DELTA_NOT_FOUND, deltaId));
            JsonObject json = ApiJson.toJsonObject(report);
            if (!ApiJson.boolParam(ctx, "include_data")) {
                json.remove("delta");
            }
            ctx.json(json);
        };
    }

    /**
     * Handles {@code DELETE /api/v1/deltas/:deltaId}.
     */
    public Handler<RoutingContext> handleDelete() {
        return ctx -> {
            String deltaId = ctx.pathParam("deltaId");
            if (!deltaReports.deleteReport(deltaId)) {
                throw ScanFleetApiException.notFound(ErrorCode.DELTA_NOT_FOUND, deltaId);
            }
            ctx.json(new JsonObject()
                    .put("message", "Delta report deleted")
                    .put("id", deltaId));
        };
    }

    /**
     * Handles {@code POST /api/v1/deltas/compare} with
     * {@code {baseline_result_id, current_result_id}}.
     */
    public Handler<RoutingContext> handleCompare() {
        return ctx -> {
            JsonObject body = ApiJson.requireJsonObject(ctx);
            String baselineId = body.getValue("baseline_result_id") instanceof String baseline ? baseline : null;
            String currentId = body.getValue("current_result_id") instanceof String current ? current : null;
            DeltaReport report;
            try {
                report = deltaReports.compare(baselineId, currentId);
            } catch (UnknownResultException e) {
                throw ScanFleetApiException.notFound(ErrorCode.RESULT_NOT_FOUND, e.getResultId());
            } catch (ValidationException e) {
                throw new ScanFleetApiException(ErrorCode.DELTA_INVALID,
                        ErrorCode.DELTA_INVALID.formatMessage(e.getMessage()), e);
            }
            ApiJson.respond(ctx, 200, report);
        };
    }
}
