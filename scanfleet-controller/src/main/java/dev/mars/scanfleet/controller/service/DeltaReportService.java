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
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.delta.DeltaComparator;
import dev.mars.scanfleet.delta.DeltaPayload;
import dev.mars.scanfleet.delta.DeltaReport;
import dev.mars.scanfleet.delta.PortChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Produces and serves delta reports between successive results of a scan
 * configuration.
 *
 * <p>Reports are written automatically when a result reaches a terminal status and
 * on demand through {@link #compare(String, String)}. Either way there is at most one
 * report per (baseline, current) pair.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class DeltaReportService {

    private static final Logger logger = LoggerFactory.getLogger(DeltaReportService.class);

    public static final int MAX_PER_PAGE = 100;
    public static final int DEFAULT_SUMMARY_DAYS = 30;

    private final ScanFleetStateStore store;
    private final ControllerMetrics metrics;
    private final Clock clock;

    public DeltaReportService(ScanFleetStateStore store, ControllerMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Compares a freshly terminal result against the latest earlier terminal result of
     * the same configuration.
     *
     * @return the report, or empty when there is nothing to compare against
     */
    public Optional<DeltaReport> onResultTerminal(AggregatedResult current) {
        Optional<AggregatedResult> baseline = findBaseline(current);
        if (baseline.isEmpty()) {
            logger.info("No baseline for result {} of scan {}, skipping delta report",
                    current.getId(), current.getScanConfigId());
            return Optional.empty();
        }
        return Optional.of(generate(baseline.get(), current));
    }

    /**
     * Manually compares two terminal results of the same configuration. A repeat call
     * for the same pair returns the report already stored.
     *
     * @throws UnknownResultException if either result does not exist
     * @throws ValidationException    if the results are not terminal or belong to different scans
     */
    public DeltaReport compare(String baselineResultId, String currentResultId)
            throws UnknownResultException, ValidationException {
        if (baselineResultId == null || baselineResultId.isBlank()
                || currentResultId == null || currentResultId.isBlank()) {
            throw new ValidationException("baseline_result_id and current_result_id are required");
        }
        if (baselineResultId.equals(currentResultId)) {
            throw new ValidationException("Cannot compare a result with itself");
        }
        AggregatedResult baseline = store.findResult(baselineResultId)
                .orElseThrow(() -> new UnknownResultException(baselineResultId));
        AggregatedResult current = store.findResult(currentResultId)
                .orElseThrow(() -> new UnknownResultException(currentResultId));

        if (!baseline.getScanConfigId().equals(current.getScanConfigId())) {
            throw new ValidationException("Results belong to different scans: "
                    + baseline.getScanConfigId() + " and " + current.getScanConfigId());
        }
        if (!baseline.getStatus().isTerminal() || !current.getStatus().isTerminal()) {
            throw new ValidationException("Both results must be finished before they can be compared");
        }

        Optional<DeltaReport> existing = store.findDeltaReport(baselineResultId, currentResultId);
        if (existing.isPresent()) {
            logger.debug("Returning existing delta report {} for {} -> {}",
                    existing.get().getId(), baselineResultId, currentResultId);
            return existing.get();
        }
        return generate(baseline, current);
    }

    /**
     * Reports of a configuration, newest first.
     *
     * @param page        1-based page number
     * @param perPage     page size, capped at {@value #MAX_PER_PAGE}
     * @param onlyChanges drop reports without any change
     */
    public ReportPage<DeltaReport> listReports(String scanConfigId, int page, int perPage, boolean onlyChanges) {
        int safePage = Math.max(1, page);
        int safePerPage = Math.max(1, Math.min(perPage, MAX_PER_PAGE));

        List<DeltaReport> reports = store.deltaReportsForScan(scanConfigId).stream()
                .filter(r -> !onlyChanges || r.hasChanges())
                .toList();

        int from = Math.min((safePage - 1) * safePerPage, reports.size());
        int to = Math.min(from + safePerPage, reports.size());
        return new ReportPage<>(reports.subList(from, to), safePage, safePerPage, reports.size());
    }

    public Optional<DeltaReport> getReport(String id) {
        return store.findDeltaReport(id);
    }

    public boolean deleteReport(String id) {
        boolean removed = store.removeDeltaReport(id);
        if (removed) {
            logger.info("Delta report deleted: id={}", id);
        }
        return removed;
    }

    /**
     * Totals over the reports created in the last {@code days} days.
     */
    public ChangeSummary changeSummary(String scanConfigId, int days) {
        int window = days <= 0 ? DEFAULT_SUMMARY_DAYS : days;
        Instant since = clock.instant().minus(Duration.ofDays(window));

        List<DeltaReport> reports = store.deltaReportsForScan(scanConfigId).stream()
                .filter(r -> !r.getCreatedAt().isBefore(since))
                .toList();

        int withChanges = 0;
        int newPorts = 0;
        int closedPorts = 0;
        int changedServices = 0;
        int newHosts = 0;
        int removedHosts = 0;
        Map<LocalDate, int[]> perDay = new TreeMap<>();

        for (DeltaReport report : reports) {
            if (report.hasChanges()) {
                withChanges++;
            }
            newPorts += report.getNewPortsCount();
            closedPorts += report.getClosedPortsCount();
            changedServices += report.getChangedServicesCount();
            newHosts += report.getNewHostsCount();
            removedHosts += report.getRemovedHostsCount();

            int[] day = perDay.computeIfAbsent(
                    LocalDate.ofInstant(report.getCreatedAt(), ZoneOffset.UTC), d -> new int[4]);
            day[0]++;
            day[1] += report.getNewPortsCount();
            day[2] += report.getClosedPortsCount();
            day[3] += report.getChangedServicesCount();
        }

        List<ChangeSummary.Day> timeline = new ArrayList<>();
        perDay.forEach((date, c) -> timeline.add(new ChangeSummary.Day(date, c[0], c[1], c[2], c[3])));

        return new ChangeSummary(scanConfigId, window, reports.size(), withChanges, newPorts, closedPorts,
                changedServices, newHosts, removedHosts, timeline);
    }

    // ── Internal helpers ───────────────────────────────────────────────

    private Optional<AggregatedResult> findBaseline(AggregatedResult current) {
        return store.resultsForScan(current.getScanConfigId()).stream()
                .filter(r -> !r.getId().equals(current.getId()))
                .filter(r -> r.getStatus().isTerminal())
                .filter(r -> !r.getCreatedAt().isAfter(current.getCreatedAt()))
                .max(Comparator.comparing(AggregatedResult::getCreatedAt));
    }

    private DeltaReport generate(AggregatedResult baseline, AggregatedResult current) {
        DeltaPayload delta = DeltaComparator.compare(baseline.getHosts(), current.getHosts());
        DeltaReport candidate = new DeltaReport(UUID.randomUUID().toString(), current.getScanConfigId(),
                baseline.getId(), current.getId(), clock.instant(), delta);

        DeltaReport stored = store.putDeltaReportIfAbsent(candidate);
        if (stored != candidate) {
            return stored;
        }

        metrics.recordDeltaGenerated();
        logger.info("Delta report {} for scan {}: newPorts={}, closedPorts={}, changedServices={}, newHosts={}, removedHosts={}",
                stored.getId(), stored.getScanConfigId(), stored.getNewPortsCount(), stored.getClosedPortsCount(),
                stored.getChangedServicesCount(), stored.getNewHostsCount(), stored.getRemovedHostsCount());

        List<PortChange> critical = stored.criticalPortsOpened();
        if (!critical.isEmpty()) {
            logger.warn("Critical ports opened in scan {} (report {}): {}", stored.getScanConfigId(), stored.getId(),
                    critical.stream().map(c -> c.host() + ":" + c.port()).toList());
        }
        return stored;
    }
}
