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

import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.ResultStatus;
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.delta.DeltaReport;
import dev.mars.scanfleet.network.PortSpec;
import dev.mars.scanfleet.network.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Create, update and delete scan configurations, keeping the scheduler in step with
 * each change.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-30
 */
public class ScanConfigService {

    private static final Logger logger = LoggerFactory.getLogger(ScanConfigService.class);

    static final int MAX_INTERVAL_MINUTES = 60 * 24 * 365;

    private final ScanFleetStateStore store;
    private final ScanScheduler scheduler;
    private final Clock clock;

    public ScanConfigService(ScanFleetStateStore store, ScanScheduler scheduler, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Validates and stores a new configuration, scheduling it when it is active and
     * recurring.
     *
     * @throws ValidationException if the name or target is missing, or the target, ports
     *                             or interval are invalid
     */
    public ScanConfig create(ScanConfigChanges request) throws ValidationException {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (request.target() == null || request.target().isBlank()) {
            throw new ValidationException("target is required");
        }

        ScanConfig config = new ScanConfig(UUID.randomUUID().toString(), request.name().trim(), null);
        config.setCreatedAt(clock.instant());
        apply(config, request);
        store.putScanConfig(config);
        logger.info("Scan created: id={}, name={}, target={}, recurring={}",
                config.getId(), config.getName(), config.getTarget(), config.isRecurring());

        scheduler.schedule(config);
        return config;
    }

    /**
     * Applies the supplied fields and re-schedules when the interval, active flag or
     * recurring flag changed.
     *
     * @return the updated configuration, or empty if it does not exist
     */
    public Optional<ScanConfig> update(String id, ScanConfigChanges changes) throws ValidationException {
        Optional<ScanConfig> found = store.findScanConfig(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ScanConfig config = found.get();
        boolean reschedule;
        synchronized (config) {
            int interval = config.getIntervalMinutes();
            boolean active = config.isActive();
            boolean recurring = config.isRecurring();
            if (changes.name() != null && changes.name().isBlank()) {
                throw new ValidationException("name must not be blank");
            }
            apply(config, changes);
            reschedule = interval != config.getIntervalMinutes()
                    || active != config.isActive()
                    || recurring != config.isRecurring();
        }
        logger.info("Scan updated: id={}, reschedule={}", id, reschedule);
        if (reschedule) {
            scheduler.schedule(config);
        }
        return Optional.of(config);
    }

    /**
     * Deactivates, unschedules and removes a configuration. Its results and delta
     * reports stay in the store.
     */
    public boolean delete(String id) {
        Optional<ScanConfig> found = store.findScanConfig(id);
        if (found.isEmpty()) {
            return false;
        }
        synchronized (found.get()) {
            found.get().setActive(false);
        }
        scheduler.unschedule(id);
        store.removeScanConfig(id);
        logger.info("Scan deleted: id={}", id);
        return true;
    }

    public Optional<ScanConfig> toggleActive(String id) {
        Optional<ScanConfig> found = store.findScanConfig(id);
        found.ifPresent(config -> {
            synchronized (config) {
                config.setActive(!config.isActive());
            }
            logger.info("Scan {}: id={}", config.isActive() ? "activated" : "deactivated", id);
            scheduler.schedule(config);
        });
        return found;
    }

    public Optional<ScanConfig> updateSchedule(String id, Integer intervalMinutes, Boolean recurring)
            throws ValidationException {
        return update(id, new ScanConfigChanges(null, null, null, null, null, intervalMinutes, null, recurring));
    }

    public List<ScanConfig> list() {
        return store.scanConfigs();
    }

    public Optional<ScanConfig> get(String id) {
        return store.findScanConfig(id);
    }

    /**
     * @return executions of the configuration, oldest first
     */
    public List<AggregatedResult> results(String id) {
        return store.resultsForScan(id);
    }

    /**
     * Result count and success rate of a configuration. An unknown id has no results.
     */
    public ScanStats stats(String id) {
        List<AggregatedResult> results = store.resultsForScan(id);
        int completed = (int) results.stream().filter(r -> r.getStatus() == ResultStatus.COMPLETED).count();
        return new ScanStats(results.size(), completed);
    }

    public Optional<DeltaReport> latestDeltaReport(String id) {
        return store.deltaReportsForScan(id).stream().findFirst();
    }

    private static void apply(ScanConfig config, ScanConfigChanges changes) throws ValidationException {
        String target = changes.target() != null ? changes.target().trim() : config.getTarget();
        String ports = changes.ports() != null ? PortSpec.normalise(changes.ports()) : config.getPorts();
        int interval = changes.intervalMinutes() != null ? changes.intervalMinutes() : config.getIntervalMinutes();

        TargetSpec.parse(target);
        if (interval < 1 || interval > MAX_INTERVAL_MINUTES) {
            throw new ValidationException("interval_minutes must be between 1 and " + MAX_INTERVAL_MINUTES);
        }

        config.setTarget(target);
        config.setPorts(ports);
        config.setIntervalMinutes(interval);
        if (changes.name() != null) {
            config.setName(changes.name().trim());
        }
        if (changes.description() != null) {
            config.setDescription(changes.description());
        }
        if (changes.scanArguments() != null) {
            config.setScanArguments(changes.scanArguments().trim());
        }
        if (changes.active() != null) {
            config.setActive(changes.active());
        }
        if (changes.recurring() != null) {
            config.setRecurring(changes.recurring());
        }
    }
}
