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
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs recurring scans on Vert.x periodic timers, one timer per active recurring
 * configuration.
 *
 * <p>Each tick re-reads the configuration from the store, so a configuration that was
 * deactivated or deleted after its timer was armed is skipped without error.
 * Unscheduling cancels the timer only; tasks already dispatched keep running.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-30
 */
public class ScanScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ScanScheduler.class);

    private final Vertx vertx;
    private final ScanFleetStateStore store;
    private final TaskDispatcher dispatcher;
    private final Clock clock;

    private final Map<String, Long> timers = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ScanScheduler(Vertx vertx, ScanFleetStateStore store, TaskDispatcher dispatcher, Clock clock) {
        this.vertx = vertx;
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Arms a timer for every active recurring configuration in the store.
     */
    public void start() {
        stopped.set(false);
        int scheduled = 0;
        for (ScanConfig config : store.scanConfigs()) {
            if (config.isSchedulable()) {
                schedule(config);
                scheduled++;
            }
        }
        logger.info("Scan scheduler started with {} recurring scan(s)", scheduled);
    }

    public void stop() {
        stopped.set(true);
        timers.forEach((id, timerId) -> vertx.cancelTimer(timerId));
        timers.clear();
        logger.info("Scan scheduler stopped");
    }

    /**
     * Arms the timer for a configuration, replacing any existing one. A configuration
     * that is not active and recurring is unscheduled instead.
     */
    public void schedule(ScanConfig config) {
        if (!config.isSchedulable()) {
            unschedule(config.getId());
            return;
        }
        if (stopped.get()) {
            logger.debug("Scheduler stopped, not scheduling scan {}", config.getId());
            return;
        }
        long intervalMs = Duration.ofMinutes(config.getIntervalMinutes()).toMillis();
        String configId = config.getId();
        long timerId = vertx.setPeriodic(intervalMs, id -> trigger(configId));

        Long previous = timers.put(configId, timerId);
        if (previous != null) {
            vertx.cancelTimer(previous);
        }
        synchronized (config) {
            config.setNextRun(clock.instant().plus(Duration.ofMinutes(config.getIntervalMinutes())));
        }
        logger.info("Scheduled scan {} every {} minute(s), next run {}", configId,
                config.getIntervalMinutes(), config.getNextRun());
    }

    /**
     * Cancels a configuration's timer. Dispatched tasks are not affected.
     *
     * @return true if a timer was cancelled
     */
    public boolean unschedule(String configId) {
        Long timerId = timers.remove(configId);
        if (timerId == null) {
            return false;
        }
        vertx.cancelTimer(timerId);
        store.findScanConfig(configId).ifPresent(config -> {
            synchronized (config) {
                config.setNextRun(null);
            }
        });
        logger.info("Unscheduled scan {}", configId);
        return true;
    }

    public boolean isScheduled(String configId) {
        return timers.containsKey(configId);
    }

    /**
     * One scheduled tick. Skips configurations that are gone or inactive, otherwise
     * dispatches and moves {@code lastRun}/{@code nextRun} forward whatever the outcome.
     *
     * @return the dispatch outcome, or empty when the tick was skipped
     */
    public Future<Optional<DispatchOutcome>> trigger(String configId) {
        Optional<ScanConfig> found = store.findScanConfig(configId);
        if (found.isEmpty() || !found.get().isActive()) {
            logger.debug("Skipping scheduled run of scan {}: missing or inactive", configId);
            return Future.succeededFuture(Optional.empty());
        }
        ScanConfig config = found.get();
        Instant now = clock.instant();
        synchronized (config) {
            config.setLastRun(now);
            config.setNextRun(now.plus(Duration.ofMinutes(config.getIntervalMinutes())));
        }
        logger.info("Scheduled run of scan {} ({})", configId, config.getName());
        return dispatcher.dispatch(config).map(outcome -> {
            if (!outcome.isDispatched()) {
                logger.warn("Scheduled run of scan {} did not dispatch: {}", configId, outcome.message());
            }
            return Optional.of(outcome);
        });
    }

    /**
     * Executes a configuration immediately, recurring or not.
     *
     * @throws ValidationException if the configuration is inactive
     */
    public Future<DispatchOutcome> runNow(ScanConfig config) throws ValidationException {
        if (!config.isActive()) {
            throw new ValidationException("Scan '" + config.getId() + "' is inactive");
        }
        synchronized (config) {
            config.setLastRun(clock.instant());
        }
        logger.info("Manual run of scan {} ({})", config.getId(), config.getName());
        return dispatcher.dispatch(config);
    }

    /**
     * @return scheduled jobs ordered by next run time
     */
    public List<ScheduledJob> scheduledJobs() {
        List<ScheduledJob> jobs = new ArrayList<>();
        for (String configId : timers.keySet()) {
            store.findScanConfig(configId).ifPresent(config -> jobs.add(new ScheduledJob(
                    ScheduledJob.jobIdFor(configId), configId, config.getName(),
                    config.getIntervalMinutes(), config.getNextRun())));
        }
        jobs.sort(Comparator.comparing(ScheduledJob::nextRun, Comparator.nullsLast(Comparator.naturalOrder())));
        return jobs;
    }
}
