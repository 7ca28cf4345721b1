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

import dev.mars.scanfleet.controller.Fleet;
import dev.mars.scanfleet.controller.MutableClock;
import dev.mars.scanfleet.controller.ScanFleetContext;
import dev.mars.scanfleet.controller.config.ControllerSettings;
import dev.mars.scanfleet.core.ScanConfig;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("ScanScheduler Tests")
class ScanSchedulerTest {

    private MutableClock clock;
    private ScanFleetContext context;
    private ScanScheduler scheduler;

    @BeforeEach
    void setUp(Vertx vertx) {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        context = ScanFleetContext.create(vertx, ControllerSettings.defaults(), clock);
        scheduler = context.scheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        context.webClient().close();
    }

    private ScanConfig stored(String target, boolean recurring, int interval) {
        ScanConfig config = Fleet.scan(target);
        config.setRecurring(recurring);
        config.setIntervalMinutes(interval);
        context.store().putScanConfig(config);
        return config;
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("start arms timers for active recurring scans only")
    void startArmsRecurringScans() {
        ScanConfig recurring = stored("10.0.0.1", true, 10);
        ScanConfig oneOff = stored("10.0.0.2", false, 10);
        ScanConfig inactive = stored("10.0.0.3", true, 10);
        inactive.setActive(false);

        scheduler.start();

        assertTrue(scheduler.isScheduled(recurring.getId()));
        assertFalse(scheduler.isScheduled(oneOff.getId()));
        assertFalse(scheduler.isScheduled(inactive.getId()));
        assertEquals(Instant.parse("2026-03-01T10:10:00Z"), recurring.getNextRun());
    }

    @Test
    @DisplayName("scheduled jobs are listed by next run")
    void jobsOrderedByNextRun() {
        scheduler.start();
        ScanConfig slow = stored("10.0.0.1", true, 60);
        ScanConfig fast = stored("10.0.0.2", true, 5);
        scheduler.schedule(slow);
        scheduler.schedule(fast);

        List<ScheduledJob> jobs = scheduler.scheduledJobs();

        assertEquals(2, jobs.size());
        assertEquals(fast.getId(), jobs.get(0).scanConfigId());
        assertEquals("scan_" + fast.getId(), jobs.get(0).jobId());
        assertEquals(slow.getId(), jobs.get(1).scanConfigId());
    }

    @Test
    @DisplayName("a tick advances lastRun and nextRun even when nothing is dispatched")
    void tickAdvancesRunTimes() throws Exception {
        scheduler.start();
        ScanConfig config = stored("10.0.0.1", true, 15);
        scheduler.schedule(config);
        clock.advance(Duration.ofMinutes(15));

        Optional<DispatchOutcome> outcome = await(scheduler.trigger(config.getId()));

        assertTrue(outcome.isPresent());
        assertEquals(DispatchOutcome.Kind.NO_ELIGIBLE_AGENTS, outcome.get().kind());
        assertEquals(Instant.parse("2026-03-01T10:15:00Z"), config.getLastRun());
        assertEquals(Instant.parse("2026-03-01T10:30:00Z"), config.getNextRun());
    }

    @Test
    @DisplayName("ticks for inactive or deleted scans are skipped")
    void tickSkipsInactiveAndMissing() throws Exception {
        ScanConfig config = stored("10.0.0.1", true, 15);
        config.setActive(false);

        assertTrue(await(scheduler.trigger(config.getId())).isEmpty());
        assertTrue(await(scheduler.trigger("deleted")).isEmpty());
        assertNull(config.getLastRun());
    }

    @Test
    @DisplayName("unscheduling cancels the timer and clears nextRun")
    void unschedule() {
        scheduler.start();
        ScanConfig config = stored("10.0.0.1", true, 15);
        scheduler.schedule(config);

        assertTrue(scheduler.unschedule(config.getId()));
        assertFalse(scheduler.unschedule(config.getId()));
        assertNull(config.getNextRun());
        assertTrue(scheduler.scheduledJobs().isEmpty());
    }

    @Test
    @DisplayName("a stopped scheduler arms nothing")
    void stoppedSchedulerIgnoresSchedule() {
        scheduler.start();
        scheduler.stop();
        ScanConfig config = stored("10.0.0.1", true, 15);

        scheduler.schedule(config);

        assertFalse(scheduler.isScheduled(config.getId()));
    }

    @Test
    @DisplayName("manual runs need an active scan and record lastRun")
    void runNow() throws Exception {
        ScanConfig config = stored("10.0.0.1", false, 60);

        DispatchOutcome outcome = await(scheduler.runNow(config));

        assertEquals(DispatchOutcome.Kind.NO_ELIGIBLE_AGENTS, outcome.kind());
        assertEquals(clock.instant(), config.getLastRun());

        config.setActive(false);
        assertThrows(ValidationException.class, () -> scheduler.runNow(config));
    }
}
