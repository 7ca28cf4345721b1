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

package dev.mars.scanfleet.controller;

import dev.mars.scanfleet.controller.config.ControllerSettings;
import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import dev.mars.scanfleet.controller.service.AgentRegistryService;
import dev.mars.scanfleet.controller.service.DeltaReportService;
import dev.mars.scanfleet.controller.service.HeartbeatMonitor;
import dev.mars.scanfleet.controller.service.ResultAggregator;
import dev.mars.scanfleet.controller.service.ScanConfigService;
import dev.mars.scanfleet.controller.service.ScanScheduler;
import dev.mars.scanfleet.controller.service.TaskDispatcher;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.time.Clock;
import java.time.Duration;

/**
 * The controller's services, wired once and passed explicitly to everything that
 * needs them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ScanFleetContext {

    private final ControllerSettings settings;
    private final Clock clock;
    private final ScanFleetStateStore store;
    private final ControllerMetrics metrics;
    private final WebClient webClient;
    private final AgentRegistryService registry;
    private final HeartbeatMonitor heartbeatMonitor;
    private final DeltaReportService deltaReports;
    private final ResultAggregator aggregator;
    private final TaskDispatcher dispatcher;
    private final ScanScheduler scheduler;
    private final ScanConfigService scanConfigs;

    private ScanFleetContext(Vertx vertx, ControllerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.store = new ScanFleetStateStore();
        this.metrics = new ControllerMetrics();
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout((int) settings.dispatchTimeoutMs())
                .setIdleTimeout((int) Math.max(1, settings.dispatchTimeoutMs() / 1000))
                .setUserAgent("ScanFleet-Controller/" + settings.version()));
        this.registry = new AgentRegistryService(store, Duration.ofMillis(settings.heartbeatTimeoutMs()), clock);
        this.heartbeatMonitor = new HeartbeatMonitor(vertx, registry, metrics, clock,
                settings.heartbeatCheckIntervalMs());
        this.deltaReports = new DeltaReportService(store, metrics, clock);
        this.aggregator = new ResultAggregator(store, registry, deltaReports, metrics, clock);
        this.dispatcher = new TaskDispatcher(webClient, store, registry, aggregator, metrics, clock,
                settings.dispatchTimeoutMs(), settings.maxTargetAddresses());
        this.scheduler = new ScanScheduler(vertx, store, dispatcher, clock);
        this.scanConfigs = new ScanConfigService(store, scheduler, clock);
    }

    public static ScanFleetContext create(Vertx vertx, ControllerSettings settings) {
        return new ScanFleetContext(vertx, settings, Clock.systemUTC());
    }

    public static ScanFleetContext create(Vertx vertx, ControllerSettings settings, Clock clock) {
        return new ScanFleetContext(vertx, settings, clock);
    }

    public ControllerSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public ScanFleetStateStore store() {
        return store;
    }

    public ControllerMetrics metrics() {
        return metrics;
    }

    public WebClient webClient() {
        return webClient;
    }

    public AgentRegistryService registry() {
        return registry;
    }

    public HeartbeatMonitor heartbeatMonitor() {
        return heartbeatMonitor;
    }

    public DeltaReportService deltaReports() {
        return deltaReports;
    }

    public ResultAggregator aggregator() {
        return aggregator;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public ScanScheduler scheduler() {
        return scheduler;
    }

    public ScanConfigService scanConfigs() {
        return scanConfigs;
    }
}
