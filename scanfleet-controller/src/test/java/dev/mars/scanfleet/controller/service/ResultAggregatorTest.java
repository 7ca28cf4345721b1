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

import dev.mars.scanfleet.agent.AgentState;
import dev.mars.scanfleet.controller.Fleet;
import dev.mars.scanfleet.controller.MutableClock;
import dev.mars.scanfleet.controller.observability.ControllerMetrics;
import dev.mars.scanfleet.controller.state.ScanFleetStateStore;
import dev.mars.scanfleet.core.AggregatedResult;
import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.ResultStatus;
import dev.mars.scanfleet.core.ScanTask;
import dev.mars.scanfleet.core.TaskStatus;
import dev.mars.scanfleet.core.exceptions.ResultClosedException;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.delta.DeltaReport;
import dev.mars.scanfleet.result.ResultSubmission;
import dev.mars.scanfleet.result.SubmissionStatus;
import dev.mars.scanfleet.result.SummaryStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ResultAggregator}: merging, status derivation, closure and
 * the hand-off to delta reporting.
 */
@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

    private MutableClock clock;
    private ScanFleetStateStore store;
    private AgentRegistryService registry;
    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new ScanFleetStateStore();
        ControllerMetrics metrics = new ControllerMetrics();
        registry = new AgentRegistryService(store, Duration.ofMinutes(3), clock);
        DeltaReportService deltaReports = new DeltaReportService(store, metrics, clock);
        aggregator = new ResultAggregator(store, registry, deltaReports, metrics, clock);

        Fleet.onlineAgent(registry, "a1", 9001, "10.0.0.0/24");
        Fleet.onlineAgent(registry, "a2", 9002, "10.0.1.0/24");
    }

    /**
     * Creates a result with one assigned task per agent, as the dispatcher would.
     */
    private List<ScanTask> dispatch(String scanId, Map<String, List<String>> targetsByAgent) {
        String groupId = UUID.randomUUID().toString();
        AggregatedResult result = new AggregatedResult(UUID.randomUUID().toString(), scanId, groupId, clock.instant());
        List<ScanTask> tasks = new ArrayList<>();
        targetsByAgent.forEach((agentId, targets) -> tasks.add(new ScanTask(UUID.randomUUID().toString(), groupId,
                scanId, result.getId(), agentId, targets, clock.instant())));
        store.putResult(result);
        store.putTasks(tasks);
        for (ScanTask task : tasks) {
            aggregator.markAssigned(result.getId(), task.getId());
            registry.markScanning(task.getAgentId());
        }
        return tasks;
    }

    private List<ScanTask> twoAgentDispatch(String scanId) {
        Map<String, List<String>> targets = new LinkedHashMap<>();
        targets.put("a1", List.of("10.0.0.1", "10.0.0.2"));
        targets.put("a2", List.of("10.0.1.1"));
        return dispatch(scanId, targets);
    }

    private AggregatedResult result(ScanTask task) {
        return store.findResult(task.getResultId()).orElseThrow();
    }

    @Nested
    @DisplayName("Discard")
    class Discard {

        @Test
        @DisplayName("a result nobody reported on is removed with its tasks")
        void removesPendingResult() {
            ScanTask task = dispatch("scan-1", Map.of("a1", List.of("10.0.0.1"))).get(0);
            AggregatedResult pending = result(task);

            assertTrue(aggregator.discard(pending.getId(), pending.getTaskGroupId()));

            assertTrue(store.findResult(pending.getId()).isEmpty());
            assertTrue(store.findTask(task.getId()).isEmpty());
        }

        @Test
        @DisplayName("a result agents already finished is kept")
        void keepsTerminalResult() throws Exception {
            ScanTask task = dispatch("scan-1", Map.of("a1", List.of("10.0.0.1"))).get(0);
            aggregator.submit(Fleet.submission(task, SubmissionStatus.COMPLETED, Map.of("10.0.0.1", Fleet.up(22))));
            AggregatedResult finished = result(task);
            assertEquals(ResultStatus.COMPLETED, finished.getStatus());

            assertFalse(aggregator.discard(finished.getId(), finished.getTaskGroupId()));

            assertTrue(store.findResult(finished.getId()).isPresent());
            assertTrue(store.findTask(task.getId()).isPresent());
            assertEquals(List.of(22), store.findResult(finished.getId()).orElseThrow()
                    .getHosts().get("10.0.0.1").openPorts());
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("progressive submissions accumulate while the result stays pending")
        void progressiveSubmissions() throws Exception {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");
            ScanTask first = tasks.get(0);

            aggregator.submit(Fleet.submission(first, SubmissionStatus.RUNNING, Map.of("10.0.0.1", Fleet.up(22))));
            SubmissionSummary summary = aggregator.submit(Fleet.submission(first, SubmissionStatus.RUNNING,
                    Map.of("10.0.0.2", Fleet.up(80, 443))));

            assertEquals(ResultStatus.PENDING, summary.status());
            assertEquals(2, summary.totalTargets());
            assertEquals(2, summary.completedTargets());
            assertEquals(3, summary.totalOpenPorts());
            assertEquals(List.of("a1"), summary.contributingAgents());
            assertEquals(TaskStatus.ASSIGNED, store.findTask(first.getId()).orElseThrow().getStatus());
            assertNotNull(result(first).getStartedAt());
        }

        @Test
        @DisplayName("ports of the same host are unioned across submissions")
        void portsUnioned() throws Exception {
            ScanTask task = twoAgentDispatch("scan-1").get(0);

            aggregator.submit(Fleet.submission(task, SubmissionStatus.RUNNING, Map.of("10.0.0.1", Fleet.up(22))));
            aggregator.submit(Fleet.submission(task, SubmissionStatus.RUNNING, Map.of("10.0.0.1", Fleet.up(80))));

            HostResult host = result(task).getHosts().get("10.0.0.1");
            assertEquals(List.of(22, 80), host.openPorts());
        }

        @Test
        @DisplayName("resubmitting identical data changes nothing")
        void resubmissionIsIdempotent() throws Exception {
            ScanTask task = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = Fleet.submission(task, SubmissionStatus.RUNNING,
                    Map.of("10.0.0.1", Fleet.up(22, 80)));

            SubmissionSummary once = aggregator.submit(submission);
            SubmissionSummary twice = aggregator.submit(submission);

            assertEquals(once.totalTargets(), twice.totalTargets());
            assertEquals(once.totalOpenPorts(), twice.totalOpenPorts());
            assertEquals(once.completedTargets(), twice.completedTargets());
        }

        @Test
        @DisplayName("failed targets are the larger of error hosts and reported errors")
        void failedTargetsFromSummaries() throws Exception {
            ScanTask task = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = new ResultSubmission(task.getResultId(), task.getId(), task.getAgentId(),
                    SubmissionStatus.RUNNING, Map.of("10.0.0.1", Fleet.up(22)),
                    new SummaryStats(2, 1, 0, 1, 1), null);

            SubmissionSummary summary = aggregator.submit(submission);

            assertEquals(1, summary.failedTargets());
            assertEquals(1, summary.completedTargets());
        }

        @Test
        @DisplayName("a submission arriving before the work-order reply moves the task to assigned")
        void earlySubmission() throws Exception {
            String groupId = "g";
            AggregatedResult result = new AggregatedResult("r-early", "scan-1", groupId, clock.instant());
            ScanTask task = new ScanTask("t-early", groupId, "scan-1", "r-early", "a1", List.of("10.0.0.1"),
                    clock.instant());
            store.putResult(result);
            store.putTasks(List.of(task));

            aggregator.submit(Fleet.submission(task, SubmissionStatus.RUNNING, Map.of("10.0.0.1", Fleet.up(22))));
            assertEquals(TaskStatus.ASSIGNED, task.getStatus());

            aggregator.markAssigned("r-early", "t-early");
            assertEquals(TaskStatus.ASSIGNED, task.getStatus());
        }

        @Test
        @DisplayName("submissions from many threads are all merged")
        void concurrentSubmissions() throws Exception {
            Map<String, List<String>> targets = new LinkedHashMap<>();
            List<String> hosts = new ArrayList<>();
            for (int i = 1; i <= 40; i++) {
                hosts.add("10.0.0." + i);
            }
            targets.put("a1", hosts);
            ScanTask task = dispatch("scan-1", targets).get(0);

            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<SubmissionSummary>> futures = new ArrayList<>();
            for (String host : hosts) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return aggregator.submit(Fleet.submission(task, SubmissionStatus.RUNNING,
                            Map.of(host, Fleet.up(22))));
                }));
            }
            start.countDown();
            for (Future<SubmissionSummary> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            AggregatedResult result = result(task);
            assertEquals(40, result.getTotalTargets());
            assertEquals(40, result.getTotalOpenPorts());
        }
    }

    @Nested
    @DisplayName("Status derivation")
    class StatusDerivation {

        @Test
        @DisplayName("all tasks completed gives COMPLETED and frees the agents")
        void allCompleted() throws Exception {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");

            aggregator.submit(Fleet.submission(tasks.get(0), SubmissionStatus.COMPLETED,
                    Map.of("10.0.0.1", Fleet.up(22), "10.0.0.2", Fleet.down())));
            assertEquals(ResultStatus.PENDING, result(tasks.get(0)).getStatus());
            assertEquals(AgentState.SCANNING, registry.find("a2").orElseThrow().getState());

            SubmissionSummary summary = aggregator.submit(Fleet.submission(tasks.get(1), SubmissionStatus.COMPLETED,
                    Map.of("10.0.1.1", Fleet.up(443))));

            assertEquals(ResultStatus.COMPLETED, summary.status());
            assertNotNull(result(tasks.get(0)).getCompletedAt());
            assertEquals(List.of("a1", "a2"), summary.contributingAgents());
            assertEquals(AgentState.ONLINE, registry.find("a1").orElseThrow().getState());
            assertEquals(AgentState.ONLINE, registry.find("a2").orElseThrow().getState());
        }

        @Test
        @DisplayName("a mix of completed and failed tasks gives PARTIAL")
        void mixedGivesPartial() throws Exception {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");

            aggregator.submit(Fleet.submission(tasks.get(0), SubmissionStatus.COMPLETED,
                    Map.of("10.0.0.1", Fleet.up(22))));
            SubmissionSummary summary = aggregator.submit(Fleet.failure(tasks.get(1), "nmap crashed"));

            assertEquals(ResultStatus.PARTIAL, summary.status());
            assertEquals("nmap crashed", store.findTask(tasks.get(1).getId()).orElseThrow().getErrorMessage());
        }

        @Test
        @DisplayName("all tasks failed gives FAILED with the first error")
        void allFailed() throws Exception {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");

            aggregator.submit(Fleet.failure(tasks.get(0), "permission denied"));
            SubmissionSummary summary = aggregator.submit(Fleet.failure(tasks.get(1), "timeout"));

            assertEquals(ResultStatus.FAILED, summary.status());
            assertNotNull(result(tasks.get(0)).getErrorMessage());
        }

        @Test
        @DisplayName("a completed task reported failed later keeps its status")
        void refusedTransitionKeepsStatus() throws Exception {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");
            ScanTask first = tasks.get(0);

            aggregator.submit(Fleet.submission(first, SubmissionStatus.COMPLETED, Map.of("10.0.0.1", Fleet.up(22))));
            aggregator.submit(Fleet.failure(first, "late failure"));

            assertEquals(TaskStatus.COMPLETED, store.findTask(first.getId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("refreshStatus closes a result whose tasks all failed to dispatch")
        void refreshAfterDispatchFailures() {
            List<ScanTask> tasks = twoAgentDispatch("scan-1");
            String resultId = tasks.get(0).getResultId();
            String groupId = "g2";
            AggregatedResult pending = new AggregatedResult("r2", "scan-2", groupId, clock.instant());
            ScanTask t = new ScanTask("t2", groupId, "scan-2", "r2", "a1", List.of("10.0.0.1"), clock.instant());
            store.putResult(pending);
            store.putTasks(List.of(t));

            aggregator.markDispatchFailed("r2", "t2", "connection refused");
            assertEquals(ResultStatus.FAILED, aggregator.refreshStatus("r2").orElseThrow());
            assertEquals("connection refused", pending.getErrorMessage());
            assertEquals(ResultStatus.PENDING, aggregator.refreshStatus(resultId).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("unknown result id is rejected and nothing changes")
        void unknownResult() {
            ScanTask task = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = new ResultSubmission("missing", task.getId(), "a1",
                    SubmissionStatus.COMPLETED, Map.of("10.0.0.1", Fleet.up(22)), null, null);

            assertThrows(UnknownResultException.class, () -> aggregator.submit(submission));
            assertEquals(TaskStatus.ASSIGNED, store.findTask(task.getId()).orElseThrow().getStatus());
            assertTrue(result(task).getHosts().isEmpty());
        }

        @Test
        @DisplayName("a closed result refuses further data")
        void closedResult() throws Exception {
            Map<String, List<String>> targets = Map.of("a1", List.of("10.0.0.1"));
            ScanTask task = dispatch("scan-1", targets).get(0);
            aggregator.submit(Fleet.submission(task, SubmissionStatus.COMPLETED, Map.of("10.0.0.1", Fleet.up(22))));

            ResultClosedException e = assertThrows(ResultClosedException.class, () -> aggregator.submit(
                    Fleet.submission(task, SubmissionStatus.RUNNING, Map.of("10.0.0.9", Fleet.up(80)))));

            assertEquals(ResultStatus.COMPLETED, e.getStatus());
            assertFalse(result(task).getHosts().containsKey("10.0.0.9"));
        }

        @Test
        @DisplayName("a task of another agent is rejected")
        void wrongAgent() {
            ScanTask task = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = Fleet.submission(task, SubmissionStatus.RUNNING, Map.of())
                    .withAgentId("a2");

            assertThrows(ValidationException.class, () -> aggregator.submit(submission));
        }

        @Test
        @DisplayName("a task of another result is rejected")
        void taskOfOtherResult() {
            ScanTask first = twoAgentDispatch("scan-1").get(0);
            ScanTask other = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = new ResultSubmission(first.getResultId(), other.getId(), "a1",
                    SubmissionStatus.RUNNING, Map.of(), null, null);

            assertThrows(ValidationException.class, () -> aggregator.submit(submission));
        }

        @Test
        @DisplayName("a missing status is rejected")
        void missingStatus() {
            ScanTask task = twoAgentDispatch("scan-1").get(0);
            ResultSubmission submission = new ResultSubmission(task.getResultId(), task.getId(), "a1",
                    null, Map.of(), null, null);

            assertThrows(ValidationException.class, () -> aggregator.submit(submission));
        }
    }

    @Nested
    @DisplayName("Delta hand-off")
    class DeltaHandOff {

        @Test
        @DisplayName("the second finished execution of a scan produces a delta report")
        void secondExecutionProducesDelta() throws Exception {
            Map<String, List<String>> targets = Map.of("a1", List.of("10.0.0.1", "10.0.0.2"));

            ScanTask first = dispatch("scan-1", targets).get(0);
            aggregator.submit(Fleet.submission(first, SubmissionStatus.COMPLETED,
                    Map.of("10.0.0.1", Fleet.up(80))));
            assertTrue(store.deltaReportsForScan("scan-1").isEmpty());

            clock.advance(Duration.ofHours(1));
            ScanTask second = dispatch("scan-1", targets).get(0);
            aggregator.submit(Fleet.submission(second, SubmissionStatus.COMPLETED,
                    Map.of("10.0.0.1", Fleet.up(80, 22), "10.0.0.2", Fleet.up(443))));

            List<DeltaReport> reports = store.deltaReportsForScan("scan-1");
            assertEquals(1, reports.size());
            DeltaReport report = reports.get(0);
            assertEquals(first.getResultId(), report.getBaselineResultId());
            assertEquals(second.getResultId(), report.getCurrentResultId());
            assertEquals(2, report.getNewPortsCount());
            assertEquals(1, report.getNewHostsCount());
            assertEquals(1, report.criticalPortsOpened().size());
        }
    }
}
