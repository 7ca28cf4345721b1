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

package dev.mars.scanfleet.agent.service;

import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import dev.mars.scanfleet.agent.scanner.PortScanner;
import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.HostState;
import dev.mars.scanfleet.result.ResultSubmission;
import dev.mars.scanfleet.result.SubmissionStatus;
import dev.mars.scanfleet.result.SummaryStats;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs accepted work orders and reports their results progressively.
 *
 * <p>Targets are scanned in batches on a dedicated worker pool. After every batch
 * except the last the hosts scanned so far are submitted with status
 * {@code running}; the final submission carries every host and the terminal
 * status. A target the scanner cannot probe is reported with state {@code error};
 * a failure of the scan itself ends the task with status {@code failed} and
 * whatever was collected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 */
public class ScanExecutionService {

    private static final Logger logger = LoggerFactory.getLogger(ScanExecutionService.class);

    /**
     * Result of offering a work order.
     */
    public enum Admission {
        ACCEPTED,
        DUPLICATE,
        BUSY,
        STOPPED
    }

    private final AgentSettings settings;
    private final PortScanner scanner;
    private final ResultSubmissionService submissions;
    private final AgentMetrics metrics;
    private final WorkerExecutor workerExecutor;

    private final Map<String, Future<SubmissionStatus>> running = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ScanExecutionService(Vertx vertx, AgentSettings settings, PortScanner scanner,
                                ResultSubmissionService submissions, AgentMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "AgentSettings cannot be null");
        this.scanner = Objects.requireNonNull(scanner, "PortScanner cannot be null");
        this.submissions = Objects.requireNonNull(submissions, "ResultSubmissionService cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "AgentMetrics cannot be null");
        this.workerExecutor = vertx.createSharedWorkerExecutor("scanfleet-scan", settings.maxConcurrentScans());
        logger.info("ScanExecutionService initialized ({} concurrent scans, batch size {})",
                settings.maxConcurrentScans(), settings.progressBatchSize());
    }

    /**
     * Starts the order unless the agent is stopped, already runs this task, or is at capacity.
     *
     * @param order validated work order
     * @param ports expanded ports from {@link WorkOrder#validate()}
     */
    public synchronized Admission accept(WorkOrder order, List<Integer> ports) {
        if (closed.get()) {
            return Admission.STOPPED;
        }
        if (running.containsKey(order.taskId())) {
            return Admission.DUPLICATE;
        }
        if (running.size() >= settings.maxConcurrentScans()) {
            return Admission.BUSY;
        }
        Future<SubmissionStatus> execution = execute(order, ports);
        if (!execution.isComplete()) {
            running.put(order.taskId(), execution);
            execution.onComplete(ar -> running.remove(order.taskId()));
        }
        return Admission.ACCEPTED;
    }

    /**
     * Completion of the given task's run, or {@code null} when it is not running.
     */
    public Future<SubmissionStatus> execution(String taskId) {
        return running.get(taskId);
    }

    public int getActiveScanCount() {
        return running.size();
    }

    Future<SubmissionStatus> execute(WorkOrder order, List<Integer> ports) {
        metrics.scanStarted();
        logger.info("Scan started: taskId={}, resultId={}, targets={}, ports={}",
                order.taskId(), order.resultId(), order.targets().size(), ports.size());

        Map<String, HostResult> collected = new LinkedHashMap<>();
        List<List<String>> batches = partition(order.targets(), Math.max(1, settings.progressBatchSize()));

        Future<Void> chain = Future.succeededFuture();
        for (int i = 0; i < batches.size(); i++) {
            List<String> batch = batches.get(i);
            boolean last = i == batches.size() - 1;
            chain = chain
                    .compose(v -> workerExecutor.executeBlocking(
                            () -> scanBatch(batch, ports, order.scanArguments()), false))
                    .compose(batchResults -> {
                        collected.putAll(batchResults);
                        metrics.recordTargetsScanned(batchResults.size());
                        if (last) {
                            return Future.<Void>succeededFuture();
                        }
                        return submissions.submit(submission(order, SubmissionStatus.RUNNING, batchResults,
                                        order.targets().size(), null))
                                .onSuccess(delivered -> {
                                    if (!delivered) {
                                        logger.warn("Progress for task {} not delivered, continuing", order.taskId());
                                    }
                                })
                                .<Void>mapEmpty();
                    });
        }

        return chain
                .map(v -> SubmissionStatus.COMPLETED)
                .recover(err -> {
                    logger.error("Scan of task {} failed after {} of {} targets",
                            order.taskId(), collected.size(), order.targets().size(), err);
                    return Future.succeededFuture(SubmissionStatus.FAILED);
                })
                .compose(status -> {
                    String error = status == SubmissionStatus.FAILED ? "Scan aborted on agent " + settings.agentId() : null;
                    return submissions.submit(submission(order, status, collected, order.targets().size(), error))
                            .recover(err -> {
                                logger.error("Final submission for task {} could not be built", order.taskId(), err);
                                return Future.succeededFuture(false);
                            })
                            .map(delivered -> {
                                metrics.scanFinished(status.getValue());
                                logger.info("Scan finished: taskId={}, status={}, hosts={}, delivered={}",
                                        order.taskId(), status, collected.size(), delivered);
                                return status;
                            });
                });
    }

    private Map<String, HostResult> scanBatch(List<String> batch, List<Integer> ports, String scanArguments) {
        Map<String, HostResult> results = new LinkedHashMap<>();
        for (String target : batch) {
            try {
                results.put(target, scanner.scan(target, ports, scanArguments));
            } catch (IOException e) {
                logger.warn("Target {} could not be scanned: {}", target, e.getMessage());
                results.put(target, new HostResult("", HostState.ERROR, List.of(), Map.of()));
            }
        }
        return results;
    }

    private ResultSubmission submission(WorkOrder order, SubmissionStatus status, Map<String, HostResult> hosts,
                                        int totalTargets, String errorMessage) {
        int up = 0;
        int down = 0;
        int errors = 0;
        int openPorts = 0;
        for (HostResult host : hosts.values()) {
            switch (host.state()) {
                case UP -> up++;
                case DOWN -> down++;
                case ERROR -> errors++;
            }
            openPorts += host.openPorts().size();
        }
        SummaryStats stats = new SummaryStats(totalTargets, up, down, errors, openPorts);
        return new ResultSubmission(order.resultId(), order.taskId(), settings.agentId(), status,
                new LinkedHashMap<>(hosts), stats, errorMessage);
    }

    private static List<List<String>> partition(List<String> targets, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < targets.size(); i += size) {
            batches.add(targets.subList(i, Math.min(targets.size(), i + size)));
        }
        return batches;
    }

    public Future<Void> shutdown() {
        if (closed.getAndSet(true)) {
            return Future.succeededFuture();
        }
        logger.info("Shutting down scan execution service ({} scans running)", running.size());
        return workerExecutor.close();
    }
}
