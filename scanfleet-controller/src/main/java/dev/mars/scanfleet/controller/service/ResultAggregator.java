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
import dev.mars.scanfleet.core.ResultStatus;
import dev.mars.scanfleet.core.ScanTask;
import dev.mars.scanfleet.core.TaskStatus;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;
import dev.mars.scanfleet.core.exceptions.ResultClosedException;
import dev.mars.scanfleet.core.exceptions.UnknownResultException;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.result.ResultMerger;
import dev.mars.scanfleet.result.ResultSubmission;
import dev.mars.scanfleet.result.SubmissionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges the partial results agents submit into one {@link AggregatedResult} per task
 * group and decides when that result is finished.
 *
 * <p>Every change to a result or its tasks goes through a {@link ReentrantLock} held
 * per result id. That covers agent submissions as well as the dispatcher recording
 * work-order outcomes, so the two never interleave on one result. Different results
 * never contend.</p>
 *
 * <p>The thread that moves a result to a terminal status is the only one that runs the
 * completion steps: agents go back to {@code ONLINE} and the delta report is generated.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ResultAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    private final ScanFleetStateStore store;
    private final AgentRegistryService registry;
    private final DeltaReportService deltaReports;
    private final ControllerMetrics metrics;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ResultAggregator(ScanFleetStateStore store, AgentRegistryService registry,
                            DeltaReportService deltaReports, ControllerMetrics metrics, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.deltaReports = deltaReports;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Merges one submission.
     *
     * @throws UnknownResultException if the result id is unknown; nothing is changed
     * @throws ValidationException    if the task is missing, belongs to another result or another agent
     * @throws ResultClosedException  if the result is already terminal
     */
    public SubmissionSummary submit(ResultSubmission submission)
            throws UnknownResultException, ValidationException, ResultClosedException {
        String resultId = submission.resultId();
        if (resultId == null || resultId.isBlank()) {
            throw new ValidationException("result_id is required");
        }
        AggregatedResult result = store.findResult(resultId).orElseThrow(() -> {
            metrics.recordSubmission("unknown_result");
            return new UnknownResultException(resultId);
        });

        Completion completion;
        SubmissionSummary summary;
        ReentrantLock lock = lockFor(resultId);
        lock.lock();
        try {
            if (result.getStatus().isTerminal()) {
                metrics.recordSubmission("closed");
                throw new ResultClosedException(resultId, result.getStatus());
            }
            ScanTask task = requireTask(submission);
            Instant now = clock.instant();

            applyTaskStatus(task, submission, now);

            result.markStarted(now);
            result.replaceHosts(ResultMerger.merge(result.getHosts(), submission.parsedResults()));
            result.recordReportedErrors(task.getAgentId(), submission.summaryStats().errorTargets());
            result.applyCounters(ResultMerger.computeCounters(result.getHosts(), result.getReportedErrorTargets()));
            result.addContributingAgent(task.getAgentId());

            logger.debug("Merged submission: resultId={}, taskId={}, agentId={}, status={}, hosts={}",
                    resultId, task.getId(), task.getAgentId(), submission.status(),
                    submission.parsedResults().size());

            completion = closeIfFinished(result, now);
            summary = summarize(result);
        } finally {
            lock.unlock();
        }

        metrics.recordSubmission(submission.status().getValue());
        runCompletion(completion);
        return summary;
    }

    /**
     * Records that an agent accepted the work order for a task. A task that already
     * moved on, for instance because the agent submitted before its reply arrived,
     * is left alone.
     */
    public void markAssigned(String resultId, String taskId) {
        withTask(resultId, taskId, (result, task, now) -> {
            if (task.getStatus() == TaskStatus.PENDING) {
                task.transitionTo(TaskStatus.ASSIGNED, now);
                result.markStarted(now);
            }
        });
    }

    /**
     * Records that a work order could not be delivered.
     */
    public void markDispatchFailed(String resultId, String taskId, String error) {
        withTask(resultId, taskId, (result, task, now) -> {
            if (task.getStatus() == TaskStatus.PENDING) {
                task.transitionTo(TaskStatus.FAILED, now);
                task.setErrorMessage(error);
            } else {
                logger.debug("Work order for task {} failed after the task moved to {}, keeping it",
                        taskId, task.getStatus());
            }
        });
    }

    /**
     * Re-derives the result status from its tasks and closes it when they are all
     * terminal.
     *
     * @return the status after the refresh, or empty if the result does not exist
     */
    public Optional<ResultStatus> refreshStatus(String resultId) {
        Optional<AggregatedResult> found = store.findResult(resultId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        AggregatedResult result = found.get();
        Completion completion;
        ReentrantLock lock = lockFor(resultId);
        lock.lock();
        try {
            if (result.getStatus().isTerminal()) {
                return Optional.of(result.getStatus());
            }
            completion = closeIfFinished(result, clock.instant());
        } finally {
            lock.unlock();
        }
        runCompletion(completion);
        return Optional.of(result.getStatus());
    }

    /**
     * Removes a result and its tasks. Used when a dispatch reached no agent at all.
     * A result that already reached a terminal status is kept, since agents delivered
     * its data and delta reports may reference it.
     *
     * @return true if the result was removed
     */
    public boolean discard(String resultId, String taskGroupId) {
        ReentrantLock lock = lockFor(resultId);
        lock.lock();
        try {
            Optional<AggregatedResult> result = store.findResult(resultId);
            if (result.isPresent() && result.get().getStatus().isTerminal()) {
                logger.warn("Not discarding result {}: already {}", resultId, result.get().getStatus());
                return false;
            }
            int removedTasks = store.removeTaskGroup(taskGroupId);
            store.removeResult(resultId);
            logger.debug("Discarded result {} and {} task(s)", resultId, removedTasks);
            return true;
        } finally {
            lock.unlock();
            locks.remove(resultId, lock);
        }
    }

    public Optional<AggregatedResult> find(String resultId) {
        return store.findResult(resultId);
    }

    // ── Internal helpers ───────────────────────────────────────────────

    private ReentrantLock lockFor(String resultId) {
        return locks.computeIfAbsent(resultId, id -> new ReentrantLock());
    }

    private ScanTask requireTask(ResultSubmission submission) throws ValidationException {
        String taskId = submission.taskId();
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("task_id is required");
        }
        ScanTask task = store.findTask(taskId)
                .orElseThrow(() -> new ValidationException("Unknown task '" + taskId + "'"));
        if (!submission.resultId().equals(task.getResultId())) {
            throw new ValidationException("Task '" + taskId + "' does not belong to result '"
                    + submission.resultId() + "'");
        }
        if (submission.agentId() != null && !submission.agentId().equals(task.getAgentId())) {
            throw new ValidationException("Task '" + taskId + "' is not assigned to agent '"
                    + submission.agentId() + "'");
        }
        if (submission.status() == null) {
            throw new ValidationException("status is required");
        }
        return task;
    }

    /**
     * Moves the task as the submission says. A task still {@code PENDING} is first
     * marked assigned. Transitions the table refuses (a completed task reported failed,
     * late data for a task whose work order failed) keep the task as it is; the data is
     * merged regardless.
     */
    private void applyTaskStatus(ScanTask task, ResultSubmission submission, Instant now) {
        try {
            if (task.getStatus() == TaskStatus.PENDING) {
                task.transitionTo(TaskStatus.ASSIGNED, now);
            }
            Optional<TaskStatus> target = submission.status().taskStatus();
            if (target.isEmpty()) {
                return;
            }
            if (task.getStatus().canTransitionTo(target.get())) {
                task.transitionTo(target.get(), now);
                if (submission.status() == SubmissionStatus.FAILED && submission.errorMessage() != null) {
                    task.setErrorMessage(submission.errorMessage());
                }
            } else {
                logger.warn("Ignoring status {} for task {} in state {}; data is still merged",
                        submission.status(), task.getId(), task.getStatus());
            }
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Must be called with the result lock held.
     *
     * @return the completion work to run after unlocking, or null if the result is still open
     */
    private Completion closeIfFinished(AggregatedResult result, Instant now) {
        List<ScanTask> tasks = store.tasksForResult(result.getId());
        ResultStatus derived = ResultStatus.derive(tasks.stream().map(ScanTask::getStatus).toList());
        if (!derived.isTerminal()) {
            return null;
        }
        try {
            result.transitionTo(derived, now);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        if (derived == ResultStatus.FAILED) {
            result.setErrorMessage(tasks.stream()
                    .map(ScanTask::getErrorMessage)
                    .filter(m -> m != null && !m.isBlank())
                    .findFirst()
                    .orElse("All tasks failed"));
        }
        logger.info("Result {} of scan {} finished: status={}, hosts={}, openPorts={}, agents={}",
                result.getId(), result.getScanConfigId(), derived, result.getTotalTargets(),
                result.getTotalOpenPorts(), result.getContributingAgents());

        Set<String> agents = new LinkedHashSet<>();
        tasks.forEach(t -> agents.add(t.getAgentId()));
        return new Completion(result, agents);
    }

    private void runCompletion(Completion completion) {
        if (completion == null) {
            return;
        }
        locks.remove(completion.result().getId());

        Set<String> idle = new LinkedHashSet<>(completion.agentIds());
        store.tasks().stream()
                .filter(t -> !t.getStatus().isTerminal())
                .forEach(t -> idle.remove(t.getAgentId()));
        registry.markIdle(idle);

        try {
            deltaReports.onResultTerminal(completion.result());
        } catch (RuntimeException e) {
            logger.error("Delta report generation failed for result {}: {}",
                    completion.result().getId(), e.getMessage(), e);
        }
    }

    private void withTask(String resultId, String taskId, TaskUpdate update) {
        Optional<AggregatedResult> result = store.findResult(resultId);
        Optional<ScanTask> task = store.findTask(taskId);
        if (result.isEmpty() || task.isEmpty()) {
            logger.debug("Ignoring task update for missing result/task: resultId={}, taskId={}", resultId, taskId);
            return;
        }
        ReentrantLock lock = lockFor(resultId);
        lock.lock();
        try {
            if (result.get().getStatus().isTerminal()) {
                return;
            }
            update.apply(result.get(), task.get(), clock.instant());
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private static SubmissionSummary summarize(AggregatedResult result) {
        return new SubmissionSummary(result.getId(), result.getStatus(), result.getTotalTargets(),
                result.getCompletedTargets(), result.getFailedTargets(), result.getTotalOpenPorts(),
                List.copyOf(result.getContributingAgents()));
    }

    @FunctionalInterface
    private interface TaskUpdate {
        void apply(AggregatedResult result, ScanTask task, Instant now) throws InvalidTransitionException;
    }

    private record Completion(AggregatedResult result, Set<String> agentIds) {
    }
}
