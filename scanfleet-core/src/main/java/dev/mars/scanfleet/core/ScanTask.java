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

package dev.mars.scanfleet.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.List;

/**
 * One unit of scan work: a subset of a configuration's targets assigned to a
 * single agent.
 *
 * <p>Tasks are created together with their siblings at dispatch time and share
 * a task group id. They are never deleted once dispatch succeeds; only their
 * status and timestamps change.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanTask {

    @JsonProperty("id")
    private String id;

    @JsonProperty("task_group_id")
    private String taskGroupId;

    @JsonProperty("scan_id")
    private String scanConfigId;

    @JsonProperty("result_id")
    private String resultId;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("targets")
    private List<String> targets;

    @JsonProperty("status")
    private TaskStatus status = TaskStatus.PENDING;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("assigned_at")
    private Instant assignedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("error_message")
    private String errorMessage;

    public ScanTask() {
    }

    public ScanTask(String id, String taskGroupId, String scanConfigId, String resultId,
                    String agentId, List<String> targets, Instant createdAt) {
        this.id = id;
        this.taskGroupId = taskGroupId;
        this.scanConfigId = scanConfigId;
        this.resultId = resultId;
        this.agentId = agentId;
        this.targets = List.copyOf(targets);
        this.createdAt = createdAt;
    }

    /**
     * Moves this task to a new status, stamping the matching timestamp.
     *
     * @param target the new status
     * @param at     when the transition happened
     * @throws InvalidTransitionException if the transition table does not allow it
     */
    public synchronized void transitionTo(TaskStatus target, Instant at) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        if (target == TaskStatus.ASSIGNED) {
            assignedAt = at;
        } else if (target.isTerminal() && completedAt == null) {
            completedAt = at;
        }
        status = target;
    }

    public String getId() {
        return id;
    }

    public String getTaskGroupId() {
        return taskGroupId;
    }

    public String getScanConfigId() {
        return scanConfigId;
    }

    public String getResultId() {
        return resultId;
    }

    public String getAgentId() {
        return agentId;
    }

    public List<String> getTargets() {
        return targets;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getAssignedAt() {
        return assignedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    @Override
    public String toString() {
        return "ScanTask{id='" + id + "', agent='" + agentId + "', targets=" + targets.size()
                + ", status=" + status + '}';
    }
}
