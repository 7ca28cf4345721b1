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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.Coverage;

import java.util.List;

/**
 * Result of dispatching one scan execution. Whole-execution failures are reported
 * through this value instead of an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchOutcome(
        @JsonProperty("outcome") Kind kind,
        @JsonProperty("scan_id") String scanConfigId,
        @JsonProperty("result_id") String resultId,
        @JsonProperty("task_group_id") String taskGroupId,
        @JsonProperty("total_targets") int totalTargets,
        @JsonProperty("assigned_targets") int assignedTargets,
        @JsonProperty("dispatched_agents") List<String> dispatchedAgents,
        @JsonProperty("failed_agents") List<String> failedAgents,
        @JsonProperty("coverage") Coverage coverage,
        @JsonProperty("message") String message) {

    public enum Kind {
        /** At least one agent accepted its work order */
        DISPATCHED,
        /** No approved, live agent owns any of the targets */
        NO_ELIGIBLE_AGENTS,
        /** Tasks were built but no agent accepted its work order */
        DISPATCH_FAILED,
        /** The target expression could not be resolved */
        INVALID_TARGET
    }

    public DispatchOutcome {
        dispatchedAgents = dispatchedAgents == null ? List.of() : List.copyOf(dispatchedAgents);
        failedAgents = failedAgents == null ? List.of() : List.copyOf(failedAgents);
    }

    public static DispatchOutcome dispatched(String scanConfigId, String resultId, String taskGroupId,
                                             int totalTargets, int assignedTargets,
                                             List<String> dispatchedAgents, List<String> failedAgents,
                                             Coverage coverage) {
        return new DispatchOutcome(Kind.DISPATCHED, scanConfigId, resultId, taskGroupId, totalTargets,
                assignedTargets, dispatchedAgents, failedAgents, coverage,
                "Scan dispatched to " + dispatchedAgents.size() + " agent(s)");
    }

    public static DispatchOutcome noEligibleAgents(String scanConfigId, int totalTargets) {
        return new DispatchOutcome(Kind.NO_ELIGIBLE_AGENTS, scanConfigId, null, null, totalTargets, 0,
                List.of(), List.of(), null, "No eligible agents cover the scan target");
    }

    public static DispatchOutcome dispatchFailed(String scanConfigId, int totalTargets, List<String> failedAgents) {
        return new DispatchOutcome(Kind.DISPATCH_FAILED, scanConfigId, null, null, totalTargets, 0,
                List.of(), failedAgents, null, "No agent accepted the work order");
    }

    public static DispatchOutcome invalidTarget(String scanConfigId, String reason) {
        return new DispatchOutcome(Kind.INVALID_TARGET, scanConfigId, null, null, 0, 0,
                List.of(), List.of(), null, reason);
    }

    public boolean isDispatched() {
        return kind == Kind.DISPATCHED;
    }
}
