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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.exceptions.ValidationException;
import dev.mars.scanfleet.network.Ipv4;
import dev.mars.scanfleet.network.PortSpec;

import java.util.List;

/**
 * Instruction from the controller to scan one task's targets.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkOrder(
        @JsonProperty("scan_id") String scanId,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("result_id") String resultId,
        @JsonProperty("targets") List<String> targets,
        @JsonProperty("ports") String ports,
        @JsonProperty("scan_arguments") String scanArguments) {

    public WorkOrder {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    /**
     * Checks the order is complete and returns the expanded port list.
     *
     * @throws ValidationException naming the first problem found
     */
    public List<Integer> validate() throws ValidationException {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("task_id is required");
        }
        if (resultId == null || resultId.isBlank()) {
            throw new ValidationException("result_id is required");
        }
        if (targets.isEmpty()) {
            throw new ValidationException("targets must not be empty");
        }
        for (String target : targets) {
            if (!Ipv4.isValid(target)) {
                throw new ValidationException("Invalid target address '" + target + "'");
            }
        }
        return PortSpec.expand(ports);
    }
}
