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

package dev.mars.scanfleet.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.scanfleet.core.HostResult;

import java.util.Map;

/**
 * Partial or final scan data one agent submits for its task. Agents may submit
 * any number of times per task; the controller merges every submission.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultSubmission(
        @JsonProperty("result_id") String resultId,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("status") SubmissionStatus status,
        @JsonProperty("parsed_results") Map<String, HostResult> parsedResults,
        @JsonProperty("summary_stats") SummaryStats summaryStats,
        @JsonProperty("error_message") String errorMessage) {

    public ResultSubmission {
        parsedResults = parsedResults == null ? Map.of() : Map.copyOf(parsedResults);
        summaryStats = summaryStats == null ? SummaryStats.EMPTY : summaryStats;
    }

    /**
     * Copy of this submission attributed to the given agent, used when the agent
     * id comes from the request path rather than the payload.
     */
    public ResultSubmission withAgentId(String agentId) {
        return new ResultSubmission(resultId, taskId, agentId, status, parsedResults, summaryStats, errorMessage);
    }
}
