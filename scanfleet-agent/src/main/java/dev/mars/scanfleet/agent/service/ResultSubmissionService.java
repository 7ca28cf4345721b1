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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import dev.mars.scanfleet.core.ScanFleetJson;
import dev.mars.scanfleet.result.ResultSubmission;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers result submissions to the controller.
 *
 * <p>This is the only component that retries. Transport errors and {@code 5xx}
 * answers (the controller draining, restarting or timing out the merge) are retried
 * up to the configured number of attempts with a fixed delay. A {@code 4xx} answer is
 * final: the controller has seen the submission and refused it, for example because
 * the result is already closed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-11
 */
public class ResultSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(ResultSubmissionService.class);

    private final Vertx vertx;
    private final AgentSettings settings;
    private final AgentMetrics metrics;
    private final WebClient webClient;

    public ResultSubmissionService(Vertx vertx, AgentSettings settings, AgentMetrics metrics) {
        this.vertx = vertx;
        this.settings = settings;
        this.metrics = metrics;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(settings.httpConnectTimeoutMs())
                .setUserAgent("ScanFleet-Agent/" + settings.version()));
        logger.debug("ResultSubmissionService initialized (retryAttempts={}, retryDelay={}ms)",
                settings.retryAttempts(), settings.retryDelayMs());
    }

    /**
     * Submits the given data, retrying as described above.
     *
     * @return future completing with {@code true} once the controller accepted the
     *         submission, {@code false} if it refused it or every attempt failed
     */
    public Future<Boolean> submit(ResultSubmission submission) {
        Buffer payload;
        try {
            payload = Buffer.buffer(ScanFleetJson.mapper().writeValueAsBytes(submission));
        } catch (JsonProcessingException e) {
            logger.error("Cannot serialize submission for task {}", submission.taskId(), e);
            return Future.failedFuture(e);
        }
        Promise<Boolean> promise = Promise.promise();
        attempt(submission, payload, 1, promise);
        return promise.future();
    }

    private void attempt(ResultSubmission submission, Buffer payload, int attempt, Promise<Boolean> promise) {
        String url = settings.controllerUrl() + "/agents/" + settings.agentId() + "/results";

        webClient.postAbs(url)
                .putHeader("Content-Type", "application/json")
                .sendBuffer(payload)
                .onSuccess(response -> {
                    int statusCode = response.statusCode();
                    if (statusCode / 100 == 2) {
                        metrics.recordSubmission("accepted");
                        logger.debug("Submission delivered: taskId={}, status={}, hosts={}, attempt={}",
                                submission.taskId(), submission.status(), submission.parsedResults().size(), attempt);
                        promise.complete(true);
                    } else if (statusCode / 100 == 4) {
                        metrics.recordSubmission("refused");
                        logger.warn("Submission refused: taskId={}, HTTP {} {}",
                                submission.taskId(), statusCode, response.bodyAsString());
                        promise.complete(false);
                    } else {
                        retryOrGiveUp(submission, payload, attempt, promise, "HTTP " + statusCode);
                    }
                })
                .onFailure(err -> retryOrGiveUp(submission, payload, attempt, promise, err.getMessage()));
    }

    private void retryOrGiveUp(ResultSubmission submission, Buffer payload, int attempt,
                               Promise<Boolean> promise, String reason) {
        metrics.recordSubmission("retryable_failure");
        if (attempt >= settings.retryAttempts()) {
            logger.error("Failed to deliver submission for task {} after {} attempts: {}",
                    submission.taskId(), attempt, reason);
            promise.complete(false);
            return;
        }
        logger.warn("Submission attempt {} for task {} failed ({}), retrying in {}ms",
                attempt, submission.taskId(), reason, settings.retryDelayMs());
        vertx.setTimer(settings.retryDelayMs(), id -> attempt(submission, payload, attempt + 1, promise));
    }

    public Future<Void> shutdown() {
        logger.debug("Shutting down ResultSubmissionService WebClient");
        webClient.close();
        return Future.succeededFuture();
    }
}
