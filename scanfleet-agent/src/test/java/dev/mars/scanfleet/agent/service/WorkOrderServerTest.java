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

import dev.mars.scanfleet.agent.FakeController;
import dev.mars.scanfleet.agent.config.AgentSettings;
import dev.mars.scanfleet.agent.observability.AgentMetrics;
import dev.mars.scanfleet.agent.scanner.PortScanner;
import dev.mars.scanfleet.core.HostResult;
import dev.mars.scanfleet.core.HostState;
import dev.mars.scanfleet.core.PortDetail;
import dev.mars.scanfleet.result.SubmissionStatus;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the agent's work order endpoint, driven over HTTP.
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WorkOrderServerTest {

    private final CountDownLatch gate = new CountDownLatch(1);

    private FakeController controller;
    private WebClient client;
    private WorkOrderServer server;
    private ScanExecutionService scans;
    private ResultSubmissionService submissions;
    private HeartbeatService heartbeats;
    private int port;

    /** Blocks scans of 10.0.0.99 until the gate opens; everything else answers immediately. */
    private final PortScanner scanner = (address, ports, args) -> {
        if (address.equals("10.0.0.99")) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return new HostResult("host-" + address, HostState.UP, List.of(ports.get(0)),
                Map.of(ports.get(0), new PortDetail("tcp", "ssh", "OpenSSH", "9.6", "")));
    };

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        client = WebClient.create(vertx);
        FakeController.start(vertx)
                .compose(started -> {
                    controller = started;
                    AgentSettings settings = AgentSettings.forController("agent-wo", controller.apiUrl(), "10.0.0.0/24")
                            .withPort(0)
                            .withRetry(2, 20)
                            .withMaxConcurrentScans(1);
                    AgentMetrics metrics = new AgentMetrics(settings.agentId());
                    heartbeats = new HeartbeatService(vertx, settings, metrics);
                    submissions = new ResultSubmissionService(vertx, settings, metrics);
                    scans = new ScanExecutionService(vertx, settings, scanner, submissions, metrics);
                    server = new WorkOrderServer(vertx, settings, scans, heartbeats, metrics);
                    return server.start();
                })
                .onComplete(testContext.succeeding(bound -> {
                    port = bound;
                    testContext.completeNow();
                }));
    }

    @BeforeEach
    void reset() {
        controller.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        gate.countDown();
        Future.join(server.shutdown(), scans.shutdown(), controller.close())
                .onComplete(ar -> {
                    heartbeats.shutdown();
                    submissions.shutdown();
                    client.close();
                    testContext.completeNow();
                });
    }

    private Future<HttpResponse<Buffer>> post(JsonObject body) {
        return client.post(port, "127.0.0.1", "/scan").sendJsonObject(body);
    }

    private static JsonObject workOrder(String taskId, String... targets) {
        return new JsonObject()
                .put("scan_id", "scan-9")
                .put("task_id", taskId)
                .put("result_id", "res-9")
                .put("targets", new JsonArray(List.of(targets)))
                .put("ports", "22,80")
                .put("scan_arguments", "-sV");
    }

    @Test
    @DisplayName("Should accept a work order with 202 and submit the scan result")
    void testAcceptAndSubmit() throws Exception {
        HttpResponse<Buffer> response = post(workOrder("task-1", "10.0.0.1", "10.0.0.2"))
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(202, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertTrue(body.getBoolean("accepted"));
        assertEquals("task-1", body.getString("task_id"));
        assertFalse(body.getBoolean("duplicate"));

        await().atMost(Duration.ofSeconds(5)).until(() -> !controller.submissions().isEmpty());
        JsonObject submission = controller.submissions().get(0);
        assertEquals("completed", submission.getString("status"));
        assertEquals("res-9", submission.getString("result_id"));
        JsonObject host = submission.getJsonObject("parsed_results").getJsonObject("10.0.0.1");
        assertEquals("host-10.0.0.1", host.getString("hostname"));
        assertEquals(List.of(22), host.getJsonArray("open_ports").getList());
        await().atMost(Duration.ofSeconds(5)).until(() -> scans.getActiveScanCount() == 0);
    }

    @Test
    @DisplayName("Should reject malformed or incomplete work orders with 400")
    void testRejectInvalid(VertxTestContext testContext) {
        JsonObject missingTask = workOrder("task-x", "10.0.0.1");
        missingTask.remove("task_id");
        JsonObject badPorts = workOrder("task-y", "10.0.0.1").put("ports", "0-10");
        JsonObject badTarget = workOrder("task-z", "10.0.0.300");

        Future.all(post(missingTask), post(badPorts), post(badTarget),
                        client.post(port, "127.0.0.1", "/scan").sendBuffer(Buffer.buffer("{not json")))
                .onComplete(testContext.succeeding(all -> testContext.verify(() -> {
                    for (int i = 0; i < 4; i++) {
                        HttpResponse<Buffer> response = all.resultAt(i);
                        assertEquals(400, response.statusCode());
                        assertFalse(response.bodyAsJsonObject().getBoolean("accepted"));
                    }
                    assertTrue(all.<HttpResponse<Buffer>>resultAt(0).bodyAsJsonObject()
                            .getString("error").contains("task_id"));
                    assertEquals(0, controller.resultAttempts());
                    testContext.completeNow();
                })));
    }

    @Test
    @DisplayName("Should answer 503 when at capacity and 202 duplicate for a running task")
    void testBusyAndDuplicate(VertxTestContext testContext) {
        post(workOrder("task-slow", "10.0.0.99"))
                .compose(first -> {
                    assertEquals(202, first.statusCode());
                    return post(workOrder("task-slow", "10.0.0.99"));
                })
                .compose(duplicate -> {
                    assertEquals(202, duplicate.statusCode());
                    assertTrue(duplicate.bodyAsJsonObject().getBoolean("duplicate"));
                    return post(workOrder("task-other", "10.0.0.5"));
                })
                .onComplete(testContext.succeeding(busy -> testContext.verify(() -> {
                    assertEquals(503, busy.statusCode());
                    assertFalse(busy.bodyAsJsonObject().getBoolean("accepted"));
                    gate.countDown();
                    Future<SubmissionStatus> slow = scans.execution("task-slow");
                    Future<SubmissionStatus> finished = slow == null ? Future.succeededFuture() : slow;
                    finished.onComplete(done -> testContext.completeNow());
                })));
    }

    @Test
    @DisplayName("Health should report identity, approval and running scans")
    void testHealth(VertxTestContext testContext) {
        client.get(port, "127.0.0.1", "/health").send()
                .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                    assertEquals(200, response.statusCode());
                    JsonObject body = response.bodyAsJsonObject();
                    assertEquals("UP", body.getString("status"));
                    assertEquals("agent-wo", body.getString("agent_id"));
                    assertFalse(body.getBoolean("approved"));
                    assertEquals("10.0.0.0/24", body.getString("owned_range"));
                    assertNotNull(body.getInteger("active_scans"));
                    testContext.completeNow();
                })));
    }
}
