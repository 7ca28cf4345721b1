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

package dev.mars.scanfleet.agent;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minimal controller on an ephemeral port: answers heartbeats with a configurable
 * reply and records every result submission, answering with queued status codes
 * and {@code 200} once the queue is empty.
 */
public final class FakeController {

    private final HttpServer server;
    private final List<JsonObject> heartbeats = new CopyOnWriteArrayList<>();
    private final List<JsonObject> submissions = new CopyOnWriteArrayList<>();
    private final Queue<Integer> resultStatuses = new ConcurrentLinkedQueue<>();
    private final AtomicInteger resultAttempts = new AtomicInteger();
    private final AtomicReference<Integer> heartbeatStatus = new AtomicReference<>(403);
    private final AtomicReference<JsonObject> heartbeatBody = new AtomicReference<>();

    private FakeController(HttpServer server) {
        this.server = server;
    }

    public static Future<FakeController> start(Vertx vertx) {
        FakeController[] holder = new FakeController[1];
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.post("/api/v1/agents/:agentId/heartbeat").handler(ctx -> {
            FakeController controller = holder[0];
            controller.heartbeats.add(ctx.body().asJsonObject().put("agent_id", ctx.pathParam("agentId")));
            ctx.response().setStatusCode(controller.heartbeatStatus.get());
            JsonObject body = controller.heartbeatBody.get();
            if (body == null) {
                ctx.response().end();
            } else {
                ctx.json(body);
            }
        });
        router.post("/api/v1/agents/:agentId/results").handler(ctx -> {
            FakeController controller = holder[0];
            controller.resultAttempts.incrementAndGet();
            Integer status = controller.resultStatuses.poll();
            int code = status == null ? 200 : status;
            if (code == 200) {
                controller.submissions.add(ctx.body().asJsonObject());
            }
            ctx.response().setStatusCode(code);
            ctx.json(new JsonObject().put("code", code));
        });

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(0, "127.0.0.1")
                .map(server -> {
                    holder[0] = new FakeController(server);
                    holder[0].pending(60);
                    return holder[0];
                });
    }

    public String apiUrl() {
        return "http://127.0.0.1:" + server.actualPort() + "/api/v1";
    }

    public void pending(int retryAfterSeconds) {
        heartbeatBody.set(new JsonObject()
                .put("approved", false)
                .put("status", "pending_approval")
                .put("retry_after_seconds", retryAfterSeconds));
        heartbeatStatus.set(403);
    }

    public void approve() {
        heartbeatBody.set(new JsonObject().put("approved", true).put("status", "online"));
        heartbeatStatus.set(200);
    }

    public void answerHeartbeats(int status, JsonObject body) {
        heartbeatBody.set(body);
        heartbeatStatus.set(status);
    }

    public void queueResultStatuses(Integer... statuses) {
        resultStatuses.addAll(List.of(statuses));
    }

    public List<JsonObject> heartbeats() {
        return heartbeats;
    }

    public List<JsonObject> submissions() {
        return submissions;
    }

    public int resultAttempts() {
        return resultAttempts.get();
    }

    public void reset() {
        heartbeats.clear();
        submissions.clear();
        resultStatuses.clear();
        resultAttempts.set(0);
        pending(60);
    }

    public Future<Void> close() {
        return server.close();
    }
}
