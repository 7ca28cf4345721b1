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

package dev.mars.scanfleet.controller.http;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rejects API requests with 503 while the controller is shutting down. Health probes
 * still pass so load balancers can watch the shutdown. Agents that get the 503 on a
 * result submission retry later.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-19
 */
public class DrainModeHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(DrainModeHandler.class);

    private static final String DEFAULT_RETRY_AFTER = "30";

    private final AtomicBoolean draining = new AtomicBoolean(false);

    @Override
    public void handle(RoutingContext ctx) {
        if (!draining.get()) {
            ctx.next();
            return;
        }

        String path = ctx.request().path();
        if (path.equals("/health") || path.endsWith("/health")) {
            ctx.next();
            return;
        }

        logger.debug("Rejecting request during drain: {} {}", ctx.request().method(), path);

        ErrorResponse errorResponse = ErrorResponse.withMessage(
                ErrorCode.SERVICE_UNAVAILABLE, path, "Server is shutting down", CorrelationIdHandler.getRequestId(ctx));

        ctx.response()
                .setStatusCode(errorResponse.httpStatus())
                .putHeader("Retry-After", DEFAULT_RETRY_AFTER)
                .putHeader("Content-Type", "application/json")
                .end(errorResponse.toJson().encode());
    }

    /**
     * Idempotent.
     */
    public void enterDrainMode() {
        if (draining.compareAndSet(false, true)) {
            logger.info("HTTP API entered drain mode, rejecting new requests");
        }
    }

    public boolean isDraining() {
        return draining.get();
    }
}
