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

package dev.mars.scanfleet.controller.lifecycle;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Coordinates graceful shutdown of the controller.
 *
 * <p>Shutdown sequence:
 * <ol>
 *   <li>DRAIN: the HTTP API answers 503 to everything except health probes</li>
 *   <li>AWAIT_COMPLETION: in-flight dispatches and submissions finish</li>
 *   <li>STOP_SERVICES: scheduler, heartbeat monitor and HTTP server stop</li>
 *   <li>CLOSE_RESOURCES: the work-order web client is closed</li>
 * </ol>
 *
 * <p>Hooks within a phase run one after another, each bounded by the phase timeout.
 * A failed or timed-out hook is logged and recorded; the sequence carries on.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-30
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    /**
     * Shutdown phases executed in order.
     */
    public enum Phase {
        /** Stop accepting new work */
        DRAIN,
        /** Wait for active work to complete */
        AWAIT_COMPLETION,
        /** Stop services */
        STOP_SERVICES,
        /** Close resources */
        CLOSE_RESOURCES
    }

    /**
     * Current shutdown state.
     */
    public enum State {
        RUNNING,
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final Vertx vertx;
    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);
    private final List<String> failedHooks = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param vertx             the Vert.x instance
     * @param drainTimeoutMs    bound for each drain hook
     * @param shutdownTimeoutMs bound for every other hook
     */
    public ShutdownCoordinator(Vertx vertx, long drainTimeoutMs, long shutdownTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new ArrayList<>());
        }
    }

    public ShutdownCoordinator(Vertx vertx) {
        this(vertx, 5000, 30000);
    }

    public State getState() {
        return state.get();
    }

    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * @return names of hooks that failed or timed out, in execution order
     */
    public List<String> getFailedHooks() {
        synchronized (failedHooks) {
            return List.copyOf(failedHooks);
        }
    }

    public ShutdownCoordinator onDrain(String name, Supplier<Future<Void>> hook) {
        return register(Phase.DRAIN, name, hook);
    }

    public ShutdownCoordinator onAwaitCompletion(String name, Supplier<Future<Void>> hook) {
        return register(Phase.AWAIT_COMPLETION, name, hook);
    }

    public ShutdownCoordinator onServiceStop(String name, Supplier<Future<Void>> hook) {
        return register(Phase.STOP_SERVICES, name, hook);
    }

    public ShutdownCoordinator onResourceClose(String name, Supplier<Future<Void>> hook) {
        return register(Phase.CLOSE_RESOURCES, name, hook);
    }

    private synchronized ShutdownCoordinator register(Phase phase, String name, Supplier<Future<Void>> hook) {
        if (shutdownRequested.get()) {
            throw new IllegalStateException("Cannot register hook '" + name + "' after shutdown was requested");
        }
        hooks.get(phase).add(new ShutdownHook(name, hook));
        return this;
    }

    /**
     * Initiates graceful shutdown. Calling it again returns a future that
     * completes when the first call finishes.
     */
    public Future<Void> shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            logger.info("Shutdown already requested, waiting for completion");
            return awaitShutdownComplete();
        }

        logger.info("Initiating graceful shutdown (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
        state.set(State.DRAINING);

        Future<Void> chain = Future.succeededFuture();
        for (Phase phase : Phase.values()) {
            chain = chain.compose(v -> runPhase(phase));
        }
        return chain.onComplete(ar -> {
            state.set(State.STOPPED);
            if (failedHooks.isEmpty()) {
                logger.info("Graceful shutdown completed");
            } else {
                logger.warn("Shutdown completed with failed hooks: {}", getFailedHooks());
            }
        });
    }

    private Future<Void> runPhase(Phase phase) {
        if (phase == Phase.STOP_SERVICES) {
            state.set(State.SHUTTING_DOWN);
        }
        List<ShutdownHook> phaseHooks = hooks.get(phase);
        logger.info("Phase {}/{}: {} ({} hooks)", phase.ordinal() + 1, Phase.values().length, phase, phaseHooks.size());

        long timeoutMs = phase == Phase.DRAIN ? drainTimeoutMs : shutdownTimeoutMs;
        Future<Void> chain = Future.succeededFuture();
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(ShutdownHook hook, long timeoutMs) {
        logger.debug("Executing shutdown hook: {}", hook.name());
        Future<Void> result;
        try {
            result = hook.hook().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .onSuccess(v -> logger.debug("Hook completed: {}", hook.name()))
                .recover(err -> {
                    logger.warn("Hook failed: {} - {}", hook.name(), err.getMessage());
                    failedHooks.add(hook.name());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> awaitShutdownComplete() {
        if (state.get() == State.STOPPED) {
            return Future.succeededFuture();
        }
        return vertx.timer(100).compose(v -> awaitShutdownComplete());
    }

    private record ShutdownHook(String name, Supplier<Future<Void>> hook) {
    }
}
