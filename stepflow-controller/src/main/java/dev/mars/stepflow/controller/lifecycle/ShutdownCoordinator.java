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

package dev.mars.stepflow.controller.lifecycle;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the controller's shutdown in four ordered phases:
 * <ol>
 *   <li>{@link Phase#DRAIN}: the HTTP API stops accepting work</li>
 *   <li>{@link Phase#AWAIT_COMPLETION}: in-flight executions get up to the drain timeout to finish</li>
 *   <li>{@link Phase#STOP_SERVICES}: HTTP server closed, queue worker cancelled, engine executors shut down</li>
 *   <li>{@link Phase#CLOSE_RESOURCES}: clients, telemetry and Vert.x resources released</li>
 * </ol>
 *
 * <p>Hooks in a phase run one after another. A hook that fails or overruns its
 * timeout is logged and skipped; shutdown always reaches {@link State#STOPPED}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public enum Phase {
        DRAIN,
        AWAIT_COMPLETION,
        STOP_SERVICES,
        CLOSE_RESOURCES
    }

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
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);
    private final Promise<Void> completion = Promise.promise();
    private volatile boolean shutdownRequested;

    /**
     * @param drainTimeoutMs    limit for each drain and await-completion hook
     * @param shutdownTimeoutMs limit for each service-stop and resource-close hook
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
        this(vertx, 30000, 10000);
    }

    public State getState() {
        return state.get();
    }

    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
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

    /**
     * Starts the shutdown sequence. Later calls return the same completion future.
     */
    public synchronized Future<Void> shutdown() {
        if (shutdownRequested) {
            logger.info("Shutdown already requested, waiting for completion");
            return completion.future();
        }
        shutdownRequested = true;
        state.set(State.DRAINING);

        logger.info("Initiating graceful shutdown (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);

        runPhase(Phase.DRAIN, drainTimeoutMs)
                .compose(v -> runPhase(Phase.AWAIT_COMPLETION, drainTimeoutMs))
                .compose(v -> {
                    state.set(State.SHUTTING_DOWN);
                    return runPhase(Phase.STOP_SERVICES, shutdownTimeoutMs);
                })
                .compose(v -> runPhase(Phase.CLOSE_RESOURCES, shutdownTimeoutMs))
                .onComplete(ar -> {
                    state.set(State.STOPPED);
                    if (ar.succeeded()) {
                        logger.info("Graceful shutdown completed");
                    } else {
                        logger.warn("Shutdown completed with errors", ar.cause());
                    }
                    completion.tryComplete();
                });
        return completion.future();
    }

    private synchronized ShutdownCoordinator register(Phase phase, String name, Supplier<Future<Void>> hook) {
        hooks.get(phase).add(new ShutdownHook(name, hook));
        return this;
    }

    private Future<Void> runPhase(Phase phase, long timeoutMs) {
        List<ShutdownHook> phaseHooks;
        synchronized (this) {
            phaseHooks = List.copyOf(hooks.get(phase));
        }
        logger.info("Phase {}/{}: {} ({} hooks)", phase.ordinal() + 1, Phase.values().length, phase, phaseHooks.size());

        Future<Void> chain = Future.succeededFuture();
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(ShutdownHook hook, long timeoutMs) {
        logger.debug("Executing shutdown hook: {}", hook.name());
        Promise<Void> outcome = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1, timeoutMs), id -> {
            if (outcome.tryFail("timed out after " + timeoutMs + "ms")) {
                logger.warn("Hook timed out: {} after {}ms", hook.name(), timeoutMs);
            }
        });

        Future<Void> started;
        try {
            started = hook.hook().get();
        } catch (RuntimeException e) {
            started = Future.failedFuture(e);
        }
        started.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                outcome.tryComplete();
            } else {
                outcome.tryFail(ar.cause());
            }
        });

        return outcome.future()
                .onSuccess(v -> logger.debug("Hook completed: {}", hook.name()))
                .recover(err -> {
                    logger.warn("Hook failed: {} - {}", hook.name(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private record ShutdownHook(String name, Supplier<Future<Void>> hook) {
    }
}
