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

package dev.mars.stepflow.controller;

import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.controller.config.AppConfig;
import dev.mars.stepflow.controller.http.OrchestrationApiServer;
import dev.mars.stepflow.controller.lifecycle.ShutdownCoordinator;
import dev.mars.stepflow.controller.observability.TelemetryConfig;
import dev.mars.stepflow.controller.tools.RemoteHttpTool;
import dev.mars.stepflow.storage.WorkflowStore;
import dev.mars.stepflow.storage.WorkflowStores;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the Stepflow controller.
 *
 * <p>Wires the tool registry, store, engine and HTTP API from {@link AppConfig},
 * then blocks until a shutdown signal runs the {@link ShutdownCoordinator}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 * @version 1.0
 */
public class StepflowControllerApplication {

    private static final Logger logger = LoggerFactory.getLogger(StepflowControllerApplication.class);
    private static final long STARTUP_TIMEOUT_SECONDS = 30;

    private final AppConfig config;

    private Vertx vertx;
    private WebClient webClient;
    private WorkflowOrchestrator orchestrator;
    private OrchestrationApiServer apiServer;
    private ShutdownCoordinator shutdownCoordinator;
    private volatile boolean running = false;

    public StepflowControllerApplication(AppConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        AppConfig config = AppConfig.get();
        config.logConfiguration();
        StepflowControllerApplication app = new StepflowControllerApplication(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping Stepflow controller...");
            app.stop();
        }, "stepflow-shutdown"));

        try {
            app.start();
            synchronized (app) {
                while (app.running) {
                    app.wait();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Main thread interrupted, stopping");
            app.stop();
        } catch (Exception e) {
            logger.error("Failed to start Stepflow controller", e);
            System.exit(1);
        }
    }

    public synchronized void start() throws Exception {
        if (running) {
            logger.warn("Stepflow controller is already running");
            return;
        }
        logger.info("Starting Stepflow controller {}...", config.getVersion());

        // metrics bind to the global provider on first use
        TelemetryConfig.configure(config);

        vertx = Vertx.vertx();
        StepflowConfiguration engineConfig = config.toStepflowConfiguration();

        webClient = WebClient.create(vertx, new WebClientOptions().setUserAgent("stepflow/" + config.getVersion()));
        ToolRegistry toolRegistry = new ToolRegistry();
        int remoteTools = RemoteHttpTool.registerAll(toolRegistry, webClient, config);
        toolRegistry.registerPlaceholders(engineConfig.getAllowedTools());
        logger.info("Registered {} remote tools; available tools: {}", remoteTools, toolRegistry.getToolNames());

        WorkflowStore store = WorkflowStores.fromConfiguration(engineConfig);
        orchestrator = WorkflowOrchestrator.create(toolRegistry, store, engineConfig);

        apiServer = new OrchestrationApiServer(vertx, config.getHttpHost(), config.getHttpPort(), orchestrator,
                config.getVersion());
        try {
            apiServer.start().toCompletionStage().toCompletableFuture().get(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.error("Failed to start HTTP API", e);
            orchestrator.shutdown();
            vertx.close();
            throw e;
        }

        shutdownCoordinator = createShutdownCoordinator();
        running = true;
        logger.info("Stepflow controller started, API at http://{}:{}{}", config.getHttpHost(),
                apiServer.actualPort(), OrchestrationApiServer.API_PREFIX);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        long limit = config.getDrainTimeoutMs() * 2 + TimeUnit.SECONDS.toMillis(STARTUP_TIMEOUT_SECONDS);
        try {
            shutdownCoordinator.shutdown().toCompletionStage().toCompletableFuture().get(limit, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for shutdown");
        } catch (Exception e) {
            logger.warn("Shutdown did not complete cleanly: {}", e.getMessage());
        } finally {
            running = false;
            notifyAll();
        }
        logger.info("Stepflow controller stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private ShutdownCoordinator createShutdownCoordinator() {
        long drainTimeoutMs = config.getDrainTimeoutMs();
        return new ShutdownCoordinator(vertx, drainTimeoutMs, TimeUnit.SECONDS.toMillis(10))
                .onDrain("http-api", apiServer::enterDrainMode)
                .onAwaitCompletion("workflow-engine", () -> vertx.executeBlocking(() -> {
                    if (!orchestrator.awaitIdle(Duration.ofMillis(drainTimeoutMs))) {
                        logger.warn("{} executions still active after {}ms", orchestrator.getActiveExecutionCount(),
                                drainTimeoutMs);
                    }
                    return null;
                }, false))
                .onServiceStop("http-server", apiServer::stop)
                .onServiceStop("workflow-orchestrator", () -> vertx.executeBlocking(() -> {
                    orchestrator.shutdown();
                    return null;
                }, false))
                .onResourceClose("web-client", () -> {
                    webClient.close();
                    return Future.succeededFuture();
                })
                .onResourceClose("telemetry", () -> {
                    TelemetryConfig.shutdown();
                    return Future.succeededFuture();
                })
                .onResourceClose("vertx", () -> vertx.close());
    }
}
