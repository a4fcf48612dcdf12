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

package dev.mars.stepflow.controller.http;

import dev.mars.stepflow.controller.http.handlers.AggregationHandler;
import dev.mars.stepflow.controller.http.handlers.BatchHandler;
import dev.mars.stepflow.controller.http.handlers.ExecutionHandler;
import dev.mars.stepflow.controller.http.handlers.HealthHandler;
import dev.mars.stepflow.controller.http.handlers.ToolHandler;
import dev.mars.stepflow.controller.http.handlers.WorkflowHandler;
import dev.mars.stepflow.json.StepflowJson;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.jackson.DatabindCodec;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x HTTP server exposing the orchestration API under {@code /api/v1}.
 *
 * <p>Every request passes the correlation id handler and the drain guard before
 * reaching a route. Failures from any route end in the {@link GlobalErrorHandler}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 * @version 1.0
 */
public class OrchestrationApiServer {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationApiServer.class);

    public static final String API_PREFIX = "/api/v1";
    private static final long MAX_BODY_BYTES = 10L * 1024 * 1024;

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final WorkflowOrchestrator orchestrator;
    private final String version;
    private final DrainModeHandler drainModeHandler = new DrainModeHandler();
    private HttpServer httpServer;

    public OrchestrationApiServer(Vertx vertx, String host, int port, WorkflowOrchestrator orchestrator,
                                  String version) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.orchestrator = orchestrator;
        this.version = version;
    }

    public Future<Void> start() {
        StepflowJson.configure(DatabindCodec.mapper());

        httpServer = vertx.createHttpServer()
                .requestHandler(createRouter());

        return httpServer.listen(port, host)
                .onSuccess(server -> logger.info("Stepflow API listening on {}:{}", host, server.actualPort()))
                .onFailure(err -> logger.error("Failed to start Stepflow API on port {}", port, err))
                .mapEmpty();
    }

    Router createRouter() {
        Router router = Router.router(vertx);
        GlobalErrorHandler errorHandler = new GlobalErrorHandler();

        router.route().handler(new CorrelationIdHandler());
        router.route().handler(drainModeHandler);
        router.route().handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));
        router.route().failureHandler(errorHandler);
        router.errorHandler(404, errorHandler);
        router.errorHandler(405, errorHandler);

        HealthHandler healthHandler = new HealthHandler(orchestrator, drainModeHandler, version);
        router.get("/health").handler(healthHandler);
        router.get(API_PREFIX + "/health").handler(healthHandler);
        router.get(API_PREFIX + "/tools").handler(new ToolHandler(orchestrator.getToolRegistry()));

        WorkflowHandler workflows = new WorkflowHandler(orchestrator);
        router.post(API_PREFIX + "/workflows").handler(workflows.handleCreate());
        router.get(API_PREFIX + "/workflows").handler(workflows.handleList());
        router.get(API_PREFIX + "/workflows/:workflowId").handler(workflows.handleGet());
        router.delete(API_PREFIX + "/workflows/:workflowId").handler(workflows.handleDelete());

        ExecutionHandler executions = new ExecutionHandler(orchestrator);
        router.post(API_PREFIX + "/workflows/:workflowId/executions").handler(executions.handleStart());
        router.get(API_PREFIX + "/workflows/:workflowId/executions").handler(executions.handleListForWorkflow());

        // before the :executionId routes
        router.post(API_PREFIX + "/executions/aggregate").handler(new AggregationHandler(orchestrator).handleAggregate());

        router.get(API_PREFIX + "/executions/:executionId").handler(executions.handleStatus());
        router.post(API_PREFIX + "/executions/:executionId/cancel").handler(executions.handleCancel());
        router.post(API_PREFIX + "/executions/:executionId/pause").handler(executions.handlePause());
        router.post(API_PREFIX + "/executions/:executionId/resume").handler(executions.handleResume());

        BatchHandler batches = new BatchHandler(orchestrator);
        router.post(API_PREFIX + "/batches").handler(batches.handleSubmit());
        router.get(API_PREFIX + "/batches/:batchId").handler(batches.handleGet());

        return router;
    }

    /**
     * Starts rejecting API requests with 503. Health probes keep answering.
     */
    public Future<Void> enterDrainMode() {
        drainModeHandler.enterDrainMode();
        return Future.succeededFuture();
    }

    public boolean isDraining() {
        return drainModeHandler.isDraining();
    }

    /**
     * @return the bound port, or -1 before {@link #start()} completes
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : -1;
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("Stepflow API stopped"));
        }
        return Future.succeededFuture();
    }
}
