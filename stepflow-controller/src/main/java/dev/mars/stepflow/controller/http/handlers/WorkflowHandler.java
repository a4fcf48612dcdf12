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

package dev.mars.stepflow.controller.http.handlers;

import dev.mars.stepflow.controller.http.ErrorCode;
import dev.mars.stepflow.controller.http.StepflowApiException;
import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for workflow definitions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/workflows} - validate and store a definition</li>
 *   <li>{@code GET /api/v1/workflows} - list definitions</li>
 *   <li>{@code GET /api/v1/workflows/:workflowId} - get one definition</li>
 *   <li>{@code DELETE /api/v1/workflows/:workflowId} - delete a definition</li>
 * </ul>
 *
 * <p>Orchestrator calls may touch the file store, so they run on a worker thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-12-18
 */
public class WorkflowHandler {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowHandler.class);
    private final WorkflowOrchestrator orchestrator;

    public WorkflowHandler(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Handles {@code POST /api/v1/workflows}. Answers 201 with the stored id.
     */
    public Handler<RoutingContext> handleCreate() {
        return ctx -> {
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "Request body is required");
            }
            WorkflowDefinition definition = body.mapTo(WorkflowDefinition.class);

            ctx.vertx().executeBlocking(() -> orchestrator.submitDefinition(definition), false)
                    .onSuccess(workflowId -> {
                        logger.info("Workflow '{}' registered as {}", definition.getName(), workflowId);
                        ctx.response().setStatusCode(201);
                        ctx.json(new JsonObject().put("workflowId", workflowId));
                    })
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code GET /api/v1/workflows}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> ctx.vertx().executeBlocking(orchestrator::listDefinitions, false)
                .onSuccess(definitions -> ctx.json(listBody(definitions)))
                .onFailure(ctx::fail);
    }

    /**
     * Handles {@code GET /api/v1/workflows/:workflowId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String workflowId = ctx.pathParam("workflowId");
            ctx.vertx().executeBlocking(() -> orchestrator.getDefinition(workflowId), false)
                    .onSuccess(ctx::json)
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code DELETE /api/v1/workflows/:workflowId}. Stored executions are kept.
     */
    public Handler<RoutingContext> handleDelete() {
        return ctx -> {
            String workflowId = ctx.pathParam("workflowId");
            ctx.vertx().executeBlocking(() -> {
                        orchestrator.deleteDefinition(workflowId);
                        return workflowId;
                    }, false)
                    .onSuccess(id -> ctx.json(new JsonObject()
                            .put("workflowId", id)
                            .put("deleted", true)))
                    .onFailure(ctx::fail);
        };
    }

    private static Map<String, Object> listBody(List<WorkflowDefinition> definitions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflows", definitions);
        body.put("total", definitions.size());
        return body;
    }
}
