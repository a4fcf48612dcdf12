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
import dev.mars.stepflow.core.WorkflowExecution;
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
 * HTTP handler for workflow executions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/workflows/:workflowId/executions} - start an execution</li>
 *   <li>{@code GET /api/v1/workflows/:workflowId/executions} - list a workflow's executions</li>
 *   <li>{@code GET /api/v1/executions/:executionId} - status view</li>
 *   <li>{@code POST /api/v1/executions/:executionId/cancel|pause|resume} - lifecycle control</li>
 * </ul>
 *
 * <p>Starting returns 202 as soon as the execution is queued. Step failures are only
 * visible through the status endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-12-18
 */
public class ExecutionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionHandler.class);
    private static final String DEFAULT_INITIATOR = "api";

    private final WorkflowOrchestrator orchestrator;

    public ExecutionHandler(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Handles {@code POST /api/v1/workflows/:workflowId/executions}.
     * Body: {@code {"parameters": {...}, "initiatedBy": "..."}}, both optional.
     */
    public Handler<RoutingContext> handleStart() {
        return ctx -> {
            String workflowId = ctx.pathParam("workflowId");
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                body = new JsonObject();
            }
            Object rawParameters = body.getValue("parameters");
            if (rawParameters != null && !(rawParameters instanceof JsonObject)) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "'parameters' must be a JSON object");
            }
            Map<String, Object> parameters = rawParameters != null ? ((JsonObject) rawParameters).getMap() : Map.of();
            String initiatedBy = body.getString("initiatedBy", DEFAULT_INITIATOR);

            ctx.vertx().executeBlocking(() -> orchestrator.startExecution(workflowId, parameters, initiatedBy), false)
                    .onSuccess(execution -> {
                        logger.info("Started execution {} of workflow {}", execution.getId(), workflowId);
                        ctx.response().setStatusCode(202);
                        ctx.json(new JsonObject()
                                .put("executionId", execution.getId())
                                .put("status", execution.getStatus().name()));
                    })
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code GET /api/v1/workflows/:workflowId/executions}.
     */
    public Handler<RoutingContext> handleListForWorkflow() {
        return ctx -> {
            String workflowId = ctx.pathParam("workflowId");
            ctx.vertx().executeBlocking(() -> orchestrator.listExecutions(workflowId), false)
                    .onSuccess(executions -> ctx.json(listBody(workflowId, executions)))
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code GET /api/v1/executions/:executionId?includeStepDetails=true}.
     */
    public Handler<RoutingContext> handleStatus() {
        return ctx -> {
            String executionId = ctx.pathParam("executionId");
            String includeParam = ctx.request().getParam("includeStepDetails");
            boolean includeStepDetails = includeParam == null || Boolean.parseBoolean(includeParam);

            ctx.vertx().executeBlocking(() -> orchestrator.getExecutionStatus(executionId, includeStepDetails), false)
                    .onSuccess(ctx::json)
                    .onFailure(ctx::fail);
        };
    }

    public Handler<RoutingContext> handleCancel() {
        return lifecycle("cancelled", orchestrator::cancelExecution);
    }

    public Handler<RoutingContext> handlePause() {
        return lifecycle("paused", orchestrator::pauseExecution);
    }

    public Handler<RoutingContext> handleResume() {
        return lifecycle("resumed", orchestrator::resumeExecution);
    }

    /**
     * Applies a lifecycle transition. A transition that does not apply to the current
     * state is not an error: the response reports {@code false} with the current status.
     */
    private Handler<RoutingContext> lifecycle(String outcomeField, LifecycleOperation operation) {
        return ctx -> {
            String executionId = ctx.pathParam("executionId");
            ctx.vertx().executeBlocking(() -> {
                        boolean applied = operation.apply(executionId);
                        WorkflowExecution execution = orchestrator.getExecution(executionId);
                        return new JsonObject()
                                .put("executionId", executionId)
                                .put(outcomeField, applied)
                                .put("status", execution.getStatus().name());
                    }, false)
                    .onSuccess(result -> {
                        logger.info("Execution {} {}={}", executionId, outcomeField, result.getBoolean(outcomeField));
                        ctx.json(result);
                    })
                    .onFailure(ctx::fail);
        };
    }

    private static Map<String, Object> listBody(String workflowId, List<WorkflowExecution> executions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflowId", workflowId);
        body.put("executions", executions);
        body.put("total", executions.size());
        return body;
    }

    @FunctionalInterface
    private interface LifecycleOperation {
        boolean apply(String executionId) throws Exception;
    }
}
