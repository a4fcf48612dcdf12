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
import dev.mars.stepflow.core.BatchProcessingConfig;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for batch runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/batches} - start one execution per item</li>
 *   <li>{@code GET /api/v1/batches/:batchId} - current batch record</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-12-18
 */
public class BatchHandler {

    private static final Logger logger = LoggerFactory.getLogger(BatchHandler.class);
    private static final String DEFAULT_INITIATOR = "api";

    private final WorkflowOrchestrator orchestrator;

    public BatchHandler(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Handles {@code POST /api/v1/batches}.
     * Body: {@code {"workflowId": "...", "items": [{...}], "config": {...}, "initiatedBy": "..."}}.
     * Answers 202 with the live batch record; dispatch continues in the background.
     */
    public Handler<RoutingContext> handleSubmit() {
        return ctx -> {
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "Request body is required");
            }
            String workflowId = body.getString("workflowId");
            if (workflowId == null || workflowId.isBlank()) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "'workflowId' is required");
            }
            List<Map<String, Object>> items = parseItems(body.getValue("items"));
            JsonObject rawConfig = body.getJsonObject("config");
            BatchProcessingConfig config = rawConfig != null
                    ? rawConfig.mapTo(BatchProcessingConfig.class)
                    : BatchProcessingConfig.defaults();
            String initiatedBy = body.getString("initiatedBy", DEFAULT_INITIATOR);

            ctx.vertx().executeBlocking(() -> orchestrator.startBatch(workflowId, items, config, initiatedBy), false)
                    .onSuccess(batch -> {
                        logger.info("Accepted batch {} with {} items for workflow {}", batch.getBatchId(),
                                batch.getTotalItems(), workflowId);
                        ctx.response().setStatusCode(202);
                        ctx.json(batch);
                    })
                    .onFailure(ctx::fail);
        };
    }

    /**
     * Handles {@code GET /api/v1/batches/:batchId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String batchId = ctx.pathParam("batchId");
            ctx.json(orchestrator.getBatch(batchId)
                    .orElseThrow(() -> StepflowApiException.notFound(ErrorCode.BATCH_NOT_FOUND, batchId)));
        };
    }

    private static List<Map<String, Object>> parseItems(Object rawItems) {
        if (rawItems == null) {
            return List.of();
        }
        if (!(rawItems instanceof JsonArray array)) {
            throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "'items' must be a JSON array");
        }
        List<Map<String, Object>> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object item = array.getValue(i);
            if (!(item instanceof JsonObject object)) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "items[" + i + "] must be a JSON object");
            }
            items.add(object.getMap());
        }
        return items;
    }
}
