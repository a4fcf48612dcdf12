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
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code POST /api/v1/executions/aggregate}.
 * Body: {@code {"executionIds": [...], "mode": "summary|detailed|statistical", "includeDetails": false}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class AggregationHandler {

    private final WorkflowOrchestrator orchestrator;

    public AggregationHandler(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Handler<RoutingContext> handleAggregate() {
        return ctx -> {
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "Request body is required");
            }
            List<String> executionIds = parseIds(body.getValue("executionIds"));
            String mode = body.getString("mode");
            boolean includeDetails = body.getBoolean("includeDetails", false);

            ctx.vertx().executeBlocking(() -> orchestrator.aggregate(executionIds, mode, includeDetails), false)
                    .onSuccess(ctx::json)
                    .onFailure(ctx::fail);
        };
    }

    private static List<String> parseIds(Object raw) {
        if (!(raw instanceof JsonArray array)) {
            throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "'executionIds' must be a JSON array");
        }
        List<String> ids = new ArrayList<>(array.size());
        for (Object id : array) {
            if (!(id instanceof String value)) {
                throw StepflowApiException.badRequest(ErrorCode.BAD_REQUEST, "'executionIds' must contain strings");
            }
            ids.add(value);
        }
        return ids;
    }
}
