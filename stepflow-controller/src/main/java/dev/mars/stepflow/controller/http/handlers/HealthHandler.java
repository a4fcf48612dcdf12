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

import dev.mars.stepflow.controller.http.DrainModeHandler;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.time.Instant;

/**
 * Health check for the controller. Reports {@code UP} with 200, or {@code DOWN} with
 * 503 once the server is draining.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class HealthHandler implements Handler<RoutingContext> {

    private final WorkflowOrchestrator orchestrator;
    private final DrainModeHandler drainModeHandler;
    private final String version;

    public HealthHandler(WorkflowOrchestrator orchestrator, DrainModeHandler drainModeHandler, String version) {
        this.orchestrator = orchestrator;
        this.drainModeHandler = drainModeHandler;
        this.version = version;
    }

    @Override
    public void handle(RoutingContext ctx) {
        boolean healthy = !drainModeHandler.isDraining();
        ctx.response().setStatusCode(healthy ? 200 : 503);
        ctx.json(new JsonObject()
                .put("status", healthy ? "UP" : "DOWN")
                .put("version", version)
                .put("timestamp", Instant.now().toString())
                .put("checks", new JsonObject()
                        .put("engine", new JsonObject()
                                .put("status", healthy ? "UP" : "DRAINING")
                                .put("activeExecutions", orchestrator.getActiveExecutionCount()))
                        .put("tools", new JsonObject()
                                .put("registered", orchestrator.getToolNames().size()))));
    }
}
