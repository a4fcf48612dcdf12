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

import dev.mars.stepflow.tool.Tool;
import dev.mars.stepflow.tool.ToolRegistry;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Handles {@code GET /api/v1/tools}: the names steps may reference, with descriptions.
 */
public class ToolHandler implements Handler<RoutingContext> {

    private final ToolRegistry toolRegistry;

    public ToolHandler(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public void handle(RoutingContext ctx) {
        JsonArray tools = new JsonArray();
        for (String name : toolRegistry.getToolNames()) {
            String description = toolRegistry.findTool(name).map(Tool::getDescription).orElse("");
            tools.add(new JsonObject().put("name", name).put("description", description));
        }
        ctx.json(new JsonObject()
                .put("tools", tools)
                .put("total", tools.size()));
    }
}
