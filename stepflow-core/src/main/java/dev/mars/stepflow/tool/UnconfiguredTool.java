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

package dev.mars.stepflow.tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stands in for an allowed tool name that has no implementation configured.
 */
final class UnconfiguredTool implements Tool {

    private final String name;

    UnconfiguredTool(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.completedFuture(ToolResult.failure("Tool '" + name + "' is not configured"));
    }

    @Override
    public String getDescription() {
        return "Placeholder for an unconfigured tool";
    }
}
