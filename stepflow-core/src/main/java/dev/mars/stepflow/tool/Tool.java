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
 * A named capability that workflow steps invoke.
 *
 * <p>Implementations must not block the calling thread for I/O. A tool reports
 * failure either with {@link ToolResult#failure(String)} or by completing the
 * future exceptionally. The engine treats both as a step failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface Tool {

    /**
     * Get the registry name of this tool, for example {@code company-search}.
     *
     * @return the tool name
     */
    String getName();

    /**
     * Invoke the tool.
     *
     * @param parameters resolved step parameters merged with execution parameters
     * @return future completing with the tool outcome
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Get a human readable description of the tool.
     *
     * @return the description, empty by default
     */
    default String getDescription() {
        return "";
    }
}
