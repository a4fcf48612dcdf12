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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a tool invocation: a payload with optional metadata, or an error message.
 */
public final class ToolResult {

    private final boolean success;
    private final Object payload;
    private final Map<String, Object> metadata;
    private final String error;

    private ToolResult(boolean success, Object payload, Map<String, Object> metadata, String error) {
        this.success = success;
        this.payload = payload;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.error = error;
    }

    public static ToolResult success(Object payload) {
        return new ToolResult(true, payload, null, null);
    }

    public static ToolResult success(Object payload, Map<String, Object> metadata) {
        return new ToolResult(true, payload, metadata, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return success;
    }

    public Object getPayload() {
        return payload;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success
                ? "ToolResult{success, payload=" + payload + '}'
                : "ToolResult{failure, error='" + error + "'}";
    }
}
