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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Error body shared by every API endpoint.
 *
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "VALIDATION_ERROR",
 *     "message": "Validation failed: Step 'b' depends on unknown step 'x'",
 *     "timestamp": "2025-12-18T10:00:00Z",
 *     "path": "/api/v1/workflows",
 *     "requestId": "req-1a2b3c4d",
 *     "details": ["Step 'b' depends on unknown step 'x'"]
 *   }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public record ErrorResponse(
        String code,
        String message,
        Instant timestamp,
        String path,
        String requestId,
        List<String> details
) {
    public ErrorResponse {
        details = details != null ? List.copyOf(details) : List.of();
    }

    public static ErrorResponse withMessage(ErrorCode code, String path, String message, String requestId) {
        return withDetails(code, path, message, List.of(), requestId);
    }

    public static ErrorResponse withDetails(ErrorCode code, String path, String message, List<String> details,
                                            String requestId) {
        return new ErrorResponse(
                code.code(),
                message,
                Instant.now(),
                path,
                requestId != null ? requestId : generateRequestId(),
                details
        );
    }

    /**
     * Uses the exception message, or the bare template when there is none.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path, String requestId) {
        String message = cause.getMessage() != null ? cause.getMessage() : code.messageTemplate();
        return withMessage(code, path, message, requestId);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("error", new JsonObject()
                        .put("code", code)
                        .put("message", message)
                        .put("timestamp", timestamp.toString())
                        .put("path", path)
                        .put("requestId", requestId)
                        .put("details", new JsonArray(List.copyOf(details))));
    }

    public int httpStatus() {
        return ErrorCode.fromCode(code)
                .map(ErrorCode::httpStatus)
                .orElse(500);
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
