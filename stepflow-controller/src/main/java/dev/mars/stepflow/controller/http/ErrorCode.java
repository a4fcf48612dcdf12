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

import java.util.Arrays;
import java.util.Optional;

/**
 * Error codes returned by the Stepflow HTTP API.
 *
 * <p>Each code carries its HTTP status and a message template. Handlers raise them
 * through {@link StepflowApiException}; the {@link GlobalErrorHandler} maps domain
 * exceptions onto them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public enum ErrorCode {

    // ==================== General Errors ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, "Invalid request: %s"),

    /** Definition or request failed validation */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s"),

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, "Resource not found: %s"),

    /** HTTP method not supported for this endpoint */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, "Method %s not allowed"),

    // ==================== Orchestration Errors ====================

    WORKFLOW_NOT_FOUND("WORKFLOW_NOT_FOUND", 404, "Workflow '%s' not found"),

    EXECUTION_NOT_FOUND("EXECUTION_NOT_FOUND", 404, "Execution '%s' not found"),

    BATCH_NOT_FOUND("BATCH_NOT_FOUND", 404, "Batch '%s' not found"),

    // ==================== Server Errors ====================

    /** Engine is shutting down or the task queue is full */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service unavailable: %s"),

    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal error: %s");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    /**
     * Formats the message template with the given arguments.
     */
    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
                .filter(e -> e.code.equals(code))
                .findFirst();
    }
}
