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

import java.util.List;

/**
 * Exception thrown by API handlers to signal a known error condition.
 *
 * <p>The {@link GlobalErrorHandler} turns it into an {@link ErrorResponse} with the
 * status of its {@link ErrorCode}.
 *
 * <pre>{@code
 * throw StepflowApiException.notFound(ErrorCode.BATCH_NOT_FOUND, batchId);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class StepflowApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> details;

    public StepflowApiException(ErrorCode errorCode, String message) {
        this(errorCode, message, List.of(), null);
    }

    public StepflowApiException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, List.of(), cause);
    }

    public StepflowApiException(ErrorCode errorCode, String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? List.copyOf(details) : List.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    /**
     * @return itemized problems, empty unless this is a validation failure
     */
    public List<String> getDetails() {
        return details;
    }

    // ==================== Factory Methods ====================

    public static StepflowApiException notFound(ErrorCode code, Object... args) {
        return new StepflowApiException(code, code.formatMessage(args));
    }

    public static StepflowApiException badRequest(ErrorCode code, Object... args) {
        return new StepflowApiException(code, code.formatMessage(args));
    }

    public static StepflowApiException validation(List<String> errors) {
        return new StepflowApiException(ErrorCode.VALIDATION_ERROR,
                ErrorCode.VALIDATION_ERROR.formatMessage(String.join("; ", errors)), errors, null);
    }

    public static StepflowApiException unavailable(ErrorCode code, Object... args) {
        return new StepflowApiException(code, code.formatMessage(args));
    }

    public static StepflowApiException internal(ErrorCode code, Throwable cause, Object... args) {
        return new StepflowApiException(code, code.formatMessage(args), cause);
    }
}
