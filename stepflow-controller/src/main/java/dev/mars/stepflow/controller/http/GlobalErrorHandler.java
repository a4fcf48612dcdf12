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

import dev.mars.stepflow.core.exceptions.ExecutionNotFoundException;
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;
import dev.mars.stepflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * Router failure handler that turns every failure into an {@link ErrorResponse}.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@link StepflowApiException} → its own error code</li>
 *   <li>{@link WorkflowValidationException} → 400 VALIDATION_ERROR with one detail per problem</li>
 *   <li>{@link WorkflowNotFoundException} → 404 WORKFLOW_NOT_FOUND</li>
 *   <li>{@link ExecutionNotFoundException} → 404 EXECUTION_NOT_FOUND</li>
 *   <li>{@link DecodeException} and {@link IllegalArgumentException} → 400 BAD_REQUEST</li>
 *   <li>{@link StepflowInfrastructureException} and everything else → 500 INTERNAL_ERROR
 *       carrying the underlying message</li>
 * </ul>
 *
 * <pre>{@code
 * router.route().failureHandler(new GlobalErrorHandler());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = unwrap(ctx.failure());
        String path = ctx.request().path();
        String requestId = CorrelationIdHandler.getRequestId(ctx);

        ErrorResponse errorResponse;

        if (failure == null) {
            // router-generated status such as 404 or 405
            errorResponse = mapStatusCodeToError(ctx.statusCode(), path, ctx.request().method().name(), requestId);
        } else if (failure instanceof StepflowApiException apiEx) {
            errorResponse = ErrorResponse.withDetails(apiEx.getErrorCode(), path, apiEx.getMessage(),
                    apiEx.getDetails(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof WorkflowValidationException validationEx) {
            errorResponse = ErrorResponse.withDetails(ErrorCode.VALIDATION_ERROR, path, validationEx.getMessage(),
                    validationEx.getErrors(), requestId);
            logError(ErrorCode.VALIDATION_ERROR, failure, path);
        } else if (failure instanceof WorkflowNotFoundException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.WORKFLOW_NOT_FOUND, failure, path, requestId);
            logError(ErrorCode.WORKFLOW_NOT_FOUND, failure, path);
        } else if (failure instanceof ExecutionNotFoundException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.EXECUTION_NOT_FOUND, failure, path, requestId);
            logError(ErrorCode.EXECUTION_NOT_FOUND, failure, path);
        } else if (failure instanceof DecodeException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path,
                    "Invalid JSON: " + failure.getMessage(), requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.BAD_REQUEST, failure, path, requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else {
            String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
            errorResponse = ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, message, requestId);
            logError(ErrorCode.INTERNAL_ERROR, failure, path);
        }

        sendErrorResponse(ctx, errorResponse);
    }

    private ErrorResponse mapStatusCodeToError(int statusCode, String path, String method, String requestId) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Bad request", requestId);
            case 404 -> ErrorResponse.withMessage(ErrorCode.NOT_FOUND, path,
                    ErrorCode.NOT_FOUND.formatMessage(path), requestId);
            case 405 -> ErrorResponse.withMessage(ErrorCode.METHOD_NOT_ALLOWED, path,
                    ErrorCode.METHOD_NOT_ALLOWED.formatMessage(method), requestId);
            case 503 -> ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path, "Service unavailable", requestId);
            default -> ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Error " + statusCode, requestId);
        };
    }

    private void sendErrorResponse(RoutingContext ctx, ErrorResponse errorResponse) {
        if (ctx.response().ended()) {
            logger.warn("Response already sent for {}, dropping error {}", ctx.request().path(), errorResponse.code());
            return;
        }
        ctx.response()
                .setStatusCode(errorResponse.httpStatus())
                .putHeader("Content-Type", "application/json")
                .end(errorResponse.toJson().encode());
    }

    /**
     * Logs at a level matching the status. The correlation id comes from the MDC.
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
