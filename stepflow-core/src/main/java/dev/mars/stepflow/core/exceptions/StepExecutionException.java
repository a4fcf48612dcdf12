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

package dev.mars.stepflow.core.exceptions;

import java.time.Duration;

/**
 * Failure of a single workflow step: a tool error, a tool exception or a timeout.
 * The engine records the message on the step. It is never propagated to the caller
 * that started the execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StepExecutionException extends StepflowException {

    private final String stepId;
    private final boolean timeout;

    public StepExecutionException(String stepId, String message) {
        this(stepId, message, false, null);
    }

    public StepExecutionException(String stepId, String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.timeout = timeout;
    }

    public static StepExecutionException timedOut(String stepId, Duration timeout) {
        return new StepExecutionException(stepId,
                "Step '" + stepId + "' timed out after " + timeout.toMillis() + "ms", true, null);
    }

    public String getStepId() {
        return stepId;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
