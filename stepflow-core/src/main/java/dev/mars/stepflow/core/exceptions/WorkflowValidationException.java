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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a workflow definition or a request is structurally invalid.
 * Carries every problem that was found, not just the first.
 */
public class WorkflowValidationException extends StepflowException {

    private final List<String> errors;

    public WorkflowValidationException(List<String> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(List.copyOf(errors));
    }

    public WorkflowValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(List<String> errors) {
        if (errors.size() == 1) {
            return "Validation failed: " + errors.get(0);
        }
        return "Validation failed with " + errors.size() + " errors: " + String.join("; ", errors);
    }
}
