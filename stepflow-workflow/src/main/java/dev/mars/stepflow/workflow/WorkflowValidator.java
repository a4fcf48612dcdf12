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

package dev.mars.stepflow.workflow;

import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Structural validation of workflow definitions.
 *
 * <p>All checks run and every failure is reported, in this order: name present,
 * at least one step, unique step ids, resolvable {@code dependsOn} references
 * (one error per dangling reference), registered tool names, and an acyclic
 * dependency graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowValidator {
    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private final Supplier<Set<String>> registeredTools;

    /**
     * @param registeredTools source of the tool names a step may reference, read on every validation
     */
    public WorkflowValidator(Supplier<Set<String>> registeredTools) {
        this.registeredTools = registeredTools;
    }

    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (definition == null) {
            result.addError("Workflow definition is required");
            return result;
        }

        if (definition.getName() == null || definition.getName().isBlank()) {
            result.addError("name", "Workflow name is required");
        }

        if (definition.getSteps().isEmpty()) {
            result.addError("steps", "Workflow must have at least one step");
        }

        List<WorkflowStep> steps = new ArrayList<>();
        for (int index = 0; index < definition.getSteps().size(); index++) {
            WorkflowStep step = definition.getSteps().get(index);
            if (step == null) {
                result.addError("steps[" + index + "]", "Step at index " + index + " is null");
            } else {
                steps.add(step);
            }
        }

        Set<String> stepIds = new HashSet<>();
        Set<String> reportedDuplicates = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!stepIds.add(step.getId()) && reportedDuplicates.add(step.getId())) {
                result.addError("steps." + step.getId(), "Duplicate step ID: " + step.getId());
            }
        }

        for (WorkflowStep step : steps) {
            for (String dependency : step.getDependsOn()) {
                if (!stepIds.contains(dependency)) {
                    result.addError("steps." + step.getId() + ".dependsOn",
                            "Step '" + step.getId() + "' depends on non-existent step '" + dependency + "'");
                }
            }
        }

        Set<String> tools = registeredTools.get();
        for (WorkflowStep step : steps) {
            if (!tools.contains(step.getToolName())) {
                result.addError("steps." + step.getId() + ".toolName",
                        "Step '" + step.getId() + "' uses unknown tool '" + step.getToolName() + "'");
            }
            if (step.getName().isBlank()) {
                result.addWarning("steps." + step.getId() + ".name", "Step '" + step.getId() + "' has no name");
            }
            if (step.getTimeout() != null && (step.getTimeout().isNegative() || step.getTimeout().isZero())) {
                result.addError("steps." + step.getId() + ".timeout",
                        "Step '" + step.getId() + "' timeout must be positive");
            }
        }

        for (List<String> cycle : new DependencyGraph(steps).findCycles()) {
            result.addError("steps", "Circular dependency detected: " + String.join(" -> ", cycle));
        }

        if (!result.isValid()) {
            logger.fine("Workflow '" + definition.getName() + "' failed validation: " + result.getErrorMessages());
        }
        return result;
    }

    /**
     * @throws WorkflowValidationException carrying every error found
     */
    public void validateOrThrow(WorkflowDefinition definition) throws WorkflowValidationException {
        ValidationResult result = validate(definition);
        if (!result.isValid()) {
            throw new WorkflowValidationException(result.getErrorMessages());
        }
    }
}
