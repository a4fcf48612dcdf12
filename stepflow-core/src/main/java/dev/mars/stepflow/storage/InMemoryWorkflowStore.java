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

package dev.mars.stepflow.storage;

import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Single-instance store backed by concurrent maps. Execution records are held by
 * reference, so updates made by the engine are visible immediately.
 */
public class InMemoryWorkflowStore implements WorkflowStore {
    private static final Logger logger = Logger.getLogger(InMemoryWorkflowStore.class.getName());

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public String saveDefinition(WorkflowDefinition definition) {
        if (definitions.putIfAbsent(definition.getId(), definition) != null) {
            throw new DuplicateDefinitionException(definition.getId());
        }
        logger.fine("Saved workflow definition: " + definition.getId());
        return definition.getId();
    }

    @Override
    public Optional<WorkflowDefinition> getDefinition(String workflowId) {
        return workflowId != null ? Optional.ofNullable(definitions.get(workflowId)) : Optional.empty();
    }

    @Override
    public List<WorkflowDefinition> listDefinitions() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(WorkflowDefinition::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteDefinition(String workflowId) {
        boolean removed = workflowId != null && definitions.remove(workflowId) != null;
        if (removed) {
            logger.fine("Deleted workflow definition: " + workflowId);
        }
        return removed;
    }

    @Override
    public void saveExecution(WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
        logger.fine("Saved workflow execution: " + execution.getId());
    }

    @Override
    public void updateExecution(WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        return executionId != null ? Optional.ofNullable(executions.get(executionId)) : Optional.empty();
    }

    @Override
    public List<WorkflowExecution> listExecutions(String workflowId) {
        return executions.values().stream()
                .filter(execution -> execution.getWorkflowId().equals(workflowId))
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> listExecutionsByStatus(WorkflowStatus status) {
        return executions.values().stream()
                .filter(execution -> execution.getStatus() == status)
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }
}
