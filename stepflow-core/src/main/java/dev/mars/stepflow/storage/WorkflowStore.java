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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for workflow definitions and execution records.
 *
 * <p>The engine depends only on this interface, so a durable or distributed
 * backend can be substituted without touching execution logic. Implementations
 * must be safe for concurrent use. I/O problems surface as
 * {@link WorkflowStoreException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface WorkflowStore {

    /**
     * Store a new definition. Definitions are never replaced in place.
     *
     * @return the id of the stored definition
     * @throws DuplicateDefinitionException if a definition with the same id is already stored
     */
    String saveDefinition(WorkflowDefinition definition);

    Optional<WorkflowDefinition> getDefinition(String workflowId);

    /**
     * @return all definitions ordered by creation time
     */
    List<WorkflowDefinition> listDefinitions();

    /**
     * @return {@code true} if a definition was removed
     */
    boolean deleteDefinition(String workflowId);

    void saveExecution(WorkflowExecution execution);

    /**
     * Persist the current state of an execution that was saved earlier.
     */
    void updateExecution(WorkflowExecution execution);

    Optional<WorkflowExecution> getExecution(String executionId);

    /**
     * @return executions of one workflow, newest first
     */
    List<WorkflowExecution> listExecutions(String workflowId);

    List<WorkflowExecution> listExecutionsByStatus(WorkflowStatus status);

    /**
     * @return executions that are running or paused
     */
    default List<WorkflowExecution> listRunningExecutions() {
        List<WorkflowExecution> active = new ArrayList<>(listExecutionsByStatus(WorkflowStatus.RUNNING));
        active.addAll(listExecutionsByStatus(WorkflowStatus.PAUSED));
        return active;
    }
}
