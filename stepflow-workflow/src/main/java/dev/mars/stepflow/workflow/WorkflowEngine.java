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
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workflow definitions as background executions.
 * Starting an execution only enqueues it. Callers observe progress through the
 * returned execution record or the completion future.
 */
public interface WorkflowEngine {

    /**
     * Creates a pending execution and hands it to the background task queue.
     * The definition must already have passed validation.
     *
     * @param definition  the workflow to run
     * @param parameters  execution parameters, merged into every step's parameters
     * @param initiatedBy who started the run, may be {@code null}
     * @return the pending execution; its id is the handle for later queries
     * @throws StepflowInfrastructureException if the queue rejects the execution or the engine is shut down
     */
    WorkflowExecution start(WorkflowDefinition definition, Map<String, Object> parameters, String initiatedBy)
            throws StepflowInfrastructureException;

    /**
     * Gets an execution that is queued or running in this engine.
     *
     * @param executionId the execution ID
     * @return the live execution record, empty once the run has finished
     */
    Optional<WorkflowExecution> getExecution(String executionId);

    /**
     * Gets a future that completes with the execution once it reaches a terminal status.
     *
     * @param executionId the execution ID
     * @return the completion future, empty if the execution is not active in this engine
     */
    Optional<CompletableFuture<WorkflowExecution>> getCompletionFuture(String executionId);

    /**
     * Pauses a running workflow execution. Steps already running finish normally
     * but no new step is started until {@link #resume(String)}.
     *
     * @param executionId the execution ID
     * @return true if the workflow was paused successfully
     */
    boolean pause(String executionId);

    /**
     * Resumes a paused workflow execution.
     *
     * @param executionId the execution ID
     * @return true if the workflow was resumed successfully
     */
    boolean resume(String executionId);

    /**
     * Cancels a queued, running or paused workflow execution. Pending and running
     * steps are marked cancelled.
     *
     * @param executionId the execution ID
     * @return true if the workflow was cancelled successfully
     */
    boolean cancel(String executionId);

    /**
     * @return number of executions that are queued or running
     */
    int getActiveExecutionCount();

    /**
     * Waits until no execution is queued or running.
     *
     * @param timeout maximum time to wait
     * @return true if the engine became idle within the timeout
     */
    boolean awaitIdle(Duration timeout);

    /**
     * Shuts down the workflow engine. Active executions are cancelled.
     */
    void shutdown();
}
