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

package dev.mars.stepflow.core;

/**
 * Status of a workflow execution.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>PENDING to RUNNING when the queue worker picks the execution up</li>
 *   <li>RUNNING to PAUSED and back</li>
 *   <li>PENDING, RUNNING or PAUSED to CANCELLED</li>
 *   <li>RUNNING to COMPLETED once every step is terminal</li>
 *   <li>PENDING, RUNNING or PAUSED to FAILED</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum WorkflowStatus {

    /**
     * Execution has been accepted and is waiting in the task queue.
     */
    PENDING,

    /**
     * Execution is dispatching steps.
     */
    RUNNING,

    /**
     * Dispatch of new steps is suspended. Steps already running are allowed to finish.
     */
    PAUSED,

    /**
     * Every step reached a terminal state without a workflow-aborting failure.
     */
    COMPLETED,

    /**
     * A step failed without continue-on-error, or the engine hit an internal error.
     */
    FAILED,

    /**
     * Execution was cancelled by a caller or by engine shutdown.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
