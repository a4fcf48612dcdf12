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
 * Lifecycle states of a single step within a workflow execution.
 * A step moves from {@link #PENDING} to {@link #RUNNING} and then to exactly one
 * terminal state. {@link #SKIPPED} and {@link #CANCELLED} may also be reached
 * directly from {@link #PENDING}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum StepStatus {

    /**
     * Step is waiting for its dependencies or for a free execution slot.
     */
    PENDING,

    /**
     * Step's tool has been invoked and the result is outstanding.
     */
    RUNNING,

    /**
     * Tool returned a successful result.
     */
    COMPLETED,

    /**
     * Tool returned an error, threw, or exceeded the step timeout.
     */
    FAILED,

    /**
     * Step was not run because an upstream step failed with continue-on-error set.
     */
    SKIPPED,

    /**
     * Step was not run, or was interrupted, because the execution was aborted.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * Whether dependents of a step in this state may be started.
     */
    public boolean satisfiesDependency() {
        return this == COMPLETED;
    }
}
