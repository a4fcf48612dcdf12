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

package dev.mars.stepflow.workflow.batch;

/**
 * Dispatch state of a batch job. Describes starting the item executions, not the
 * executions themselves.
 */
public enum BatchStatus {

    /**
     * Items are still being started.
     */
    RUNNING,

    /**
     * Every item has a started execution or a recorded start failure.
     */
    COMPLETED,

    /**
     * Dispatch stopped after a batch with a start failure because continue-on-error was off.
     */
    STOPPED,

    /**
     * Dispatch was interrupted, for example by shutdown.
     */
    ABORTED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
