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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Start outcome of one batch item.
 *
 * @param itemIndex   position of the item in the submitted list
 * @param batchNumber zero-based batch the item belonged to
 * @param executionId id of the started execution, {@code null} when starting failed
 * @param error       why the item could not be started, {@code null} on success
 * @param attempts    number of start attempts made
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemOutcome(int itemIndex, int batchNumber, String executionId, String error, int attempts) {

    public static BatchItemOutcome started(int itemIndex, int batchNumber, String executionId, int attempts) {
        return new BatchItemOutcome(itemIndex, batchNumber, executionId, null, attempts);
    }

    public static BatchItemOutcome failed(int itemIndex, int batchNumber, String error, int attempts) {
        return new BatchItemOutcome(itemIndex, batchNumber, null, error, attempts);
    }

    public boolean isStarted() {
        return executionId != null;
    }
}
