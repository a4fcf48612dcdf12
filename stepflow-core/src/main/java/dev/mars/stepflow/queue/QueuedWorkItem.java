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

package dev.mars.stepflow.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * A work item together with the correlation id it was submitted with.
 *
 * @param workItem      the work to run
 * @param correlationId optional id used in log messages, for example an execution id
 * @param enqueuedAt    time the item entered the queue
 */
public record QueuedWorkItem(BackgroundWorkItem workItem, String correlationId, Instant enqueuedAt) {

    public QueuedWorkItem {
        Objects.requireNonNull(workItem, "workItem");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public String describe() {
        return correlationId != null ? correlationId : "uncorrelated work item";
    }
}
