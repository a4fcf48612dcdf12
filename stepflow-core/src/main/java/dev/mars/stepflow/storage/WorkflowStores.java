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

import dev.mars.stepflow.config.StepflowConfiguration;

import java.util.logging.Logger;

/**
 * Creates the store selected by {@code stepflow.storage.type}.
 */
public final class WorkflowStores {

    private static final Logger logger = Logger.getLogger(WorkflowStores.class.getName());

    private WorkflowStores() {
    }

    public static WorkflowStore fromConfiguration(StepflowConfiguration configuration) {
        String type = configuration.getStorageType();
        switch (type) {
            case "file":
                return new FileWorkflowStore(configuration.getStorageDirectory());
            case "memory":
                return new InMemoryWorkflowStore();
            default:
                logger.warning("Unknown storage type '" + type + "', using in-memory store");
                return new InMemoryWorkflowStore();
        }
    }
}
