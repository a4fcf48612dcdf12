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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStoresTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsToInMemoryStore() {
        WorkflowStore store = WorkflowStores.fromConfiguration(new StepflowConfiguration(new Properties()));
        assertTrue(store instanceof InMemoryWorkflowStore);
    }

    @Test
    void testFileStoreUsesConfiguredDirectory() {
        Properties properties = new Properties();
        properties.setProperty(StepflowConfiguration.STORAGE_TYPE, "FILE");
        properties.setProperty(StepflowConfiguration.STORAGE_DIRECTORY, tempDir.resolve("data").toString());

        WorkflowStore store = WorkflowStores.fromConfiguration(new StepflowConfiguration(properties));

        assertTrue(store instanceof FileWorkflowStore);
        assertTrue(Files.isDirectory(tempDir.resolve("data").resolve("definitions")));
        assertTrue(Files.isDirectory(tempDir.resolve("data").resolve("executions")));
    }

    @Test
    void testUnknownTypeFallsBackToInMemoryStore() {
        Properties properties = new Properties();
        properties.setProperty(StepflowConfiguration.STORAGE_TYPE, "redis");
        assertTrue(WorkflowStores.fromConfiguration(new StepflowConfiguration(properties)) instanceof InMemoryWorkflowStore);
    }
}
