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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.json.StepflowJson;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Stores each definition and execution as a JSON document under a base directory:
 * <pre>
 *   &lt;base&gt;/definitions/&lt;workflowId&gt;.json
 *   &lt;base&gt;/executions/&lt;executionId&gt;.json
 * </pre>
 * Writes go to a temporary file first and are then moved into place, so readers
 * never observe a partially written record.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FileWorkflowStore implements WorkflowStore {
    private static final Logger logger = Logger.getLogger(FileWorkflowStore.class.getName());

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";

    private final Path definitionsDir;
    private final Path executionsDir;
    private final ObjectMapper objectMapper;

    public FileWorkflowStore(Path baseDirectory) {
        this.definitionsDir = baseDirectory.resolve("definitions");
        this.executionsDir = baseDirectory.resolve("executions");
        this.objectMapper = StepflowJson.newObjectMapper();
        try {
            Files.createDirectories(definitionsDir);
            Files.createDirectories(executionsDir);
        } catch (IOException e) {
            throw new WorkflowStoreException("Cannot create store directories under " + baseDirectory, e);
        }
        logger.info("File workflow store initialised at " + baseDirectory.toAbsolutePath());
    }

    @Override
    public synchronized String saveDefinition(WorkflowDefinition definition) {
        Path target = fileFor(definitionsDir, definition.getId());
        if (Files.exists(target)) {
            throw new DuplicateDefinitionException(definition.getId());
        }
        write(target, definition);
        return definition.getId();
    }

    @Override
    public Optional<WorkflowDefinition> getDefinition(String workflowId) {
        if (!isSafeId(workflowId)) {
            return Optional.empty();
        }
        return read(fileFor(definitionsDir, workflowId), WorkflowDefinition.class);
    }

    @Override
    public List<WorkflowDefinition> listDefinitions() {
        List<WorkflowDefinition> result = readAll(definitionsDir, WorkflowDefinition.class);
        result.sort(Comparator.comparing(WorkflowDefinition::getCreatedAt));
        return result;
    }

    @Override
    public boolean deleteDefinition(String workflowId) {
        if (!isSafeId(workflowId)) {
            return false;
        }
        try {
            return Files.deleteIfExists(fileFor(definitionsDir, workflowId));
        } catch (IOException e) {
            throw new WorkflowStoreException("Failed to delete workflow definition " + workflowId, e);
        }
    }

    @Override
    public void saveExecution(WorkflowExecution execution) {
        write(fileFor(executionsDir, execution.getId()), execution);
    }

    @Override
    public void updateExecution(WorkflowExecution execution) {
        write(fileFor(executionsDir, execution.getId()), execution);
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        if (!isSafeId(executionId)) {
            return Optional.empty();
        }
        return read(fileFor(executionsDir, executionId), WorkflowExecution.class);
    }

    @Override
    public List<WorkflowExecution> listExecutions(String workflowId) {
        return listExecutionsMatching(execution -> execution.getWorkflowId().equals(workflowId));
    }

    @Override
    public List<WorkflowExecution> listExecutionsByStatus(WorkflowStatus status) {
        return listExecutionsMatching(execution -> execution.getStatus() == status);
    }

    private List<WorkflowExecution> listExecutionsMatching(Predicate<WorkflowExecution> filter) {
        return readAll(executionsDir, WorkflowExecution.class).stream()
                .filter(filter)
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    private static boolean isSafeId(String id) {
        return id != null && SAFE_ID.matcher(id).matches();
    }

    private static Path fileFor(Path dir, String id) {
        if (!isSafeId(id)) {
            throw new IllegalArgumentException("Invalid record id: " + id);
        }
        return dir.resolve(id + SUFFIX);
    }

    private synchronized void write(Path target, Object record) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), record);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new WorkflowStoreException("Failed to write " + target.getFileName(), e);
        }
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new WorkflowStoreException("Failed to read " + file.getFileName(), e);
        }
    }

    private <T> List<T> readAll(Path dir, Class<T> type) {
        List<T> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    records.add(objectMapper.readValue(file.toFile(), type));
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Skipping unreadable record " + file.getFileName() + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new WorkflowStoreException("Failed to list " + dir, e);
        }
        return records;
    }
}
