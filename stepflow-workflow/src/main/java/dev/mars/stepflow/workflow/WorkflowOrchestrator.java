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

import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.BatchProcessingConfig;
import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.exceptions.ExecutionNotFoundException;
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;
import dev.mars.stepflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.storage.DuplicateDefinitionException;
import dev.mars.stepflow.storage.WorkflowStore;
import dev.mars.stepflow.storage.WorkflowStoreException;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.workflow.aggregation.AggregatedResults;
import dev.mars.stepflow.workflow.aggregation.AggregationMode;
import dev.mars.stepflow.workflow.aggregation.ResultAggregator;
import dev.mars.stepflow.workflow.batch.BatchProcessor;
import dev.mars.stepflow.workflow.batch.BatchResult;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Single entry point for the orchestration operations: definition management,
 * execution control, batch submission and aggregation. The HTTP layer talks only
 * to this class.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowOrchestrator {

    private static final Logger logger = Logger.getLogger(WorkflowOrchestrator.class.getName());

    private final ToolRegistry toolRegistry;
    private final WorkflowStore store;
    private final WorkflowValidator validator;
    private final WorkflowEngine engine;
    private final BatchProcessor batchProcessor;
    private final ResultAggregator aggregator;

    public WorkflowOrchestrator(ToolRegistry toolRegistry, WorkflowStore store, WorkflowEngine engine,
                                BatchProcessor batchProcessor) {
        this.toolRegistry = toolRegistry;
        this.store = store;
        this.engine = engine;
        this.batchProcessor = batchProcessor;
        this.validator = new WorkflowValidator(toolRegistry::getToolNames);
        this.aggregator = new ResultAggregator(engine, store);
    }

    /**
     * Wires a default engine and batch processor from the configuration.
     */
    public static WorkflowOrchestrator create(ToolRegistry toolRegistry, WorkflowStore store,
                                              StepflowConfiguration configuration) {
        WorkflowEngine engine = new DefaultWorkflowEngine(toolRegistry, store, configuration);
        BatchProcessor batchProcessor = new BatchProcessor(engine, store, configuration.getBatchThreadPoolSize(),
                configuration.getBatchMaxRetained());
        return new WorkflowOrchestrator(toolRegistry, store, engine, batchProcessor);
    }

    // Definitions

    /**
     * Validates and stores a definition.
     *
     * @return the definition id
     * @throws WorkflowValidationException listing every problem found, or if the id is already taken
     */
    public String submitDefinition(WorkflowDefinition definition)
            throws WorkflowValidationException, StepflowInfrastructureException {
        validator.validateOrThrow(definition);
        try {
            String id = store.saveDefinition(definition);
            logger.info("Registered workflow '" + definition.getName() + "' (" + id + ") with "
                    + definition.getSteps().size() + " steps");
            return id;
        } catch (DuplicateDefinitionException e) {
            throw new WorkflowValidationException(e.getMessage());
        } catch (WorkflowStoreException e) {
            throw new StepflowInfrastructureException("Failed to store workflow definition: " + e.getMessage(), e);
        }
    }

    public WorkflowDefinition getDefinition(String workflowId) throws WorkflowNotFoundException {
        return store.getDefinition(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    public List<WorkflowDefinition> listDefinitions() {
        return store.listDefinitions();
    }

    public void deleteDefinition(String workflowId) throws WorkflowNotFoundException {
        if (!store.deleteDefinition(workflowId)) {
            throw new WorkflowNotFoundException(workflowId);
        }
        logger.info("Deleted workflow " + workflowId);
    }

    public ValidationResult validateDefinition(WorkflowDefinition definition) {
        return validator.validate(definition);
    }

    // Executions

    /**
     * Creates a pending execution and queues it. Returns without waiting for any step.
     */
    public WorkflowExecution startExecution(String workflowId, Map<String, Object> parameters, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException, StepflowInfrastructureException {
        WorkflowDefinition definition = getDefinition(workflowId);
        // tools may have been unregistered since the definition was stored
        validator.validateOrThrow(definition);
        return engine.start(definition, parameters, initiatedBy);
    }

    /**
     * @return the live execution while it is active, otherwise the stored record
     */
    public WorkflowExecution getExecution(String executionId) throws ExecutionNotFoundException {
        Optional<WorkflowExecution> active = engine.getExecution(executionId);
        if (active.isPresent()) {
            return active.get();
        }
        return store.getExecution(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    public ExecutionStatusView getExecutionStatus(String executionId, boolean includeStepDetails)
            throws ExecutionNotFoundException {
        return ExecutionStatusView.of(getExecution(executionId), includeStepDetails);
    }

    public List<WorkflowExecution> listExecutions(String workflowId) throws WorkflowNotFoundException {
        getDefinition(workflowId);
        return store.listExecutions(workflowId);
    }

    public Optional<CompletableFuture<WorkflowExecution>> getCompletionFuture(String executionId) {
        return engine.getCompletionFuture(executionId);
    }

    public boolean cancelExecution(String executionId) throws ExecutionNotFoundException {
        getExecution(executionId);
        return engine.cancel(executionId);
    }

    public boolean pauseExecution(String executionId) throws ExecutionNotFoundException {
        getExecution(executionId);
        return engine.pause(executionId);
    }

    public boolean resumeExecution(String executionId) throws ExecutionNotFoundException {
        getExecution(executionId);
        return engine.resume(executionId);
    }

    public int getActiveExecutionCount() {
        return engine.getActiveExecutionCount();
    }

    public boolean awaitIdle(Duration timeout) {
        return engine.awaitIdle(timeout);
    }

    // Batches

    public CompletableFuture<BatchResult> submitBatch(String workflowId, List<Map<String, Object>> items,
                                                      BatchProcessingConfig config, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException {
        validator.validateOrThrow(getDefinition(workflowId));
        return batchProcessor.submit(workflowId, items, config, initiatedBy);
    }

    /**
     * Starts a batch and returns its live record without waiting for dispatch.
     */
    public BatchResult startBatch(String workflowId, List<Map<String, Object>> items,
                                  BatchProcessingConfig config, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException {
        validator.validateOrThrow(getDefinition(workflowId));
        return batchProcessor.start(workflowId, items, config, initiatedBy);
    }

    public Optional<BatchResult> getBatch(String batchId) {
        return batchProcessor.getBatch(batchId);
    }

    // Aggregation

    public AggregatedResults aggregate(Collection<String> executionIds, String mode, boolean includeDetails)
            throws WorkflowValidationException {
        return aggregator.aggregate(executionIds, AggregationMode.parse(mode), includeDetails);
    }

    // Tools

    public Set<String> getToolNames() {
        return toolRegistry.getToolNames();
    }

    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public void shutdown() {
        logger.info("Shutting down workflow orchestrator");
        batchProcessor.shutdown();
        engine.shutdown();
    }
}
