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
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.exceptions.ExecutionNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.storage.InMemoryWorkflowStore;
import dev.mars.stepflow.tool.Tool;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.tool.ToolResult;
import dev.mars.stepflow.workflow.aggregation.AggregatedResults;
import dev.mars.stepflow.workflow.batch.BatchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests through the orchestrator with the real engine and an in-memory store.
 */
class WorkflowOrchestratorTest {

    private ToolRegistry toolRegistry;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        toolRegistry = new ToolRegistry();
        Tool search = mock(Tool.class);
        when(search.getName()).thenReturn("company-search");
        when(search.execute(anyMap()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        ToolResult.success(Map.of("query", ((Map<?, ?>) invocation.getArgument(0)).get("query")))));
        toolRegistry.registerTool(search);
        toolRegistry.registerPlaceholders(List.of("content-search"));

        Properties properties = new Properties();
        properties.setProperty(StepflowConfiguration.BATCH_THREAD_POOL_SIZE, "2");
        orchestrator = WorkflowOrchestrator.create(toolRegistry, new InMemoryWorkflowStore(),
                new StepflowConfiguration(properties));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private static WorkflowDefinition lookupWorkflow() {
        return WorkflowDefinition.builder("lookup")
                .step(WorkflowStep.builder("search").tool("company-search").parameter("query", "${ticker}").build())
                .build();
    }

    private WorkflowExecution awaitTerminal(String executionId) throws Exception {
        await().atMost(Duration.ofSeconds(10))
                .until(() -> orchestrator.getExecution(executionId).getStatus().isTerminal());
        await().atMost(Duration.ofSeconds(10)).until(() -> orchestrator.getActiveExecutionCount() == 0);
        return orchestrator.getExecution(executionId);
    }

    @Test
    void testSubmitAndRunDefinition() throws Exception {
        String workflowId = orchestrator.submitDefinition(lookupWorkflow());

        WorkflowExecution started = orchestrator.startExecution(workflowId, Map.of("ticker", "MSFT"), "analyst");
        WorkflowExecution finished = awaitTerminal(started.getId());

        assertEquals(WorkflowStatus.COMPLETED, finished.getStatus());
        assertEquals(Map.of("query", "MSFT"), finished.getResults().get("search"));
        assertEquals(1, orchestrator.listExecutions(workflowId).size());

        ExecutionStatusView view = orchestrator.getExecutionStatus(started.getId(), false);
        assertNull(view.stepDetails());
        assertEquals(1, orchestrator.getExecutionStatus(started.getId(), true).stepDetails().size());
    }

    @Test
    void testInvalidDefinitionRejectedWithAllErrors() {
        WorkflowDefinition definition = WorkflowDefinition.builder("broken")
                .step(WorkflowStep.builder("a").tool("unknown-tool").dependsOn("b").build())
                .step(WorkflowStep.builder("b").tool("company-search").dependsOn("a").build())
                .build();

        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> orchestrator.submitDefinition(definition));

        assertEquals(2, exception.getErrors().size());
        assertTrue(orchestrator.listDefinitions().isEmpty());
    }

    @Test
    void testResubmittingAnExistingIdIsRejected() throws Exception {
        WorkflowDefinition original = WorkflowDefinition.builder("original")
                .id("wf-1")
                .step(WorkflowStep.builder("search").tool("company-search").build())
                .build();
        WorkflowDefinition replacement = WorkflowDefinition.builder("replacement")
                .id("wf-1")
                .step(WorkflowStep.builder("z").tool("company-search").build())
                .build();
        assertEquals("wf-1", orchestrator.submitDefinition(original));

        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> orchestrator.submitDefinition(replacement));

        assertEquals(List.of("Workflow id 'wf-1' already exists"), exception.getErrors());
        WorkflowDefinition stored = orchestrator.getDefinition("wf-1");
        assertEquals("original", stored.getName());
        assertEquals("search", stored.getSteps().get(0).getId());
    }

    @Test
    void testUnknownIdsRaiseNotFound() {
        assertThrows(WorkflowNotFoundException.class, () -> orchestrator.getDefinition("nope"));
        assertThrows(WorkflowNotFoundException.class, () -> orchestrator.deleteDefinition("nope"));
        assertThrows(WorkflowNotFoundException.class,
                () -> orchestrator.startExecution("nope", Map.of(), "analyst"));
        assertThrows(ExecutionNotFoundException.class, () -> orchestrator.getExecution("nope"));
        assertThrows(ExecutionNotFoundException.class, () -> orchestrator.cancelExecution("nope"));
    }

    @Test
    void testPlaceholderToolFailsExecution() throws Exception {
        String workflowId = orchestrator.submitDefinition(WorkflowDefinition.builder("news")
                .step(WorkflowStep.builder("scan").tool("content-search").build())
                .build());

        WorkflowExecution finished = awaitTerminal(
                orchestrator.startExecution(workflowId, Map.of(), "analyst").getId());

        assertEquals(WorkflowStatus.FAILED, finished.getStatus());
        assertTrue(finished.getStepExecution("scan").orElseThrow().getError().contains("not configured"));
    }

    @Test
    void testBatchThenAggregate() throws Exception {
        String workflowId = orchestrator.submitDefinition(lookupWorkflow());
        List<Map<String, Object>> items = List.of(
                Map.of("ticker", "AAPL"), Map.of("ticker", "MSFT"), Map.of("ticker", "GOOG"));

        BatchResult batch = orchestrator.submitBatch(workflowId, items,
                BatchProcessingConfig.of(2, 2, 0, Duration.ZERO, true), "analyst").get(10, TimeUnit.SECONDS);

        assertEquals(3, batch.getSuccessfulStarts());
        assertTrue(orchestrator.getBatch(batch.getBatchId()).isPresent());
        await().atMost(Duration.ofSeconds(10)).until(() -> orchestrator.getActiveExecutionCount() == 0);

        AggregatedResults results = orchestrator.aggregate(batch.getExecutionIds(), "detailed", false);
        assertEquals(3, results.getTotalExecutions());
        assertEquals(100.0, results.getSuccessRate(), 1e-9);
        assertEquals(Map.of("lookup", 3), results.getExecutionsByWorkflow());
        assertEquals(100.0, results.getStepSuccessRates().get("search"), 1e-9);

        assertThrows(WorkflowValidationException.class,
                () -> orchestrator.aggregate(batch.getExecutionIds(), "everything", false));
    }

    @Test
    void testDeleteDefinition() throws Exception {
        String workflowId = orchestrator.submitDefinition(lookupWorkflow());
        orchestrator.deleteDefinition(workflowId);
        assertThrows(WorkflowNotFoundException.class, () -> orchestrator.getDefinition(workflowId));
    }

    @Test
    void testLifecycleOnFinishedExecutionIsNoOp() throws Exception {
        String workflowId = orchestrator.submitDefinition(lookupWorkflow());
        WorkflowExecution finished = awaitTerminal(
                orchestrator.startExecution(workflowId, Map.of("ticker", "IBM"), "analyst").getId());

        assertFalse(orchestrator.cancelExecution(finished.getId()));
        assertFalse(orchestrator.pauseExecution(finished.getId()));
        assertFalse(orchestrator.resumeExecution(finished.getId()));
        assertEquals(WorkflowStatus.COMPLETED, orchestrator.getExecution(finished.getId()).getStatus());
    }
}
