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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowExecutionTest {

    private WorkflowDefinition definition;
    private WorkflowExecution execution;

    @BeforeEach
    void setUp() {
        definition = WorkflowDefinition.builder("research")
                .step(WorkflowStep.builder("a").tool("company-search").build())
                .step(WorkflowStep.builder("b").tool("form-filter").dependsOn("a").build())
                .step(WorkflowStep.builder("c").tool("content-search").dependsOn("a").build())
                .build();
        execution = WorkflowExecution.create(definition, Map.of("ticker", "ACME"), "tester");
    }

    @Test
    void testInitialState() {
        assertNotNull(execution.getId());
        assertEquals(definition.getId(), execution.getWorkflowId());
        assertEquals("research", execution.getWorkflowName());
        assertEquals(WorkflowStatus.PENDING, execution.getStatus());
        assertEquals(3, execution.getStepExecutions().size());
        assertEquals("a", execution.getStepExecutions().get(0).getStepId());
        assertEquals("c", execution.getStepExecutions().get(2).getStepId());
        assertEquals("ACME", execution.getParameters().get("ticker"));
        assertEquals("tester", execution.getInitiatedBy());
        assertNull(execution.getStartedAt());
        assertNull(execution.getDuration());
    }

    @Test
    void testStartOnlyWorksFromPending() {
        assertTrue(execution.start(Instant.now()));
        Instant firstStart = execution.getStartedAt();

        assertFalse(execution.start(Instant.now().plusSeconds(5)));
        assertEquals(firstStart, execution.getStartedAt());
    }

    @Test
    void testPauseAndResume() {
        assertFalse(execution.pause(), "cannot pause before running");

        execution.start(Instant.now());
        assertTrue(execution.pause());
        assertEquals(WorkflowStatus.PAUSED, execution.getStatus());
        assertFalse(execution.complete(Instant.now()), "paused execution does not complete");

        assertTrue(execution.resume());
        assertEquals(WorkflowStatus.RUNNING, execution.getStatus());
    }

    @Test
    void testTerminalStatesAreFinal() {
        execution.start(Instant.now());
        assertTrue(execution.fail(Instant.now(), "boom"));

        assertFalse(execution.cancel(Instant.now(), "late"));
        assertFalse(execution.complete(Instant.now()));
        assertEquals(WorkflowStatus.FAILED, execution.getStatus());
        assertEquals("boom", execution.getErrorMessage());
    }

    @Test
    void testDurationDerivedFromTimestamps() {
        Instant start = Instant.parse("2025-01-01T10:00:00Z");
        execution.start(start);
        execution.complete(start.plusSeconds(42));

        assertEquals(Duration.ofSeconds(42), execution.getDuration());
    }

    @Test
    void testProgressCountsEveryStepOnce() {
        execution.start(Instant.now());
        WorkflowStepExecution a = execution.getStepExecution("a").orElseThrow();
        WorkflowStepExecution b = execution.getStepExecution("b").orElseThrow();
        WorkflowStepExecution c = execution.getStepExecution("c").orElseThrow();

        a.markRunning(Instant.now());
        a.markFailed(Instant.now(), "tool error");
        b.markSkipped("dependency a failed");
        c.markCancelled(Instant.now(), "aborted");

        WorkflowProgress progress = execution.getProgress();
        assertEquals(3, progress.getTotalSteps());
        assertEquals(1, progress.getFailedSteps());
        assertEquals(1, progress.getSkippedSteps());
        assertEquals(1, progress.getCancelledSteps());
        assertEquals(progress.getTotalSteps(),
                progress.getCompletedSteps() + progress.getFailedSteps() + progress.getPendingSteps()
                        + progress.getRunningSteps() + progress.getSkippedSteps() + progress.getCancelledSteps());
    }

    @Test
    void testPercentCompleteAndEstimate() {
        Instant start = Instant.now().minusSeconds(10);
        execution.start(start);
        WorkflowStepExecution a = execution.getStepExecution("a").orElseThrow();
        a.markRunning(start);
        a.markCompleted(start.plusSeconds(10), Map.of("hits", 3));

        WorkflowProgress progress = execution.getProgress();
        assertEquals(100.0 / 3, progress.getPercentComplete(), 0.0001);
        assertNotNull(progress.getEstimatedTimeRemaining());
        assertTrue(progress.getEstimatedTimeRemaining().toSeconds() >= 19);
    }

    @Test
    void testEmptyProgressHasZeroPercent() {
        WorkflowProgress progress = new WorkflowProgress(0, 0, 0, 0, 0, 0, 0, null);
        assertEquals(0.0, progress.getPercentComplete());
    }

    @Test
    void testResultsIgnoreNullOutput() {
        execution.recordResult("a", Map.of("k", "v"));
        execution.recordResult("b", null);

        assertEquals(1, execution.getResults().size());
        assertTrue(execution.getResults().containsKey("a"));
    }
}
