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

import dev.mars.stepflow.core.BatchProcessingConfig;
import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;
import dev.mars.stepflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.storage.InMemoryWorkflowStore;
import dev.mars.stepflow.workflow.WorkflowEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

class BatchProcessorTest {

    private WorkflowEngine engine;
    private InMemoryWorkflowStore store;
    private BatchProcessor processor;
    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() throws Exception {
        engine = mock(WorkflowEngine.class);
        store = new InMemoryWorkflowStore();
        definition = WorkflowDefinition.builder("company-lookup")
                .step(WorkflowStep.builder("search").tool("company-search").parameter("query", "${ticker}").build())
                .build();
        store.saveDefinition(definition);
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation ->
                WorkflowExecution.create(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2)));
        processor = new BatchProcessor(engine, store, 8);
    }

    @AfterEach
    void tearDown() {
        processor.shutdown();
    }

    private static List<Map<String, Object>> items(int count) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(Map.of("ticker", "T" + i, "index", i));
        }
        return items;
    }

    @Test
    void testPartition() {
        assertEquals(List.of(3, 3, 3, 1), BatchProcessor.partition(10, 3));
        assertEquals(List.of(5), BatchProcessor.partition(5, 10));
        assertEquals(List.of(2, 2), BatchProcessor.partition(4, 2));
        assertTrue(BatchProcessor.partition(0, 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> BatchProcessor.partition(3, 0));
    }

    @Test
    void testEveryItemStartedAcrossBatches() throws Exception {
        BatchResult result = processor.process(definition.getId(), items(10),
                BatchProcessingConfig.of(3, 2, 0, Duration.ZERO, true), "batch-tester");

        assertEquals(BatchStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(3, 3, 3, 1), result.getBatchSizes());
        assertEquals(4, result.getBatchesDispatched());
        assertEquals(10, result.getProcessedItems());
        assertEquals(10, result.getSuccessfulStarts());
        assertEquals(0, result.getFailedStarts());
        assertEquals(10, result.getExecutionIds().size());
        assertEquals(10, result.getExecutionIds().stream().distinct().count());
        assertFalse(result.isStoppedEarly());
        assertNotNull(result.getCompletedAt());
        verify(engine, times(10)).start(any(), anyMap(), any());

        List<BatchItemOutcome> outcomes = result.getItemOutcomes();
        for (int i = 0; i < outcomes.size(); i++) {
            assertEquals(i, outcomes.get(i).itemIndex());
            assertEquals(i / 3, outcomes.get(i).batchNumber());
        }
    }

    @Test
    void testStartsWithinBatchBoundedByMaxParallelism() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(100);
            inFlight.decrementAndGet();
            return WorkflowExecution.create(invocation.getArgument(0), invocation.getArgument(1), "batch-tester");
        });

        BatchResult result = processor.process(definition.getId(), items(6),
                BatchProcessingConfig.of(6, 2, 0, Duration.ZERO, true), "batch-tester");

        assertEquals(6, result.getSuccessfulStarts());
        assertTrue(peak.get() <= 2, "peak parallel starts was " + peak.get());
    }

    @Test
    void testStopsAfterBatchWithFailureWhenContinueOnErrorDisabled() throws Exception {
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            Map<String, Object> item = invocation.getArgument(1);
            if (Integer.valueOf(2).equals(item.get("index"))) {
                throw new IllegalStateException("item rejected");
            }
            return WorkflowExecution.create(invocation.getArgument(0), item, "batch-tester");
        });

        BatchResult result = processor.process(definition.getId(), items(6),
                BatchProcessingConfig.of(2, 2, 0, Duration.ZERO, false), "batch-tester");

        assertEquals(BatchStatus.STOPPED, result.getStatus());
        assertTrue(result.isStoppedEarly());
        assertEquals(2, result.getBatchesDispatched());
        assertEquals(4, result.getProcessedItems());
        assertEquals(3, result.getSuccessfulStarts());
        assertEquals(1, result.getFailedStarts());
        assertEquals("item rejected", result.getItemOutcomes().get(2).error());
        verify(engine, times(4)).start(any(), anyMap(), any());
    }

    @Test
    void testFailuresRecordedWhenContinueOnErrorEnabled() throws Exception {
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            Map<String, Object> item = invocation.getArgument(1);
            if (((Integer) item.get("index")) % 2 == 0) {
                throw new IllegalStateException("even items rejected");
            }
            return WorkflowExecution.create(invocation.getArgument(0), item, "batch-tester");
        });

        BatchResult result = processor.process(definition.getId(), items(5),
                BatchProcessingConfig.of(2, 2, 0, Duration.ZERO, true), "batch-tester");

        assertEquals(BatchStatus.COMPLETED, result.getStatus());
        assertEquals(5, result.getProcessedItems());
        assertEquals(2, result.getSuccessfulStarts());
        assertEquals(3, result.getFailedStarts());
        assertEquals(2, result.getExecutionIds().size());
    }

    @Test
    void testInfrastructureFailureRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() <= 2) {
                throw new StepflowInfrastructureException("Task queue is full (capacity 1)");
            }
            return WorkflowExecution.create(invocation.getArgument(0), invocation.getArgument(1), "batch-tester");
        });

        BatchResult result = processor.process(definition.getId(), items(1),
                BatchProcessingConfig.of(1, 1, 2, Duration.ofMillis(10), true), "batch-tester");

        assertEquals(1, result.getSuccessfulStarts());
        assertEquals(3, result.getItemOutcomes().get(0).attempts());
    }

    @Test
    void testRetriesExhausted() throws Exception {
        when(engine.start(any(), anyMap(), any()))
                .thenThrow(new StepflowInfrastructureException("Task queue is full (capacity 1)"));

        BatchResult result = processor.process(definition.getId(), items(1),
                BatchProcessingConfig.of(1, 1, 1, Duration.ofMillis(10), true), "batch-tester");

        assertEquals(1, result.getFailedStarts());
        BatchItemOutcome outcome = result.getItemOutcomes().get(0);
        assertFalse(outcome.isStarted());
        assertEquals(2, outcome.attempts());
        assertTrue(outcome.error().contains("queue is full"));
    }

    @Test
    void testNonInfrastructureFailureNotRetried() throws Exception {
        when(engine.start(any(), anyMap(), any())).thenThrow(new IllegalStateException("bad item"));

        BatchResult result = processor.process(definition.getId(), items(1),
                BatchProcessingConfig.of(1, 1, 3, Duration.ofMillis(10), true), "batch-tester");

        assertEquals(1, result.getItemOutcomes().get(0).attempts());
        verify(engine, times(1)).start(any(), anyMap(), any());
    }

    @Test
    void testRejectsInvalidRequests() {
        assertThrows(WorkflowValidationException.class, () -> processor.submit(definition.getId(), List.of(),
                BatchProcessingConfig.defaults(), "batch-tester"));

        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> processor.submit(definition.getId(), items(2),
                        BatchProcessingConfig.of(0, 51, 0, Duration.ZERO, true), "batch-tester"));
        assertEquals(2, exception.getErrors().size());

        assertThrows(WorkflowNotFoundException.class, () -> processor.submit("no-such-workflow", items(2),
                BatchProcessingConfig.defaults(), "batch-tester"));
    }

    @Test
    void testBatchRetrievableById() throws Exception {
        BatchResult result = processor.submit(definition.getId(), items(3),
                BatchProcessingConfig.of(3, 3, 0, Duration.ZERO, true), "batch-tester").get(5, TimeUnit.SECONDS);

        assertSame(result, processor.getBatch(result.getBatchId()).orElseThrow());
        assertTrue(processor.getBatch("unknown").isEmpty());
        assertEquals("company-lookup", result.getWorkflowName());
    }

    @Test
    void testStartReturnsLiveRecordBeforeDispatchFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return WorkflowExecution.create(invocation.getArgument(0), invocation.getArgument(1), "batch-tester");
        });

        BatchResult result = processor.start(definition.getId(), items(2),
                BatchProcessingConfig.of(2, 2, 0, Duration.ZERO, true), "batch-tester");

        assertEquals(BatchStatus.RUNNING, result.getStatus());
        assertFalse(result.getCompletion().isDone());
        assertSame(result, processor.getBatch(result.getBatchId()).orElseThrow());

        release.countDown();
        assertSame(result, result.getCompletion().get(5, TimeUnit.SECONDS));
        assertEquals(BatchStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getSuccessfulStarts());
    }

    @Test
    void testOldestFinishedBatchesEvictedBeyondRetentionLimit() throws Exception {
        BatchProcessor bounded = new BatchProcessor(engine, store, 2, 2);
        try {
            List<String> batchIds = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                BatchResult result = bounded.submit(definition.getId(), items(1),
                        BatchProcessingConfig.of(1, 1, 0, Duration.ZERO, true), "batch-tester")
                        .get(5, TimeUnit.SECONDS);
                batchIds.add(result.getBatchId());
            }

            assertEquals(2, bounded.listBatches().size());
            assertTrue(bounded.getBatch(batchIds.get(0)).isEmpty());
            assertTrue(bounded.getBatch(batchIds.get(1)).isEmpty());
            assertTrue(bounded.getBatch(batchIds.get(3)).isPresent());
        } finally {
            bounded.shutdown();
        }
    }

    @Test
    void testRunningBatchIsNeverEvicted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(engine.start(any(), anyMap(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return WorkflowExecution.create(invocation.getArgument(0), invocation.getArgument(1), "batch-tester");
        });
        BatchProcessor bounded = new BatchProcessor(engine, store, 2, 1);
        try {
            BatchResult running = bounded.start(definition.getId(), items(1),
                    BatchProcessingConfig.of(1, 1, 0, Duration.ZERO, true), "batch-tester");
            BatchResult second = bounded.start(definition.getId(), items(1),
                    BatchProcessingConfig.of(1, 1, 0, Duration.ZERO, true), "batch-tester");

            assertTrue(bounded.getBatch(running.getBatchId()).isPresent());
            assertTrue(bounded.getBatch(second.getBatchId()).isPresent());

            release.countDown();
            running.getCompletion().get(5, TimeUnit.SECONDS);
            second.getCompletion().get(5, TimeUnit.SECONDS);
            await().atMost(Duration.ofSeconds(5)).until(() -> bounded.listBatches().size() == 1);
        } finally {
            bounded.shutdown();
        }
    }
}
