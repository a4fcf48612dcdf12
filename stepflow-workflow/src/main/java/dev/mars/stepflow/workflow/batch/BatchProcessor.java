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
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;
import dev.mars.stepflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.storage.WorkflowStore;
import dev.mars.stepflow.workflow.WorkflowEngine;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts one workflow execution per input item, in contiguous batches.
 *
 * <p>The item list is split into {@code ceil(N / batchSize)} batches in input order.
 * Every item of a batch is started, with at most {@code maxParallelism} start
 * attempts in flight at once, and the whole batch is awaited before the next one
 * begins. Between batches the processor waits {@code retryDelay}. A start that
 * fails for an infrastructure reason, such as a full queue, is retried up to
 * {@code retryCount} times with the same delay. When {@code continueOnError} is off,
 * processing stops after the first batch that contains a failed start.
 *
 * <p>The processor only starts executions. It does not wait for them to finish.
 * Batch records are kept in memory up to {@code maxRetained}; beyond that the oldest
 * finished records are evicted. Records still dispatching are never evicted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class BatchProcessor {

    private static final Logger logger = Logger.getLogger(BatchProcessor.class.getName());

    public static final int DEFAULT_MAX_RETAINED = 500;

    private final WorkflowEngine engine;
    private final WorkflowStore store;
    private final WorkflowMetrics metrics;
    private final ExecutorService dispatchPool;
    private final ExecutorService itemPool;
    private final Map<String, BatchResult> batches = new ConcurrentHashMap<>();
    private final Deque<String> retentionOrder = new ConcurrentLinkedDeque<>();
    private final int maxRetained;

    public BatchProcessor(WorkflowEngine engine, WorkflowStore store, int threadPoolSize) {
        this(engine, store, threadPoolSize, DEFAULT_MAX_RETAINED);
    }

    public BatchProcessor(WorkflowEngine engine, WorkflowStore store, int threadPoolSize, int maxRetained) {
        this.engine = engine;
        this.store = store;
        this.maxRetained = Math.max(1, maxRetained);
        this.metrics = WorkflowMetrics.getInstance();
        this.dispatchPool = Executors.newCachedThreadPool(new NamedThreadFactory("stepflow-batch-dispatch-"));
        this.itemPool = Executors.newFixedThreadPool(Math.max(1, threadPoolSize),
                new NamedThreadFactory("stepflow-batch-item-"));
    }

    /**
     * Splits {@code itemCount} items into contiguous batches.
     *
     * @return the size of each batch, in order
     */
    public static List<Integer> partition(int itemCount, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        List<Integer> sizes = new ArrayList<>();
        for (int start = 0; start < itemCount; start += batchSize) {
            sizes.add(Math.min(batchSize, itemCount - start));
        }
        return sizes;
    }

    /**
     * Validates the request and starts dispatching in the background.
     *
     * @return a future completing with the batch record once every batch has been dispatched
     * @throws WorkflowNotFoundException   if the workflow id does not resolve
     * @throws WorkflowValidationException if the item list is empty or the config is out of range
     */
    public CompletableFuture<BatchResult> submit(String workflowId, List<Map<String, Object>> items,
                                                 BatchProcessingConfig config, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException {
        return start(workflowId, items, config, initiatedBy).getCompletion();
    }

    /**
     * Same as {@link #submit} but hands back the live record straight away. The record's
     * {@link BatchResult#getCompletion() completion} future finishes when dispatch ends.
     */
    public BatchResult start(String workflowId, List<Map<String, Object>> items,
                             BatchProcessingConfig config, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException {
        BatchProcessingConfig effectiveConfig = config != null ? config : BatchProcessingConfig.defaults();
        List<String> errors = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            errors.add("Batch must contain at least one item");
        }
        errors.addAll(effectiveConfig.validate());
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
        WorkflowDefinition definition = store.getDefinition(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));

        List<Map<String, Object>> snapshot = new ArrayList<>(items);
        BatchResult result = new BatchResult(definition.getId(), definition.getName(), snapshot.size(),
                partition(snapshot.size(), effectiveConfig.getBatchSize()), effectiveConfig, initiatedBy);
        batches.put(result.getBatchId(), result);
        retentionOrder.addLast(result.getBatchId());
        evictFinishedBatches();

        logger.info("Starting batch " + result.getBatchId() + " for workflow '" + definition.getName() + "' with "
                + snapshot.size() + " items in " + result.getBatchCount() + " batches of size "
                + effectiveConfig.getBatchSize());

        CompletableFuture.supplyAsync(() -> dispatch(result, definition, snapshot, effectiveConfig), dispatchPool)
                .whenComplete((done, error) -> {
                    if (error != null) {
                        logger.log(Level.SEVERE, "Batch " + result.getBatchId() + " dispatch failed: "
                                + error.getMessage());
                        result.getCompletion().completeExceptionally(error);
                    } else {
                        result.getCompletion().complete(done);
                    }
                    evictFinishedBatches();
                });
        return result;
    }

    /**
     * Runs the whole batch job and returns once every batch has been dispatched.
     */
    public BatchResult process(String workflowId, List<Map<String, Object>> items,
                               BatchProcessingConfig config, String initiatedBy)
            throws WorkflowNotFoundException, WorkflowValidationException {
        return submit(workflowId, items, config, initiatedBy).join();
    }

    public Optional<BatchResult> getBatch(String batchId) {
        return batchId != null ? Optional.ofNullable(batches.get(batchId)) : Optional.empty();
    }

    public List<BatchResult> listBatches() {
        return new ArrayList<>(batches.values());
    }

    /**
     * Drops the oldest finished records while more than {@code maxRetained} are held.
     */
    private synchronized void evictFinishedBatches() {
        Iterator<String> oldestFirst = retentionOrder.iterator();
        while (batches.size() > maxRetained && oldestFirst.hasNext()) {
            String batchId = oldestFirst.next();
            BatchResult candidate = batches.get(batchId);
            if (candidate == null || candidate.getCompletion().isDone()) {
                oldestFirst.remove();
                if (batches.remove(batchId) != null) {
                    logger.fine("Evicted batch record " + batchId);
                }
            }
        }
    }

    public void shutdown() {
        dispatchPool.shutdownNow();
        itemPool.shutdown();
        try {
            if (!itemPool.awaitTermination(5, TimeUnit.SECONDS)) {
                itemPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            itemPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("BatchProcessor shutdown completed");
    }

    private BatchResult dispatch(BatchResult result, WorkflowDefinition definition,
                                 List<Map<String, Object>> items, BatchProcessingConfig config) {
        List<Integer> sizes = result.getBatchSizes();
        int offset = 0;
        try {
            for (int batchNumber = 0; batchNumber < sizes.size(); batchNumber++) {
                int size = sizes.get(batchNumber);
                int failures = dispatchBatch(result, definition, items, offset, size, batchNumber, config);
                offset += size;
                result.batchDispatched();

                logger.info("Batch " + result.getBatchId() + " dispatched batch " + (batchNumber + 1) + "/"
                        + sizes.size() + ": " + (size - failures) + " started, " + failures + " failed");

                if (failures > 0 && !config.isContinueOnError()) {
                    logger.warning("Stopping batch " + result.getBatchId()
                            + " after a failed start because continueOnError is false");
                    result.finish(BatchStatus.STOPPED);
                    return result;
                }
                if (batchNumber < sizes.size() - 1) {
                    sleep(config.getRetryDelay());
                }
            }
            result.finish(BatchStatus.COMPLETED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Batch " + result.getBatchId() + " interrupted after " + result.getProcessedItems()
                    + " items");
            result.finish(BatchStatus.ABORTED);
        }
        logger.info("Batch processing completed: " + result.getSuccessfulStarts() + "/" + result.getTotalItems()
                + " executions started successfully");
        return result;
    }

    /**
     * Starts every item of one batch with bounded parallelism and waits for all starts.
     *
     * @return number of items that could not be started
     */
    private int dispatchBatch(BatchResult result, WorkflowDefinition definition, List<Map<String, Object>> items,
                              int offset, int size, int batchNumber, BatchProcessingConfig config)
            throws InterruptedException {
        Semaphore parallelism = new Semaphore(config.getMaxParallelism());
        AtomicInteger failures = new AtomicInteger();
        List<CompletableFuture<Void>> starts = new ArrayList<>(size);

        for (int index = offset; index < offset + size; index++) {
            parallelism.acquire();
            int itemIndex = index;
            CompletableFuture<Void> start;
            try {
                start = CompletableFuture.runAsync(() -> {
                    BatchItemOutcome outcome = startItem(definition, items.get(itemIndex), itemIndex, batchNumber,
                            config, result.getInitiatedBy());
                    result.record(outcome);
                    metrics.recordBatchItem(definition.getName(), outcome.isStarted());
                    if (!outcome.isStarted()) {
                        failures.incrementAndGet();
                    }
                }, itemPool);
            } catch (RuntimeException e) {
                parallelism.release();
                throw e;
            }
            starts.add(start.whenComplete((ignored, error) -> parallelism.release()));
        }

        try {
            CompletableFuture.allOf(starts.toArray(new CompletableFuture[0])).join();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected failure while starting batch items: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Batch item start failure details", e);
            }
        }
        // items whose start task itself blew up have no outcome yet
        int recorded = 0;
        for (BatchItemOutcome outcome : result.getItemOutcomes()) {
            if (outcome.batchNumber() == batchNumber) {
                recorded++;
            }
        }
        return failures.get() + (size - recorded);
    }

    private BatchItemOutcome startItem(WorkflowDefinition definition, Map<String, Object> item, int itemIndex,
                                       int batchNumber, BatchProcessingConfig config, String initiatedBy) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                String executionId = engine.start(definition, item, initiatedBy).getId();
                return BatchItemOutcome.started(itemIndex, batchNumber, executionId, attempts);
            } catch (StepflowInfrastructureException e) {
                if (attempts > config.getRetryCount()) {
                    logger.log(Level.SEVERE, "Failed to start workflow execution for batch item " + itemIndex
                            + " after " + attempts + " attempts: " + e.getMessage());
                    return BatchItemOutcome.failed(itemIndex, batchNumber, e.getMessage(), attempts);
                }
                logger.warning("Start of batch item " + itemIndex + " failed (attempt " + attempts + "), retrying in "
                        + config.getRetryDelay() + ": " + e.getMessage());
                try {
                    sleep(config.getRetryDelay());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return BatchItemOutcome.failed(itemIndex, batchNumber, "Interrupted while retrying", attempts);
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to start workflow execution for batch item " + itemIndex + ": "
                        + e.getMessage());
                return BatchItemOutcome.failed(itemIndex, batchNumber, e.getMessage(), attempts);
            }
        }
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
