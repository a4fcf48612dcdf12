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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.stepflow.core.BatchProcessingConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Live record of a batch job. Counters are updated as items are started, so the
 * record can be read while dispatch is still running.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BatchResult {

    private final String batchId;
    private final String workflowId;
    private final String workflowName;
    private final int totalItems;
    private final List<Integer> batchSizes;
    private final BatchProcessingConfig config;
    private final String initiatedBy;
    private final Instant startedAt;

    private final List<BatchItemOutcome> outcomes = new ArrayList<>();
    private final AtomicInteger processedItems = new AtomicInteger();
    private final AtomicInteger successfulStarts = new AtomicInteger();
    private final AtomicInteger failedStarts = new AtomicInteger();
    private final AtomicInteger batchesDispatched = new AtomicInteger();

    private final CompletableFuture<BatchResult> completion = new CompletableFuture<>();

    private volatile BatchStatus status = BatchStatus.RUNNING;
    private volatile Instant completedAt;

    BatchResult(String workflowId, String workflowName, int totalItems, List<Integer> batchSizes,
                BatchProcessingConfig config, String initiatedBy) {
        this.batchId = UUID.randomUUID().toString();
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.totalItems = totalItems;
        this.batchSizes = List.copyOf(batchSizes);
        this.config = config;
        this.initiatedBy = initiatedBy;
        this.startedAt = Instant.now();
    }

    void record(BatchItemOutcome outcome) {
        synchronized (outcomes) {
            outcomes.add(outcome);
        }
        processedItems.incrementAndGet();
        if (outcome.isStarted()) {
            successfulStarts.incrementAndGet();
        } else {
            failedStarts.incrementAndGet();
        }
    }

    void batchDispatched() {
        batchesDispatched.incrementAndGet();
    }

    void finish(BatchStatus finalStatus) {
        this.completedAt = Instant.now();
        this.status = finalStatus;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getProcessedItems() {
        return processedItems.get();
    }

    public int getSuccessfulStarts() {
        return successfulStarts.get();
    }

    public int getFailedStarts() {
        return failedStarts.get();
    }

    public int getBatchCount() {
        return batchSizes.size();
    }

    public List<Integer> getBatchSizes() {
        return batchSizes;
    }

    public int getBatchesDispatched() {
        return batchesDispatched.get();
    }

    public BatchProcessingConfig getConfig() {
        return config;
    }

    public String getInitiatedBy() {
        return initiatedBy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public BatchStatus getStatus() {
        return status;
    }

    public boolean isStoppedEarly() {
        return status == BatchStatus.STOPPED;
    }

    /**
     * @return outcomes ordered by item index
     */
    public List<BatchItemOutcome> getItemOutcomes() {
        synchronized (outcomes) {
            return outcomes.stream()
                    .sorted(Comparator.comparingInt(BatchItemOutcome::itemIndex))
                    .collect(Collectors.toList());
        }
    }

    /**
     * @return ids of the started executions, ordered by item index
     */
    public List<String> getExecutionIds() {
        return getItemOutcomes().stream()
                .filter(BatchItemOutcome::isStarted)
                .map(BatchItemOutcome::executionId)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public CompletableFuture<BatchResult> getCompletion() {
        return completion;
    }

    @JsonIgnore
    public boolean isFinished() {
        return status.isFinished();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "batchId='" + batchId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", processed=" + processedItems.get() + "/" + totalItems +
                ", started=" + successfulStarts.get() +
                ", failed=" + failedStarts.get() +
                '}';
    }
}
