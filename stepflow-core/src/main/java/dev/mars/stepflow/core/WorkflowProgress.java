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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time step counters for an execution.
 * Each step is counted exactly once, so the six counters always add up to
 * {@link #getTotalSteps()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowProgress {

    private final int totalSteps;
    private final int completedSteps;
    private final int failedSteps;
    private final int pendingSteps;
    private final int runningSteps;
    private final int skippedSteps;
    private final int cancelledSteps;
    private final Duration estimatedTimeRemaining;

    @JsonCreator
    public WorkflowProgress(@JsonProperty("totalSteps") int totalSteps,
                            @JsonProperty("completedSteps") int completedSteps,
                            @JsonProperty("failedSteps") int failedSteps,
                            @JsonProperty("pendingSteps") int pendingSteps,
                            @JsonProperty("runningSteps") int runningSteps,
                            @JsonProperty("skippedSteps") int skippedSteps,
                            @JsonProperty("cancelledSteps") int cancelledSteps,
                            @JsonProperty("estimatedTimeRemaining") Duration estimatedTimeRemaining) {
        this.totalSteps = totalSteps;
        this.completedSteps = completedSteps;
        this.failedSteps = failedSteps;
        this.pendingSteps = pendingSteps;
        this.runningSteps = runningSteps;
        this.skippedSteps = skippedSteps;
        this.cancelledSteps = cancelledSteps;
        this.estimatedTimeRemaining = estimatedTimeRemaining;
    }

    /**
     * Counts step states. The time estimate extrapolates the mean time per finished
     * step over the remaining steps and is only produced for a running execution.
     */
    public static WorkflowProgress of(List<WorkflowStepExecution> steps, Instant startedAt,
                                      Instant now, boolean terminal) {
        int completed = 0;
        int failed = 0;
        int pending = 0;
        int running = 0;
        int skipped = 0;
        int cancelled = 0;
        for (WorkflowStepExecution step : steps) {
            switch (step.getStatus()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case PENDING -> pending++;
                case RUNNING -> running++;
                case SKIPPED -> skipped++;
                case CANCELLED -> cancelled++;
            }
        }

        Duration estimate = null;
        int finished = completed + failed;
        int remaining = pending + running;
        if (!terminal && startedAt != null && finished > 0 && remaining > 0) {
            long elapsedMs = Duration.between(startedAt, now).toMillis();
            estimate = Duration.ofMillis(elapsedMs / finished * remaining);
        }
        return new WorkflowProgress(steps.size(), completed, failed, pending, running, skipped, cancelled, estimate);
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public int getCompletedSteps() {
        return completedSteps;
    }

    public int getFailedSteps() {
        return failedSteps;
    }

    public int getPendingSteps() {
        return pendingSteps;
    }

    public int getRunningSteps() {
        return runningSteps;
    }

    public int getSkippedSteps() {
        return skippedSteps;
    }

    public int getCancelledSteps() {
        return cancelledSteps;
    }

    public double getPercentComplete() {
        return totalSteps == 0 ? 0.0 : (double) completedSteps / totalSteps * 100.0;
    }

    public Duration getEstimatedTimeRemaining() {
        return estimatedTimeRemaining;
    }

    @Override
    public String toString() {
        return "WorkflowProgress{" +
                "total=" + totalSteps +
                ", completed=" + completedSteps +
                ", failed=" + failedSteps +
                ", pending=" + pendingSteps +
                ", running=" + runningSteps +
                ", skipped=" + skippedSteps +
                ", cancelled=" + cancelledSteps +
                '}';
    }
}
