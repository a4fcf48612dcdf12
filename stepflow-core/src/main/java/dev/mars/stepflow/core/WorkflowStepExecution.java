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

/**
 * Runtime record of one step within a workflow execution.
 *
 * <p>Transitions are synchronized so that concurrent completion and cancellation
 * of the same step resolve to a single terminal state. Every {@code mark*} method
 * returns {@code false} when the transition is not allowed from the current state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowStepExecution {

    private final String stepId;
    private final String stepName;
    private final String toolName;

    private volatile StepStatus status;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile Object result;
    private volatile String error;

    public WorkflowStepExecution(WorkflowStep step) {
        this(step.getId(), step.getName(), step.getToolName(), StepStatus.PENDING, null, null, null, null);
    }

    @JsonCreator
    public WorkflowStepExecution(@JsonProperty("stepId") String stepId,
                                 @JsonProperty("stepName") String stepName,
                                 @JsonProperty("toolName") String toolName,
                                 @JsonProperty("status") StepStatus status,
                                 @JsonProperty("startedAt") Instant startedAt,
                                 @JsonProperty("completedAt") Instant completedAt,
                                 @JsonProperty("result") Object result,
                                 @JsonProperty("error") String error) {
        this.stepId = stepId;
        this.stepName = stepName;
        this.toolName = toolName;
        this.status = status != null ? status : StepStatus.PENDING;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.result = result;
        this.error = error;
    }

    public synchronized boolean markRunning(Instant now) {
        if (status != StepStatus.PENDING) {
            return false;
        }
        status = StepStatus.RUNNING;
        startedAt = now;
        return true;
    }

    public synchronized boolean markCompleted(Instant now, Object output) {
        if (status != StepStatus.RUNNING) {
            return false;
        }
        status = StepStatus.COMPLETED;
        completedAt = now;
        result = output;
        return true;
    }

    public synchronized boolean markFailed(Instant now, String errorMessage) {
        if (status != StepStatus.RUNNING) {
            return false;
        }
        status = StepStatus.FAILED;
        completedAt = now;
        error = errorMessage;
        return true;
    }

    public synchronized boolean markSkipped(String reason) {
        if (status != StepStatus.PENDING) {
            return false;
        }
        status = StepStatus.SKIPPED;
        error = reason;
        return true;
    }

    /**
     * Cancels a pending or running step. A running step keeps its start time.
     */
    public synchronized boolean markCancelled(Instant now, String reason) {
        if (status.isTerminal()) {
            return false;
        }
        if (status == StepStatus.RUNNING) {
            completedAt = now;
        }
        status = StepStatus.CANCELLED;
        error = reason;
        return true;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public String getToolName() {
        return toolName;
    }

    public StepStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Object getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    /**
     * @return {@code completedAt - startedAt}, or {@code null} until both are set
     */
    public Duration getDuration() {
        Instant start = startedAt;
        Instant end = completedAt;
        return start != null && end != null ? Duration.between(start, end) : null;
    }

    @Override
    public String toString() {
        return "WorkflowStepExecution{" +
                "stepId='" + stepId + '\'' +
                ", status=" + status +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
