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

package dev.mars.stepflow.workflow.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowProgress;
import dev.mars.stepflow.core.WorkflowStatus;

import java.time.Duration;

/**
 * Per-execution line of an aggregation report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionSummary(String executionId,
                               String workflowId,
                               String workflowName,
                               WorkflowStatus status,
                               Double durationSeconds,
                               int totalSteps,
                               int completedSteps,
                               int failedSteps,
                               String errorMessage) {

    static ExecutionSummary of(WorkflowExecution execution) {
        WorkflowProgress progress = execution.getProgress();
        Duration duration = execution.getDuration();
        return new ExecutionSummary(
                execution.getId(),
                execution.getWorkflowId(),
                execution.getWorkflowName(),
                execution.getStatus(),
                duration != null ? ResultAggregator.toSeconds(duration) : null,
                progress.getTotalSteps(),
                progress.getCompletedSteps(),
                progress.getFailedSteps(),
                execution.getErrorMessage());
    }
}
