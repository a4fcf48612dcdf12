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

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowProgress;
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.core.WorkflowStepExecution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of an execution for status queries. Step details are omitted
 * unless requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionStatusView(String executionId,
                                  String workflowId,
                                  String workflowName,
                                  WorkflowStatus status,
                                  WorkflowProgress progress,
                                  Instant startedAt,
                                  Instant completedAt,
                                  Duration duration,
                                  String initiatedBy,
                                  String errorMessage,
                                  List<WorkflowStepExecution> stepDetails) {

    public static ExecutionStatusView of(WorkflowExecution execution, boolean includeStepDetails) {
        return new ExecutionStatusView(
                execution.getId(),
                execution.getWorkflowId(),
                execution.getWorkflowName(),
                execution.getStatus(),
                execution.getProgress(),
                execution.getStartedAt(),
                execution.getCompletedAt(),
                execution.getDuration(),
                execution.getInitiatedBy(),
                execution.getErrorMessage(),
                includeStepDetails ? execution.getStepExecutions() : null);
    }
}
