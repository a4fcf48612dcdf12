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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * One run of a workflow definition with concrete parameters.
 *
 * <p>The execution is owned and mutated by the execution engine while it is active
 * and is read concurrently by status queries. Status transitions are synchronized.
 * Step records are mutated through {@link WorkflowStepExecution}'s own transitions.
 * Progress is derived from the step records on every read.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkflowExecution {

    private final String id;
    private final String workflowId;
    private final String workflowName;
    private final Map<String, Object> parameters;
    private final List<WorkflowStepExecution> stepExecutions;
    private final Map<String, Object> results;
    private final String initiatedBy;
    private final Instant createdAt;

    private volatile WorkflowStatus status;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile String errorMessage;

    /**
     * Creates a pending execution with one pending step record per definition step.
     */
    public static WorkflowExecution create(WorkflowDefinition definition, Map<String, Object> parameters,
                                           String initiatedBy) {
        List<WorkflowStepExecution> steps = new ArrayList<>(definition.getSteps().size());
        for (WorkflowStep step : definition.getSteps()) {
            steps.add(new WorkflowStepExecution(step));
        }
        return new WorkflowExecution(UUID.randomUUID().toString(), definition.getId(), definition.getName(),
                WorkflowStatus.PENDING, parameters, steps, null, initiatedBy, Instant.now(), null, null, null);
    }

    @JsonCreator
    public WorkflowExecution(@JsonProperty("id") String id,
                             @JsonProperty("workflowId") String workflowId,
                             @JsonProperty("workflowName") String workflowName,
                             @JsonProperty("status") WorkflowStatus status,
                             @JsonProperty("parameters") Map<String, Object> parameters,
                             @JsonProperty("stepExecutions") List<WorkflowStepExecution> stepExecutions,
                             @JsonProperty("results") Map<String, Object> results,
                             @JsonProperty("initiatedBy") String initiatedBy,
                             @JsonProperty("createdAt") Instant createdAt,
                             @JsonProperty("startedAt") Instant startedAt,
                             @JsonProperty("completedAt") Instant completedAt,
                             @JsonProperty("errorMessage") String errorMessage) {
        this.id = id;
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.status = status != null ? status : WorkflowStatus.PENDING;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.stepExecutions = stepExecutions != null
                ? stepExecutions.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
                : Collections.emptyList();
        this.results = new ConcurrentHashMap<>();
        if (results != null) {
            results.forEach((key, value) -> {
                if (key != null && value != null) {
                    this.results.put(key, value);
                }
            });
        }
        this.initiatedBy = initiatedBy;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.errorMessage = errorMessage;
    }

    // Status transitions

    public synchronized boolean start(Instant now) {
        if (status != WorkflowStatus.PENDING) {
            return false;
        }
        status = WorkflowStatus.RUNNING;
        startedAt = now;
        return true;
    }

    public synchronized boolean pause() {
        if (status != WorkflowStatus.RUNNING) {
            return false;
        }
        status = WorkflowStatus.PAUSED;
        return true;
    }

    public synchronized boolean resume() {
        if (status != WorkflowStatus.PAUSED) {
            return false;
        }
        status = WorkflowStatus.RUNNING;
        return true;
    }

    public synchronized boolean complete(Instant now) {
        if (status != WorkflowStatus.RUNNING) {
            return false;
        }
        status = WorkflowStatus.COMPLETED;
        completedAt = now;
        return true;
    }

    public synchronized boolean fail(Instant now, String message) {
        if (status.isTerminal()) {
            return false;
        }
        status = WorkflowStatus.FAILED;
        completedAt = now;
        errorMessage = message;
        return true;
    }

    public synchronized boolean cancel(Instant now, String reason) {
        if (status.isTerminal()) {
            return false;
        }
        status = WorkflowStatus.CANCELLED;
        completedAt = now;
        errorMessage = reason;
        return true;
    }

    /**
     * Records the output of a completed step for use by later steps and callers.
     */
    public void recordResult(String stepId, Object output) {
        if (output != null) {
            results.put(stepId, output);
        }
    }

    // Accessors

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public List<WorkflowStepExecution> getStepExecutions() {
        return stepExecutions;
    }

    @JsonIgnore
    public Optional<WorkflowStepExecution> getStepExecution(String stepId) {
        return stepExecutions.stream().filter(step -> step.getStepId().equals(stepId)).findFirst();
    }

    public Map<String, Object> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public String getInitiatedBy() {
        return initiatedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return {@code completedAt - startedAt}, or {@code null} while either is unset
     */
    public Duration getDuration() {
        Instant start = startedAt;
        Instant end = completedAt;
        return start != null && end != null ? Duration.between(start, end) : null;
    }

    public WorkflowProgress getProgress() {
        return WorkflowProgress.of(stepExecutions, startedAt, Instant.now(), status.isTerminal());
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
                "id='" + id + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", steps=" + stepExecutions.size() +
                '}';
    }
}
