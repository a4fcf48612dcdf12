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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cross-execution report produced by {@link ResultAggregator}.
 *
 * <p>Counts cover only the executions that were found. The breakdown maps are
 * present for {@link AggregationMode#DETAILED} and {@link AggregationMode#STATISTICAL},
 * the duration statistics only for the latter, and the per-execution lines only
 * when details were requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AggregatedResults {

    private final AggregationMode mode;
    private final int totalExecutions;
    private final int successfulExecutions;
    private final int failedExecutions;
    private final int cancelledExecutions;
    private final int totalSteps;
    private final int successfulSteps;
    private final int failedSteps;
    private final double successRate;
    private final double averageStepsPerWorkflow;
    private final String mostCommonWorkflow;
    private final double averageDuration;
    private final double totalDuration;
    private final Map<String, Integer> executionsByStatus;
    private final Map<String, Integer> executionsByWorkflow;
    private final Map<String, Double> stepSuccessRates;
    private final DurationStatistics durationStatistics;
    private final Integer executionsWithDuration;
    private final List<ExecutionSummary> executions;
    private final List<String> notFoundExecutionIds;
    private final Instant generatedAt;

    private AggregatedResults(Builder builder) {
        this.mode = builder.mode;
        this.totalExecutions = builder.totalExecutions;
        this.successfulExecutions = builder.successfulExecutions;
        this.failedExecutions = builder.failedExecutions;
        this.cancelledExecutions = builder.cancelledExecutions;
        this.totalSteps = builder.totalSteps;
        this.successfulSteps = builder.successfulSteps;
        this.failedSteps = builder.failedSteps;
        this.successRate = builder.successRate;
        this.averageStepsPerWorkflow = builder.averageStepsPerWorkflow;
        this.mostCommonWorkflow = builder.mostCommonWorkflow;
        this.averageDuration = builder.averageDuration;
        this.totalDuration = builder.totalDuration;
        this.executionsByStatus = builder.executionsByStatus;
        this.executionsByWorkflow = builder.executionsByWorkflow;
        this.stepSuccessRates = builder.stepSuccessRates;
        this.durationStatistics = builder.durationStatistics;
        this.executionsWithDuration = builder.durationStatistics != null ? builder.durationStatistics.getCount() : null;
        this.executions = builder.executions;
        this.notFoundExecutionIds = builder.notFoundExecutionIds;
        this.generatedAt = Instant.now();
    }

    static Builder builder(AggregationMode mode) {
        return new Builder(mode);
    }

    public AggregationMode getMode() {
        return mode;
    }

    public int getTotalExecutions() {
        return totalExecutions;
    }

    public int getSuccessfulExecutions() {
        return successfulExecutions;
    }

    public int getFailedExecutions() {
        return failedExecutions;
    }

    public int getCancelledExecutions() {
        return cancelledExecutions;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public int getSuccessfulSteps() {
        return successfulSteps;
    }

    public int getFailedSteps() {
        return failedSteps;
    }

    /**
     * @return percentage of found executions that completed, 0 when none were found
     */
    public double getSuccessRate() {
        return successRate;
    }

    public double getAverageStepsPerWorkflow() {
        return averageStepsPerWorkflow;
    }

    public String getMostCommonWorkflow() {
        return mostCommonWorkflow;
    }

    /** Seconds, over executions with a recorded duration. */
    public double getAverageDuration() {
        return averageDuration;
    }

    /** Seconds. */
    public double getTotalDuration() {
        return totalDuration;
    }

    public Map<String, Integer> getExecutionsByStatus() {
        return executionsByStatus;
    }

    public Map<String, Integer> getExecutionsByWorkflow() {
        return executionsByWorkflow;
    }

    /**
     * @return percentage of completed step executions per step id
     */
    public Map<String, Double> getStepSuccessRates() {
        return stepSuccessRates;
    }

    public DurationStatistics getDurationStatistics() {
        return durationStatistics;
    }

    /**
     * @return number of executions contributing to the duration statistics, statistical mode only
     */
    public Integer getExecutionsWithDuration() {
        return executionsWithDuration;
    }

    public List<ExecutionSummary> getExecutions() {
        return executions;
    }

    public List<String> getNotFoundExecutionIds() {
        return notFoundExecutionIds;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    static final class Builder {
        private final AggregationMode mode;
        private int totalExecutions;
        private int successfulExecutions;
        private int failedExecutions;
        private int cancelledExecutions;
        private int totalSteps;
        private int successfulSteps;
        private int failedSteps;
        private double successRate;
        private double averageStepsPerWorkflow;
        private String mostCommonWorkflow = "N/A";
        private double averageDuration;
        private double totalDuration;
        private Map<String, Integer> executionsByStatus;
        private Map<String, Integer> executionsByWorkflow;
        private Map<String, Double> stepSuccessRates;
        private DurationStatistics durationStatistics;
        private List<ExecutionSummary> executions;
        private List<String> notFoundExecutionIds = List.of();

        private Builder(AggregationMode mode) {
            this.mode = mode;
        }

        Builder executionCounts(int total, int successful, int failed, int cancelled) {
            this.totalExecutions = total;
            this.successfulExecutions = successful;
            this.failedExecutions = failed;
            this.cancelledExecutions = cancelled;
            return this;
        }

        Builder stepCounts(int total, int successful, int failed) {
            this.totalSteps = total;
            this.successfulSteps = successful;
            this.failedSteps = failed;
            return this;
        }

        Builder successRate(double successRate) {
            this.successRate = successRate;
            return this;
        }

        Builder averageStepsPerWorkflow(double averageStepsPerWorkflow) {
            this.averageStepsPerWorkflow = averageStepsPerWorkflow;
            return this;
        }

        Builder mostCommonWorkflow(String mostCommonWorkflow) {
            this.mostCommonWorkflow = mostCommonWorkflow;
            return this;
        }

        Builder durations(double average, double total) {
            this.averageDuration = average;
            this.totalDuration = total;
            return this;
        }

        Builder breakdowns(Map<String, Integer> byStatus, Map<String, Integer> byWorkflow,
                           Map<String, Double> stepRates) {
            this.executionsByStatus = byStatus;
            this.executionsByWorkflow = byWorkflow;
            this.stepSuccessRates = stepRates;
            return this;
        }

        Builder durationStatistics(DurationStatistics durationStatistics) {
            this.durationStatistics = durationStatistics;
            return this;
        }

        Builder executions(List<ExecutionSummary> executions) {
            this.executions = executions;
            return this;
        }

        Builder notFoundExecutionIds(List<String> notFoundExecutionIds) {
            this.notFoundExecutionIds = List.copyOf(notFoundExecutionIds);
            return this;
        }

        AggregatedResults build() {
            return new AggregatedResults(this);
        }
    }
}
