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

import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.core.WorkflowStepExecution;
import dev.mars.stepflow.storage.WorkflowStore;
import dev.mars.stepflow.workflow.WorkflowEngine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Computes summary, breakdown and duration statistics across a set of executions.
 *
 * <p>Executions are looked up in the engine first, so runs still in progress report
 * their live state, then in the store. Ids that resolve to nothing are listed in the
 * report but otherwise ignored.
 */
public class ResultAggregator {

    private static final Logger logger = Logger.getLogger(ResultAggregator.class.getName());
    private static final String UNKNOWN = "unknown";

    private final WorkflowEngine engine;
    private final WorkflowStore store;

    public ResultAggregator(WorkflowEngine engine, WorkflowStore store) {
        this.engine = engine;
        this.store = store;
    }

    public AggregatedResults aggregate(Collection<String> executionIds, AggregationMode mode, boolean includeDetails) {
        AggregationMode effectiveMode = mode != null ? mode : AggregationMode.SUMMARY;
        List<WorkflowExecution> executions = new ArrayList<>();
        List<String> notFound = new ArrayList<>();

        if (executionIds != null) {
            for (String id : new LinkedHashSet<>(executionIds)) {
                Optional<WorkflowExecution> execution = lookup(id);
                if (execution.isPresent()) {
                    executions.add(execution.get());
                } else {
                    notFound.add(id);
                }
            }
        }
        if (!notFound.isEmpty()) {
            logger.fine("Aggregation skipped " + notFound.size() + " unknown execution ids");
        }

        AggregatedResults.Builder builder = summarize(executions, effectiveMode).notFoundExecutionIds(notFound);
        if (includeDetails) {
            List<ExecutionSummary> lines = new ArrayList<>(executions.size());
            for (WorkflowExecution execution : executions) {
                lines.add(ExecutionSummary.of(execution));
            }
            builder.executions(lines);
        }
        logger.info("Aggregated " + executions.size() + " executions in " + effectiveMode + " mode");
        return builder.build();
    }

    /**
     * Builds the report over executions already in hand.
     */
    public AggregatedResults aggregateExecutions(List<WorkflowExecution> executions, AggregationMode mode) {
        return summarize(executions, mode != null ? mode : AggregationMode.SUMMARY).build();
    }

    private Optional<WorkflowExecution> lookup(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            return Optional.empty();
        }
        Optional<WorkflowExecution> active = engine.getExecution(executionId);
        return active.isPresent() ? active : store.getExecution(executionId);
    }

    private AggregatedResults.Builder summarize(List<WorkflowExecution> executions, AggregationMode mode) {
        int successful = 0;
        int failed = 0;
        int cancelled = 0;
        int totalSteps = 0;
        int successfulSteps = 0;
        int failedSteps = 0;
        List<Double> durations = new ArrayList<>();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        Map<String, Integer> byWorkflow = new LinkedHashMap<>();
        Map<String, int[]> stepTallies = new LinkedHashMap<>();

        for (WorkflowExecution execution : executions) {
            WorkflowStatus status = execution.getStatus();
            switch (status) {
                case COMPLETED -> successful++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> {
                }
            }
            byStatus.merge(status.name(), 1, Integer::sum);
            byWorkflow.merge(keyOrUnknown(execution.getWorkflowName()), 1, Integer::sum);

            Duration duration = execution.getDuration();
            if (duration != null) {
                durations.add(toSeconds(duration));
            }

            for (WorkflowStepExecution step : execution.getStepExecutions()) {
                totalSteps++;
                int[] tally = stepTallies.computeIfAbsent(keyOrUnknown(step.getStepId()), key -> new int[2]);
                tally[1]++;
                if (step.getStatus() == StepStatus.COMPLETED) {
                    successfulSteps++;
                    tally[0]++;
                } else if (step.getStatus() == StepStatus.FAILED) {
                    failedSteps++;
                }
            }
        }

        int total = executions.size();
        double totalDuration = durations.stream().mapToDouble(Double::doubleValue).sum();

        AggregatedResults.Builder builder = AggregatedResults.builder(mode)
                .executionCounts(total, successful, failed, cancelled)
                .stepCounts(totalSteps, successfulSteps, failedSteps)
                .successRate(percentage(successful, total))
                .averageStepsPerWorkflow(total == 0 ? 0.0 : (double) totalSteps / total)
                .mostCommonWorkflow(mostCommon(byWorkflow))
                .durations(durations.isEmpty() ? 0.0 : totalDuration / durations.size(), totalDuration);

        if (mode.includesBreakdowns()) {
            Map<String, Double> stepRates = new LinkedHashMap<>();
            stepTallies.forEach((stepId, tally) -> stepRates.put(stepId, percentage(tally[0], tally[1])));
            builder.breakdowns(byStatus, byWorkflow, stepRates);
        }
        if (mode.includesDurationStatistics()) {
            builder.durationStatistics(DurationStatistics.of(durations));
        }
        return builder;
    }

    // records loaded from a store may lack names; map keys must not be null
    private static String keyOrUnknown(String key) {
        return key != null ? key : UNKNOWN;
    }

    private static String mostCommon(Map<String, Integer> counts) {
        String best = "N/A";
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static double percentage(int part, int whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
