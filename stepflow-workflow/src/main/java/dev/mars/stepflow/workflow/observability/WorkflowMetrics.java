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

package dev.mars.stepflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Stepflow execution engine and batch processor.
 *
 * Provides:
 * - stepflow.workflow.active (gauge) - Currently active workflow executions
 * - stepflow.workflow.total (counter) - Executions started
 * - stepflow.workflow.completed / failed / cancelled (counters) - Executions by outcome
 * - stepflow.workflow.steps.total / failed / skipped (counters) - Step outcomes
 * - stepflow.workflow.duration.seconds (histogram) - Execution duration distribution
 * - stepflow.batch.items.total / failed (counters) - Batch item start attempts
 *
 * The meter is taken from {@link GlobalOpenTelemetry}, so an SDK must be registered
 * before the first call to {@link #getInstance()} for the metrics to be exported.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "stepflow-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsSkipped;
    private final LongCounter batchItemsTotal;
    private final LongCounter batchItemsFailed;

    private final DoubleHistogram workflowDuration;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> TOOL_NAME_KEY = AttributeKey.stringKey("tool.name");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = counter(meter, "stepflow.workflow.total", "Total number of workflow executions started");
        workflowsCompleted = counter(meter, "stepflow.workflow.completed", "Number of completed workflow executions");
        workflowsFailed = counter(meter, "stepflow.workflow.failed", "Number of failed workflow executions");
        workflowsCancelled = counter(meter, "stepflow.workflow.cancelled", "Number of cancelled workflow executions");
        stepsTotal = counter(meter, "stepflow.workflow.steps.total", "Total number of workflow steps invoked");
        stepsFailed = counter(meter, "stepflow.workflow.steps.failed", "Number of failed workflow steps");
        stepsSkipped = counter(meter, "stepflow.workflow.steps.skipped", "Number of skipped workflow steps");
        batchItemsTotal = counter(meter, "stepflow.batch.items.total", "Batch items submitted for execution");
        batchItemsFailed = counter(meter, "stepflow.batch.items.failed", "Batch items that could not be started");

        workflowDuration = meter.histogramBuilder("stepflow.workflow.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("stepflow.workflow.active")
                .setDescription("Number of currently active workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, nameAttributes(workflowName));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = nameAttributes(workflowName);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, String failureReason) {
        activeWorkflows.decrementAndGet();
        workflowsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, safe(workflowName))
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build());
    }

    public void recordWorkflowCancelled(String workflowName) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, nameAttributes(workflowName));
    }

    public void recordStepExecuted(String workflowName, String toolName) {
        stepsTotal.add(1, stepAttributes(workflowName, toolName));
    }

    public void recordStepFailed(String workflowName, String toolName, boolean timeout) {
        stepsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, safe(workflowName))
                .put(TOOL_NAME_KEY, safe(toolName))
                .put(FAILURE_REASON_KEY, timeout ? "timeout" : "tool_error")
                .build());
    }

    public void recordStepsSkipped(String workflowName, int count) {
        if (count > 0) {
            stepsSkipped.add(count, nameAttributes(workflowName));
        }
    }

    public void recordBatchItem(String workflowName, boolean started) {
        Attributes attrs = nameAttributes(workflowName);
        batchItemsTotal.add(1, attrs);
        if (!started) {
            batchItemsFailed.add(1, attrs);
        }
    }

    /**
     * Get the current number of active workflows.
     */
    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes nameAttributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, safe(workflowName));
    }

    private static Attributes stepAttributes(String workflowName, String toolName) {
        return Attributes.of(WORKFLOW_NAME_KEY, safe(workflowName), TOOL_NAME_KEY, safe(toolName));
    }

    private static String safe(String value) {
        return value != null ? value : "unknown";
    }
}
