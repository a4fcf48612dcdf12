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

import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowExecution;
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.WorkflowStepExecution;
import dev.mars.stepflow.core.exceptions.StepExecutionException;
import dev.mars.stepflow.core.exceptions.StepflowInfrastructureException;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.queue.BackgroundTaskQueue;
import dev.mars.stepflow.queue.QueuedTaskWorker;
import dev.mars.stepflow.storage.WorkflowStore;
import dev.mars.stepflow.storage.WorkflowStoreException;
import dev.mars.stepflow.tool.Tool;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.tool.ToolResult;
import dev.mars.stepflow.workflow.observability.WorkflowMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default workflow engine.
 *
 * <p>Executions enter a bounded {@link BackgroundTaskQueue} and are started by a
 * single queue worker in submission order. Each started execution gets a
 * coordinator thread that walks the steps in topological order and launches every
 * step whose dependencies have completed. Independent steps run concurrently,
 * limited by an engine-wide cap on running steps shared by all executions.
 *
 * <p>Step failure handling:
 * <ul>
 *   <li>{@code continueOnError=true}: every direct and transitive dependent is
 *       skipped and independent branches carry on</li>
 *   <li>{@code continueOnError=false}: the execution fails and all steps that have
 *       not finished are cancelled</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(DefaultWorkflowEngine.class.getName());

    private static final long WAIT_INTERVAL_MS = 200;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final ToolRegistry toolRegistry;
    private final WorkflowStore store;
    private final WorkflowMetrics metrics;
    private final BackgroundTaskQueue taskQueue;
    private final QueuedTaskWorker queueWorker;
    private final ExecutorService coordinatorPool;
    private final Semaphore stepSlots;
    private final Duration defaultStepTimeout;
    private final Map<String, ExecutionRun> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DefaultWorkflowEngine(ToolRegistry toolRegistry, WorkflowStore store, StepflowConfiguration configuration) {
        this.toolRegistry = toolRegistry;
        this.store = store;
        this.metrics = WorkflowMetrics.getInstance();
        this.taskQueue = new BackgroundTaskQueue(configuration.getQueueCapacity(), configuration.getQueueFullMode());
        this.queueWorker = new QueuedTaskWorker(taskQueue, "stepflow-queue-worker");
        this.coordinatorPool = Executors.newCachedThreadPool(new CoordinatorThreadFactory());
        this.stepSlots = new Semaphore(Math.max(1, configuration.getMaxConcurrentSteps()), true);
        this.defaultStepTimeout = configuration.getDefaultStepTimeout();

        queueWorker.start();
        logger.info("DefaultWorkflowEngine initialized with queue capacity " + taskQueue.getCapacity()
                + " (" + taskQueue.getFullMode() + " when full), max concurrent steps "
                + configuration.getMaxConcurrentSteps() + ", default step timeout " + defaultStepTimeout);
    }

    @Override
    public WorkflowExecution start(WorkflowDefinition definition, Map<String, Object> parameters, String initiatedBy)
            throws StepflowInfrastructureException {
        if (shutdown.get()) {
            throw new StepflowInfrastructureException("Workflow engine is shut down");
        }

        WorkflowExecution execution = WorkflowExecution.create(definition, parameters, initiatedBy);
        ExecutionRun run = new ExecutionRun(definition, execution);
        try {
            store.saveExecution(execution);
        } catch (WorkflowStoreException e) {
            throw new StepflowInfrastructureException("Failed to store execution " + execution.getId(), e);
        }
        activeRuns.put(execution.getId(), run);

        try {
            taskQueue.enqueue(token -> begin(run), execution.getId());
        } catch (StepflowInfrastructureException e) {
            abandon(run, e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(run, "Interrupted while waiting for queue capacity");
            throw new StepflowInfrastructureException("Interrupted while enqueueing execution " + execution.getId(), e);
        }

        logger.info("Queued workflow execution: " + execution.getId() + " for workflow '"
                + definition.getName() + "' (" + definition.getId() + ")");
        return execution;
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        ExecutionRun run = executionId != null ? activeRuns.get(executionId) : null;
        return run != null ? Optional.of(run.execution) : Optional.empty();
    }

    @Override
    public Optional<CompletableFuture<WorkflowExecution>> getCompletionFuture(String executionId) {
        ExecutionRun run = executionId != null ? activeRuns.get(executionId) : null;
        return run != null ? Optional.of(run.completion.copy()) : Optional.empty();
    }

    @Override
    public boolean pause(String executionId) {
        ExecutionRun run = activeRuns.get(executionId);
        if (run == null) {
            return false;
        }
        boolean paused;
        synchronized (run) {
            paused = run.execution.pause();
            run.notifyAll();
        }
        if (paused) {
            logger.info("Paused workflow execution: " + executionId);
            persist(run.execution);
        }
        return paused;
    }

    @Override
    public boolean resume(String executionId) {
        ExecutionRun run = activeRuns.get(executionId);
        if (run == null) {
            return false;
        }
        boolean resumed;
        synchronized (run) {
            resumed = run.execution.resume();
            run.notifyAll();
        }
        if (resumed) {
            logger.info("Resumed workflow execution: " + executionId);
            persist(run.execution);
        }
        return resumed;
    }

    @Override
    public boolean cancel(String executionId) {
        ExecutionRun run = activeRuns.get(executionId);
        if (run == null) {
            return false;
        }
        return cancelRun(run, "Execution cancelled");
    }

    @Override
    public int getActiveExecutionCount() {
        return activeRuns.size();
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!activeRuns.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return activeRuns.isEmpty();
            }
        }
        return true;
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("DefaultWorkflowEngine shutdown initiated with " + activeRuns.size() + " active executions");

        queueWorker.stop(SHUTDOWN_TIMEOUT_MS);
        for (ExecutionRun run : new ArrayList<>(activeRuns.values())) {
            cancelRun(run, "Workflow engine shut down");
            if (!run.started.get()) {
                finish(run);
            }
        }

        coordinatorPool.shutdown();
        try {
            if (!coordinatorPool.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                coordinatorPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            coordinatorPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("DefaultWorkflowEngine shutdown completed");
    }

    // Queue worker side

    private void begin(ExecutionRun run) {
        WorkflowExecution execution = run.execution;
        if (!execution.start(Instant.now())) {
            logger.info("Workflow execution " + execution.getId() + " left the queue as " + execution.getStatus());
            finish(run);
            return;
        }
        run.started.set(true);
        metrics.recordWorkflowStarted(execution.getWorkflowName());
        persist(execution);

        try {
            coordinatorPool.execute(() -> coordinate(run));
        } catch (RejectedExecutionException e) {
            failRun(run, "Workflow engine is shut down");
            finish(run);
        }
    }

    // Coordinator side

    private void coordinate(ExecutionRun run) {
        WorkflowExecution execution = run.execution;
        logger.info("Starting workflow execution: " + execution.getId() + " with "
                + execution.getStepExecutions().size() + " steps");
        try {
            List<String> order = run.graph.topologicalSort();
            while (true) {
                List<WorkflowStep> ready = awaitReadySteps(run, order);
                if (ready.isEmpty()) {
                    break;
                }
                for (WorkflowStep step : ready) {
                    if (!acquireSlot(run)) {
                        break;
                    }
                    launchStep(run, step);
                }
            }
        } catch (WorkflowValidationException e) {
            failRun(run, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failRun(run, "Execution interrupted");
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Workflow execution failed: " + execution.getId() + " - " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Workflow execution exception details for: " + execution.getId(), e);
            }
            failRun(run, "Internal error: " + e.getMessage());
        }
        finish(run);
    }

    /**
     * Blocks until at least one step can be launched, or returns an empty list when
     * the run has nothing left to launch: it is terminal, or no step is ready and
     * none is in flight.
     */
    private List<WorkflowStep> awaitReadySteps(ExecutionRun run, List<String> order) throws InterruptedException {
        synchronized (run) {
            while (true) {
                WorkflowStatus status = run.execution.getStatus();
                if (status.isTerminal()) {
                    return List.of();
                }
                if (status == WorkflowStatus.RUNNING) {
                    List<WorkflowStep> ready = findReadySteps(run, order);
                    if (!ready.isEmpty()) {
                        return ready;
                    }
                    if (run.inFlight.isEmpty()) {
                        return List.of();
                    }
                }
                run.wait(WAIT_INTERVAL_MS);
            }
        }
    }

    private List<WorkflowStep> findReadySteps(ExecutionRun run, List<String> order) {
        List<WorkflowStep> ready = new ArrayList<>();
        for (String stepId : order) {
            WorkflowStepExecution stepExecution = run.stepExecution(stepId);
            if (stepExecution.getStatus() != StepStatus.PENDING || run.inFlight.containsKey(stepId)) {
                continue;
            }
            boolean dependenciesMet = true;
            for (String dependency : run.graph.getDependencies(stepId)) {
                if (!run.stepExecution(dependency).getStatus().satisfiesDependency()) {
                    dependenciesMet = false;
                    break;
                }
            }
            if (dependenciesMet) {
                ready.add(run.graph.getStep(stepId));
            }
        }
        return ready;
    }

    /**
     * Takes one of the engine-wide step slots. Gives up without a slot when the run
     * stops being {@link WorkflowStatus#RUNNING} while waiting.
     */
    private boolean acquireSlot(ExecutionRun run) throws InterruptedException {
        while (true) {
            if (run.execution.getStatus() != WorkflowStatus.RUNNING) {
                return false;
            }
            if (stepSlots.tryAcquire(WAIT_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (run.execution.getStatus() == WorkflowStatus.RUNNING) {
                    return true;
                }
                stepSlots.release();
                return false;
            }
        }
    }

    private void launchStep(ExecutionRun run, WorkflowStep step) {
        WorkflowExecution execution = run.execution;
        WorkflowStepExecution stepExecution = run.stepExecution(step.getId());
        // registered before the tool is called so that cancelRun and failRun always see it
        CompletableFuture<ToolResult> invocation = new CompletableFuture<>();
        synchronized (run) {
            if (execution.getStatus() != WorkflowStatus.RUNNING || !stepExecution.markRunning(Instant.now())) {
                stepSlots.release();
                return;
            }
            run.inFlight.put(step.getId(), invocation);
        }
        metrics.recordStepExecuted(execution.getWorkflowName(), step.getToolName());
        logger.info("Executing step " + step.getId() + " (" + step.getName() + ") with tool '"
                + step.getToolName() + "' in execution " + execution.getId());
        persist(execution);

        if (!invocation.isDone()) {
            CompletableFuture<ToolResult> toolFuture;
            try {
                Tool tool = toolRegistry.getTool(step.getToolName());
                Map<String, Object> parameters = new ParameterResolver(execution.getParameters(), execution.getResults())
                        .resolveStepParameters(step.getParameters());
                toolFuture = tool.execute(parameters);
                if (toolFuture == null) {
                    toolFuture = CompletableFuture.failedFuture(new IllegalStateException("tool returned no future"));
                }
            } catch (RuntimeException e) {
                toolFuture = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<ToolResult> started = toolFuture;
            started.whenComplete((result, error) -> {
                if (error != null) {
                    invocation.completeExceptionally(error);
                } else {
                    invocation.complete(result);
                }
            });
            invocation.whenComplete((result, error) -> {
                if (invocation.isCancelled()) {
                    started.cancel(true);
                }
            });
        }

        Duration timeout = step.getTimeout() != null ? step.getTimeout() : defaultStepTimeout;
        invocation.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> onStepFinished(run, step, invocation, timeout, result, error));
    }

    private void onStepFinished(ExecutionRun run, WorkflowStep step, CompletableFuture<ToolResult> invocation,
                                Duration timeout, ToolResult result, Throwable error) {
        stepSlots.release();
        WorkflowExecution execution = run.execution;
        StepExecutionException failure = toStepFailure(step, timeout, result, error);
        if (failure != null && failure.isTimeout()) {
            invocation.cancel(true);
        }

        synchronized (run) {
            run.inFlight.remove(step.getId());
            WorkflowStepExecution stepExecution = run.stepExecution(step.getId());
            Instant now = Instant.now();
            if (failure == null) {
                if (stepExecution.markCompleted(now, result.getPayload())) {
                    execution.recordResult(step.getId(), result.getPayload());
                    logger.info("Step " + step.getId() + " completed successfully in execution " + execution.getId());
                }
            } else if (stepExecution.markFailed(now, failure.getMessage())) {
                metrics.recordStepFailed(execution.getWorkflowName(), step.getToolName(), failure.isTimeout());
                logger.log(Level.WARNING, "Step " + step.getId() + " failed in execution " + execution.getId()
                        + ": " + failure.getMessage());
                if (step.isContinueOnError()) {
                    skipDependents(run, step);
                } else {
                    failRun(run, "Step '" + step.getId() + "' failed: " + failure.getMessage());
                }
            }
            run.notifyAll();
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Execution " + execution.getId() + " progress: " + execution.getProgress());
        }
        persist(execution);
    }

    private StepExecutionException toStepFailure(WorkflowStep step, Duration timeout, ToolResult result,
                                                 Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return StepExecutionException.timedOut(step.getId(), timeout);
        }
        if (cause instanceof CancellationException) {
            return new StepExecutionException(step.getId(), "Step '" + step.getId() + "' was cancelled");
        }
        if (cause != null) {
            return new StepExecutionException(step.getId(),
                    "Tool '" + step.getToolName() + "' failed: " + cause.getMessage(), false, cause);
        }
        if (result == null) {
            return new StepExecutionException(step.getId(), "Tool '" + step.getToolName() + "' returned no result");
        }
        if (!result.isSuccess()) {
            return new StepExecutionException(step.getId(), result.getError());
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // Run state changes, callers hold the run monitor or own the run exclusively

    private void skipDependents(ExecutionRun run, WorkflowStep failedStep) {
        int skipped = 0;
        for (String dependentId : run.graph.getTransitiveDependents(failedStep.getId())) {
            if (run.stepExecution(dependentId).markSkipped("Skipped because step '" + failedStep.getId() + "' failed")) {
                skipped++;
            }
        }
        if (skipped > 0) {
            metrics.recordStepsSkipped(run.execution.getWorkflowName(), skipped);
            logger.info("Skipped " + skipped + " dependent steps of failed step " + failedStep.getId()
                    + " in execution " + run.execution.getId());
        }
    }

    private void failRun(ExecutionRun run, String reason) {
        synchronized (run) {
            if (run.execution.fail(Instant.now(), reason)) {
                logger.warning("Workflow execution " + run.execution.getId() + " failed: " + reason);
                cancelUnfinishedSteps(run, "Cancelled because the execution failed");
            }
            run.notifyAll();
        }
    }

    private boolean cancelRun(ExecutionRun run, String reason) {
        boolean cancelled;
        synchronized (run) {
            cancelled = run.execution.cancel(Instant.now(), reason);
            if (cancelled) {
                cancelUnfinishedSteps(run, reason);
            }
            run.notifyAll();
        }
        if (cancelled) {
            logger.info("Cancelled workflow execution: " + run.execution.getId() + " (" + reason + ")");
            persist(run.execution);
        }
        return cancelled;
    }

    private void cancelUnfinishedSteps(ExecutionRun run, String reason) {
        Instant now = Instant.now();
        for (WorkflowStepExecution stepExecution : run.execution.getStepExecutions()) {
            stepExecution.markCancelled(now, reason);
        }
        for (CompletableFuture<ToolResult> invocation : new ArrayList<>(run.inFlight.values())) {
            invocation.cancel(true);
        }
    }

    private void abandon(ExecutionRun run, String reason) {
        run.execution.fail(Instant.now(), reason);
        for (WorkflowStepExecution stepExecution : run.execution.getStepExecutions()) {
            stepExecution.markCancelled(Instant.now(), reason);
        }
        activeRuns.remove(run.execution.getId());
        persist(run.execution);
        run.completion.complete(run.execution);
    }

    private void finish(ExecutionRun run) {
        WorkflowExecution execution = run.execution;
        synchronized (run) {
            if (execution.getStatus() == WorkflowStatus.RUNNING) {
                for (WorkflowStepExecution stepExecution : execution.getStepExecutions()) {
                    stepExecution.markSkipped("Dependencies were not satisfied");
                }
                execution.complete(Instant.now());
            }
        }
        persist(execution);
        activeRuns.remove(execution.getId());

        if (run.started.get()) {
            switch (execution.getStatus()) {
                case COMPLETED -> {
                    Duration duration = execution.getDuration();
                    metrics.recordWorkflowCompleted(execution.getWorkflowName(),
                            duration != null ? duration.toMillis() / 1000.0 : 0.0);
                }
                case FAILED -> metrics.recordWorkflowFailed(execution.getWorkflowName(), "step_failure");
                case CANCELLED -> metrics.recordWorkflowCancelled(execution.getWorkflowName());
                default -> logger.warning("Execution " + execution.getId() + " finished in unexpected status "
                        + execution.getStatus());
            }
        }
        logger.info("Workflow execution completed: " + execution.getId() + " with status: "
                + execution.getStatus() + " " + execution.getProgress());
        run.completion.complete(execution);
    }

    private void persist(WorkflowExecution execution) {
        try {
            store.updateExecution(execution);
        } catch (WorkflowStoreException e) {
            logger.log(Level.SEVERE, "Failed to persist execution " + execution.getId() + ": " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Persistence failure details for: " + execution.getId(), e);
            }
        }
    }

    /**
     * Mutable coordination state for one execution. Guarded by its own monitor.
     */
    private static final class ExecutionRun {
        private final WorkflowExecution execution;
        private final DependencyGraph graph;
        private final Map<String, WorkflowStepExecution> stepExecutions = new LinkedHashMap<>();
        private final Map<String, CompletableFuture<ToolResult>> inFlight = new LinkedHashMap<>();
        private final CompletableFuture<WorkflowExecution> completion = new CompletableFuture<>();
        private final AtomicBoolean started = new AtomicBoolean(false);

        private ExecutionRun(WorkflowDefinition definition, WorkflowExecution execution) {
            this.execution = execution;
            this.graph = new DependencyGraph(definition.getSteps());
            for (WorkflowStepExecution stepExecution : execution.getStepExecutions()) {
                stepExecutions.put(stepExecution.getStepId(), stepExecution);
            }
        }

        private WorkflowStepExecution stepExecution(String stepId) {
            return stepExecutions.get(stepId);
        }
    }

    private static final class CoordinatorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stepflow-execution-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
