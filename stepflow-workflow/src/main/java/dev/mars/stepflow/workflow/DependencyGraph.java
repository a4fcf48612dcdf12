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

import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;

import java.util.*;

/**
 * Directed graph of workflow steps formed by their {@code dependsOn} edges.
 * Provides cycle detection, topological ordering and dependent lookup.
 *
 * <p>Iteration follows definition order everywhere, so the same definition
 * always yields the same execution order.
 */
public class DependencyGraph {

    private final Map<String, WorkflowStep> steps;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    public DependencyGraph(Collection<WorkflowStep> workflowSteps) {
        Objects.requireNonNull(workflowSteps, "Workflow steps cannot be null");
        this.steps = new LinkedHashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();

        for (WorkflowStep step : workflowSteps) {
            // first occurrence wins for duplicate ids
            if (steps.putIfAbsent(step.getId(), step) == null) {
                dependencies.put(step.getId(), new LinkedHashSet<>(step.getDependsOn()));
                dependents.put(step.getId(), new LinkedHashSet<>());
            }
        }
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (dependents.containsKey(dependency)) {
                    dependents.get(dependency).add(entry.getKey());
                }
            }
        }
    }

    public Set<String> getStepIds() {
        return Collections.unmodifiableSet(steps.keySet());
    }

    public WorkflowStep getStep(String stepId) {
        return steps.get(stepId);
    }

    /**
     * Gets the declared dependencies of a step.
     *
     * @param stepId the step id
     * @return set of step ids the step depends on
     */
    public Set<String> getDependencies(String stepId) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(stepId, Set.of()));
    }

    /**
     * Gets the steps that directly depend on a step.
     */
    public Set<String> getDependents(String stepId) {
        return Collections.unmodifiableSet(dependents.getOrDefault(stepId, Set.of()));
    }

    /**
     * Gets every step reachable from {@code stepId} along reverse dependency edges.
     * The step itself is not included.
     */
    public Set<String> getTransitiveDependents(String stepId) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>(getDependents(stepId));
        while (!toVisit.isEmpty()) {
            String current = toVisit.poll();
            if (result.add(current)) {
                toVisit.addAll(getDependents(current));
            }
        }
        result.remove(stepId);
        return result;
    }

    /**
     * Finds dependency cycles with a depth-first traversal. A node that is reached
     * again while still on the traversal stack closes a cycle. Reaching a node that
     * has already been fully visited is a cross edge and is ignored.
     *
     * @return each detected cycle as a path that starts and ends at the same step
     */
    public List<List<String>> findCycles() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        List<List<String>> cycles = new ArrayList<>();

        for (String stepId : steps.keySet()) {
            if (!visited.contains(stepId)) {
                visit(stepId, visited, onStack, path, cycles);
            }
        }
        return cycles;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    private void visit(String stepId, Set<String> visited, Set<String> onStack,
                       Deque<String> path, List<List<String>> cycles) {
        visited.add(stepId);
        onStack.add(stepId);
        path.addLast(stepId);

        for (String dependency : dependencies.get(stepId)) {
            if (!steps.containsKey(dependency)) {
                continue;
            }
            if (onStack.contains(dependency)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String node : path) {
                    if (node.equals(dependency)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(node);
                    }
                }
                cycle.add(dependency);
                cycles.add(cycle);
            } else if (!visited.contains(dependency)) {
                visit(dependency, visited, onStack, path, cycles);
            }
        }

        path.removeLast();
        onStack.remove(stepId);
    }

    /**
     * Performs a topological sort to determine execution order.
     * Dependencies that do not resolve to a step are ignored.
     *
     * @return step ids with every step after all of its dependencies
     * @throws WorkflowValidationException if circular dependencies are detected
     */
    public List<String> topologicalSort() throws WorkflowValidationException {
        // Kahn's algorithm, seeded and drained in definition order
        Map<String, Integer> inDegree = calculateInDegree();
        Deque<String> queue = new ArrayDeque<>();
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);
            for (String dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != steps.size()) {
            List<String> unresolved = new ArrayList<>(steps.keySet());
            unresolved.removeAll(result);
            throw new WorkflowValidationException("Circular dependency detected among steps: " + unresolved);
        }
        return result;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int count = 0;
            for (String dependency : entry.getValue()) {
                if (steps.containsKey(dependency)) {
                    count++;
                }
            }
            inDegree.put(entry.getKey(), count);
        }
        return inDegree;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "steps=" + steps.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
