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

package dev.mars.stepflow.tool;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Registry of the tools that workflow steps may reference by name.
 * Tool names are case-sensitive. Definitions are validated against
 * {@link #getToolNames()} at submission time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ToolRegistry {
    private static final Logger logger = Logger.getLogger(ToolRegistry.class.getName());

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry() {
    }

    public void registerTool(Tool tool) {
        Tool previous = tools.put(tool.getName(), tool);
        if (previous != null && previous != tool) {
            logger.warning("Replaced tool registration: " + tool.getName());
        } else {
            logger.info("Registered tool: " + tool.getName());
        }
    }

    /**
     * Register every name in {@code toolNames} that has no tool yet with a tool that
     * always fails. Keeps allowed names valid for submission before a real
     * implementation is wired in.
     */
    public void registerPlaceholders(Iterable<String> toolNames) {
        for (String name : toolNames) {
            if (name != null && !name.isBlank()) {
                tools.putIfAbsent(name, new UnconfiguredTool(name));
            }
        }
    }

    public void unregisterTool(String toolName) {
        if (toolName != null && tools.remove(toolName) != null) {
            logger.info("Unregistered tool: " + toolName);
        }
    }

    /**
     * @throws ToolNotFoundException if no tool is registered under the name
     */
    public Tool getTool(String toolName) {
        Tool tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            throw new ToolNotFoundException(toolName);
        }
        return tool;
    }

    public Optional<Tool> findTool(String toolName) {
        return toolName != null ? Optional.ofNullable(tools.get(toolName)) : Optional.empty();
    }

    public boolean isRegistered(String toolName) {
        return toolName != null && tools.containsKey(toolName);
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(tools.keySet()));
    }
}
