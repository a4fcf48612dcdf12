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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.json.StepflowJson;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${...}} placeholders in step parameters.
 *
 * <p>{@code ${name}} refers to an execution parameter. {@code ${stepId.path.to.value}}
 * refers to a property of the result of an earlier step. A parameter whose whole
 * value is one placeholder takes the referenced value with its type. Placeholders
 * inside longer strings are replaced by their string form. Unresolvable
 * placeholders are left as written.
 */
public class ParameterResolver {
    private static final Logger logger = Logger.getLogger(ParameterResolver.class.getName());

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\$\\{([^}]+)\\}");

    private final Map<String, Object> executionParameters;
    private final Map<String, Object> stepResults;
    private final ObjectMapper objectMapper;

    public ParameterResolver(Map<String, Object> executionParameters, Map<String, Object> stepResults) {
        this.executionParameters = executionParameters != null ? executionParameters : Map.of();
        this.stepResults = stepResults != null ? stepResults : Map.of();
        this.objectMapper = StepflowJson.newObjectMapper();
    }

    /**
     * Merge execution parameters with resolved step parameters. Step parameters win
     * when both define the same name.
     */
    public Map<String, Object> resolveStepParameters(Map<String, Object> stepParameters) {
        Map<String, Object> merged = new LinkedHashMap<>(executionParameters);
        for (Map.Entry<String, Object> entry : stepParameters.entrySet()) {
            merged.put(entry.getKey(), resolveValue(entry.getValue()));
        }
        return merged;
    }

    public Object resolveValue(Object value) {
        if (!(value instanceof String text) || !text.contains("${")) {
            return value;
        }

        Matcher whole = PLACEHOLDER_PATTERN.matcher(text);
        if (whole.matches()) {
            Object resolved = resolvePath(whole.group(1).trim());
            return resolved != null ? resolved : text;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object resolved = resolvePath(matcher.group(1).trim());
            String replacement = resolved != null ? String.valueOf(resolved) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private Object resolvePath(String path) {
        if (executionParameters.containsKey(path)) {
            return executionParameters.get(path);
        }

        int dot = path.indexOf('.');
        if (dot < 0) {
            logger.fine("Unresolved parameter placeholder: " + path);
            return null;
        }

        String stepId = path.substring(0, dot);
        Object current = stepResults.get(stepId);
        if (current == null) {
            logger.fine("No result recorded for step '" + stepId + "' referenced by " + path);
            return null;
        }

        for (String segment : path.substring(dot + 1).split("\\.")) {
            current = child(current, segment);
            if (current == null) {
                logger.fine("Unresolved property path: " + path);
                return null;
            }
        }
        return current;
    }

    private Object child(Object node, String segment) {
        if (node instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (node instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (node instanceof String || node instanceof Number || node instanceof Boolean
                || node instanceof Collection<?>) {
            return null;
        }
        // arbitrary result objects are navigated through their JSON form
        try {
            Map<?, ?> asMap = objectMapper.convertValue(node, Map.class);
            return asMap.get(segment);
        } catch (IllegalArgumentException e) {
            logger.fine("Cannot navigate " + node.getClass().getSimpleName() + " result: " + e.getMessage());
            return null;
        }
    }
}
