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

import dev.mars.stepflow.core.exceptions.WorkflowValidationException;

import java.util.Locale;

/**
 * How much detail an aggregation produces. Each mode includes everything the previous one does.
 */
public enum AggregationMode {
    SUMMARY,
    DETAILED,
    STATISTICAL;

    public boolean includesBreakdowns() {
        return this != SUMMARY;
    }

    public boolean includesDurationStatistics() {
        return this == STATISTICAL;
    }

    /**
     * Parses a mode name case-insensitively. A null or blank value means {@link #SUMMARY}.
     *
     * @throws WorkflowValidationException for an unknown mode name
     */
    public static AggregationMode parse(String value) throws WorkflowValidationException {
        if (value == null || value.isBlank()) {
            return SUMMARY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowValidationException("Unknown aggregation mode: " + value
                    + " (expected summary, detailed or statistical)");
        }
    }
}
