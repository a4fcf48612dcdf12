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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A single tool invocation within a workflow definition.
 * Steps are immutable. {@code dependsOn} names other steps of the same definition
 * that must complete before this one may start.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowStep implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String description;
    private final String toolName;
    private final Map<String, Object> parameters;
    private final Set<String> dependsOn;
    private final boolean continueOnError;
    private final Duration timeout;

    @JsonCreator
    public WorkflowStep(@JsonProperty("id") String id,
                        @JsonProperty("name") String name,
                        @JsonProperty("description") String description,
                        @JsonProperty("toolName") String toolName,
                        @JsonProperty("parameters") Map<String, Object> parameters,
                        @JsonProperty("dependsOn") Collection<String> dependsOn,
                        @JsonProperty("continueOnError") boolean continueOnError,
                        @JsonProperty("timeout") Duration timeout) {
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.name = name != null ? name : this.id;
        this.description = description;
        this.toolName = toolName != null ? toolName : "";
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.dependsOn = dependsOn != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn))
                : Collections.emptySet();
        this.continueOnError = continueOnError;
        this.timeout = timeout;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Set<String> getDependsOn() {
        return dependsOn;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    /**
     * @return the step timeout, or {@code null} when the engine default applies
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return continueOnError == that.continueOnError &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(toolName, that.toolName) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(dependsOn, that.dependsOn) &&
                Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, toolName, parameters, dependsOn, continueOnError, timeout);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
                "id='" + id + '\'' +
                ", toolName='" + toolName + '\'' +
                ", dependsOn=" + dependsOn +
                ", continueOnError=" + continueOnError +
                '}';
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String toolName;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private boolean continueOnError;
        private Duration timeout;

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tool(String toolName) {
            this.toolName = toolName;
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            Collections.addAll(this.dependsOn, stepIds);
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(id, name, description, toolName, parameters, dependsOn, continueOnError, timeout);
        }
    }
}
