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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A named, versioned graph of workflow steps.
 * Definitions are never mutated once stored. A new version gets a new id.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_VERSION = "1.0";

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final List<WorkflowStep> steps;
    private final List<String> tags;
    private final Instant createdAt;
    private final String createdBy;

    @JsonCreator
    public WorkflowDefinition(@JsonProperty("id") String id,
                              @JsonProperty("name") String name,
                              @JsonProperty("version") String version,
                              @JsonProperty("description") String description,
                              @JsonProperty("steps") List<WorkflowStep> steps,
                              @JsonProperty("tags") List<String> tags,
                              @JsonProperty("createdAt") Instant createdAt,
                              @JsonProperty("createdBy") String createdBy) {
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.name = name;
        this.version = version != null && !version.isBlank() ? version : DEFAULT_VERSION;
        this.description = description;
        this.steps = steps != null
                ? Collections.unmodifiableList(new ArrayList<>(steps))
                : Collections.emptyList();
        this.tags = tags != null
                ? Collections.unmodifiableList(new ArrayList<>(tags))
                : Collections.emptyList();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.createdBy = createdBy;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public List<String> getTags() {
        return tags;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    @JsonIgnore
    public Optional<WorkflowStep> findStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(version, that.version) &&
                Objects.equals(steps, that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, version, steps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", steps=" + steps.size() +
                '}';
    }

    public static final class Builder {
        private String id;
        private final String name;
        private String version;
        private String description;
        private final List<WorkflowStep> steps = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private String createdBy;

        private Builder(String name) {
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(id, name, version, description, steps, tags, null, createdBy);
        }
    }
}
