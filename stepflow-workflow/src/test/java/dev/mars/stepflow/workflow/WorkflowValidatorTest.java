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

import dev.mars.stepflow.core.WorkflowDefinition;
import dev.mars.stepflow.core.WorkflowStep;
import dev.mars.stepflow.core.exceptions.WorkflowValidationException;
import dev.mars.stepflow.json.StepflowJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowValidatorTest {

    private WorkflowValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowValidator(() -> Set.of("company-search", "form-filter", "content-search"));
    }

    @Test
    void testValidDefinition() {
        WorkflowDefinition definition = WorkflowDefinition.builder("filings")
                .step(WorkflowStep.builder("search").name("Search").tool("company-search").build())
                .step(WorkflowStep.builder("filter").name("Filter").tool("form-filter").dependsOn("search").build())
                .build();

        ValidationResult result = validator.validate(definition);

        assertTrue(result.isValid(), result.toString());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testNullStepEntriesReportedWithOtherErrors() throws Exception {
        WorkflowDefinition definition = StepflowJson.newObjectMapper().readValue(
                "{\"name\":\"x\",\"steps\":[null,{\"id\":\"a\",\"toolName\":\"company-search\","
                        + "\"dependsOn\":[\"missing\"]}]}",
                WorkflowDefinition.class);

        ValidationResult result = validator.validate(definition);

        assertEquals(List.of("Step at index 0 is null", "Step 'a' depends on non-existent step 'missing'"),
                result.getErrorMessages());
        assertThrows(WorkflowValidationException.class, () -> validator.validateOrThrow(definition));
    }

    @Test
    void testNullDefinition() {
        ValidationResult result = validator.validate(null);
        assertEquals(List.of("Workflow definition is required"), result.getErrorMessages());
    }

    @Nested
    @DisplayName("Structural errors")
    class StructuralErrors {

        @Test
        void testMissingNameAndSteps() {
            WorkflowDefinition definition = new WorkflowDefinition(null, " ", null, null, List.of(), null, null, null);

            List<String> errors = validator.validate(definition).getErrorMessages();

            assertTrue(errors.contains("Workflow name is required"));
            assertTrue(errors.contains("Workflow must have at least one step"));
        }

        @Test
        void testDuplicateStepIdReportedOnce() {
            WorkflowDefinition definition = WorkflowDefinition.builder("dup")
                    .step(WorkflowStep.builder("a").name("A").tool("company-search").build())
                    .step(WorkflowStep.builder("a").name("A2").tool("company-search").build())
                    .step(WorkflowStep.builder("a").name("A3").tool("company-search").build())
                    .build();

            List<String> errors = validator.validate(definition).getErrorMessages();
            assertEquals(List.of("Duplicate step ID: a"), errors);
        }

        @Test
        void testEachDanglingDependencyReported() {
            WorkflowDefinition definition = WorkflowDefinition.builder("dangling")
                    .step(WorkflowStep.builder("a").name("A").tool("company-search").dependsOn("x", "y").build())
                    .build();

            List<String> errors = validator.validate(definition).getErrorMessages();

            assertEquals(2, errors.size());
            assertTrue(errors.contains("Step 'a' depends on non-existent step 'x'"));
            assertTrue(errors.contains("Step 'a' depends on non-existent step 'y'"));
        }

        @Test
        void testUnknownTool() {
            WorkflowDefinition definition = WorkflowDefinition.builder("tools")
                    .step(WorkflowStep.builder("a").name("A").tool("email-sender").build())
                    .build();

            assertEquals(List.of("Step 'a' uses unknown tool 'email-sender'"),
                    validator.validate(definition).getErrorMessages());
        }

        @Test
        void testNonPositiveTimeout() {
            WorkflowDefinition definition = WorkflowDefinition.builder("timeouts")
                    .step(WorkflowStep.builder("a").name("A").tool("company-search").timeout(Duration.ZERO).build())
                    .build();

            assertEquals(List.of("Step 'a' timeout must be positive"),
                    validator.validate(definition).getErrorMessages());
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        void testCycleReportedWithPath() {
            WorkflowDefinition definition = WorkflowDefinition.builder("cyclic")
                    .step(WorkflowStep.builder("a").name("A").tool("company-search").dependsOn("b").build())
                    .step(WorkflowStep.builder("b").name("B").tool("company-search").dependsOn("a").build())
                    .build();

            List<String> errors = validator.validate(definition).getErrorMessages();
            assertEquals(List.of("Circular dependency detected: a -> b -> a"), errors);
        }

        @Test
        void testSelfDependency() {
            WorkflowDefinition definition = WorkflowDefinition.builder("self")
                    .step(WorkflowStep.builder("a").name("A").tool("company-search").dependsOn("a").build())
                    .build();

            assertEquals(List.of("Circular dependency detected: a -> a"),
                    validator.validate(definition).getErrorMessages());
        }
    }

    @Test
    void testAllErrorsAccumulate() {
        WorkflowDefinition definition = WorkflowDefinition.builder("broken")
                .step(WorkflowStep.builder("a").name("A").tool("nope").dependsOn("missing").build())
                .step(WorkflowStep.builder("b").name("B").tool("company-search").dependsOn("c").build())
                .step(WorkflowStep.builder("c").name("C").tool("company-search").dependsOn("b").build())
                .build();

        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> validator.validateOrThrow(definition));

        assertEquals(3, exception.getErrors().size());
        assertTrue(exception.getErrors().contains("Step 'a' depends on non-existent step 'missing'"));
        assertTrue(exception.getErrors().contains("Step 'a' uses unknown tool 'nope'"));
        assertTrue(exception.getErrors().contains("Circular dependency detected: b -> c -> b"));
    }

    @Test
    void testBlankStepNameIsWarningOnly() {
        WorkflowDefinition definition = WorkflowDefinition.builder("warn")
                .step(WorkflowStep.builder("a").name("").tool("company-search").build())
                .build();

        ValidationResult result = validator.validate(definition);
        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
    }

    @Test
    void testToolNamesReadOnEveryValidation() {
        Set<String> tools = new HashSet<>();
        WorkflowValidator dynamic = new WorkflowValidator(() -> tools);
        WorkflowDefinition definition = WorkflowDefinition.builder("late")
                .step(WorkflowStep.builder("a").name("A").tool("late-tool").build())
                .build();

        assertFalse(dynamic.validate(definition).isValid());
        tools.add("late-tool");
        assertTrue(dynamic.validate(definition).isValid());
    }
}
