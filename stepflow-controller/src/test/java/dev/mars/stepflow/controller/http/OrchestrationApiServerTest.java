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

package dev.mars.stepflow.controller.http;

import dev.mars.stepflow.config.StepflowConfiguration;
import dev.mars.stepflow.core.WorkflowStatus;
import dev.mars.stepflow.storage.InMemoryWorkflowStore;
import dev.mars.stepflow.tool.Tool;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.tool.ToolResult;
import dev.mars.stepflow.workflow.WorkflowOrchestrator;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the orchestration API over HTTP against a real orchestrator, engine and
 * in-memory store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
@ExtendWith(VertxExtension.class)
@DisplayName("Orchestration API Tests")
class OrchestrationApiServerTest {

    private static final int HTTP_PORT = 18191;
    private static final String HOST = "localhost";

    private static Vertx vertx;
    private static WorkflowOrchestrator orchestrator;
    private static OrchestrationApiServer server;
    private static WebClient webClient;

    /** Completed by nothing: executions using "slow-search" stay running until cancelled */
    private static final CompletableFuture<ToolResult> NEVER = new CompletableFuture<>();

    @BeforeAll
    static void setUp() throws Exception {
        vertx = Vertx.vertx();

        ToolRegistry registry = new ToolRegistry();
        registry.registerTool(new FixedTool("company-search",
                parameters -> CompletableFuture.completedFuture(
                        ToolResult.success(Map.of("query", String.valueOf(parameters.get("query")), "hits", 3)))));
        registry.registerTool(new FixedTool("slow-search", parameters -> NEVER.thenApply(r -> r)));
        registry.registerPlaceholders(List.of("content-search"));

        Properties properties = new Properties();
        properties.setProperty(StepflowConfiguration.BATCH_THREAD_POOL_SIZE, "2");
        orchestrator = WorkflowOrchestrator.create(registry, new InMemoryWorkflowStore(),
                new StepflowConfiguration(properties));

        server = new OrchestrationApiServer(vertx, HOST, HTTP_PORT, orchestrator, "test");
        server.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        webClient = WebClient.create(vertx);
    }

    @AfterAll
    static void tearDown() throws Exception {
        if (webClient != null) webClient.close();
        if (server != null) server.stop().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        if (orchestrator != null) orchestrator.shutdown();
        if (vertx != null) vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    // ==================== helpers ====================

    private static JsonObject lookupDefinition(String name) {
        return new JsonObject()
                .put("name", name)
                .put("steps", new JsonArray()
                        .add(new JsonObject()
                                .put("id", "search")
                                .put("toolName", "company-search")
                                .put("parameters", new JsonObject().put("query", "${ticker}")))
                        .add(new JsonObject()
                                .put("id", "summary")
                                .put("toolName", "company-search")
                                .put("dependsOn", new JsonArray().add("search"))
                                .put("parameters", new JsonObject().put("query", "${search.query}"))));
    }

    private static HttpResponse<Buffer> post(String path, JsonObject body) throws Exception {
        return webClient.post(HTTP_PORT, HOST, path).sendJsonObject(body)
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static HttpResponse<Buffer> get(String path) throws Exception {
        return webClient.get(HTTP_PORT, HOST, path).send()
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static String createWorkflow(JsonObject definition) throws Exception {
        HttpResponse<Buffer> response = post("/api/v1/workflows", definition);
        assertEquals(201, response.statusCode(), response.bodyAsString());
        return response.bodyAsJsonObject().getString("workflowId");
    }

    private static String startExecution(String workflowId, JsonObject parameters) throws Exception {
        HttpResponse<Buffer> response = post("/api/v1/workflows/" + workflowId + "/executions",
                new JsonObject().put("parameters", parameters).put("initiatedBy", "api-test"));
        assertEquals(202, response.statusCode(), response.bodyAsString());
        return response.bodyAsJsonObject().getString("executionId");
    }

    private static void awaitStatus(String executionId, WorkflowStatus status) {
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(20))
                .until(() -> orchestrator.getExecution(executionId).getStatus() == status);
    }

    // ==================== Health and tools ====================

    @Nested
    @DisplayName("Health and tools")
    class HealthAndTools {

        @Test
        @DisplayName("health reports UP and echoes the request id")
        void testHealth(VertxTestContext ctx) {
            webClient.get(HTTP_PORT, HOST, "/api/v1/health")
                    .putHeader(CorrelationIdHandler.REQUEST_ID_HEADER, "req-health-1")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        assertEquals("req-health-1", response.getHeader(CorrelationIdHandler.REQUEST_ID_HEADER));
                        JsonObject json = response.bodyAsJsonObject();
                        assertEquals("UP", json.getString("status"));
                        assertNotNull(json.getJsonObject("checks").getJsonObject("engine"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("lists registered tools including placeholders")
        void testTools(VertxTestContext ctx) {
            webClient.get(HTTP_PORT, HOST, "/api/v1/tools")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        JsonObject json = response.bodyAsJsonObject();
                        assertEquals(3, json.getInteger("total"));
                        assertEquals("company-search", json.getJsonArray("tools").getJsonObject(0).getString("name"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Workflows ====================

    @Nested
    @DisplayName("/api/v1/workflows")
    class Workflows {

        @Test
        @DisplayName("creates, reads, lists and deletes a definition")
        void testDefinitionLifecycle() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("crud"));

            HttpResponse<Buffer> fetched = get("/api/v1/workflows/" + workflowId);
            assertEquals(200, fetched.statusCode());
            JsonObject definition = fetched.bodyAsJsonObject();
            assertEquals("crud", definition.getString("name"));
            assertEquals("1.0", definition.getString("version"));
            assertEquals(2, definition.getJsonArray("steps").size());

            HttpResponse<Buffer> listed = get("/api/v1/workflows");
            assertEquals(200, listed.statusCode());
            assertTrue(listed.bodyAsJsonObject().getInteger("total") >= 1);

            HttpResponse<Buffer> deleted = webClient.delete(HTTP_PORT, HOST, "/api/v1/workflows/" + workflowId).send()
                    .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
            assertEquals(200, deleted.statusCode());
            assertTrue(deleted.bodyAsJsonObject().getBoolean("deleted"));

            assertEquals(404, get("/api/v1/workflows/" + workflowId).statusCode());
        }

        @Test
        @DisplayName("rejects an invalid definition with every problem listed")
        void testValidationErrors(VertxTestContext ctx) {
            JsonObject invalid = new JsonObject()
                    .put("name", "broken")
                    .put("steps", new JsonArray()
                            .add(new JsonObject().put("id", "a").put("toolName", "no-such-tool")
                                    .put("dependsOn", new JsonArray().add("b")))
                            .add(new JsonObject().put("id", "b").put("toolName", "company-search")
                                    .put("dependsOn", new JsonArray().add("a"))));

            webClient.post(HTTP_PORT, HOST, "/api/v1/workflows")
                    .sendJsonObject(invalid)
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                        assertEquals("VALIDATION_ERROR", error.getString("code"));
                        assertEquals("/api/v1/workflows", error.getString("path"));
                        assertNotNull(error.getString("requestId"));
                        assertTrue(error.getJsonArray("details").size() >= 2,
                                "Unknown tool and cycle should both be reported: " + error);
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("refuses to replace a definition under an existing id")
        void testDuplicateIdRejected() throws Exception {
            JsonObject first = new JsonObject()
                    .put("id", "fixed-id")
                    .put("name", "first")
                    .put("steps", new JsonArray().add(new JsonObject().put("id", "s").put("toolName", "company-search")));
            assertEquals("fixed-id", createWorkflow(first));

            HttpResponse<Buffer> second = post("/api/v1/workflows", first.copy().put("name", "second"));

            assertEquals(400, second.statusCode());
            JsonObject error = second.bodyAsJsonObject().getJsonObject("error");
            assertEquals("VALIDATION_ERROR", error.getString("code"));
            assertEquals("Workflow id 'fixed-id' already exists", error.getJsonArray("details").getString(0));
            assertEquals("first", get("/api/v1/workflows/fixed-id").bodyAsJsonObject().getString("name"));
        }

        @Test
        @DisplayName("reports a null step as a validation error")
        void testNullStepRejected() throws Exception {
            JsonObject definition = new JsonObject()
                    .put("name", "holes")
                    .put("steps", new JsonArray().addNull()
                            .add(new JsonObject().put("id", "s").put("toolName", "company-search")));

            HttpResponse<Buffer> response = post("/api/v1/workflows", definition);

            assertEquals(400, response.statusCode(), response.bodyAsString());
            assertEquals("Step at index 0 is null",
                    response.bodyAsJsonObject().getJsonObject("error").getJsonArray("details").getString(0));
        }

        @Test
        @DisplayName("rejects malformed JSON with 400")
        void testMalformedJson(VertxTestContext ctx) {
            webClient.post(HTTP_PORT, HOST, "/api/v1/workflows")
                    .putHeader("Content-Type", "application/json")
                    .sendBuffer(Buffer.buffer("{\"name\": "))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        assertEquals("BAD_REQUEST", response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("answers 404 for an unknown workflow")
        void testUnknownWorkflow(VertxTestContext ctx) {
            webClient.get(HTTP_PORT, HOST, "/api/v1/workflows/does-not-exist")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(404, response.statusCode());
                        assertEquals("WORKFLOW_NOT_FOUND",
                                response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Executions ====================

    @Nested
    @DisplayName("Executions")
    class Executions {

        @Test
        @DisplayName("runs an execution and reports its status with and without step details")
        void testStartAndStatus() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("status"));
            String executionId = startExecution(workflowId, new JsonObject().put("ticker", "ACME"));

            awaitStatus(executionId, WorkflowStatus.COMPLETED);

            JsonObject status = get("/api/v1/executions/" + executionId).bodyAsJsonObject();
            assertEquals("COMPLETED", status.getString("status"));
            assertEquals("api-test", status.getString("initiatedBy"));
            assertEquals(2, status.getJsonObject("progress").getInteger("completedSteps"));
            JsonArray steps = status.getJsonArray("stepDetails");
            assertEquals(2, steps.size());

            JsonObject withoutSteps = get("/api/v1/executions/" + executionId + "?includeStepDetails=false")
                    .bodyAsJsonObject();
            assertFalse(withoutSteps.containsKey("stepDetails"));

            JsonObject listed = get("/api/v1/workflows/" + workflowId + "/executions").bodyAsJsonObject();
            assertEquals(1, listed.getInteger("total"));
        }

        @Test
        @DisplayName("starting an unknown workflow answers 404")
        void testStartUnknownWorkflow() throws Exception {
            HttpResponse<Buffer> response = post("/api/v1/workflows/missing/executions", new JsonObject());
            assertEquals(404, response.statusCode());
        }

        @Test
        @DisplayName("rejects non-object parameters")
        void testInvalidParameters() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("bad-params"));
            HttpResponse<Buffer> response = post("/api/v1/workflows/" + workflowId + "/executions",
                    new JsonObject().put("parameters", new JsonArray().add(1)));
            assertEquals(400, response.statusCode());
        }

        @Test
        @DisplayName("answers 404 for an unknown execution")
        void testUnknownExecution(VertxTestContext ctx) {
            webClient.get(HTTP_PORT, HOST, "/api/v1/executions/missing")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(404, response.statusCode());
                        assertEquals("EXECUTION_NOT_FOUND",
                                response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("pauses, resumes and cancels a running execution")
        void testLifecycle() throws Exception {
            JsonObject slow = new JsonObject()
                    .put("name", "slow")
                    .put("steps", new JsonArray()
                            .add(new JsonObject().put("id", "wait").put("toolName", "slow-search")));
            String workflowId = createWorkflow(slow);
            String executionId = startExecution(workflowId, new JsonObject());
            awaitStatus(executionId, WorkflowStatus.RUNNING);

            JsonObject paused = post("/api/v1/executions/" + executionId + "/pause", new JsonObject())
                    .bodyAsJsonObject();
            assertTrue(paused.getBoolean("paused"));
            assertEquals("PAUSED", paused.getString("status"));

            JsonObject resumed = post("/api/v1/executions/" + executionId + "/resume", new JsonObject())
                    .bodyAsJsonObject();
            assertTrue(resumed.getBoolean("resumed"));
            assertEquals("RUNNING", resumed.getString("status"));

            JsonObject cancelled = post("/api/v1/executions/" + executionId + "/cancel", new JsonObject())
                    .bodyAsJsonObject();
            assertTrue(cancelled.getBoolean("cancelled"));
            assertEquals("CANCELLED", cancelled.getString("status"));

            JsonObject again = post("/api/v1/executions/" + executionId + "/cancel", new JsonObject())
                    .bodyAsJsonObject();
            assertFalse(again.getBoolean("cancelled"));
        }
    }

    // ==================== Batches ====================

    @Nested
    @DisplayName("/api/v1/batches")
    class Batches {

        @Test
        @DisplayName("accepts a batch with 202 and finishes dispatching every item")
        void testSubmitBatch() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("batch"));
            JsonObject body = new JsonObject()
                    .put("workflowId", workflowId)
                    .put("items", new JsonArray()
                            .add(new JsonObject().put("ticker", "A"))
                            .add(new JsonObject().put("ticker", "B"))
                            .add(new JsonObject().put("ticker", "C")))
                    .put("config", new JsonObject()
                            .put("batchSize", 2)
                            .put("maxParallelism", 2)
                            .put("retryDelay", "PT0S"));

            HttpResponse<Buffer> response = post("/api/v1/batches", body);
            assertEquals(202, response.statusCode(), response.bodyAsString());
            JsonObject accepted = response.bodyAsJsonObject();
            String batchId = accepted.getString("batchId");
            assertNotNull(batchId);
            assertEquals(3, accepted.getInteger("totalItems"));
            assertEquals(2, accepted.getInteger("batchCount"));
            assertEquals(new JsonArray().add(2).add(1), accepted.getJsonArray("batchSizes"));

            await().atMost(Duration.ofSeconds(10)).until(() ->
                    "COMPLETED".equals(get("/api/v1/batches/" + batchId).bodyAsJsonObject().getString("status")));

            JsonObject finished = get("/api/v1/batches/" + batchId).bodyAsJsonObject();
            assertEquals(3, finished.getInteger("successfulStarts"));
            assertEquals(3, finished.getJsonArray("executionIds").size());
        }

        @Test
        @DisplayName("rejects an empty item list and out-of-range config together")
        void testInvalidBatch() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("invalid-batch"));
            JsonObject body = new JsonObject()
                    .put("workflowId", workflowId)
                    .put("items", new JsonArray())
                    .put("config", new JsonObject().put("batchSize", 0));

            HttpResponse<Buffer> response = post("/api/v1/batches", body);
            assertEquals(400, response.statusCode());
            JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
            assertEquals("VALIDATION_ERROR", error.getString("code"));
            assertEquals(2, error.getJsonArray("details").size());
        }

        @Test
        @DisplayName("answers 404 for an unknown batch")
        void testUnknownBatch() throws Exception {
            HttpResponse<Buffer> response = get("/api/v1/batches/missing");
            assertEquals(404, response.statusCode());
            assertEquals("BATCH_NOT_FOUND", response.bodyAsJsonObject().getJsonObject("error").getString("code"));
        }
    }

    // ==================== Aggregation ====================

    @Nested
    @DisplayName("/api/v1/executions/aggregate")
    class Aggregation {

        @Test
        @DisplayName("aggregates found executions and lists the missing ones")
        void testStatisticalAggregation() throws Exception {
            String workflowId = createWorkflow(lookupDefinition("aggregate"));
            String first = startExecution(workflowId, new JsonObject().put("ticker", "X"));
            String second = startExecution(workflowId, new JsonObject().put("ticker", "Y"));
            awaitStatus(first, WorkflowStatus.COMPLETED);
            awaitStatus(second, WorkflowStatus.COMPLETED);

            JsonObject body = new JsonObject()
                    .put("executionIds", new JsonArray().add(first).add(second).add("missing"))
                    .put("mode", "Statistical");
            HttpResponse<Buffer> response = post("/api/v1/executions/aggregate", body);
            assertEquals(200, response.statusCode(), response.bodyAsString());

            JsonObject result = response.bodyAsJsonObject();
            assertEquals(2, result.getInteger("totalExecutions"));
            assertEquals(2, result.getInteger("successfulExecutions"));
            assertEquals(100.0, result.getDouble("successRate"), 1e-9);
            assertEquals("aggregate", result.getString("mostCommonWorkflow"));
            assertEquals(new JsonArray().add("missing"), result.getJsonArray("notFoundExecutionIds"));
            assertNotNull(result.getJsonObject("durationStatistics"));
        }

        @Test
        @DisplayName("rejects an unknown mode with 400")
        void testUnknownMode(VertxTestContext ctx) {
            JsonObject body = new JsonObject()
                    .put("executionIds", new JsonArray())
                    .put("mode", "histogram");
            webClient.post(HTTP_PORT, HOST, "/api/v1/executions/aggregate")
                    .sendJsonObject(body)
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                        assertEquals("VALIDATION_ERROR", error.getString("code"));
                        assertTrue(error.getString("message").contains("histogram"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Routing errors ====================

    @Test
    @DisplayName("unknown routes answer 404 in the error envelope")
    void testUnknownRoute(VertxTestContext ctx) {
        webClient.get(HTTP_PORT, HOST, "/api/v1/nothing-here")
                .send()
                .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                    assertEquals(404, response.statusCode());
                    assertEquals("NOT_FOUND", response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("unsupported methods answer 405")
    void testMethodNotAllowed(VertxTestContext ctx) {
        webClient.put(HTTP_PORT, HOST, "/api/v1/workflows")
                .send()
                .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                    assertEquals(405, response.statusCode());
                    assertEquals("METHOD_NOT_ALLOWED",
                            response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                    ctx.completeNow();
                })));
    }

    private record FixedTool(String name,
                             Function<Map<String, Object>, CompletableFuture<ToolResult>> behaviour)
            implements Tool {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return behaviour.apply(parameters);
        }
    }
}
