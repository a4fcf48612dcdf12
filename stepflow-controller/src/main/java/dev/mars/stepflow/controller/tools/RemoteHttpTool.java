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

package dev.mars.stepflow.controller.tools;

import dev.mars.stepflow.controller.config.AppConfig;
import dev.mars.stepflow.tool.Tool;
import dev.mars.stepflow.tool.ToolRegistry;
import dev.mars.stepflow.tool.ToolResult;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool backed by an HTTP endpoint. The step parameters are POSTed as a JSON object;
 * a 2xx response body, decoded as JSON, becomes the step result.
 *
 * <p>Any other status, an unreadable body or a transport error is reported as a
 * failed {@link ToolResult}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 * @version 1.0
 */
public class RemoteHttpTool implements Tool {

    private static final Logger logger = LoggerFactory.getLogger(RemoteHttpTool.class);
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final String name;
    private final String url;
    private final long timeoutMs;
    private final WebClient client;

    public RemoteHttpTool(String name, String url, long timeoutMs, WebClient client) {
        this.name = name;
        this.url = url;
        this.timeoutMs = timeoutMs;
        this.client = client;
    }

    /**
     * Registers one tool per configured {@code stepflow.tools.remote.<name>.url}.
     *
     * @return number of tools registered
     */
    public static int registerAll(ToolRegistry registry, WebClient client, AppConfig config) {
        Map<String, String> urls = config.getRemoteToolUrls();
        urls.forEach((toolName, toolUrl) ->
                registry.registerTool(new RemoteHttpTool(toolName, toolUrl, config.getRemoteToolTimeoutMs(), client)));
        return urls.size();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "HTTP tool at " + url;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        logger.debug("Invoking remote tool {} at {}", name, url);

        client.postAbs(url)
                .timeout(timeoutMs)
                .putHeader("Accept", "application/json")
                .sendJsonObject(new JsonObject(new LinkedHashMap<>(parameters)))
                .onSuccess(response -> result.complete(toResult(response)))
                .onFailure(err -> {
                    logger.warn("Remote tool {} request to {} failed: {}", name, url, err.getMessage());
                    result.complete(ToolResult.failure("Tool '" + name + "' request failed: " + err.getMessage()));
                });
        return result;
    }

    private ToolResult toResult(HttpResponse<Buffer> response) {
        int status = response.statusCode();
        Map<String, Object> metadata = Map.of("httpStatus", status, "url", url);
        if (status < 200 || status >= 300) {
            String body = response.bodyAsString();
            logger.warn("Remote tool {} returned HTTP {}", name, status);
            return ToolResult.failure("Tool '" + name + "' returned HTTP " + status + abbreviate(body));
        }
        try {
            Object payload = response.bodyAsJson(Object.class);
            return ToolResult.success(payload, metadata);
        } catch (DecodeException e) {
            logger.warn("Remote tool {} returned a body that is not JSON: {}", name, e.getMessage());
            return ToolResult.failure("Tool '" + name + "' returned invalid JSON: " + e.getMessage());
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY_CHARS ? trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "..." : trimmed);
    }
}
