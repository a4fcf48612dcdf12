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

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Assigns a correlation id to every request.
 *
 * <p>The id comes from the {@code X-Request-ID} header when the client sends one,
 * otherwise a new one is generated. It is put into the SLF4J MDC under
 * {@code requestId}, stored on the routing context and echoed in the response header.
 * The MDC entry is removed when the request ends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public class CorrelationIdHandler implements Handler<RoutingContext> {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public static final String MDC_REQUEST_ID = "requestId";

    public static final String CTX_REQUEST_ID = "requestId";

    @Override
    public void handle(RoutingContext ctx) {
        String requestId = ctx.request().getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = generateRequestId();
        }

        MDC.put(MDC_REQUEST_ID, requestId);
        ctx.put(CTX_REQUEST_ID, requestId);
        ctx.response().putHeader(REQUEST_ID_HEADER, requestId);
        ctx.addEndHandler(v -> MDC.remove(MDC_REQUEST_ID));

        ctx.next();
    }

    /**
     * @return the request's correlation id, or null outside the HTTP pipeline
     */
    public static String getRequestId(RoutingContext ctx) {
        return ctx.get(CTX_REQUEST_ID);
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
