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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    @Test
    void testRegisterAndLookup() {
        Tool tool = new EchoTool("company-search");
        registry.registerTool(tool);

        assertTrue(registry.isRegistered("company-search"));
        assertSame(tool, registry.getTool("company-search"));
        assertTrue(registry.findTool("company-search").isPresent());
    }

    @Test
    void testNamesAreCaseSensitive() {
        registry.registerTool(new EchoTool("company-search"));

        assertFalse(registry.isRegistered("Company-Search"));
        assertThrows(ToolNotFoundException.class, () -> registry.getTool("Company-Search"));
    }

    @Test
    void testUnknownToolThrows() {
        ToolNotFoundException e = assertThrows(ToolNotFoundException.class, () -> registry.getTool("missing"));
        assertEquals("missing", e.getToolName());
        assertFalse(registry.findTool(null).isPresent());
    }

    @Test
    void testPlaceholdersDoNotReplaceRealTools() throws Exception {
        Tool real = new EchoTool("form-filter");
        registry.registerTool(real);

        registry.registerPlaceholders(List.of("form-filter", "content-search"));

        assertSame(real, registry.getTool("form-filter"));
        ToolResult result = registry.getTool("content-search").execute(Map.of()).get();
        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("not configured"));
    }

    @Test
    void testToolNamesSortedAndUnregister() {
        registry.registerTool(new EchoTool("b-tool"));
        registry.registerTool(new EchoTool("a-tool"));

        assertEquals(List.of("a-tool", "b-tool"), List.copyOf(registry.getToolNames()));

        registry.unregisterTool("a-tool");
        assertFalse(registry.isRegistered("a-tool"));
    }

    private static final class EchoTool implements Tool {
        private final String name;

        EchoTool(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return CompletableFuture.completedFuture(ToolResult.success(parameters));
        }
    }
}
