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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterResolverTest {

    private ParameterResolver resolver;

    /** Result type navigated through its JSON form. */
    public static class SearchHit {
        public String cik = "0000320193";
        public int rank = 1;
    }

    @BeforeEach
    void setUp() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("ticker", "AAPL");
        parameters.put("limit", 25);
        parameters.put("form", "10-K");

        Map<String, Object> results = new LinkedHashMap<>();
        results.put("search", Map.of(
                "company", Map.of("name", "Apple Inc.", "cik", "0000320193"),
                "filings", List.of("f-1", "f-2")));
        results.put("lookup", new SearchHit());

        resolver = new ParameterResolver(parameters, results);
    }

    @Test
    void testWholePlaceholderKeepsType() {
        assertEquals(25, resolver.resolveValue("${limit}"));
        assertEquals(List.of("f-1", "f-2"), resolver.resolveValue("${search.filings}"));
    }

    @Test
    void testEmbeddedPlaceholdersAreStringified() {
        assertEquals("Filings for AAPL (25)", resolver.resolveValue("Filings for ${ticker} (${limit})"));
    }

    @Test
    void testStepResultPath() {
        assertEquals("Apple Inc.", resolver.resolveValue("${search.company.name}"));
        assertEquals("f-2", resolver.resolveValue("${search.filings.1}"));
    }

    @Test
    void testObjectResultNavigatedAsJson() {
        assertEquals("0000320193", resolver.resolveValue("${lookup.cik}"));
    }

    @Test
    void testUnresolvedPlaceholdersStayVerbatim() {
        assertEquals("${missing}", resolver.resolveValue("${missing}"));
        assertEquals("${search.company.ticker}", resolver.resolveValue("${search.company.ticker}"));
        assertEquals("${other.value} for AAPL", resolver.resolveValue("${other.value} for ${ticker}"));
        assertEquals("${search.filings.9}", resolver.resolveValue("${search.filings.9}"));
    }

    @Test
    void testNonStringValuesUntouched() {
        assertEquals(7, resolver.resolveValue(7));
        assertNull(resolver.resolveValue(null));
        assertEquals("plain", resolver.resolveValue("plain"));
    }

    @Test
    void testStepParametersOverrideExecutionParameters() {
        Map<String, Object> stepParameters = new LinkedHashMap<>();
        stepParameters.put("form", "8-K");
        stepParameters.put("query", "${ticker}");

        Map<String, Object> merged = resolver.resolveStepParameters(stepParameters);

        assertEquals("8-K", merged.get("form"));
        assertEquals("AAPL", merged.get("query"));
        assertEquals(25, merged.get("limit"));
        assertEquals("AAPL", merged.get("ticker"));
    }
}
