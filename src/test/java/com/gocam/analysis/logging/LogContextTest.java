package com.gocam.analysis.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forModel sets modelId and operation in MDC")
    void forModelSetsMDC() {
        try (LogContext ctx = LogContext.forModel("gomodel:1")) {
            assertEquals("gomodel:1", MDC.get("modelId"));
            assertEquals("build", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch sets batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge sets correlationId, mergedModelId, modelCount and operation in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-789", "merged", 3)) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("merged", MDC.get("mergedModelId"));
            assertEquals("3", MDC.get("modelCount"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC is cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forModel("gomodel:1");
        assertNotNull(MDC.get("modelId"));

        ctx.close();

        assertNull(MDC.get("modelId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() adds keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forModel("gomodel:1").with("source", "models/a.json")) {
            assertEquals("models/a.json", MDC.get("source"));
        }
        assertNull(MDC.get("source"));
        assertNull(MDC.get("modelId"));
    }

    @Test
    @DisplayName("generateCorrelationId returns unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(ids.iterator().next().matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("Inner contexts leave outer keys in place")
    void nestedContexts() {
        try (LogContext outer = LogContext.forBatch("batch-1")) {
            try (LogContext inner = LogContext.forMerge("corr-1", "merged", 2)) {
                assertEquals("batch-1", MDC.get("batchId"));
                assertEquals("corr-1", MDC.get("correlationId"));
            }
            assertNull(MDC.get("correlationId"));
            assertEquals("batch-1", MDC.get("batchId"));
        }
        assertNull(MDC.get("batchId"));
    }
}
