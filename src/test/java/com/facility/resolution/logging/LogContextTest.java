package com.facility.resolution.logging;

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
    @DisplayName("forMatch should set correlationId, facilityId, and operation in MDC")
    void forMatchSetsMDC() {
        try (LogContext ctx = LogContext.forMatch("corr-123", "f-1")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("f-1", MDC.get("facilityId"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456", "deduplicate")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("deduplicate", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge should set survivor and group size in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-789", "survivor-1", 3)) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("survivor-1", MDC.get("survivorId"));
            assertEquals("3", MDC.get("groupSize"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forMatch("corr-123", "f-1")) {
            assertEquals("corr-123", MDC.get("correlationId"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("facilityId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forMatch("corr-123", "f-1")
                .with("strategy", "alias_match")) {
            assertEquals("alias_match", MDC.get("strategy"));
        }
        assertNull(MDC.get("strategy"));
    }

    @Test
    @DisplayName("Keys set outside the context survive its close")
    void foreignKeysKept() {
        MDC.put("tenant", "mining");
        try (LogContext ctx = LogContext.forBatch("batch-1", "slug")) {
            assertEquals("mining", MDC.get("tenant"));
        }
        assertEquals("mining", MDC.get("tenant"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateCorrelationId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
