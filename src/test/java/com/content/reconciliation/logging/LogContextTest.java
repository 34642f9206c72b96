package com.content.reconciliation.logging;

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
    @DisplayName("forFold should set correlationId, recordCount and operation in MDC")
    void forFoldSetsMDC() {
        try (LogContext ctx = LogContext.forFold("corr-123", 42)) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("42", MDC.get("recordCount"));
            assertEquals("fold", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMatch should set both collection sizes")
    void forMatchSetsMDC() {
        try (LogContext ctx = LogContext.forMatch("corr-1", 3, 7)) {
            assertEquals("3", MDC.get("videoCount"));
            assertEquals("7", MDC.get("counterpartCount"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forConsolidation should set keep and discard ids")
    void forConsolidationSetsMDC() {
        try (LogContext ctx = LogContext.forConsolidation("corr-9", "video:v1", "product:P1")) {
            assertEquals("video:v1", MDC.get("keepEntityId"));
            assertEquals("product:P1", MDC.get("discardEntityId"));
            assertEquals("consolidate", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including extra keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forCommit("corr-5", "MATCHING").with("reviewer", "alice");
        assertEquals("MATCHING", MDC.get("stage"));
        assertEquals("alice", MDC.get("reviewer"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("reviewer"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique ids")
    void correlationIdsUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
