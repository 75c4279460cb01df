package com.spending.fraud.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set rule keys and remove them on close")
    void testForRule() {
        try (LogContext ignored = LogContext.forRule("run-1", "network")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("network", MDC.get("rule"));
            assertEquals("rule", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("rule"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys in place")
    void testKeepsOtherKeys() {
        MDC.put("requestId", "abc");
        try (LogContext ignored = LogContext.forBatch("match-1", 3).with("size", "500")) {
            assertEquals("3", MDC.get("batchIndex"));
            assertEquals("500", MDC.get("size"));
        }
        assertEquals("abc", MDC.get("requestId"));
        assertNull(MDC.get("size"));
    }

    @Test
    @DisplayName("Should generate distinct ids")
    void testGenerateId() {
        assertNotEquals(LogContext.generateId(), LogContext.generateId());
    }
}
