package com.entity.intelligence.logging;

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
    @DisplayName("forBuild should set buildId and operation in MDC")
    void forBuildSetsMDC() {
        try (LogContext ctx = LogContext.forBuild("build-123")) {
            assertEquals("build-123", MDC.get("buildId"));
            assertEquals("build", MDC.get("operation"));
        }
        assertNull(MDC.get("buildId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forAnalyzer should set analyzer and operation in MDC")
    void forAnalyzerSetsMDC() {
        try (LogContext ctx = LogContext.forAnalyzer("semantic").with("entityId", "movie:1")) {
            assertEquals("semantic", MDC.get("analyzer"));
            assertEquals("analyze", MDC.get("operation"));
            assertEquals("movie:1", MDC.get("entityId"));
        }
        assertNull(MDC.get("analyzer"));
        assertNull(MDC.get("entityId"));
    }

    @Test
    @DisplayName("Closing an inner context should keep the outer keys")
    void nestedContexts() {
        try (LogContext outer = LogContext.forBuild("outer")) {
            try (LogContext inner = LogContext.forAnalyzer("content")) {
                assertEquals("content", MDC.get("analyzer"));
                assertEquals("outer", MDC.get("buildId"));
            }
            assertNull(MDC.get("analyzer"));
            assertEquals("outer", MDC.get("buildId"));
        }
        assertNull(MDC.get("buildId"));
    }

    @Test
    @DisplayName("generateBuildId should return unique UUIDs")
    void generateBuildIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateBuildId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateBuildId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
