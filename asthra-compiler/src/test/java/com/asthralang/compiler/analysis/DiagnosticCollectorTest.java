package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticCollectorTest {

    private static SourceLocation at(int line) {
        return new SourceLocation("cap.asthra", line, 1);
    }

    @Test
    void testErrorsBeyondCapAreCountedNotRecorded() {
        AnalysisStatistics stats = new AnalysisStatistics();
        DiagnosticCollector collector = new DiagnosticCollector(100, true, stats);
        for (int i = 1; i <= 150; i++) {
            SemanticDiagnostic d = collector.reportError(ErrorKind.TYPE_MISMATCH, at(i), "错误 %d", i);
            if (i <= 100) {
                assertNotNull(d);
            } else {
                assertNull(d);
            }
        }
        assertEquals(150, collector.getErrorCount());
        assertEquals(100, collector.getErrors().size());
        assertTrue(collector.isCapReached());
        assertTrue(collector.hasErrors());
        assertEquals(150, stats.getErrorsFound());
        // 保留的是最早的 100 个
        assertEquals("错误 1", collector.getErrors().get(0).getMessage());
        assertEquals("错误 100", collector.getErrors().get(99).getMessage());
    }

    @Test
    void testWarningsDoNotConsumeErrorQuota() {
        DiagnosticCollector collector = new DiagnosticCollector(2, true, null);
        collector.reportWarning(ErrorKind.INVALID_CONTROL_FLOW, at(1), "w1");
        collector.reportWarning(ErrorKind.INVALID_CONTROL_FLOW, at(2), "w2");
        collector.reportWarning(ErrorKind.INVALID_CONTROL_FLOW, at(3), "w3");
        collector.reportError(ErrorKind.INVALID_EXPRESSION, at(4), "e1");
        collector.reportError(ErrorKind.INVALID_EXPRESSION, at(5), "e2");

        assertEquals(2, collector.getErrors().size());
        assertEquals(2, collector.getWarnings().size());
        assertEquals(3, collector.getWarningCount());
        assertEquals(4, collector.getDiagnostics().size());
    }

    @Test
    void testWarningsDisabledAreOnlyCounted() {
        DiagnosticCollector collector = new DiagnosticCollector(10, false, null);
        assertNull(collector.reportWarning(ErrorKind.REDECLARATION, at(1), "遮蔽"));
        assertEquals(1, collector.getWarningCount());
        assertTrue(collector.getWarnings().isEmpty());
        assertFalse(collector.hasErrors());
    }

    @Test
    void testMessageWithoutArgsIsVerbatim() {
        DiagnosticCollector collector = new DiagnosticCollector(10, true, null);
        SemanticDiagnostic d = collector.reportError(ErrorKind.INTERNAL, at(1), "100% 原样");
        assertEquals("100% 原样", d.getMessage());
    }

    @Test
    void testSuggestionKept() {
        DiagnosticCollector collector = new DiagnosticCollector(10, true, null);
        SemanticDiagnostic d = collector.reportErrorWithSuggestion(ErrorKind.IMMUTABILITY_VIOLATION, at(7),
                "let mut x", "变量 '%s' 不可变", "x");
        assertEquals("let mut x", d.getSuggestion());
        assertEquals("变量 'x' 不可变", d.getMessage());
        assertEquals("cap.asthra:7:1: error[E011]: 变量 'x' 不可变 (let mut x)", d.toString());
    }

    @Test
    void testZeroCapRecordsNothing() {
        DiagnosticCollector collector = new DiagnosticCollector(0, true, null);
        collector.reportError(ErrorKind.INTERNAL, at(1), "x");
        assertEquals(1, collector.getErrorCount());
        assertTrue(collector.getErrors().isEmpty());
        assertTrue(collector.isCapReached());
    }
}
