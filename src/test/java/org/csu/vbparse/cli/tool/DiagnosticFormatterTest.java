package org.csu.vbparse.cli.tool;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticFormatterTest {

    @Test
    public void testEmptyList() {
        System.out.println("--- Running test: testEmptyList ---");
        assertEquals("No diagnostics.", DiagnosticFormatter.format(List.of()));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testTableLayout() {
        System.out.println("--- Running test: testTableLayout ---");
        List<Diagnostic> diagnostics = List.of(
                new Diagnostic(DiagnosticKind.UNKNOWN_STATEMENT, "Unknown statement starting with ')'", "a.bas", 0, 1, 1),
                new Diagnostic(DiagnosticKind.MISSING_EXPRESSION, "100% missing", "a.bas", 20, 12, 5));
        String table = DiagnosticFormatter.format(diagnostics);
        System.out.println(table);

        String[] lines = table.split("\n");
        assertEquals(7, lines.length);
        assertEquals(lines[0], lines[2]);
        assertEquals(lines[0], lines[5]);
        assertTrue(lines[0].startsWith("+------+--------+"));
        assertTrue(lines[1].startsWith("| Line | Column | Kind "));
        assertTrue(lines[3].startsWith("| 1    | 1      | UNKNOWN_STATEMENT  |"));
        // 消息中的 % 原样输出
        assertTrue(lines[4].contains("| 100% missing "));
        for (int i = 0; i < 6; i++) {
            assertEquals(lines[0].length(), lines[i].length(), "每一行宽度相同");
        }
        assertEquals("2 diagnostics.", lines[6]);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSingleDiagnosticSummary() {
        System.out.println("--- Running test: testSingleDiagnosticSummary ---");
        String table = DiagnosticFormatter.format(List.of(
                new Diagnostic(DiagnosticKind.NESTING_TOO_DEEP, "too deep", "a.bas", 0, 1, 1)));
        assertTrue(table.endsWith("\n1 diagnostic."));
        System.out.println("Result: Test PASSED.\n");
    }
}
