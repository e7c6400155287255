package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.compiler.cst.ConcreteSyntaxTree;
import org.csu.vbparse.compiler.cst.CstNode;
import org.csu.vbparse.compiler.cst.TreeBuilder;
import org.csu.vbparse.compiler.lexer.Lexer;
import org.csu.vbparse.compiler.syntax.SyntaxKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 错误恢复：坏代码只影响它所在的语句，解析总能继续并保持无损。
 */
public class ParserRecoveryTest {

    private List<Diagnostic> diagnostics;

    private ConcreteSyntaxTree parse(String source, ParserOptions options) {
        TreeBuilder builder = new TreeBuilder();
        Parser parser = new Parser(new Lexer(source).tokenize(), builder, options, "Broken.bas");
        parser.parse();
        diagnostics = parser.getDiagnostics();
        ConcreteSyntaxTree tree = builder.finish();
        assertEquals(source, tree.text());
        return tree;
    }

    private ConcreteSyntaxTree parse(String source) {
        return parse(source, ParserOptions.defaults());
    }

    private List<DiagnosticKind> kinds() {
        return diagnostics.stream().map(Diagnostic::kind).collect(Collectors.toList());
    }

    @Test
    public void testBrokenStatementsStayInsideTheirProcedure() {
        System.out.println("--- Running test: testBrokenStatementsStayInsideTheirProcedure ---");
        String clean = "Sub Clean()\n    y = 2\nEnd Sub\n";
        String source = "Sub Broken()\n    x = = 1\n    ) junk\nEnd Sub\n\n" + clean;
        ConcreteSyntaxTree tree = parse(source);
        System.out.println(tree.debugTree());

        List<CstNode> subs = tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT);
        assertEquals(2, subs.size());
        assertEquals(clean, subs.get(1).text());
        assertFalse(subs.get(1).text().contains("junk"));

        CstNode broken = subs.get(0);
        CstNode body = broken.firstChildOfKind(SyntaxKind.STATEMENT_LIST).orElseThrow();
        assertEquals(List.of(SyntaxKind.ASSIGNMENT_STATEMENT, SyntaxKind.UNKNOWN),
                body.children().stream().map(CstNode::kind).collect(Collectors.toList()));
        assertEquals("    ) junk\n", body.findChildrenByKind(SyntaxKind.UNKNOWN).get(0).text());

        // x = = 1：缺失的表达式是一个空节点，多余的部分并入赋值语句
        CstNode assignment = body.findChildrenByKind(SyntaxKind.ASSIGNMENT_STATEMENT).get(0);
        CstNode missing = assignment.firstChildOfKind(SyntaxKind.MISSING_EXPRESSION).orElseThrow();
        assertEquals("", missing.text());
        assertEquals("    x = = 1\n", assignment.text());

        assertEquals(List.of(DiagnosticKind.MISSING_EXPRESSION, DiagnosticKind.UNEXPECTED_TOKEN,
                DiagnosticKind.UNKNOWN_STATEMENT), kinds());
        assertEquals(2, diagnostics.get(0).line());
        assertEquals(3, diagnostics.get(2).line());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMissingTerminatorAtEndOfFile() {
        System.out.println("--- Running test: testMissingTerminatorAtEndOfFile ---");
        ConcreteSyntaxTree tree = parse("Sub Main()\n    x = 1\n");

        assertEquals(List.of(DiagnosticKind.MISSING_BLOCK_TERMINATOR), kinds());
        assertTrue(diagnostics.get(0).message().contains("End Sub"));
        assertEquals(1, tree.childCount());
        assertEquals(SyntaxKind.SUB_STATEMENT, tree.firstChild().orElseThrow().kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMissingEndIfIsClosedByProcedureEnd() {
        System.out.println("--- Running test: testMissingEndIfIsClosedByProcedureEnd ---");
        String source = "Sub Main()\n    If a Then\n        b = 1\nEnd Sub\nx = 2\n";
        ConcreteSyntaxTree tree = parse(source);
        System.out.println(tree.debugTree());

        assertEquals(List.of(DiagnosticKind.MISSING_BLOCK_TERMINATOR), kinds());
        assertTrue(diagnostics.get(0).message().contains("End If"));
        CstNode sub = tree.firstChild().orElseThrow();
        assertEquals("Sub Main()\n    If a Then\n        b = 1\nEnd Sub\n", sub.text());
        assertEquals(SyntaxKind.ASSIGNMENT_STATEMENT, tree.lastChild().orElseThrow().kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMismatchedProcedureEndIsConsumed() {
        System.out.println("--- Running test: testMismatchedProcedureEndIsConsumed ---");
        String source = "Sub Main()\n    x = 1\nEnd Function\n";
        ConcreteSyntaxTree tree = parse(source);

        assertEquals(List.of(DiagnosticKind.MISMATCHED_BLOCK_TERMINATOR), kinds());
        assertEquals(1, tree.childCount());
        assertEquals(source, tree.firstChild().orElseThrow().text());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testStrayTerminatorsAreUnknownStatements() {
        System.out.println("--- Running test: testStrayTerminatorsAreUnknownStatements ---");
        ConcreteSyntaxTree tree = parse("Sub A()\n    End If\n    Loop\nEnd Sub\nElse\nWend\n");

        assertEquals(List.of(DiagnosticKind.UNKNOWN_STATEMENT, DiagnosticKind.UNKNOWN_STATEMENT,
                DiagnosticKind.UNKNOWN_STATEMENT, DiagnosticKind.UNKNOWN_STATEMENT), kinds());
        assertEquals(4, tree.descendantsOfKind(SyntaxKind.UNKNOWN).size());
        assertEquals(1, tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT).size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNextWithTooManyVariables() {
        System.out.println("--- Running test: testNextWithTooManyVariables ---");
        ConcreteSyntaxTree tree = parse("For i = 1 To 2\nNext i, j\nx = 1\n");

        assertEquals(List.of(DiagnosticKind.UNEXPECTED_TOKEN), kinds());
        assertEquals(SyntaxKind.FOR_STATEMENT, tree.firstChild().orElseThrow().kind());
        assertEquals(SyntaxKind.ASSIGNMENT_STATEMENT, tree.lastChild().orElseThrow().kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMisplacedPropertyBlockIsWrappedWhole() {
        System.out.println("--- Running test: testMisplacedPropertyBlockIsWrappedWhole ---");
        String block = "Begin VB.Form Form1\n   Caption = \"x\"\nEnd\n";
        ConcreteSyntaxTree tree = parse("Option Explicit\n" + block);

        assertEquals(List.of(DiagnosticKind.HEADER_STATEMENT_OUTSIDE_HEADER), kinds());
        CstNode unknown = tree.lastChild().orElseThrow();
        assertEquals(SyntaxKind.UNKNOWN, unknown.kind());
        assertEquals(block, unknown.text());
        // 块内的 End 没有被当成 End 语句
        assertFalse(tree.containsKind(SyntaxKind.END_STATEMENT));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testBlockNestingLimit() {
        System.out.println("--- Running test: testBlockNestingLimit ---");
        String source = "If a Then\nIf b Then\nIf c Then\nIf d Then\nx = 1\nEnd If\nEnd If\nEnd If\nEnd If\n";
        ConcreteSyntaxTree tree = parse(source, ParserOptions.defaults().withMaxNestingDepth(3));
        System.out.println(tree.debugTree());

        assertTrue(kinds().contains(DiagnosticKind.NESTING_TOO_DEEP));
        assertTrue(tree.containsKindDeep(SyntaxKind.UNKNOWN));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDeepExpressionDoesNotOverflow() {
        System.out.println("--- Running test: testDeepExpressionDoesNotOverflow ---");
        String source = "x = " + "(".repeat(2000) + "1" + ")".repeat(2000) + "\n";
        ConcreteSyntaxTree tree = parse(source);

        assertTrue(kinds().contains(DiagnosticKind.NESTING_TOO_DEEP));
        assertTrue(tree.containsKindDeep(SyntaxKind.MISSING_EXPRESSION));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testInvalidOptionsAreRejected() {
        System.out.println("--- Running test: testInvalidOptionsAreRejected ---");
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.defaults().withMaxNestingDepth(0));
        System.out.println("Result: Test PASSED.\n");
    }
}
