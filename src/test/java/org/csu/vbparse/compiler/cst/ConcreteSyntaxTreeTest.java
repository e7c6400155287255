package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;
import org.csu.vbparse.engine.SourceProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 导航与查询 API 的测试：直接子节点查询、后代查询以及带位置的 SyntaxNodeRef。
 */
public class ConcreteSyntaxTreeTest {

    private static final String SOURCE = String.join("\n",
            "Option Explicit",
            "",
            "Sub Main()",
            "    x = 1",
            "    y = 2",
            "End Sub",
            "");

    private ConcreteSyntaxTree tree;

    @BeforeEach
    void setUp() {
        tree = new SourceProcessor().parse(SOURCE).tree();
    }

    @Test
    public void testRootQueries() {
        System.out.println("--- Running test: testRootQueries ---");
        System.out.println(tree.debugTree());

        assertEquals(SyntaxKind.ROOT, tree.rootKind());
        assertEquals(SOURCE, tree.text());
        assertEquals(SOURCE.length(), tree.textLength());
        assertTrue(tree.containsKind(SyntaxKind.OPTION_STATEMENT));
        assertTrue(tree.containsKind(SyntaxKind.SUB_STATEMENT));
        // 赋值语句在过程体内，不是根的直接子节点
        assertFalse(tree.containsKind(SyntaxKind.ASSIGNMENT_STATEMENT));
        assertTrue(tree.containsKindDeep(SyntaxKind.ASSIGNMENT_STATEMENT));
        assertEquals(1, tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT).size());

        assertEquals(SyntaxKind.OPTION_STATEMENT, tree.firstChild().orElseThrow().kind());
        assertEquals(SyntaxKind.SUB_STATEMENT, tree.lastChild().orElseThrow().kind());
        assertTrue(tree.childAt(-1).isEmpty());
        assertTrue(tree.childAt(tree.childCount()).isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDescendantsInSourceOrder() {
        System.out.println("--- Running test: testDescendantsInSourceOrder ---");
        List<CstNode> assignments = tree.descendantsOfKind(SyntaxKind.ASSIGNMENT_STATEMENT);

        assertEquals(2, assignments.size());
        assertEquals("    x = 1\n", assignments.get(0).text());
        assertEquals("    y = 2\n", assignments.get(1).text());
        assertTrue(tree.descendantsOfKind(SyntaxKind.ROOT).isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNavigationIsIdempotent() {
        System.out.println("--- Running test: testNavigationIsIdempotent ---");
        assertEquals(tree.children(), tree.children());
        assertEquals(tree.descendantsOfKind(SyntaxKind.IDENTIFIER), tree.descendantsOfKind(SyntaxKind.IDENTIFIER));
        assertEquals(tree.debugTree(), tree.debugTree());
        assertEquals(tree.rootNode(), tree.rootNode());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNodeRefPositionsAndParents() {
        System.out.println("--- Running test: testNodeRefPositionsAndParents ---");
        SyntaxNodeRef root = tree.rootNode();
        int offset = SOURCE.indexOf("y = 2");

        SyntaxNodeRef token = root.elementAt(offset).orElseThrow();
        assertTrue(token.isToken());
        assertEquals(SyntaxKind.IDENTIFIER, token.kind());
        assertEquals("y", token.text());
        assertEquals(offset, token.offset());
        assertEquals(offset + 1, token.endOffset());
        assertEquals(new TextRange(offset, offset + 1), token.textRange());
        assertEquals(SOURCE.length(), root.textRange().length());

        SyntaxNodeRef statement = token.ancestorOfKind(SyntaxKind.ASSIGNMENT_STATEMENT).orElseThrow();
        assertEquals("    y = 2\n", statement.text());
        SyntaxNodeRef previous = statement.previousSibling().orElseThrow();
        assertEquals("    x = 1\n", previous.text());
        assertEquals(statement, previous.nextSibling().orElseThrow());

        assertTrue(token.ancestorOfKind(SyntaxKind.SUB_STATEMENT).isPresent());
        assertTrue(root.parent().isEmpty());
        assertTrue(root.elementAt(SOURCE.length()).isEmpty());
        assertEquals(statement.toCstNode(), tree.descendantsOfKind(SyntaxKind.ASSIGNMENT_STATEMENT).get(1));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDebugTreeFormat() {
        System.out.println("--- Running test: testDebugTreeFormat ---");
        String debug = new SourceProcessor().parse("x = 1\n").tree().debugTree();
        System.out.println(debug);

        String[] lines = debug.split("\n");
        assertEquals("ROOT@0..6", lines[0]);
        assertEquals("  ASSIGNMENT_STATEMENT@0..6", lines[1]);
        assertTrue(debug.contains("IDENTIFIER@0..1 \"x\""));
        assertTrue(debug.contains("NEWLINE@5..6 \"\\n\""));
        System.out.println("Result: Test PASSED.\n");
    }
}
