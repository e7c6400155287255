package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.compiler.cst.TreeSink;
import org.csu.vbparse.compiler.lexer.Lexer;
import org.csu.vbparse.compiler.syntax.SyntaxKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.mockito.invocation.Invocation;

import java.util.Collection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 使用 Mock 的 TreeSink 隔离树的构建，只检查解析器发出的事件序列。
 */
public class ParserSinkSequenceTest {

    private TreeSink mockSink;

    @BeforeEach
    void setUp() {
        // checkpoint() 在 Mock 中返回 null，解析器只负责原样传回
        mockSink = Mockito.mock(TreeSink.class);
    }

    private void parse(String source) {
        new Parser(new Lexer(source).tokenize(), mockSink, ParserOptions.defaults(), "Mock.bas").parse();
    }

    @Test
    void testAssignmentEventSequence() {
        System.out.println("--- Running test: testAssignmentEventSequence ---");
        parse("x = 1\n");

        InOrder order = inOrder(mockSink);
        order.verify(mockSink).startNode(SyntaxKind.ROOT);
        order.verify(mockSink).startNode(SyntaxKind.IDENTIFIER_EXPRESSION);
        order.verify(mockSink).token(SyntaxKind.IDENTIFIER, "x");
        order.verify(mockSink).token(SyntaxKind.EQUAL, "=");
        order.verify(mockSink).startNode(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
        order.verify(mockSink).token(SyntaxKind.INTEGER_CONST, "1");
        order.verify(mockSink).token(SyntaxKind.NEWLINE, "\n");
        order.verify(mockSink).startNodeAt(isNull(), eq(SyntaxKind.ASSIGNMENT_STATEMENT));

        verify(mockSink, times(2)).token(SyntaxKind.WHITESPACE, " ");
        verify(mockSink, times(4)).finishNode();
        // 文件结束标记不会写入树中
        verify(mockSink, never()).token(any(), eq(""));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEveryStartedNodeIsFinished() {
        System.out.println("--- Running test: testEveryStartedNodeIsFinished ---");
        String source = "Sub Main()\n    If a Then b = 1 Else c\n    Select Case n\n    Case 1\n    End Select\n"
                + "    x = = (1\nEnd Function\nWend\n";
        parse(source);

        Collection<Invocation> invocations = Mockito.mockingDetails(mockSink).getInvocations();
        long started = invocations.stream()
                .filter(i -> i.getMethod().getName().startsWith("startNode"))
                .count();
        long finished = invocations.stream()
                .filter(i -> i.getMethod().getName().equals("finishNode"))
                .count();
        assertEquals(started, finished, "startNode 与 finishNode 必须成对出现");

        StringBuilder text = new StringBuilder();
        invocations.stream()
                .filter(i -> i.getMethod().getName().equals("token"))
                .forEach(i -> text.append((String) i.getArgument(1)));
        assertEquals(source, text.toString(), "所有 Token 按顺序恰好写出一次");
        System.out.println("Result: Test PASSED.\n");
    }
}
