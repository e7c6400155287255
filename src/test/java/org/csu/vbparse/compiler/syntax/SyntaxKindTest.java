package org.csu.vbparse.compiler.syntax;

import org.csu.vbparse.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyntaxKind 的编号与分类测试。
 */
public class SyntaxKindTest {

    @Test
    public void testRawIdRoundTrip() {
        System.out.println("--- Running test: testRawIdRoundTrip ---");
        for (SyntaxKind kind : SyntaxKind.values()) {
            assertEquals(kind, SyntaxKind.fromRaw(kind.raw()));
        }
        assertThrows(IllegalArgumentException.class, () -> SyntaxKind.fromRaw(-1));
        assertThrows(IllegalArgumentException.class, () -> SyntaxKind.fromRaw(SyntaxKind.values().length));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testEveryTokenTypeExceptEofHasAKind() {
        System.out.println("--- Running test: testEveryTokenTypeExceptEofHasAKind ---");
        for (TokenType type : TokenType.values()) {
            if (type == TokenType.EOF) {
                assertThrows(IllegalArgumentException.class, () -> SyntaxKind.fromToken(type));
                continue;
            }
            SyntaxKind kind = SyntaxKind.fromToken(type);
            assertTrue(kind.isToken(), type + " 应映射为 Token 种类");
            assertEquals(type, kind.tokenType());
            assertEquals(type.isKeyword(), kind.isKeyword());
        }
        assertEquals(SyntaxKind.IF_KEYWORD, SyntaxKind.fromToken(TokenType.IF));
        assertEquals(SyntaxKind.IDENTIFIER, SyntaxKind.fromToken(TokenType.IDENTIFIER));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testPredicates() {
        System.out.println("--- Running test: testPredicates ---");
        assertTrue(SyntaxKind.WHITESPACE.isTrivia());
        assertTrue(SyntaxKind.COMMENT.isTrivia());
        assertFalse(SyntaxKind.IDENTIFIER.isTrivia());

        assertTrue(SyntaxKind.IF_STATEMENT.isStatement());
        assertTrue(SyntaxKind.PRINT_STATEMENT.isStatement());
        assertFalse(SyntaxKind.BINARY_EXPRESSION.isStatement());
        assertFalse(SyntaxKind.IF_KEYWORD.isStatement());

        assertTrue(SyntaxKind.ROOT.isNode());
        assertNull(SyntaxKind.ROOT.tokenType());
        System.out.println("Result: Test PASSED.\n");
    }
}
