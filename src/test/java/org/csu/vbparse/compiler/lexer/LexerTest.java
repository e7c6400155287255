package org.csu.vbparse.compiler.lexer;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 *
 * 验证各种字面量、关键字大小写、注释、续行以及错误 Token 的处理，
 * 并检查所有 Token 文本拼接后与输入一致。
 */
public class LexerTest {

    private static List<Token> significant(String source) {
        return Lexer.withoutTrivia(new Lexer(source).tokenize());
    }

    private static String join(List<Token> tokens) {
        return tokens.stream().map(Token::lexeme).collect(Collectors.joining());
    }

    @Test
    public void testSimpleAssignment() {
        System.out.println("--- Running test: testSimpleAssignment ---");
        String source = "x = 42\n";
        System.out.println("Input: " + source.trim());

        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Generated Tokens: " + tokens);

        TokenType[] expectedTypes = {
                TokenType.IDENTIFIER, TokenType.WHITESPACE, TokenType.EQUAL, TokenType.WHITESPACE,
                TokenType.INTEGER_CONST, TokenType.NEWLINE, TokenType.EOF
        };
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
        assertEquals("", tokens.get(tokens.size() - 1).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testKeywordsAreCaseInsensitiveButKeepText() {
        System.out.println("--- Running test: testKeywordsAreCaseInsensitiveButKeepText ---");
        List<Token> tokens = significant("IF x tHeN End if");

        assertEquals(TokenType.IF, tokens.get(0).type());
        assertEquals("IF", tokens.get(0).lexeme());
        assertEquals(TokenType.THEN, tokens.get(2).type());
        assertEquals("tHeN", tokens.get(2).lexeme());
        assertEquals(TokenType.END, tokens.get(3).type());
        assertEquals(TokenType.IF, tokens.get(4).type());
        assertEquals("if", tokens.get(4).lexeme());
        assertEquals(TokenType.GO_TO, Lexer.lookupKeyword("GOTO"));
        assertNull(Lexer.lookupKeyword("MsgBox"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testNumericLiteralForms() {
        System.out.println("--- Running test: testNumericLiteralForms ---");
        List<Token> tokens = significant("10 10& 10% 1.5 1.5# 2.5@ 3! 1E5 1D-3 &HFF &HFF& &O17 .5");
        System.out.println("Generated Tokens: " + tokens);

        TokenType[] expected = {
                TokenType.INTEGER_CONST, TokenType.LONG_CONST, TokenType.INTEGER_CONST,
                TokenType.SINGLE_CONST, TokenType.DOUBLE_CONST, TokenType.DECIMAL_CONST,
                TokenType.SINGLE_CONST, TokenType.SINGLE_CONST, TokenType.DOUBLE_CONST,
                TokenType.INTEGER_CONST, TokenType.LONG_CONST, TokenType.INTEGER_CONST,
                TokenType.SINGLE_CONST, TokenType.EOF
        };
        assertEquals(expected.length, tokens.size());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], tokens.get(i).type(), "Token类型不匹配 at index " + i + ": " + tokens.get(i));
        }
        assertEquals("&HFF&", tokens.get(10).lexeme());
        assertEquals("1D-3", tokens.get(8).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testStringWithEscapedQuotes() {
        System.out.println("--- Running test: testStringWithEscapedQuotes ---");
        List<Token> tokens = significant("s = \"say \"\"hi\"\"\"");

        Token literal = tokens.get(2);
        assertEquals(TokenType.STRING_CONST, literal.type());
        assertEquals("\"say \"\"hi\"\"\"", literal.lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDateLiteralAndFileNumberHash() {
        System.out.println("--- Running test: testDateLiteralAndFileNumberHash ---");
        List<Token> dates = significant("d = #1/15/2024# + #12:30:00 PM#");
        assertEquals(TokenType.DATE_CONST, dates.get(2).type());
        assertEquals("#1/15/2024#", dates.get(2).lexeme());
        assertEquals(TokenType.DATE_CONST, dates.get(4).type());

        // 文件号中的 # 不是日期
        List<Token> print = significant("Print #1, x");
        assertEquals(TokenType.PRINT, print.get(0).type());
        assertEquals(TokenType.HASH, print.get(1).type());
        assertEquals(TokenType.INTEGER_CONST, print.get(2).type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testCommentsAndRem() {
        System.out.println("--- Running test: testCommentsAndRem ---");
        List<Token> tokens = new Lexer("x = 1 ' note\nRem old style\nRemove x\n").tokenize();
        System.out.println("Generated Tokens: " + tokens);

        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.COMMENT && t.lexeme().equals("' note")));
        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.REM_COMMENT && t.lexeme().equals("Rem old style")));
        // Remove 是普通标识符
        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.IDENTIFIER && t.lexeme().equals("Remove")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testBracketedIdentifierAndTypeSuffix() {
        System.out.println("--- Running test: testBracketedIdentifierAndTypeSuffix ---");
        List<Token> tokens = significant("[End] = Mid$(s, 1)");

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("[End]", tokens.get(0).lexeme());
        assertEquals(TokenType.MID, tokens.get(2).type());
        assertTrue(tokens.get(2).type().isContextual());
        assertEquals(TokenType.DOLLAR, tokens.get(3).type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnterminatedStringProducesDiagnostic() {
        System.out.println("--- Running test: testUnterminatedStringProducesDiagnostic ---");
        String source = "x = \"abc\ny = 1\n";
        Lexer lexer = new Lexer(source, "Module1.bas");
        List<Token> tokens = lexer.tokenize();

        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.ILLEGAL && t.lexeme().equals("\"abc")));
        List<Diagnostic> diagnostics = lexer.getDiagnostics();
        assertEquals(1, diagnostics.size());
        Diagnostic diagnostic = diagnostics.get(0);
        System.out.println("Diagnostic: " + diagnostic);
        assertEquals(DiagnosticKind.UNTERMINATED_STRING, diagnostic.kind());
        assertEquals(1, diagnostic.line());
        assertEquals(5, diagnostic.column());
        assertEquals("Module1.bas", diagnostic.fileName());
        assertEquals(source, join(tokens));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testUnknownCharacter() {
        System.out.println("--- Running test: testUnknownCharacter ---");
        Lexer lexer = new Lexer("a = 1 ~ 2");
        List<Token> tokens = lexer.tokenize();

        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.ILLEGAL && t.lexeme().equals("~")));
        assertEquals(DiagnosticKind.UNKNOWN_TOKEN, lexer.getDiagnostics().get(0).kind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testLineContinuationAndCrLf() {
        System.out.println("--- Running test: testLineContinuationAndCrLf ---");
        String source = "s = \"a\" & _\r\n    \"b\"\r\n";
        List<Token> tokens = new Lexer(source).tokenize();

        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.UNDERSCORE));
        assertEquals(2, tokens.stream().filter(t -> t.type() == TokenType.NEWLINE && t.lexeme().equals("\r\n")).count());
        assertEquals(source, join(tokens));
        System.out.println("Result: Test PASSED.\n");
    }
}
