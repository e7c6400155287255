package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.common.model.LineIndex;
import org.csu.vbparse.compiler.cst.Checkpoint;
import org.csu.vbparse.compiler.cst.TreeSink;
import org.csu.vbparse.compiler.lexer.Token;
import org.csu.vbparse.compiler.lexer.TokenType;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句解析器、表达式解析器和属性块解析器共用的底层操作：
 * 查看 Token、把 Token 原样写入语法树、记录诊断信息。
 *
 * 所有写入都经过这里，因此每个 Token 恰好被写入一次，保证往返不变式。
 */
final class SyntaxEmitter {

    private final TokenCursor cursor;
    private final TreeSink sink;
    private final ParserState state;
    private final ParserOptions options;
    private final String fileName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private LineIndex lineIndex;

    SyntaxEmitter(TokenCursor cursor, TreeSink sink, ParserState state, ParserOptions options, String fileName) {
        this.cursor = cursor;
        this.sink = sink;
        this.state = state;
        this.options = options;
        this.fileName = fileName;
    }

    TokenCursor cursor() {
        return cursor;
    }

    ParserState state() {
        return state;
    }

    ParserOptions options() {
        return options;
    }

    List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    // --- 查看 ---

    /** 第 n 个有意义 Token 的类型，跳过空白与续行 */
    TokenType nth(int n) {
        return cursor.peekSignificant(n);
    }

    Token nthToken(int n) {
        return cursor.significantToken(n);
    }

    boolean check(TokenType type) {
        return nth(0) == type;
    }

    boolean checkAny(TokenType... types) {
        TokenType next = nth(0);
        for (TokenType type : types) {
            if (next == type) {
                return true;
            }
        }
        return false;
    }

    /** 当前 Token 紧贴着（中间没有空白）是否为该类型 */
    boolean checkAdjacent(TokenType type) {
        return cursor.peek().type() == type;
    }

    /**
     * 有意义的下一个 Token 是否结束当前语句：换行、注释、冒号或输入结束；
     * 在单行 If 中 Else 也结束语句。
     */
    boolean atStatementEnd() {
        TokenType next = nth(0);
        return isLineEnd(next) || next == TokenType.COLON
                || (state.inInlineIf() && next == TokenType.ELSE);
    }

    /** 有意义的下一个 Token 是否结束当前物理行（冒号不算） */
    boolean atLineEnd() {
        return isLineEnd(nth(0));
    }

    static boolean isLineEnd(TokenType type) {
        return type == TokenType.NEWLINE || type == TokenType.EOF || type.isComment();
    }

    // --- 写入 ---

    /** 写出当前 Token，使用它自己的种类 */
    void bump() {
        Token token = cursor.advance();
        sink.token(SyntaxKind.fromToken(token.type()), token.lexeme());
    }

    /** 写出当前 Token，但使用给定的种类（例如把关键字当作标识符） */
    void bumpAs(SyntaxKind kind) {
        Token token = cursor.advance();
        sink.token(kind, token.lexeme());
    }

    /** 写出空白和续行序列，直到下一个有意义的 Token */
    void skipTrivia() {
        while (true) {
            if (cursor.peek().type() == TokenType.WHITESPACE) {
                bump();
            } else if (cursor.isContinuationAt(cursor.getPosition())) {
                bump(); // _
                if (cursor.peek().type() == TokenType.WHITESPACE) {
                    bump();
                }
                bump(); // 换行
            } else {
                return;
            }
        }
    }

    /** 如果下一个有意义 Token 是该类型，则连同前面的空白一起写出 */
    boolean match(TokenType type) {
        if (!check(type)) {
            return false;
        }
        skipTrivia();
        bump();
        return true;
    }

    boolean matchAny(TokenType... types) {
        if (!checkAny(types)) {
            return false;
        }
        skipTrivia();
        bump();
        return true;
    }

    /** 标识符或上下文关键字，作为 IDENTIFIER 写出 */
    boolean matchName() {
        if (!nth(0).isNameLike()) {
            return false;
        }
        skipTrivia();
        bumpAs(SyntaxKind.IDENTIFIER);
        return true;
    }

    /** 点号之后任何关键字都可以作为成员名 */
    boolean matchMemberName() {
        TokenType next = nth(0);
        if (next != TokenType.IDENTIFIER && !next.isKeyword()) {
            return false;
        }
        skipTrivia();
        bumpAs(SyntaxKind.IDENTIFIER);
        return true;
    }

    /** 写出到语句结束之前的所有 Token，关键字保留各自的种类 */
    void bumpUntilStatementEnd() {
        while (!atStatementEnd()) {
            skipTrivia();
            bump();
        }
    }

    // --- 树结构 ---

    void startNode(SyntaxKind kind) {
        sink.startNode(kind);
    }

    void finishNode() {
        sink.finishNode();
    }

    Checkpoint checkpoint() {
        return sink.checkpoint();
    }

    void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
        sink.startNodeAt(checkpoint, kind);
    }

    /** 写出一个空节点，用于占位缺失的表达式 */
    void emptyNode(SyntaxKind kind) {
        sink.startNode(kind);
        sink.finishNode();
    }

    // --- 诊断 ---

    /** 在下一个有意义 Token 的位置记录诊断 */
    void report(DiagnosticKind kind, String message) {
        reportAt(kind, message, cursor.offsetOf(cursor.significantIndex(0)));
    }

    void reportAt(DiagnosticKind kind, String message, int offset) {
        if (lineIndex == null) {
            lineIndex = new LineIndex(cursor.sourceText());
        }
        diagnostics.add(Diagnostic.at(kind, message, fileName, lineIndex, offset));
    }

    String describeNext() {
        Token token = nthToken(0);
        if (token.type() == TokenType.EOF) {
            return "end of input";
        }
        if (token.type() == TokenType.NEWLINE) {
            return "end of line";
        }
        return "'" + token.lexeme() + "' (" + token.type() + ")";
    }
}
