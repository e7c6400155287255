package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.compiler.cst.Checkpoint;
import org.csu.vbparse.compiler.lexer.TokenType;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

/**
 * @description: 窗体文件头中 Begin ... End 属性块的解析器
 *
 * Begin VB.Form frmMain
 *    Caption         =   "Main"
 *    BeginProperty Font {0BE35203-8F91-11CE-9DE3-00AA004BB851}
 *       Name            =   "Tahoma"
 *    EndProperty
 *    Begin VB.CommandButton cmdOk
 *       ...
 *    End
 * End
 */
class PropertyBlockParser {

    private final SyntaxEmitter emitter;

    PropertyBlockParser(SyntaxEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * 写出从 Begin 行到对应 End 行的全部内容，外层节点由调用者包装。
     */
    void parseBlockContents() {
        emitter.match(TokenType.BEGIN);
        if (startsName()) {
            emitter.skipTrivia();
            emitter.startNode(SyntaxKind.PROPERTIES_TYPE);
            emitter.bumpAs(SyntaxKind.IDENTIFIER);
            while (emitter.checkAdjacent(TokenType.DOT)) {
                emitter.bump();
                emitter.matchMemberName();
            }
            emitter.finishNode();
            if (startsName()) {
                emitter.skipTrivia();
                emitter.startNode(SyntaxKind.PROPERTIES_NAME);
                emitter.bumpAs(SyntaxKind.IDENTIFIER);
                emitter.finishNode();
            }
        }
        endLine();
        parseMembers(TokenType.END, "End");
    }

    private boolean startsName() {
        TokenType next = emitter.nth(0);
        return next == TokenType.IDENTIFIER || next.isKeyword();
    }

    /**
     * 逐行解析成员，直到遇到 terminator 所在的行。
     */
    private void parseMembers(TokenType terminator, String terminatorText) {
        while (true) {
            skipBlankLines();
            TokenType first = emitter.nth(0);
            if (first == TokenType.EOF) {
                emitter.report(DiagnosticKind.MISSING_BLOCK_TERMINATOR,
                        "Missing '" + terminatorText + "' for property block");
                return;
            }
            if (first == terminator) {
                emitter.skipTrivia();
                emitter.bump();
                endLine();
                return;
            }
            if (terminator == TokenType.END_PROPERTY && first == TokenType.END) {
                // 外层块的 End 提前出现，组没有闭合
                emitter.report(DiagnosticKind.MISSING_BLOCK_TERMINATOR,
                        "Missing 'EndProperty' before 'End'");
                return;
            }
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.skipTrivia();
            SyntaxKind kind = switch (first) {
                case BEGIN -> parseNestedBlock();
                case BEGIN_PROPERTY -> parseGroup();
                case END_PROPERTY -> parseStrayLine("'EndProperty' without 'BeginProperty'");
                default -> parseProperty();
            };
            emitter.startNodeAt(checkpoint, kind);
            emitter.finishNode();
        }
    }

    private SyntaxKind parseNestedBlock() {
        ParserState state = emitter.state();
        int maxDepth = emitter.options().maxNestingDepth();
        if (!state.enter(maxDepth)) {
            emitter.report(DiagnosticKind.NESTING_TOO_DEEP, "Property blocks nested deeper than " + maxDepth + " levels");
            return parseProperty();
        }
        parseBlockContents();
        state.exit();
        return SyntaxKind.PROPERTIES_BLOCK;
    }

    private SyntaxKind parseGroup() {
        emitter.bump(); // BeginProperty
        if (startsName()) {
            emitter.skipTrivia();
            emitter.startNode(SyntaxKind.PROPERTY_GROUP_NAME);
            emitter.bumpAs(SyntaxKind.IDENTIFIER);
            emitter.finishNode();
        }
        // 可选的 {GUID} 保持扁平
        bumpUntilLineEnd();
        endLine();
        parseMembers(TokenType.END_PROPERTY, "EndProperty");
        return SyntaxKind.PROPERTY_GROUP;
    }

    private SyntaxKind parseStrayLine(String message) {
        emitter.report(DiagnosticKind.UNEXPECTED_TOKEN, message);
        bumpUntilLineEnd();
        endLine();
        return SyntaxKind.UNKNOWN;
    }

    /**
     * 键 = 值。键由连续的非空白 Token 组成；值到行尾为止，不含尾部空白和注释。
     */
    private SyntaxKind parseProperty() {
        TokenCursor cursor = emitter.cursor();
        emitter.startNode(SyntaxKind.PROPERTY_KEY);
        while (true) {
            TokenType type = cursor.peek().type();
            if (type == TokenType.WHITESPACE || type == TokenType.EQUAL || SyntaxEmitter.isLineEnd(type)
                    || cursor.isContinuationAt(cursor.getPosition())) {
                break;
            }
            if (type.isKeyword()) {
                emitter.bumpAs(SyntaxKind.IDENTIFIER);
            } else {
                emitter.bump();
            }
        }
        emitter.finishNode();

        if (emitter.match(TokenType.EQUAL)) {
            emitter.skipTrivia();
            emitter.startNode(SyntaxKind.PROPERTY_VALUE);
            while (true) {
                TokenType type = cursor.peek().type();
                if (SyntaxEmitter.isLineEnd(type)) {
                    break;
                }
                if (type == TokenType.WHITESPACE && SyntaxEmitter.isLineEnd(cursor.typeAt(cursor.getPosition() + 1))) {
                    break;
                }
                emitter.bump();
            }
            emitter.finishNode();
        } else if (!emitter.atLineEnd()) {
            emitter.report(DiagnosticKind.UNEXPECTED_TOKEN,
                    "Expected '=' in property line but found " + emitter.describeNext());
        }
        endLine();
        return SyntaxKind.PROPERTY;
    }

    private void bumpUntilLineEnd() {
        while (!emitter.atLineEnd()) {
            emitter.skipTrivia();
            emitter.bump();
        }
    }

    /**
     * 行尾：多余的 Token 记一次诊断后并入当前节点，然后是空白、注释和换行。
     */
    private void endLine() {
        if (!emitter.atLineEnd()) {
            emitter.report(DiagnosticKind.UNEXPECTED_TOKEN, "Unexpected " + emitter.describeNext() + " in property block");
            bumpUntilLineEnd();
        }
        emitter.skipTrivia();
        if (emitter.cursor().peek().type().isComment()) {
            emitter.bump();
        }
        if (emitter.cursor().peek().type() == TokenType.NEWLINE) {
            emitter.bump();
        }
    }

    private void skipBlankLines() {
        while (true) {
            TokenType next = emitter.nth(0);
            if (next != TokenType.NEWLINE && !next.isComment()) {
                return;
            }
            emitter.skipTrivia();
            if (next.isComment()) {
                emitter.bump();
            }
            if (emitter.cursor().peek().type() == TokenType.NEWLINE) {
                emitter.bump();
            }
        }
    }
}
