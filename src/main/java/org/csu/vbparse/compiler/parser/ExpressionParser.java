package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.compiler.cst.Checkpoint;
import org.csu.vbparse.compiler.lexer.TokenType;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

/**
 * @description: 表达式解析器
 *
 * 采用优先级爬升法。二元运算符全部左结合，优先级从低到高：
 * Imp, Eqv, Xor, Or, And, Not(一元), 比较运算, &, + -, Mod, \, * /, 一元负号, ^
 *
 * 函数调用与数组下标在语法上无法区分，统一生成 CALL_EXPRESSION。
 * 只有在确定要读取下一个运算符或操作数时才写出前面的空白，
 * 表达式末尾的空白留给外层语句。
 */
class ExpressionParser {

    private static final int COMPARISON_PRECEDENCE = 7;
    private static final int EXPONENT_PRECEDENCE = 14;

    private final SyntaxEmitter emitter;

    ExpressionParser(SyntaxEmitter emitter) {
        this.emitter = emitter;
    }

    static int binaryPrecedence(TokenType type) {
        return switch (type) {
            case IMP -> 1;
            case EQV -> 2;
            case XOR -> 3;
            case OR -> 4;
            case AND -> 5;
            case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, LIKE, IS -> COMPARISON_PRECEDENCE;
            case AMPERSAND -> 8;
            case PLUS, MINUS -> 9;
            case MOD -> 10;
            case BACKSLASH -> 11;
            case ASTERISK, SLASH -> 12;
            case CARET -> EXPONENT_PRECEDENCE;
            default -> -1;
        };
    }

    /**
     * 能否开始一个表达式，用于判断可选的表达式是否存在。
     */
    boolean canStartExpression() {
        TokenType next = emitter.nth(0);
        return switch (next) {
            case LPAREN, MINUS, PLUS, NOT, NEW, TYPE_OF, ADDRESS_OF, DOT, BANG,
                 STRING_CONST, DATE_CONST, TRUE, FALSE, NOTHING, NULL, EMPTY, ME, IDENTIFIER -> true;
            default -> next.isNumericLiteral() || next.isNameLike();
        };
    }

    public void parseExpression() {
        parseBinary(0);
    }

    /**
     * 解析表达式；缺失时写出空的 MISSING_EXPRESSION 节点并记录诊断。
     */
    public void expectExpression(String context) {
        if (!canStartExpression()) {
            emitter.report(DiagnosticKind.MISSING_EXPRESSION,
                    "Expected an expression " + context + " but found " + emitter.describeNext());
            emitter.emptyNode(SyntaxKind.MISSING_EXPRESSION);
            return;
        }
        parseExpression();
    }

    /**
     * 赋值目标、For 循环变量、Call 目标等位置：只允许名字、成员访问和调用，
     * 不解析二元运算符，这样 x = 1 中的 = 不会被当成比较。
     */
    public boolean parseTarget() {
        TokenType next = emitter.nth(0);
        if (next != TokenType.DOT && next != TokenType.BANG && next != TokenType.ME
                && !next.isNameLike()) {
            return false;
        }
        emitter.skipTrivia();
        parsePostfix();
        return true;
    }

    private void parseBinary(int minPrecedence) {
        ParserState state = emitter.state();
        if (!state.enter(emitter.options().maxNestingDepth())) {
            emitter.report(DiagnosticKind.NESTING_TOO_DEEP, "Expression nesting exceeds "
                    + emitter.options().maxNestingDepth() + " levels");
            emitter.emptyNode(SyntaxKind.MISSING_EXPRESSION);
            return;
        }
        try {
            emitter.skipTrivia();
            Checkpoint checkpoint = emitter.checkpoint();
            parseUnary();
            while (true) {
                TokenType operator = emitter.nth(0);
                int precedence = binaryPrecedence(operator);
                if (precedence < 0 || precedence < minPrecedence) {
                    break;
                }
                emitter.skipTrivia();
                emitter.bump();
                // 左结合：右操作数只接受更高优先级的运算符
                parseOperand(precedence + 1);
                emitter.startNodeAt(checkpoint, SyntaxKind.BINARY_EXPRESSION);
                emitter.finishNode();
            }
        } finally {
            state.exit();
        }
    }

    private void parseOperand(int minPrecedence) {
        if (!canStartExpression()) {
            emitter.report(DiagnosticKind.MISSING_EXPRESSION,
                    "Expected an operand but found " + emitter.describeNext());
            emitter.emptyNode(SyntaxKind.MISSING_EXPRESSION);
            return;
        }
        parseBinary(minPrecedence);
    }

    private void parseUnary() {
        TokenType next = emitter.nth(0);
        switch (next) {
            case NOT -> {
                emitter.startNode(SyntaxKind.UNARY_EXPRESSION);
                emitter.bump();
                // Not 的优先级低于比较运算：Not a = b 即 Not (a = b)
                parseOperand(COMPARISON_PRECEDENCE);
                emitter.finishNode();
            }
            case MINUS, PLUS -> {
                emitter.startNode(SyntaxKind.UNARY_EXPRESSION);
                emitter.bump();
                // -2 ^ 2 即 -(2 ^ 2)
                parseOperand(EXPONENT_PRECEDENCE);
                emitter.finishNode();
            }
            case ADDRESS_OF -> {
                emitter.startNode(SyntaxKind.ADDRESS_OF_EXPRESSION);
                emitter.bump();
                if (!parseTarget()) {
                    missingOperand("after AddressOf");
                }
                emitter.finishNode();
            }
            case NEW -> {
                emitter.startNode(SyntaxKind.NEW_EXPRESSION);
                emitter.bump();
                parseTypeName();
                emitter.finishNode();
            }
            case TYPE_OF -> {
                emitter.startNode(SyntaxKind.TYPE_OF_EXPRESSION);
                emitter.bump();
                if (!parseTarget()) {
                    missingOperand("after TypeOf");
                }
                if (emitter.match(TokenType.IS)) {
                    parseTypeName();
                }
                emitter.finishNode();
            }
            default -> parsePostfix();
        }
    }

    /**
     * 基本表达式之后跟随的成员访问（. 或 !）和紧贴的括号参数表。
     */
    private void parsePostfix() {
        Checkpoint checkpoint = emitter.checkpoint();
        parsePrimary();
        while (true) {
            if (emitter.checkAdjacent(TokenType.DOT) || isBangAccess()) {
                emitter.bump();
                emitter.matchMemberName();
                emitter.startNodeAt(checkpoint, SyntaxKind.MEMBER_ACCESS_EXPRESSION);
                emitter.finishNode();
            } else if (emitter.checkAdjacent(TokenType.LPAREN)) {
                parseArgumentList();
                emitter.startNodeAt(checkpoint, SyntaxKind.CALL_EXPRESSION);
                emitter.finishNode();
            } else {
                return;
            }
        }
    }

    private void parsePrimary() {
        TokenType next = emitter.nth(0);
        if (next == TokenType.LPAREN) {
            emitter.startNode(SyntaxKind.PARENTHESIZED_EXPRESSION);
            emitter.bump();
            parseOperand(0);
            if (!emitter.match(TokenType.RPAREN)) {
                emitter.report(DiagnosticKind.UNEXPECTED_TOKEN, "Expected ')' but found " + emitter.describeNext());
            }
            emitter.finishNode();
        } else if (next.isNumericLiteral()) {
            literal(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
        } else if (next == TokenType.STRING_CONST) {
            literal(SyntaxKind.STRING_LITERAL_EXPRESSION);
        } else if (next == TokenType.TRUE || next == TokenType.FALSE) {
            literal(SyntaxKind.BOOLEAN_LITERAL_EXPRESSION);
        } else if (next == TokenType.DATE_CONST || next == TokenType.NOTHING
                || next == TokenType.NULL || next == TokenType.EMPTY) {
            literal(SyntaxKind.LITERAL_EXPRESSION);
        } else if (next == TokenType.DOT || next == TokenType.BANG) {
            // With 块中省略对象的成员访问
            emitter.startNode(SyntaxKind.MEMBER_ACCESS_EXPRESSION);
            emitter.bump();
            emitter.matchMemberName();
            emitter.finishNode();
        } else if (next == TokenType.ME) {
            emitter.startNode(SyntaxKind.IDENTIFIER_EXPRESSION);
            emitter.bump();
            emitter.finishNode();
        } else if (next.isNameLike()) {
            emitter.startNode(SyntaxKind.IDENTIFIER_EXPRESSION);
            emitter.bumpAs(SyntaxKind.IDENTIFIER);
            matchTypeSuffix();
            emitter.finishNode();
        } else {
            missingOperand("");
        }
    }

    private void literal(SyntaxKind kind) {
        emitter.startNode(kind);
        emitter.bump();
        emitter.finishNode();
    }

    private void missingOperand(String context) {
        emitter.report(DiagnosticKind.MISSING_EXPRESSION,
                "Expected an expression" + (context.isEmpty() ? "" : " " + context)
                        + " but found " + emitter.describeNext());
        emitter.emptyNode(SyntaxKind.MISSING_EXPRESSION);
    }

    /**
     * 名字后面紧贴的类型后缀：$ % & ! # @。
     * ! 后面还跟着名字时是成员访问；& 后面紧跟操作数时是连接运算符。
     */
    private void matchTypeSuffix() {
        TokenCursor cursor = emitter.cursor();
        TokenType suffix = cursor.peek().type();
        TokenType after = cursor.typeAt(cursor.getPosition() + 1);
        boolean isSuffix = switch (suffix) {
            case DOLLAR, PERCENT, HASH, AT -> true;
            case BANG -> after != TokenType.IDENTIFIER && !after.isKeyword();
            case AMPERSAND -> after != TokenType.IDENTIFIER && !after.isKeyword()
                    && !after.isNumericLiteral() && after != TokenType.STRING_CONST && after != TokenType.LPAREN;
            default -> false;
        };
        if (isSuffix) {
            emitter.bump();
        }
    }

    private boolean isBangAccess() {
        TokenCursor cursor = emitter.cursor();
        if (cursor.peek().type() != TokenType.BANG) {
            return false;
        }
        TokenType after = cursor.typeAt(cursor.getPosition() + 1);
        return after == TokenType.IDENTIFIER || after.isKeyword();
    }

    /**
     * 紧贴在被调用者后面的 ( 参数, ... )。空参数（如 f(a, , b)）生成空的 ARGUMENT 节点。
     */
    void parseArgumentList() {
        emitter.startNode(SyntaxKind.ARGUMENT_LIST);
        emitter.bump(); // (
        if (emitter.match(TokenType.RPAREN)) {
            emitter.finishNode();
            return;
        }
        while (true) {
            parseArgument();
            if (emitter.match(TokenType.COMMA)) {
                continue;
            }
            if (!emitter.match(TokenType.RPAREN)) {
                emitter.report(DiagnosticKind.UNEXPECTED_TOKEN,
                        "Expected ',' or ')' in argument list but found " + emitter.describeNext());
            }
            break;
        }
        emitter.finishNode();
    }

    /**
     * 不带括号的参数表，例如 Foo a, b 或 Debug.Print a; b。
     * 允许用 , 或 ; 分隔，允许空参数和末尾多余的分隔符。
     */
    void parseBareArgumentList() {
        emitter.startNode(SyntaxKind.ARGUMENT_LIST);
        while (!emitter.atStatementEnd()) {
            if (emitter.checkAny(TokenType.COMMA, TokenType.SEMICOLON)) {
                emitter.skipTrivia();
                emitter.bump();
                continue;
            }
            if (!canStartArgument()) {
                break;
            }
            parseArgument();
        }
        emitter.finishNode();
    }

    private boolean canStartArgument() {
        return canStartExpression() || emitter.checkAny(TokenType.BY_VAL, TokenType.BY_REF);
    }

    private void parseArgument() {
        emitter.startNode(SyntaxKind.ARGUMENT);
        if (emitter.checkAny(TokenType.COMMA, TokenType.RPAREN)) {
            emitter.finishNode();
            return;
        }
        emitter.matchAny(TokenType.BY_VAL, TokenType.BY_REF);
        if (emitter.nth(0).isNameLike() && emitter.nth(1) == TokenType.COLON_EQUAL) {
            emitter.matchName();
            emitter.match(TokenType.COLON_EQUAL);
        }
        emitter.skipTrivia();
        parseOperand(0);
        emitter.finishNode();
    }

    /**
     * 类型名：内置类型关键字，或以点号连接的名字（如 ADODB.Recordset）。
     */
    void parseTypeName() {
        TokenType next = emitter.nth(0);
        if (next == TokenType.IDENTIFIER || next.isKeyword()) {
            emitter.skipTrivia();
            if (next.isNameLike()) {
                emitter.bumpAs(SyntaxKind.IDENTIFIER);
            } else {
                emitter.bump();
            }
            while (emitter.checkAdjacent(TokenType.DOT)) {
                emitter.bump();
                emitter.matchMemberName();
            }
        } else {
            missingOperand("for a type name");
        }
    }
}
