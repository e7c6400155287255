package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.compiler.lexer.TokenType;

/**
 * 正在解析的块结构。每种块知道哪些行首 Token 结束它或继续它的下一段。
 */
enum BlockContext {
    IF("End If"),
    SELECT("End Select"),
    FOR("Next"),
    FOR_EACH("Next"),
    WHILE("Wend"),
    DO("Loop"),
    WITH("End With"),
    SUB("End Sub"),
    FUNCTION("End Function"),
    PROPERTY("End Property");

    private final String terminator;

    BlockContext(String terminator) {
        this.terminator = terminator;
    }

    public String terminator() {
        return terminator;
    }

    /**
     * 以 first、second 开头的行是否是本块自己的结束行。
     */
    public boolean isClosedBy(TokenType first, TokenType second) {
        return switch (this) {
            case IF -> first == TokenType.END && second == TokenType.IF;
            case SELECT -> first == TokenType.END && second == TokenType.SELECT;
            case FOR, FOR_EACH -> first == TokenType.NEXT;
            case WHILE -> first == TokenType.WEND;
            case DO -> first == TokenType.LOOP;
            case WITH -> first == TokenType.END && second == TokenType.WITH;
            case SUB -> first == TokenType.END && second == TokenType.SUB;
            case FUNCTION -> first == TokenType.END && second == TokenType.FUNCTION;
            case PROPERTY -> first == TokenType.END && second == TokenType.PROPERTY;
        };
    }

    /**
     * 以 first、second 开头的行是否让语句列表停下：结束本块、进入本块的下一段，
     * 或者（过程块）是任何一种过程的结束行。
     */
    public boolean stopsAt(TokenType first, TokenType second) {
        return switch (this) {
            case IF -> isClosedBy(first, second) || first == TokenType.ELSE_IF || first == TokenType.ELSE;
            case SELECT -> isClosedBy(first, second) || first == TokenType.CASE;
            case SUB, FUNCTION, PROPERTY -> isProcedureEnd(first, second);
            default -> isClosedBy(first, second);
        };
    }

    public static boolean isProcedureEnd(TokenType first, TokenType second) {
        return first == TokenType.END
                && (second == TokenType.SUB || second == TokenType.FUNCTION || second == TokenType.PROPERTY);
    }
}
