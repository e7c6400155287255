package org.csu.vbparse.compiler.lexer;

/**
 * 词法单元。位置不随 Token 保存，而是由它在 Token 流中的顺序推导。
 *
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本，保留原始大小写和定界符
 */
public record Token(TokenType type, String lexeme) {

    public boolean isTrivia() {
        return type.isTrivia();
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-15s, Lexeme='%s']", type, escape(lexeme));
    }

    private static String escape(String text) {
        return text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
    }
}
