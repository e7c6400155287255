package org.csu.vbparse.compiler.parser;

import lombok.Getter;
import org.csu.vbparse.compiler.lexer.Token;
import org.csu.vbparse.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Token 流上的只进游标。
 *
 * Token 自身不保存位置，这里用前缀和推导每个 Token 的起始偏移。
 * “有意义的” Token 指跳过空白和续行符（_ 加换行）之后看到的 Token；
 * 注释和普通换行仍然有意义，因为它们结束一条语句。
 */
public class TokenCursor {

    private final List<Token> tokens;
    private final int[] offsets;
    @Getter
    private int position = 0;

    public TokenCursor(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            copy.add(new Token(TokenType.EOF, ""));
        }
        this.tokens = copy;
        this.offsets = new int[copy.size() + 1];
        for (int i = 0; i < copy.size(); i++) {
            offsets[i + 1] = offsets[i] + copy.get(i).lexeme().length();
        }
    }

    public Token peek() {
        return tokens.get(position);
    }

    public Token tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    public TokenType typeAt(int index) {
        return tokenAt(index).type();
    }

    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            position++;
        }
        return token;
    }

    public int offset() {
        return offsets[position];
    }

    public int offsetOf(int index) {
        return offsets[Math.min(index, tokens.size() - 1)];
    }

    /**
     * @return 从当前位置开始第 n 个（从 0 计）有意义 Token 的下标
     */
    public int significantIndex(int n) {
        int index = skipInsignificant(position);
        for (int i = 0; i < n && typeAt(index) != TokenType.EOF; i++) {
            index = skipInsignificant(index + 1);
        }
        return index;
    }

    public TokenType peekSignificant(int n) {
        return typeAt(significantIndex(n));
    }

    public Token significantToken(int n) {
        return tokenAt(significantIndex(n));
    }

    /**
     * 下标处是否为续行序列的开始：_ 后面（可有空白）紧跟换行。
     */
    public boolean isContinuationAt(int index) {
        if (typeAt(index) != TokenType.UNDERSCORE) {
            return false;
        }
        int next = index + 1;
        if (typeAt(next) == TokenType.WHITESPACE) {
            next++;
        }
        return typeAt(next) == TokenType.NEWLINE;
    }

    /**
     * 当前位置之前（忽略空白）是否为行首。
     */
    public boolean atLineStart() {
        int index = position - 1;
        while (index >= 0 && typeAt(index) == TokenType.WHITESPACE) {
            index--;
        }
        return index < 0 || typeAt(index) == TokenType.NEWLINE;
    }

    /**
     * 重新拼接出完整的源文本。
     */
    public String sourceText() {
        StringBuilder sb = new StringBuilder(offsets[tokens.size()]);
        for (Token token : tokens) {
            sb.append(token.lexeme());
        }
        return sb.toString();
    }

    private int skipInsignificant(int index) {
        while (true) {
            TokenType type = typeAt(index);
            if (type == TokenType.WHITESPACE) {
                index++;
            } else if (isContinuationAt(index)) {
                index++;
                if (typeAt(index) == TokenType.WHITESPACE) {
                    index++;
                }
                index++; // 换行
            } else {
                return index;
            }
        }
    }
}
