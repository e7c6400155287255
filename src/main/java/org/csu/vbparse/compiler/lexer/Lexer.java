package org.csu.vbparse.compiler.lexer;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.common.model.LineIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将已解码的源文本分解为一系列的Token。
 * 空白、注释和换行同样作为 Token 输出，保证所有 Token 文本拼接后与输入完全一致。
 */
public class Lexer {

    private static final String DATE_PART =
            "\\d{1,4}\\s*[-/]\\s*\\d{1,2}(?:\\s*[-/]\\s*\\d{1,4})?"
                    + "|[A-Za-z]{3,9}\\s+\\d{1,2}\\s*,?\\s*\\d{2,4}";
    private static final String TIME_PART =
            "\\d{1,2}(?:\\s*:\\s*\\d{1,2}){1,2}(?:\\s*[AaPp][Mm])?"
                    + "|\\d{1,2}\\s*[AaPp][Mm]";
    private static final Pattern DATE_LITERAL = Pattern.compile(
            "\\s*(?:(?:" + DATE_PART + ")(?:\\s+(?:" + TIME_PART + "))?|(?:" + TIME_PART + "))\\s*");

    // 关键字映射表，键为小写形式
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        for (TokenType type : TokenType.values()) {
            if (type.isKeyword()) {
                keywords.put(type.getKeyword().toLowerCase(Locale.ROOT), type);
            }
        }
    }

    private final String input;
    private final String fileName;
    private int position = 0; // 当前读取的位置
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private LineIndex lineIndex;

    public Lexer(String input) {
        this(input, "<input>");
    }

    public Lexer(String input, String fileName) {
        this.input = input;
        this.fileName = fileName;
    }

    /**
     * 按不区分大小写的方式查找关键字。
     *
     * @return 关键字类型；不是关键字时返回 null
     */
    public static TokenType lookupKeyword(String word) {
        return keywords.get(word.toLowerCase(Locale.ROOT));
    }

    /**
     * 主方法，执行词法分析并返回所有Token，最后一个总是空文本的 EOF
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * 过滤掉空白、注释与换行，便于只关心有意义 Token 的调用方使用。
     */
    public static List<Token> withoutTrivia(List<Token> tokens) {
        List<Token> result = new ArrayList<>();
        for (Token token : tokens) {
            if (!token.isTrivia()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        if (position >= input.length()) {
            return new Token(TokenType.EOF, "");
        }

        char currentChar = peek();

        if (currentChar == '\r' || currentChar == '\n') {
            return readNewline();
        }
        if (currentChar == '\'') {
            return readToEndOfLine(TokenType.COMMENT);
        }
        if (isRemComment()) {
            return readToEndOfLine(TokenType.REM_COMMENT);
        }
        if (currentChar == '"') {
            return readString();
        }
        if (currentChar == '#') {
            Token date = readDateLiteral();
            if (date != null) {
                return date;
            }
        }
        if (isDigit(currentChar)
                || (currentChar == '.' && isDigit(peekNext()) && !previousEndsOperand())
                || (currentChar == '&' && isRadixPrefix())) {
            return readNumber();
        }
        if (Character.isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }
        if (currentChar == '[') {
            return readBracketedIdentifier();
        }
        if (isWhitespace(currentChar)) {
            return readWhitespace();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '=':
                return consumeAndReturn(TokenType.EQUAL, 1);
            case '<':
                if (peekNext() == '>') {
                    return consumeAndReturn(TokenType.NOT_EQUAL, 2);
                }
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.LESS_EQUAL, 2);
                }
                return consumeAndReturn(TokenType.LESS, 1);
            case '>':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.GREATER_EQUAL, 2);
                }
                return consumeAndReturn(TokenType.GREATER, 1);
            case '+':
                return consumeAndReturn(TokenType.PLUS, 1);
            case '-':
                return consumeAndReturn(TokenType.MINUS, 1);
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, 1);
            case '/':
                return consumeAndReturn(TokenType.SLASH, 1);
            case '\\':
                return consumeAndReturn(TokenType.BACKSLASH, 1);
            case '^':
                return consumeAndReturn(TokenType.CARET, 1);
            case '&':
                return consumeAndReturn(TokenType.AMPERSAND, 1);
            case '(':
                return consumeAndReturn(TokenType.LPAREN, 1);
            case ')':
                return consumeAndReturn(TokenType.RPAREN, 1);
            case '{':
                return consumeAndReturn(TokenType.LBRACE, 1);
            case '}':
                return consumeAndReturn(TokenType.RBRACE, 1);
            case ',':
                return consumeAndReturn(TokenType.COMMA, 1);
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, 1);
            case ':':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.COLON_EQUAL, 2);
                }
                return consumeAndReturn(TokenType.COLON, 1);
            case '.':
                return consumeAndReturn(TokenType.DOT, 1);
            case '!':
                return consumeAndReturn(TokenType.BANG, 1);
            case '#':
                return consumeAndReturn(TokenType.HASH, 1);
            case '$':
                return consumeAndReturn(TokenType.DOLLAR, 1);
            case '%':
                return consumeAndReturn(TokenType.PERCENT, 1);
            case '@':
                return consumeAndReturn(TokenType.AT, 1);
            case '_':
                return consumeAndReturn(TokenType.UNDERSCORE, 1);
            case '?':
                return consumeAndReturn(TokenType.QUESTION, 1);
            default:
                return readIllegal();
        }
    }

    private Token readNewline() {
        if (peek() == '\r' && peekNext() == '\n') {
            return consumeAndReturn(TokenType.NEWLINE, 2);
        }
        return consumeAndReturn(TokenType.NEWLINE, 1);
    }

    /**
     * 注释一直延伸到行尾，但不包含换行符本身。
     */
    private Token readToEndOfLine(TokenType type) {
        int startPos = position;
        while (position < input.length() && peek() != '\r' && peek() != '\n') {
            position++;
        }
        return new Token(type, input.substring(startPos, position));
    }

    private boolean isRemComment() {
        if (!input.regionMatches(true, position, "rem", 0, 3)) {
            return false;
        }
        if (position > 0 && (isIdentifierPart(input.charAt(position - 1)) || input.charAt(position - 1) == '.')) {
            return false;
        }
        int after = position + 3;
        if (after >= input.length()) {
            return true;
        }
        char next = input.charAt(after);
        return next == '\r' || next == '\n' || isWhitespace(next);
    }

    private Token readString() {
        int startPos = position;
        position++; // 跳过起始的双引号
        while (position < input.length()) {
            char c = peek();
            if (c == '\r' || c == '\n') {
                break;
            }
            if (c == '"') {
                if (peekNext() == '"') {
                    position += 2; // "" 表示转义的引号
                    continue;
                }
                position++;
                return new Token(TokenType.STRING_CONST, input.substring(startPos, position));
            }
            position++;
        }
        // 未闭合的字符串，作为非法 Token 延伸到行尾
        report(DiagnosticKind.UNTERMINATED_STRING, "String literal is not terminated before end of line", startPos);
        return new Token(TokenType.ILLEGAL, input.substring(startPos, position));
    }

    /**
     * 尝试读取 #...# 形式的日期/时间常量；内容不像日期时返回 null，
     * 此时 # 作为文件号标记处理。
     */
    private Token readDateLiteral() {
        int end = position + 1;
        while (end < input.length()) {
            char c = input.charAt(end);
            if (c == '#' || c == '\r' || c == '\n') {
                break;
            }
            end++;
        }
        if (end >= input.length() || input.charAt(end) != '#') {
            return null;
        }
        String content = input.substring(position + 1, end);
        if (!DATE_LITERAL.matcher(content).matches()) {
            return null;
        }
        int startPos = position;
        position = end + 1;
        return new Token(TokenType.DATE_CONST, input.substring(startPos, position));
    }

    private Token readNumber() {
        int startPos = position;
        TokenType type = TokenType.INTEGER_CONST;

        if (peek() == '&') {
            char radix = Character.toUpperCase(peekNext());
            position += 2;
            while (position < input.length() && isRadixDigit(radix, peek())) {
                position++;
            }
        } else {
            while (position < input.length() && isDigit(peek())) {
                position++;
            }
            // 检查并处理小数点，确认后面还有数字
            if (peek() == '.' && isDigit(peekNext())) {
                position++;
                while (position < input.length() && isDigit(peek())) {
                    position++;
                }
                type = TokenType.SINGLE_CONST;
            }
            char exponent = Character.toUpperCase(peek());
            if ((exponent == 'E' || exponent == 'D') && isExponentStart()) {
                position++;
                if (peek() == '+' || peek() == '-') {
                    position++;
                }
                while (position < input.length() && isDigit(peek())) {
                    position++;
                }
                type = exponent == 'D' ? TokenType.DOUBLE_CONST : TokenType.SINGLE_CONST;
            }
        }

        // 类型后缀
        char suffix = peek();
        if (suffix == '%') {
            position++;
            type = TokenType.INTEGER_CONST;
        } else if (suffix == '&' && !isIdentifierPart(peekNext())) {
            position++;
            type = TokenType.LONG_CONST;
        } else if (suffix == '!' && !Character.isLetter(peekNext())) {
            position++;
            type = TokenType.SINGLE_CONST;
        } else if (suffix == '#') {
            position++;
            type = TokenType.DOUBLE_CONST;
        } else if (suffix == '@') {
            position++;
            type = TokenType.DECIMAL_CONST;
        }
        return new Token(type, input.substring(startPos, position));
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        while (position < input.length() && isIdentifierPart(peek())) {
            position++;
        }
        String text = input.substring(startPos, position);
        // 检查是否是关键字，忽略大小写，但保留原始文本
        TokenType type = keywords.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
        return new Token(type, text);
    }

    private Token readBracketedIdentifier() {
        int end = position + 1;
        while (end < input.length()) {
            char c = input.charAt(end);
            if (c == ']' || c == '\r' || c == '\n') {
                break;
            }
            end++;
        }
        if (end >= input.length() || input.charAt(end) != ']') {
            return readIllegal();
        }
        // 被方括号包裹的内容强制视为标识符，即使它是关键字
        int startPos = position;
        position = end + 1;
        return new Token(TokenType.IDENTIFIER, input.substring(startPos, position));
    }

    private Token readWhitespace() {
        int startPos = position;
        while (position < input.length() && isWhitespace(peek())) {
            position++;
        }
        return new Token(TokenType.WHITESPACE, input.substring(startPos, position));
    }

    private Token readIllegal() {
        int startPos = position;
        position += Character.charCount(input.codePointAt(position));
        String text = input.substring(startPos, position);
        report(DiagnosticKind.UNKNOWN_TOKEN, "Unrecognized character '" + text + "'", startPos);
        return new Token(TokenType.ILLEGAL, text);
    }

    // --- 辅助方法 ---

    private void report(DiagnosticKind kind, String message, int offset) {
        if (lineIndex == null) {
            lineIndex = new LineIndex(input);
        }
        diagnostics.add(Diagnostic.at(kind, message, fileName, lineIndex, offset));
    }

    private boolean isRadixPrefix() {
        char radix = Character.toUpperCase(peekNext());
        if (radix != 'H' && radix != 'O') {
            return false;
        }
        return position + 2 < input.length() && isRadixDigit(radix, input.charAt(position + 2));
    }

    private boolean isExponentStart() {
        char next = peekNext();
        if (isDigit(next)) {
            return true;
        }
        return (next == '+' || next == '-')
                && position + 2 < input.length() && isDigit(input.charAt(position + 2));
    }

    /**
     * 形如 .5 的小数只有在前一个字符不能结束一个操作数时才成立，
     * 否则这里的 . 是成员访问。
     */
    private boolean previousEndsOperand() {
        if (position == 0) {
            return false;
        }
        char previous = input.charAt(position - 1);
        return isIdentifierPart(previous) || previous == ')' || previous == ']' || previous == '"';
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private Token consumeAndReturn(TokenType type, int length) {
        Token token = new Token(type, input.substring(position, position + length));
        position += length;
        return token;
    }

    private static boolean isWhitespace(char c) {
        if (c == '\r' || c == '\n') {
            return false;
        }
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\uFEFF' || Character.isSpaceChar(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isRadixDigit(char radix, char c) {
        if (radix == 'O') {
            return c >= '0' && c <= '7';
        }
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
