package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.compiler.lexer.TokenType;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * 浅解析的内置语句：关键字之后直到语句结束符的所有 Token 都作为语句节点的扁平子元素，
 * 不建立表达式结构。
 *
 * 需要结构化参数的语句应从这里移到 {@link StatementRule} 并编写独立的解析方法。
 */
enum LibraryStatement {
    APP_ACTIVATE(TokenType.APP_ACTIVATE, SyntaxKind.APP_ACTIVATE_STATEMENT),
    BEEP(TokenType.BEEP, SyntaxKind.BEEP_STATEMENT),
    CH_DIR(TokenType.CH_DIR, SyntaxKind.CH_DIR_STATEMENT),
    CH_DRIVE(TokenType.CH_DRIVE, SyntaxKind.CH_DRIVE_STATEMENT),
    CLOSE(TokenType.CLOSE, SyntaxKind.CLOSE_STATEMENT),
    DATE(TokenType.DATE, SyntaxKind.DATE_STATEMENT),
    DELETE_SETTING(TokenType.DELETE_SETTING, SyntaxKind.DELETE_SETTING_STATEMENT),
    ERROR(TokenType.ERROR, SyntaxKind.ERROR_STATEMENT),
    FILE_COPY(TokenType.FILE_COPY, SyntaxKind.FILE_COPY_STATEMENT),
    GET(TokenType.GET, SyntaxKind.GET_STATEMENT),
    INPUT(TokenType.INPUT, SyntaxKind.INPUT_STATEMENT),
    KILL(TokenType.KILL, SyntaxKind.KILL_STATEMENT),
    LINE_INPUT(TokenType.LINE, SyntaxKind.LINE_INPUT_STATEMENT),
    LOAD(TokenType.LOAD, SyntaxKind.LOAD_STATEMENT),
    LOCK(TokenType.LOCK, SyntaxKind.LOCK_STATEMENT),
    LSET(TokenType.LSET, SyntaxKind.LSET_STATEMENT),
    MID(TokenType.MID, SyntaxKind.MID_STATEMENT),
    MID_B(TokenType.MID_B, SyntaxKind.MID_B_STATEMENT),
    MK_DIR(TokenType.MK_DIR, SyntaxKind.MK_DIR_STATEMENT),
    NAME(TokenType.NAME, SyntaxKind.NAME_STATEMENT),
    OPEN(TokenType.OPEN, SyntaxKind.OPEN_STATEMENT),
    PRINT(TokenType.PRINT, SyntaxKind.PRINT_STATEMENT),
    PUT(TokenType.PUT, SyntaxKind.PUT_STATEMENT),
    RANDOMIZE(TokenType.RANDOMIZE, SyntaxKind.RANDOMIZE_STATEMENT),
    RESET(TokenType.RESET, SyntaxKind.RESET_STATEMENT),
    RM_DIR(TokenType.RM_DIR, SyntaxKind.RM_DIR_STATEMENT),
    RSET(TokenType.RSET, SyntaxKind.RSET_STATEMENT),
    SAVE_PICTURE(TokenType.SAVE_PICTURE, SyntaxKind.SAVE_PICTURE_STATEMENT),
    SAVE_SETTING(TokenType.SAVE_SETTING, SyntaxKind.SAVE_SETTING_STATEMENT),
    SEEK(TokenType.SEEK, SyntaxKind.SEEK_STATEMENT),
    SEND_KEYS(TokenType.SEND_KEYS, SyntaxKind.SEND_KEYS_STATEMENT),
    SET_ATTR(TokenType.SET_ATTR, SyntaxKind.SET_ATTR_STATEMENT),
    STOP(TokenType.STOP, SyntaxKind.STOP_STATEMENT),
    TIME(TokenType.TIME, SyntaxKind.TIME_STATEMENT),
    UNLOAD(TokenType.UNLOAD, SyntaxKind.UNLOAD_STATEMENT),
    UNLOCK(TokenType.UNLOCK, SyntaxKind.UNLOCK_STATEMENT),
    WIDTH(TokenType.WIDTH, SyntaxKind.WIDTH_STATEMENT),
    WRITE(TokenType.WRITE, SyntaxKind.WRITE_STATEMENT),

    DEF_BOOL(TokenType.DEF_BOOL, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_BYTE(TokenType.DEF_BYTE, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_CUR(TokenType.DEF_CUR, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_DATE(TokenType.DEF_DATE, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_DBL(TokenType.DEF_DBL, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_DEC(TokenType.DEF_DEC, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_INT(TokenType.DEF_INT, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_LNG(TokenType.DEF_LNG, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_OBJ(TokenType.DEF_OBJ, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_SNG(TokenType.DEF_SNG, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_STR(TokenType.DEF_STR, SyntaxKind.DEF_TYPE_STATEMENT),
    DEF_VAR(TokenType.DEF_VAR, SyntaxKind.DEF_TYPE_STATEMENT);

    private static final Map<TokenType, LibraryStatement> BY_KEYWORD = new EnumMap<>(TokenType.class);

    static {
        for (LibraryStatement statement : values()) {
            BY_KEYWORD.put(statement.keyword, statement);
        }
    }

    private final TokenType keyword;
    private final SyntaxKind kind;

    LibraryStatement(TokenType keyword, SyntaxKind kind) {
        this.keyword = keyword;
        this.kind = kind;
    }

    public TokenType keyword() {
        return keyword;
    }

    public SyntaxKind kind() {
        return kind;
    }

    /**
     * Date = ... 与 Time = ... 本身就是赋值形式的语句；
     * 其它关键字后面紧跟 = 时是对同名属性的普通赋值。
     */
    public boolean isAssignmentForm() {
        return this == DATE || this == TIME;
    }

    /**
     * @return 该关键字开头的浅解析语句；不是库语句关键字时返回 null
     */
    public static LibraryStatement forKeyword(TokenType keyword) {
        return BY_KEYWORD.get(keyword);
    }
}
