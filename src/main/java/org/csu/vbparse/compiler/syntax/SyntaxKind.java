package org.csu.vbparse.compiler.syntax;

import org.csu.vbparse.compiler.lexer.TokenType;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 语法种类的封闭集合：每一种节点（语句、子句、表达式）加上每一种 Token 类别。
 *
 * 树中只保存 {@link #raw()} 得到的稠密整数编号，{@link #fromRaw(int)} 是它的逆运算。
 * Token 种类与 {@link TokenType} 一一对应，关键字统一加 _KEYWORD 后缀。
 */
public enum SyntaxKind {
    // ---- 结构节点 ----
    ROOT,
    STATEMENT_LIST,
    UNKNOWN,
    MISSING_EXPRESSION,

    // ---- 文件头 ----
    VERSION_STATEMENT,
    OBJECT_STATEMENT,
    ATTRIBUTE_STATEMENT,
    OPTION_STATEMENT,
    PROPERTIES_BLOCK,
    PROPERTIES_TYPE,
    PROPERTIES_NAME,
    PROPERTY,
    PROPERTY_KEY,
    PROPERTY_VALUE,
    PROPERTY_GROUP,
    PROPERTY_GROUP_NAME,

    // ---- 声明 ----
    DIM_STATEMENT,
    VARIABLE_DECLARATION,
    ARRAY_BOUNDS,
    ARRAY_BOUND,
    AS_CLAUSE,
    CONST_STATEMENT,
    CONST_DECLARATION,
    RE_DIM_STATEMENT,
    ERASE_STATEMENT,
    TYPE_STATEMENT,
    TYPE_MEMBER,
    ENUM_STATEMENT,
    ENUM_MEMBER,
    DECLARE_STATEMENT,
    EVENT_STATEMENT,
    IMPLEMENTS_STATEMENT,
    DEF_TYPE_STATEMENT,

    // ---- 过程 ----
    SUB_STATEMENT,
    FUNCTION_STATEMENT,
    PROPERTY_STATEMENT,
    PARAMETER_LIST,
    PARAMETER,

    // ---- 控制流 ----
    IF_STATEMENT,
    ELSE_IF_CLAUSE,
    ELSE_CLAUSE,
    SELECT_CASE_STATEMENT,
    CASE_CLAUSE,
    CASE_ELSE_CLAUSE,
    FOR_STATEMENT,
    FOR_EACH_STATEMENT,
    WHILE_STATEMENT,
    DO_STATEMENT,
    WITH_STATEMENT,
    GO_TO_STATEMENT,
    GO_SUB_STATEMENT,
    RETURN_STATEMENT,
    RESUME_STATEMENT,
    EXIT_STATEMENT,
    ON_ERROR_STATEMENT,
    ON_GO_TO_STATEMENT,
    ON_GO_SUB_STATEMENT,
    END_STATEMENT,
    LABEL_STATEMENT,

    // ---- 赋值与调用 ----
    ASSIGNMENT_STATEMENT,
    LET_STATEMENT,
    SET_STATEMENT,
    CALL_STATEMENT,
    RAISE_EVENT_STATEMENT,

    // ---- 浅解析的库语句 ----
    APP_ACTIVATE_STATEMENT,
    BEEP_STATEMENT,
    CH_DIR_STATEMENT,
    CH_DRIVE_STATEMENT,
    CLOSE_STATEMENT,
    DATE_STATEMENT,
    DELETE_SETTING_STATEMENT,
    ERROR_STATEMENT,
    FILE_COPY_STATEMENT,
    GET_STATEMENT,
    INPUT_STATEMENT,
    KILL_STATEMENT,
    LINE_INPUT_STATEMENT,
    LOAD_STATEMENT,
    LOCK_STATEMENT,
    LSET_STATEMENT,
    MID_STATEMENT,
    MID_B_STATEMENT,
    MK_DIR_STATEMENT,
    NAME_STATEMENT,
    OPEN_STATEMENT,
    PRINT_STATEMENT,
    PUT_STATEMENT,
    RANDOMIZE_STATEMENT,
    RESET_STATEMENT,
    RM_DIR_STATEMENT,
    RSET_STATEMENT,
    SAVE_PICTURE_STATEMENT,
    SAVE_SETTING_STATEMENT,
    SEEK_STATEMENT,
    SEND_KEYS_STATEMENT,
    SET_ATTR_STATEMENT,
    STOP_STATEMENT,
    TIME_STATEMENT,
    UNLOAD_STATEMENT,
    UNLOCK_STATEMENT,
    WIDTH_STATEMENT,
    WRITE_STATEMENT,

    // ---- 表达式 ----
    BINARY_EXPRESSION,
    UNARY_EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    LITERAL_EXPRESSION,
    NUMERIC_LITERAL_EXPRESSION,
    STRING_LITERAL_EXPRESSION,
    BOOLEAN_LITERAL_EXPRESSION,
    IDENTIFIER_EXPRESSION,
    MEMBER_ACCESS_EXPRESSION,
    CALL_EXPRESSION,
    ARGUMENT_LIST,
    ARGUMENT,
    NEW_EXPRESSION,
    TYPE_OF_EXPRESSION,
    ADDRESS_OF_EXPRESSION,

    // ---- 关键字 Token ----
    ACCESS_KEYWORD,
    ADDRESS_OF_KEYWORD,
    ALIAS_KEYWORD,
    AND_KEYWORD,
    APP_ACTIVATE_KEYWORD,
    APPEND_KEYWORD,
    AS_KEYWORD,
    ATTRIBUTE_KEYWORD,
    BASE_KEYWORD,
    BEEP_KEYWORD,
    BEGIN_KEYWORD,
    BEGIN_PROPERTY_KEYWORD,
    BINARY_KEYWORD,
    BOOLEAN_KEYWORD,
    BY_REF_KEYWORD,
    BY_VAL_KEYWORD,
    BYTE_KEYWORD,
    CALL_KEYWORD,
    CASE_KEYWORD,
    CH_DIR_KEYWORD,
    CH_DRIVE_KEYWORD,
    CLASS_KEYWORD,
    CLOSE_KEYWORD,
    COMPARE_KEYWORD,
    CONST_KEYWORD,
    CURRENCY_KEYWORD,
    DATABASE_KEYWORD,
    DATE_KEYWORD,
    DECIMAL_KEYWORD,
    DECLARE_KEYWORD,
    DEF_BOOL_KEYWORD,
    DEF_BYTE_KEYWORD,
    DEF_CUR_KEYWORD,
    DEF_DATE_KEYWORD,
    DEF_DBL_KEYWORD,
    DEF_DEC_KEYWORD,
    DEF_INT_KEYWORD,
    DEF_LNG_KEYWORD,
    DEF_OBJ_KEYWORD,
    DEF_SNG_KEYWORD,
    DEF_STR_KEYWORD,
    DEF_VAR_KEYWORD,
    DELETE_SETTING_KEYWORD,
    DIM_KEYWORD,
    DO_KEYWORD,
    DOUBLE_KEYWORD,
    EACH_KEYWORD,
    ELSE_KEYWORD,
    ELSE_IF_KEYWORD,
    EMPTY_KEYWORD,
    END_KEYWORD,
    END_PROPERTY_KEYWORD,
    ENUM_KEYWORD,
    EQV_KEYWORD,
    ERASE_KEYWORD,
    ERROR_KEYWORD,
    EVENT_KEYWORD,
    EXIT_KEYWORD,
    EXPLICIT_KEYWORD,
    FALSE_KEYWORD,
    FILE_COPY_KEYWORD,
    FOR_KEYWORD,
    FRIEND_KEYWORD,
    FUNCTION_KEYWORD,
    GET_KEYWORD,
    GLOBAL_KEYWORD,
    GO_SUB_KEYWORD,
    GO_TO_KEYWORD,
    IF_KEYWORD,
    IMP_KEYWORD,
    IMPLEMENTS_KEYWORD,
    IN_KEYWORD,
    INPUT_KEYWORD,
    INTEGER_KEYWORD,
    IS_KEYWORD,
    KILL_KEYWORD,
    LEN_KEYWORD,
    LET_KEYWORD,
    LIB_KEYWORD,
    LIKE_KEYWORD,
    LINE_KEYWORD,
    LOAD_KEYWORD,
    LOCAL_KEYWORD,
    LOCK_KEYWORD,
    LONG_KEYWORD,
    LOOP_KEYWORD,
    LSET_KEYWORD,
    ME_KEYWORD,
    MID_KEYWORD,
    MID_B_KEYWORD,
    MK_DIR_KEYWORD,
    MOD_KEYWORD,
    MODULE_KEYWORD,
    NAME_KEYWORD,
    NEW_KEYWORD,
    NEXT_KEYWORD,
    NOT_KEYWORD,
    NOTHING_KEYWORD,
    NULL_KEYWORD,
    OBJECT_KEYWORD,
    ON_KEYWORD,
    OPEN_KEYWORD,
    OPTION_KEYWORD,
    OPTIONAL_KEYWORD,
    OR_KEYWORD,
    OUTPUT_KEYWORD,
    PARAM_ARRAY_KEYWORD,
    PRESERVE_KEYWORD,
    PRINT_KEYWORD,
    PRIVATE_KEYWORD,
    PROPERTY_KEYWORD,
    PUBLIC_KEYWORD,
    PUT_KEYWORD,
    RAISE_EVENT_KEYWORD,
    RANDOM_KEYWORD,
    RANDOMIZE_KEYWORD,
    READ_KEYWORD,
    RE_DIM_KEYWORD,
    RESET_KEYWORD,
    RESUME_KEYWORD,
    RETURN_KEYWORD,
    RM_DIR_KEYWORD,
    RSET_KEYWORD,
    SAVE_PICTURE_KEYWORD,
    SAVE_SETTING_KEYWORD,
    SEEK_KEYWORD,
    SELECT_KEYWORD,
    SEND_KEYS_KEYWORD,
    SET_KEYWORD,
    SET_ATTR_KEYWORD,
    SHARED_KEYWORD,
    SINGLE_KEYWORD,
    STATIC_KEYWORD,
    STEP_KEYWORD,
    STOP_KEYWORD,
    STRING_KEYWORD,
    SUB_KEYWORD,
    TEXT_KEYWORD,
    THEN_KEYWORD,
    TIME_KEYWORD,
    TO_KEYWORD,
    TRUE_KEYWORD,
    TYPE_KEYWORD,
    TYPE_OF_KEYWORD,
    UNLOAD_KEYWORD,
    UNLOCK_KEYWORD,
    UNTIL_KEYWORD,
    VARIANT_KEYWORD,
    VERSION_KEYWORD,
    WEND_KEYWORD,
    WHILE_KEYWORD,
    WIDTH_KEYWORD,
    WITH_KEYWORD,
    WITH_EVENTS_KEYWORD,
    WRITE_KEYWORD,
    XOR_KEYWORD,

    // ---- 其它 Token ----
    IDENTIFIER,
    INTEGER_CONST,
    LONG_CONST,
    SINGLE_CONST,
    DOUBLE_CONST,
    DECIMAL_CONST,
    STRING_CONST,
    DATE_CONST,
    EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    PLUS,
    MINUS,
    ASTERISK,
    SLASH,
    BACKSLASH,
    CARET,
    AMPERSAND,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    COLON,
    COLON_EQUAL,
    DOT,
    BANG,
    HASH,
    DOLLAR,
    PERCENT,
    AT,
    UNDERSCORE,
    QUESTION,
    WHITESPACE,
    NEWLINE,
    COMMENT,
    REM_COMMENT,
    ILLEGAL;

    private static final SyntaxKind[] VALUES = values();
    private static final Map<TokenType, SyntaxKind> BY_TOKEN_TYPE = new EnumMap<>(TokenType.class);
    private static final Map<SyntaxKind, TokenType> TOKEN_TYPES = new EnumMap<>(SyntaxKind.class);
    private static final Set<SyntaxKind> STATEMENTS = EnumSet.noneOf(SyntaxKind.class);

    static {
        for (TokenType type : TokenType.values()) {
            if (type == TokenType.EOF) {
                continue;
            }
            SyntaxKind kind = valueOf(type.isKeyword() ? type.name() + "_KEYWORD" : type.name());
            BY_TOKEN_TYPE.put(type, kind);
            TOKEN_TYPES.put(kind, type);
        }
        for (SyntaxKind kind : VALUES) {
            if (kind.name().endsWith("_STATEMENT")) {
                STATEMENTS.add(kind);
            }
        }
    }

    public int raw() {
        return ordinal();
    }

    public static SyntaxKind fromRaw(int raw) {
        if (raw < 0 || raw >= VALUES.length) {
            throw new IllegalArgumentException("Unknown syntax kind id: " + raw);
        }
        return VALUES[raw];
    }

    /**
     * EOF 从不进入语法树，因此没有对应的种类。
     */
    public static SyntaxKind fromToken(TokenType type) {
        SyntaxKind kind = BY_TOKEN_TYPE.get(type);
        if (kind == null) {
            throw new IllegalArgumentException("Token type " + type + " has no syntax kind");
        }
        return kind;
    }

    /**
     * @return 对应的词法类别；节点种类返回 null
     */
    public TokenType tokenType() {
        return TOKEN_TYPES.get(this);
    }

    public boolean isToken() {
        return TOKEN_TYPES.containsKey(this);
    }

    public boolean isNode() {
        return !isToken();
    }

    public boolean isTrivia() {
        TokenType type = tokenType();
        return type != null && type.isTrivia();
    }

    public boolean isKeyword() {
        TokenType type = tokenType();
        return type != null && type.isKeyword();
    }

    public boolean isStatement() {
        return STATEMENTS.contains(this);
    }
}
