package org.csu.vbparse.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 关键字常量带有规范拼写（用于大小写无关的匹配），
 * contextual 标记表示该关键字在名字位置上也可以当作普通标识符使用。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    ACCESS("Access", true),
    ADDRESS_OF("AddressOf"),
    ALIAS("Alias", true),
    AND("And"),
    APP_ACTIVATE("AppActivate"),
    APPEND("Append", true),
    AS("As"),
    ATTRIBUTE("Attribute"),
    BASE("Base", true),
    BEEP("Beep"),
    BEGIN("Begin", true),
    BEGIN_PROPERTY("BeginProperty", true),
    BINARY("Binary", true),
    BOOLEAN("Boolean"),
    BY_REF("ByRef"),
    BY_VAL("ByVal"),
    BYTE("Byte"),
    CALL("Call"),
    CASE("Case"),
    CH_DIR("ChDir"),
    CH_DRIVE("ChDrive"),
    CLASS("Class", true),
    CLOSE("Close"),
    COMPARE("Compare", true),
    CONST("Const"),
    CURRENCY("Currency"),
    DATABASE("Database", true),
    DATE("Date", true),
    DECIMAL("Decimal"),
    DECLARE("Declare"),
    DEF_BOOL("DefBool"),
    DEF_BYTE("DefByte"),
    DEF_CUR("DefCur"),
    DEF_DATE("DefDate"),
    DEF_DBL("DefDbl"),
    DEF_DEC("DefDec"),
    DEF_INT("DefInt"),
    DEF_LNG("DefLng"),
    DEF_OBJ("DefObj"),
    DEF_SNG("DefSng"),
    DEF_STR("DefStr"),
    DEF_VAR("DefVar"),
    DELETE_SETTING("DeleteSetting"),
    DIM("Dim"),
    DO("Do"),
    DOUBLE("Double"),
    EACH("Each"),
    ELSE("Else"),
    ELSE_IF("ElseIf"),
    EMPTY("Empty"),
    END("End"),
    END_PROPERTY("EndProperty", true),
    ENUM("Enum"),
    EQV("Eqv"),
    ERASE("Erase"),
    ERROR("Error", true),
    EVENT("Event"),
    EXIT("Exit"),
    EXPLICIT("Explicit", true),
    FALSE("False"),
    FILE_COPY("FileCopy"),
    FOR("For"),
    FRIEND("Friend"),
    FUNCTION("Function"),
    GET("Get"),
    GLOBAL("Global"),
    GO_SUB("GoSub"),
    GO_TO("GoTo"),
    IF("If"),
    IMP("Imp"),
    IMPLEMENTS("Implements"),
    IN("In"),
    INPUT("Input", true),
    INTEGER("Integer"),
    IS("Is"),
    KILL("Kill"),
    LEN("Len", true),
    LET("Let"),
    LIB("Lib", true),
    LIKE("Like"),
    LINE("Line", true),
    LOAD("Load"),
    LOCAL("Local", true),
    LOCK("Lock"),
    LONG("Long"),
    LOOP("Loop"),
    LSET("LSet"),
    ME("Me"),
    MID("Mid", true),
    MID_B("MidB", true),
    MK_DIR("MkDir"),
    MOD("Mod"),
    MODULE("Module", true),
    NAME("Name", true),
    NEW("New"),
    NEXT("Next"),
    NOT("Not"),
    NOTHING("Nothing"),
    NULL("Null"),
    OBJECT("Object"),
    ON("On"),
    OPEN("Open"),
    OPTION("Option"),
    OPTIONAL("Optional"),
    OR("Or"),
    OUTPUT("Output", true),
    PARAM_ARRAY("ParamArray"),
    PRESERVE("Preserve"),
    PRINT("Print"),
    PRIVATE("Private"),
    PROPERTY("Property"),
    PUBLIC("Public"),
    PUT("Put"),
    RAISE_EVENT("RaiseEvent"),
    RANDOM("Random", true),
    RANDOMIZE("Randomize"),
    READ("Read", true),
    RE_DIM("ReDim"),
    RESET("Reset"),
    RESUME("Resume"),
    RETURN("Return"),
    RM_DIR("RmDir"),
    RSET("RSet"),
    SAVE_PICTURE("SavePicture"),
    SAVE_SETTING("SaveSetting"),
    SEEK("Seek", true),
    SELECT("Select"),
    SEND_KEYS("SendKeys"),
    SET("Set"),
    SET_ATTR("SetAttr"),
    SHARED("Shared", true),
    SINGLE("Single"),
    STATIC("Static"),
    STEP("Step"),
    STOP("Stop"),
    STRING("String", true),
    SUB("Sub"),
    TEXT("Text", true),
    THEN("Then"),
    TIME("Time", true),
    TO("To"),
    TRUE("True"),
    TYPE("Type"),
    TYPE_OF("TypeOf"),
    UNLOAD("Unload"),
    UNLOCK("Unlock"),
    UNTIL("Until"),
    VARIANT("Variant"),
    VERSION("Version", true),
    WEND("Wend"),
    WHILE("While"),
    WIDTH("Width", true),
    WITH("With"),
    WITH_EVENTS("WithEvents"),
    WRITE("Write"),
    XOR("Xor"),

    // ---- 标识符 (Identifier) ----
    IDENTIFIER,     // 变量名、过程名，也包括 [方括号] 转义的名字

    // ---- 常量 (Constants) ----
    INTEGER_CONST,  // 123, 123%, &HFF
    LONG_CONST,     // 123&, &HFFFF&
    SINGLE_CONST,   // 1.5, 1E3, 1!
    DOUBLE_CONST,   // 1D3, 1#
    DECIMAL_CONST,  // 1.5@ (Currency)
    STRING_CONST,   // "hello"，保留引号
    DATE_CONST,     // #1/2/2000#，保留 # 号

    // ---- 运算符 (Operators) ----
    EQUAL,          // =
    NOT_EQUAL,      // <>
    LESS,           // <
    LESS_EQUAL,     // <=
    GREATER,        // >
    GREATER_EQUAL,  // >=
    PLUS,           // +
    MINUS,          // -
    ASTERISK,       // *
    SLASH,          // /
    BACKSLASH,      // \ 整除
    CARET,          // ^
    AMPERSAND,      // & 字符串连接

    // ---- 分隔符 (Delimiters) ----
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // : 语句分隔符
    COLON_EQUAL,    // := 命名参数
    DOT,            // .
    BANG,           // ! 默认成员访问
    HASH,           // # 文件号
    DOLLAR,         // $
    PERCENT,        // %
    AT,             // @
    UNDERSCORE,     // _ 续行符
    QUESTION,       // ?

    // ---- 琐碎 Token (Trivia) ----
    WHITESPACE,
    NEWLINE,
    COMMENT,        // ' 注释，不含换行
    REM_COMMENT,    // Rem 注释，不含换行

    // ---- 特殊 Token ----
    ILLEGAL,        // 非法字符或未闭合的字符串，用于错误处理
    EOF;            // End-Of-File，表示输入流结束

    private final String keyword;
    private final boolean contextual;

    TokenType() {
        this(null, false);
    }

    TokenType(String keyword) {
        this(keyword, false);
    }

    TokenType(String keyword, boolean contextual) {
        this.keyword = keyword;
        this.contextual = contextual;
    }

    /**
     * @return 关键字的规范拼写；非关键字返回 null
     */
    public String getKeyword() {
        return keyword;
    }

    public boolean isKeyword() {
        return keyword != null;
    }

    public boolean isContextual() {
        return contextual;
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE || this == COMMENT || this == REM_COMMENT;
    }

    public boolean isComment() {
        return this == COMMENT || this == REM_COMMENT;
    }

    public boolean isNumericLiteral() {
        return this == INTEGER_CONST || this == LONG_CONST || this == SINGLE_CONST
                || this == DOUBLE_CONST || this == DECIMAL_CONST;
    }

    /**
     * 可以出现在普通名字位置上的 Token：标识符或上下文关键字。
     */
    public boolean isNameLike() {
        return this == IDENTIFIER || contextual;
    }
}
