package org.csu.vbparse.compiler.parser;

/**
 * 语句规则的标签。分派处使用不带 default 分支的 switch，
 * 新增语句时编译器会检查所有分支都已处理。
 */
enum StatementRule {
    LABEL,
    VERSION,
    OBJECT,
    ATTRIBUTE,
    OPTION,
    PROPERTIES_BLOCK,
    DIM,
    CONST,
    PROCEDURE,
    DECLARE,
    EVENT,
    IMPLEMENTS,
    TYPE,
    ENUM,
    RE_DIM,
    ERASE,
    IF,
    SELECT_CASE,
    FOR,
    WHILE,
    DO,
    WITH,
    GO_TO,
    GO_SUB,
    RETURN,
    RESUME,
    EXIT,
    ON,
    END,
    CALL,
    RAISE_EVENT,
    SET,
    LET,
    LIBRARY,
    EXPRESSION,
    UNKNOWN;

    /**
     * 只能出现在文件头区域的语句。
     */
    boolean isHeaderOnly() {
        return this == VERSION || this == OBJECT || this == PROPERTIES_BLOCK;
    }

    /**
     * 不会结束文件头区域的语句。
     */
    boolean keepsHeader() {
        return isHeaderOnly() || this == ATTRIBUTE;
    }

    boolean opensBlock() {
        return switch (this) {
            case PROPERTIES_BLOCK, PROCEDURE, TYPE, ENUM, IF, SELECT_CASE, FOR, WHILE, DO, WITH -> true;
            default -> false;
        };
    }
}
