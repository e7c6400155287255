package org.csu.vbparse.common.model;

/**
 * 诊断信息的分类。前两项来自词法分析，其余来自语法分析的恢复点。
 */
public enum DiagnosticKind {
    UNKNOWN_TOKEN,
    UNTERMINATED_STRING,
    UNKNOWN_STATEMENT,
    UNEXPECTED_TOKEN,
    MISSING_BLOCK_TERMINATOR,
    MISMATCHED_BLOCK_TERMINATOR,
    HEADER_STATEMENT_OUTSIDE_HEADER,
    MISSING_EXPRESSION,
    NESTING_TOO_DEEP;

    public boolean isLexical() {
        return this == UNKNOWN_TOKEN || this == UNTERMINATED_STRING;
    }
}
