package org.csu.vbparse.compiler.parser;

/**
 * 解析器配置。
 *
 * @param startInHeader   是否从文件头区域开始解析（VERSION、BEGIN 块、Attribute 只在头部合法）
 * @param maxNestingDepth 块语句与表达式的最大嵌套深度，超出的部分按未知语句处理
 */
public record ParserOptions(boolean startInHeader, int maxNestingDepth) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, DEFAULT_MAX_NESTING_DEPTH);
    }

    public ParserOptions withStartInHeader(boolean value) {
        return new ParserOptions(value, maxNestingDepth);
    }

    public ParserOptions withMaxNestingDepth(int value) {
        return new ParserOptions(startInHeader, value);
    }
}
