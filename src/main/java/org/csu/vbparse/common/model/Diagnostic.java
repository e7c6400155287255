package org.csu.vbparse.common.model;

/**
 * 一条诊断信息，描述解析器在何处进行了错误恢复。
 *
 * @param kind     诊断类别
 * @param message  可读的描述
 * @param fileName 源文件名，仅用于展示
 * @param offset   从 0 开始的字符偏移
 * @param line     从 1 开始的行号
 * @param column   从 1 开始的列号
 */
public record Diagnostic(
        DiagnosticKind kind,
        String message,
        String fileName,
        int offset,
        int line,
        int column
) {
    // 静态工厂方法，由偏移量推导行列号
    public static Diagnostic at(DiagnosticKind kind, String message, String fileName,
                                LineIndex lineIndex, int offset) {
        SourcePosition position = lineIndex.position(offset);
        return new Diagnostic(kind, message, fileName, offset, position.line(), position.column());
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d: %s %s", fileName, line, column, kind, message);
    }
}
