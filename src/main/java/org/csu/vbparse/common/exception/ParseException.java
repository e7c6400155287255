package org.csu.vbparse.common.exception;

import org.csu.vbparse.common.model.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 *
 * 严格模式下使用：解析结果带有诊断信息时由 ParseOutcome.requireClean() 抛出。
 * 解析器本身从不因为语法问题抛出异常。
 */
public class ParseException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public ParseException(String fileName, List<Diagnostic> diagnostics) {
        super(String.format("Syntax errors in %s (%d):%n%s",
                fileName,
                diagnostics.size(),
                diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining(System.lineSeparator()))));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
