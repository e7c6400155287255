package org.csu.vbparse.engine;

import org.csu.vbparse.common.exception.ParseException;
import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.compiler.cst.ConcreteSyntaxTree;

import java.util.List;

/**
 * 一次解析的结果。语法树总是存在，即使源文件有错误。
 *
 * @param fileName    源文件名
 * @param tree        无损的具体语法树
 * @param diagnostics 按出现位置排序的诊断信息
 */
public record ParseOutcome(String fileName, ConcreteSyntaxTree tree, List<Diagnostic> diagnostics) {

    public ParseOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * 严格模式：有任何诊断信息时抛出 {@link ParseException}。
     *
     * @return 没有诊断信息时返回语法树
     */
    public ConcreteSyntaxTree requireClean() {
        if (hasDiagnostics()) {
            throw new ParseException(fileName, diagnostics);
        }
        return tree;
    }
}
