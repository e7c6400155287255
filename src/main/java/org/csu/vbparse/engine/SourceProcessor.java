package org.csu.vbparse.engine;

import lombok.Getter;
import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.compiler.cst.ConcreteSyntaxTree;
import org.csu.vbparse.compiler.cst.TreeBuilder;
import org.csu.vbparse.compiler.lexer.Lexer;
import org.csu.vbparse.compiler.lexer.Token;
import org.csu.vbparse.compiler.parser.Parser;
import org.csu.vbparse.compiler.parser.ParserOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * @author hidyouth
 * @description: 解析流水线的入口：源文本 -> Token 流 -> 具体语法树
 *
 * 每次调用都创建新的词法分析器、解析器和树构建器，因此同一个实例可以被多个线程共享。
 */
public class SourceProcessor {

    public static final String DEFAULT_FILE_NAME = "<input>";

    @Getter
    private final ParserOptions options;
    @Getter
    private final boolean verbose;

    public SourceProcessor() {
        this(ParserOptions.defaults(), false);
    }

    public SourceProcessor(ParserOptions options, boolean verbose) {
        this.options = options;
        this.verbose = verbose;
    }

    public ParseOutcome parse(String text) {
        return parse(DEFAULT_FILE_NAME, text);
    }

    public ParseOutcome parse(String fileName, String text) {
        long start = System.nanoTime();

        // 1. 词法分析
        Lexer lexer = new Lexer(text, fileName);
        List<Token> tokens = lexer.tokenize();

        // 2. 语法分析，直接写入树构建器
        TreeBuilder builder = new TreeBuilder();
        Parser parser = new Parser(tokens, builder, options, fileName);
        parser.parse();
        ConcreteSyntaxTree tree = builder.finish();

        // 3. 合并两个阶段的诊断信息，按位置排序（稳定排序，同一位置保持产生顺序）
        List<Diagnostic> diagnostics = new ArrayList<>(lexer.getDiagnostics());
        diagnostics.addAll(parser.getDiagnostics());
        diagnostics.sort(Comparator.comparingInt(Diagnostic::offset));

        if (verbose) {
            long micros = (System.nanoTime() - start) / 1000;
            System.out.println("[SourceProcessor] Parsed " + fileName + ": " + tokens.size() + " tokens, "
                    + tree.arena().size() + " arena elements, " + diagnostics.size() + " diagnostics in "
                    + micros + " us.");
        }
        return new ParseOutcome(fileName, tree, diagnostics);
    }
}
