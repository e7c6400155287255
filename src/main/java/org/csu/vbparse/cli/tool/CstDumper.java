package org.csu.vbparse.cli.tool;

import org.csu.vbparse.engine.ParseOutcome;
import org.csu.vbparse.engine.SourceProcessor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 命令行工具，打印 VB6 源文件的具体语法树和诊断信息
 *
 * 用法: CstDumper [--charset NAME] [--quiet] file...
 * 退出码: 0 全部文件无诊断；1 存在诊断；2 参数错误或读取失败
 */
public class CstDumper {

    public static final String DEFAULT_CHARSET = "windows-1252";

    static final int EXIT_CLEAN = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: CstDumper [--charset NAME] [--quiet] file...";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String charsetName = DEFAULT_CHARSET;
        boolean quiet = false;
        List<String> files = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--charset" -> {
                    if (i + 1 >= args.length) {
                        err.println("[CstDumper] Missing value for --charset");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    charsetName = args[++i];
                }
                case "--quiet" -> quiet = true;
                case "--help", "-h" -> {
                    out.println(USAGE);
                    return EXIT_CLEAN;
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("[CstDumper] Unknown option: " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    files.add(arg);
                }
            }
        }
        if (files.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            err.println("[CstDumper] Unsupported charset: " + charsetName);
            return EXIT_USAGE;
        }

        SourceProcessor processor = new SourceProcessor();
        int exitCode = EXIT_CLEAN;
        for (String file : files) {
            String text;
            try {
                text = Files.readString(Path.of(file), charset);
            } catch (IOException e) {
                err.println("[CstDumper] Failed to read " + file + ": " + e.getMessage());
                return EXIT_USAGE;
            }
            out.println("[CstDumper] Parsing " + file + " (" + charset.name() + ")...");
            ParseOutcome outcome = processor.parse(file, text);
            if (!quiet) {
                out.print(outcome.tree().debugTree());
            }
            out.println(DiagnosticFormatter.format(outcome.diagnostics()));
            if (outcome.hasDiagnostics()) {
                exitCode = EXIT_DIAGNOSTICS;
            }
        }
        return exitCode;
    }
}
