package org.csu.vbparse.cli.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 命令行工具的测试，输出流被重定向到内存中
 */
public class CstDumperTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content, Charset charset) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, charset);
        return file;
    }

    @Test
    void testCleanFile() throws IOException {
        System.out.println("--- Running test: testCleanFile ---");
        Path file = write("Module1.bas", "Sub Main()\r\n    x = 1\r\nEnd Sub\r\n", StandardCharsets.UTF_8);

        int code = CstDumper.run(new String[]{file.toString()}, out, err);

        assertEquals(CstDumper.EXIT_CLEAN, code);
        assertTrue(output().contains("[CstDumper] Parsing " + file + " (windows-1252)..."));
        assertTrue(output().contains("ROOT@0.."));
        assertTrue(output().contains("SUB_STATEMENT@0.."));
        assertTrue(output().contains("No diagnostics."));
        assertEquals("", errors());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDiagnosticsSetExitCode() throws IOException {
        System.out.println("--- Running test: testDiagnosticsSetExitCode ---");
        Path good = write("Good.bas", "x = 1\n", StandardCharsets.UTF_8);
        Path bad = write("Bad.bas", "Sub Main()\n", StandardCharsets.UTF_8);

        int code = CstDumper.run(new String[]{"--quiet", good.toString(), bad.toString()}, out, err);

        assertEquals(CstDumper.EXIT_DIAGNOSTICS, code);
        assertFalse(output().contains("ROOT@"), "--quiet 不打印语法树");
        assertTrue(output().contains("MISSING_BLOCK_TERMINATOR"));
        assertTrue(output().contains("1 diagnostic."));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCharsetOption() throws IOException {
        System.out.println("--- Running test: testCharsetOption ---");
        Path file = write("Accents.bas", "s = \"café\"\n", Charset.forName("windows-1252"));

        assertEquals(CstDumper.EXIT_CLEAN, CstDumper.run(new String[]{file.toString()}, out, err));
        assertTrue(output().contains("\"\\\"café\\\"\""), output());

        setUp();
        Path utf8 = write("Utf8.bas", "s = \"ü\"\n", StandardCharsets.UTF_8);
        assertEquals(CstDumper.EXIT_CLEAN, CstDumper.run(new String[]{"--charset", "UTF-8", utf8.toString()}, out, err));
        assertTrue(output().contains("(UTF-8)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUsageErrors() {
        System.out.println("--- Running test: testUsageErrors ---");
        assertEquals(CstDumper.EXIT_USAGE, CstDumper.run(new String[]{}, out, err));
        assertTrue(errors().contains("Usage: CstDumper"));

        assertEquals(CstDumper.EXIT_USAGE, CstDumper.run(new String[]{"--verbose"}, out, err));
        assertTrue(errors().contains("Unknown option: --verbose"));

        assertEquals(CstDumper.EXIT_USAGE, CstDumper.run(new String[]{"a.bas", "--charset"}, out, err));
        assertTrue(errors().contains("Missing value for --charset"));

        assertEquals(CstDumper.EXIT_USAGE, CstDumper.run(new String[]{"--charset", "no-such-charset", "a.bas"}, out, err));
        assertTrue(errors().contains("Unsupported charset"));

        Path missing = tempDir.resolve("Missing.bas");
        assertEquals(CstDumper.EXIT_USAGE, CstDumper.run(new String[]{missing.toString()}, out, err));
        assertTrue(errors().contains("Failed to read"));

        assertEquals(CstDumper.EXIT_CLEAN, CstDumper.run(new String[]{"--help"}, out, err));
        assertTrue(output().contains("Usage: CstDumper"));
        System.out.println("Result: Test PASSED.\n");
    }
}
