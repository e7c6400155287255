package org.csu.vbparse.cli.tool;

import org.csu.vbparse.common.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * 将诊断信息格式化为带边框的控制台表格。
 */
public class DiagnosticFormatter {

    private static final List<String> HEADERS = List.of("Line", "Column", "Kind", "Message");

    /**
     * @param diagnostics 诊断信息列表
     * @return 格式化后的表格字符串；列表为空时返回 "No diagnostics."
     */
    public static String format(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "No diagnostics.";
        }

        List<List<String>> rows = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            rows.add(List.of(
                    String.valueOf(diagnostic.line()),
                    String.valueOf(diagnostic.column()),
                    diagnostic.kind().name(),
                    diagnostic.message()));
        }

        // 1. 计算每列的最大宽度
        List<Integer> columnWidths = new ArrayList<>();
        for (int i = 0; i < HEADERS.size(); i++) {
            int maxWidth = HEADERS.get(i).length();
            for (List<String> row : rows) {
                maxWidth = Math.max(maxWidth, row.get(i).length());
            }
            columnWidths.add(maxWidth);
        }

        // 2. 表头
        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(HEADERS, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");

        // 3. 数据行
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }

        // 4. 底部边框和汇总
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(diagnostics.size()).append(diagnostics.size() == 1 ? " diagnostic." : " diagnostics.");
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
