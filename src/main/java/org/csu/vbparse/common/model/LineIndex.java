package org.csu.vbparse.common.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 行首偏移表，用于把字符偏移换算成行列号。
 * 支持 \r\n、\n 以及单独的 \r 三种换行。
 */
public class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i += 2;
                starts.add(i);
            } else if (c == '\r' || c == '\n') {
                i++;
                starts.add(i);
            } else {
                i++;
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public SourcePosition position(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int index = Arrays.binarySearch(lineStarts, clamped);
        if (index < 0) {
            index = -index - 2;
        }
        return new SourcePosition(index + 1, clamped - lineStarts[index] + 1);
    }

    /**
     * @param line 从 1 开始的行号
     * @return 该行文本，不含换行符
     */
    public String lineText(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " is out of range 1.." + lineStarts.length);
        }
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        while (end > start && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(start, end);
    }
}
