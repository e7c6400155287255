package org.csu.vbparse.compiler.cst;

/**
 * 半开区间 [start, end)，单位为字符偏移。
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text range " + start + ".." + end);
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
