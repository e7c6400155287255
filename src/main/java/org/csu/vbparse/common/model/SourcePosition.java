package org.csu.vbparse.common.model;

/**
 * 源文件中的行列位置，均从 1 开始。
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
