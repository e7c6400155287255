package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;

/**
 * 以整数下标寻址的不可变元素池。
 *
 * 每个元素要么是 Token（保存文本），要么是内部节点（保存子元素区间）。
 * 元素不保存父指针；相同的元素在池中只出现一次，可以被多个父节点共享。
 */
public final class SyntaxArena {

    private final int[] kinds;
    private final String[] texts;
    private final int[] childStart;
    private final int[] childCount;
    private final int[] children;
    private final int[] textLength;

    SyntaxArena(int[] kinds, String[] texts, int[] childStart, int[] childCount,
                int[] children, int[] textLength) {
        this.kinds = kinds;
        this.texts = texts;
        this.childStart = childStart;
        this.childCount = childCount;
        this.children = children;
        this.textLength = textLength;
    }

    public int size() {
        return kinds.length;
    }

    public SyntaxKind kind(int element) {
        return SyntaxKind.fromRaw(kinds[element]);
    }

    public boolean isToken(int element) {
        return texts[element] != null;
    }

    /**
     * @return Token 的文本；内部节点返回 null
     */
    public String tokenText(int element) {
        return texts[element];
    }

    public int childCount(int element) {
        return childCount[element];
    }

    public int child(int element, int index) {
        if (index < 0 || index >= childCount[element]) {
            throw new IndexOutOfBoundsException("Child " + index + " of element " + element
                    + " (count " + childCount[element] + ")");
        }
        return children[childStart[element] + index];
    }

    public int textLength(int element) {
        return textLength[element];
    }
}
