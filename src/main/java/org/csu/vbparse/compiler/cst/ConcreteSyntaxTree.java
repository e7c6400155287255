package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 完成构建的无损具体语法树。
 *
 * 树本身不可变，可以在多个线程之间直接共享读取。
 * 所有查询都从根元素出发计算，不会修改树。
 */
public final class ConcreteSyntaxTree {

    private final SyntaxArena arena;
    private final int root;

    ConcreteSyntaxTree(SyntaxArena arena, int root) {
        this.arena = arena;
        this.root = root;
    }

    public SyntaxArena arena() {
        return arena;
    }

    int rootElement() {
        return root;
    }

    public SyntaxKind rootKind() {
        return arena.kind(root);
    }

    /**
     * 按深度优先、从左到右拼接所有叶子文本，结果应与原始输入完全一致。
     */
    public String text() {
        return textOf(root);
    }

    public int textLength() {
        return arena.textLength(root);
    }

    String textOf(int element) {
        StringBuilder sb = new StringBuilder(arena.textLength(element));
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(element);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (arena.isToken(current)) {
                sb.append(arena.tokenText(current));
                continue;
            }
            for (int i = arena.childCount(current) - 1; i >= 0; i--) {
                pending.push(arena.child(current, i));
            }
        }
        return sb.toString();
    }

    public int childCount() {
        return arena.childCount(root);
    }

    public List<CstNode> children() {
        List<CstNode> result = new ArrayList<>(childCount());
        for (int i = 0; i < childCount(); i++) {
            result.add(project(arena.child(root, i)));
        }
        return result;
    }

    public List<CstNode> findChildrenByKind(SyntaxKind kind) {
        List<CstNode> result = new ArrayList<>();
        for (int i = 0; i < childCount(); i++) {
            int child = arena.child(root, i);
            if (arena.kind(child) == kind) {
                result.add(project(child));
            }
        }
        return result;
    }

    /**
     * 只检查根节点的直接子元素。
     */
    public boolean containsKind(SyntaxKind kind) {
        for (int i = 0; i < childCount(); i++) {
            if (arena.kind(arena.child(root, i)) == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * 检查整棵树中是否出现过该种类。
     */
    public boolean containsKindDeep(SyntaxKind kind) {
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (arena.kind(current) == kind) {
                return true;
            }
            for (int i = 0; i < arena.childCount(current); i++) {
                pending.push(arena.child(current, i));
            }
        }
        return false;
    }

    public Optional<CstNode> firstChild() {
        return childAt(0);
    }

    public Optional<CstNode> lastChild() {
        return childAt(childCount() - 1);
    }

    public Optional<CstNode> childAt(int index) {
        if (index < 0 || index >= childCount()) {
            return Optional.empty();
        }
        return Optional.of(project(arena.child(root, index)));
    }

    /**
     * 按先序遍历收集所有指定种类的后代（不含根节点本身）。
     */
    public List<CstNode> descendantsOfKind(SyntaxKind kind) {
        List<CstNode> result = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();
        for (int i = childCount() - 1; i >= 0; i--) {
            pending.push(arena.child(root, i));
        }
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (arena.kind(current) == kind) {
                result.add(project(current));
            }
            for (int i = arena.childCount(current) - 1; i >= 0; i--) {
                pending.push(arena.child(current, i));
            }
        }
        return result;
    }

    public SyntaxNodeRef rootNode() {
        return new SyntaxNodeRef(this, null, root, 0, 0);
    }

    /**
     * 输出整棵树的缩进文本形式，每行形如 KIND@start..end，Token 额外带上引号包裹的文本。
     * 仅用于调试和测试断言，格式不保证稳定。
     */
    public String debugTree() {
        StringBuilder sb = new StringBuilder();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{root, 0, 0});
        while (!pending.isEmpty()) {
            int[] entry = pending.pop();
            int element = entry[0];
            int depth = entry[1];
            int offset = entry[2];
            sb.append("  ".repeat(depth))
                    .append(arena.kind(element))
                    .append('@').append(offset)
                    .append("..").append(offset + arena.textLength(element));
            if (arena.isToken(element)) {
                sb.append(" \"").append(escape(arena.tokenText(element))).append('"');
            }
            sb.append('\n');

            int count = arena.childCount(element);
            int[] offsets = new int[count];
            int childOffset = offset;
            for (int i = 0; i < count; i++) {
                offsets[i] = childOffset;
                childOffset += arena.textLength(arena.child(element, i));
            }
            for (int i = count - 1; i >= 0; i--) {
                pending.push(new int[]{arena.child(element, i), depth + 1, offsets[i]});
            }
        }
        return sb.toString();
    }

    CstNode project(int element) {
        if (arena.isToken(element)) {
            return new CstNode(arena.kind(element), arena.tokenText(element), true, List.of());
        }
        List<CstNode> children = new ArrayList<>(arena.childCount(element));
        for (int i = 0; i < arena.childCount(element); i++) {
            children.add(project(arena.child(element, i)));
        }
        return new CstNode(arena.kind(element), textOf(element), false, children);
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ConcreteSyntaxTree[" + rootKind() + ", " + textLength() + " chars]";
    }
}
