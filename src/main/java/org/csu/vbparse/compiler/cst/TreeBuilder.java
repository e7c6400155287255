package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.common.exception.TreeBuildException;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于栈的语法树构建器。
 *
 * 每个打开的节点对应栈中的一帧，帧里保存已经完成的子元素下标；
 * finishNode 时弹出栈顶帧，生成不可变元素并追加到父帧。
 * 相同的 Token 和相同的完成节点会被复用，实现结构共享。
 * 构建器只能使用一次。
 */
public class TreeBuilder implements TreeSink {

    private static final int INITIAL_CAPACITY = 256;

    private int[] kinds = new int[INITIAL_CAPACITY];
    private String[] texts = new String[INITIAL_CAPACITY];
    private int[] childStart = new int[INITIAL_CAPACITY];
    private int[] childCount = new int[INITIAL_CAPACITY];
    private int[] textLength = new int[INITIAL_CAPACITY];
    private int size = 0;

    private int[] childPool = new int[INITIAL_CAPACITY];
    private int childPoolSize = 0;

    private final Map<TokenKey, Integer> tokenCache = new HashMap<>();
    private final Map<NodeKey, Integer> nodeCache = new HashMap<>();

    private final List<Frame> stack = new ArrayList<>();
    private int root = -1;
    private boolean finished = false;

    @Override
    public void startNode(SyntaxKind kind) {
        ensureOpen();
        if (kind.isToken()) {
            throw new TreeBuildException("Cannot open a node of token kind " + kind);
        }
        if (stack.isEmpty() && root >= 0) {
            throw new TreeBuildException("Cannot open " + kind + ": the root node is already finished");
        }
        stack.add(new Frame(kind, new ArrayList<>()));
    }

    @Override
    public void token(SyntaxKind kind, String text) {
        ensureOpen();
        if (!kind.isToken()) {
            throw new TreeBuildException("Cannot append a token of node kind " + kind);
        }
        if (stack.isEmpty()) {
            throw new TreeBuildException("Cannot append token " + kind + " outside of any node");
        }
        top().children.add(internToken(kind, text));
    }

    @Override
    public void finishNode() {
        ensureOpen();
        if (stack.isEmpty()) {
            throw new TreeBuildException("finishNode called with no open node");
        }
        Frame frame = stack.remove(stack.size() - 1);
        int element = internNode(frame);
        if (stack.isEmpty()) {
            root = element;
        } else {
            top().children.add(element);
        }
    }

    @Override
    public Checkpoint checkpoint() {
        ensureOpen();
        int position = stack.isEmpty() ? 0 : top().children.size();
        return new Checkpoint(this, stack.size(), position);
    }

    @Override
    public void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
        ensureOpen();
        if (checkpoint == null || !checkpoint.belongsTo(this)) {
            throw new TreeBuildException("Checkpoint was not created by this builder");
        }
        if (kind.isToken()) {
            throw new TreeBuildException("Cannot open a node of token kind " + kind);
        }
        if (stack.isEmpty() || checkpoint.depth() != stack.size()) {
            throw new TreeBuildException("Stale checkpoint " + checkpoint + " at depth " + stack.size());
        }
        List<Integer> siblings = top().children;
        if (checkpoint.position() > siblings.size()) {
            throw new TreeBuildException("Stale checkpoint " + checkpoint + ": only "
                    + siblings.size() + " children remain");
        }
        List<Integer> tail = siblings.subList(checkpoint.position(), siblings.size());
        List<Integer> wrapped = new ArrayList<>(tail);
        tail.clear();
        stack.add(new Frame(kind, wrapped));
    }

    /**
     * 根节点关闭后调用，得到不可变的语法树。
     */
    public ConcreteSyntaxTree finish() {
        ensureOpen();
        if (!stack.isEmpty()) {
            throw new TreeBuildException(stack.size() + " node(s) still open, innermost "
                    + top().kind);
        }
        if (root < 0) {
            throw new TreeBuildException("No root node was built");
        }
        finished = true;
        SyntaxArena arena = new SyntaxArena(
                Arrays.copyOf(kinds, size),
                Arrays.copyOf(texts, size),
                Arrays.copyOf(childStart, size),
                Arrays.copyOf(childCount, size),
                Arrays.copyOf(childPool, childPoolSize),
                Arrays.copyOf(textLength, size));
        return new ConcreteSyntaxTree(arena, root);
    }

    public int depth() {
        return stack.size();
    }

    private Frame top() {
        return stack.get(stack.size() - 1);
    }

    private void ensureOpen() {
        if (finished) {
            throw new TreeBuildException("Builder has already produced its tree");
        }
    }

    private int internToken(SyntaxKind kind, String text) {
        TokenKey key = new TokenKey(kind.raw(), text);
        Integer existing = tokenCache.get(key);
        if (existing != null) {
            return existing;
        }
        int element = allocate(kind, text, text.length());
        childStart[element] = childPoolSize;
        tokenCache.put(key, element);
        return element;
    }

    private int internNode(Frame frame) {
        int[] ids = frame.children.stream().mapToInt(Integer::intValue).toArray();
        NodeKey key = new NodeKey(frame.kind.raw(), ids);
        Integer existing = nodeCache.get(key);
        if (existing != null) {
            return existing;
        }
        int length = 0;
        for (int id : ids) {
            length += textLength[id];
        }
        int element = allocate(frame.kind, null, length);
        ensureChildCapacity(ids.length);
        System.arraycopy(ids, 0, childPool, childPoolSize, ids.length);
        childStart[element] = childPoolSize;
        childCount[element] = ids.length;
        childPoolSize += ids.length;
        nodeCache.put(key, element);
        return element;
    }

    private int allocate(SyntaxKind kind, String text, int length) {
        if (size == kinds.length) {
            int capacity = size * 2;
            kinds = Arrays.copyOf(kinds, capacity);
            texts = Arrays.copyOf(texts, capacity);
            childStart = Arrays.copyOf(childStart, capacity);
            childCount = Arrays.copyOf(childCount, capacity);
            textLength = Arrays.copyOf(textLength, capacity);
        }
        kinds[size] = kind.raw();
        texts[size] = text;
        textLength[size] = length;
        return size++;
    }

    private void ensureChildCapacity(int extra) {
        if (childPoolSize + extra > childPool.length) {
            childPool = Arrays.copyOf(childPool, Math.max(childPool.length * 2, childPoolSize + extra));
        }
    }

    private static final class Frame {
        private final SyntaxKind kind;
        private final List<Integer> children;

        private Frame(SyntaxKind kind, List<Integer> children) {
            this.kind = kind;
            this.children = children;
        }
    }

    private record TokenKey(int kind, String text) {
    }

    private static final class NodeKey {
        private final int kind;
        private final int[] children;
        private final int hash;

        private NodeKey(int kind, int[] children) {
            this.kind = kind;
            this.children = children;
            this.hash = 31 * kind + Arrays.hashCode(children);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NodeKey other)) return false;
            return kind == other.kind && Arrays.equals(children, other.children);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
