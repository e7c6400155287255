package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 带位置信息的元素引用。
 *
 * 语法树中不保存父指针；父节点、偏移量、兄弟关系都记录在这个包装对象里，
 * 只能从根节点一路向下得到。
 */
public final class SyntaxNodeRef {

    private final ConcreteSyntaxTree tree;
    private final SyntaxNodeRef parent;
    private final int element;
    private final int indexInParent;
    private final int offset;

    SyntaxNodeRef(ConcreteSyntaxTree tree, SyntaxNodeRef parent, int element, int indexInParent, int offset) {
        this.tree = tree;
        this.parent = parent;
        this.element = element;
        this.indexInParent = indexInParent;
        this.offset = offset;
    }

    public SyntaxKind kind() {
        return tree.arena().kind(element);
    }

    public boolean isToken() {
        return tree.arena().isToken(element);
    }

    public String text() {
        return isToken() ? tree.arena().tokenText(element) : tree.textOf(element);
    }

    public int offset() {
        return offset;
    }

    public int endOffset() {
        return offset + tree.arena().textLength(element);
    }

    public TextRange textRange() {
        return new TextRange(offset, endOffset());
    }

    public Optional<SyntaxNodeRef> parent() {
        return Optional.ofNullable(parent);
    }

    public int indexInParent() {
        return indexInParent;
    }

    public int childCount() {
        return tree.arena().childCount(element);
    }

    public List<SyntaxNodeRef> children() {
        List<SyntaxNodeRef> result = new ArrayList<>(childCount());
        int childOffset = offset;
        for (int i = 0; i < childCount(); i++) {
            int child = tree.arena().child(element, i);
            result.add(new SyntaxNodeRef(tree, this, child, i, childOffset));
            childOffset += tree.arena().textLength(child);
        }
        return result;
    }

    public Optional<SyntaxNodeRef> childAt(int index) {
        if (index < 0 || index >= childCount()) {
            return Optional.empty();
        }
        return Optional.of(children().get(index));
    }

    public Optional<SyntaxNodeRef> nextSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        return parent.childAt(indexInParent + 1);
    }

    public Optional<SyntaxNodeRef> previousSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        return parent.childAt(indexInParent - 1);
    }

    /**
     * 查找覆盖该偏移量的最深元素（通常是一个 Token）。
     */
    public Optional<SyntaxNodeRef> elementAt(int target) {
        if (!textRange().contains(target)) {
            return Optional.empty();
        }
        SyntaxNodeRef current = this;
        while (!current.isToken()) {
            SyntaxNodeRef next = null;
            for (SyntaxNodeRef child : current.children()) {
                if (child.textRange().contains(target)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                break;
            }
            current = next;
        }
        return Optional.of(current);
    }

    /**
     * 沿父链向上查找第一个指定种类的祖先。
     */
    public Optional<SyntaxNodeRef> ancestorOfKind(SyntaxKind kind) {
        SyntaxNodeRef current = parent;
        while (current != null) {
            if (current.kind() == kind) {
                return Optional.of(current);
            }
            current = current.parent;
        }
        return Optional.empty();
    }

    public CstNode toCstNode() {
        return tree.project(element);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNodeRef other)) return false;
        return tree == other.tree && element == other.element && offset == other.offset
                && indexInParent == other.indexInParent;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(tree), element, offset, indexInParent);
    }

    @Override
    public String toString() {
        return kind() + "@" + offset + ".." + endOffset();
    }
}
