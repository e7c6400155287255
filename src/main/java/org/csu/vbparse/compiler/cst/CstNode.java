package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 语法树的轻量、自持有投影。每次查询都会重新生成，不与原树共享可变状态。
 *
 * @param kind     节点或 Token 的种类
 * @param text     该元素覆盖的完整源文本
 * @param isToken  是否为叶子 Token
 * @param children 子元素，Token 为空列表
 */
public record CstNode(SyntaxKind kind, String text, boolean isToken, List<CstNode> children) {

    public CstNode {
        children = List.copyOf(children);
    }

    public int childCount() {
        return children.size();
    }

    public List<CstNode> findChildrenByKind(SyntaxKind kind) {
        return children.stream().filter(child -> child.kind == kind).collect(Collectors.toList());
    }

    public boolean containsKind(SyntaxKind kind) {
        return children.stream().anyMatch(child -> child.kind == kind);
    }

    public Optional<CstNode> firstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    public Optional<CstNode> lastChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
    }

    public Optional<CstNode> childAt(int index) {
        if (index < 0 || index >= children.size()) {
            return Optional.empty();
        }
        return Optional.of(children.get(index));
    }

    /**
     * 去掉空白、注释、换行之后的直接子元素。
     */
    public List<CstNode> nonTriviaChildren() {
        return children.stream().filter(child -> !child.kind.isTrivia()).collect(Collectors.toList());
    }

    public Optional<CstNode> firstChildOfKind(SyntaxKind kind) {
        return children.stream().filter(child -> child.kind == kind).findFirst();
    }
}
