package org.csu.vbparse.compiler.cst;

import org.csu.vbparse.compiler.syntax.SyntaxKind;

/**
 * 解析器驱动语法树构建所用的最小接口。
 * startNode/finishNode 必须像括号一样嵌套；token 原样追加到当前打开的节点。
 */
public interface TreeSink {

    void startNode(SyntaxKind kind);

    void token(SyntaxKind kind, String text);

    void finishNode();

    /**
     * 记录当前节点中下一个子元素的位置，供之后 {@link #startNodeAt} 回头包裹。
     */
    Checkpoint checkpoint();

    /**
     * 打开一个新节点，并把检查点之后已经追加的子元素移入其中。
     */
    void startNodeAt(Checkpoint checkpoint, SyntaxKind kind);
}
