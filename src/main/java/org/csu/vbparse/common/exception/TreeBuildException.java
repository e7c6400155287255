package org.csu.vbparse.common.exception;

/**
 * 语法树构建器被错误使用时抛出，例如节点的打开与关闭没有正确嵌套。
 * 这表示解析器本身存在缺陷，而不是输入有误，因此不属于可恢复的错误。
 */
public class TreeBuildException extends RuntimeException {

    public TreeBuildException(String message) {
        super(message);
    }
}
