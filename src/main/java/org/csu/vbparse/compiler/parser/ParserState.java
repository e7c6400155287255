package org.csu.vbparse.compiler.parser;

import lombok.Getter;
import org.csu.vbparse.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 解析器的显式模式状态，随解析器一起传递，不使用任何全局变量。
 */
@Getter
public class ParserState {

    /** 仍处于文件头区域：VERSION、BEGIN 块、Object 行和模块级 Attribute 只在这里合法 */
    private boolean inHeader;
    private final Deque<BlockContext> blocks = new ArrayDeque<>();
    /** Next j, i 这种一次关闭多个 For 的情况下，还需外层 For 认领的 Next 数 */
    private int pendingNextCloses;
    private int inlineIfDepth;
    private int nestingDepth;

    public ParserState(boolean inHeader) {
        this.inHeader = inHeader;
    }

    public void leaveHeader() {
        inHeader = false;
    }

    void pushBlock(BlockContext context) {
        blocks.push(context);
    }

    void popBlock() {
        blocks.pop();
    }

    /**
     * 当前行是否会结束或继续任何一个外层块。
     */
    boolean stopsAnyBlock(TokenType first, TokenType second) {
        for (BlockContext context : blocks) {
            if (context.stopsAt(first, second)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 栈顶之下还有多少个连续的 For 块，用于决定 Next 后面的变量列表能关闭几层。
     */
    int enclosingForLoops() {
        int count = 0;
        boolean skippedTop = false;
        for (BlockContext context : blocks) {
            if (!skippedTop) {
                skippedTop = true;
                continue;
            }
            if (context != BlockContext.FOR && context != BlockContext.FOR_EACH) {
                break;
            }
            count++;
        }
        return count;
    }

    void addPendingNext() {
        pendingNextCloses++;
    }

    boolean takePendingNext() {
        if (pendingNextCloses == 0) {
            return false;
        }
        pendingNextCloses--;
        return true;
    }

    boolean inInlineIf() {
        return inlineIfDepth > 0;
    }

    void enterInlineIf() {
        inlineIfDepth++;
    }

    void exitInlineIf() {
        inlineIfDepth--;
    }

    /**
     * @return 进入后深度未超过上限时返回 true；返回 false 时深度不变
     */
    boolean enter(int maxDepth) {
        if (nestingDepth >= maxDepth) {
            return false;
        }
        nestingDepth++;
        return true;
    }

    void exit() {
        nestingDepth--;
    }
}
