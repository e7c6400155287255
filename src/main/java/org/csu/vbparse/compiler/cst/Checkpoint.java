package org.csu.vbparse.compiler.cst;

/**
 * 由 {@link TreeBuilder#checkpoint()} 返回的不透明位置标记。
 */
public final class Checkpoint {

    private final Object owner;
    private final int depth;
    private final int position;

    Checkpoint(Object owner, int depth, int position) {
        this.owner = owner;
        this.depth = depth;
        this.position = position;
    }

    boolean belongsTo(Object builder) {
        return owner == builder;
    }

    int depth() {
        return depth;
    }

    int position() {
        return position;
    }

    @Override
    public String toString() {
        return "Checkpoint[depth=" + depth + ", position=" + position + "]";
    }
}
