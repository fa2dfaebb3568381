package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 取负：-@x、-(...)
 */
public final class Negative extends Node {
    private final Node value;

    public Negative(Node value) {
        super(value.getIndex(), value.getFileInfo());
        this.value = value;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitNegative(this, context);
    }
}
