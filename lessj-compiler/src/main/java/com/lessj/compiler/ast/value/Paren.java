package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 括号包裹的值，也用于媒体特性 (min-width: 1px) 与选择器中的 (selector)
 */
public final class Paren extends Node {
    private final Node value;

    public Paren(Node value) {
        super(value.getIndex(), value.getFileInfo());
        this.value = value;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitParen(this, context);
    }
}
