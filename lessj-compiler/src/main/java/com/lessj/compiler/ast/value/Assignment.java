package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * IE 滤镜参数中的 key=value
 */
public final class Assignment extends Node {
    private final String key;
    private final Node value;

    public Assignment(String key, Node value) {
        super(value.getIndex(), value.getFileInfo());
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAssignment(this, context);
    }
}
