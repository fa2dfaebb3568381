package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 逗号分隔的值列表
 */
public final class Value extends Node {
    private final List<Node> value;

    public Value(List<Node> value) {
        this(value, 0, null);
    }

    public Value(List<Node> value, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        if (value == null) {
            throw new IllegalArgumentException("Value requires an array argument");
        }
        this.value = Collections.unmodifiableList(value);
    }

    public List<Node> getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitValue(this, context);
    }
}
