package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 变量引用 @name，name 以 @@ 开头时为间接引用
 */
public final class Variable extends Node {
    private final String name;

    public Variable(String name, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
