package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 属性引用 $name，取最近作用域中同名声明的值
 */
public final class Property extends Node {
    private final String name;

    public Property(String name, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitProperty(this, context);
    }
}
