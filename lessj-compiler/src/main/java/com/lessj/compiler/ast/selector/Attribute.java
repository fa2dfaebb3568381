package com.lessj.compiler.ast.selector;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 属性选择器 [key op value cif]
 */
public final class Attribute extends Node {
    private final Node key;
    private final String op;
    private final Node value;
    private final String cif;

    public Attribute(Node key, String op, Node value, String cif) {
        super(key.getIndex(), key.getFileInfo());
        this.key = key;
        this.op = op;
        this.value = value;
        this.cif = cif;
    }

    /** Keyword 或插值 Variable */
    public Node getKey() {
        return key;
    }

    /** 比较运算符，无值时为 null */
    public String getOp() {
        return op;
    }

    public Node getValue() {
        return value;
    }

    /** 大小写标志 i / s，可能为 null */
    public String getCif() {
        return cif;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
