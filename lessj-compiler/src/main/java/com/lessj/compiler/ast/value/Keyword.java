package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 关键字（标识符），也用于保存选择器元素的文本
 */
public final class Keyword extends Node {
    public static final Keyword TRUE = new Keyword("true");
    public static final Keyword FALSE = new Keyword("false");

    private final String value;

    public Keyword(String value) {
        this(value, 0, null);
    }

    public Keyword(String value, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.value = value;
    }

    public static Keyword of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitKeyword(this, context);
    }

    @Override
    public String toString() {
        return value;
    }
}
