package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * unicode-range 描述符，如 U+0025-00FF
 */
public final class UnicodeDescriptor extends Node {
    private final String value;

    public UnicodeDescriptor(String value) {
        super(0, null);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitUnicodeDescriptor(this, context);
    }
}
