package com.lessj.compiler.ast.selector;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 选择器组合符："" (紧邻)、" " (后代)、">"、"+"、"~"、"|" 等
 */
public final class Combinator extends Node {
    public static final Combinator NONE = new Combinator("");
    public static final Combinator DESCENDANT = new Combinator(" ");

    private final String value;

    public Combinator(String value) {
        super(0, null);
        if (" ".equals(value)) {
            this.value = " ";
        } else {
            this.value = value == null ? "" : value.trim();
        }
    }

    public String getValue() {
        return value;
    }

    public boolean isEmptyOrWhitespace() {
        return value.isEmpty() || " ".equals(value);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCombinator(this, context);
    }

    @Override
    public String toString() {
        return value;
    }
}
