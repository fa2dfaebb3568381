package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 分离规则集调用 @dr();
 */
public final class VariableCall extends Node {
    private final String variable;
    private final boolean important;

    public VariableCall(String variable, boolean important, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.variable = variable;
        this.important = important;
    }

    public String getVariable() {
        return variable;
    }

    public boolean isImportant() {
        return important;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitVariableCall(this, context);
    }
}
