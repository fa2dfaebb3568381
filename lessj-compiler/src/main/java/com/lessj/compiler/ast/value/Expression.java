package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 空格分隔的值序列
 */
public final class Expression extends Node {
    private final List<Node> value;
    private final boolean noSpacing;
    private boolean parens;
    private boolean parensInOp;

    public Expression(List<Node> value) {
        this(value, false);
    }

    public Expression(List<Node> value, boolean noSpacing) {
        this(value, noSpacing, 0, null);
    }

    public Expression(List<Node> value, boolean noSpacing, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.value = Collections.unmodifiableList(value);
        this.noSpacing = noSpacing;
    }

    public List<Node> getValue() {
        return value;
    }

    public boolean isNoSpacing() {
        return noSpacing;
    }

    /** 由括号包裹的子表达式 */
    public boolean isParens() {
        return parens;
    }

    public void setParens(boolean parens) {
        this.parens = parens;
    }

    /** 作为运算的操作数出现 */
    public boolean isParensInOp() {
        return parensInOp;
    }

    public void setParensInOp(boolean parensInOp) {
        this.parensInOp = parensInOp;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitExpression(this, context);
    }
}
