package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 守卫条件：and / or / 比较运算
 */
public final class Condition extends Node {
    private final String op;
    private final Node lvalue;
    private final Node rvalue;
    private boolean negate;

    public Condition(String op, Node lvalue, Node rvalue, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.op = op.trim();
        this.lvalue = lvalue;
        this.rvalue = rvalue;
    }

    public String getOp() {
        return op;
    }

    public Node getLvalue() {
        return lvalue;
    }

    public Node getRvalue() {
        return rvalue;
    }

    public boolean isNegate() {
        return negate;
    }

    /** 解析 not (...) 时翻转 */
    public void toggleNegate() {
        negate = !negate;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCondition(this, context);
    }
}
