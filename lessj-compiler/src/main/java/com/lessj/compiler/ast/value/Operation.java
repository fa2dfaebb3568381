package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 二元运算：+ - * / 以及 ./（总是执行的除法）
 */
public final class Operation extends Node {
    private final String op;
    private final Node left;
    private final Node right;
    private final boolean spaced;

    public Operation(String op, Node left, Node right, boolean spaced) {
        this(op, left, right, spaced, 0, null);
    }

    public Operation(String op, Node left, Node right, boolean spaced, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.op = op.trim();
        this.left = left;
        this.right = right;
        this.spaced = spaced;
    }

    public String getOp() {
        return op;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    /** 运算符两侧是否有空格，决定未求值时的输出形式 */
    public boolean isSpaced() {
        return spaced;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitOperation(this, context);
    }
}
