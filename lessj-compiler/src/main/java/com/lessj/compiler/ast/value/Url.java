package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * url(...)，value 为 Quoted、Variable 或 Anonymous
 */
public final class Url extends Node {
    private final Node value;
    private final boolean evaluated;

    public Url(Node value, int index, FileInfo fileInfo, boolean evaluated) {
        super(index, fileInfo);
        this.value = value;
        this.evaluated = evaluated;
    }

    public Node getValue() {
        return value;
    }

    /** 已求值的 url 不再做路径重写 */
    public boolean isEvaluated() {
        return evaluated;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitUrl(this, context);
    }
}
