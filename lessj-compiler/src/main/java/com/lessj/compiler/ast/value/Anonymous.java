package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 原样输出的文本（无法进一步解析的值、内联导入的内容等）
 */
public final class Anonymous extends Node {
    private final String value;
    private final boolean mapLines;
    private final boolean rulesetLike;

    public Anonymous(String value) {
        this(value, 0, null, false, false);
    }

    public Anonymous(String value, int index, FileInfo fileInfo) {
        this(value, index, fileInfo, false, false);
    }

    public Anonymous(String value, int index, FileInfo fileInfo, boolean mapLines, boolean rulesetLike) {
        super(index, fileInfo);
        this.value = value == null ? "" : value;
        this.mapLines = mapLines;
        this.rulesetLike = rulesetLike;
    }

    public String getValue() {
        return value;
    }

    public boolean isMapLines() {
        return mapLines;
    }

    @Override
    public boolean isRulesetLike() {
        return rulesetLike;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAnonymous(this, context);
    }

    @Override
    public String toString() {
        return value;
    }
}
