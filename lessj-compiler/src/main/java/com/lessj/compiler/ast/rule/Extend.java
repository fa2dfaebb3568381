package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.selector.Selector;

/**
 * :extend(selector [all])
 */
public final class Extend extends Node {
    private final Selector selector;
    private final String option;

    public Extend(Selector selector, String option, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.selector = selector;
        this.option = option;
    }

    public Selector getSelector() {
        return selector;
    }

    /** "all" 或 null */
    public String getOption() {
        return option;
    }

    /** all 模式下目标可以出现在被扩展选择器的任意位置 */
    public boolean isAll() {
        return "all".equals(option) || "!all".equals(option);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitExtend(this, context);
    }
}
