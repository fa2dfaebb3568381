package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 命名空间取值：#ns.mixin()[@x]、@dr[@x]、.m()[]（最后一个声明）
 *
 * <p>lookups 中 "@x" 取变量，"x" 或 "$x" 取属性，空串取最后一个声明。</p>
 */
public final class NamespaceValue extends Node {
    private final Node value;
    private final List<String> lookups;
    private final boolean important;

    public NamespaceValue(Node value, List<String> lookups, boolean important, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.value = value;
        this.lookups = Collections.unmodifiableList(lookups);
        this.important = important;
    }

    /** MixinCall、VariableCall 或 Variable */
    public Node getValue() {
        return value;
    }

    public List<String> getLookups() {
        return lookups;
    }

    public boolean isImportant() {
        return important;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitNamespaceValue(this, context);
    }
}
