package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 声明：属性 "name: value" 或变量 "@name: value"
 *
 * <p>名称含插值（如 {@code @{p}-color}）时 name 为 null，由 nameParts 在求值时拼出。</p>
 */
public final class Declaration extends Node {
    private final String name;
    private final List<Node> nameParts;
    private final Node value;
    private final String important;
    private final String merge;
    private final boolean inline;
    private final boolean variable;

    public Declaration(String name, Node value, String important, String merge,
                       int index, FileInfo fileInfo, boolean inline, boolean variable) {
        this(name, null, value, important, merge, index, fileInfo, inline, variable);
    }

    public Declaration(String name, List<Node> nameParts, Node value, String important, String merge,
                       int index, FileInfo fileInfo, boolean inline, boolean variable) {
        super(index, fileInfo);
        this.name = name;
        this.nameParts = nameParts == null ? null : Collections.unmodifiableList(nameParts);
        this.value = value;
        this.important = important == null || important.trim().isEmpty() ? "" : " " + important.trim();
        this.merge = merge == null || merge.isEmpty() ? null : merge;
        this.inline = inline;
        this.variable = variable;
    }

    public String getName() {
        return name;
    }

    public List<Node> getNameParts() {
        return nameParts;
    }

    public boolean hasInterpolatedName() {
        return name == null;
    }

    public Node getValue() {
        return value;
    }

    /** "" 或 " !important" */
    public String getImportant() {
        return important;
    }

    public boolean isImportant() {
        return !important.isEmpty();
    }

    /** 合并方式："+"（逗号）、"+_"（空格），不合并时为 null */
    public String getMerge() {
        return merge;
    }

    /** 内联声明（媒体特性中的 (min-width: 1px)）不输出分号 */
    public boolean isInline() {
        return inline;
    }

    public boolean isVariable() {
        return variable;
    }

    public Declaration withValue(Node newValue, String newImportant) {
        Declaration copy = new Declaration(name, nameParts, newValue, newImportant, merge,
                getIndex(), getFileInfo(), inline, variable);
        copy.copyVisibilityInfo(visibilityInfo());
        return copy;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitDeclaration(this, context);
    }
}
