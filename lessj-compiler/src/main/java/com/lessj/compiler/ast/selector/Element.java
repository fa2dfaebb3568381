package com.lessj.compiler.ast.selector;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Quoted;

/**
 * 选择器元素：组合符 + 值
 *
 * <p>值为 Keyword（普通文本，含 "&amp;"）、Variable（@{name} 插值）、Attribute 或 Paren(Selector)。</p>
 */
public final class Element extends Node {
    private final Combinator combinator;
    private final Node value;
    private final boolean variable;

    public Element(Combinator combinator, String value, int index, FileInfo fileInfo) {
        this(combinator, new Keyword(value == null ? "" : value.trim(), index, fileInfo), false, index, fileInfo);
    }

    public Element(Combinator combinator, Node value, boolean variable, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.combinator = combinator == null ? Combinator.NONE : combinator;
        this.value = value == null ? new Keyword("") : value;
        this.variable = variable;
    }

    public Combinator getCombinator() {
        return combinator;
    }

    public Node getValue() {
        return value;
    }

    /** 值是否为 @{name} 插值 */
    public boolean isVariable() {
        return variable;
    }

    /** 普通文本元素的文本，否则返回 null */
    public String getText() {
        if (value instanceof Keyword) {
            return ((Keyword) value).getValue();
        }
        return null;
    }

    /** 是否为父选择器引用 & */
    public boolean isParentReference() {
        return "&".equals(getText());
    }

    /**
     * 用于 mixin 名称匹配的文本形式
     */
    public String getValueText() {
        if (value instanceof Keyword) {
            return ((Keyword) value).getValue();
        }
        if (value instanceof Quoted) {
            return ((Quoted) value).getValue();
        }
        if (value instanceof Anonymous) {
            return ((Anonymous) value).getValue();
        }
        return String.valueOf(value);
    }

    public Element withCombinator(Combinator newCombinator) {
        return new Element(newCombinator, value, variable, getIndex(), getFileInfo())
                .withVisibility(visibilityInfo());
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitElement(this, context);
    }

    @Override
    public String toString() {
        return combinator.getValue() + getValueText();
    }
}
