package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.List;

/**
 * 通用 at 规则（@charset、@font-face、@keyframes、@supports、未知指令等）
 *
 * <p>rules 为 null 表示语句形式（以分号结束），否则只含一个规则集作为块体。
 * rooted 为 false 的规则（@supports、@document、@layer 等）在嵌套时与父选择器连接。</p>
 */
public final class AtRule extends Node {
    private final String name;
    private final Node value;
    private List<Node> rules;
    private final boolean rooted;

    public AtRule(String name, Node value, List<Node> rules, int index, FileInfo fileInfo, boolean rooted) {
        super(index, fileInfo);
        this.name = name;
        this.value = value;
        this.rules = rules;
        this.rooted = rooted;
    }

    public String getName() {
        return name;
    }

    public Node getValue() {
        return value;
    }

    public List<Node> getRules() {
        return rules;
    }

    public void setRules(List<Node> rules) {
        this.rules = rules;
    }

    public boolean isRooted() {
        return rooted;
    }

    public boolean isCharset() {
        return "@charset".equals(name);
    }

    public boolean hasBody() {
        return rules != null;
    }

    @Override
    public boolean isRulesetLike() {
        return rules != null || !isCharset();
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAtRule(this, context);
    }
}
