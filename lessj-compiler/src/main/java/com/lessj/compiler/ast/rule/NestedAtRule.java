package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;

import java.util.List;

/**
 * 可冒泡的条件块（@media、@container）：特性列表 + 单个规则集块体
 */
public abstract class NestedAtRule extends Node {
    private Node features;
    private List<Node> rules;

    protected NestedAtRule(Node features, List<Node> rules, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.features = features;
        this.rules = rules;
    }

    /** 特性列表（Value），永不为 null */
    public Node getFeatures() {
        return features;
    }

    /** 嵌套媒体查询合并特性时替换 */
    public void setFeatures(Node features) {
        this.features = features;
    }

    public List<Node> getRules() {
        return rules;
    }

    public void setRules(List<Node> rules) {
        this.rules = rules;
    }

    /** "@media" 或 "@container" */
    public abstract String getKeyword();

    /** 以新的特性与规则构造同类节点 */
    public abstract NestedAtRule create(Node newFeatures, List<Node> newRules);

    /** 块体规则集（第一个规则） */
    public Ruleset body() {
        return (Ruleset) rules.get(0);
    }

    @Override
    public boolean isRulesetLike() {
        return true;
    }
}
