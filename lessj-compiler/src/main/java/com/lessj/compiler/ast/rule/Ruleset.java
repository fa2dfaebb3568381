package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.selector.Selector;

import java.util.ArrayList;
import java.util.List;

/**
 * 规则集：选择器 + 规则体
 *
 * <p>root 表示规则直接输出、不包裹选择器（根节点、顶层媒体查询体）；
 * paths 在选择器连接阶段计算，为每条完整选择器路径。</p>
 */
public final class Ruleset extends RuleBlock {
    private final boolean strictImports;
    private boolean root;
    private boolean firstRoot;
    private boolean multiMedia;
    private boolean allowImports;
    private List<List<Selector>> paths;
    private Ruleset originalRuleset;

    public Ruleset(List<Selector> selectors, List<Node> rules) {
        this(selectors, rules, false, 0, null);
    }

    public Ruleset(List<Selector> selectors, List<Node> rules, boolean strictImports, int index, FileInfo fileInfo) {
        super(selectors, rules, index, fileInfo);
        this.strictImports = strictImports;
    }

    public void setSelectors(List<Selector> selectors) {
        this.selectors = selectors;
        resetCache();
    }

    public void setRules(List<Node> rules) {
        this.rules = rules;
        resetCache();
    }

    public boolean isStrictImports() {
        return strictImports;
    }

    public boolean isRoot() {
        return root;
    }

    public void setRoot(boolean root) {
        this.root = root;
    }

    public boolean isFirstRoot() {
        return firstRoot;
    }

    public void setFirstRoot(boolean firstRoot) {
        this.firstRoot = firstRoot;
    }

    /** 嵌套媒体查询展开后的包装规则集 */
    public boolean isMultiMedia() {
        return multiMedia;
    }

    public void setMultiMedia(boolean multiMedia) {
        this.multiMedia = multiMedia;
    }

    public boolean isAllowImports() {
        return allowImports;
    }

    public void setAllowImports(boolean allowImports) {
        this.allowImports = allowImports;
    }

    public List<List<Selector>> getPaths() {
        return paths;
    }

    public void setPaths(List<List<Selector>> paths) {
        this.paths = paths;
    }

    /** 作为 mixin 调用时的来源规则集，用于检测自递归 */
    public Ruleset getOriginalRuleset() {
        return originalRuleset;
    }

    public void setOriginalRuleset(Ruleset originalRuleset) {
        this.originalRuleset = originalRuleset;
    }

    /** 复制根属性，规则与选择器由调用方给出 */
    public Ruleset copyShape(List<Selector> newSelectors, List<Node> newRules) {
        Ruleset copy = new Ruleset(newSelectors, newRules, strictImports, getIndex(), getFileInfo());
        copy.root = root;
        copy.firstRoot = firstRoot;
        copy.allowImports = allowImports;
        copy.multiMedia = multiMedia;
        copy.copyVisibilityInfo(visibilityInfo());
        return copy;
    }

    public List<Node> rulesCopy() {
        return rules == null ? new ArrayList<Node>() : new ArrayList<>(rules);
    }

    @Override
    public boolean isRulesetLike() {
        return true;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitRuleset(this, context);
    }
}
