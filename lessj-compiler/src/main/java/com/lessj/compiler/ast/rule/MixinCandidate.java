package com.lessj.compiler.ast.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * mixin 查找结果：匹配到的规则块及其命名空间路径（由内向外）
 */
public final class MixinCandidate {
    private final RuleBlock rule;
    private final List<RuleBlock> path;

    public MixinCandidate(RuleBlock rule, List<RuleBlock> path) {
        this.rule = rule;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public RuleBlock getRule() {
        return rule;
    }

    public List<RuleBlock> getPath() {
        return path;
    }

    MixinCandidate withOuter(RuleBlock namespace) {
        List<RuleBlock> extended = new ArrayList<>(path);
        extended.add(namespace);
        return new MixinCandidate(rule, extended);
    }
}
