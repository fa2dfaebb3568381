package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.selector.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 带选择器与规则体的块（Ruleset、MixinDefinition），同时充当作用域帧
 */
public abstract class RuleBlock extends Node implements Frame {
    protected List<Selector> selectors;
    protected List<Node> rules;

    private Map<String, Declaration> variables;
    private Map<String, List<Declaration>> properties;
    private final Map<String, List<MixinCandidate>> lookups = new HashMap<>();

    protected RuleBlock(List<Selector> selectors, List<Node> rules, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.selectors = selectors;
        this.rules = rules;
    }

    /** 选择器列表，可能为 null（根节点或无输出选择器） */
    public List<Selector> getSelectors() {
        return selectors;
    }

    /** 规则列表，可能为 null */
    public List<Node> getRules() {
        return rules;
    }

    /** 规则变化后清除查找缓存 */
    public void resetCache() {
        variables = null;
        properties = null;
        lookups.clear();
    }

    public Map<String, Declaration> variables() {
        if (variables == null) {
            Map<String, Declaration> map = new LinkedHashMap<>();
            if (rules != null) {
                for (Node r : rules) {
                    if (r instanceof Declaration && ((Declaration) r).isVariable()) {
                        Declaration d = (Declaration) r;
                        map.put(d.getName(), d);
                    }
                }
            }
            variables = map;
        }
        return variables;
    }

    private Map<String, List<Declaration>> properties() {
        if (properties == null) {
            Map<String, List<Declaration>> map = new LinkedHashMap<>();
            if (rules != null) {
                for (Node r : rules) {
                    if (r instanceof Declaration && !((Declaration) r).isVariable()
                            && ((Declaration) r).getName() != null) {
                        Declaration d = (Declaration) r;
                        map.computeIfAbsent(d.getName(), k -> new ArrayList<>()).add(d);
                    }
                }
            }
            properties = map;
        }
        return properties;
    }

    @Override
    public Declaration variable(String name) {
        return variables().get(name);
    }

    @Override
    public List<Declaration> property(String name) {
        List<Declaration> found = properties().get(name);
        return found == null ? Collections.<Declaration>emptyList() : found;
    }

    /** 最后一条声明（namespace 取值 [] 使用） */
    public Declaration lastDeclaration() {
        if (rules == null) {
            return null;
        }
        for (int i = rules.size() - 1; i >= 0; i--) {
            if (rules.get(i) instanceof Declaration) {
                return (Declaration) rules.get(i);
            }
        }
        return null;
    }

    /** 规则体中的子规则块（嵌套 ruleset 与 mixin 定义） */
    public List<RuleBlock> rulesets() {
        List<RuleBlock> result = new ArrayList<>();
        if (rules != null) {
            for (Node r : rules) {
                if (r instanceof RuleBlock) {
                    result.add((RuleBlock) r);
                }
            }
        }
        return result;
    }

    @Override
    public List<MixinCandidate> find(Selector selector, RuleBlock self, Predicate<RuleBlock> filter) {
        RuleBlock exclude = self == null ? this : self;
        String key = selector.toString();
        List<MixinCandidate> cached = lookups.get(key);
        if (cached != null) {
            return cached;
        }
        List<MixinCandidate> result = new ArrayList<>();
        for (RuleBlock rule : rulesets()) {
            if (rule == exclude || rule.getSelectors() == null) {
                continue;
            }
            for (Selector candidate : rule.getSelectors()) {
                int match = selector.match(candidate);
                if (match == 0) {
                    continue;
                }
                if (selector.getElements().size() > match) {
                    if (filter == null || filter.test(rule)) {
                        Selector remaining = new Selector(
                                selector.getElements().subList(match, selector.getElements().size()));
                        for (MixinCandidate found : rule.find(remaining, exclude, filter)) {
                            result.add(found.withOuter(rule));
                        }
                    }
                } else {
                    result.add(new MixinCandidate(rule, Collections.<RuleBlock>emptyList()));
                }
                break;
            }
        }
        lookups.put(key, result);
        return result;
    }
}
