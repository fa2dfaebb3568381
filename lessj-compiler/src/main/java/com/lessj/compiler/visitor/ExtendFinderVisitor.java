package com.lessj.compiler.visitor;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 收集树中所有 extend
 *
 * <p>每个选择器路径上的 extend（包括规则集内的 &amp;:extend）生成一条 {@link ExtendRecord}，
 * 按所在的作用域分组：根、每个媒体块、每个带规则体的 at-rule 各自一组。</p>
 */
final class ExtendFinderVisitor {
    private final Deque<List<ExtendRecord>> stack = new ArrayDeque<>();
    private final Map<Node, List<ExtendRecord>> scopes = new IdentityHashMap<>();
    private final Set<Ruleset> extendOnEveryPath = Collections.newSetFromMap(new IdentityHashMap<Ruleset, Boolean>());
    private int nextId;
    private boolean foundExtends;

    void run(Ruleset root) {
        List<ExtendRecord> rootExtends = new ArrayList<>();
        scopes.put(root, rootExtends);
        stack.push(rootExtends);
        visit(root);
        stack.pop();
    }

    boolean hasFoundExtends() {
        return foundExtends;
    }

    /** 媒体块、at-rule 或根节点作用域内收集到的 extend */
    List<ExtendRecord> extendsOf(Node scope) {
        List<ExtendRecord> list = scopes.get(scope);
        return list != null ? list : new ArrayList<ExtendRecord>();
    }

    boolean isExtendOnEveryPath(Ruleset ruleset) {
        return extendOnEveryPath.contains(ruleset);
    }

    int newId() {
        return nextId++;
    }

    private void visit(Node node) {
        if (node instanceof Ruleset) {
            visitRuleset((Ruleset) node);
        } else if (node instanceof NestedAtRule) {
            visitScope(node, ((NestedAtRule) node).getRules());
        } else if (node instanceof AtRule) {
            visitScope(node, ((AtRule) node).getRules());
        }
    }

    private void visitScope(Node node, List<Node> rules) {
        List<ExtendRecord> list = new ArrayList<>();
        scopes.put(node, list);
        stack.push(list);
        try {
            visitAll(rules);
        } finally {
            stack.pop();
        }
    }

    private void visitAll(List<Node> rules) {
        if (rules == null) {
            return;
        }
        for (Node rule : rules) {
            visit(rule);
        }
    }

    private void visitRuleset(Ruleset ruleset) {
        if (ruleset.isRoot()) {
            visitAll(ruleset.getRules());
            return;
        }
        // &:extend(...) 作用于规则集的每个选择器
        List<Extend> allSelectorsExtends = new ArrayList<>();
        if (ruleset.getRules() != null) {
            for (Node rule : ruleset.getRules()) {
                if (rule instanceof Extend) {
                    allSelectorsExtends.add((Extend) rule);
                    extendOnEveryPath.add(ruleset);
                }
            }
        }

        List<List<Selector>> paths = ruleset.getPaths();
        if (paths != null) {
            for (List<Selector> path : paths) {
                Selector last = path.get(path.size() - 1);
                List<Extend> extendList = new ArrayList<>(last.getExtendList());
                extendList.addAll(allSelectorsExtends);
                for (int j = 0; j < extendList.size(); j++) {
                    Extend extend = extendList.get(j);
                    foundExtends = true;
                    ExtendRecord record = new ExtendRecord(newId(), extend.getSelector(), extend.isAll(),
                            extend.getIndex(), extend.getFileInfo(), extend.visibilityInfo());
                    record.findSelfSelectors(path);
                    record.ruleset = ruleset;
                    record.firstExtendOnThisSelectorPath = j == 0;
                    stack.peek().add(record);
                }
            }
        }
        visitAll(ruleset.getRules());
    }
}
