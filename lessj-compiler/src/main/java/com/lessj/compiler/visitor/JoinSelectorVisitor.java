package com.lessj.compiler.visitor;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Paren;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 选择器连接
 *
 * <p>为每个非根规则集计算完整的选择器路径（paths）：路径中的 &amp; 替换为外层规则集的路径，
 * 不含 &amp; 的选择器以后代关系接在外层路径之后。媒体块与带规则体的 at-rule 在外层没有
 * 路径时把规则体标记为根。</p>
 */
public final class JoinSelectorVisitor {
    private final Deque<List<List<Selector>>> contexts = new ArrayDeque<>();

    public void run(Ruleset root) {
        contexts.clear();
        contexts.push(new ArrayList<List<Selector>>());
        visit(root);
    }

    private void visit(Node node) {
        if (node instanceof Ruleset) {
            visitRuleset((Ruleset) node);
        } else if (node instanceof NestedAtRule) {
            NestedAtRule media = (NestedAtRule) node;
            List<Node> rules = media.getRules();
            if (rules != null && !rules.isEmpty() && rules.get(0) instanceof Ruleset) {
                ((Ruleset) rules.get(0)).setRoot(contexts.peek().isEmpty());
            }
            visitAll(rules);
        } else if (node instanceof AtRule) {
            AtRule atRule = (AtRule) node;
            List<Node> rules = atRule.getRules();
            if (rules != null && !rules.isEmpty() && rules.get(0) instanceof Ruleset) {
                ((Ruleset) rules.get(0)).setRoot(atRule.isRooted() || contexts.peek().isEmpty());
            }
            visitAll(rules);
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
        List<List<Selector>> context = contexts.peek();
        List<List<Selector>> paths = new ArrayList<>();
        if (!ruleset.isRoot()) {
            List<Selector> selectors = new ArrayList<>();
            if (ruleset.getSelectors() != null) {
                for (Selector s : ruleset.getSelectors()) {
                    if (s.isOutput()) {
                        selectors.add(s);
                    }
                }
            }
            if (selectors.isEmpty()) {
                ruleset.setSelectors(null);
                ruleset.setRules(null);
            } else {
                ruleset.setSelectors(selectors);
                joinSelectors(paths, context, selectors);
            }
            ruleset.setPaths(paths);
        }
        contexts.push(paths);
        try {
            visitAll(ruleset.getRules());
        } finally {
            contexts.pop();
        }
    }

    // ============ 连接 ============

    static void joinSelectors(List<List<Selector>> paths, List<List<Selector>> context, List<Selector> selectors) {
        for (Selector selector : selectors) {
            joinSelector(paths, context, selector);
        }
    }

    static void joinSelector(List<List<Selector>> paths, List<List<Selector>> context, Selector selector) {
        List<List<Selector>> newPaths = new ArrayList<>();
        boolean hadParentSelector = replaceParentSelector(newPaths, context, selector);
        if (!hadParentSelector) {
            newPaths = new ArrayList<>();
            if (!context.isEmpty()) {
                for (List<Selector> parentPath : context) {
                    List<Selector> path = new ArrayList<>(parentPath.size() + 1);
                    for (Selector parent : parentPath) {
                        Selector derived = parent.createDerived(parent.getElements(), parent.getExtendList(), null);
                        derived.copyVisibilityInfo(selector.visibilityInfo());
                        path.add(derived);
                    }
                    path.add(selector);
                    newPaths.add(path);
                }
            } else {
                List<Selector> path = new ArrayList<>();
                path.add(selector);
                newPaths.add(path);
            }
        }
        paths.addAll(newPaths);
    }

    /**
     * 把选择器中的 &amp; 替换为外层路径，结果追加到 paths
     *
     * @return 选择器中是否出现过 &amp;
     */
    private static boolean replaceParentSelector(List<List<Selector>> paths, List<List<Selector>> context,
                                                 Selector inSelector) {
        boolean hadParentSelector = false;
        List<Element> currentElements = new ArrayList<>();
        List<List<Selector>> newSelectors = new ArrayList<>();
        newSelectors.add(new ArrayList<Selector>());

        for (Element el : inSelector.getElements()) {
            if (!el.isParentReference()) {
                Selector nested = findNestedSelector(el);
                if (nested != null) {
                    // :not(&) 之类括号里的 & 递归替换
                    mergeElementsOnToSelectors(currentElements, newSelectors);
                    List<List<Selector>> nestedPaths = new ArrayList<>();
                    List<List<Selector>> replaced = new ArrayList<>();
                    hadParentSelector = replaceParentSelector(nestedPaths, context, nested) || hadParentSelector;
                    for (List<Selector> nestedPath : nestedPaths) {
                        Selector replacement = createSelector(createParenthesis(nestedPath, el), el);
                        for (List<Selector> beginning : newSelectors) {
                            replaced.add(addReplacementIntoPath(beginning,
                                    Collections.singletonList(replacement), el, inSelector));
                        }
                    }
                    newSelectors = replaced;
                    currentElements = new ArrayList<>();
                } else {
                    currentElements.add(el);
                }
                continue;
            }

            hadParentSelector = true;
            List<List<Selector>> multiplied = new ArrayList<>();
            mergeElementsOnToSelectors(currentElements, newSelectors);
            for (List<Selector> sel : newSelectors) {
                if (context.isEmpty()) {
                    // 没有外层时 & 变成空元素，只保留它的组合符
                    if (!sel.isEmpty()) {
                        Selector first = sel.get(0);
                        List<Element> elements = new ArrayList<>(first.getElements());
                        elements.add(new Element(el.getCombinator(), "", el.getIndex(), el.getFileInfo()));
                        sel.set(0, first.createDerived(elements));
                    }
                    multiplied.add(sel);
                } else {
                    for (List<Selector> parentPath : context) {
                        multiplied.add(addReplacementIntoPath(sel, parentPath, el, inSelector));
                    }
                }
            }
            newSelectors = multiplied;
            currentElements = new ArrayList<>();
        }
        mergeElementsOnToSelectors(currentElements, newSelectors);

        for (List<Selector> path : newSelectors) {
            if (!path.isEmpty()) {
                int last = path.size() - 1;
                Selector lastSelector = path.get(last);
                path.set(last, lastSelector.createDerived(lastSelector.getElements(), inSelector.getExtendList(), null));
                paths.add(path);
            }
        }
        return hadParentSelector;
    }

    private static Selector findNestedSelector(Element element) {
        if (!(element.getValue() instanceof Paren)) {
            return null;
        }
        Node inner = ((Paren) element.getValue()).getValue();
        return inner instanceof Selector ? (Selector) inner : null;
    }

    private static Paren createParenthesis(List<Selector> elementsToPack, Element original) {
        List<Element> inside = new ArrayList<>(elementsToPack.size());
        for (Selector s : elementsToPack) {
            inside.add(new Element(null, s, original.isVariable(), original.getIndex(), original.getFileInfo()));
        }
        return new Paren(new Selector(inside));
    }

    private static Selector createSelector(Node contained, Element original) {
        Element element = new Element(null, contained, original.isVariable(), original.getIndex(), original.getFileInfo());
        return new Selector(Collections.singletonList(element));
    }

    /**
     * 把外层路径 addPath 接到 beginningPath 末尾选择器上，替换掉一个 &amp;
     */
    private static List<Selector> addReplacementIntoPath(List<Selector> beginningPath, List<Selector> addPath,
                                                         Element replaced, Selector original) {
        List<Selector> newPath = new ArrayList<>();
        List<Element> joined = new ArrayList<>();
        if (!beginningPath.isEmpty()) {
            newPath.addAll(beginningPath);
            Selector last = newPath.remove(newPath.size() - 1);
            joined.addAll(last.getElements());
        }
        if (!addPath.isEmpty()) {
            Combinator combinator = replaced.getCombinator();
            Element parentEl = addPath.get(0).getElements().get(0);
            if (combinator.isEmptyOrWhitespace() && !parentEl.getCombinator().isEmptyOrWhitespace()) {
                combinator = parentEl.getCombinator();
            }
            joined.add(new Element(combinator, parentEl.getValue(), replaced.isVariable(),
                    replaced.getIndex(), replaced.getFileInfo()));
            List<Element> rest = addPath.get(0).getElements();
            joined.addAll(rest.subList(1, rest.size()));
        }
        if (!joined.isEmpty()) {
            newPath.add(original.createDerived(joined));
        }
        for (int i = 1; i < addPath.size(); i++) {
            Selector s = addPath.get(i);
            newPath.add(s.createDerived(s.getElements(), Collections.<Extend>emptyList(), null));
        }
        return newPath;
    }

    private static void mergeElementsOnToSelectors(List<Element> elements, List<List<Selector>> selectors) {
        if (elements.isEmpty()) {
            return;
        }
        if (selectors.isEmpty()) {
            List<Selector> path = new ArrayList<>();
            path.add(new Selector(elements));
            selectors.add(path);
            return;
        }
        for (List<Selector> sel : selectors) {
            if (!sel.isEmpty()) {
                int last = sel.size() - 1;
                List<Element> merged = new ArrayList<>(sel.get(last).getElements());
                merged.addAll(elements);
                sel.set(last, sel.get(last).createDerived(merged));
            } else {
                sel.add(new Selector(elements));
            }
        }
    }
}
