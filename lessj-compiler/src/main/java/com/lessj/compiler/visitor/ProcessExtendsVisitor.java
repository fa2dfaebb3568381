package com.lessj.compiler.visitor;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Attribute;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Paren;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.output.CssEmitter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 执行 :extend
 *
 * <p>先在各作用域内做链式扩展（a 扩展 b、b 扩展 c 时 a 也扩展 c），再遍历每个规则集，
 * 把命中的选择器路径复制一份、用扩展方替换匹配部分后追加到规则集的 paths 中。
 * 扩展方可见时新路径可见，所以引用导入中被扩展的规则也会输出。</p>
 */
public final class ProcessExtendsVisitor {
    private static final Logger LOG = Logger.getLogger(ProcessExtendsVisitor.class.getName());

    /** 链式扩展的最大轮数，超过视为循环引用 */
    static final int MAX_CHAIN_ITERATIONS = 100;

    private final Deque<List<ExtendRecord>> allExtendsStack = new ArrayDeque<>();
    private final Set<String> warned = new HashSet<>();
    private ExtendFinderVisitor finder;

    public void run(Ruleset root) {
        finder = new ExtendFinderVisitor();
        finder.run(root);
        if (!finder.hasFoundExtends()) {
            return;
        }
        List<ExtendRecord> rootExtends = new ArrayList<>(finder.extendsOf(root));
        rootExtends.addAll(doExtendChaining(rootExtends, rootExtends, 0));
        allExtendsStack.push(rootExtends);
        try {
            visit(root);
        } finally {
            allExtendsStack.pop();
        }
        checkExtendsForNonMatched(rootExtends);
    }

    private void checkExtendsForNonMatched(List<ExtendRecord> extendList) {
        for (ExtendRecord extend : extendList) {
            if (extend.hasFoundMatches || extend.parentIds.size() != 1) {
                continue;
            }
            String selector = CssEmitter.toCss(extend.selector, false, false).trim();
            if (warned.add(extend.index + " " + selector)) {
                LOG.warning("extend '" + selector + "' has no matches");
            }
        }
    }

    // ============ 链式扩展 ============

    private List<ExtendRecord> doExtendChaining(List<ExtendRecord> extendsList, List<ExtendRecord> targets,
                                                int iteration) {
        List<ExtendRecord> extendsToAdd = new ArrayList<>();
        for (ExtendRecord extend : extendsList) {
            for (ExtendRecord target : targets) {
                if (extend.parentIds.contains(target.id)) {
                    continue;
                }
                List<Selector> selectorPath = new ArrayList<>();
                selectorPath.add(target.selfSelectors.get(0));
                List<Match> matches = findMatch(extend, selectorPath);
                if (matches.isEmpty()) {
                    continue;
                }
                extend.hasFoundMatches = true;
                for (Selector selfSelector : extend.selfSelectors) {
                    List<Selector> newSelector = extendSelector(matches, selectorPath, selfSelector, extend.isVisible());
                    ExtendRecord newExtend = new ExtendRecord(finder.newId(), target.selector, target.all,
                            0, target.fileInfo, target.visibility);
                    newExtend.selfSelectors = newSelector;
                    newExtend.ruleset = target.ruleset;
                    newExtend.parentIds.addAll(target.parentIds);
                    newExtend.parentIds.addAll(extend.parentIds);
                    extendsToAdd.add(newExtend);
                    // 同一路径上的多个 extend 只需把新路径加入一次
                    if (target.firstExtendOnThisSelectorPath) {
                        newExtend.firstExtendOnThisSelectorPath = true;
                        addPath(target.ruleset.getPaths(), newSelector);
                    }
                }
            }
        }
        if (extendsToAdd.isEmpty()) {
            return extendsToAdd;
        }
        if (iteration > MAX_CHAIN_ITERATIONS) {
            ExtendRecord first = extendsToAdd.get(0);
            String selectorOne = CssEmitter.toCss(first.selfSelectors.get(0), false, false).trim();
            String selectorTwo = CssEmitter.toCss(first.selector, false, false).trim();
            throw new LessException(ErrorKind.RUNTIME,
                    "extend circular reference detected. One of the circular extends is currently:"
                            + selectorOne + ":extend(" + selectorTwo + ")",
                    first.fileInfo != null ? first.fileInfo.getFilename() : null, first.index);
        }
        List<ExtendRecord> result = new ArrayList<>(extendsToAdd);
        result.addAll(doExtendChaining(extendsToAdd, targets, iteration + 1));
        return result;
    }

    // ============ 遍历 ============

    private void visit(Node node) {
        if (node instanceof Ruleset) {
            Ruleset ruleset = (Ruleset) node;
            if (!ruleset.isRoot()) {
                visitRuleset(ruleset);
            }
            visitAll(ruleset.getRules());
        } else if (node instanceof NestedAtRule) {
            visitScope(node, ((NestedAtRule) node).getRules());
        } else if (node instanceof AtRule) {
            visitScope(node, ((AtRule) node).getRules());
        }
    }

    private void visitScope(Node scope, List<Node> rules) {
        List<ExtendRecord> own = finder.extendsOf(scope);
        List<ExtendRecord> all = new ArrayList<>(own);
        all.addAll(allExtendsStack.peek());
        all.addAll(doExtendChaining(all, own, 0));
        allExtendsStack.push(all);
        try {
            visitAll(rules);
        } finally {
            allExtendsStack.pop();
        }
    }

    private void visitAll(List<Node> rules) {
        if (rules == null) {
            return;
        }
        for (Node rule : new ArrayList<>(rules)) {
            visit(rule);
        }
    }

    private void visitRuleset(Ruleset ruleset) {
        List<List<Selector>> paths = ruleset.getPaths();
        if (paths == null || finder.isExtendOnEveryPath(ruleset)) {
            return;
        }
        List<List<Selector>> selectorsToAdd = new ArrayList<>();
        for (ExtendRecord extend : allExtendsStack.peek()) {
            for (List<Selector> selectorPath : paths) {
                // 自身带 extend 的路径不参与被扩展
                if (!selectorPath.get(selectorPath.size() - 1).getExtendList().isEmpty()) {
                    continue;
                }
                List<Match> matches = findMatch(extend, selectorPath);
                if (matches.isEmpty()) {
                    continue;
                }
                extend.hasFoundMatches = true;
                for (Selector selfSelector : extend.selfSelectors) {
                    selectorsToAdd.add(extendSelector(matches, selectorPath, selfSelector, extend.isVisible()));
                }
            }
        }
        for (List<Selector> path : selectorsToAdd) {
            addPath(paths, path);
        }
    }

    /**
     * 追加选择器路径；输出相同的路径只保留一条，已有路径全部不可见而新路径可见时以新路径替换
     */
    static void addPath(List<List<Selector>> paths, List<Selector> newPath) {
        String css = pathToCss(newPath);
        for (int i = 0; i < paths.size(); i++) {
            List<Selector> existing = paths.get(i);
            if (!pathToCss(existing).equals(css)) {
                continue;
            }
            if (hasVisibleSelector(newPath) && !hasVisibleSelector(existing)) {
                paths.set(i, newPath);
            }
            return;
        }
        paths.add(newPath);
    }

    private static String pathToCss(List<Selector> path) {
        StringBuilder sb = new StringBuilder();
        for (Selector selector : path) {
            sb.append(CssEmitter.toCss(selector, true, false));
        }
        return sb.toString().trim();
    }

    private static boolean hasVisibleSelector(List<Selector> path) {
        for (Selector selector : path) {
            if (selector.isVisible()) {
                return true;
            }
        }
        return false;
    }

    // ============ 匹配 ============

    private static final class Match {
        int pathIndex;
        int index;
        int matched;
        Combinator initialCombinator;
        boolean finished;
        int endPathIndex;
        int endPathElementIndex;
    }

    private List<Match> findMatch(ExtendRecord extend, List<Selector> haystack) {
        List<Element> needle = extend.selector.getElements();
        List<Match> potentials = new ArrayList<>();
        List<Match> matches = new ArrayList<>();
        for (int selectorIndex = 0; selectorIndex < haystack.size(); selectorIndex++) {
            List<Element> elements = haystack.get(selectorIndex).getElements();
            for (int elementIndex = 0; elementIndex < elements.size(); elementIndex++) {
                Element element = elements.get(elementIndex);
                // 非 all 模式只能从路径开头匹配
                if (extend.all || (selectorIndex == 0 && elementIndex == 0)) {
                    Match m = new Match();
                    m.pathIndex = selectorIndex;
                    m.index = elementIndex;
                    m.initialCombinator = element.getCombinator();
                    potentials.add(m);
                }
                for (int i = 0; i < potentials.size(); i++) {
                    Match potential = potentials.get(i);
                    String targetCombinator = element.getCombinator().getValue();
                    if ("".equals(targetCombinator) && elementIndex == 0) {
                        targetCombinator = " ";
                    }
                    Element needleElement = needle.get(potential.matched);
                    if (!isElementValuesEqual(needleElement.getValue(), element.getValue())
                            || (potential.matched > 0 && !needleElement.getCombinator().getValue().equals(targetCombinator))) {
                        potential = null;
                    } else {
                        potential.matched++;
                    }
                    if (potential != null) {
                        potential.finished = potential.matched == needle.size();
                        if (potential.finished && !extend.all
                                && (elementIndex + 1 < elements.size() || selectorIndex + 1 < haystack.size())) {
                            potential = null;
                        }
                    }
                    if (potential != null) {
                        if (potential.finished) {
                            potential.endPathIndex = selectorIndex;
                            potential.endPathElementIndex = elementIndex + 1;
                            // 匹配不重叠，重新开始
                            potentials.clear();
                            matches.add(potential);
                        }
                    } else {
                        potentials.remove(i);
                        i--;
                    }
                }
            }
        }
        return matches;
    }

    static boolean isElementValuesEqual(Node value1, Node value2) {
        String text1 = textOf(value1);
        String text2 = textOf(value2);
        if (text1 != null || text2 != null) {
            return Objects.equals(text1, text2);
        }
        if (value1 instanceof Attribute) {
            if (!(value2 instanceof Attribute)) {
                return false;
            }
            Attribute a1 = (Attribute) value1;
            Attribute a2 = (Attribute) value2;
            if (!Objects.equals(a1.getOp(), a2.getOp())
                    || !Objects.equals(attributeText(a1.getKey()), attributeText(a2.getKey()))) {
                return false;
            }
            if (a1.getValue() == null || a2.getValue() == null) {
                return a1.getValue() == null && a2.getValue() == null;
            }
            return Objects.equals(attributeText(a1.getValue()), attributeText(a2.getValue()));
        }
        if (value1 instanceof Paren && value2 instanceof Paren) {
            Node inner1 = ((Paren) value1).getValue();
            Node inner2 = ((Paren) value2).getValue();
            if (!(inner1 instanceof Selector) || !(inner2 instanceof Selector)) {
                return false;
            }
            List<Element> e1 = ((Selector) inner1).getElements();
            List<Element> e2 = ((Selector) inner2).getElements();
            if (e1.size() != e2.size()) {
                return false;
            }
            for (int i = 0; i < e1.size(); i++) {
                String c1 = e1.get(i).getCombinator().getValue();
                String c2 = e2.get(i).getCombinator().getValue();
                if (!c1.equals(c2)) {
                    if (i != 0 || !(c1.isEmpty() ? " " : c1).equals(c2.isEmpty() ? " " : c2)) {
                        return false;
                    }
                }
                if (!isElementValuesEqual(e1.get(i).getValue(), e2.get(i).getValue())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static String textOf(Node node) {
        if (node instanceof Keyword) {
            return ((Keyword) node).getValue();
        }
        if (node instanceof Anonymous) {
            return ((Anonymous) node).getValue();
        }
        return null;
    }

    private static String attributeText(Node node) {
        if (node instanceof Quoted) {
            return ((Quoted) node).getValue();
        }
        String text = textOf(node);
        return text != null ? text : CssEmitter.toCss(node, false, false);
    }

    // ============ 替换 ============

    /** 构造中的路径片段；base 为 null 表示新建的选择器 */
    private static final class PathPart {
        final Selector base;
        final List<Element> elements;

        PathPart(Selector base, List<Element> elements) {
            this.base = base;
            this.elements = new ArrayList<>(elements);
        }
    }

    /**
     * 用 replacement 替换路径中每处匹配，返回新的选择器路径
     */
    private static List<Selector> extendSelector(List<Match> matches, List<Selector> selectorPath,
                                                 Selector replacement, boolean visible) {
        int currentPathIndex = 0;
        int currentElementIndex = 0;
        List<PathPart> path = new ArrayList<>();
        for (int matchIndex = 0; matchIndex < matches.size(); matchIndex++) {
            Match match = matches.get(matchIndex);
            Selector selector = selectorPath.get(match.pathIndex);
            Element replacementFirst = replacement.getElements().get(0);
            Element firstElement = new Element(match.initialCombinator, replacementFirst.getValue(),
                    replacementFirst.isVariable(), replacementFirst.getIndex(), replacementFirst.getFileInfo());

            if (match.pathIndex > currentPathIndex && currentElementIndex > 0) {
                List<Element> rest = selectorPath.get(currentPathIndex).getElements();
                path.get(path.size() - 1).elements.addAll(rest.subList(currentElementIndex, rest.size()));
                currentElementIndex = 0;
                currentPathIndex++;
            }

            List<Element> newElements = new ArrayList<>(selector.getElements().subList(currentElementIndex, match.index));
            newElements.add(firstElement);
            newElements.addAll(replacement.getElements().subList(1, replacement.getElements().size()));

            if (currentPathIndex == match.pathIndex && matchIndex > 0) {
                path.get(path.size() - 1).elements.addAll(newElements);
            } else {
                for (Selector s : selectorPath.subList(currentPathIndex, match.pathIndex)) {
                    path.add(new PathPart(s, s.getElements()));
                }
                path.add(new PathPart(null, newElements));
            }
            currentPathIndex = match.endPathIndex;
            currentElementIndex = match.endPathElementIndex;
            if (currentElementIndex >= selectorPath.get(currentPathIndex).getElements().size()) {
                currentElementIndex = 0;
                currentPathIndex++;
            }
        }
        if (currentPathIndex < selectorPath.size() && currentElementIndex > 0) {
            List<Element> rest = selectorPath.get(currentPathIndex).getElements();
            path.get(path.size() - 1).elements.addAll(rest.subList(currentElementIndex, rest.size()));
            currentPathIndex++;
        }
        for (Selector s : selectorPath.subList(currentPathIndex, selectorPath.size())) {
            path.add(new PathPart(s, s.getElements()));
        }

        List<Selector> result = new ArrayList<>(path.size());
        for (PathPart part : path) {
            Selector derived = part.base != null
                    ? part.base.createDerived(part.elements)
                    : new Selector(part.elements);
            if (visible) {
                derived.ensureVisibility();
            } else {
                derived.ensureInvisibility();
            }
            result.add(derived);
        }
        return result;
    }
}
