package com.lessj.compiler.visitor;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.output.CssEmitter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 输出前的整理
 *
 * <ul>
 *   <li>嵌套的规则集、媒体块和 at-rule 提升为外层规则集之后的兄弟节点</li>
 *   <li>删除变量声明、mixin 定义、extend、静默注释、不可见节点和空块</li>
 *   <li>合并 + / +_ 声明，删除完全相同的重复声明</li>
 *   <li>只保留第一个 @charset</li>
 * </ul>
 */
public final class ToCssVisitor {
    private static final Logger LOG = Logger.getLogger(ToCssVisitor.class.getName());

    private final boolean compress;
    private final boolean strictUnits;
    private boolean charset;

    public ToCssVisitor(boolean compress, boolean strictUnits) {
        this.compress = compress;
        this.strictUnits = strictUnits;
    }

    public void run(Ruleset root) {
        charset = false;
        visit(root);
    }

    /**
     * 访问一个节点，返回替换它的节点列表（为空表示删除）
     */
    private List<Node> visit(Node node) {
        List<Node> result = new ArrayList<>();
        if (node instanceof Ruleset) {
            return visitRuleset((Ruleset) node);
        } else if (node instanceof Declaration) {
            Declaration decl = (Declaration) node;
            if (!decl.blocksVisibility() && !decl.isVariable()) {
                result.add(decl);
            }
        } else if (node instanceof Comment) {
            Comment comment = (Comment) node;
            if (!comment.blocksVisibility() && !comment.isSilent(compress)) {
                result.add(comment);
            }
        } else if (node instanceof NestedAtRule) {
            NestedAtRule media = (NestedAtRule) node;
            List<Node> originalRules = bodyRules(media.getRules());
            media.setRules(visitRules(media.getRules()));
            return resolveVisibility(media, media.getRules(), originalRules);
        } else if (node instanceof AtRule) {
            return visitAtRule((AtRule) node);
        } else if (node instanceof Import) {
            if (!node.blocksVisibility()) {
                result.add(node);
            }
        } else if (node instanceof Anonymous) {
            if (!node.blocksVisibility()) {
                result.add(node);
            }
        } else if (node != null) {
            // mixin 定义、extend 以及函数在规则位置返回的值都不输出
            LOG.finest("dropped " + node.getClass().getSimpleName() + " at rule level");
        }
        return result;
    }

    private List<Node> visitRules(List<Node> rules) {
        if (rules == null) {
            return null;
        }
        List<Node> result = new ArrayList<>(rules.size());
        for (Node rule : rules) {
            result.addAll(visit(rule));
        }
        return result;
    }

    // ============ 规则集 ============

    private List<Node> visitRuleset(Ruleset ruleset) {
        List<Node> result = new ArrayList<>();
        checkValidNodes(ruleset.getRules(), ruleset.isFirstRoot());

        if (!ruleset.isRoot()) {
            compilePaths(ruleset);
            List<Node> rules = ruleset.getRules();
            List<Node> remaining = new ArrayList<>();
            if (rules != null) {
                for (Node rule : rules) {
                    if (hasRules(rule)) {
                        // 嵌套块提升到当前规则集之后
                        result.addAll(visit(rule));
                    } else {
                        remaining.add(rule);
                    }
                }
            }
            ruleset.setRules(remaining.isEmpty() ? null : visitRules(remaining));
        } else {
            ruleset.setRules(visitRules(ruleset.getRules()));
        }

        if (ruleset.getRules() != null) {
            mergeRules(ruleset.getRules());
            removeDuplicateRules(ruleset.getRules());
            for (Node rule : ruleset.getRules()) {
                rule.ensureVisibility();
            }
        }

        if (isVisibleRuleset(ruleset)) {
            ruleset.ensureVisibility();
            result.add(0, ruleset);
        }
        return result;
    }

    /**
     * 丢弃不可见的选择器路径；路径首个元素的后代组合符去掉
     */
    private static void compilePaths(Ruleset ruleset) {
        List<List<Selector>> paths = ruleset.getPaths();
        if (paths == null) {
            return;
        }
        List<List<Selector>> kept = new ArrayList<>();
        for (List<Selector> path : paths) {
            Selector first = path.get(0);
            if (!first.getElements().isEmpty()
                    && " ".equals(first.getElements().get(0).getCombinator().getValue())) {
                List<Element> elements = new ArrayList<>(first.getElements());
                elements.set(0, elements.get(0).withCombinator(Combinator.NONE));
                path = new ArrayList<>(path);
                path.set(0, first.createDerived(elements));
            }
            for (Selector s : path) {
                if (s.isVisible() && s.isOutput()) {
                    kept.add(path);
                    break;
                }
            }
        }
        ruleset.setPaths(kept);
    }

    private static boolean hasRules(Node node) {
        if (node instanceof Ruleset) {
            return ((Ruleset) node).getRules() != null;
        }
        if (node instanceof NestedAtRule) {
            return ((NestedAtRule) node).getRules() != null;
        }
        if (node instanceof AtRule) {
            return ((AtRule) node).getRules() != null;
        }
        return false;
    }

    private static boolean isVisibleRuleset(Ruleset ruleset) {
        if (ruleset.isFirstRoot()) {
            return true;
        }
        if (isEmpty(ruleset.getRules())) {
            return false;
        }
        return ruleset.isRoot() || (ruleset.getPaths() != null && !ruleset.getPaths().isEmpty());
    }

    private void checkValidNodes(List<Node> rules, boolean isRoot) {
        if (rules == null || !isRoot) {
            return;
        }
        for (Node rule : rules) {
            if (rule instanceof Declaration && !((Declaration) rule).isVariable()) {
                throw new LessException(ErrorKind.SYNTAX,
                        "Properties must be inside selector blocks. They cannot be in the root",
                        rule.getFileInfo() != null ? rule.getFileInfo().getFilename() : null, rule.getIndex());
            }
        }
    }

    // ============ at-rule ============

    private List<Node> visitAtRule(AtRule atRule) {
        List<Node> result = new ArrayList<>();
        if (atRule.getRules() != null && !atRule.getRules().isEmpty()) {
            List<Node> originalRules = bodyRules(atRule.getRules());
            atRule.setRules(visitRules(atRule.getRules()));
            if (!isEmpty(atRule.getRules()) && atRule.getRules().get(0) instanceof Ruleset) {
                List<Node> body = ((Ruleset) atRule.getRules().get(0)).getRules();
                if (body != null) {
                    mergeRules(body);
                }
            }
            return resolveVisibility(atRule, atRule.getRules(), originalRules);
        }
        if (atRule.blocksVisibility()) {
            return result;
        }
        if (atRule.isCharset()) {
            if (charset) {
                return result;
            }
            charset = true;
        }
        result.add(atRule);
        return result;
    }

    /** 只有一个无路径规则集时取其中的规则，否则就是块本身的规则 */
    private static List<Node> bodyRules(List<Node> rules) {
        if (rules != null && rules.size() == 1 && rules.get(0) instanceof Ruleset) {
            Ruleset fake = (Ruleset) rules.get(0);
            if (fake.getPaths() == null || fake.getPaths().isEmpty()) {
                return fake.getRules() == null ? null : new ArrayList<>(fake.getRules());
            }
        }
        return rules == null ? null : new ArrayList<>(rules);
    }

    private List<Node> resolveVisibility(Node node, List<Node> rules, List<Node> originalRules) {
        List<Node> result = new ArrayList<>();
        if (!node.blocksVisibility()) {
            if (isEmpty(rules) && !containsSilentNonBlockedChild(originalRules)) {
                return result;
            }
            result.add(node);
            return result;
        }
        // 被阻塞的块只输出其中变为可见的部分
        Node first = rules == null || rules.isEmpty() ? null : rules.get(0);
        if (first instanceof Ruleset) {
            Ruleset body = (Ruleset) first;
            if (body.getRules() != null) {
                List<Node> visible = new ArrayList<>();
                for (Node child : body.getRules()) {
                    if (child.isVisible()) {
                        visible.add(child);
                    }
                }
                body.setRules(visible);
            }
            if (isEmpty(body.getRules())) {
                return result;
            }
        } else if (first == null) {
            return result;
        }
        node.ensureVisibility();
        node.removeVisibilityBlock();
        result.add(node);
        return result;
    }

    private boolean containsSilentNonBlockedChild(List<Node> rules) {
        if (rules == null) {
            return false;
        }
        for (Node rule : rules) {
            if (rule instanceof Comment && ((Comment) rule).isSilent(compress) && !rule.blocksVisibility()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmpty(List<Node> rules) {
        return rules == null || rules.isEmpty();
    }

    // ============ 声明合并 ============

    /**
     * 合并同名的 + / +_ 声明：所有值并入第一个声明，+ 以逗号连接，+_ 以空格连接。
     * 其余同名声明从列表中移除。
     */
    public static void mergeRules(List<Node> rules) {
        if (rules == null) {
            return;
        }
        Map<String, List<Declaration>> groups = new LinkedHashMap<>();
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            Node rule = rules.get(i);
            if (!(rule instanceof Declaration) || ((Declaration) rule).getMerge() == null) {
                continue;
            }
            Declaration decl = (Declaration) rule;
            List<Declaration> group = groups.get(decl.getName());
            if (group == null) {
                group = new ArrayList<>();
                groups.put(decl.getName(), group);
                positions.put(decl.getName(), i);
            } else {
                rules.remove(i--);
            }
            group.add(decl);
        }

        for (Map.Entry<String, List<Declaration>> entry : groups.entrySet()) {
            List<Declaration> group = entry.getValue();
            Declaration first = group.get(0);
            List<Node> comma = new ArrayList<>();
            List<Node> space = new ArrayList<>();
            String important = first.getImportant();
            for (Declaration decl : group) {
                if ("+".equals(decl.getMerge()) && !space.isEmpty()) {
                    comma.add(new Expression(space));
                    space = new ArrayList<>();
                }
                space.add(decl.getValue());
                if ((important == null || important.isEmpty()) && decl.isImportant()) {
                    important = decl.getImportant();
                }
            }
            comma.add(new Expression(space));
            Declaration merged = first.withValue(new Value(comma), important);
            rules.set(positions.get(entry.getKey()), merged);
        }
    }

    /**
     * 从后往前检查同名声明，生成的 CSS 完全相同时只保留最后一个
     */
    private void removeDuplicateRules(List<Node> rules) {
        Map<String, Set<String>> seen = new LinkedHashMap<>();
        for (int i = rules.size() - 1; i >= 0; i--) {
            Node rule = rules.get(i);
            if (!(rule instanceof Declaration)) {
                continue;
            }
            String name = ((Declaration) rule).getName();
            String css = CssEmitter.toCss(rule, compress, strictUnits);
            Set<String> outputs = seen.get(name);
            if (outputs == null) {
                outputs = new HashSet<>();
                seen.put(name, outputs);
            }
            if (!outputs.add(css)) {
                rules.remove(i);
            }
        }
    }
}
