package com.lessj.compiler.eval;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.MixinCall;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.rule.VariableCall;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.DetachedRuleset;
import com.lessj.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 规则集求值
 *
 * <p>顺序：选择器（含插值后的重新解析）、展开导入、先求值 mixin 定义与分离规则集、
 * 展开 mixin 调用与分离规则集调用、求值其余规则、折叠只有 &amp; 的子规则集，
 * 最后把本规则集内新产生的媒体查询块包上本规则集的选择器。</p>
 */
final class RulesetEvaluator {
    private final Evaluator evaluator;

    RulesetEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    Ruleset evaluate(Ruleset node, EvalContext context) {
        return evaluate(node, context, node, new IdentityHashMap<Node, Integer>());
    }

    /**
     * @param original 记录为结果的来源规则集，mixin 递归检测以此识别"正在求值的规则集"
     * @param blocks   引用导入带来的额外可见性阻塞，按节点标识计数，在节点求值后施加
     */
    Ruleset evaluate(Ruleset node, EvalContext context, Ruleset original, Map<Node, Integer> blocks) {
        List<Selector> selectors = null;
        boolean passing = true;
        if (node.getSelectors() != null && !node.getSelectors().isEmpty()) {
            selectors = evalSelectors(node.getSelectors(), context);
            passing = false;
            for (Selector s : selectors) {
                if (s.isOutput()) {
                    passing = true;
                    break;
                }
            }
        }

        List<Node> rules = passing ? node.rulesCopy() : new ArrayList<Node>();
        Ruleset ruleset = node.copyShape(selectors, rules);
        ruleset.setOriginalRuleset(original);

        List<NestedAtRule> mediaBlocks;
        int mediaBlockCount;
        context.pushFrame(ruleset);
        try {
            if (ruleset.isRoot() || ruleset.isAllowImports()
                    || !(node.isStrictImports() || context.getOptions().isStrictImports())) {
                evalImports(rules, context, blocks);
                ruleset.resetCache();
            }

            for (int i = 0; i < rules.size(); i++) {
                Node rule = rules.get(i);
                if (isEvalFirst(rule)) {
                    rules.set(i, evalRule(rule, context, blocks));
                }
            }
            ruleset.resetCache();

            mediaBlocks = context.getMediaBlocks();
            mediaBlockCount = mediaBlocks == null ? 0 : mediaBlocks.size();

            expandCalls(ruleset, rules, context, blocks);

            for (int i = 0; i < rules.size(); i++) {
                Node rule = rules.get(i);
                if (!isEvalFirst(rule)) {
                    rules.set(i, evalRule(rule, context, blocks));
                }
            }
            foldParentSelectorRulesets(rules);
            ruleset.resetCache();
        } finally {
            context.popFrame();
        }

        // 最外层的媒体查询求值后会清空上下文中的列表，这里用求值前取得的列表
        if (mediaBlocks != null && selectors != null) {
            for (int i = mediaBlockCount; i < mediaBlocks.size(); i++) {
                evaluator.atRules.bubbleSelectors(mediaBlocks.get(i), selectors);
            }
        }
        return ruleset;
    }

    // ============ 选择器 ============

    private List<Selector> evalSelectors(List<Selector> selectors, EvalContext context) {
        DefaultGuard guard = context.getSession().getDefaultGuard();
        guard.error(new EvalException(ErrorKind.SYNTAX,
                "it is currently only allowed in parametric mixin guards,"));
        try {
            List<Selector> evaluated = new ArrayList<>(selectors.size());
            boolean interpolated = false;
            for (Selector s : selectors) {
                Selector e = (Selector) evaluator.eval(s, context);
                evaluated.add(e);
                for (Element element : e.getElements()) {
                    if (element.isVariable()) {
                        interpolated = true;
                    }
                }
            }
            return interpolated ? reparse(evaluated, context) : evaluated;
        } finally {
            guard.reset();
        }
    }

    /**
     * 插值后的选择器按文本重新解析，保留原选择器的 extend 与守卫结果
     */
    private static List<Selector> reparse(List<Selector> evaluated, EvalContext context) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < evaluated.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            text.append(context.toCss(evaluated.get(i)).trim());
        }
        Selector first = evaluated.get(0);
        List<Selector> parsed = Parser.parseSelectors(text.toString(), first.getFileInfo(), first.getIndex());
        List<Selector> result = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            Selector source = evaluated.get(Math.min(i, evaluated.size() - 1));
            Selector p = parsed.get(i);
            result.add(p.createDerived(p.getElements(), source.getExtendList(), source.isOutput()));
        }
        return result;
    }

    // ============ 规则 ============

    private static boolean isEvalFirst(Node rule) {
        return rule instanceof MixinDefinition || rule instanceof DetachedRuleset;
    }

    private Node evalRule(Node rule, EvalContext context, Map<Node, Integer> blocks) {
        Node result = evaluator.eval(rule, context);
        Integer count = blocks.get(rule);
        if (count != null) {
            for (int i = 0; i < count; i++) {
                result.addVisibilityBlock();
            }
        }
        return result;
    }

    /**
     * 原地展开 mixin 调用与 @detached() 调用；调用结果中与本规则集同名的变量不覆盖本地定义
     */
    private void expandCalls(Ruleset ruleset, List<Node> rules, EvalContext context, Map<Node, Integer> blocks) {
        for (int i = 0; i < rules.size(); i++) {
            Node rule = rules.get(i);
            List<Node> produced;
            if (rule instanceof MixinCall) {
                boolean blocked = rule.blocksVisibility() || blocks.containsKey(rule);
                List<Node> output = evaluator.mixins.evaluate((MixinCall) rule, context, blocked);
                produced = new ArrayList<>(output.size());
                for (Node r : output) {
                    if (r instanceof Declaration && ((Declaration) r).isVariable()
                            && ruleset.variable(((Declaration) r).getName()) != null) {
                        continue;
                    }
                    produced.add(r);
                }
            } else if (rule instanceof VariableCall) {
                Ruleset called = (Ruleset) evaluator.eval(rule, context);
                produced = new ArrayList<>();
                for (Node r : called.getRules()) {
                    if (!(r instanceof Declaration && ((Declaration) r).isVariable())) {
                        produced.add(r);
                    }
                }
            } else {
                continue;
            }
            rules.remove(i);
            rules.addAll(i, produced);
            i += produced.size() - 1;
            ruleset.resetCache();
        }
    }

    /**
     * 选择器只有 &amp; 的子规则集并入当前规则集；其中的变量不外泄
     */
    private static void foldParentSelectorRulesets(List<Node> rules) {
        for (int i = 0; i < rules.size(); i++) {
            Node rule = rules.get(i);
            if (!(rule instanceof Ruleset)) {
                continue;
            }
            Ruleset child = (Ruleset) rule;
            List<Selector> selectors = child.getSelectors();
            if (selectors == null || selectors.size() != 1 || !selectors.get(0).isJustParentSelector()) {
                continue;
            }
            rules.remove(i);
            int at = i;
            if (child.getRules() != null) {
                for (Node sub : child.getRules()) {
                    sub.copyVisibilityInfo(child.visibilityInfo());
                    if (sub instanceof Declaration && ((Declaration) sub).isVariable()) {
                        continue;
                    }
                    rules.add(at++, sub);
                }
            }
            i = at - 1;
        }
    }

    // ============ 导入 ============

    /**
     * 原地把 @import 替换为被导入文件的规则
     */
    void evalImports(List<Node> rules, EvalContext context, Map<Node, Integer> blocks) {
        for (int i = 0; i < rules.size(); i++) {
            Node rule = rules.get(i);
            if (rule instanceof Import) {
                List<Node> imported = evaluator.imports.evaluate((Import) rule, context, blocks);
                rules.remove(i);
                rules.addAll(i, imported);
                i += imported.size() - 1;
            }
        }
    }

    /**
     * 以 &amp; 为选择器包装一组规则，求值后会并入外层规则集
     */
    static Ruleset parentSelectorRuleset(List<Node> rules, Node at) {
        List<Element> elements = new ArrayList<>();
        elements.add(new Element(Combinator.NONE, "&", at.getIndex(), at.getFileInfo()));
        List<Selector> selectors = new ArrayList<>();
        selectors.add(new Selector(elements, null, null, at.getIndex(), at.getFileInfo()));
        Ruleset ruleset = new Ruleset(selectors, new ArrayList<>(rules), false, at.getIndex(), at.getFileInfo());
        ruleset.setAllowImports(true);
        return ruleset;
    }
}
