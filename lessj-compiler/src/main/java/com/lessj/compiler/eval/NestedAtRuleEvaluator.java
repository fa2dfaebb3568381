package com.lessj.compiler.eval;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @media / @container 求值与冒泡
 *
 * <p>嵌套的媒体查询各自求值后登记到当前冒泡作用域；内层的条件与外层条件按
 * "and" 组合成笛卡尔积，原位置只留下空规则集。回到最外层时，作用域内的全部
 * 媒体块并列输出。</p>
 */
final class NestedAtRuleEvaluator {
    private final Evaluator evaluator;

    NestedAtRuleEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    Node evaluate(NestedAtRule node, EvalContext context) {
        if (context.getMediaBlocks() == null) {
            context.setMediaState(new ArrayList<NestedAtRule>(), new ArrayList<NestedAtRule>());
        }
        Node features = node.getFeatures() == null ? null : evaluator.eval(node.getFeatures(), context);
        NestedAtRule media = node.create(features, new ArrayList<Node>());
        context.getMediaPath().add(media);
        context.getMediaBlocks().add(media);

        Ruleset body = node.body();
        Ruleset evaluated;
        context.pushFrame(body);
        try {
            evaluated = (Ruleset) evaluator.eval(body, context);
        } finally {
            context.popFrame();
        }
        List<Node> rules = new ArrayList<>();
        rules.add(evaluated);
        media.setRules(rules);

        List<NestedAtRule> path = context.getMediaPath();
        path.remove(path.size() - 1);
        return path.isEmpty() ? evalTop(media, context) : evalNested(media, context);
    }

    /**
     * 最外层：作用域内有多个媒体块时用多媒体规则集并列输出
     */
    private Node evalTop(NestedAtRule media, EvalContext context) {
        Node result = media;
        List<NestedAtRule> blocks = context.getMediaBlocks();
        if (blocks.size() > 1) {
            Ruleset multiMedia = new Ruleset(Selector.createEmptySelectors(media.getIndex(), media.getFileInfo()),
                    new ArrayList<Node>(blocks), false, media.getIndex(), media.getFileInfo());
            multiMedia.setMultiMedia(true);
            multiMedia.copyVisibilityInfo(media.visibilityInfo());
            result = multiMedia;
        }
        context.setMediaState(null, null);
        return result;
    }

    private Node evalNested(NestedAtRule media, EvalContext context) {
        List<NestedAtRule> chain = new ArrayList<>(context.getMediaPath());
        chain.add(media);
        List<List<Node>> path = new ArrayList<>(chain.size());
        for (int i = 0; i < chain.size(); i++) {
            NestedAtRule entry = chain.get(i);
            // @media 与 @container 互不合并，内层保留在原位
            if (entry.getClass() != media.getClass()) {
                if (i < context.getMediaBlocks().size()) {
                    context.getMediaBlocks().remove(i);
                }
                return media;
            }
            Node features = entry.getFeatures();
            path.add(features instanceof Value
                    ? ((Value) features).getValue()
                    : Collections.singletonList(features));
        }

        List<Node> expressions = new ArrayList<>();
        for (List<Node> combination : permute(path)) {
            List<Node> items = new ArrayList<>();
            for (int i = 0; i < combination.size(); i++) {
                if (i > 0) {
                    items.add(new Anonymous("and"));
                }
                items.add(combination.get(i));
            }
            expressions.add(new Expression(items));
        }
        media.setFeatures(new Value(expressions));
        return new Ruleset(new ArrayList<Selector>(), new ArrayList<Node>());
    }

    /**
     * 各层条件列表的笛卡尔积，外层在前
     */
    static List<List<Node>> permute(List<List<Node>> lists) {
        List<List<Node>> result = new ArrayList<>();
        if (lists.isEmpty()) {
            return result;
        }
        if (lists.size() == 1) {
            for (Node item : lists.get(0)) {
                result.add(Collections.singletonList(item));
            }
            return result;
        }
        List<List<Node>> rest = permute(lists.subList(1, lists.size()));
        for (List<Node> tail : rest) {
            for (Node head : lists.get(0)) {
                List<Node> combination = new ArrayList<>(tail.size() + 1);
                combination.add(head);
                combination.addAll(tail);
                result.add(combination);
            }
        }
        return result;
    }

    /**
     * 冒泡出去的媒体块包上所在规则集的选择器
     */
    void bubbleSelectors(NestedAtRule media, List<Selector> selectors) {
        if (selectors == null || selectors.isEmpty() || media.getRules() == null || media.getRules().isEmpty()) {
            return;
        }
        List<Node> inner = new ArrayList<>();
        inner.add(media.getRules().get(0));
        List<Node> rules = new ArrayList<>();
        rules.add(new Ruleset(new ArrayList<>(selectors), inner));
        media.setRules(rules);
    }
}
