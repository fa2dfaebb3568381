package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.MixinParameter;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.DetachedRuleset;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表函数：length、extract、range、each
 */
final class ListFunctions {

    private ListFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addBuiltin("length", (ctx, args) ->
                new Dimension(Args.items(Args.required(args, 0, "first")).size()));
        registry.addBuiltin("extract", (ctx, args) -> {
            List<Node> items = Args.items(Args.required(args, 0, "first"));
            int index = (int) Args.amount(Args.required(args, 1, "second")) - 1;
            // 越界时不处理，按原样输出
            return index >= 0 && index < items.size() ? items.get(index) : null;
        });
        registry.addBuiltin("range", (ctx, args) -> range(args));
        registry.addBuiltin("each", ListFunctions::each);
    }

    /**
     * range(end) 从 1 开始；range(start, end[, step])，结果使用 end 的单位
     */
    private static Node range(List<Node> args) {
        Dimension start = Args.dimension(Args.required(args, 0, "first"));
        double from;
        double step = 1;
        Dimension to;
        if (args.size() > 1) {
            to = Args.dimension(args.get(1));
            from = start.getValue();
            if (args.size() > 2) {
                step = Args.amount(args.get(2));
            }
        } else {
            from = 1;
            to = start;
        }
        if (step <= 0) {
            throw new IllegalArgumentException("step must be a positive number");
        }
        List<Node> list = new ArrayList<>();
        Unit unit = to.getUnit();
        for (double i = from; i <= to.getValue(); i += step) {
            list.add(new Dimension(i, unit));
        }
        return new Expression(list);
    }

    /**
     * each(list, ruleset)：对每个元素求值一次规则集，规则集中可使用 @value、@key、@index；
     * 第二个参数为匿名 mixin 时按其参数名绑定
     */
    private static Node each(FunctionContext ctx, List<Node> args) {
        Node list = Args.required(args, 0, "first");
        Node body = Args.required(args, 1, "second");

        List<Node> iterator;
        if (list instanceof DetachedRuleset) {
            Node evaluated = ctx.evaluate(((DetachedRuleset) list).getRuleset());
            iterator = evaluated instanceof Ruleset && ((Ruleset) evaluated).getRules() != null
                    ? ((Ruleset) evaluated).getRules()
                    : Collections.<Node>emptyList();
        } else if (list instanceof Ruleset) {
            iterator = ((Ruleset) list).rulesCopy();
        } else {
            iterator = Args.items(list);
        }

        String valueName = "@value";
        String keyName = "@key";
        String indexName = "@index";
        List<Node> template;
        boolean strictImports = false;
        if (body instanceof MixinDefinition) {
            List<MixinParameter> params = ((MixinDefinition) body).getParams();
            valueName = paramName(params, 0);
            keyName = paramName(params, 1);
            indexName = paramName(params, 2);
            template = ((MixinDefinition) body).getRules();
        } else if (body instanceof DetachedRuleset) {
            Ruleset ruleset = ((DetachedRuleset) body).getRuleset();
            template = ruleset.getRules();
            strictImports = ruleset.isStrictImports();
        } else {
            throw new IllegalArgumentException("the second argument to each must be a detached ruleset or mixin");
        }

        List<Node> rules = new ArrayList<>();
        for (int i = 0; i < iterator.size(); i++) {
            Node item = iterator.get(i);
            if (item instanceof Comment) {
                continue;
            }
            Node key;
            Node value;
            if (item instanceof Declaration) {
                key = new Anonymous(((Declaration) item).getName());
                value = ((Declaration) item).getValue();
            } else {
                key = new Dimension(i + 1);
                value = item;
            }
            List<Node> newRules = template == null ? new ArrayList<Node>() : new ArrayList<>(template);
            if (valueName != null) {
                newRules.add(variable(valueName, value, ctx));
            }
            if (indexName != null) {
                newRules.add(variable(indexName, new Dimension(i + 1), ctx));
            }
            if (keyName != null) {
                newRules.add(variable(keyName, key, ctx));
            }
            rules.add(new Ruleset(parentSelector(ctx), newRules, strictImports, ctx.getIndex(), ctx.getFileInfo()));
        }
        Ruleset wrapper = new Ruleset(parentSelector(ctx), rules, strictImports, ctx.getIndex(), ctx.getFileInfo());
        return ctx.evaluate(wrapper);
    }

    private static String paramName(List<MixinParameter> params, int i) {
        return params != null && i < params.size() ? params.get(i).getName() : null;
    }

    private static Declaration variable(String name, Node value, FunctionContext ctx) {
        return new Declaration(name, value, null, null, ctx.getIndex(), ctx.getFileInfo(), false, true);
    }

    private static List<Selector> parentSelector(FunctionContext ctx) {
        Element amp = new Element(Combinator.NONE, "&", ctx.getIndex(), ctx.getFileInfo());
        List<Selector> selectors = new ArrayList<>();
        selectors.add(new Selector(Collections.singletonList(amp), null, null, ctx.getIndex(), ctx.getFileInfo()));
        return selectors;
    }
}
