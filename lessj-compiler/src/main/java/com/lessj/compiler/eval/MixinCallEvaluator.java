package com.lessj.compiler.eval;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Frame;
import com.lessj.compiler.ast.rule.FrameChain;
import com.lessj.compiler.ast.rule.MixinArgument;
import com.lessj.compiler.ast.rule.MixinCall;
import com.lessj.compiler.ast.rule.MixinCandidate;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.MixinParameter;
import com.lessj.compiler.ast.rule.RuleBlock;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.function.Predicate;

/**
 * mixin 调用：候选查找、参数匹配、守卫（含 default()）与展开
 *
 * <p>由内向外逐帧查找候选；第一个有匹配的帧决定结果。普通规则集也可以作为
 * 无参数 mixin 调用，正在求值的规则集不会调用自身。</p>
 */
final class MixinCallEvaluator {
    private static final int DEF_NONE = 0;
    private static final int DEF_TRUE = 1;
    private static final int DEF_FALSE = 2;
    private static final int DEF_FALSE_EITHER_CASE = -1;

    private final Evaluator evaluator;

    MixinCallEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /** 一个通过参数匹配的候选及其 default() 分组 */
    private static final class Candidate {
        final RuleBlock mixin;
        final int group;

        Candidate(RuleBlock mixin, int group) {
            this.mixin = mixin;
            this.group = group;
        }
    }

    /**
     * 展开 mixin 调用
     *
     * @param blocked 调用本身不可见（位于引用导入中）时，展开结果也不可见
     * @return 展开得到的规则
     */
    List<Node> evaluate(MixinCall call, EvalContext context, boolean blocked) {
        Selector selector = (Selector) evaluator.eval(call.getSelector(), context);
        List<MixinArgument> args = evalArguments(call, context);
        DefaultGuard guard = context.getSession().getDefaultGuard();
        Predicate<RuleBlock> noArgsFilter = rule -> matchArgs(rule, Collections.<MixinArgument>emptyList(), context);

        boolean found = false;
        boolean allRecursive = true;
        List<Node> rules = new ArrayList<>();
        for (Frame frame : context.getFrames()) {
            List<MixinCandidate> mixins = frame.find(selector, null, noArgsFilter);
            if (mixins.isEmpty()) {
                continue;
            }
            found = true;
            boolean match = false;
            List<Candidate> candidates = new ArrayList<>();
            try {
                for (MixinCandidate mc : mixins) {
                    RuleBlock mixin = mc.getRule();
                    if (isRecursive(mixin, context.getFrames())) {
                        continue;
                    }
                    allRecursive = false;
                    if (matchArgs(mixin, args, context)) {
                        int group = calcDefGroup(mixin, mc.getPath(), args, context, guard);
                        if (group != DEF_FALSE_EITHER_CASE) {
                            candidates.add(new Candidate(mixin, group));
                        }
                        match = true;
                    }
                }
            } finally {
                guard.reset();
            }

            int[] count = new int[3];
            for (Candidate c : candidates) {
                count[c.group]++;
            }
            int defaultResult;
            if (count[DEF_NONE] > 0) {
                defaultResult = DEF_FALSE;
            } else {
                defaultResult = DEF_TRUE;
                if (count[DEF_TRUE] + count[DEF_FALSE] > 1) {
                    throw new EvalException(ErrorKind.RUNTIME, "Ambiguous use of `default()` found when matching for `"
                            + format(selector, args, context) + "`", call);
                }
            }

            for (Candidate c : candidates) {
                if (c.group == DEF_NONE || c.group == defaultResult) {
                    try {
                        rules.addAll(expand(c.mixin, args, call, context, blocked));
                    } catch (EvalException e) {
                        throw e.locatedAt(call);
                    }
                }
            }
            if (match) {
                return rules;
            }
        }
        if (found) {
            // 所有候选都是正在求值的规则集自身，调用静默地不产生任何规则
            if (allRecursive) {
                return rules;
            }
            throw new EvalException(ErrorKind.RUNTIME, "No matching definition was found for `"
                    + format(selector, args, context) + "`", call);
        }
        throw new EvalException(ErrorKind.NAME, context.toCss(selector).trim() + " is undefined", call);
    }

    /**
     * 求值实参；带 ... 的实参若为列表则展开为多个位置参数
     */
    private List<MixinArgument> evalArguments(MixinCall call, EvalContext context) {
        List<MixinArgument> args = new ArrayList<>();
        for (MixinArgument arg : call.getArgs()) {
            Node value = evaluator.eval(arg.getValue(), context);
            if (arg.isExpand() && (value instanceof Value || value instanceof Expression)) {
                List<Node> items = value instanceof Value
                        ? ((Value) value).getValue() : ((Expression) value).getValue();
                for (Node item : items) {
                    args.add(new MixinArgument(null, item, false));
                }
            } else {
                args.add(new MixinArgument(arg.getName(), value, false));
            }
        }
        return args;
    }

    private static boolean isRecursive(RuleBlock mixin, FrameChain frames) {
        if (mixin instanceof MixinDefinition) {
            return false;
        }
        Ruleset candidate = (Ruleset) mixin;
        Ruleset candidateOrigin = candidate.getOriginalRuleset() != null ? candidate.getOriginalRuleset() : candidate;
        for (Frame frame : frames) {
            Frame origin = frame;
            if (frame instanceof Ruleset && ((Ruleset) frame).getOriginalRuleset() != null) {
                origin = ((Ruleset) frame).getOriginalRuleset();
            }
            if (origin == candidate || origin == candidateOrigin) {
                return true;
            }
        }
        return false;
    }

    // ============ 匹配 ============

    private boolean matchArgs(RuleBlock rule, List<MixinArgument> args, EvalContext context) {
        if (!(rule instanceof MixinDefinition)) {
            return args.isEmpty();
        }
        MixinDefinition def = (MixinDefinition) rule;
        int requiredArgs = 0;
        for (MixinArgument arg : args) {
            if (arg.getName() == null || !def.getOptionalParameters().contains(arg.getName())) {
                requiredArgs++;
            }
        }
        if (!def.isVariadic()) {
            if (requiredArgs < def.getRequired() || args.size() > def.getParams().size()) {
                return false;
            }
        } else if (requiredArgs < def.getRequired() - 1) {
            return false;
        }
        int len = Math.min(requiredArgs, def.getArity());
        for (int i = 0; i < len; i++) {
            MixinParameter param = def.getParams().get(i);
            if (param.isPattern()) {
                String actual = context.toCss(evaluator.eval(args.get(i).getValue(), context));
                String expected = context.toCss(evaluator.eval(param.getValue(), context));
                if (!actual.equals(expected)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean matchCondition(RuleBlock rule, List<MixinArgument> args, EvalContext context) {
        if (rule instanceof MixinDefinition) {
            MixinDefinition def = (MixinDefinition) rule;
            if (def.getCondition() == null) {
                return true;
            }
            FrameChain frames = frames(def).concat(context.getFrames());
            Ruleset paramFrame = evalParams(def, context, context.derive(frames), args, new ArrayList<Node>());
            EvalContext guardContext = context.derive(frames.push(paramFrame));
            return Evaluator.isTruthy(evaluator.eval(def.getCondition(), guardContext));
        }
        List<Selector> selectors = rule.getSelectors();
        if (selectors == null || selectors.isEmpty()) {
            return true;
        }
        Selector last = selectors.get(selectors.size() - 1);
        if (!last.isOutput()) {
            return false;
        }
        return last.getCondition() == null
                || Evaluator.isTruthy(evaluator.eval(last.getCondition(), context.derive(context.getFrames())));
    }

    /**
     * 分别以 default() 为 false 与 true 计算守卫，得到候选所属的分组
     */
    private int calcDefGroup(RuleBlock mixin, List<RuleBlock> path, List<MixinArgument> args,
                             EvalContext context, DefaultGuard guard) {
        boolean[] result = new boolean[2];
        for (int f = 0; f < 2; f++) {
            guard.value(f == 1);
            boolean ok = true;
            for (int p = 0; p < path.size() && ok; p++) {
                ok = matchCondition(path.get(p), Collections.<MixinArgument>emptyList(), context);
            }
            result[f] = ok && matchCondition(mixin, args, context);
        }
        if (result[0] || result[1]) {
            if (result[0] != result[1]) {
                return result[1] ? DEF_TRUE : DEF_FALSE;
            }
            return DEF_NONE;
        }
        return DEF_FALSE_EITHER_CASE;
    }

    // ============ 展开 ============

    private List<Node> expand(RuleBlock mixin, List<MixinArgument> args, MixinCall call,
                              EvalContext context, boolean blocked) {
        MixinDefinition def;
        Ruleset original = null;
        if (mixin instanceof MixinDefinition) {
            def = (MixinDefinition) mixin;
        } else {
            Ruleset ruleset = (Ruleset) mixin;
            original = ruleset.getOriginalRuleset() != null ? ruleset.getOriginalRuleset() : ruleset;
            def = new MixinDefinition("", null, ruleset.getRules(), null, false, null,
                    ruleset.getIndex(), ruleset.getFileInfo());
            def.copyVisibilityInfo(original.visibilityInfo());
        }
        Ruleset result = evalCall(def, args, call.isImportant(), original, context);
        List<Node> rules = result.getRules();
        if (blocked) {
            for (Node rule : rules) {
                rule.addVisibilityBlock();
            }
        }
        return rules;
    }

    private Ruleset evalCall(MixinDefinition def, List<MixinArgument> args, boolean important,
                             Ruleset original, EvalContext context) {
        EvalSession session = context.getSession();
        session.enterMixin();
        try {
            FrameChain mixinFrames = frames(def).concat(context.getFrames());
            List<Node> evaldArguments = new ArrayList<>();
            Ruleset frame = evalParams(def, context, context.derive(mixinFrames), args, evaldArguments);
            Node arguments = evaluator.eval(new Expression(evaldArguments), context);
            prepend(frame, variable("@arguments", arguments, def));

            List<Node> rules = def.getRules() == null ? new ArrayList<Node>() : new ArrayList<>(def.getRules());
            Ruleset body = new Ruleset(null, rules, false, def.getIndex(), def.getFileInfo());
            body.copyVisibilityInfo(def.visibilityInfo());
            EvalContext callContext = context.derive(mixinFrames.push(frame).push(def));
            Ruleset result = evaluator.rulesets.evaluate(body, callContext, original != null ? original : body,
                    new IdentityHashMap<Node, Integer>());
            return important ? makeImportant(result) : result;
        } finally {
            session.leaveMixin();
        }
    }

    /**
     * 把实参绑定为参数帧中的变量
     *
     * @param mixinEnv       求值参数默认值的环境（定义处帧在内、调用处帧在外）
     * @param evaldArguments 输出：按位置排列的实参值，用于 @arguments
     */
    private Ruleset evalParams(MixinDefinition def, EvalContext context, EvalContext mixinEnv,
                               List<MixinArgument> args, List<Node> evaldArguments) {
        Ruleset frame = new Ruleset(null, new ArrayList<Node>());
        EvalContext env = mixinEnv.derive(mixinEnv.getFrames().push(frame));
        List<MixinParameter> params = def.getParams();
        Node[] evald = new Node[Math.max(params.size(), args.size())];
        List<MixinArgument> positional = new ArrayList<>(args);
        int argsLength = positional.size();

        for (int i = 0; i < positional.size(); i++) {
            MixinArgument arg = positional.get(i);
            String name = arg.getName();
            if (name == null) {
                continue;
            }
            boolean bound = false;
            for (int j = 0; j < params.size(); j++) {
                if (evald[j] == null && name.equals(params.get(j).getName())) {
                    evald[j] = evaluator.eval(arg.getValue(), context);
                    prepend(frame, variable(name, evald[j], def));
                    bound = true;
                    break;
                }
            }
            if (!bound) {
                throw new EvalException(ErrorKind.RUNTIME,
                        "Named argument for " + def.getName() + " " + name + " not found");
            }
            positional.remove(i--);
        }

        int argIndex = 0;
        for (int i = 0; i < params.size(); i++) {
            if (evald[i] != null) {
                continue;
            }
            MixinParameter param = params.get(i);
            MixinArgument arg = argIndex < positional.size() ? positional.get(argIndex) : null;
            String name = param.getName();
            if (name != null) {
                if (param.isVariadic()) {
                    List<Node> varargs = new ArrayList<>();
                    for (int j = argIndex; j < positional.size(); j++) {
                        varargs.add(evaluator.eval(positional.get(j).getValue(), context));
                    }
                    prepend(frame, variable(name, evaluator.eval(new Expression(varargs), context), def));
                } else {
                    Node value;
                    if (arg != null && arg.getValue() != null) {
                        value = evaluator.eval(arg.getValue(), context);
                    } else if (param.getValue() != null) {
                        value = evaluator.eval(param.getValue(), env);
                        frame.resetCache();
                    } else {
                        throw new EvalException(ErrorKind.RUNTIME, "wrong number of arguments for " + def.getName()
                                + " (" + argsLength + " for " + def.getArity() + ")");
                    }
                    prepend(frame, variable(name, value, def));
                    evald[i] = value;
                }
            } else if (!param.isVariadic() && arg != null) {
                evald[i] = evaluator.eval(arg.getValue(), context);
            }
            if (param.isVariadic()) {
                for (int j = argIndex; j < positional.size(); j++) {
                    evald[j] = evaluator.eval(positional.get(j).getValue(), context);
                }
            }
            argIndex++;
        }

        for (Node n : evald) {
            if (n != null) {
                evaldArguments.add(n);
            }
        }
        return frame;
    }

    private static FrameChain frames(MixinDefinition def) {
        return def.getFrames() == null ? FrameChain.EMPTY : def.getFrames();
    }

    private static Declaration variable(String name, Node value, Node at) {
        return new Declaration(name, value, null, null, at.getIndex(), at.getFileInfo(), false, true);
    }

    private static void prepend(Ruleset frame, Declaration declaration) {
        frame.getRules().add(0, declaration);
        frame.resetCache();
    }

    /**
     * !important 调用：结果中的声明（含嵌套规则集中的）全部加上 !important
     */
    static Ruleset makeImportant(Ruleset ruleset) {
        List<Node> rules = new ArrayList<>();
        if (ruleset.getRules() != null) {
            for (Node rule : ruleset.getRules()) {
                if (rule instanceof Declaration) {
                    Declaration d = (Declaration) rule;
                    rules.add(d.withValue(d.getValue(), "!important"));
                } else if (rule instanceof Ruleset) {
                    rules.add(makeImportant((Ruleset) rule));
                } else {
                    rules.add(rule);
                }
            }
        }
        Ruleset result = new Ruleset(ruleset.getSelectors(), rules, ruleset.isStrictImports(),
                ruleset.getIndex(), ruleset.getFileInfo());
        result.copyVisibilityInfo(ruleset.visibilityInfo());
        return result;
    }

    /** 错误信息中的调用形式，如 .m(1px, @b:2) */
    private static String format(Selector selector, List<MixinArgument> args, EvalContext context) {
        StringBuilder sb = new StringBuilder(context.toCss(selector).trim()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            MixinArgument arg = args.get(i);
            if (arg.getName() != null) {
                sb.append(arg.getName()).append(':');
            }
            sb.append(context.toCss(arg.getValue()));
        }
        return sb.append(')').toString();
    }
}
