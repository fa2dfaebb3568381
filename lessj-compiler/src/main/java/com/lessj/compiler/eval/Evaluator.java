package com.lessj.compiler.eval;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;
import com.lessj.compiler.MathMode;
import com.lessj.compiler.RewriteUrls;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Container;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.Frame;
import com.lessj.compiler.ast.rule.FrameChain;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.Media;
import com.lessj.compiler.ast.rule.MixinCall;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.RuleBlock;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.rule.VariableCall;
import com.lessj.compiler.ast.selector.Attribute;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Assignment;
import com.lessj.compiler.ast.value.Call;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Condition;
import com.lessj.compiler.ast.value.DetachedRuleset;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.NamespaceValue;
import com.lessj.compiler.ast.value.Negative;
import com.lessj.compiler.ast.value.Operation;
import com.lessj.compiler.ast.value.Paren;
import com.lessj.compiler.ast.value.Property;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.UnicodeDescriptor;
import com.lessj.compiler.ast.value.Url;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.ast.value.Variable;
import com.lessj.compiler.function.FunctionRegistry;
import com.lessj.compiler.function.PluginException;
import com.lessj.compiler.output.CssEmitter;
import com.lessj.compiler.visitor.ToCssVisitor;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 求值器：把解析树求值为只含具体值的树
 *
 * <p>值节点在这里直接求值；规则集、mixin 调用、媒体查询与导入分别委托给
 * {@link RulesetEvaluator}、{@link MixinCallEvaluator}、{@link NestedAtRuleEvaluator}、
 * {@link ImportEvaluator}。求值从不修改解析树：规则级节点每次都求值为新节点，
 * 同一棵解析树可以被多次 mixin 调用或多次编译复用。</p>
 */
public final class Evaluator implements NodeVisitor<Node, EvalContext> {
    private static final Pattern DATA_URI = Pattern.compile("^\\s*data:");

    final RulesetEvaluator rulesets;
    final MixinCallEvaluator mixins;
    final NestedAtRuleEvaluator atRules;
    final ImportEvaluator imports;

    public Evaluator() {
        this.rulesets = new RulesetEvaluator(this);
        this.mixins = new MixinCallEvaluator(this);
        this.atRules = new NestedAtRuleEvaluator(this);
        this.imports = new ImportEvaluator(this);
    }

    /**
     * 求值样式表根节点
     */
    public Ruleset evaluate(Ruleset root, EvalContext context) {
        return rulesets.evaluate(root, context);
    }

    public Node eval(Node node, EvalContext context) {
        return node.accept(this, context);
    }

    // ============ 字面量 ============

    @Override
    public Node visitAnonymous(Anonymous node, EvalContext context) {
        return new Anonymous(node.getValue(), node.getIndex(), node.getFileInfo(), node.isMapLines(),
                node.isRulesetLike()).withVisibility(node.visibilityInfo());
    }

    @Override
    public Node visitKeyword(Keyword node, EvalContext context) {
        return node;
    }

    @Override
    public Node visitDimension(Dimension node, EvalContext context) {
        return node;
    }

    @Override
    public Node visitColor(Color node, EvalContext context) {
        return node;
    }

    @Override
    public Node visitUnicodeDescriptor(UnicodeDescriptor node, EvalContext context) {
        return node;
    }

    @Override
    public Node visitCombinator(Combinator node, EvalContext context) {
        return node;
    }

    /**
     * 字符串插值 @{var} 与 ${prop}，反复替换直到结果不再变化
     */
    @Override
    public Node visitQuoted(Quoted node, EvalContext context) {
        String value = node.getValue();
        value = interpolate(value, Quoted.VARIABLE_INTERPOLATION, node, context, true);
        value = interpolate(value, Quoted.PROPERTY_INTERPOLATION, node, context, false);
        return new Quoted(node.getQuote(), value, node.isEscaped(), node.getIndex(), node.getFileInfo());
    }

    private String interpolate(String value, Pattern pattern, Quoted node, EvalContext context, boolean variable) {
        String current = value;
        while (true) {
            Matcher m = pattern.matcher(current);
            StringBuffer sb = new StringBuffer();
            boolean found = false;
            while (m.find()) {
                found = true;
                Node ref = variable
                        ? new Variable("@" + m.group(1), node.getIndex(), node.getFileInfo())
                        : new Property("$" + m.group(1), node.getIndex(), node.getFileInfo());
                Node v = eval(ref, context);
                String text = v instanceof Quoted ? ((Quoted) v).getValue() : CssEmitter.toCss(v, false, false);
                m.appendReplacement(sb, Matcher.quoteReplacement(text));
            }
            if (!found) {
                return current;
            }
            m.appendTail(sb);
            String next = sb.toString();
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    /**
     * url()：按所在文件的 rootpath 重写相对路径，并追加 urlArgs
     */
    @Override
    public Node visitUrl(Url node, EvalContext context) {
        Node val = eval(node.getValue(), context);
        if (!node.isEvaluated()) {
            String text = textOf(val);
            if (text != null) {
                FileInfo fileInfo = node.getFileInfo();
                String rootpath = fileInfo == null ? null : fileInfo.getRootpath();
                if (rootpath != null && requiresRewrite(text, context)) {
                    boolean quoted = val instanceof Quoted && !((Quoted) val).getQuote().isEmpty();
                    if (!quoted) {
                        rootpath = PathUtils.escapeUrlPath(rootpath);
                    }
                    text = PathUtils.rewritePath(text, rootpath);
                } else {
                    text = PathUtils.normalize(text);
                }
                String urlArgs = context.getOptions().getUrlArgs();
                if (!urlArgs.isEmpty() && !DATA_URI.matcher(text).find()) {
                    String args = (text.indexOf('?') == -1 ? "?" : "&") + urlArgs;
                    if (text.indexOf('#') != -1) {
                        text = text.replaceFirst("#", Matcher.quoteReplacement(args) + "#");
                    } else {
                        text = text + args;
                    }
                }
                val = withText(val, text);
            }
        }
        return new Url(val, node.getIndex(), node.getFileInfo(), true);
    }

    static boolean requiresRewrite(String path, EvalContext context) {
        if (context.getOptions().effectiveRewriteUrls() == RewriteUrls.LOCAL) {
            return PathUtils.isLocalRelative(path);
        }
        return PathUtils.isRelative(path);
    }

    /** Quoted 与 Anonymous 的文本，其他节点返回 null */
    static String textOf(Node node) {
        if (node instanceof Quoted) {
            return ((Quoted) node).getValue();
        }
        if (node instanceof Anonymous) {
            return ((Anonymous) node).getValue();
        }
        return null;
    }

    static Node withText(Node node, String text) {
        if (node instanceof Quoted) {
            return ((Quoted) node).withValue(text);
        }
        return new Anonymous(text, node.getIndex(), node.getFileInfo());
    }

    // ============ 变量与属性 ============

    /**
     * 由内向外查找变量；@@name 先求出 @name 的值再以其为变量名
     */
    @Override
    public Node visitVariable(Variable node, EvalContext context) {
        String name = node.getName();
        if (name.startsWith("@@")) {
            Node inner = visitVariable(new Variable(name.substring(1), node.getIndex(), node.getFileInfo()), context);
            name = "@" + plainText(inner, context);
        }
        EvalSession session = context.getSession();
        session.enter(node, "Recursive variable definition for " + name);
        try {
            for (Frame frame : context.getFrames()) {
                Declaration declaration = frame.variable(name);
                if (declaration == null) {
                    continue;
                }
                declaration = session.parsed(declaration);
                if (declaration.isImportant()) {
                    context.markImportant(declaration.getImportant());
                }
                if (context.isInCalc()) {
                    return evalAsCalcOperand(declaration.getValue(), context);
                }
                return eval(declaration.getValue(), context);
            }
        } finally {
            session.leave(node);
        }
        throw new EvalException(ErrorKind.NAME, "variable " + name + " is undefined", node);
    }

    /**
     * calc() 中引用的变量照常做数学运算，结果再作为 calc 的参数
     */
    private Node evalAsCalcOperand(Node value, EvalContext context) {
        boolean mathOn = context.isMathEnabled();
        context.setMathEnabled(true);
        context.enterCalc();
        try {
            return unwrapArgument(eval(value, context));
        } finally {
            context.exitCalc();
            context.setMathEnabled(mathOn);
        }
    }

    /**
     * $name：取最近作用域中同名声明（合并 + / +_ 后）的最后一个值
     */
    @Override
    public Node visitProperty(Property node, EvalContext context) {
        String name = node.getName();
        EvalSession session = context.getSession();
        session.enter(node, "Recursive property reference for " + name);
        try {
            for (Frame frame : context.getFrames()) {
                List<Declaration> found = frame.property(name.substring(1));
                if (found.isEmpty()) {
                    continue;
                }
                List<Node> copies = new ArrayList<>();
                for (Declaration d : found) {
                    copies.add(session.parsed(d).withValue(session.parsed(d).getValue(), d.getImportant()));
                }
                ToCssVisitor.mergeRules(copies);
                Declaration last = (Declaration) copies.get(copies.size() - 1);
                if (last.isImportant()) {
                    context.markImportant(last.getImportant());
                }
                return eval(last.getValue(), context);
            }
        } finally {
            session.leave(node);
        }
        throw new EvalException(ErrorKind.NAME, "Property '" + name + "' is undefined", node);
    }

    /** @@ 间接引用与 [@@x] 取值使用的名称文本 */
    String plainText(Node node, EvalContext context) {
        if (node instanceof Quoted) {
            return ((Quoted) node).getValue();
        }
        if (node instanceof Keyword) {
            return ((Keyword) node).getValue();
        }
        if (node instanceof Anonymous) {
            return ((Anonymous) node).getValue();
        }
        return context.toCss(node);
    }

    // ============ 运算 ============

    @Override
    public Node visitOperation(Operation node, EvalContext context) {
        Node a = eval(node.getLeft(), context);
        Node b = eval(node.getRight(), context);
        if (!context.isMathOn(node.getOp())) {
            return new Operation(node.getOp(), a, b, node.isSpaced(), node.getIndex(), node.getFileInfo());
        }
        String op = "./".equals(node.getOp()) ? "/" : node.getOp();
        if (a instanceof Dimension && b instanceof Color) {
            a = ((Dimension) a).toColor();
        }
        if (b instanceof Dimension && a instanceof Color) {
            b = ((Dimension) b).toColor();
        }
        try {
            if (a instanceof Dimension && b instanceof Dimension) {
                return Operations.operate((Dimension) a, op, (Dimension) b, context.getOptions().isStrictUnits());
            }
            if (a instanceof Color && b instanceof Color) {
                return Operations.operate((Color) a, op, (Color) b);
            }
        } catch (EvalException e) {
            throw e.locatedAt(node);
        }
        if ((a instanceof Operation || b instanceof Operation)
                && a instanceof Operation && "/".equals(((Operation) a).getOp())
                && context.getMath() == MathMode.PARENS_DIVISION) {
            return new Operation(node.getOp(), a, b, node.isSpaced(), node.getIndex(), node.getFileInfo());
        }
        throw new EvalException(ErrorKind.OPERATION, "Operation on an invalid type", node);
    }

    @Override
    public Node visitNegative(Negative node, EvalContext context) {
        if (context.isMathOn()) {
            Operation negate = new Operation("*", new Dimension(-1), node.getValue(), false,
                    node.getIndex(), node.getFileInfo());
            return eval(negate, context);
        }
        return new Negative(eval(node.getValue(), context));
    }

    /**
     * 表达式：括号内开启除法；多余的双层括号在关闭数学运算时保留一层
     */
    @Override
    public Node visitExpression(Expression node, EvalContext context) {
        boolean mathOn = context.isMathOn();
        boolean inParens = node.isParens();
        boolean doubleParen = false;
        Node result;
        if (inParens) {
            context.enterParens();
        }
        try {
            List<Node> items = node.getValue();
            if (items.size() > 1) {
                List<Node> evaluated = new ArrayList<>(items.size());
                for (Node item : items) {
                    evaluated.add(eval(item, context));
                }
                result = new Expression(evaluated, node.isNoSpacing(), node.getIndex(), node.getFileInfo());
            } else if (items.size() == 1) {
                Node only = items.get(0);
                if (only instanceof Expression && ((Expression) only).isParens()
                        && !((Expression) only).isParensInOp() && !context.isInCalc()) {
                    doubleParen = true;
                }
                result = eval(only, context);
            } else {
                result = node;
            }
        } finally {
            if (inParens) {
                context.exitParens();
            }
        }
        if (node.isParens() && node.isParensInOp() && !mathOn && !doubleParen && !(result instanceof Dimension)) {
            result = new Paren(result);
        }
        return result;
    }

    @Override
    public Node visitValue(Value node, EvalContext context) {
        List<Node> items = node.getValue();
        if (items.size() == 1) {
            return eval(items.get(0), context);
        }
        List<Node> evaluated = new ArrayList<>(items.size());
        for (Node item : items) {
            evaluated.add(eval(item, context));
        }
        return new Value(evaluated, node.getIndex(), node.getFileInfo());
    }

    @Override
    public Node visitParen(Paren node, EvalContext context) {
        return new Paren(eval(node.getValue(), context));
    }

    @Override
    public Node visitAssignment(Assignment node, EvalContext context) {
        return new Assignment(node.getKey(), eval(node.getValue(), context));
    }

    /**
     * 守卫条件，结果为 Keyword true / false
     */
    @Override
    public Node visitCondition(Condition node, EvalContext context) {
        Node a = eval(node.getLvalue(), context);
        Node b = eval(node.getRvalue(), context);
        boolean result;
        switch (node.getOp()) {
            case "and":
                result = isTruthy(a) && isTruthy(b);
                break;
            case "or":
                result = isTruthy(a) || isTruthy(b);
                break;
            default:
                result = compareResult(node.getOp(), Operations.compare(a, b));
                break;
        }
        return Keyword.of(node.isNegate() != result);
    }

    private static boolean compareResult(String op, Integer cmp) {
        if (cmp == null) {
            return false;
        }
        switch (cmp) {
            case -1:
                return "<".equals(op) || "=<".equals(op) || "<=".equals(op);
            case 0:
                return "=".equals(op) || ">=".equals(op) || "=<".equals(op) || "<=".equals(op);
            case 1:
                return ">".equals(op) || ">=".equals(op) || "=>".equals(op);
            default:
                return false;
        }
    }

    /** 条件求值结果的真假：只有关键字 false 为假 */
    static boolean isTruthy(Node node) {
        if (node == null) {
            return false;
        }
        if (node instanceof Keyword) {
            return !"false".equals(((Keyword) node).getValue());
        }
        return true;
    }

    // ============ 函数调用 ============

    /**
     * 函数调用；未注册或返回 null 的函数按 name(args) 原样输出
     *
     * <p>calc() 内关闭数学运算。函数体抛出的未定位错误包装为
     * "Error evaluating function"，已定位的错误原样抛出。</p>
     */
    @Override
    public Node visitCall(Call node, EvalContext context) {
        boolean mathOn = context.isMathEnabled();
        boolean calc = node.isCalc() || context.isInCalc();
        context.setMathEnabled(!node.isCalc());
        if (calc) {
            context.enterCalc();
        }
        try {
            FunctionRegistry.Entry entry = context.getSession().getFunctions().get(node.getName());
            if (entry != null) {
                Node result = invoke(entry, node, context);
                if (result != null) {
                    return result;
                }
            }
            List<Node> args = new ArrayList<>(node.getArgs().size());
            for (Node arg : node.getArgs()) {
                args.add(eval(arg, context));
            }
            return new Call(node.getName(), args, node.getIndex(), node.getFileInfo());
        } finally {
            if (calc) {
                context.exitCalc();
            }
            context.setMathEnabled(mathOn);
        }
    }

    private Node invoke(FunctionRegistry.Entry entry, Call node, EvalContext context) {
        try {
            List<Node> args = new ArrayList<>(node.getArgs().size());
            for (Node arg : node.getArgs()) {
                Node value = entry.isEvaluateArgs() ? eval(arg, context) : arg;
                if (!(value instanceof Comment)) {
                    args.add(unwrapArgument(value));
                }
            }
            return entry.getFunction().call(new EvalFunctionContext(this, context, node), args);
        } catch (EvalException e) {
            if (e.isLocated()) {
                throw e;
            }
            throw new EvalException(e.getKind(), functionError(node, e.getRawMessage()),
                    EvalException.filenameOf(node), node.getIndex(), e);
        } catch (LessException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = functionError(node, e.getMessage());
            if (entry.isBuiltin()) {
                throw new EvalException(ErrorKind.ARGUMENT, message, EvalException.filenameOf(node),
                        node.getIndex(), e);
            }
            throw new PluginException(message, EvalException.filenameOf(node), node.getIndex(), e);
        }
    }

    private static String functionError(Call node, String message) {
        String base = "Error evaluating function `" + node.getName() + "`";
        return message == null || message.isEmpty() ? base : base + ": " + message;
    }

    /**
     * 函数参数的规整：去掉表达式中的注释，单元素表达式展开为元素本身
     * （括号中的除法保留括号）
     */
    static Node unwrapArgument(Node value) {
        if (!(value instanceof Expression)) {
            return value;
        }
        Expression expression = (Expression) value;
        List<Node> items = new ArrayList<>();
        for (Node item : expression.getValue()) {
            if (!(item instanceof Comment)) {
                items.add(item);
            }
        }
        if (items.size() == 1) {
            Node only = items.get(0);
            if (expression.isParens() && only instanceof Operation && "/".equals(((Operation) only).getOp())) {
                return expression;
            }
            return only;
        }
        return new Expression(items);
    }

    // ============ 命名空间与分离规则集 ============

    /**
     * #ns.mixin()[@x]、@dr[$y]、.m()[]：在调用结果中依次取值
     */
    @Override
    public Node visitNamespaceValue(NamespaceValue node, EvalContext context) {
        Node rules = eval(node.getValue(), context);
        for (String lookup : node.getLookups()) {
            Declaration found;
            if (lookup.isEmpty()) {
                found = rules instanceof RuleBlock ? ((RuleBlock) rules).lastDeclaration() : null;
                if (found == null) {
                    throw new EvalException(ErrorKind.NAME, "no declaration found in lookup", node);
                }
            } else if (lookup.charAt(0) == '@') {
                String name = lookup;
                if (name.startsWith("@@")) {
                    name = "@" + plainText(eval(new Variable(name.substring(1), node.getIndex(),
                            node.getFileInfo()), context), context);
                }
                found = rules instanceof RuleBlock ? ((RuleBlock) rules).variable(name) : null;
                if (found == null) {
                    throw new EvalException(ErrorKind.NAME, "variable " + name + " not found", node);
                }
            } else {
                String name;
                if (lookup.startsWith("$@")) {
                    name = plainText(eval(new Variable(lookup.substring(1), node.getIndex(),
                            node.getFileInfo()), context), context);
                } else {
                    name = lookup.charAt(0) == '$' ? lookup.substring(1) : lookup;
                }
                List<Declaration> props = rules instanceof RuleBlock
                        ? ((RuleBlock) rules).property(name) : new ArrayList<Declaration>();
                if (props.isEmpty()) {
                    throw new EvalException(ErrorKind.NAME, "property \"" + name + "\" not found", node);
                }
                found = props.get(props.size() - 1);
            }
            found = context.getSession().parsed(found);
            rules = ((Declaration) eval(found, context)).getValue();
            if (rules instanceof DetachedRuleset) {
                rules = eval(((DetachedRuleset) rules).getRuleset(), context);
            }
        }
        return rules;
    }

    @Override
    public Node visitDetachedRuleset(DetachedRuleset node, EvalContext context) {
        FrameChain frames = node.getFrames() != null ? node.getFrames() : context.getFrames();
        return new DetachedRuleset(node.getRuleset(), frames).withVisibility(node.visibilityInfo());
    }

    /**
     * 以捕获的帧（在内）与调用处的帧（在外）求值分离规则集
     */
    Ruleset callDetached(DetachedRuleset detached, EvalContext context) {
        if (detached.getFrames() == null) {
            return (Ruleset) eval(detached.getRuleset(), context);
        }
        EvalContext inner = context.derive(detached.getFrames().concat(context.getFrames()));
        return (Ruleset) eval(detached.getRuleset(), inner);
    }

    @Override
    public Node visitVariableCall(VariableCall node, EvalContext context) {
        Node target = eval(new Variable(node.getVariable(), node.getIndex(), node.getFileInfo()), context);
        DetachedRuleset detached;
        if (target instanceof DetachedRuleset) {
            detached = (DetachedRuleset) target;
        } else if (target instanceof Ruleset) {
            detached = new DetachedRuleset((Ruleset) target);
        } else if (target instanceof Value || target instanceof Expression) {
            List<Node> items = target instanceof Value
                    ? ((Value) target).getValue() : ((Expression) target).getValue();
            detached = new DetachedRuleset(new Ruleset(null, new ArrayList<>(items)));
        } else {
            throw new EvalException(ErrorKind.SYNTAX,
                    "Could not evaluate variable call " + node.getVariable(), node);
        }
        Ruleset result = callDetached(detached, context);
        return node.isImportant() ? MixinCallEvaluator.makeImportant(result) : result;
    }

    // ============ 选择器 ============

    @Override
    public Node visitSelector(Selector node, EvalContext context) {
        Boolean evaldCondition = null;
        if (node.getCondition() != null) {
            evaldCondition = isTruthy(eval(node.getCondition(), context));
        }
        List<Element> elements = new ArrayList<>(node.getElements().size());
        for (Element e : node.getElements()) {
            elements.add((Element) eval(e, context));
        }
        List<Extend> extendList = new ArrayList<>(node.getExtendList().size());
        for (Extend e : node.getExtendList()) {
            extendList.add((Extend) eval(e, context));
        }
        return node.createDerived(elements, extendList, evaldCondition);
    }

    @Override
    public Node visitElement(Element node, EvalContext context) {
        return new Element(node.getCombinator(), eval(node.getValue(), context), node.isVariable(),
                node.getIndex(), node.getFileInfo()).withVisibility(node.visibilityInfo());
    }

    @Override
    public Node visitAttribute(Attribute node, EvalContext context) {
        Node value = node.getValue() == null ? null : eval(node.getValue(), context);
        return new Attribute(eval(node.getKey(), context), node.getOp(), value, node.getCif());
    }

    // ============ 规则 ============

    @Override
    public Node visitRuleset(Ruleset node, EvalContext context) {
        return rulesets.evaluate(node, context);
    }

    /**
     * 声明：求出插值名称与值，收集值中引用到的 !important 变量
     */
    @Override
    public Node visitDeclaration(Declaration node, EvalContext context) {
        String name = node.getName();
        boolean variable = node.isVariable();
        try {
            if (node.hasInterpolatedName()) {
                name = interpolatedName(node, context);
                variable = false;
            }
            MathMode savedMath = context.getMath();
            boolean mathBypass = "font".equals(name) && savedMath == MathMode.ALWAYS;
            if (mathBypass) {
                context.setMath(MathMode.PARENS_DIVISION);
            }
            context.pushImportantScope();
            try {
                Node value = eval(node.getValue(), context);
                if (!node.isVariable() && value instanceof DetachedRuleset) {
                    throw new EvalException(ErrorKind.SYNTAX, "Rulesets cannot be evaluated on a property.", node);
                }
                String important = node.getImportant();
                EvalContext.ImportantScope scope = context.popImportantScope();
                if (important.isEmpty() && scope.important != null) {
                    important = scope.important;
                }
                return new Declaration(name, value, important, node.getMerge(), node.getIndex(),
                        node.getFileInfo(), node.isInline(), variable);
            } finally {
                if (mathBypass) {
                    context.setMath(savedMath);
                }
            }
        } catch (EvalException e) {
            throw e.locatedAt(node);
        }
    }

    private String interpolatedName(Declaration node, EvalContext context) {
        List<Node> parts = node.getNameParts();
        if (parts.size() == 1 && parts.get(0) instanceof Keyword) {
            return ((Keyword) parts.get(0)).getValue();
        }
        StringBuilder sb = new StringBuilder();
        for (Node part : parts) {
            sb.append(context.toCss(eval(part, context)));
        }
        return sb.toString();
    }

    /**
     * 通用 at 规则：块体单独成为一个媒体冒泡作用域，并作为根规则集输出
     */
    @Override
    public Node visitAtRule(AtRule node, EvalContext context) {
        List<NestedAtRule> savedBlocks = context.getMediaBlocks();
        List<NestedAtRule> savedPath = context.getMediaPath();
        context.setMediaState(new ArrayList<NestedAtRule>(),
                new ArrayList<NestedAtRule>());
        try {
            Node value = node.getValue() == null ? null : eval(node.getValue(), context);
            List<Node> rules = null;
            if (node.getRules() != null) {
                Ruleset body = (Ruleset) eval(node.getRules().get(0), context);
                body.setRoot(true);
                rules = new ArrayList<>();
                rules.add(body);
            }
            return new AtRule(node.getName(), value, rules, node.getIndex(), node.getFileInfo(), node.isRooted())
                    .withVisibility(node.visibilityInfo());
        } finally {
            context.setMediaState(savedBlocks, savedPath);
        }
    }

    @Override
    public Node visitMedia(Media node, EvalContext context) {
        return atRules.evaluate(node, context);
    }

    @Override
    public Node visitContainer(Container node, EvalContext context) {
        return atRules.evaluate(node, context);
    }

    /**
     * 规则集未展开的导入（strictImports）在此求值：CSS 导入保留为 @import，
     * 其余展开为可折叠的 &amp; 规则集
     */
    @Override
    public Node visitImport(Import node, EvalContext context) {
        Map<Node, Integer> blocks = new IdentityHashMap<>();
        List<Node> rules = imports.evaluate(node, context, blocks);
        if (rules.size() == 1 && rules.get(0) instanceof Import) {
            Node css = rules.get(0);
            Integer count = blocks.get(css);
            for (int i = 0; count != null && i < count; i++) {
                css.addVisibilityBlock();
            }
            return css;
        }
        Ruleset wrapper = RulesetEvaluator.parentSelectorRuleset(rules, node);
        return rulesets.evaluate(wrapper, context, wrapper, blocks);
    }

    @Override
    public Node visitExtend(Extend node, EvalContext context) {
        return new Extend((Selector) eval(node.getSelector(), context), node.getOption(), node.getIndex(),
                node.getFileInfo()).withVisibility(node.visibilityInfo());
    }

    @Override
    public Node visitComment(Comment node, EvalContext context) {
        return new Comment(node.getValue(), node.isLineComment(), node.getIndex(), node.getFileInfo())
                .withVisibility(node.visibilityInfo());
    }

    /**
     * mixin 定义求值时捕获当前帧链作为闭包
     */
    @Override
    public Node visitMixinDefinition(MixinDefinition node, EvalContext context) {
        return node.withFrames(node.getFrames() != null ? node.getFrames() : context.getFrames());
    }

    /**
     * 值中的 mixin 调用（命名空间取值）：结果包装为规则集以便继续查找
     */
    @Override
    public Node visitMixinCall(MixinCall node, EvalContext context) {
        return new Ruleset(null, mixins.evaluate(node, context, false));
    }
}
