package com.lessj.compiler.output;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.SourceText;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Container;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.Media;
import com.lessj.compiler.ast.rule.MixinCall;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.NestedAtRule;
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
import com.lessj.compiler.ast.value.Unit;
import com.lessj.compiler.ast.value.Url;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.ast.value.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 把节点树写成 CSS 文本
 *
 * <p>普通模式两空格缩进，压缩模式去掉所有可省略的空白与最后一个分号。
 * 最终输出的数值舍入到 {@link CssNumbers#PRECISION} 位小数；求值阶段取节点文本时不舍入。</p>
 */
public final class CssEmitter implements NodeVisitor<Void, CssOutput> {
    private final boolean compress;
    private final boolean strictUnits;
    private final boolean round;

    private int tabLevel;
    private boolean firstSelector;
    private boolean lastRule;

    private CssEmitter(boolean compress, boolean strictUnits, boolean round) {
        this.compress = compress;
        this.strictUnits = strictUnits;
        this.round = round;
    }

    /**
     * 求值阶段的节点文本（字符串插值、模式匹配、错误消息），数值不舍入
     */
    public static String toCss(Node node, boolean compress, boolean strictUnits) {
        CssOutput out = new CssOutput();
        node.accept(new CssEmitter(compress, strictUnits, false), out);
        return out.toString();
    }

    /**
     * 输出整棵样式表
     *
     * @param sources 需要源码映射时给出文件名到源文本的查找，否则为 null
     */
    public static CssOutput emit(Ruleset root, boolean compress, boolean strictUnits,
                                 Function<String, SourceText> sources) {
        CssOutput out = new CssOutput(sources);
        root.accept(new CssEmitter(compress, strictUnits, true), out);
        return out;
    }

    private void emit(Node node, CssOutput out) {
        node.accept(this, out);
    }

    private static String filenameOf(Node node) {
        FileInfo fi = node.getFileInfo();
        return fi == null ? null : fi.getFilename();
    }

    // ============ 值 ============

    @Override
    public Void visitAnonymous(Anonymous node, CssOutput out) {
        out.add(node.getValue(), node.getFileInfo(), node.getIndex(), node.isMapLines());
        return null;
    }

    @Override
    public Void visitKeyword(Keyword node, CssOutput out) {
        if ("%".equals(node.getValue())) {
            throw new LessException(ErrorKind.SYNTAX, "Invalid % without number", filenameOf(node), node.getIndex());
        }
        out.add(node.getValue());
        return null;
    }

    @Override
    public Void visitDimension(Dimension node, CssOutput out) {
        Unit unit = node.getUnit();
        if (strictUnits && !unit.isSingular()) {
            throw new LessException(ErrorKind.RUNTIME,
                    "Multiple units in dimension. Correct the units or use the unit function. Bad unit: " + unit,
                    filenameOf(node), node.getIndex());
        }
        double value = round ? CssNumbers.round(node.getValue()) : node.getValue();
        String text = CssNumbers.format(value);
        if (compress) {
            if (value == 0 && unit.isLength()) {
                out.add(text);
                return null;
            }
            if (value > 0 && value < 1) {
                text = text.substring(1);
            }
        }
        out.add(text);
        out.add(unit.toCss(strictUnits));
        return null;
    }

    /**
     * 颜色：保留原始写法；函数生成的颜色不透明时写十六进制，半透明时写 rgba()/hsla()
     */
    @Override
    public Void visitColor(Color node, CssOutput out) {
        out.add(colorCss(node));
        return null;
    }

    private String colorCss(Color color) {
        double alpha = fround(color.getAlpha());
        String function = null;
        String form = color.getValue();
        if (form != null) {
            if (form.startsWith("rgb")) {
                if (alpha < 1) {
                    function = "rgba";
                }
            } else if (form.startsWith("hsl")) {
                function = alpha < 1 ? "hsla" : "hsl";
            } else {
                return form;
            }
        } else if (alpha < 1) {
            function = "rgba";
        }

        if (function != null) {
            List<String> args = new ArrayList<>();
            if ("rgba".equals(function)) {
                for (double c : color.getRgb()) {
                    args.add(CssNumbers.format(clamp(Math.round(c), 255)));
                }
            } else {
                double[] hsl = color.toHsl();
                args.add(CssNumbers.format(fround(hsl[0])));
                args.add(CssNumbers.format(fround(hsl[1] * 100)) + "%");
                args.add(CssNumbers.format(fround(hsl[2] * 100)) + "%");
            }
            if (!"hsl".equals(function)) {
                args.add(CssNumbers.format(clamp(alpha, 1)));
            }
            return function + "(" + String.join(compress ? "," : ", ", args) + ")";
        }

        String hex = color.toRgbHex();
        if (compress && hex.charAt(1) == hex.charAt(2) && hex.charAt(3) == hex.charAt(4)
                && hex.charAt(5) == hex.charAt(6)) {
            hex = "#" + hex.charAt(1) + hex.charAt(3) + hex.charAt(5);
        }
        return hex;
    }

    private double fround(double value) {
        return round ? CssNumbers.round(value) : value;
    }

    private static double clamp(double v, double max) {
        return Math.min(Math.max(v, 0), max);
    }

    @Override
    public Void visitQuoted(Quoted node, CssOutput out) {
        if (!node.isEscaped()) {
            out.add(node.getQuote(), node.getFileInfo(), node.getIndex());
        }
        out.add(node.getValue());
        if (!node.isEscaped()) {
            out.add(node.getQuote());
        }
        return null;
    }

    @Override
    public Void visitUrl(Url node, CssOutput out) {
        out.add("url(");
        emit(node.getValue(), out);
        out.add(")");
        return null;
    }

    @Override
    public Void visitVariable(Variable node, CssOutput out) {
        out.add(node.getName(), node.getFileInfo(), node.getIndex());
        return null;
    }

    @Override
    public Void visitProperty(Property node, CssOutput out) {
        out.add(node.getName(), node.getFileInfo(), node.getIndex());
        return null;
    }

    @Override
    public Void visitOperation(Operation node, CssOutput out) {
        emit(node.getLeft(), out);
        if (node.isSpaced()) {
            out.add(" ");
        }
        out.add(node.getOp());
        if (node.isSpaced()) {
            out.add(" ");
        }
        emit(node.getRight(), out);
        return null;
    }

    @Override
    public Void visitCall(Call node, CssOutput out) {
        out.add(node.getName() + "(", node.getFileInfo(), node.getIndex());
        List<Node> args = node.getArgs();
        for (int i = 0; i < args.size(); i++) {
            emit(args.get(i), out);
            if (i + 1 < args.size()) {
                out.add(", ");
            }
        }
        out.add(")");
        return null;
    }

    /**
     * 空格分隔的表达式；逗号形式的 Anonymous 前不加空格
     */
    @Override
    public Void visitExpression(Expression node, CssOutput out) {
        List<Node> items = node.getValue();
        for (int i = 0; i < items.size(); i++) {
            emit(items.get(i), out);
            if (!node.isNoSpacing() && i + 1 < items.size()) {
                Node next = items.get(i + 1);
                if (!(next instanceof Anonymous) || !",".equals(((Anonymous) next).getValue())) {
                    out.add(" ");
                }
            }
        }
        return null;
    }

    @Override
    public Void visitValue(Value node, CssOutput out) {
        List<Node> items = node.getValue();
        for (int i = 0; i < items.size(); i++) {
            emit(items.get(i), out);
            if (i + 1 < items.size()) {
                out.add(compress ? "," : ", ");
            }
        }
        return null;
    }

    @Override
    public Void visitParen(Paren node, CssOutput out) {
        out.add("(");
        emit(node.getValue(), out);
        out.add(")");
        return null;
    }

    @Override
    public Void visitNegative(Negative node, CssOutput out) {
        out.add("-");
        emit(node.getValue(), out);
        return null;
    }

    @Override
    public Void visitCondition(Condition node, CssOutput out) {
        if (node.isNegate()) {
            out.add("not ");
        }
        emit(node.getLvalue(), out);
        out.add(" " + node.getOp() + " ");
        emit(node.getRvalue(), out);
        return null;
    }

    @Override
    public Void visitAssignment(Assignment node, CssOutput out) {
        out.add(node.getKey() + "=");
        emit(node.getValue(), out);
        return null;
    }

    @Override
    public Void visitUnicodeDescriptor(UnicodeDescriptor node, CssOutput out) {
        out.add(node.getValue());
        return null;
    }

    @Override
    public Void visitNamespaceValue(NamespaceValue node, CssOutput out) {
        emit(node.getValue(), out);
        for (String lookup : node.getLookups()) {
            out.add("[" + lookup + "]");
        }
        return null;
    }

    @Override
    public Void visitDetachedRuleset(DetachedRuleset node, CssOutput out) {
        return null;
    }

    // ============ 选择器 ============

    /**
     * 非路径首个选择器、且首元素没有组合符时，前面补一个空格
     */
    @Override
    public Void visitSelector(Selector node, CssOutput out) {
        List<Element> elements = node.getElements();
        if (!firstSelector && !elements.isEmpty() && elements.get(0).getCombinator().getValue().isEmpty()) {
            out.add(" ", node.getFileInfo(), node.getIndex());
        }
        for (Element e : elements) {
            emit(e, out);
        }
        return null;
    }

    @Override
    public Void visitElement(Element node, CssOutput out) {
        boolean saved = firstSelector;
        if (node.getValue() instanceof Paren) {
            firstSelector = true;
        }
        CssOutput value = new CssOutput();
        emit(node.getValue(), value);
        firstSelector = saved;
        String text = value.toString();
        if (text.isEmpty() && node.getCombinator().getValue().startsWith("&")) {
            return null;
        }
        emit(node.getCombinator(), out);
        out.add(text, node.getFileInfo(), node.getIndex());
        return null;
    }

    @Override
    public Void visitCombinator(Combinator node, CssOutput out) {
        String value = node.getValue();
        boolean noSpace = value.isEmpty() || " ".equals(value) || "|".equals(value);
        String pad = compress || noSpace ? "" : " ";
        out.add(pad + value + pad);
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node, CssOutput out) {
        out.add("[");
        emit(node.getKey(), out);
        if (node.getOp() != null) {
            out.add(node.getOp());
            emit(node.getValue(), out);
        }
        if (node.getCif() != null) {
            out.add(" " + node.getCif());
        }
        out.add("]");
        return null;
    }

    // ============ 规则 ============

    /**
     * 规则集：@charset 与 @import 提到最前（注释之后），其余保持顺序
     */
    @Override
    public Void visitRuleset(Ruleset node, CssOutput out) {
        if (!node.isRoot()) {
            tabLevel++;
        }
        String tabRuleStr = compress ? "" : indent(tabLevel);
        String tabSetStr = compress ? "" : indent(tabLevel - 1);

        List<Node> ruleNodes = orderRules(node.getRules());

        if (!node.isRoot()) {
            List<List<Selector>> paths = node.getPaths();
            String sep = compress ? "," : ",\n" + tabSetStr;
            boolean first = true;
            if (paths != null) {
                for (List<Selector> path : paths) {
                    if (path.isEmpty()) {
                        continue;
                    }
                    if (!first) {
                        out.add(sep);
                    }
                    first = false;
                    firstSelector = true;
                    emit(path.get(0), out);
                    firstSelector = false;
                    for (int j = 1; j < path.size(); j++) {
                        emit(path.get(j), out);
                    }
                }
            }
            out.add((compress ? "{" : " {\n") + tabRuleStr);
        }

        for (int i = 0; i < ruleNodes.size(); i++) {
            Node rule = ruleNodes.get(i);
            if (i + 1 == ruleNodes.size()) {
                lastRule = true;
            }
            boolean currentLastRule = lastRule;
            if (rule.isRulesetLike()) {
                lastRule = false;
            }
            emit(rule, out);
            lastRule = currentLastRule;
            if (!lastRule && rule.isVisible()) {
                out.add(compress ? "" : "\n" + tabRuleStr);
            } else {
                lastRule = false;
            }
        }

        if (!node.isRoot()) {
            out.add(compress ? "}" : "\n" + tabSetStr + "}");
            tabLevel--;
        }
        if (!out.isEmpty() && !compress && node.isFirstRoot()) {
            out.add("\n");
        }
        return null;
    }

    private static List<Node> orderRules(List<Node> rules) {
        List<Node> ordered = new ArrayList<>();
        if (rules == null) {
            return ordered;
        }
        int charsetIndex = 0;
        int importIndex = 0;
        for (int i = 0; i < rules.size(); i++) {
            Node rule = rules.get(i);
            if (rule instanceof Comment) {
                if (importIndex == i) {
                    importIndex++;
                }
                ordered.add(rule);
            } else if (rule instanceof AtRule && ((AtRule) rule).isCharset()) {
                ordered.add(charsetIndex, rule);
                charsetIndex++;
                importIndex++;
            } else if (rule instanceof Import) {
                ordered.add(importIndex, rule);
                importIndex++;
            } else {
                ordered.add(rule);
            }
        }
        return ordered;
    }

    private static String indent(int level) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) {
            sb.append("  ");
        }
        return sb.toString();
    }

    @Override
    public Void visitDeclaration(Declaration node, CssOutput out) {
        out.add(node.getName() + (compress ? ":" : ": "), node.getFileInfo(), node.getIndex());
        emit(node.getValue(), out);
        boolean omitSemicolon = node.isInline() || (lastRule && compress);
        out.add(node.getImportant() + (omitSemicolon ? "" : ";"), node.getFileInfo(), node.getIndex());
        return null;
    }

    @Override
    public Void visitAtRule(AtRule node, CssOutput out) {
        out.add(node.getName(), node.getFileInfo(), node.getIndex());
        if (node.getValue() != null) {
            out.add(" ");
            emit(node.getValue(), out);
        }
        if (node.getRules() != null) {
            outputBlock(node.getRules(), out);
        } else {
            out.add(";");
        }
        return null;
    }

    @Override
    public Void visitMedia(Media node, CssOutput out) {
        return nestedAtRule(node, out);
    }

    @Override
    public Void visitContainer(Container node, CssOutput out) {
        return nestedAtRule(node, out);
    }

    private Void nestedAtRule(NestedAtRule node, CssOutput out) {
        out.add(node.getKeyword() + " ", node.getFileInfo(), node.getIndex());
        if (node.getFeatures() != null) {
            emit(node.getFeatures(), out);
        }
        outputBlock(node.getRules(), out);
        return null;
    }

    private void outputBlock(List<Node> rules, CssOutput out) {
        tabLevel++;
        int count = rules == null ? 0 : rules.size();
        if (compress) {
            out.add("{");
            for (int i = 0; i < count; i++) {
                emit(rules.get(i), out);
            }
            out.add("}");
            tabLevel--;
            return;
        }
        String tabSetStr = "\n" + indent(tabLevel - 1);
        String tabRuleStr = tabSetStr + "  ";
        if (count == 0) {
            out.add(" {" + tabSetStr + "}");
        } else {
            out.add(" {" + tabRuleStr);
            emit(rules.get(0), out);
            for (int i = 1; i < count; i++) {
                out.add(tabRuleStr);
                emit(rules.get(i), out);
            }
            out.add(tabSetStr + "}");
        }
        tabLevel--;
    }

    @Override
    public Void visitImport(Import node, CssOutput out) {
        if (!node.isCss()) {
            return null;
        }
        out.add("@import ", node.getFileInfo(), node.getIndex());
        emit(node.getPath(), out);
        if (node.getFeatures() != null) {
            out.add(" ");
            emit(node.getFeatures(), out);
        }
        out.add(";");
        return null;
    }

    @Override
    public Void visitComment(Comment node, CssOutput out) {
        out.add(node.getValue(), node.getFileInfo(), node.getIndex());
        return null;
    }

    // 以下节点不产生输出

    @Override
    public Void visitExtend(Extend node, CssOutput out) {
        return null;
    }

    @Override
    public Void visitMixinDefinition(MixinDefinition node, CssOutput out) {
        return null;
    }

    @Override
    public Void visitMixinCall(MixinCall node, CssOutput out) {
        return null;
    }

    @Override
    public Void visitVariableCall(VariableCall node, CssOutput out) {
        return null;
    }
}
