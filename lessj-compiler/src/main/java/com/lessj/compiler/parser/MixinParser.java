package com.lessj.compiler.parser;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.MixinArgument;
import com.lessj.compiler.ast.rule.MixinCall;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.MixinParameter;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.NamespaceValue;
import com.lessj.compiler.ast.value.Property;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.ast.value.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * mixin 定义、调用与命名空间取值 [@x]
 */
final class MixinParser {
    private static final Pattern MIXIN_ELEMENT =
            Pattern.compile("[#.](?:[\\w-]|\\\\(?:[A-Fa-f0-9]{1,6} ?|[^A-Fa-f0-9]))+");
    private static final Pattern DEFINITION_START =
            Pattern.compile("([#.](?:[\\w-]|\\\\(?:[A-Fa-f0-9]{1,6} ?|[^A-Fa-f0-9]))+)\\s*\\(");
    private static final Pattern CALL_BEFORE_CLOSE = Pattern.compile("[^{]*\\}");
    private static final Pattern LOOKUP_NAME = Pattern.compile("(?:[@$]{0,2})[_a-zA-Z0-9-]*");

    /** 参数列表解析结果：调用时为 arguments，定义时为 params */
    static final class ArgsResult {
        final List<MixinArgument> arguments = new ArrayList<>();
        final List<MixinParameter> params = new ArrayList<>();
        boolean variadic;
    }

    /** 解析中的单个参数：名称、值，以及展开（调用）或可变（定义）标记 */
    private static final class RawArg {
        final String name;
        final Node value;
        final boolean flag;

        RawArg(String name, Node value, boolean flag) {
            this.name = name;
            this.value = value;
            this.flag = flag;
        }
    }

    private final Parser parser;
    private final ParserInput in;

    MixinParser(Parser parser) {
        this.parser = parser;
        this.in = parser.in;
    }

    /**
     * mixin 调用 .a > .b(args) !important;
     *
     * @param inValue   是否位于值中（此时必须带括号或取值）
     * @param getLookup null 允许取值，TRUE 要求取值，FALSE 不解析取值
     */
    Node call(boolean inValue, Boolean getLookup) {
        char s = in.currentChar();
        if (s != '.' && s != '#') {
            return null;
        }
        int index = in.i;
        in.save();
        List<Element> elements = elements();
        if (elements != null) {
            List<MixinArgument> args = new ArrayList<>();
            boolean hasParens = false;
            if (in.ch('(') != null) {
                args = args(true).arguments;
                parser.expectChar(')');
                hasParens = true;
            }
            List<String> lookups = null;
            if (!Boolean.FALSE.equals(getLookup)) {
                lookups = ruleLookups();
            }
            if ((Boolean.TRUE.equals(getLookup) && lookups == null) || (inValue && lookups == null && !hasParens)) {
                in.restore();
                return null;
            }
            boolean important = !inValue && parser.values.important() != null;
            if (inValue || parser.end()) {
                in.forget();
                MixinCall mixin = new MixinCall(new Selector(elements), args, lookups == null && important,
                        parser.abs(index), parser.fileInfo);
                if (lookups != null) {
                    return new NamespaceValue(mixin, lookups, important, parser.abs(index), parser.fileInfo);
                }
                return mixin;
            }
        }
        in.restore();
        return null;
    }

    private List<Element> elements() {
        List<Element> elements = null;
        Combinator c = null;
        while (true) {
            int elemIndex = in.i;
            String e = in.re(MIXIN_ELEMENT);
            if (e == null) {
                break;
            }
            if (elements == null) {
                elements = new ArrayList<>();
            }
            elements.add(new Element(c, e, parser.abs(elemIndex), parser.fileInfo));
            c = in.ch('>') != null ? new Combinator(">") : null;
        }
        return elements;
    }

    /**
     * 参数列表；逗号与分号两种分隔方式，出现分号时逗号只分隔列表值
     *
     * @param isCall true 为调用实参，false 为定义形参
     */
    ArgsResult args(boolean isCall) {
        ArgsResult result = new ArgsResult();
        List<Node> expressions = new ArrayList<>();
        List<RawArg> argsSemiColon = new ArrayList<>();
        List<RawArg> argsComma = new ArrayList<>();
        boolean semiColonSeparated = false;
        boolean expressionContainsNamed = false;
        String name = null;
        boolean hasSep = true;
        in.save();
        while (true) {
            Node arg;
            if (isCall) {
                arg = parser.detachedRuleset();
                if (arg == null) {
                    arg = parser.values.expression();
                }
            } else {
                in.commentStore.clear();
                if (in.str("...") != null) {
                    result.variadic = true;
                    if (in.ch(';') != null && !semiColonSeparated) {
                        semiColonSeparated = true;
                    }
                    (semiColonSeparated ? argsSemiColon : argsComma).add(new RawArg(null, null, true));
                    break;
                }
                arg = parser.entities.variable();
                if (arg == null) {
                    arg = parser.entities.property();
                }
                if (arg == null) {
                    arg = parser.entities.literal();
                }
                if (arg == null) {
                    arg = parser.entities.keyword();
                }
                if (arg == null) {
                    arg = call(true, null);
                }
            }
            if (arg == null || !hasSep) {
                break;
            }
            String nameLoop = null;
            Node value = arg;
            boolean expand = false;
            Node val = null;
            if (isCall) {
                if (arg instanceof Expression && ((Expression) arg).getValue().size() == 1) {
                    val = ((Expression) arg).getValue().get(0);
                }
            } else {
                val = arg;
            }
            if (val instanceof Variable || val instanceof Property) {
                String valName = val instanceof Variable ? ((Variable) val).getName() : ((Property) val).getName();
                if (in.ch(':') != null) {
                    if (!expressions.isEmpty()) {
                        if (semiColonSeparated) {
                            throw parser.error("Cannot mix ; and , as delimiter types");
                        }
                        expressionContainsNamed = true;
                    }
                    value = parser.detachedRuleset();
                    if (value == null) {
                        value = parser.values.expression();
                    }
                    if (value == null) {
                        if (isCall) {
                            throw parser.error("could not understand value for named argument");
                        }
                        in.restore();
                        return new ArgsResult();
                    }
                    name = valName;
                    nameLoop = valName;
                } else if (in.str("...") != null) {
                    if (!isCall) {
                        result.variadic = true;
                        if (in.ch(';') != null && !semiColonSeparated) {
                            semiColonSeparated = true;
                        }
                        (semiColonSeparated ? argsSemiColon : argsComma)
                                .add(new RawArg(valName, null, true));
                        break;
                    }
                    expand = true;
                } else if (!isCall) {
                    name = valName;
                    nameLoop = valName;
                    value = null;
                }
            }
            if (value != null) {
                expressions.add(value);
            }
            argsComma.add(new RawArg(nameLoop, value, expand));
            if (in.ch(',') != null) {
                hasSep = true;
                continue;
            }
            hasSep = in.ch(';') != null;
            if (hasSep || semiColonSeparated) {
                if (expressionContainsNamed) {
                    throw parser.error("Cannot mix ; and , as delimiter types");
                }
                semiColonSeparated = true;
                if (expressions.size() > 1) {
                    value = new Value(expressions);
                }
                argsSemiColon.add(new RawArg(name, value, expand));
                name = null;
                expressions = new ArrayList<>();
                expressionContainsNamed = false;
            }
        }
        in.forget();
        for (RawArg a : semiColonSeparated ? argsSemiColon : argsComma) {
            if (isCall) {
                result.arguments.add(new MixinArgument(a.name, a.value, a.flag));
            } else {
                result.params.add(new MixinParameter(a.name, a.value, a.flag));
            }
        }
        return result;
    }

    /**
     * 参数化 mixin 定义 .m(@a; @b: 2) when (guard) { ... }
     */
    MixinDefinition definition() {
        char c = in.currentChar();
        if ((c != '.' && c != '#') || in.peek(CALL_BEFORE_CLOSE)) {
            return null;
        }
        int index = in.i;
        in.save();
        String[] m = in.reGroups(DEFINITION_START);
        if (m == null) {
            in.restore();
            return null;
        }
        String name = m[1];
        ArgsResult argInfo = args(false);
        if (in.ch(')') == null) {
            in.restore("Missing closing ')'");
            return null;
        }
        in.commentStore.clear();
        Node condition = null;
        if (in.str("when") != null) {
            condition = parser.expect(parser.values.conditions(), "expected condition");
        }
        List<Node> rules = parser.block();
        if (rules != null) {
            in.forget();
            return new MixinDefinition(name, argInfo.params, rules, condition, argInfo.variadic, null,
                    parser.abs(index), parser.fileInfo);
        }
        in.restore();
        return null;
    }

    /**
     * 取值链 [@x][$y][]
     */
    List<String> ruleLookups() {
        if (in.currentChar() != '[') {
            return null;
        }
        List<String> lookups = new ArrayList<>();
        while (true) {
            in.save();
            String rule = lookupValue();
            if (rule == null) {
                in.restore();
                break;
            }
            lookups.add(rule);
            in.forget();
        }
        return lookups.isEmpty() ? null : lookups;
    }

    private String lookupValue() {
        in.save();
        if (in.ch('[') == null) {
            in.restore();
            return null;
        }
        String name = in.re(LOOKUP_NAME);
        if (in.ch(']') == null) {
            in.restore();
            return null;
        }
        in.forget();
        return name == null ? "" : name;
    }
}
