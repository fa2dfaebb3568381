package com.lessj.compiler.parser;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.selector.Attribute;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Paren;
import com.lessj.compiler.ast.value.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 选择器解析：元素、组合符、属性选择器、:extend 与 CSS 守卫
 */
final class SelectorParser {
    private static final Pattern PERCENTAGE_ELEMENT = Pattern.compile("(?:\\d+\\.\\d+|\\d+)%");
    private static final Pattern ELEMENT = Pattern.compile(
            "(?:[.#]?|:*)(?:[\\w-]|[^\\x00-\\x9f]|\\\\(?:[A-Fa-f0-9]{1,6} ?|[^A-Fa-f0-9]))+");
    private static final Pattern PAREN_ELEMENT = Pattern.compile("\\([^&()@]+\\)");
    private static final Pattern INTERPOLATION_PREFIX = Pattern.compile("[.#:](?=@)");
    private static final Pattern SLASHED_COMBINATOR = Pattern.compile("/[a-z]+/", Pattern.CASE_INSENSITIVE);
    private static final Pattern ATTRIBUTE_KEY =
            Pattern.compile("(?:[_A-Za-z0-9-*]*\\|)?(?:[_A-Za-z0-9-]|\\\\.)+");
    private static final Pattern ATTRIBUTE_OP = Pattern.compile("[|~*$^]?=");
    private static final Pattern ATTRIBUTE_PERCENT = Pattern.compile("[0-9]+%");
    private static final Pattern ATTRIBUTE_WORD = Pattern.compile("[\\w-]+");
    private static final Pattern ATTRIBUTE_CASE = Pattern.compile("[iIsS]");
    private static final Pattern EXTEND_ALL = Pattern.compile("(all)(?=\\s*(\\)|,))");

    private final Parser parser;
    private final ParserInput in;

    SelectorParser(Parser parser) {
        this.parser = parser;
        this.in = parser.in;
    }

    /**
     * 逗号分隔的选择器列表；带守卫时只允许一个选择器
     */
    List<Selector> selectors() {
        List<Selector> list = null;
        while (true) {
            Selector s = selector(true);
            if (s == null) {
                break;
            }
            if (list == null) {
                list = new ArrayList<>();
            }
            list.add(s);
            in.commentStore.clear();
            if (s.getCondition() != null && list.size() > 1) {
                throw parser.error("Guards are only currently allowed on a single selector.");
            }
            if (in.ch(',') == null) {
                break;
            }
            if (s.getCondition() != null) {
                throw parser.error("Guards are only currently allowed on a single selector.");
            }
            in.commentStore.clear();
        }
        return list;
    }

    /**
     * @param isLess 是否允许 :extend 与 when 守卫（括号内的子选择器不允许）
     */
    Selector selector(boolean isLess) {
        int index = in.i;
        List<Element> elements = null;
        List<Extend> allExtends = null;
        Node condition = null;
        while (true) {
            List<Extend> extendList = isLess ? extend(false) : null;
            boolean when = extendList == null && isLess && in.str("when") != null;
            Element e = extendList == null && !when ? element() : null;
            if (extendList == null && !when && e == null) {
                break;
            }
            char c = '\0';
            if (when) {
                condition = parser.expect(parser.values.conditions(), "expected condition");
            } else if (condition != null) {
                throw parser.error("CSS guard can only be used at the end of selector");
            } else if (extendList != null) {
                if (allExtends == null) {
                    allExtends = new ArrayList<>();
                }
                allExtends.addAll(extendList);
            } else {
                if (allExtends != null) {
                    throw parser.error("Extend can only be used at the end of selector");
                }
                c = in.currentChar();
                if (elements == null) {
                    elements = new ArrayList<>();
                }
                elements.add(e);
            }
            if (c == '{' || c == '}' || c == ';' || c == ',' || c == ')') {
                break;
            }
        }
        if (elements != null) {
            return new Selector(elements, allExtends, condition, parser.abs(index), parser.fileInfo);
        }
        if (allExtends != null) {
            throw parser.error("Extend must be used to extend a selector, it cannot be used on its own");
        }
        return null;
    }

    Element element() {
        int index = in.i;
        Combinator c = combinator();
        String text = in.re(PERCENTAGE_ELEMENT);
        if (text == null) {
            text = in.re(ELEMENT);
        }
        if (text == null) {
            text = in.ch('*');
        }
        if (text == null) {
            text = in.ch('&');
        }
        Node value = text == null ? null : new Keyword(text, parser.abs(index), parser.fileInfo);
        if (value == null) {
            value = attribute();
        }
        if (value == null) {
            text = in.re(PAREN_ELEMENT);
            if (text == null) {
                text = in.re(INTERPOLATION_PREFIX);
            }
            if (text != null) {
                value = new Keyword(text, parser.abs(index), parser.fileInfo);
            }
        }
        if (value == null) {
            value = parser.entities.variableCurly();
        }
        if (value == null) {
            in.save();
            if (in.ch('(') != null) {
                Selector inner = selector(false);
                if (inner != null && in.ch(')') != null) {
                    value = new Paren(inner);
                    in.forget();
                } else {
                    in.restore("Missing closing ')'");
                }
            } else {
                in.forget();
            }
        }
        if (value == null) {
            return null;
        }
        return new Element(c, value, value instanceof Variable, parser.abs(index), parser.fileInfo);
    }

    /**
     * 组合符；空白本身就是后代组合符，直接按字符推进不吸收注释
     */
    Combinator combinator() {
        char c = in.currentChar();
        if (c == '/') {
            in.save();
            String slashed = in.re(SLASHED_COMBINATOR);
            if (slashed != null) {
                in.forget();
                return new Combinator(slashed);
            }
            in.restore();
        }
        if (c == '>' || c == '+' || c == '~' || c == '|' || c == '^') {
            in.i++;
            String value = String.valueOf(c);
            if (c == '^' && in.currentChar() == '^') {
                value = "^^";
                in.i++;
            }
            while (in.isWhitespace(0)) {
                in.i++;
            }
            return new Combinator(value);
        }
        if (in.isWhitespace(-1)) {
            return Combinator.DESCENDANT;
        }
        return Combinator.NONE;
    }

    Attribute attribute() {
        if (in.ch('[') == null) {
            return null;
        }
        Node key = parser.entities.variableCurly();
        if (key == null) {
            key = new Keyword(parser.expect(in.re(ATTRIBUTE_KEY), "unexpected token"));
        }
        String op = in.re(ATTRIBUTE_OP);
        Node value = null;
        String cif = null;
        if (op != null) {
            value = parser.entities.quoted();
            if (value == null) {
                String word = in.re(ATTRIBUTE_PERCENT);
                if (word == null) {
                    word = in.re(ATTRIBUTE_WORD);
                }
                if (word != null) {
                    value = new Keyword(word);
                }
            }
            if (value == null) {
                value = parser.entities.variableCurly();
            }
            if (value != null) {
                cif = in.re(ATTRIBUTE_CASE);
            }
        }
        parser.expectChar(']');
        return new Attribute(key, op, value, cif);
    }

    /**
     * :extend(sel all, sel2)；isRule 为 true 时解析语句形式 &amp;:extend(...);
     */
    List<Extend> extend(boolean isRule) {
        int index = in.i;
        if (in.str(isRule ? "&:extend(" : ":extend(") == null) {
            return null;
        }
        List<Extend> extendList = new ArrayList<>();
        do {
            String option = null;
            List<Element> elements = null;
            while (true) {
                String[] all = in.reGroups(EXTEND_ALL);
                if (all != null) {
                    option = all[1];
                    break;
                }
                Element e = element();
                if (e == null) {
                    break;
                }
                if (elements == null) {
                    elements = new ArrayList<>();
                }
                elements.add(e);
            }
            if (elements == null) {
                throw parser.error("Missing target selector for :extend().");
            }
            extendList.add(new Extend(new Selector(elements), option, parser.abs(index), parser.fileInfo));
        } while (in.ch(',') != null);
        parser.expectChar(')');
        if (isRule) {
            parser.expectChar(';');
        }
        return extendList;
    }
}
