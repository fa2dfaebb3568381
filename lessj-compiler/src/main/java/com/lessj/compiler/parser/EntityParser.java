package com.lessj.compiler.parser;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Assignment;
import com.lessj.compiler.ast.value.Call;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Property;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.UnicodeDescriptor;
import com.lessj.compiler.ast.value.Unit;
import com.lessj.compiler.ast.value.Url;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.ast.value.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 字面量解析：数值、颜色、字符串、关键字、变量、属性引用、函数调用、url()
 */
final class EntityParser {
    private static final Pattern KEYWORD =
            Pattern.compile("\\[?(?:[\\w-]|\\\\(?:[A-Fa-f0-9]{1,6} ?|[^A-Fa-f0-9]))+\\]?");
    private static final Pattern CALL = Pattern.compile("([\\w-]+|%|~|progid:[\\w.]+)\\(");
    private static final Pattern URL_START = Pattern.compile("url\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSIGNMENT_KEY = Pattern.compile("\\w+(?=\\s?=)");
    private static final Pattern URL_RAW = Pattern.compile("(?:(?:\\\\[()'\"])|[^()'\"])+");
    private static final Pattern VARIABLE = Pattern.compile("@@?[\\w-]+");
    private static final Pattern VARIABLE_CURLY = Pattern.compile("@\\{([\\w-]+)\\}");
    private static final Pattern PROPERTY = Pattern.compile("\\$[\\w-]+");
    private static final Pattern COLOR = Pattern.compile(
            "#([A-Fa-f0-9]{8}|[A-Fa-f0-9]{6}|[A-Fa-f0-9]{3,4})([\\w.#\\[])?");
    private static final Pattern COLOR_KEYWORD = Pattern.compile("[_A-Za-z-][_A-Za-z0-9-]+");
    private static final Pattern DIMENSION =
            Pattern.compile("([+-]?\\d*\\.?\\d+)(%|[a-z_]+)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNICODE_RANGE = Pattern.compile("U\\+[0-9a-fA-F?]+(-[0-9a-fA-F?]+)?");
    private static final Pattern IE_OPACITY = Pattern.compile("opacity=", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final Parser parser;
    private final ParserInput in;

    EntityParser(Parser parser) {
        this.parser = parser;
        this.in = parser.in;
    }

    /**
     * 数值、颜色、字符串或 unicode-range
     */
    Node literal() {
        Node node = dimension();
        if (node == null) {
            node = color();
        }
        if (node == null) {
            node = quoted();
        }
        if (node == null) {
            node = unicodeDescriptor();
        }
        return node;
    }

    /**
     * "..." 或 ~"..."
     */
    Quoted quoted() {
        int index = in.i;
        boolean escaped = false;
        in.save();
        if (in.ch('~') != null) {
            escaped = true;
        }
        String str = in.quoted();
        if (str == null) {
            in.restore();
            return null;
        }
        in.forget();
        return new Quoted(String.valueOf(str.charAt(0)), str.substring(1, str.length() - 1), escaped,
                parser.abs(index), parser.fileInfo);
    }

    /**
     * 关键字；颜色名返回 Color
     */
    Node keyword() {
        int index = in.i;
        String k = in.ch('%');
        if (k == null) {
            k = in.re(KEYWORD);
        }
        if (k == null) {
            return null;
        }
        Color color = Color.fromKeyword(k);
        if (color != null) {
            return color;
        }
        return new Keyword(k, parser.abs(index), parser.fileInfo);
    }

    /**
     * 函数调用 name(args)，url() 由 {@link #url()} 处理
     */
    Node call() {
        int index = in.i;
        if (in.peek(URL_START)) {
            return null;
        }
        in.save();
        String[] m = in.reGroups(CALL);
        if (m == null) {
            in.forget();
            return null;
        }
        String name = m[1];
        String lower = name.toLowerCase(Locale.ROOT);
        List<Node> prevArgs = null;
        if ("alpha".equals(lower)) {
            Quoted alpha = ieAlpha();
            if (alpha != null) {
                in.forget();
                return alpha;
            }
        } else if ("if".equals(lower) || "boolean".equals(lower)) {
            prevArgs = new ArrayList<>();
            prevArgs.add(parser.expect(parser.values.condition(false), "expected condition"));
        }
        List<Node> args = arguments(prevArgs);
        if (in.ch(')') == null) {
            in.restore("Could not parse call arguments or missing ')'");
            return null;
        }
        in.forget();
        return new Call(name, args, parser.abs(index), parser.fileInfo);
    }

    /**
     * IE 的 alpha(opacity=50)
     */
    private Quoted ieAlpha() {
        if (in.re(IE_OPACITY) == null) {
            return null;
        }
        String value = in.re(DIGITS);
        if (value == null) {
            Node variable = parser.expect(variable(), "Could not parse alpha");
            if (!(variable instanceof Variable)) {
                throw parser.error("Could not parse alpha");
            }
            value = "@{" + ((Variable) variable).getName().substring(1) + "}";
        }
        parser.expectChar(')');
        return new Quoted("", "alpha(opacity=" + value + ")", false);
    }

    /**
     * 函数参数，支持以分号分隔的参数组
     */
    List<Node> arguments(List<Node> prevArgs) {
        List<Node> argsComma = prevArgs != null ? prevArgs : new ArrayList<Node>();
        List<Node> argsSemiColon = new ArrayList<>();
        boolean semiColonSeparated = false;
        boolean skipValue = prevArgs != null;
        in.save();
        while (true) {
            if (skipValue) {
                skipValue = false;
            } else {
                Node value = parser.detachedRuleset();
                if (value == null) {
                    value = assignment();
                }
                if (value == null) {
                    value = parser.values.expression();
                }
                if (value == null) {
                    break;
                }
                if (value instanceof Expression && ((Expression) value).getValue().size() == 1) {
                    value = ((Expression) value).getValue().get(0);
                }
                argsComma.add(value);
            }
            if (in.ch(',') != null) {
                continue;
            }
            if (in.ch(';') != null || semiColonSeparated) {
                semiColonSeparated = true;
                if (!argsComma.isEmpty()) {
                    argsSemiColon.add(new Value(argsComma));
                }
                argsComma = new ArrayList<>();
            }
        }
        in.forget();
        return semiColonSeparated ? argsSemiColon : argsComma;
    }

    /**
     * IE 滤镜参数 key=value
     */
    private Assignment assignment() {
        in.save();
        String key = in.re(ASSIGNMENT_KEY);
        if (key == null || in.ch('=') == null) {
            in.restore();
            return null;
        }
        Node value = parser.entity();
        if (value != null) {
            in.forget();
            return new Assignment(key, value);
        }
        in.restore();
        return null;
    }

    /**
     * url(...)：内容为字符串、变量、属性引用或原样文本，原样文本中不吸收注释
     */
    Url url() {
        int index = in.i;
        in.autoCommentAbsorb = false;
        if (in.str("url(") == null) {
            in.autoCommentAbsorb = true;
            return null;
        }
        Node value = quoted();
        if (value == null) {
            value = variable();
        }
        if (value == null) {
            value = property();
        }
        if (value == null) {
            String raw = in.re(URL_RAW);
            value = new Anonymous(raw == null ? "" : raw, parser.abs(index), parser.fileInfo);
        }
        in.autoCommentAbsorb = true;
        parser.expectChar(')');
        return new Url(value, parser.abs(index), parser.fileInfo, false);
    }

    /**
     * @name、@@name，后跟 ( 或 [ 时为分离规则集调用或取值
     */
    Node variable() {
        int index = in.i;
        if (in.currentChar() != '@') {
            return null;
        }
        in.save();
        String name = in.re(VARIABLE);
        if (name == null) {
            in.restore();
            return null;
        }
        char ch = in.currentChar();
        if (ch == '(' || (ch == '[' && !Character.isWhitespace(in.prevChar()))) {
            Node result = parser.variableCall(name);
            if (result != null) {
                in.forget();
                return result;
            }
        }
        in.forget();
        return new Variable(name, parser.abs(index), parser.fileInfo);
    }

    /**
     * 选择器与属性名中的 @{name}
     */
    Variable variableCurly() {
        int index = in.i;
        if (in.currentChar() != '@') {
            return null;
        }
        String[] m = in.reGroups(VARIABLE_CURLY);
        return m == null ? null : new Variable("@" + m[1], parser.abs(index), parser.fileInfo);
    }

    Property property() {
        int index = in.i;
        if (in.currentChar() != '$') {
            return null;
        }
        String name = in.re(PROPERTY);
        return name == null ? null : new Property(name, parser.abs(index), parser.fileInfo);
    }

    /**
     * #rgb、#rgba、#rrggbb、#rrggbbaa；后面紧跟标识符字符时不是颜色（如 #abc.def）
     */
    Color color() {
        int index = in.i;
        if (in.currentChar() != '#') {
            return null;
        }
        in.save();
        String[] m = in.reGroups(COLOR);
        if (m != null && m[2] == null) {
            in.forget();
            return Color.fromHex(m[1], m[0], parser.abs(index), parser.fileInfo);
        }
        in.restore();
        return null;
    }

    /**
     * 运算数位置的颜色名，不吸收其后的注释
     */
    Color colorKeyword() {
        in.save();
        boolean absorb = in.autoCommentAbsorb;
        in.autoCommentAbsorb = false;
        String k = in.re(COLOR_KEYWORD);
        in.autoCommentAbsorb = absorb;
        if (k == null) {
            in.forget();
            return null;
        }
        in.restore();
        Color color = Color.fromKeyword(k);
        if (color != null) {
            in.str(k);
        }
        return color;
    }

    Dimension dimension() {
        int index = in.i;
        if (in.peekNotNumeric()) {
            return null;
        }
        String[] m = in.reGroups(DIMENSION);
        if (m == null) {
            return null;
        }
        return new Dimension(Double.parseDouble(m[1]), Unit.of(m[2]), parser.abs(index), parser.fileInfo);
    }

    UnicodeDescriptor unicodeDescriptor() {
        String ud = in.re(UNICODE_RANGE);
        return ud == null ? null : new UnicodeDescriptor(ud);
    }

    /**
     * 内联 JavaScript（`...` 与 ~`...`）不受支持
     */
    void rejectJavascript() {
        char c = in.currentChar();
        if (c == '`' || (c == '~' && in.charAt(in.i + 1) == '`')) {
            throw parser.error("Inline JavaScript evaluation (`...`) is not supported");
        }
    }
}
