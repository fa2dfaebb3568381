package com.lessj.compiler.parser;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.MixinDefinition;
import com.lessj.compiler.ast.rule.MixinParameter;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.rule.VariableCall;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.DetachedRuleset;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.NamespaceValue;
import com.lessj.compiler.ast.value.Property;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 递归下降解析器
 *
 * <p>本类负责根节点与语句级产生式；字面量、选择器、表达式、mixin 与 at 规则
 * 分别委托给 {@link EntityParser}、{@link SelectorParser}、{@link ValueParser}、
 * {@link MixinParser}、{@link AtRuleParser}。歧义通过 save/restore 试探解决，
 * 不做错误恢复。</p>
 */
public class Parser {
    private static final Pattern VARIABLE_NAME = Pattern.compile("(@[\\w-]+)\\s*:");
    private static final Pattern VARIABLE_CALL = Pattern.compile("(@[\\w-]+)(\\(\\s*\\))?");
    private static final Pattern SIMPLE_PROPERTY = Pattern.compile("([_a-zA-Z0-9-]+)\\s*:");
    private static final Pattern PROPERTY_STAR = Pattern.compile("(\\*?)");
    private static final Pattern PROPERTY_PART = Pattern.compile("((?:[\\w-]+)|(?:[@$]\\{[\\w-]+\\}))");
    private static final Pattern PROPERTY_MERGE = Pattern.compile("((?:\\+_|\\+)?)\\s*:");
    private static final Pattern ANONYMOUS_VALUE = Pattern.compile("([^.#@$+/'\"*`(;{}\\-]*);");
    private static final Pattern DETACHED_PARAMS = Pattern.compile("[.#]\\(");

    final ParserInput in;
    final FileInfo fileInfo;
    final String filename;
    private final int baseIndex;

    final EntityParser entities;
    final SelectorParser selectors;
    final ValueParser values;
    final MixinParser mixins;
    final AtRuleParser atRules;

    public Parser(String source, FileInfo fileInfo) {
        this(source, fileInfo, 0);
    }

    Parser(String source, FileInfo fileInfo, int baseIndex) {
        this.fileInfo = fileInfo;
        this.filename = fileInfo == null ? "input" : fileInfo.getFilename();
        this.baseIndex = baseIndex;
        this.in = new ParserInput(source, Chunker.scan(source, filename));
        this.entities = new EntityParser(this);
        this.selectors = new SelectorParser(this);
        this.values = new ValueParser(this);
        this.mixins = new MixinParser(this);
        this.atRules = new AtRuleParser(this);
    }

    /**
     * 统一换行并去掉 BOM，节点偏移与错误位置都基于处理后的文本
     */
    public static String preprocess(String source) {
        String text = source;
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * 解析整个样式表
     *
     * @return 根规则集（root 与 firstRoot 均为 true）
     * @throws ParseException 语法错误
     */
    public Ruleset parse() {
        List<Node> rules = primary();
        Ruleset root = new Ruleset(null, rules, false, baseIndex, fileInfo);
        root.setRoot(true);
        root.setFirstRoot(true);
        checkFinished();
        return root;
    }

    /**
     * 重新解析插值后的选择器文本
     */
    public static List<Selector> parseSelectors(String text, FileInfo fileInfo, int index) {
        Parser parser = new Parser(text, fileInfo, index);
        List<Selector> result = parser.selectors.selectors();
        parser.checkFinished();
        return result;
    }

    /**
     * 把延迟解析的声明值（"red !important"）解析为 [值, important]
     *
     * @return 无法完整解析时返回 null
     */
    public static Node[] parseValue(String text, FileInfo fileInfo, int index) {
        try {
            Parser parser = new Parser(text, fileInfo, index);
            Node value = parser.values.value();
            String important = parser.values.important();
            if (value == null || !parser.in.end()) {
                return null;
            }
            return new Node[]{value, important == null ? null : new Keyword(important)};
        } catch (ParseException e) {
            return null;
        }
    }

    // ============ 工具 ============

    int abs(int index) {
        return index + baseIndex;
    }

    ParseException error(String message) {
        return new ParseException(message, filename, abs(in.i));
    }

    <T> T expect(T result, String message) {
        if (result == null) {
            throw error(message);
        }
        return result;
    }

    String expectChar(char c) {
        String result = in.ch(c);
        if (result == null) {
            throw error("expected '" + c + "' got '" + in.currentChar() + "'");
        }
        return result;
    }

    private void checkFinished() {
        boolean finished = in.end();
        if (finished) {
            return;
        }
        String message = in.getFurthestPossibleErrorMessage();
        if (message == null) {
            message = "Unrecognised input";
            char c = in.currentChar();
            if (c == '}') {
                message += ". Possibly missing opening '{'";
            } else if (c == ')') {
                message += ". Possibly missing opening '('";
            } else if (in.i >= in.getInput().length() - 1) {
                message += ". Possibly missing something";
            }
        }
        throw new ParseException(message, filename, abs(in.i));
    }

    // ============ 语句 ============

    /**
     * 规则序列：根节点与块体共用
     */
    List<Node> primary() {
        List<Node> root = new ArrayList<>();
        while (true) {
            Node node;
            while ((node = comment()) != null) {
                root.add(node);
            }
            if (in.finished() || in.peekChar('}')) {
                break;
            }
            List<Extend> extendRule = selectors.extend(true);
            if (extendRule != null) {
                root.addAll(extendRule);
                continue;
            }
            node = mixins.definition();
            if (node == null) {
                node = declaration();
            }
            if (node == null) {
                node = mixins.call(false, false);
            }
            if (node == null) {
                node = ruleset();
            }
            if (node == null) {
                node = variableCall(null);
            }
            if (node == null) {
                // 语句级函数调用，如 each(@list, { ... });
                node = entities.call();
            }
            if (node == null) {
                node = atRules.atRule();
            }
            if (node != null) {
                root.add(node);
            } else {
                boolean foundSemiColon = false;
                while (in.ch(';') != null) {
                    foundSemiColon = true;
                }
                if (!foundSemiColon) {
                    break;
                }
            }
        }
        return root;
    }

    Comment comment() {
        if (in.commentStore.isEmpty()) {
            return null;
        }
        ParserInput.CommentToken token = in.commentStore.remove(0);
        return new Comment(token.text, token.lineComment, abs(token.index), fileInfo);
    }

    boolean end() {
        return in.ch(';') != null || in.peekChar('}');
    }

    List<Node> block() {
        if (in.ch('{') == null) {
            return null;
        }
        List<Node> content = primary();
        if (in.ch('}') == null) {
            return null;
        }
        return content;
    }

    Ruleset blockRuleset() {
        int index = in.i;
        List<Node> block = block();
        return block == null ? null : new Ruleset(null, block, false, abs(index), fileInfo);
    }

    Ruleset ruleset() {
        int index = in.i;
        in.save();
        List<Selector> list = selectors.selectors();
        List<Node> rules = list == null ? null : block();
        if (rules != null) {
            in.forget();
            return new Ruleset(list, rules, false, abs(index), fileInfo);
        }
        in.restore();
        return null;
    }

    /**
     * 分离规则集 { ... } 或匿名 mixin #(@a) { ... }
     */
    Node detachedRuleset() {
        int index = in.i;
        List<MixinParameter> params = null;
        boolean variadic = false;
        in.save();
        if (in.re(DETACHED_PARAMS) != null) {
            MixinParser.ArgsResult argInfo = mixins.args(false);
            params = argInfo.params;
            variadic = argInfo.variadic;
            if (in.ch(')') == null) {
                in.restore();
                return null;
            }
        }
        Ruleset block = blockRuleset();
        if (block != null) {
            in.forget();
            if (params != null) {
                return new MixinDefinition(null, params, block.getRules(), null, variadic, null,
                        abs(index), fileInfo);
            }
            return new DetachedRuleset(block);
        }
        in.restore();
        return null;
    }

    /**
     * 分离规则集调用 @dr(); 或值中的 @dr[@x]
     *
     * @param parsedName 值中已读出的变量名；语句级调用时为 null
     */
    Node variableCall(String parsedName) {
        int index = in.i;
        boolean inValue = parsedName != null;
        String name = parsedName;
        boolean hasParens = false;
        in.save();
        if (!inValue) {
            if (in.currentChar() != '@') {
                in.restore();
                return null;
            }
            String[] m = in.reGroups(VARIABLE_CALL);
            if (m == null) {
                in.restore();
                return null;
            }
            name = m[1];
            hasParens = m[2] != null;
        }
        List<String> lookups = mixins.ruleLookups();
        if (lookups == null && ((inValue && in.str("()") == null) || (!inValue && !hasParens))) {
            in.restore("Missing '[...]' lookup in variable call");
            return null;
        }
        if (!inValue) {
            boolean important = values.important() != null;
            if (end()) {
                in.forget();
                VariableCall call = new VariableCall(name, important, abs(index), fileInfo);
                if (lookups == null) {
                    return call;
                }
                return new NamespaceValue(call, lookups, important, abs(index), fileInfo);
            }
            in.restore();
            return null;
        }
        in.forget();
        return new NamespaceValue(new VariableCall(name, false, abs(index), fileInfo),
                lookups, false, abs(index), fileInfo);
    }

    // ============ 声明 ============

    Declaration declaration() {
        int index = in.i;
        char c = in.currentChar();
        if (c == '.' || c == '#' || c == '&' || c == ':') {
            return null;
        }
        in.save();
        String variableName = variableName();
        List<Node> nameParts = variableName == null ? ruleProperty() : null;
        if (variableName == null && nameParts == null) {
            in.restore();
            return null;
        }
        boolean isVariable = variableName != null;
        Node value = null;
        boolean hasDetached = false;
        String important = null;
        String merge = null;

        if (isVariable) {
            value = detachedRuleset();
            hasDetached = value != null;
        }
        in.commentStore.clear();
        if (value == null) {
            if (!isVariable && nameParts.size() > 1) {
                Node marker = nameParts.remove(nameParts.size() - 1);
                merge = ((Keyword) marker).getValue();
            }
            String firstPart = !isVariable && nameParts.get(0) instanceof Keyword
                    ? ((Keyword) nameParts.get(0)).getValue() : "";
            if (firstPart.startsWith("--")) {
                if (in.ch(';') != null) {
                    value = new Anonymous("", abs(in.i), fileInfo);
                } else {
                    value = permissiveValue(";}");
                }
            } else {
                value = anonymousValue();
            }
            if (value != null) {
                in.forget();
                return makeDeclaration(variableName, nameParts, value, null, merge, index);
            }
            value = values.value();
            if (value != null) {
                important = values.important();
            } else if (isVariable) {
                value = permissiveValue(";");
            }
        }
        if (value != null && (end() || hasDetached)) {
            in.forget();
            return makeDeclaration(variableName, nameParts, value, important, merge, index);
        }
        in.restore();
        return null;
    }

    private Declaration makeDeclaration(String variableName, List<Node> nameParts, Node value,
                                        String important, String merge, int index) {
        if (variableName != null) {
            return new Declaration(variableName, value, important, null, abs(index), fileInfo, false, true);
        }
        StringBuilder plain = new StringBuilder();
        for (Node part : nameParts) {
            if (!(part instanceof Keyword)) {
                return new Declaration(null, nameParts, value, important, merge, abs(index), fileInfo, false, false);
            }
            plain.append(((Keyword) part).getValue());
        }
        return new Declaration(plain.toString(), value, important, merge, abs(index), fileInfo, false, false);
    }

    private String variableName() {
        if (in.currentChar() != '@') {
            return null;
        }
        String[] m = in.reGroups(VARIABLE_NAME);
        return m == null ? null : m[1];
    }

    /**
     * 属性名：简单名称，或由关键字与插值片段组成、末尾带合并标记的片段列表
     */
    List<Node> ruleProperty() {
        in.save();
        String[] simple = in.reGroups(SIMPLE_PROPERTY);
        if (simple != null) {
            in.forget();
            List<Node> name = new ArrayList<>();
            name.add(new Keyword(simple[1]));
            return name;
        }
        List<String> parts = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        matchPart(PROPERTY_STAR, parts, indexes);
        boolean more = true;
        while (more) {
            more = matchPart(PROPERTY_PART, parts, indexes);
        }
        if (parts.size() > 1 && matchPart(PROPERTY_MERGE, parts, indexes)) {
            in.forget();
            if (parts.get(0).isEmpty()) {
                parts.remove(0);
                indexes.remove(0);
            }
            List<Node> name = new ArrayList<>();
            for (int k = 0; k < parts.size(); k++) {
                String s = parts.get(k);
                int at = abs(indexes.get(k));
                if (s.startsWith("@")) {
                    name.add(new Variable(
                            "@" + s.substring(2, s.length() - 1), at, fileInfo));
                } else if (s.startsWith("$")) {
                    name.add(new Property(
                            "$" + s.substring(2, s.length() - 1), at, fileInfo));
                } else {
                    name.add(new Keyword(s, at, fileInfo));
                }
            }
            return name;
        }
        in.restore();
        return null;
    }

    private boolean matchPart(Pattern pattern, List<String> parts, List<Integer> indexes) {
        int start = in.i;
        String[] m = in.reGroups(pattern);
        if (m == null) {
            return false;
        }
        if (pattern == PROPERTY_PART && m[1].isEmpty()) {
            return false;
        }
        indexes.add(start);
        parts.add(m[1]);
        return true;
    }

    /**
     * 不含特殊字符的简单值原样保存，需要时再解析
     */
    private Anonymous anonymousValue() {
        int index = in.i;
        String[] m = in.reGroups(ANONYMOUS_VALUE);
        if (m != null) {
            return new Anonymous(m[1], abs(index), fileInfo);
        }
        return null;
    }

    /**
     * 宽松值：先尽量按实体解析，剩余部分原样保留直到终止字符
     *
     * @param stopChars 终止字符集合
     */
    Node permissiveValue(String stopChars) {
        int index = in.i;
        if (stopChars.indexOf(in.currentChar()) >= 0) {
            return null;
        }
        List<Node> result = new ArrayList<>();
        List<Node> value = new ArrayList<>();
        Node e;
        do {
            e = comment();
            if (e != null) {
                value.add(e);
                continue;
            }
            e = entity();
            if (e != null) {
                value.add(e);
            }
            if (in.peekChar(',')) {
                value.add(new Anonymous(",", abs(in.i), fileInfo));
                in.ch(',');
            }
        } while (e != null);

        boolean done = stopChars.indexOf(in.currentChar()) >= 0;
        if (!value.isEmpty()) {
            Expression expression = new Expression(value, false, abs(index), fileInfo);
            if (done) {
                return expression;
            }
            result.add(expression);
            if (in.prevChar() == ' ') {
                result.add(new Anonymous(" ", abs(index), fileInfo));
            }
        }
        in.save();
        String raw = in.parseUntil(stopChars);
        if (raw != null) {
            String trimmed = raw.trim();
            if (trimmed.isEmpty() && result.isEmpty()) {
                in.forget();
                return new Anonymous("", abs(index), fileInfo);
            }
            result.add(new Quoted("'", trimmed, true, abs(index), fileInfo));
            in.forget();
            return new Expression(result, true, abs(index), fileInfo);
        }
        in.restore();
        return null;
    }

    /**
     * 单个值实体
     */
    Node entity() {
        Node e = comment();
        if (e == null) {
            e = entities.literal();
        }
        if (e == null) {
            e = entities.variable();
        }
        if (e == null) {
            e = entities.url();
        }
        if (e == null) {
            e = entities.property();
        }
        if (e == null) {
            e = entities.call();
        }
        if (e == null) {
            e = entities.keyword();
        }
        if (e == null) {
            e = mixins.call(true, null);
        }
        if (e == null) {
            entities.rejectJavascript();
        }
        return e;
    }
}
