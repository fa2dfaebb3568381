package com.lessj.compiler.parser;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Container;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.ImportOptions;
import com.lessj.compiler.ast.rule.Media;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Paren;
import com.lessj.compiler.ast.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * at 规则：@import、@media、@container 与通用指令
 */
final class AtRuleParser {
    private static final Pattern IMPORT = Pattern.compile("@import\\s+");
    private static final Pattern IMPORT_OPTION =
            Pattern.compile("(less|css|multiple|once|inline|reference|optional)");
    private static final Pattern AT_RULE_NAME = Pattern.compile("@[a-z-]+");
    private static final Pattern FEATURE_PROPERTY = Pattern.compile("(\\*?-?[_a-zA-Z0-9-]+)\\s*:");
    private static final Pattern PLUGIN = Pattern.compile("@plugin\\b");

    private final Parser parser;
    private final ParserInput in;

    AtRuleParser(Parser parser) {
        this.parser = parser;
        this.in = parser.in;
    }

    Node atRule() {
        if (in.currentChar() != '@') {
            return null;
        }
        if (in.peek(PLUGIN)) {
            throw parser.error("@plugin is not supported");
        }
        Node value = importRule();
        if (value == null) {
            value = media();
        }
        if (value == null) {
            value = container();
        }
        if (value != null) {
            return value;
        }
        return directive();
    }

    /**
     * 通用指令：按去掉厂商前缀后的名称决定值的解析方式与是否需要块体
     */
    private AtRule directive() {
        int index = in.i;
        in.save();
        String name = in.re(AT_RULE_NAME);
        if (name == null) {
            in.restore();
            return null;
        }
        String nonVendorName = name;
        if (name.charAt(1) == '-' && name.indexOf('-', 2) > 0) {
            nonVendorName = "@" + name.substring(name.indexOf('-', 2) + 1);
        }
        boolean hasIdentifier = false;
        boolean hasExpression = false;
        boolean hasUnknown = false;
        boolean hasBlock = true;
        boolean isRooted = true;
        switch (nonVendorName) {
            case "@charset":
                hasIdentifier = true;
                hasBlock = false;
                break;
            case "@namespace":
                hasExpression = true;
                hasBlock = false;
                break;
            case "@keyframes":
            case "@counter-style":
                hasIdentifier = true;
                break;
            case "@document":
            case "@supports":
            case "@layer":
                hasUnknown = true;
                isRooted = false;
                break;
            default:
                hasUnknown = true;
                break;
        }
        in.commentStore.clear();

        Node value = null;
        if (hasIdentifier) {
            value = parser.expect(parser.entity(), "expected " + name + " identifier");
        } else if (hasExpression) {
            value = parser.expect(parser.values.expression(), "expected " + name + " expression");
        } else if (hasUnknown) {
            value = parser.permissiveValue("{;");
            hasBlock = in.currentChar() == '{';
            if (value == null) {
                if (!hasBlock && in.currentChar() != ';') {
                    throw parser.error(name + " rule is missing block or ending semi-colon");
                }
            } else if (value instanceof Anonymous && ((Anonymous) value).getValue().isEmpty()) {
                value = null;
            }
        }

        List<Node> rules = null;
        if (hasBlock) {
            Ruleset body = parser.blockRuleset();
            if (body != null) {
                rules = wrapBody(body.getRules(), body.getIndex());
            }
        }
        if (rules != null || (!hasBlock && value != null && in.ch(';') != null)) {
            in.forget();
            return new AtRule(name, value, rules, parser.abs(index), parser.fileInfo, isRooted);
        }
        in.restore("at-rule options not recognised");
        return null;
    }

    /**
     * 块体统一包装为以 "&amp;" 为选择器的规则集
     */
    private List<Node> wrapBody(List<Node> content, int index) {
        Ruleset body = new Ruleset(Selector.createEmptySelectors(index, parser.fileInfo), content,
                false, index, parser.fileInfo);
        List<Node> rules = new ArrayList<>();
        rules.add(body);
        return rules;
    }

    private Import importRule() {
        int index = in.i;
        if (in.re(IMPORT) == null) {
            return null;
        }
        ImportOptions options = importOptions();
        Node path = parser.entities.quoted();
        if (path == null) {
            path = parser.entities.url();
        }
        if (path == null) {
            in.i = index;
            throw parser.error("malformed import statement");
        }
        List<Node> features = mediaFeatures();
        if (in.ch(';') == null) {
            in.i = index;
            throw parser.error("missing semi-colon or unrecognised media features on import");
        }
        Node featureValue = features == null ? null : new Value(features);
        return new Import(path, featureValue, options, parser.abs(index), parser.fileInfo);
    }

    /**
     * (reference, once) 等导入选项；css 即 less=false，once 即 multiple=false
     */
    private ImportOptions importOptions() {
        if (in.ch('(') == null) {
            return ImportOptions.DEFAULT;
        }
        Boolean less = null;
        boolean inline = false;
        boolean reference = false;
        boolean multiple = false;
        boolean optional = false;
        while (true) {
            String[] o = in.reGroups(IMPORT_OPTION);
            if (o == null) {
                break;
            }
            switch (o[1]) {
                case "css":
                    less = Boolean.FALSE;
                    break;
                case "less":
                    less = Boolean.TRUE;
                    break;
                case "once":
                    multiple = false;
                    break;
                case "multiple":
                    multiple = true;
                    break;
                case "inline":
                    inline = true;
                    break;
                case "reference":
                    reference = true;
                    break;
                default:
                    optional = true;
                    break;
            }
            if (in.ch(',') == null) {
                break;
            }
        }
        parser.expectChar(')');
        return new ImportOptions(less, inline, reference, multiple, optional);
    }

    private Media media() {
        int index = in.i;
        if (in.str("@media") == null) {
            return null;
        }
        List<Node> features = mediaFeatures();
        List<Node> rules = parser.expect(parser.block(),
                "media definitions require block statements after any features");
        return (Media) withBody(new Media(featureValue(features, index), null, parser.abs(index), parser.fileInfo),
                rules, index);
    }

    private Container container() {
        int index = in.i;
        if (in.str("@container") == null) {
            return null;
        }
        List<Node> features = mediaFeatures();
        List<Node> rules = parser.expect(parser.block(),
                "container definitions require block statements after any features");
        return (Container) withBody(new Container(featureValue(features, index), null, parser.abs(index),
                parser.fileInfo), rules, index);
    }

    private Value featureValue(List<Node> features, int index) {
        return new Value(features == null ? new ArrayList<Node>() : features, parser.abs(index), parser.fileInfo);
    }

    private NestedAtRule withBody(NestedAtRule atRule, List<Node> content, int index) {
        List<Node> rules = wrapBody(content, parser.abs(index));
        ((Ruleset) rules.get(0)).setAllowImports(true);
        atRule.setRules(rules);
        return atRule;
    }

    /**
     * 逗号分隔的媒体查询列表
     */
    List<Node> mediaFeatures() {
        List<Node> features = new ArrayList<>();
        while (true) {
            Node e = mediaFeature();
            if (e == null) {
                e = parser.entities.variable();
                if (e == null) {
                    e = parser.mixins.call(true, Boolean.TRUE);
                }
            }
            if (e == null) {
                break;
            }
            features.add(e);
            if (in.ch(',') == null) {
                break;
            }
        }
        return features.isEmpty() ? null : features;
    }

    /**
     * 单个查询：关键字、变量与括号特性 (name: value) 的序列
     */
    private Expression mediaFeature() {
        int index = in.i;
        List<Node> nodes = new ArrayList<>();
        in.save();
        while (true) {
            Node e = parser.entities.keyword();
            if (e == null) {
                e = parser.entities.variable();
            }
            if (e == null) {
                e = parser.mixins.call(true, Boolean.TRUE);
            }
            if (e != null) {
                nodes.add(e);
                continue;
            }
            if (in.ch('(') == null) {
                break;
            }
            int featureStart = in.i;
            String[] property = in.reGroups(FEATURE_PROPERTY);
            Node value = parser.values.value();
            if (in.ch(')') != null) {
                if (property != null && value != null) {
                    String name = property[1];
                    nodes.add(new Paren(new Declaration(name, value, null, null, parser.abs(featureStart),
                            parser.fileInfo, true, false)));
                } else if (value != null) {
                    nodes.add(new Paren(value));
                } else {
                    throw parser.error("badly formed media feature definition");
                }
            } else {
                // 范围语法等无法结构化解析的查询原样保留，如 (400px <= width <= 700px)
                in.i = featureStart;
                String raw = in.parseUntil(")");
                if (raw == null || in.ch(')') == null) {
                    throw parser.error("Missing closing ')'");
                }
                nodes.add(new Paren(new Anonymous(raw.trim(), parser.abs(featureStart), parser.fileInfo)));
            }
        }
        in.forget();
        if (nodes.isEmpty()) {
            return null;
        }
        return new Expression(nodes, false, parser.abs(index), parser.fileInfo);
    }
}
