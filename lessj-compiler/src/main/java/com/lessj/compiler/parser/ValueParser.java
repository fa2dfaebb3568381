package com.lessj.compiler.parser;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Comment;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Condition;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Negative;
import com.lessj.compiler.ast.value.Operation;
import com.lessj.compiler.ast.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 值与表达式：逗号列表、空格表达式、四则运算、守卫条件
 *
 * <p>运算优先级：* / ./ 高于 + -。减号前有空白而后面没有空白时（"1 -1"）
 * 视为列表的下一项而不是减法。</p>
 */
final class ValueParser {
    private static final Pattern COMMENT_START = Pattern.compile("/[/*]");
    private static final Pattern ADDITIVE_OP = Pattern.compile("[-+]\\s+");
    private static final Pattern NEGATED_OPERAND = Pattern.compile("-[@$(]");
    private static final Pattern IMPORTANT = Pattern.compile("! *important");
    private static final Pattern NEXT_CONDITION = Pattern.compile(",\\s*(not\\s*)?\\(");

    private final Parser parser;
    private final ParserInput in;

    ValueParser(Parser parser) {
        this.parser = parser;
        this.in = parser.in;
    }

    /**
     * 逗号分隔的表达式列表
     */
    Value value() {
        int index = in.i;
        List<Node> expressions = new ArrayList<>();
        while (true) {
            Expression e = expression();
            if (e == null) {
                break;
            }
            expressions.add(e);
            if (in.ch(',') == null) {
                break;
            }
        }
        return expressions.isEmpty() ? null : new Value(expressions, parser.abs(index), parser.fileInfo);
    }

    String important() {
        if (in.currentChar() == '!') {
            return in.re(IMPORTANT);
        }
        return null;
    }

    /**
     * 空格分隔的实体序列；行注释被丢弃，块注释保留在表达式中
     */
    Expression expression() {
        int index = in.i;
        List<Node> entities = new ArrayList<>();
        Node e;
        do {
            e = parser.comment();
            if (e != null && !((Comment) e).isLineComment()) {
                entities.add(e);
                continue;
            }
            e = addition();
            if (e == null) {
                e = parser.entity();
            }
            if (e instanceof Comment) {
                e = null;
            }
            if (e != null) {
                entities.add(e);
                // 关键字与数值之间的 "/" 不是除法，如 small/20px
                if (!in.peek(COMMENT_START)) {
                    String delim = in.ch('/');
                    if (delim != null) {
                        entities.add(new Anonymous(delim, parser.abs(index), parser.fileInfo));
                    }
                }
            }
        } while (e != null);
        return entities.isEmpty() ? null : new Expression(entities, false, parser.abs(index), parser.fileInfo);
    }

    Node addition() {
        Node m = multiplication();
        if (m == null) {
            return null;
        }
        Node operation = null;
        boolean isSpaced = in.isWhitespace(-1);
        while (true) {
            int index = in.i;
            String op = in.re(ADDITIVE_OP);
            if (op == null && !isSpaced) {
                op = in.ch('+');
                if (op == null) {
                    op = in.ch('-');
                }
            }
            if (op == null) {
                break;
            }
            Node a = multiplication();
            if (a == null) {
                break;
            }
            markParensInOp(m);
            markParensInOp(a);
            operation = new Operation(op, operation != null ? operation : m, a, isSpaced,
                    parser.abs(index), parser.fileInfo);
            isSpaced = in.isWhitespace(-1);
        }
        return operation != null ? operation : m;
    }

    Node multiplication() {
        Node m = operand();
        if (m == null) {
            return null;
        }
        Node operation = null;
        boolean isSpaced = in.isWhitespace(-1);
        while (true) {
            if (in.peek(COMMENT_START)) {
                break;
            }
            int index = in.i;
            in.save();
            String op = in.ch('/');
            if (op == null) {
                op = in.ch('*');
            }
            if (op == null) {
                op = in.str("./");
            }
            if (op == null) {
                in.forget();
                break;
            }
            Node a = operand();
            if (a == null) {
                in.restore();
                break;
            }
            in.forget();
            markParensInOp(m);
            markParensInOp(a);
            operation = new Operation(op, operation != null ? operation : m, a, isSpaced,
                    parser.abs(index), parser.fileInfo);
            isSpaced = in.isWhitespace(-1);
        }
        return operation != null ? operation : m;
    }

    private static void markParensInOp(Node node) {
        if (node instanceof Expression) {
            ((Expression) node).setParensInOp(true);
        }
    }

    /**
     * 运算数；-@x、-$x、-(...) 形式包装为 Negative
     */
    Node operand() {
        in.save();
        boolean negate = false;
        if (in.peek(NEGATED_OPERAND)) {
            negate = in.ch('-') != null;
        }
        Node o = sub();
        if (o == null) {
            o = parser.entities.dimension();
        }
        if (o == null) {
            o = parser.entities.color();
        }
        if (o == null) {
            o = parser.entities.variable();
        }
        if (o == null) {
            o = parser.entities.property();
        }
        if (o == null) {
            o = parser.entities.call();
        }
        if (o == null) {
            o = parser.entities.quoted();
        }
        if (o == null) {
            o = parser.entities.colorKeyword();
        }
        if (o == null) {
            o = parser.mixins.call(true, Boolean.TRUE);
        }
        if (o == null) {
            in.restore();
            return null;
        }
        in.forget();
        if (negate) {
            markParensInOp(o);
            o = new Negative(o);
        }
        return o;
    }

    /**
     * 括号子表达式
     */
    Expression sub() {
        in.save();
        if (in.ch('(') != null) {
            Node a = addition();
            if (a != null && in.ch(')') != null) {
                in.forget();
                List<Node> list = new ArrayList<>();
                list.add(a);
                Expression e = new Expression(list);
                e.setParens(true);
                return e;
            }
            in.restore("Expected ')'");
            return null;
        }
        in.restore();
        return null;
    }

    // ============ 守卫条件 ============

    /**
     * when 后的条件列表，逗号表示或
     */
    Node conditions() {
        int index = in.i;
        Node a = condition(true);
        if (a == null) {
            return null;
        }
        Node result = a;
        while (in.peek(NEXT_CONDITION) && in.ch(',') != null) {
            Node b = condition(true);
            if (b == null) {
                break;
            }
            result = new Condition("or", result, b, parser.abs(index), parser.fileInfo);
        }
        return result;
    }

    Node condition(boolean needsParens) {
        int index = in.i;
        Node result = conditionAnd(needsParens);
        if (result == null) {
            return null;
        }
        String logical = in.str("or");
        if (logical != null) {
            Node next = condition(needsParens);
            if (next == null) {
                return null;
            }
            result = new Condition(logical, result, next, parser.abs(index), parser.fileInfo);
        }
        return result;
    }

    private Node conditionAnd(boolean needsParens) {
        int index = in.i;
        Node result = negatedCondition(needsParens);
        if (result == null) {
            result = parenthesisCondition(needsParens);
        }
        if (result == null && !needsParens) {
            result = atomicCondition();
        }
        if (result == null) {
            return null;
        }
        String logical = in.str("and");
        if (logical != null) {
            Node next = conditionAnd(needsParens);
            if (next == null) {
                return null;
            }
            result = new Condition(logical, result, next, parser.abs(index), parser.fileInfo);
        }
        return result;
    }

    private Node negatedCondition(boolean needsParens) {
        if (in.str("not") == null) {
            return null;
        }
        Node result = parenthesisCondition(needsParens);
        if (result instanceof Condition) {
            ((Condition) result).toggleNegate();
        }
        return result;
    }

    private Node parenthesisCondition(boolean needsParens) {
        in.save();
        if (in.str("(") == null) {
            in.restore();
            return null;
        }
        in.save();
        Node body = condition(needsParens);
        if (body != null && in.ch(')') != null) {
            in.forget();
            in.forget();
            return body;
        }
        in.restore();
        body = atomicCondition();
        if (body == null) {
            in.restore();
            return null;
        }
        if (in.ch(')') == null) {
            in.restore("expected ')' got '" + in.currentChar() + "'");
            return null;
        }
        in.forget();
        return body;
    }

    /**
     * a op b；只有一个值时等价于 a = true
     */
    private Node atomicCondition() {
        int index = in.i;
        Node a = conditionOperand();
        if (a == null) {
            return null;
        }
        String op = null;
        if (in.ch('>') != null) {
            op = in.ch('=') != null ? ">=" : ">";
        } else if (in.ch('<') != null) {
            op = in.ch('=') != null ? "<=" : "<";
        } else if (in.ch('=') != null) {
            if (in.ch('>') != null) {
                op = "=>";
            } else if (in.ch('<') != null) {
                op = "=<";
            } else {
                op = "=";
            }
        }
        if (op != null) {
            Node b = conditionOperand();
            if (b == null) {
                throw parser.error("expected expression");
            }
            return new Condition(op, a, b, parser.abs(index), parser.fileInfo);
        }
        return new Condition("=", a, new Keyword("true"), parser.abs(index), parser.fileInfo);
    }

    private Node conditionOperand() {
        Node node = addition();
        if (node == null) {
            node = parser.entities.keyword();
        }
        if (node == null) {
            node = parser.entities.quoted();
        }
        if (node == null) {
            node = parser.mixins.call(true, Boolean.TRUE);
        }
        return node;
    }
}
