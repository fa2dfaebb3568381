package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 内置函数的参数检查与取值
 *
 * <p>检查失败抛出 {@link IllegalArgumentException}，由求值器包装为参数错误。</p>
 */
final class Args {

    private Args() {
    }

    static Node arg(List<Node> args, int i) {
        return i < args.size() ? args.get(i) : null;
    }

    static Node required(List<Node> args, int i, String what) {
        Node n = arg(args, i);
        if (n == null) {
            throw new IllegalArgumentException("missing the required " + what + " argument");
        }
        return n;
    }

    static Dimension dimension(Node n) {
        if (!(n instanceof Dimension)) {
            throw new IllegalArgumentException("argument must be a number");
        }
        return (Dimension) n;
    }

    static Color color(Node n) {
        if (!(n instanceof Color)) {
            throw new IllegalArgumentException("Argument cannot be evaluated to a color");
        }
        return (Color) n;
    }

    /** 百分数按 0-1 取值，其余数值取原值 */
    static double number(Node n) {
        if (n instanceof Dimension) {
            Dimension d = (Dimension) n;
            return d.getUnit().is("%") ? d.getValue() / 100 : d.getValue();
        }
        throw new IllegalArgumentException("color functions take numbers as parameters");
    }

    /** 百分数按 size 缩放，其余同 {@link #number(Node)} */
    static double scaled(Node n, double size) {
        if (n instanceof Dimension && ((Dimension) n).getUnit().is("%")) {
            return ((Dimension) n).getValue() * size / 100;
        }
        return number(n);
    }

    /** 数值参数的原始数值（不做百分数换算） */
    static double amount(Node n) {
        return dimension(n).getValue();
    }

    static double clamp(double v) {
        return Math.min(1, Math.max(0, v));
    }

    /** 字符串、关键字、匿名值的文本；其余返回 null */
    static String text(Node n) {
        if (n instanceof Quoted) {
            return ((Quoted) n).getValue();
        }
        if (n instanceof Keyword) {
            return ((Keyword) n).getValue();
        }
        if (n instanceof Anonymous) {
            return ((Anonymous) n).getValue();
        }
        return null;
    }

    /** 列表值的元素：逗号列表或空格列表展开，其余视为单元素列表 */
    static List<Node> items(Node n) {
        if (n instanceof Value) {
            return ((Value) n).getValue();
        }
        if (n instanceof Expression) {
            return ((Expression) n).getValue();
        }
        List<Node> single = new ArrayList<>();
        single.add(n);
        return single;
    }
}
