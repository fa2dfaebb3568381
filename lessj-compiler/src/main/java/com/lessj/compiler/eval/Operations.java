package com.lessj.compiler.eval;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Unit;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.output.CssEmitter;

import java.util.List;

/**
 * 数值与颜色运算、值比较
 */
public final class Operations {

    private Operations() {
    }

    /**
     * 四则运算
     */
    public static double apply(String op, double a, double b) {
        switch (op) {
            case "+":
                return a + b;
            case "-":
                return a - b;
            case "*":
                return a * b;
            case "/":
                return a / b;
            default:
                throw new IllegalArgumentException("unknown operator " + op);
        }
    }

    /**
     * 带单位的数值运算
     *
     * <p>加减时右操作数换算到左操作数使用的单位；无单位的一侧采用另一侧的单位。
     * 严格单位模式下换算后单位仍不一致则报错，否则沿用左操作数的单位。</p>
     */
    public static Dimension operate(Dimension left, String op, Dimension right, boolean strictUnits) {
        double value = apply(op, left.getValue(), right.getValue());
        Unit unit = left.getUnit();
        Dimension other = right;
        if ("+".equals(op) || "-".equals(op)) {
            if (unit.getNumerator().isEmpty() && unit.getDenominator().isEmpty()) {
                unit = other.getUnit();
                if (left.getUnit().getBackupUnit() != null) {
                    unit = unit.withBackupUnit(left.getUnit().getBackupUnit());
                }
            } else if (other.getUnit().getNumerator().isEmpty() && unit.getDenominator().isEmpty()) {
                // 右侧无单位，沿用左侧
            } else {
                other = other.convertTo(left.getUnit().usedUnits());
                if (strictUnits && !other.getUnit().toString().equals(unit.toString())) {
                    throw new EvalException(ErrorKind.OPERATION,
                            "Incompatible units. Change the units or use the unit function. Bad units: '"
                                    + unit + "' and '" + other.getUnit() + "'.");
                }
                value = apply(op, left.getValue(), other.getValue());
            }
        } else if ("*".equals(op)) {
            unit = unit.multiply(other.getUnit());
        } else if ("/".equals(op)) {
            unit = unit.divide(other.getUnit());
        }
        if (Double.isNaN(value)) {
            throw new EvalException(ErrorKind.OPERATION, "Dimension is not a number.");
        }
        return new Dimension(value, unit);
    }

    /**
     * 逐通道的颜色运算，alpha 按叠加公式合成
     */
    public static Color operate(Color left, String op, Color right) {
        double[] rgb = new double[3];
        double alpha = left.getAlpha() * (1 - right.getAlpha()) + right.getAlpha();
        for (int c = 0; c < 3; c++) {
            rgb[c] = apply(op, left.channel(c), right.channel(c));
        }
        return new Color(rgb, alpha, null);
    }

    // ============ 比较 ============

    /**
     * 比较两个已求值的节点
     *
     * @return -1、0、1，不可比较时返回 null
     */
    public static Integer compare(Node a, Node b) {
        if (hasCompare(a) && !(b instanceof Quoted || b instanceof Anonymous)) {
            return compareWith(a, b);
        }
        if (hasCompare(b)) {
            Integer r = compareWith(b, a);
            return r == null ? null : -r;
        }
        if (a.getClass() != b.getClass()) {
            return null;
        }
        if (a instanceof Keyword) {
            return ((Keyword) a).getValue().equals(((Keyword) b).getValue()) ? Integer.valueOf(0) : null;
        }
        List<Node> left = listOf(a);
        List<Node> right = listOf(b);
        if (left == null || right == null || left.size() != right.size()) {
            return null;
        }
        for (int i = 0; i < left.size(); i++) {
            Integer r = compare(left.get(i), right.get(i));
            if (r == null || r != 0) {
                return null;
            }
        }
        return 0;
    }

    private static boolean hasCompare(Node node) {
        return node instanceof Dimension || node instanceof Color
                || node instanceof Quoted || node instanceof Anonymous;
    }

    private static Integer compareWith(Node self, Node other) {
        if (self instanceof Dimension) {
            return other instanceof Dimension ? ((Dimension) self).compareTo((Dimension) other) : null;
        }
        if (self instanceof Color) {
            return other instanceof Color ? ((Color) self).compareTo((Color) other) : null;
        }
        if (self instanceof Quoted && other instanceof Quoted
                && !((Quoted) self).isEscaped() && !((Quoted) other).isEscaped()) {
            int r = ((Quoted) self).getValue().compareTo(((Quoted) other).getValue());
            return Integer.signum(r);
        }
        return CssEmitter.toCss(self, false, false).equals(CssEmitter.toCss(other, false, false))
                ? Integer.valueOf(0) : null;
    }

    private static List<Node> listOf(Node node) {
        if (node instanceof Value) {
            return ((Value) node).getValue();
        }
        if (node instanceof Expression) {
            return ((Expression) node).getValue();
        }
        return null;
    }
}
