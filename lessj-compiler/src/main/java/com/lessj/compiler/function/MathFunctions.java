package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Operation;
import com.lessj.compiler.ast.value.Unit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * 数学与单位函数
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        // ---- 取整与基本运算，保留单位 ----
        registerUnary(registry, "ceil", Math::ceil, null);
        registerUnary(registry, "floor", Math::floor, null);
        registerUnary(registry, "sqrt", Math::sqrt, null);
        registerUnary(registry, "abs", Math::abs, null);

        // ---- 三角函数，角度先换算为弧度 ----
        registerUnary(registry, "tan", Math::tan, "");
        registerUnary(registry, "sin", Math::sin, "");
        registerUnary(registry, "cos", Math::cos, "");
        registerUnary(registry, "atan", Math::atan, "rad");
        registerUnary(registry, "asin", Math::asin, "rad");
        registerUnary(registry, "acos", Math::acos, "rad");

        registry.addBuiltin("round", (ctx, args) -> {
            Node fraction = Args.arg(args, 1);
            final int places = fraction == null ? 0 : (int) Args.amount(fraction);
            return apply(Args.arg(args, 0), v -> BigDecimal.valueOf(v).setScale(places, RoundingMode.HALF_UP)
                    .doubleValue(), null);
        });
        registry.addBuiltin("percentage", (ctx, args) -> apply(Args.arg(args, 0), v -> v * 100, "%"));
        registry.addBuiltin("pi", (ctx, args) -> new Dimension(Math.PI));
        registry.addBuiltin("mod", (ctx, args) -> {
            Dimension a = Args.dimension(Args.required(args, 0, "first"));
            Dimension b = Args.dimension(Args.required(args, 1, "second"));
            return new Dimension(a.getValue() % b.getValue(), a.getUnit());
        });
        registry.addBuiltin("pow", (ctx, args) -> {
            Node x = Args.arg(args, 0);
            Node y = Args.arg(args, 1);
            if (!(x instanceof Dimension) || !(y instanceof Dimension)) {
                throw new IllegalArgumentException("arguments must be numbers");
            }
            Dimension base = (Dimension) x;
            return new Dimension(Math.pow(base.getValue(), ((Dimension) y).getValue()), base.getUnit());
        });
        registry.addBuiltin("min", (ctx, args) -> minMax(true, args, ctx));
        registry.addBuiltin("max", (ctx, args) -> minMax(false, args, ctx));

        // ---- 单位 ----
        registry.addBuiltin("convert", (ctx, args) -> {
            Dimension value = Args.dimension(Args.required(args, 0, "first"));
            String unit = Args.text(Args.required(args, 1, "second"));
            if (unit == null) {
                unit = ctx.toCss(args.get(1));
            }
            return value.convertTo(unit);
        });
        registry.addBuiltin("unit", (ctx, args) -> {
            Node value = Args.arg(args, 0);
            if (!(value instanceof Dimension)) {
                throw new IllegalArgumentException("the first argument to unit must be a number"
                        + (value instanceof Operation ? ". Have you forgotten parenthesis?" : ""));
            }
            Node unitArg = Args.arg(args, 1);
            String unit = "";
            if (unitArg instanceof Keyword) {
                unit = ((Keyword) unitArg).getValue();
            } else if (unitArg != null) {
                unit = ctx.toCss(unitArg);
            }
            return new Dimension(((Dimension) value).getValue(), unit);
        });
        registry.addBuiltin("get-unit", (ctx, args) ->
                new Anonymous(Args.dimension(Args.required(args, 0, "first")).getUnit().toString()));
    }

    private static void registerUnary(FunctionRegistry registry, String name, DoubleUnaryOperator fn, String unit) {
        registry.addBuiltin(name, (ctx, args) -> apply(Args.arg(args, 0), fn, unit));
    }

    /**
     * unit 为 null 时保留原单位；否则先统一单位（角度变弧度）再换成 unit
     */
    private static Dimension apply(Node n, DoubleUnaryOperator fn, String unit) {
        Dimension d = Args.dimension(n);
        Unit resultUnit;
        if (unit == null) {
            resultUnit = d.getUnit();
        } else {
            d = d.unify();
            resultUnit = Unit.of(unit);
        }
        return new Dimension(fn.applyAsDouble(d.getValue()), resultUnit);
    }

    /**
     * min / max：可比较的单位取极值；出现无法比较的单位组时输出原样的 min()/max()
     */
    private static Node minMax(boolean isMin, List<Node> input, FunctionContext ctx) {
        if (input.isEmpty()) {
            throw new IllegalArgumentException("one or more arguments required");
        }
        List<Node> args = new ArrayList<>(input);
        List<Dimension> order = new ArrayList<>();
        Map<String, Integer> values = new HashMap<>();
        String unitStatic = null;
        String unitClone = null;
        for (int i = 0; i < args.size(); i++) {
            Node current = args.get(i);
            if (!(current instanceof Dimension)) {
                List<Node> nested = Args.items(current);
                if (nested.size() > 1 || nested.get(0) != current) {
                    args.addAll(nested);
                }
                continue;
            }
            Dimension dim = (Dimension) current;
            Dimension unified = dim.getUnit().isEmpty() && unitClone != null
                    ? new Dimension(dim.getValue(), unitClone).unify()
                    : dim.unify();
            String unit = unified.getUnit().toString().isEmpty() && unitStatic != null
                    ? unitStatic
                    : unified.getUnit().toString();
            if (!unit.isEmpty() && (unitStatic == null || order.get(0).unify().getUnit().toString().isEmpty())) {
                unitStatic = unit;
            }
            if (!unit.isEmpty() && unitClone == null) {
                unitClone = dim.getUnit().toString();
            }
            Integer j = values.get("") != null && !unit.isEmpty() && unit.equals(unitStatic)
                    ? values.get("")
                    : values.get(unit);
            if (j == null) {
                if (unitStatic != null && !unit.equals(unitStatic)) {
                    throw new IllegalArgumentException("incompatible types");
                }
                values.put(unit, order.size());
                order.add(dim);
                continue;
            }
            Dimension reference = order.get(j);
            Dimension referenceUnified = reference.getUnit().isEmpty() && unitClone != null
                    ? new Dimension(reference.getValue(), unitClone).unify()
                    : reference.unify();
            if (isMin ? unified.getValue() < referenceUnified.getValue()
                    : unified.getValue() > referenceUnified.getValue()) {
                order.set(j, dim);
            }
        }
        if (order.size() == 1) {
            return order.get(0);
        }
        List<String> parts = new ArrayList<>();
        for (Dimension d : order) {
            parts.add(ctx.toCss(d));
        }
        String separator = ctx.getOptions().isCompress() ? "," : ", ";
        return new Anonymous((isMin ? "min" : "max") + "(" + String.join(separator, parts) + ")");
    }
}
