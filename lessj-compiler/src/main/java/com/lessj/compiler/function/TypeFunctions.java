package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.DetachedRuleset;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Url;

/**
 * 类型判断函数
 */
final class TypeFunctions {

    private TypeFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addBuiltin("isruleset", (ctx, args) -> isa(Args.arg(args, 0), DetachedRuleset.class));
        registry.addBuiltin("iscolor", (ctx, args) -> isa(Args.arg(args, 0), Color.class));
        registry.addBuiltin("isnumber", (ctx, args) -> isa(Args.arg(args, 0), Dimension.class));
        registry.addBuiltin("isstring", (ctx, args) -> isa(Args.arg(args, 0), Quoted.class));
        registry.addBuiltin("iskeyword", (ctx, args) -> isa(Args.arg(args, 0), Keyword.class));
        registry.addBuiltin("isurl", (ctx, args) -> isa(Args.arg(args, 0), Url.class));
        registry.addBuiltin("ispixel", (ctx, args) -> isUnit(Args.arg(args, 0), "px"));
        registry.addBuiltin("ispercentage", (ctx, args) -> isUnit(Args.arg(args, 0), "%"));
        registry.addBuiltin("isem", (ctx, args) -> isUnit(Args.arg(args, 0), "em"));
        registry.addBuiltin("isunit", (ctx, args) -> {
            Node unit = Args.arg(args, 1);
            if (unit == null) {
                throw new IllegalArgumentException("missing the required second argument to isunit.");
            }
            String text = Args.text(unit);
            if (text == null) {
                throw new IllegalArgumentException("Second argument to isunit should be a unit or a string.");
            }
            return isUnit(Args.arg(args, 0), text);
        });
    }

    private static Keyword isa(Node n, Class<? extends Node> type) {
        return Keyword.of(type.isInstance(n));
    }

    private static Keyword isUnit(Node n, String unit) {
        return Keyword.of(n instanceof Dimension && ((Dimension) n).getUnit().is(unit));
    }
}
