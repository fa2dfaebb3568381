package com.lessj.compiler.function;

import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Keyword;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 逻辑函数：if、boolean、isdefined、default
 *
 * <p>前三个以原始参数注册，条件在调用处求值，未选中的分支不会被求值。</p>
 */
final class LogicFunctions {
    private static final Logger LOG = Logger.getLogger(LogicFunctions.class.getName());

    private LogicFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addRaw("if", (ctx, args) -> {
            Node condition = Args.required(args, 0, "first");
            Node whenTrue = Args.required(args, 1, "second");
            Node whenFalse = Args.arg(args, 2);
            if (isTrue(ctx.evaluate(condition))) {
                return ctx.evaluate(whenTrue);
            }
            return whenFalse != null ? ctx.evaluate(whenFalse) : new Anonymous("");
        });
        registry.addRaw("boolean", (ctx, args) ->
                Keyword.of(isTrue(ctx.evaluate(Args.required(args, 0, "first")))));
        registry.addRaw("isdefined", (ctx, args) -> {
            Node variable = Args.required(args, 0, "first");
            try {
                ctx.evaluate(variable);
                return Keyword.TRUE;
            } catch (LessException e) {
                LOG.log(Level.FINEST, "isdefined: " + e.getRawMessage());
                return Keyword.FALSE;
            }
        });
        // 只在 mixin 守卫中有值，其余位置按原样输出
        registry.addBuiltin("default", (ctx, args) -> ctx.defaultValue());
    }

    private static boolean isTrue(Node value) {
        return value instanceof Keyword && "true".equals(((Keyword) value).getValue());
    }
}
