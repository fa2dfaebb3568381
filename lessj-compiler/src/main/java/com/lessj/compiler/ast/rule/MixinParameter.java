package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.Node;

/**
 * mixin 形参
 *
 * <p>三种形态：命名参数 {@code @a}（可带默认值 value）、字面量模式（name 为 null，
 * value 为要匹配的值）、可变参数 {@code ...} 或 {@code @rest...}。</p>
 */
public final class MixinParameter {
    private final String name;
    private final Node value;
    private final boolean variadic;

    public MixinParameter(String name, Node value, boolean variadic) {
        this.name = name;
        this.value = value;
        this.variadic = variadic;
    }

    public String getName() {
        return name;
    }

    public Node getValue() {
        return value;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /** 字面量模式参数：无名称、非可变 */
    public boolean isPattern() {
        return name == null && !variadic;
    }
}
