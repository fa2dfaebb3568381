package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.Node;

/**
 * mixin 实参：位置参数、命名参数（{@code @a: 1}）或展开参数（{@code @list...}）
 */
public final class MixinArgument {
    private final String name;
    private final Node value;
    private final boolean expand;

    public MixinArgument(String name, Node value, boolean expand) {
        this.name = name;
        this.value = value;
        this.expand = expand;
    }

    public String getName() {
        return name;
    }

    public Node getValue() {
        return value;
    }

    public boolean isExpand() {
        return expand;
    }

    public MixinArgument withValue(Node newValue) {
        return new MixinArgument(name, newValue, expand);
    }
}
