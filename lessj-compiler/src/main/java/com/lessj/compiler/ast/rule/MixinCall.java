package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.selector.Selector;

import java.util.Collections;
import java.util.List;

/**
 * mixin 调用：.m(args)、#ns > .m()、#ns.m() !important
 */
public final class MixinCall extends Node {
    private final Selector selector;
    private final List<MixinArgument> args;
    private final boolean important;

    public MixinCall(Selector selector, List<MixinArgument> args, boolean important, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.selector = selector;
        this.args = args == null
                ? Collections.<MixinArgument>emptyList()
                : Collections.unmodifiableList(args);
        this.important = important;
    }

    public Selector getSelector() {
        return selector;
    }

    public List<MixinArgument> getArgs() {
        return args;
    }

    public boolean isImportant() {
        return important;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitMixinCall(this, context);
    }
}
