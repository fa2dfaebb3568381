package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.rule.FrameChain;
import com.lessj.compiler.ast.rule.Ruleset;

/**
 * 分离规则集 { ... }，求值时捕获定义处的作用域帧
 */
public final class DetachedRuleset extends Node {
    private final Ruleset ruleset;
    private final FrameChain frames;

    public DetachedRuleset(Ruleset ruleset) {
        this(ruleset, null);
    }

    public DetachedRuleset(Ruleset ruleset, FrameChain frames) {
        super(ruleset.getIndex(), ruleset.getFileInfo());
        this.ruleset = ruleset;
        this.frames = frames;
    }

    public Ruleset getRuleset() {
        return ruleset;
    }

    /** 捕获的帧链；未求值时为 null */
    public FrameChain getFrames() {
        return frames;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitDetachedRuleset(this, context);
    }
}
