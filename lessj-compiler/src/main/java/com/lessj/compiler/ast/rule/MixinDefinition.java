package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 参数化 mixin 定义 .name(params) when (guard) { rules }
 *
 * <p>frames 为求值定义时捕获的闭包帧链；未求值的定义为 null。</p>
 */
public final class MixinDefinition extends RuleBlock {
    private final String name;
    private final List<MixinParameter> params;
    private final Node condition;
    private final boolean variadic;
    private final FrameChain frames;
    private final int arity;
    private final int required;
    private final Set<String> optionalParameters;

    public MixinDefinition(String name, List<MixinParameter> params, List<Node> rules, Node condition,
                           boolean variadic, FrameChain frames, int index, FileInfo fileInfo) {
        super(selectorFor(name, index, fileInfo), rules, index, fileInfo);
        this.name = name == null ? "anonymous mixin" : name;
        this.params = params == null
                ? Collections.<MixinParameter>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(params));
        this.condition = condition;
        this.variadic = variadic;
        this.frames = frames;
        this.arity = this.params.size();
        int req = 0;
        Set<String> optional = new LinkedHashSet<>();
        for (MixinParameter p : this.params) {
            if (p.getName() == null || p.getValue() == null) {
                req++;
            } else {
                optional.add(p.getName());
            }
        }
        this.required = req;
        this.optionalParameters = Collections.unmodifiableSet(optional);
    }

    private static List<Selector> selectorFor(String name, int index, FileInfo fileInfo) {
        List<Element> elements = new ArrayList<>();
        elements.add(new Element(Combinator.NONE, name == null ? "" : name, index, fileInfo));
        List<Selector> selectors = new ArrayList<>();
        selectors.add(new Selector(elements));
        return selectors;
    }

    public String getName() {
        return name;
    }

    public List<MixinParameter> getParams() {
        return params;
    }

    public Node getCondition() {
        return condition;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public FrameChain getFrames() {
        return frames;
    }

    public int getArity() {
        return arity;
    }

    /** 必须提供的参数个数（无默认值的命名参数 + 模式参数） */
    public int getRequired() {
        return required;
    }

    public Set<String> getOptionalParameters() {
        return optionalParameters;
    }

    /** 以捕获的帧链派生已求值的定义 */
    public MixinDefinition withFrames(FrameChain capturedFrames) {
        MixinDefinition copy = new MixinDefinition(name, params, rules, condition, variadic, capturedFrames,
                getIndex(), getFileInfo());
        copy.copyVisibilityInfo(visibilityInfo());
        return copy;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitMixinDefinition(this, context);
    }
}
