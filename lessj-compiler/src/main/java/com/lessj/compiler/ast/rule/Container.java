package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.List;

/**
 * @container 块，冒泡规则与 @media 相同
 */
public final class Container extends NestedAtRule {

    public Container(Node features, List<Node> rules, int index, FileInfo fileInfo) {
        super(features, rules, index, fileInfo);
    }

    @Override
    public String getKeyword() {
        return "@container";
    }

    @Override
    public NestedAtRule create(Node newFeatures, List<Node> newRules) {
        Container container = new Container(newFeatures, newRules, getIndex(), getFileInfo());
        container.copyVisibilityInfo(visibilityInfo());
        return container;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitContainer(this, context);
    }
}
