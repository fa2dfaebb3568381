package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.List;

/**
 * @media 块
 */
public final class Media extends NestedAtRule {

    public Media(Node features, List<Node> rules, int index, FileInfo fileInfo) {
        super(features, rules, index, fileInfo);
    }

    @Override
    public String getKeyword() {
        return "@media";
    }

    @Override
    public NestedAtRule create(Node newFeatures, List<Node> newRules) {
        Media media = new Media(newFeatures, newRules, getIndex(), getFileInfo());
        media.copyVisibilityInfo(visibilityInfo());
        return media;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitMedia(this, context);
    }
}
