package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

/**
 * 注释；// 行注释永不输出，压缩模式下只保留 /*! 开头的块注释
 */
public final class Comment extends Node {
    private final String value;
    private final boolean lineComment;

    public Comment(String value, boolean lineComment, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.value = value;
        this.lineComment = lineComment;
    }

    public String getValue() {
        return value;
    }

    public boolean isLineComment() {
        return lineComment;
    }

    public boolean isSilent(boolean compress) {
        boolean isCompressed = compress && value.length() > 2 && value.charAt(2) != '!';
        return lineComment || isCompressed;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitComment(this, context);
    }
}
