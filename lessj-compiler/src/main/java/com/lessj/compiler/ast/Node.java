package com.lessj.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>每个节点记录源码偏移、所属文件以及可见性状态。可见性由两部分组成：
 * 引用导入施加的阻塞计数（visibilityBlocks）与显式可见标记（nodeVisible）。
 * 阻塞计数为 0 或被显式标记为可见时，节点才会输出。</p>
 */
public abstract class Node {
    private final int index;
    private final FileInfo fileInfo;
    private int visibilityBlocks;
    private Boolean nodeVisible;

    protected Node(int index, FileInfo fileInfo) {
        this.index = index;
        this.fileInfo = fileInfo;
    }

    public int getIndex() {
        return index;
    }

    public FileInfo getFileInfo() {
        return fileInfo;
    }

    public abstract <R, C> R accept(NodeVisitor<R, C> visitor, C context);

    /**
     * 规则集类节点（Ruleset、Media 等）在输出时不参与"最后一条规则省略分号"的判断
     */
    public boolean isRulesetLike() {
        return false;
    }

    // ============ 可见性 ============

    public boolean blocksVisibility() {
        return visibilityBlocks != 0;
    }

    public void addVisibilityBlock() {
        visibilityBlocks++;
    }

    public void removeVisibilityBlock() {
        if (visibilityBlocks > 0) {
            visibilityBlocks--;
        }
    }

    /** 显式标记为可见，即使节点处于引用导入中 */
    public void ensureVisibility() {
        nodeVisible = Boolean.TRUE;
    }

    public void ensureInvisibility() {
        nodeVisible = Boolean.FALSE;
    }

    public boolean isVisible() {
        return Boolean.TRUE.equals(nodeVisible);
    }

    public VisibilityInfo visibilityInfo() {
        return new VisibilityInfo(visibilityBlocks, nodeVisible);
    }

    public void copyVisibilityInfo(VisibilityInfo info) {
        if (info == null) {
            return;
        }
        this.visibilityBlocks = info.getVisibilityBlocks();
        this.nodeVisible = info.getNodeVisible();
    }

    /** 复制可见性信息并返回自身，便于在构造后链式调用 */
    @SuppressWarnings("unchecked")
    public <T extends Node> T withVisibility(VisibilityInfo info) {
        copyVisibilityInfo(info);
        return (T) this;
    }
}
