package com.lessj.compiler.ast;

/**
 * 节点可见性快照（阻塞计数 + 显式可见标记）
 */
public final class VisibilityInfo {
    private final int visibilityBlocks;
    private final Boolean nodeVisible;

    public VisibilityInfo(int visibilityBlocks, Boolean nodeVisible) {
        this.visibilityBlocks = visibilityBlocks;
        this.nodeVisible = nodeVisible;
    }

    public int getVisibilityBlocks() {
        return visibilityBlocks;
    }

    /** 可能为 null，表示尚未被可见性遍历标记 */
    public Boolean getNodeVisible() {
        return nodeVisible;
    }
}
