package com.lessj.compiler.visitor;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.AtRule;
import com.lessj.compiler.ast.rule.Extend;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;

import java.util.List;

/**
 * 把没有被可见性阻塞的节点显式标记为可见（或不可见）
 *
 * <p>遇到被阻塞的节点（reference 导入的结果）时不再深入，其子树保持未标记状态，
 * 之后只有被 extend 命中的部分会重新变为可见。</p>
 */
public final class SetTreeVisibilityVisitor {
    private final boolean visible;

    public SetTreeVisibilityVisitor(boolean visible) {
        this.visible = visible;
    }

    public void run(Node root) {
        visit(root);
    }

    private void visit(Node node) {
        if (node == null || node.blocksVisibility()) {
            return;
        }
        mark(node);
        if (node instanceof Ruleset) {
            Ruleset ruleset = (Ruleset) node;
            if (ruleset.getPaths() != null) {
                for (List<Selector> path : ruleset.getPaths()) {
                    for (Selector selector : path) {
                        visitSelector(selector);
                    }
                }
            } else if (ruleset.getSelectors() != null) {
                for (Selector selector : ruleset.getSelectors()) {
                    visitSelector(selector);
                }
            }
            visitAll(ruleset.getRules());
        } else if (node instanceof NestedAtRule) {
            visitAll(((NestedAtRule) node).getRules());
        } else if (node instanceof AtRule) {
            visitAll(((AtRule) node).getRules());
        }
    }

    private void visitSelector(Selector selector) {
        if (selector.blocksVisibility()) {
            return;
        }
        mark(selector);
        for (Extend extend : selector.getExtendList()) {
            if (!extend.blocksVisibility()) {
                mark(extend);
            }
        }
    }

    private void visitAll(List<Node> nodes) {
        if (nodes == null) {
            return;
        }
        for (Node n : nodes) {
            visit(n);
        }
    }

    private void mark(Node node) {
        if (visible) {
            node.ensureVisibility();
        } else {
            node.ensureInvisibility();
        }
    }
}
