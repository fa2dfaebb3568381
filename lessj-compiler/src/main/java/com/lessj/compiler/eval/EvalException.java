package com.lessj.compiler.eval;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.Node;

/**
 * 求值异常：未定义的变量或 mixin、参数不匹配、单位不兼容等
 *
 * <p>在不知道位置的地方（如数值运算内部）抛出时 index 为 -1，
 * 由外层的声明或调用节点通过 {@link #locatedAt(Node)} 补上位置。</p>
 */
public class EvalException extends LessException {

    public EvalException(ErrorKind kind, String message) {
        super(kind, message, null, -1);
    }

    public EvalException(ErrorKind kind, String message, Node node) {
        super(kind, message, filenameOf(node), node == null ? -1 : node.getIndex());
    }

    public EvalException(ErrorKind kind, String message, String filename, int index, Throwable cause) {
        super(kind, message, filename, index, cause);
    }

    public boolean isLocated() {
        return getIndex() >= 0;
    }

    /**
     * 尚无位置时以 node 的位置派生新异常，已有位置时返回自身
     */
    public EvalException locatedAt(Node node) {
        if (isLocated() || node == null) {
            return this;
        }
        return new EvalException(getKind(), getRawMessage(), filenameOf(node), node.getIndex(), getCause());
    }

    static String filenameOf(Node node) {
        if (node == null || node.getFileInfo() == null) {
            return null;
        }
        return node.getFileInfo().getFilename();
    }
}
