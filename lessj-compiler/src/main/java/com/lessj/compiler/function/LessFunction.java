package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;

import java.util.List;

/**
 * 样式函数
 *
 * <p>参数已经求值（除非注册为原始参数函数），注释已过滤，单元素表达式已展开。</p>
 */
@FunctionalInterface
public interface LessFunction {

    /**
     * @param context 调用上下文
     * @param args    实参
     * @return 结果节点；返回 null 表示不处理，调用按原样输出
     */
    Node call(FunctionContext context, List<Node> args);
}
