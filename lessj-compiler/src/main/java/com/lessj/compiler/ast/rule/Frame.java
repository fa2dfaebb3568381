package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.selector.Selector;

import java.util.List;
import java.util.function.Predicate;

/**
 * 作用域帧：提供变量、属性与 mixin 查找
 */
public interface Frame {

    /**
     * 查找本帧直接声明的变量（同名取最后一个）
     *
     * @return 变量声明，不存在则返回 null
     */
    Declaration variable(String name);

    /**
     * 查找本帧中名为 name 的全部普通声明（不含前缀 $）
     *
     * @return 声明列表，不存在则返回空列表
     */
    List<Declaration> property(String name);

    /**
     * 查找匹配选择器的 mixin 候选（可沿命名空间路径深入）
     *
     * @param self   需要排除的规则块（调用方自身）
     * @param filter 命名空间守卫过滤器，可为 null
     */
    List<MixinCandidate> find(Selector selector, RuleBlock self, Predicate<RuleBlock> filter);
}
