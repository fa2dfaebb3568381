package com.lessj.compiler.eval;

import com.lessj.compiler.LessException;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Keyword;

/**
 * default() 守卫函数的状态
 *
 * <p>mixin 匹配时先后以 false、true 两个取值计算守卫；求值选择器时置为错误状态，
 * 其余时候 default() 没有值，按原样输出。</p>
 */
public final class DefaultGuard {
    private Boolean value;
    private LessException error;

    /**
     * @return Keyword true/false，无值时返回 null
     */
    public Node eval() {
        if (error != null) {
            throw error;
        }
        if (value != null) {
            return Keyword.of(value);
        }
        return null;
    }

    void value(boolean v) {
        this.value = v;
    }

    void error(LessException e) {
        this.error = e;
    }

    void reset() {
        this.value = null;
        this.error = null;
    }
}
