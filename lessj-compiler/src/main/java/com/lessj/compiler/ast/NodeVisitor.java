package com.lessj.compiler.ast;

import com.lessj.compiler.ast.rule.*;
import com.lessj.compiler.ast.selector.*;
import com.lessj.compiler.ast.value.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点一个方法，新增节点类型时所有遍历都必须处理它。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface NodeVisitor<R, C> {

    // ============ 值 ============

    R visitAnonymous(Anonymous node, C context);

    R visitKeyword(Keyword node, C context);

    R visitDimension(Dimension node, C context);

    R visitColor(Color node, C context);

    R visitQuoted(Quoted node, C context);

    R visitUrl(Url node, C context);

    R visitVariable(Variable node, C context);

    R visitProperty(Property node, C context);

    R visitOperation(Operation node, C context);

    R visitCall(Call node, C context);

    R visitExpression(Expression node, C context);

    R visitValue(Value node, C context);

    R visitParen(Paren node, C context);

    R visitNegative(Negative node, C context);

    R visitCondition(Condition node, C context);

    R visitAssignment(Assignment node, C context);

    R visitUnicodeDescriptor(UnicodeDescriptor node, C context);

    R visitNamespaceValue(NamespaceValue node, C context);

    R visitDetachedRuleset(DetachedRuleset node, C context);

    // ============ 选择器 ============

    R visitSelector(Selector node, C context);

    R visitElement(Element node, C context);

    R visitCombinator(Combinator node, C context);

    R visitAttribute(Attribute node, C context);

    // ============ 规则 ============

    R visitRuleset(Ruleset node, C context);

    R visitDeclaration(Declaration node, C context);

    R visitAtRule(AtRule node, C context);

    R visitMedia(Media node, C context);

    R visitContainer(Container node, C context);

    R visitImport(Import node, C context);

    R visitExtend(Extend node, C context);

    R visitComment(Comment node, C context);

    R visitMixinDefinition(MixinDefinition node, C context);

    R visitMixinCall(MixinCall node, C context);

    R visitVariableCall(VariableCall node, C context);
}
