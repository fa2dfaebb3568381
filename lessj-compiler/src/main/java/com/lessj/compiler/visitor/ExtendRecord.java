package com.lessj.compiler.visitor;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.VisibilityInfo;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Combinator;
import com.lessj.compiler.ast.selector.Element;
import com.lessj.compiler.ast.selector.Selector;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次 extend 的处理记录：目标选择器、发起扩展的完整选择器与所属规则集
 *
 * <p>链式扩展产生的记录通过 parentIds 记住来源，用于识别循环引用。</p>
 */
final class ExtendRecord {
    final int id;
    final Selector selector;
    final boolean all;
    final int index;
    final FileInfo fileInfo;
    final VisibilityInfo visibility;
    final List<Integer> parentIds = new ArrayList<>();

    List<Selector> selfSelectors;
    Ruleset ruleset;
    boolean firstExtendOnThisSelectorPath;
    boolean hasFoundMatches;

    ExtendRecord(int id, Selector selector, boolean all, int index, FileInfo fileInfo, VisibilityInfo visibility) {
        this.id = id;
        this.selector = selector;
        this.all = all;
        this.index = index;
        this.fileInfo = fileInfo;
        this.visibility = visibility;
        parentIds.add(id);
    }

    boolean isVisible() {
        return Boolean.TRUE.equals(visibility.getNodeVisible());
    }

    /**
     * 由发起扩展的选择器路径拼出自身选择器；后续选择器的空组合符按后代处理
     */
    void findSelfSelectors(List<Selector> path) {
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < path.size(); i++) {
            List<Element> selectorElements = path.get(i).getElements();
            for (int j = 0; j < selectorElements.size(); j++) {
                Element el = selectorElements.get(j);
                if (i > 0 && j == 0 && "".equals(el.getCombinator().getValue())) {
                    el = el.withCombinator(Combinator.DESCENDANT);
                }
                elements.add(el);
            }
        }
        Selector self = new Selector(elements);
        self.copyVisibilityInfo(visibility);
        selfSelectors = new ArrayList<>();
        selfSelectors.add(self);
    }
}
