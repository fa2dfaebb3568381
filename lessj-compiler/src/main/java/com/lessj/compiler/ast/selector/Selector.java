package com.lessj.compiler.ast.selector;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.rule.Extend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 选择器：元素序列，可附带 :extend 列表与 CSS 守卫
 */
public final class Selector extends Node {
    private static final Pattern MIXIN_ELEMENT = Pattern.compile("[,&#*.\\w-]([\\w-]|(\\\\.))*");

    private final List<Element> elements;
    private final List<Extend> extendList;
    private final Node condition;
    private final boolean evaldCondition;
    private final boolean mediaEmpty;
    private List<String> mixinElements;

    public Selector(List<Element> elements) {
        this(elements, null, null, 0, null);
    }

    public Selector(List<Element> elements, List<Extend> extendList, Node condition, int index, FileInfo fileInfo) {
        this(elements, extendList, condition, condition == null, false, index, fileInfo);
    }

    private Selector(List<Element> elements, List<Extend> extendList, Node condition,
                     boolean evaldCondition, boolean mediaEmpty, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.extendList = extendList == null
                ? Collections.<Extend>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(extendList));
        this.condition = condition;
        this.evaldCondition = evaldCondition;
        this.mediaEmpty = mediaEmpty;
    }

    /**
     * 媒体查询冒泡时使用的空选择器 "&amp;"
     */
    public static List<Selector> createEmptySelectors(int index, FileInfo fileInfo) {
        Element el = new Element(Combinator.NONE, "&", index, fileInfo);
        Selector sel = new Selector(Collections.singletonList(el), null, null, true, true, index, fileInfo);
        List<Selector> list = new ArrayList<>();
        list.add(sel);
        return list;
    }

    public List<Element> getElements() {
        return elements;
    }

    public List<Extend> getExtendList() {
        return extendList;
    }

    public Node getCondition() {
        return condition;
    }

    /** 守卫求值结果；无守卫时为 true */
    public boolean isOutput() {
        return evaldCondition;
    }

    public boolean isMediaEmpty() {
        return mediaEmpty;
    }

    /**
     * 派生新选择器，保留可见性与 mediaEmpty
     */
    public Selector createDerived(List<Element> newElements, List<Extend> newExtendList, Boolean newEvaldCondition) {
        Selector derived = new Selector(newElements,
                newExtendList != null ? newExtendList : extendList,
                null,
                newEvaldCondition != null ? newEvaldCondition : evaldCondition,
                mediaEmpty, getIndex(), getFileInfo());
        derived.copyVisibilityInfo(visibilityInfo());
        return derived;
    }

    public Selector createDerived(List<Element> newElements) {
        return createDerived(newElements, null, null);
    }

    public boolean isJustParentSelector() {
        return !mediaEmpty
                && elements.size() == 1
                && elements.get(0).isParentReference()
                && elements.get(0).getCombinator().isEmptyOrWhitespace();
    }

    /**
     * 作为 mixin 候选时的名称片段，如 ".a .b" -> [".a", ".b"]
     */
    public List<String> mixinElements() {
        if (mixinElements != null) {
            return mixinElements;
        }
        StringBuilder sb = new StringBuilder();
        for (Element e : elements) {
            sb.append(e.getCombinator().getValue()).append(e.getValueText());
        }
        List<String> result = new ArrayList<>();
        Matcher m = MIXIN_ELEMENT.matcher(sb);
        while (m.find()) {
            result.add(m.group());
        }
        if (!result.isEmpty() && "&".equals(result.get(0))) {
            result.remove(0);
        }
        mixinElements = Collections.unmodifiableList(result);
        return mixinElements;
    }

    /**
     * 以本选择器（调用方）匹配候选选择器，返回匹配上的元素数，不匹配返回 0
     */
    public int match(Selector other) {
        List<String> otherElements = other.mixinElements();
        int olen = otherElements.size();
        if (olen == 0 || elements.size() < olen) {
            return 0;
        }
        for (int i = 0; i < olen; i++) {
            if (!otherElements.get(i).equals(elements.get(i).getValueText())) {
                return 0;
            }
        }
        return olen;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSelector(this, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Element e : elements) {
            sb.append(e);
        }
        return sb.toString().trim();
    }
}
