package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.regex.Pattern;

/**
 * 字符串字面量；escaped 表示 ~"..." 形式，输出时不带引号
 */
public final class Quoted extends Node {
    /** 字符串内插值：@{name} */
    public static final Pattern VARIABLE_INTERPOLATION = Pattern.compile("@\\{([\\w-]+)\\}");
    /** 字符串内属性插值：${name} */
    public static final Pattern PROPERTY_INTERPOLATION = Pattern.compile("\\$\\{([\\w-]+)\\}");

    private final String quote;
    private final String value;
    private final boolean escaped;

    public Quoted(String quote, String value, boolean escaped) {
        this(quote, value, escaped, 0, null);
    }

    public Quoted(String quote, String value, boolean escaped, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.quote = quote == null ? "" : quote;
        this.value = value == null ? "" : value;
        this.escaped = escaped;
    }

    /** 引号字符（' 或 "），无引号时为空串 */
    public String getQuote() {
        return quote;
    }

    public String getValue() {
        return value;
    }

    public boolean isEscaped() {
        return escaped;
    }

    public boolean containsInterpolation() {
        return VARIABLE_INTERPOLATION.matcher(value).find() || PROPERTY_INTERPOLATION.matcher(value).find();
    }

    public Quoted withValue(String newValue) {
        return new Quoted(quote, newValue, escaped, getIndex(), getFileInfo());
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitQuoted(this, context);
    }

    @Override
    public String toString() {
        return escaped ? value : quote + value + quote;
    }
}
