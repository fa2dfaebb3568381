package com.lessj.compiler.ast.rule;

/**
 * @import 选项：(less)、(css)、(inline)、(reference)、(once)、(multiple)、(optional)
 */
public final class ImportOptions {
    public static final ImportOptions DEFAULT = new ImportOptions(null, false, false, false, false);

    private final Boolean less;
    private final boolean inline;
    private final boolean reference;
    private final boolean multiple;
    private final boolean optional;

    public ImportOptions(Boolean less, boolean inline, boolean reference, boolean multiple, boolean optional) {
        this.less = less;
        this.inline = inline;
        this.reference = reference;
        this.multiple = multiple;
        this.optional = optional;
    }

    /** 显式指定 (less) 为 TRUE、(css) 为 FALSE，未指定为 null */
    public Boolean getLess() {
        return less;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isMultiple() {
        return multiple;
    }

    public boolean isOptional() {
        return optional;
    }
}
