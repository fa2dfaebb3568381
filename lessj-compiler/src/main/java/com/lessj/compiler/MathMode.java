package com.lessj.compiler;

import java.util.Locale;

/**
 * 数学运算模式
 */
public enum MathMode {
    /** 任何位置都执行运算 */
    ALWAYS("always"),
    /** 除法必须写在括号内或使用 ./，其余运算照常执行 */
    PARENS_DIVISION("parens-division"),
    /** 所有运算都必须写在括号内 */
    PARENS("parens");

    private final String optionName;

    MathMode(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    /**
     * 解析选项值，兼容旧的 strict 写法
     *
     * @throws IllegalArgumentException 未知的模式名
     */
    public static MathMode fromString(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "always":
            case "0":
                return ALWAYS;
            case "parens-division":
            case "1":
                return PARENS_DIVISION;
            case "parens":
            case "strict":
            case "2":
                return PARENS;
            default:
                throw new IllegalArgumentException("Unknown math mode: " + value);
        }
    }
}
