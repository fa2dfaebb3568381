package com.lessj.compiler;

import java.util.Locale;

/**
 * url() 重写模式
 */
public enum RewriteUrls {
    /** 不按导入文件所在目录重写 */
    OFF("off"),
    /** 只重写以 . 开头的相对路径 */
    LOCAL("local"),
    /** 重写所有相对路径 */
    ALL("all");

    private final String optionName;

    RewriteUrls(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    public static RewriteUrls fromString(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (RewriteUrls mode : values()) {
            if (mode.optionName.equals(v)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown rewrite-urls mode: " + value);
    }
}
