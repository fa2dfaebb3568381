package com.lessj.compiler;

/**
 * 编译错误类别
 */
public enum ErrorKind {
    PARSE("Parse"),
    NAME("Name"),
    ARGUMENT("Argument"),
    RUNTIME("Runtime"),
    OPERATION("Operation"),
    SYNTAX("Syntax"),
    IMPORT("File"),
    PLUGIN("Plugin");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
