package com.lessj.compiler.output;

/**
 * 一条源码映射：输出位置对应的源文件位置（行列均从 0 开始，与 source map v3 一致）
 */
public final class SourceMapping {
    private final int generatedLine;
    private final int generatedColumn;
    private final String source;
    private final int originalLine;
    private final int originalColumn;

    public SourceMapping(int generatedLine, int generatedColumn, String source, int originalLine, int originalColumn) {
        this.generatedLine = generatedLine;
        this.generatedColumn = generatedColumn;
        this.source = source;
        this.originalLine = originalLine;
        this.originalColumn = originalColumn;
    }

    public int getGeneratedLine() {
        return generatedLine;
    }

    public int getGeneratedColumn() {
        return generatedColumn;
    }

    public String getSource() {
        return source;
    }

    public int getOriginalLine() {
        return originalLine;
    }

    public int getOriginalColumn() {
        return originalColumn;
    }

    @Override
    public String toString() {
        return generatedLine + ":" + generatedColumn + " -> " + source + ":" + originalLine + ":" + originalColumn;
    }
}
