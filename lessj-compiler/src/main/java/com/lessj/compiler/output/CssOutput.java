package com.lessj.compiler.output;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.SourceLocation;
import com.lessj.compiler.ast.SourceText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * CSS 输出缓冲
 *
 * <p>给定源文本查找函数时，每段带源位置的输出都记录一条 {@link SourceMapping}。</p>
 */
public final class CssOutput {
    private final StringBuilder buffer = new StringBuilder();
    private final Function<String, SourceText> sources;
    private final List<SourceMapping> mappings = new ArrayList<>();
    private int line;
    private int column;

    /** 不记录源码映射 */
    public CssOutput() {
        this(null);
    }

    /**
     * @param sources 文件名到源文本；为 null 时不记录映射
     */
    public CssOutput(Function<String, SourceText> sources) {
        this.sources = sources;
    }

    public void add(String chunk) {
        add(chunk, null, 0, false);
    }

    public void add(String chunk, FileInfo fileInfo, int index) {
        add(chunk, fileInfo, index, false);
    }

    /**
     * @param mapLines 逐行映射（inline 导入的原文）
     */
    public void add(String chunk, FileInfo fileInfo, int index, boolean mapLines) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        if (sources != null && fileInfo != null) {
            record(chunk, fileInfo, index, mapLines);
        }
        buffer.append(chunk);
        int lastBreak = chunk.lastIndexOf('\n');
        if (lastBreak < 0) {
            column += chunk.length();
        } else {
            for (int i = 0; i <= lastBreak; i++) {
                if (chunk.charAt(i) == '\n') {
                    line++;
                }
            }
            column = chunk.length() - lastBreak - 1;
        }
    }

    private void record(String chunk, FileInfo fileInfo, int index, boolean mapLines) {
        SourceText source = sources.apply(fileInfo.getFilename());
        if (source == null) {
            return;
        }
        SourceLocation loc = source.locate(index);
        int originalLine = loc.getLine() - 1;
        int originalColumn = loc.getColumn() - 1;
        mappings.add(new SourceMapping(line, column, fileInfo.getFilename(), originalLine, originalColumn));
        if (mapLines) {
            int lines = 0;
            for (int i = 0; i < chunk.length(); i++) {
                if (chunk.charAt(i) == '\n' && i + 1 < chunk.length()) {
                    lines++;
                    mappings.add(new SourceMapping(line + lines, 0, fileInfo.getFilename(), originalLine + lines, 0));
                }
            }
        }
    }

    public boolean isEmpty() {
        return buffer.length() == 0;
    }

    public List<SourceMapping> getMappings() {
        return Collections.unmodifiableList(mappings);
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
