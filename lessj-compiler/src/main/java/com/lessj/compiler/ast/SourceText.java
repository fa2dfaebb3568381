package com.lessj.compiler.ast;

import java.util.Arrays;

/**
 * 源文本及其行首偏移表，用于把字符偏移换算成行列
 */
public final class SourceText {
    private final String filename;
    private final String text;
    private final int[] lineStarts;

    public SourceText(String filename, String text) {
        this.filename = filename;
        this.text = text;
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        this.lineStarts = starts;
    }

    public String getFilename() {
        return filename;
    }

    public String getText() {
        return text;
    }

    public SourceLocation locate(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        int lineIndex = idx >= 0 ? idx : -idx - 2;
        return new SourceLocation(filename, lineIndex + 1, clamped - lineStarts[lineIndex] + 1, clamped);
    }

    /** 第 line 行（从 1 开始）的文本，不含换行符 */
    public String line(int line) {
        if (line < 1 || line > lineStarts.length) {
            return "";
        }
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        String s = text.substring(start, Math.max(start, end));
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }
}
