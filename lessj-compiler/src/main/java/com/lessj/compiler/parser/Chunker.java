package com.lessj.compiler.parser;

import java.util.Arrays;

/**
 * 预扫描器：一次性检查括号、引号与注释是否配对，并记录每个字符串字面量的结束位置
 *
 * <p>解析器回溯时可以直接跳过已知的字符串，不必重新扫描引号内容。
 * 圆括号内的 "//" 与 "/*" 不视为注释（如 url(http://...)）。</p>
 */
final class Chunker {
    private final String input;
    private final String filename;
    private final int[] stringEnd;

    private Chunker(String input, String filename) {
        this.input = input;
        this.filename = filename;
        this.stringEnd = new int[input.length()];
        Arrays.fill(stringEnd, -1);
    }

    /**
     * 扫描输入
     *
     * @return 字符串结束位置表：stringEnd[i] 为从 i 开始的字符串字面量末尾引号之后的位置，否则为 -1
     * @throws ParseException 括号、引号或注释不配对
     */
    static int[] scan(String input, String filename) {
        Chunker chunker = new Chunker(input, filename);
        chunker.run();
        return chunker.stringEnd;
    }

    private void run() {
        int len = input.length();
        int level = 0;
        int parenLevel = 0;
        int lastOpening = -1;
        int lastOpeningParen = -1;
        int lastMultiComment = -1;
        int lastMultiCommentEndBrace = -1;

        for (int i = 0; i < len; i++) {
            char c = input.charAt(i);
            switch (c) {
                case '(':
                    parenLevel++;
                    lastOpeningParen = i;
                    break;
                case ')':
                    if (--parenLevel < 0) {
                        throw fail("missing opening `(`", i);
                    }
                    break;
                case '{':
                    level++;
                    lastOpening = i;
                    break;
                case '}':
                    if (--level < 0) {
                        throw fail("missing opening `{`", i);
                    }
                    break;
                case '\\':
                    if (i < len - 1) {
                        i++;
                        break;
                    }
                    throw fail("unescaped `\\`", i);
                case '"':
                case '\'':
                case '`': {
                    int start = i;
                    boolean matched = false;
                    for (i = i + 1; i < len; i++) {
                        char c2 = input.charAt(i);
                        if (c2 == c) {
                            matched = true;
                            break;
                        }
                        if (c2 == '\\') {
                            if (i == len - 1) {
                                throw fail("unescaped `\\`", i);
                            }
                            i++;
                        }
                    }
                    if (!matched) {
                        throw fail("unmatched `" + c + "`", start);
                    }
                    stringEnd[start] = i + 1;
                    break;
                }
                case '/': {
                    if (parenLevel > 0 || i == len - 1) {
                        break;
                    }
                    char c2 = input.charAt(i + 1);
                    if (c2 == '/') {
                        while (i < len && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
                            i++;
                        }
                    } else if (c2 == '*') {
                        int start = i;
                        lastMultiComment = i;
                        boolean closed = false;
                        for (i = i + 2; i < len - 1; i++) {
                            char c3 = input.charAt(i);
                            if (c3 == '}') {
                                lastMultiCommentEndBrace = i;
                            }
                            if (c3 == '*' && input.charAt(i + 1) == '/') {
                                closed = true;
                                break;
                            }
                        }
                        if (!closed) {
                            throw fail("missing closing `*/`", start);
                        }
                        i++;
                    }
                    break;
                }
                case '*':
                    if (i < len - 1 && input.charAt(i + 1) == '/' && parenLevel == 0) {
                        throw fail("unmatched `/*`", i);
                    }
                    break;
                default:
                    break;
            }
        }

        if (level != 0) {
            if (lastMultiComment > lastOpening && lastMultiCommentEndBrace > lastMultiComment) {
                throw fail("missing closing `}` or `*/`", lastOpening);
            }
            throw fail("missing closing `}`", lastOpening);
        }
        if (parenLevel != 0) {
            throw fail("missing closing `)`", lastOpeningParen);
        }
    }

    private ParseException fail(String message, int index) {
        return new ParseException(message, filename, index);
    }
}
