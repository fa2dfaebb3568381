package com.lessj.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 可回溯的输入游标
 *
 * <p>save / restore / forget 构成事务：尝试一种产生式失败后恢复到保存点。
 * 每次成功匹配后自动跳过空白，并把跳过的注释收集到 commentStore。
 * restore 时记录最远到达位置，供最终的 "Unrecognised input" 错误定位。</p>
 */
final class ParserInput {

    /** 被跳过的注释 */
    static final class CommentToken {
        final int index;
        final String text;
        final boolean lineComment;

        CommentToken(int index, String text, boolean lineComment) {
            this.index = index;
            this.text = text;
            this.lineComment = lineComment;
        }
    }

    private final String input;
    private final int[] stringEnd;
    int i;
    private int[] saveStack = new int[32];
    private int saveDepth;
    private int furthest;
    private String furthestPossibleErrorMessage;
    boolean autoCommentAbsorb = true;
    final List<CommentToken> commentStore = new ArrayList<>();

    ParserInput(String input, int[] stringEnd) {
        this.input = input;
        this.stringEnd = stringEnd;
        this.i = 0;
        skipWhitespace(0);
    }

    String getInput() {
        return input;
    }

    // ============ 事务 ============

    void save() {
        if (saveDepth * 2 + 2 > saveStack.length) {
            int[] grown = new int[saveStack.length * 2];
            System.arraycopy(saveStack, 0, grown, 0, saveStack.length);
            saveStack = grown;
        }
        saveStack[saveDepth * 2] = i;
        saveStack[saveDepth * 2 + 1] = commentStore.size();
        saveDepth++;
    }

    void restore() {
        restore(null);
    }

    void restore(String possibleErrorMessage) {
        if (i > furthest || (i == furthest && possibleErrorMessage != null && furthestPossibleErrorMessage == null)) {
            furthest = i;
            furthestPossibleErrorMessage = possibleErrorMessage;
        }
        saveDepth--;
        i = saveStack[saveDepth * 2];
        int comments = saveStack[saveDepth * 2 + 1];
        while (commentStore.size() > comments) {
            commentStore.remove(commentStore.size() - 1);
        }
    }

    void forget() {
        saveDepth--;
    }

    // ============ 查看 ============

    boolean finished() {
        return i >= input.length();
    }

    char currentChar() {
        return i < input.length() ? input.charAt(i) : '\0';
    }

    char prevChar() {
        return i > 0 && i <= input.length() ? input.charAt(i - 1) : '\0';
    }

    char charAt(int pos) {
        return pos >= 0 && pos < input.length() ? input.charAt(pos) : '\0';
    }

    boolean isWhitespace(int offset) {
        char c = charAt(i + offset);
        return c == ' ' || c == '\r' || c == '\t' || c == '\n';
    }

    boolean peek(String tok) {
        return input.startsWith(tok, i);
    }

    boolean peek(Pattern pattern) {
        Matcher m = pattern.matcher(input);
        m.region(i, input.length());
        m.useTransparentBounds(true);
        return m.lookingAt();
    }

    boolean peekChar(char c) {
        return currentChar() == c;
    }

    /** 当前字符不可能开始一个数值 */
    boolean peekNotNumeric() {
        char c = currentChar();
        return c > '9' || c < '+' || c == '/' || c == ',';
    }

    // ============ 匹配（成功后跳过空白） ============

    String re(Pattern pattern) {
        String[] groups = reGroups(pattern);
        return groups == null ? null : groups[0];
    }

    /**
     * 正则匹配，返回全部分组（下标 0 为整体），未匹配返回 null
     */
    String[] reGroups(Pattern pattern) {
        Matcher m = pattern.matcher(input);
        m.region(i, input.length());
        m.useTransparentBounds(true);
        if (!m.lookingAt()) {
            return null;
        }
        String[] groups = new String[m.groupCount() + 1];
        for (int g = 0; g <= m.groupCount(); g++) {
            groups[g] = m.group(g);
        }
        skipWhitespace(m.end() - i);
        return groups;
    }

    String ch(char c) {
        if (currentChar() != c || finished()) {
            return null;
        }
        skipWhitespace(1);
        return String.valueOf(c);
    }

    String str(String tok) {
        if (!input.startsWith(tok, i)) {
            return null;
        }
        skipWhitespace(tok.length());
        return tok;
    }

    /**
     * 匹配当前位置的字符串字面量（含引号），成功后跳过空白
     */
    String quoted() {
        String str = quotedAt(i);
        if (str != null) {
            skipWhitespace(str.length());
        }
        return str;
    }

    /**
     * 读取 pos 处的字符串字面量（含引号），不移动游标
     */
    String quotedAt(int pos) {
        char startChar = charAt(pos);
        if (startChar != '\'' && startChar != '"') {
            return null;
        }
        if (pos < stringEnd.length && stringEnd[pos] > pos) {
            return input.substring(pos, stringEnd[pos]);
        }
        for (int k = pos + 1; k < input.length(); k++) {
            char next = input.charAt(k);
            if (next == '\\') {
                k++;
            } else if (next == startChar) {
                return input.substring(pos, k + 1);
            }
        }
        return null;
    }

    /**
     * 读取到顶层的某个终止字符为止的原始文本（跳过成对括号、字符串与块注释）
     *
     * @return 原始文本（可能为空串），括号不配对时返回 null 且不移动游标
     */
    String parseUntil(String stopChars) {
        int start = i;
        int k = i;
        List<Character> blockStack = new ArrayList<>();
        boolean inComment = false;
        int length = input.length();
        while (k < length) {
            char c = input.charAt(k);
            if (inComment) {
                if (c == '*' && charAt(k + 1) == '/') {
                    k++;
                    inComment = false;
                }
                k++;
                continue;
            }
            if (blockStack.isEmpty() && stopChars.indexOf(c) >= 0) {
                String raw = input.substring(start, k);
                skipWhitespace(k - start);
                return raw;
            }
            switch (c) {
                case '\\':
                    k++;
                    break;
                case '/':
                    if (charAt(k + 1) == '*') {
                        k++;
                        inComment = true;
                    }
                    break;
                case '\'':
                case '"': {
                    String q = quotedAt(k);
                    if (q == null) {
                        return null;
                    }
                    k += q.length() - 1;
                    break;
                }
                case '{':
                    blockStack.add('}');
                    break;
                case '(':
                    blockStack.add(')');
                    break;
                case '[':
                    blockStack.add(']');
                    break;
                case '}':
                case ')':
                case ']':
                    if (blockStack.isEmpty() || blockStack.remove(blockStack.size() - 1) != c) {
                        return null;
                    }
                    break;
                default:
                    break;
            }
            k++;
        }
        return null;
    }

    // ============ 空白与注释 ============

    private void skipWhitespace(int length) {
        i += length;
        int end = input.length();
        while (i < end) {
            char c = input.charAt(i);
            if (autoCommentAbsorb && c == '/') {
                char next = charAt(i + 1);
                if (next == '/') {
                    int newline = input.indexOf('\n', i + 2);
                    if (newline < 0) {
                        newline = end;
                    }
                    commentStore.add(new CommentToken(i, input.substring(i, newline), true));
                    i = newline;
                    continue;
                } else if (next == '*') {
                    int close = input.indexOf("*/", i + 2);
                    if (close >= 0) {
                        commentStore.add(new CommentToken(i, input.substring(i, close + 2), false));
                        i = close + 2;
                        continue;
                    }
                }
                break;
            }
            if (c != ' ' && c != '\n' && c != '\t' && c != '\r') {
                break;
            }
            i++;
        }
    }

    /** 手动跳过空白与注释（用于关闭注释吸收后恢复） */
    void skipSpace() {
        skipWhitespace(0);
    }

    // ============ 结束检查 ============

    /** 输入是否完全消费；未消费时把游标移到最远失败位置 */
    boolean end() {
        boolean isFinished = finished();
        if (i < furthest) {
            i = furthest;
        } else {
            furthestPossibleErrorMessage = null;
        }
        return isFinished;
    }

    String getFurthestPossibleErrorMessage() {
        return furthestPossibleErrorMessage;
    }
}
