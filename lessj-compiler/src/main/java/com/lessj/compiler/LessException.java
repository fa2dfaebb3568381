package com.lessj.compiler;

import com.lessj.compiler.ast.SourceLocation;
import com.lessj.compiler.ast.SourceText;

/**
 * 编译错误基类
 *
 * <p>携带错误类别、文件、字符偏移；行列与源码行在编译器拿到源文本后补全。
 * 任何一个错误都会终止整次编译。</p>
 */
public class LessException extends RuntimeException {
    private final ErrorKind kind;
    private final String filename;
    private final int index;
    private int line;
    private int column;
    private String sourceLine;

    public LessException(ErrorKind kind, String message, String filename, int index) {
        this(kind, message, filename, index, null);
    }

    public LessException(ErrorKind kind, String message, String filename, int index, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.filename = filename;
        this.index = index;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getFilename() {
        return filename;
    }

    /** 字符偏移，未知时为 -1 */
    public int getIndex() {
        return index;
    }

    /** 行号（从 1 开始），未知时为 0 */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /**
     * 用源文本补全行列信息（只补一次）
     */
    public void locate(SourceText source) {
        if (line > 0 || source == null || index < 0) {
            return;
        }
        SourceLocation loc = source.locate(index);
        this.line = loc.getLine();
        this.column = loc.getColumn();
        this.sourceLine = source.line(loc.getLine());
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getLabel()).append("Error: ").append(super.getMessage());
        if (line > 0) {
            sb.append("\n");
            sb.append(formatErrorWithLocation());
        } else if (filename != null) {
            sb.append(" in ").append(filename);
        }
        return sb.toString();
    }

    /**
     * 格式化带位置信息的错误消息
     *
     * 输出格式类似:
     * --> main.less:5:10
     *   |
     * 5 |   color: @missing;
     *   |          ^
     */
    private String formatErrorWithLocation() {
        StringBuilder sb = new StringBuilder();
        String file = filename == null || filename.isEmpty() ? "<input>" : filename;
        sb.append("  --> ").append(file)
          .append(":").append(line)
          .append(":").append(column);

        if (sourceLine != null && !sourceLine.isEmpty()) {
            String lineNum = String.valueOf(line);
            String padding = repeat(" ", lineNum.length());
            sb.append("\n");
            sb.append(padding).append(" |\n");
            sb.append(lineNum).append(" | ").append(sourceLine).append("\n");
            sb.append(padding).append(" | ");
            if (column > 0) {
                sb.append(repeat(" ", column - 1));
            }
            sb.append("^");
        }
        return sb.toString();
    }

    private static String repeat(String s, int count) {
        if (count <= 0) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
