package com.lessj.compiler;

/**
 * 导入解析结果：规范化的文件标识与文件内容
 */
public final class ResolvedImport {
    private final String filename;
    private final String contents;

    public ResolvedImport(String filename, String contents) {
        this.filename = filename;
        this.contents = contents;
    }

    /** 同一文件在一次编译中的唯一标识，也用于推导被导入文件的目录 */
    public String getFilename() {
        return filename;
    }

    public String getContents() {
        return contents;
    }
}
