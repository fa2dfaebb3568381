package com.lessj.compiler.ast;

/**
 * 源文件信息
 *
 * <p>filename 为导入解析器给出的规范标识；currentDirectory 用于解析相对导入；
 * rootpath 为 url() 重写时拼接的前缀；reference 表示该文件以 (reference) 方式导入。</p>
 */
public final class FileInfo {
    private final String filename;
    private final String currentDirectory;
    private final String rootpath;
    private final String entryPath;
    private final String rootFilename;
    private final boolean reference;

    public FileInfo(String filename, String currentDirectory, String rootpath,
                    String entryPath, String rootFilename, boolean reference) {
        this.filename = filename;
        this.currentDirectory = currentDirectory == null ? "" : currentDirectory;
        this.rootpath = rootpath == null ? "" : rootpath;
        this.entryPath = entryPath == null ? "" : entryPath;
        this.rootFilename = rootFilename;
        this.reference = reference;
    }

    /**
     * 入口文件
     */
    public static FileInfo entry(String filename, String currentDirectory, String rootpath) {
        return new FileInfo(filename, currentDirectory, rootpath, currentDirectory, filename, false);
    }

    public String getFilename() {
        return filename;
    }

    public String getCurrentDirectory() {
        return currentDirectory;
    }

    public String getRootpath() {
        return rootpath;
    }

    public String getEntryPath() {
        return entryPath;
    }

    public String getRootFilename() {
        return rootFilename;
    }

    public boolean isReference() {
        return reference;
    }

    /**
     * 派生被导入文件的信息，entryPath 与 rootFilename 沿用入口文件
     */
    public FileInfo derive(String filename, String currentDirectory, String rootpath, boolean reference) {
        return new FileInfo(filename, currentDirectory, rootpath, entryPath, rootFilename,
                this.reference || reference);
    }

    @Override
    public String toString() {
        return filename;
    }
}
