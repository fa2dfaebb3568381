package com.lessj.compiler;

/**
 * 导入失败：文件不存在、读取出错等，由 {@link ImportResolver} 抛出
 */
public class ImportException extends LessException {

    public ImportException(String message) {
        super(ErrorKind.IMPORT, message, null, -1);
    }

    public ImportException(String message, Throwable cause) {
        super(ErrorKind.IMPORT, message, null, -1, cause);
    }

    public ImportException(String message, String filename, int index, Throwable cause) {
        super(ErrorKind.IMPORT, message, filename, index, cause);
    }
}
