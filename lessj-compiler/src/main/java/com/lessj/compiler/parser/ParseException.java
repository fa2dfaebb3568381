package com.lessj.compiler.parser;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;

/**
 * 解析异常，解析器不做错误恢复，第一个错误即终止
 */
public class ParseException extends LessException {

    public ParseException(String message, String filename, int index) {
        super(ErrorKind.PARSE, message, filename, index);
    }
}
