package com.lessj.compiler.function;

import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.LessException;

/**
 * 宿主注册的函数执行失败
 */
public class PluginException extends LessException {

    public PluginException(String message, String filename, int index, Throwable cause) {
        super(ErrorKind.PLUGIN, message, filename, index, cause);
    }
}
