package com.lessj.compiler.function;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;

/**
 * 函数调用上下文：调用位置、编译选项以及回到求值器的入口
 */
public interface FunctionContext {

    /** 调用处的字符偏移 */
    int getIndex();

    FileInfo getFileInfo();

    CompileOptions getOptions();

    /**
     * 在调用处的作用域中求值节点（原始参数函数、each 使用）
     */
    Node evaluate(Node node);

    /**
     * 节点在求值阶段的 CSS 文本（不做数值舍入）
     */
    String toCss(Node node);

    /**
     * 通过宿主的导入解析器读取文件字节
     *
     * @param path             文件路径，不含 #片段
     * @param currentDirectory 查找的起始目录
     * @throws com.lessj.compiler.ImportException 没有配置解析器，或文件不存在
     */
    byte[] loadFile(String path, String currentDirectory);

    /**
     * default() 的当前值；不在 mixin 守卫中时返回 null
     */
    Node defaultValue();
}
