package com.lessj.compiler;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 导入解析器，由宿主提供（文件系统、内存、网络等）
 *
 * <p>求值到 @import 时同步调用；实现可以自行缓存或预取。</p>
 */
public interface ImportResolver {

    /**
     * 解析导入路径
     *
     * @param path             求值后的导入路径
     * @param currentDirectory 发起导入的文件所在目录（以 / 结尾，入口文件可能为空串）
     * @param paths            额外的搜索目录
     * @throws ImportException 文件不存在或无法读取
     */
    ResolvedImport resolve(String path, String currentDirectory, List<String> paths);

    /**
     * 读取资源文件的原始字节（data-uri、image-size 使用），查找规则与 {@link #resolve} 相同
     *
     * <p>默认实现把文本内容按 UTF-8 编码，只能处理文本资源。</p>
     *
     * @throws ImportException 文件不存在或无法读取
     */
    default byte[] resolveBinary(String path, String currentDirectory, List<String> paths) {
        return resolve(path, currentDirectory, paths).getContents().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 没有扩展名的路径补上 .less
     */
    static String withLessExtension(String path) {
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        if (name.indexOf('.') >= 0) {
            return path;
        }
        return path + ".less";
    }
}
