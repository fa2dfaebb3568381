package com.lessj.compiler;

import com.lessj.compiler.eval.PathUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于内存映射的导入解析器，键为以 / 分隔的相对路径
 */
public class MapImportResolver implements ImportResolver {
    private final Map<String, String> files = new LinkedHashMap<>();
    private final Map<String, byte[]> binaries = new LinkedHashMap<>();

    public MapImportResolver() {
    }

    public MapImportResolver(Map<String, String> files) {
        for (Map.Entry<String, String> e : files.entrySet()) {
            add(e.getKey(), e.getValue());
        }
    }

    public MapImportResolver add(String path, String contents) {
        files.put(PathUtils.normalize(path), contents);
        return this;
    }

    /** 登记二进制资源，供 data-uri 和 image-size 读取 */
    public MapImportResolver add(String path, byte[] contents) {
        binaries.put(PathUtils.normalize(path), contents.clone());
        return this;
    }

    @Override
    public byte[] resolveBinary(String path, String currentDirectory, List<String> paths) {
        for (String dir : directories(currentDirectory, paths)) {
            byte[] contents = binaries.get(PathUtils.normalize(PathUtils.join(dir, path)));
            if (contents != null) {
                return contents.clone();
            }
        }
        return ImportResolver.super.resolveBinary(path, currentDirectory, paths);
    }

    @Override
    public ResolvedImport resolve(String path, String currentDirectory, List<String> paths) {
        String target = ImportResolver.withLessExtension(path);
        List<String> tried = new ArrayList<>();
        for (String dir : directories(currentDirectory, paths)) {
            String candidate = PathUtils.normalize(PathUtils.join(dir, target));
            tried.add(candidate);
            String contents = files.get(candidate);
            if (contents != null) {
                return new ResolvedImport(candidate, contents);
            }
        }
        throw new ImportException("'" + path + "' wasn't found. Tried - " + String.join(",", tried));
    }

    private static List<String> directories(String currentDirectory, List<String> paths) {
        List<String> directories = new ArrayList<>();
        directories.add(currentDirectory == null ? "" : currentDirectory);
        if (paths != null) {
            directories.addAll(paths);
        }
        return directories;
    }
}
