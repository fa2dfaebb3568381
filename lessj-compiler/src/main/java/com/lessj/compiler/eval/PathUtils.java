package com.lessj.compiler.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 以 / 分隔的路径工具：规范化、拼接、相对目录差与 url() 重写
 */
public final class PathUtils {
    private static final Pattern NOT_RELATIVE = Pattern.compile("^(?:[a-z-]+:|/|#)", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_SPECIAL = Pattern.compile("[()'\"\\s]");

    private PathUtils() {
    }

    /** 不以协议、/ 或 # 开头 */
    public static boolean isRelative(String path) {
        return !NOT_RELATIVE.matcher(path).find();
    }

    /** 以 . 开头（./a.png、../a.png） */
    public static boolean isLocalRelative(String path) {
        return path.startsWith(".");
    }

    /**
     * 消去 . 与可回退的 .. 片段；无法回退的前导 .. 保留
     */
    public static String normalize(String path) {
        String[] segments = path.split("/", -1);
        List<String> result = new ArrayList<>();
        for (String segment : segments) {
            switch (segment) {
                case ".":
                    break;
                case "..":
                    if (result.isEmpty() || "..".equals(result.get(result.size() - 1))) {
                        result.add(segment);
                    } else {
                        result.remove(result.size() - 1);
                    }
                    break;
                default:
                    result.add(segment);
                    break;
            }
        }
        return String.join("/", result);
    }

    /**
     * 拼接目录与路径；path 为绝对路径或带协议时直接返回
     */
    public static String join(String directory, String path) {
        if (directory == null || directory.isEmpty() || !isRelative(path)) {
            return path;
        }
        return directory.endsWith("/") ? directory + path : directory + "/" + path;
    }

    /**
     * 文件所在目录，含末尾的 /；没有目录部分时返回空串
     */
    public static String dirname(String filename) {
        int slash = filename.lastIndexOf('/');
        return slash < 0 ? "" : filename.substring(0, slash + 1);
    }

    /**
     * 从 base 目录到 url 目录的相对路径，如 pathDiff("a/b/", "a/c/") = "../b/"
     */
    public static String pathDiff(String url, String base) {
        String[] urlDirs = url.split("/", -1);
        String[] baseDirs = base.split("/", -1);
        int max = Math.max(urlDirs.length, baseDirs.length);
        int i = 0;
        while (i < max && i < urlDirs.length && i < baseDirs.length && urlDirs[i].equals(baseDirs[i])) {
            i++;
        }
        StringBuilder diff = new StringBuilder();
        for (int j = i; j < baseDirs.length - 1; j++) {
            diff.append("../");
        }
        for (int j = i; j < urlDirs.length - 1; j++) {
            diff.append(urlDirs[j]).append('/');
        }
        return diff.toString();
    }

    /**
     * 在路径前拼接 rootpath 并规范化；原本显式相对的路径保持以 ./ 开头
     */
    public static String rewritePath(String path, String rootpath) {
        String root = rootpath == null ? "" : rootpath;
        String newPath = normalize(root + path);
        if (isLocalRelative(path) && isRelative(root) && !isLocalRelative(newPath)) {
            newPath = "./" + newPath;
        }
        return newPath;
    }

    /** 未加引号的 url() 中需要转义的字符 */
    public static String escapeUrlPath(String path) {
        return URL_SPECIAL.matcher(path).replaceAll("\\\\$0");
    }
}
