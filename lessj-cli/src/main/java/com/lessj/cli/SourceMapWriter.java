package com.lessj.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lessj.compiler.output.SourceMapping;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成 source map v3 文档
 *
 * <p>mappings 按输出行分组（以 ; 分隔），每段为 Base64 VLQ 编码的相对增量：
 * 输出列、源文件序号、源行、源列。</p>
 */
public final class SourceMapWriter {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private final String file;
    private final Path baseDirectory;
    private final Map<String, String> sourcesContent;

    /**
     * @param file           生成的 CSS 文件名，写入 "file" 字段
     * @param baseDirectory  source map 所在目录，sources 相对它给出；为 null 时保留原样
     * @param sourcesContent 需要内嵌源码时给出文件标识到源文本，否则为 null
     */
    public SourceMapWriter(String file, Path baseDirectory, Map<String, String> sourcesContent) {
        this.file = file;
        this.baseDirectory = baseDirectory;
        this.sourcesContent = sourcesContent;
    }

    public String write(List<SourceMapping> mappings) {
        Map<String, Integer> sourceIndex = new LinkedHashMap<>();
        for (SourceMapping m : mappings) {
            if (!sourceIndex.containsKey(m.getSource())) {
                sourceIndex.put(m.getSource(), sourceIndex.size());
            }
        }

        JsonObject map = new JsonObject();
        map.addProperty("version", 3);
        if (file != null) {
            map.addProperty("file", file);
        }
        JsonArray sources = new JsonArray();
        for (String source : sourceIndex.keySet()) {
            sources.add(relativize(source));
        }
        map.add("sources", sources);
        if (sourcesContent != null) {
            JsonArray contents = new JsonArray();
            for (String source : sourceIndex.keySet()) {
                contents.add(sourcesContent.get(source));
            }
            map.add("sourcesContent", contents);
        }
        map.add("names", new JsonArray());
        map.addProperty("mappings", encodeMappings(mappings, sourceIndex));
        return GSON.toJson(map);
    }

    static String encodeMappings(List<SourceMapping> mappings, Map<String, Integer> sourceIndex) {
        List<SourceMapping> sorted = new ArrayList<>(mappings);
        sorted.sort((a, b) -> a.getGeneratedLine() != b.getGeneratedLine()
                ? Integer.compare(a.getGeneratedLine(), b.getGeneratedLine())
                : Integer.compare(a.getGeneratedColumn(), b.getGeneratedColumn()));

        StringBuilder sb = new StringBuilder();
        int line = 0;
        int previousColumn = 0;
        int previousSource = 0;
        int previousLine = 0;
        int previousOriginalColumn = 0;
        boolean firstInLine = true;
        for (SourceMapping m : sorted) {
            while (line < m.getGeneratedLine()) {
                sb.append(';');
                line++;
                previousColumn = 0;
                firstInLine = true;
            }
            if (!firstInLine) {
                sb.append(',');
            }
            int source = sourceIndex.get(m.getSource());
            encodeVlq(sb, m.getGeneratedColumn() - previousColumn);
            encodeVlq(sb, source - previousSource);
            encodeVlq(sb, m.getOriginalLine() - previousLine);
            encodeVlq(sb, m.getOriginalColumn() - previousOriginalColumn);
            previousColumn = m.getGeneratedColumn();
            previousSource = source;
            previousLine = m.getOriginalLine();
            previousOriginalColumn = m.getOriginalColumn();
            firstInLine = false;
        }
        return sb.toString();
    }

    /**
     * 最低位为符号位，每 5 位一组，第 6 位表示后面还有组
     */
    static void encodeVlq(StringBuilder sb, int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & 0x1f;
            vlq >>>= 5;
            if (vlq > 0) {
                digit |= 0x20;
            }
            sb.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }

    private String relativize(String source) {
        // <global-vars> 之类的虚拟来源不是文件路径
        if (baseDirectory == null || source.startsWith("<")) {
            return source;
        }
        Path path = Paths.get(source);
        if (!path.isAbsolute()) {
            return source;
        }
        Path base = baseDirectory.toAbsolutePath().normalize();
        if (path.getRoot() == null || !path.getRoot().equals(base.getRoot())) {
            return source;
        }
        return base.relativize(path).toString().replace('\\', '/');
    }
}
