package com.lessj.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.lessj.compiler.output.SourceMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceMapWriterTest {

    private static String vlq(int value) {
        StringBuilder sb = new StringBuilder();
        SourceMapWriter.encodeVlq(sb, value);
        return sb.toString();
    }

    @Nested
    @DisplayName("Base64 VLQ")
    class VlqTests {

        @Test
        @DisplayName("单组编码")
        void testSmallValues() {
            assertEquals("A", vlq(0));
            assertEquals("C", vlq(1));
            assertEquals("D", vlq(-1));
            assertEquals("e", vlq(15));
        }

        @Test
        @DisplayName("多组编码")
        void testContinuation() {
            assertEquals("gB", vlq(16));
            assertEquals("hB", vlq(-16));
            assertEquals("2H", vlq(123));
        }
    }

    @Nested
    @DisplayName("mappings 编码")
    class MappingTests {

        @Test
        @DisplayName("同一行以逗号分隔，换行以分号分隔，字段为相对增量")
        void testEncodeMappings() {
            Map<String, Integer> index = new LinkedHashMap<>();
            index.put("a.less", 0);
            List<SourceMapping> mappings = Arrays.asList(
                    new SourceMapping(0, 0, "a.less", 0, 0),
                    new SourceMapping(0, 4, "a.less", 1, 2),
                    new SourceMapping(2, 2, "a.less", 1, 2));
            assertEquals("AAAA,IACE;;EAAA", SourceMapWriter.encodeMappings(mappings, index));
        }
    }

    @Nested
    @DisplayName("文档")
    class DocumentTests {

        @Test
        @DisplayName("生成 v3 文档，sources 相对 map 所在目录")
        void testWrite() {
            String base = Paths.get("").toAbsolutePath().toString().replace('\\', '/');
            String source = base + "/styles/main.less";
            Map<String, String> contents = Collections.singletonMap(source, "a { b: c; }");
            SourceMapWriter writer = new SourceMapWriter("main.css", Paths.get(""), contents);

            String json = writer.write(Collections.singletonList(new SourceMapping(0, 0, source, 0, 0)));
            JsonObject map = JsonParser.parseString(json).getAsJsonObject();
            assertEquals(3, map.get("version").getAsInt());
            assertEquals("main.css", map.get("file").getAsString());
            assertEquals("styles/main.less", map.getAsJsonArray("sources").get(0).getAsString());
            assertEquals("a { b: c; }", map.getAsJsonArray("sourcesContent").get(0).getAsString());
            assertEquals("AAAA", map.get("mappings").getAsString());
        }

        @Test
        @DisplayName("虚拟来源保持原样")
        void testVirtualSource() {
            SourceMapWriter writer = new SourceMapWriter(null, Paths.get(""), null);
            String json = writer.write(Collections.singletonList(new SourceMapping(0, 0, "<global-vars>", 0, 0)));
            JsonObject map = JsonParser.parseString(json).getAsJsonObject();
            assertFalse(map.has("file"));
            assertFalse(map.has("sourcesContent"));
            assertEquals("<global-vars>", map.getAsJsonArray("sources").get(0).getAsString());
        }
    }
}
