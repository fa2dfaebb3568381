package com.lessj.cli;

import com.lessj.cli.cache.CaffeineCache;
import com.lessj.compiler.ImportException;
import com.lessj.compiler.ResolvedImport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class FileSystemImportResolverTest {

    @TempDir
    Path dir;

    private Path write(String name, String contents) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String directoryOf(Path path) {
        return FileSystemImportResolver.identify(path) + "/";
    }

    @Test
    @DisplayName("在当前目录中查找并补上 .less 扩展名")
    void testResolveRelative() throws IOException {
        Path file = write("vars.less", "@c: red;");
        ResolvedImport resolved = new FileSystemImportResolver()
                .resolve("vars", directoryOf(dir), Collections.<String>emptyList());
        assertEquals(FileSystemImportResolver.identify(file), resolved.getFilename());
        assertEquals("@c: red;", resolved.getContents());
    }

    @Test
    @DisplayName("当前目录找不到时查找 include 路径")
    void testIncludePaths() throws IOException {
        write("lib/mixins.less", ".m() {}");
        ResolvedImport resolved = new FileSystemImportResolver()
                .resolve("mixins.less", directoryOf(dir.resolve("src")),
                        Collections.singletonList(directoryOf(dir.resolve("lib"))));
        assertThat(resolved.getFilename()).endsWith("lib/mixins.less");
    }

    @Test
    @DisplayName("资源文件按原始字节读取，不补 .less 扩展名")
    void testResolveBinary() throws IOException {
        Path image = dir.resolve("img/dot");
        Files.createDirectories(image.getParent());
        byte[] bytes = {(byte) 0x89, 'P', 'N', 'G', 0, (byte) 0xff};
        Files.write(image, bytes);
        byte[] read = new FileSystemImportResolver()
                .resolveBinary("img/dot", directoryOf(dir), Collections.<String>emptyList());
        assertArrayEquals(bytes, read);
        assertThatThrownBy(() -> new FileSystemImportResolver()
                .resolveBinary("img/none.png", directoryOf(dir), Collections.<String>emptyList()))
                .isInstanceOf(ImportException.class)
                .hasMessageContaining("wasn't found");
    }

    @Test
    @DisplayName("找不到文件时列出尝试过的路径")
    void testMissing() {
        assertThatThrownBy(() -> new FileSystemImportResolver()
                .resolve("nope", directoryOf(dir), Collections.<String>emptyList()))
                .isInstanceOf(ImportException.class)
                .hasMessageContaining("'nope' wasn't found. Tried - ")
                .hasMessageContaining("nope.less");
    }

    @Test
    @DisplayName("查询参数不参与文件查找")
    void testQueryStripped() throws IOException {
        write("theme.less", "@t: 1;");
        ResolvedImport resolved = new FileSystemImportResolver()
                .resolve("theme.less?v=2", directoryOf(dir), Collections.<String>emptyList());
        assertEquals("@t: 1;", resolved.getContents());
    }

    @Test
    @DisplayName("未修改的文件从缓存读取，修改后重新加载")
    void testCache() throws IOException {
        Path file = write("a.less", "@a: 1;");
        CaffeineCache<Path, FileSystemImportResolver.CachedFile> cache = new CaffeineCache<>(16);
        FileSystemImportResolver resolver = new FileSystemImportResolver(cache);

        resolver.resolve("a", directoryOf(dir), null);
        resolver.resolve("a", directoryOf(dir), null);
        assertEquals(1L, resolver.getCacheStats().getEstimatedSize());
        assertTrue(resolver.getCacheStats().getHitCount() >= 1);

        Files.write(file, "@a: 2;".getBytes(StandardCharsets.UTF_8));
        FileTime later = FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 5000);
        Files.setLastModifiedTime(file, later);
        assertEquals("@a: 2;", resolver.resolve("a", directoryOf(dir), null).getContents());
    }
}
