package com.lessj.cli;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.MathMode;
import com.lessj.compiler.RewriteUrls;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * lessc 命令行测试
 */
class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new CommandLine(new Main(out, err)).execute(args);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String contents) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("编译")
    class CompileTests {

        @Test
        @DisplayName("未给出输出文件时写到标准输出")
        void testStdout() throws IOException {
            Path input = write("main.less", "@c: red;\na { color: @c; }");
            assertEquals(0, run(input.toString()));
            assertEquals("a {\n  color: red;\n}\n", out());
        }

        @Test
        @DisplayName("写出文件并解析相对导入")
        void testOutputFileWithImport() throws IOException {
            write("vars.less", "@w: 10px;");
            Path input = write("main.less", "@import 'vars';\na { width: @w; }");
            Path output = dir.resolve("out/main.css");
            assertEquals(0, run(input.toString(), output.toString()));
            assertEquals("a {\n  width: 10px;\n}\n", read(output));
        }

        @Test
        @DisplayName("压缩与 --modify-var")
        void testCompressAndModifyVar() throws IOException {
            Path input = write("main.less", "@c: 1px;\na { w: @c; h: 2px; }");
            assertEquals(0, run("--compress", "--modify-var", "c=3px", input.toString()));
            assertEquals("a{w:3px;h:2px}", out());
        }

        @Test
        @DisplayName("--include-path 中的导入")
        void testIncludePath() throws IOException {
            Path lib = Files.createDirectories(dir.resolve("lib"));
            Files.write(lib.resolve("base.less"), ".base { x: 1; }".getBytes(StandardCharsets.UTF_8));
            Path input = write("main.less", "@import 'base';");
            assertEquals(0, run("--include-path", lib.toString(), input.toString()));
            assertEquals(".base {\n  x: 1;\n}\n", out());
        }

        @Test
        @DisplayName("--source-map 生成 .map 文件并追加引用注释")
        void testSourceMap() throws IOException {
            Path input = write("main.less", "a {\n  color: red;\n}");
            Path output = dir.resolve("main.css");
            assertEquals(0, run("--source-map", input.toString(), output.toString()));
            assertThat(read(output)).endsWith("/*# sourceMappingURL=main.css.map */");
            String map = read(dir.resolve("main.css.map"));
            assertThat(map).contains("\"version\":3").contains("\"main.less\"");
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("输入文件不存在")
        void testMissingInput() {
            assertEquals(1, run(dir.resolve("nope.less").toString()));
            assertThat(err()).startsWith("错误: 文件不存在");
        }

        @Test
        @DisplayName("编译错误输出到 stderr")
        void testCompileError() throws IOException {
            Path input = write("main.less", "a { color: @missing; }");
            assertEquals(1, run(input.toString()));
            assertThat(err()).contains("NameError: variable @missing is undefined");
            assertEquals("", out());
        }

        @Test
        @DisplayName("未知的数学模式")
        void testBadMathMode() throws IOException {
            Path input = write("main.less", "a { x: 1; }");
            assertEquals(2, run("--math", "sometimes", input.toString()));
            assertThat(err()).contains("Unknown math mode");
        }

        @Test
        @DisplayName("输出到标准输出时不能生成 source map")
        void testSourceMapNeedsOutput() throws IOException {
            Path input = write("main.less", "a { x: 1; }");
            assertEquals(1, run("--source-map", input.toString()));
        }
    }

    @Nested
    @DisplayName("选项")
    class OptionTests {

        @Test
        @DisplayName("命令行选项映射到编译选项")
        void testBuildOptions() {
            Main main = new Main();
            new CommandLine(main).parseArgs("--strict-units", "--math", "parens", "--rewrite-urls", "local",
                    "--rootpath", "/static/", "--global-var", "a=1",
                    "--include-path", "x" + File.pathSeparator + "y/", "in.less");
            CompileOptions options = main.buildOptions();
            assertTrue(options.isStrictUnits());
            assertEquals(MathMode.PARENS, options.getMath());
            assertEquals(RewriteUrls.LOCAL, options.getRewriteUrls());
            assertEquals("/static/", options.getRootpath());
            assertEquals("1", options.getGlobalVars().get("a"));
            assertThat(options.getPaths()).containsExactly("x/", "y/");
        }
    }
}
