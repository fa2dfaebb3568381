package com.lessj.cli;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.CompileResult;
import com.lessj.compiler.LessCompiler;
import com.lessj.compiler.LessException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 编译执行器：读取入口文件，编译并写出 CSS 与 source map
 */
public class CompileRunner {
    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private final CompileOptions options;
    private final FileSystemImportResolver resolver;
    private final PrintStream out;
    private final PrintStream err;

    public CompileRunner(CompileOptions options, PrintStream out, PrintStream err) {
        this(options, new FileSystemImportResolver(), out, err);
    }

    CompileRunner(CompileOptions options, FileSystemImportResolver resolver, PrintStream out, PrintStream err) {
        this.options = options;
        this.resolver = resolver;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件
     *
     * @param inputPath      入口 .less 文件
     * @param outputPath     输出 CSS 文件，为 null 时写到标准输出
     * @param includeSources source map 中内嵌源码
     * @return 进程退出码
     */
    public int compileFile(String inputPath, String outputPath, boolean includeSources) {
        Path input = Paths.get(inputPath);
        if (!Files.isRegularFile(input)) {
            err.println("错误: 文件不存在 - " + inputPath);
            return 1;
        }
        if (options.isSourceMap() && outputPath == null) {
            err.println("错误: 生成 source map 需要指定输出文件");
            return 1;
        }

        try {
            String source = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            LessCompiler compiler = LessCompiler.builder()
                    .options(options)
                    .resolver(resolver)
                    .build();
            CompileResult result = compiler.compile(source, FileSystemImportResolver.identify(input));
            LOG.fine("import cache: " + resolver.getCacheStats());

            if (outputPath == null) {
                out.print(result.getCss());
                out.flush();
                return 0;
            }
            writeOutput(Paths.get(outputPath), result, includeSources);
            return 0;
        } catch (LessException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    private void writeOutput(Path output, CompileResult result, boolean includeSources) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String css = result.getCss();
        if (options.isSourceMap()) {
            Path mapFile = Paths.get(output.toString() + ".map");
            SourceMapWriter writer = new SourceMapWriter(output.getFileName().toString(), parent,
                    includeSources ? result.getSources() : null);
            Files.write(mapFile, writer.write(result.getMappings()).getBytes(StandardCharsets.UTF_8));
            css = css + (css.endsWith("\n") || css.isEmpty() ? "" : "\n")
                    + "/*# sourceMappingURL=" + mapFile.getFileName() + " */";
            LOG.fine("wrote " + mapFile);
        }
        Files.write(output, css.getBytes(StandardCharsets.UTF_8));
        LOG.fine("wrote " + output);
    }
}
