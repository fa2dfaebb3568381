package com.lessj.cli;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.MathMode;
import com.lessj.compiler.RewriteUrls;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * lessc 命令行入口（picocli）
 */
@Command(name = "lessc", version = "LessJ v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 LESS 样式表编译为 CSS")
public class Main implements Callable<Integer> {

    @Parameters(index = "0", description = "入口 .less 文件")
    String input;

    @Parameters(index = "1", arity = "0..1", description = "输出 CSS 文件，省略时写到标准输出")
    String output;

    @Option(names = {"-x", "--compress"}, description = "压缩输出")
    boolean compress;

    @Option(names = {"-su", "--strict-units"}, description = "单位不兼容的运算报错")
    boolean strictUnits;

    @Option(names = {"-m", "--math"}, paramLabel = "MODE",
            description = "数学运算模式（always, parens-division, parens）")
    String math;

    @Option(names = {"-ru", "--rewrite-urls"}, paramLabel = "MODE",
            description = "按导入文件目录重写 url（off, local, all）")
    String rewriteUrls;

    @Option(names = "--relative-urls", description = "等价于 --rewrite-urls=all")
    boolean relativeUrls;

    @Option(names = "--rootpath", paramLabel = "PATH", description = "url 重写时添加的前缀")
    String rootpath;

    @Option(names = "--url-args", paramLabel = "ARGS", description = "追加到每个 url 的查询参数")
    String urlArgs;

    @Option(names = "--strict-imports", description = "禁止在选择器块中导入")
    boolean strictImports;

    @Option(names = "--include-path", paramLabel = "PATHS",
            description = "导入搜索目录，以系统路径分隔符分隔，可重复")
    List<String> includePaths = new ArrayList<>();

    @Option(names = "--global-var", paramLabel = "NAME=VALUE", description = "全局变量，可被样式表覆盖")
    Map<String, String> globalVars = new LinkedHashMap<>();

    @Option(names = "--modify-var", paramLabel = "NAME=VALUE", description = "覆盖样式表中的变量")
    Map<String, String> modifyVars = new LinkedHashMap<>();

    @Option(names = "--source-map", description = "在输出文件旁生成 .map 文件")
    boolean sourceMap;

    @Option(names = "--source-map-include-source", description = "source map 中内嵌源码")
    boolean sourceMapIncludeSource;

    @Option(names = {"-v", "--verbose"}, description = "输出编译过程日志")
    boolean verbose;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        configureLogging(verbose ? Level.FINE : Level.WARNING);
        CompileOptions options;
        try {
            options = buildOptions();
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 2;
        }
        return new CompileRunner(options, out, err).compileFile(input, output, sourceMapIncludeSource);
    }

    CompileOptions buildOptions() {
        CompileOptions options = new CompileOptions();
        options.setCompress(compress);
        options.setStrictUnits(strictUnits);
        if (math != null) {
            options.setMath(MathMode.fromString(math));
        }
        if (rewriteUrls != null) {
            options.setRewriteUrls(RewriteUrls.fromString(rewriteUrls));
        }
        options.setRelativeUrls(relativeUrls);
        if (rootpath != null) {
            options.setRootpath(rootpath);
        }
        if (urlArgs != null) {
            options.setUrlArgs(urlArgs);
        }
        options.setStrictImports(strictImports);
        options.setSourceMap(sourceMap);

        List<String> paths = new ArrayList<>();
        for (String entry : includePaths) {
            for (String p : entry.split(File.pathSeparator)) {
                if (!p.isEmpty()) {
                    paths.add(p.endsWith("/") ? p : p + "/");
                }
            }
        }
        options.setPaths(paths);
        options.setGlobalVars(new LinkedHashMap<>(globalVars));
        options.setModifyVars(new LinkedHashMap<>(modifyVars));
        return options;
    }

    /**
     * 日志统一写到 stderr，不干扰标准输出上的 CSS
     */
    static void configureLogging(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
