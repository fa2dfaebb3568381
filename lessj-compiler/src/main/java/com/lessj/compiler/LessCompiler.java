package com.lessj.compiler;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.SourceText;
import com.lessj.compiler.ast.rule.FrameChain;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.eval.EvalContext;
import com.lessj.compiler.eval.EvalSession;
import com.lessj.compiler.eval.Evaluator;
import com.lessj.compiler.eval.PathUtils;
import com.lessj.compiler.function.FunctionRegistry;
import com.lessj.compiler.function.LessFunction;
import com.lessj.compiler.output.CssEmitter;
import com.lessj.compiler.output.CssOutput;
import com.lessj.compiler.output.SourceMapping;
import com.lessj.compiler.parser.Parser;
import com.lessj.compiler.visitor.JoinSelectorVisitor;
import com.lessj.compiler.visitor.ProcessExtendsVisitor;
import com.lessj.compiler.visitor.SetTreeVisibilityVisitor;
import com.lessj.compiler.visitor.ToCssVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LESS 编译器入口
 *
 * <p>编译流程：解析 → 求值 → 选择器拼接 → 可见性标记 → extend 处理 → 输出前整理 → 生成 CSS。
 * 实例不可变，可在多个线程间共享；每次 {@link #compile} 使用独立的会话状态。</p>
 *
 * <pre>
 * LessCompiler compiler = LessCompiler.builder()
 *         .compress(true)
 *         .resolver(new MapImportResolver().add("vars.less", "@c: red;"))
 *         .build();
 * String css = compiler.compile("@import 'vars'; a { color: @c; }", "main.less").getCss();
 * </pre>
 */
public final class LessCompiler {
    private static final Logger LOG = Logger.getLogger(LessCompiler.class.getName());

    private static final String GLOBAL_VARS_FILE = "<global-vars>";
    private static final String MODIFY_VARS_FILE = "<modify-vars>";

    private final CompileOptions options;
    private final ImportResolver resolver;
    private final FunctionRegistry functions;

    private LessCompiler(Builder builder) {
        this.options = builder.options;
        this.resolver = builder.resolver;
        this.functions = builder.functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 默认选项、不支持导入的编译器 */
    public static LessCompiler create() {
        return builder().build();
    }

    public CompileOptions getOptions() {
        return options;
    }

    /**
     * 编译样式表
     *
     * @param source   LESS 源文本
     * @param filename 入口文件名，用于错误信息、相对导入与源码映射
     * @throws LessException 任一阶段出错，位置信息已补全
     */
    public CompileResult compile(String source, String filename) {
        String entryName = filename == null || filename.isEmpty() ? "input" : filename;
        EvalSession session = new EvalSession(options, functions, resolver);
        try {
            return doCompile(source, entryName, session);
        } catch (LessException e) {
            e.locate(session.getSource(e.getFilename()));
            throw e;
        } catch (StackOverflowError e) {
            throw new LessException(ErrorKind.RUNTIME,
                    "Maximum call stack size exceeded", entryName, -1, e);
        }
    }

    /** 以 "input" 为文件名编译 */
    public CompileResult compile(String source) {
        return compile(source, "input");
    }

    private CompileResult doCompile(String source, String filename, EvalSession session) {
        long start = System.nanoTime();

        // ============ 解析 ============
        String text = Parser.preprocess(source == null ? "" : source);
        session.addSource(new SourceText(filename, text));
        FileInfo fileInfo = FileInfo.entry(filename, PathUtils.dirname(filename), options.getRootpath());
        Ruleset root = new Parser(text, fileInfo).parse();
        injectVariables(root, session, fileInfo);
        long parsed = System.nanoTime();

        // ============ 求值 ============
        EvalContext context = new EvalContext(session, FrameChain.EMPTY);
        Ruleset evaluated = new Evaluator().evaluate(root, context);
        long evaluatedAt = System.nanoTime();

        // ============ 输出前处理 ============
        new JoinSelectorVisitor().run(evaluated);
        new SetTreeVisibilityVisitor(true).run(evaluated);
        new ProcessExtendsVisitor().run(evaluated);
        new ToCssVisitor(options.isCompress(), options.isStrictUnits()).run(evaluated);
        long visited = System.nanoTime();

        CssOutput out = CssEmitter.emit(evaluated, options.isCompress(), options.isStrictUnits(),
                options.isSourceMap() ? session::getSource : null);
        long emitted = System.nanoTime();

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("compiled %s: parse %.2fms, eval %.2fms, visitors %.2fms, emit %.2fms",
                    filename, millis(start, parsed), millis(parsed, evaluatedAt),
                    millis(evaluatedAt, visited), millis(visited, emitted)));
        }

        List<SourceMapping> mappings = options.isSourceMap()
                ? out.getMappings() : Collections.<SourceMapping>emptyList();
        Map<String, String> sources = new LinkedHashMap<>();
        for (Map.Entry<String, SourceText> e : session.getSources().entrySet()) {
            sources.put(e.getKey(), e.getValue().getText());
        }
        return new CompileResult(out.toString(), mappings,
                new ArrayList<>(session.getImportedFiles()), sources);
    }

    /**
     * globalVars 放在入口规则之前，可以被样式表覆盖；modifyVars 放在之后，覆盖样式表中的同名变量
     */
    private void injectVariables(Ruleset root, EvalSession session, FileInfo entry) {
        List<Node> globals = parseVariables(options.getGlobalVars(), GLOBAL_VARS_FILE, session, entry);
        List<Node> modifies = parseVariables(options.getModifyVars(), MODIFY_VARS_FILE, session, entry);
        if (globals.isEmpty() && modifies.isEmpty()) {
            return;
        }
        List<Node> rules = new ArrayList<>(globals);
        if (root.getRules() != null) {
            rules.addAll(root.getRules());
        }
        rules.addAll(modifies);
        root.setRules(rules);
    }

    private static List<Node> parseVariables(Map<String, String> vars, String name,
                                             EvalSession session, FileInfo entry) {
        if (vars == null || vars.isEmpty()) {
            return Collections.emptyList();
        }
        String text = serializeVariables(vars);
        session.addSource(new SourceText(name, text));
        FileInfo info = entry.derive(name, entry.getCurrentDirectory(), entry.getRootpath(), false);
        Ruleset parsed = new Parser(text, info).parse();
        return parsed.getRules() == null ? Collections.<Node>emptyList() : parsed.getRules();
    }

    /**
     * 变量表序列化为 LESS 声明：名称缺少 @ 时补上，值末尾缺少分号时补上
     */
    static String serializeVariables(Map<String, String> vars) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : vars.entrySet()) {
            String key = e.getKey();
            String value = e.getValue() == null ? "" : e.getValue().trim();
            sb.append(key.startsWith("@") ? "" : "@").append(key).append(": ").append(value);
            if (!value.endsWith(";")) {
                sb.append(';');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static double millis(long from, long to) {
        return (to - from) / 1_000_000.0;
    }

    // ============ Builder ============

    public static final class Builder {
        private CompileOptions options = new CompileOptions();
        private ImportResolver resolver;
        private FunctionRegistry functions = FunctionRegistry.builtins();

        Builder() {
        }

        public Builder options(CompileOptions options) {
            this.options = options == null ? new CompileOptions() : options;
            return this;
        }

        public Builder compress(boolean compress) {
            options.setCompress(compress);
            return this;
        }

        public Builder strictUnits(boolean strictUnits) {
            options.setStrictUnits(strictUnits);
            return this;
        }

        public Builder math(MathMode math) {
            options.setMath(math);
            return this;
        }

        public Builder resolver(ImportResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * 注册宿主函数，同名时覆盖内置函数
         */
        public Builder function(String name, LessFunction function) {
            if (functions == FunctionRegistry.builtins()) {
                functions = FunctionRegistry.builtins().inherit();
            }
            functions.add(name, function);
            return this;
        }

        public LessCompiler build() {
            return new LessCompiler(this);
        }
    }
}
