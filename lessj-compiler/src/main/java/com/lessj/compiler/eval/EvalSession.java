package com.lessj.compiler.eval;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.ErrorKind;
import com.lessj.compiler.ImportResolver;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.SourceText;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.function.FunctionRegistry;
import com.lessj.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次编译的共享状态
 *
 * <p>导入缓存、源文本表、default() 守卫、递归检测与 mixin 深度都只属于一次编译，
 * 多个编译可以并发进行而互不影响。</p>
 */
public final class EvalSession {
    static final int MAX_MIXIN_DEPTH = 1000;

    private final CompileOptions options;
    private final FunctionRegistry functions;
    private final ImportResolver resolver;

    private final Map<String, Ruleset> parsedImports = new HashMap<>();
    private final Map<String, SourceText> sources = new LinkedHashMap<>();
    private final Set<String> onceImported = new LinkedHashSet<>();
    private final Map<Node, Boolean> importSkips = new IdentityHashMap<>();
    private final List<String> importedFiles = new ArrayList<>();
    private final DefaultGuard defaultGuard = new DefaultGuard();
    private final Set<Node> evaluating = Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());
    private final Map<Declaration, Declaration> reparsed = new IdentityHashMap<>();
    private int mixinDepth;

    public EvalSession(CompileOptions options, FunctionRegistry functions, ImportResolver resolver) {
        this.options = options;
        this.functions = functions;
        this.resolver = resolver;
    }

    public CompileOptions getOptions() {
        return options;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    public ImportResolver getResolver() {
        return resolver;
    }

    public DefaultGuard getDefaultGuard() {
        return defaultGuard;
    }

    // ============ 源文本与导入 ============

    public void addSource(SourceText source) {
        sources.put(source.getFilename(), source);
    }

    /** 文件名到源文本，用于给错误补全行列 */
    public SourceText getSource(String filename) {
        return filename == null ? null : sources.get(filename);
    }

    public Map<String, SourceText> getSources() {
        return Collections.unmodifiableMap(sources);
    }

    /** 按首次导入顺序排列的被导入文件 */
    public List<String> getImportedFiles() {
        return Collections.unmodifiableList(importedFiles);
    }

    Ruleset cachedImport(String filename) {
        return parsedImports.get(filename);
    }

    void cacheImport(String filename, Ruleset root) {
        parsedImports.put(filename, root);
        recordImportedFile(filename);
    }

    void recordImportedFile(String filename) {
        if (!importedFiles.contains(filename)) {
            importedFiles.add(filename);
        }
    }

    /**
     * once 规则按 @import 节点判定一次：同一节点再次求值（如位于被多次调用的 mixin 中）沿用首次的结论
     *
     * @return 已判定过时返回结论，否则返回 null
     */
    Boolean skipDecision(Node importNode) {
        return importSkips.get(importNode);
    }

    void recordSkip(Node importNode, boolean skip) {
        importSkips.put(importNode, skip);
    }

    /**
     * 标记文件已按 once 规则导入
     *
     * @return 第一次导入时返回 true
     */
    public boolean markImported(String filename) {
        return onceImported.add(filename);
    }

    // ============ 递归检测 ============

    /**
     * 进入节点的求值；节点已在求值中时抛出位于该节点的 NAME 错误
     */
    void enter(Node node, String message) {
        if (!evaluating.add(node)) {
            throw new EvalException(ErrorKind.NAME, message, node);
        }
    }

    void leave(Node node) {
        evaluating.remove(node);
    }

    void enterMixin() {
        if (++mixinDepth > MAX_MIXIN_DEPTH) {
            throw new EvalException(ErrorKind.RUNTIME,
                    "Maximum mixin call depth of " + MAX_MIXIN_DEPTH + " exceeded");
        }
    }

    void leaveMixin() {
        if (mixinDepth > 0) {
            mixinDepth--;
        }
    }

    /**
     * 以延迟解析保存的声明值（Anonymous）在首次被查找时解析为结构化值
     *
     * <p>解析失败时保留原文。结果按声明对象缓存。</p>
     */
    Declaration parsed(Declaration declaration) {
        if (!(declaration.getValue() instanceof Anonymous)) {
            return declaration;
        }
        Declaration cached = reparsed.get(declaration);
        if (cached != null) {
            return cached;
        }
        Anonymous raw = (Anonymous) declaration.getValue();
        Node[] result = Parser.parseValue(raw.getValue(), declaration.getFileInfo(), raw.getIndex());
        Declaration resolved = declaration;
        if (result != null) {
            String important = result[1] == null ? "" : result[1].toString();
            resolved = declaration.withValue(result[0], important);
        }
        reparsed.put(declaration, resolved);
        return resolved;
    }
}
