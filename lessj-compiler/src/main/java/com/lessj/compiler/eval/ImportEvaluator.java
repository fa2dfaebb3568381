package com.lessj.compiler.eval;

import com.lessj.compiler.ImportException;
import com.lessj.compiler.ImportResolver;
import com.lessj.compiler.RewriteUrls;
import com.lessj.compiler.ResolvedImport;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.SourceText;
import com.lessj.compiler.ast.rule.Import;
import com.lessj.compiler.ast.rule.ImportOptions;
import com.lessj.compiler.ast.rule.Media;
import com.lessj.compiler.ast.rule.Ruleset;
import com.lessj.compiler.ast.selector.Selector;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Url;
import com.lessj.compiler.ast.value.Value;
import com.lessj.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * @import 求值
 *
 * <p>CSS 导入保留为 @import 输出；inline 导入原样输出文件内容；其余导入解析被导入文件
 * （每个文件只解析一次），递归展开其中的导入后返回其规则。带媒体特性的导入包装为 @media。
 * reference 导入的结果整体不可见，只有被 extend 或 mixin 使用的部分才会输出。</p>
 */
final class ImportEvaluator {
    private static final Logger LOG = Logger.getLogger(ImportEvaluator.class.getName());

    private final Evaluator evaluator;

    ImportEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param blocks 结果节点的可见性阻塞计数，reference 导入为每个结果节点加一
     * @return 替换 @import 的规则；CSS 导入时为一个新的 {@link Import}
     */
    List<Node> evaluate(Import node, EvalContext context, Map<Node, Integer> blocks) {
        List<Node> result = doEvaluate(node, context, blocks);
        boolean blocked = node.blocksVisibility() || blocks.containsKey(node);
        if (node.getOptions().isReference() || blocked) {
            for (Node n : result) {
                blocks.merge(n, 1, Integer::sum);
            }
        }
        return result;
    }

    private List<Node> doEvaluate(Import node, EvalContext context, Map<Node, Integer> blocks) {
        ImportOptions options = node.getOptions();
        Node features = node.getFeatures() == null ? null : evaluator.eval(node.getFeatures(), context);
        Import evaluated = new Import(evalPath(node, context), features, options, node.getIndex(), node.getFileInfo());
        evaluated.copyVisibilityInfo(node.visibilityInfo());
        if (evaluated.isCss() && !options.isInline()) {
            List<Node> result = new ArrayList<>();
            result.add(evaluated);
            return result;
        }

        Node pathNode = node.getPath() instanceof Url ? ((Url) node.getPath()).getValue() : node.getPath();
        Node resolvedPath = evaluator.eval(pathNode, context);
        String path = Evaluator.textOf(resolvedPath);
        if (path == null) {
            path = context.toCss(resolvedPath);
        }

        EvalSession session = context.getSession();
        ImportResolver resolver = session.getResolver();
        if (resolver == null) {
            throw new ImportException("no import resolver configured for '" + path + "'",
                    EvalException.filenameOf(node), node.getIndex(), null);
        }
        FileInfo parentInfo = node.getFileInfo() != null
                ? node.getFileInfo()
                : FileInfo.entry("input", "", context.getOptions().getRootpath());
        ResolvedImport resolved;
        try {
            resolved = resolver.resolve(path, parentInfo.getCurrentDirectory(), context.getOptions().getPaths());
        } catch (ImportException e) {
            if (options.isOptional()) {
                LOG.fine("optional import '" + path + "' skipped: " + e.getRawMessage());
                return new ArrayList<>();
            }
            throw new ImportException(e.getRawMessage(), EvalException.filenameOf(node), node.getIndex(), e);
        }

        String filename = resolved.getFilename();
        if (skip(node, filename, parentInfo, session)) {
            LOG.fine("import '" + filename + "' skipped, already imported");
            return new ArrayList<>();
        }

        String directory = PathUtils.dirname(filename);
        String rootpath = parentInfo.getRootpath();
        if (context.getOptions().effectiveRewriteUrls() != RewriteUrls.OFF) {
            rootpath = context.getOptions().getRootpath() + PathUtils.pathDiff(directory, parentInfo.getEntryPath());
        }
        FileInfo importedInfo = parentInfo.derive(filename, directory, rootpath, options.isReference());

        if (options.isInline()) {
            session.recordImportedFile(filename);
            Node contents = new Anonymous(resolved.getContents(), 0, importedInfo, true, true);
            List<Node> result = new ArrayList<>();
            result.add(features != null ? wrapInMedia(Collections.singletonList(contents), features, node) : contents);
            return result;
        }

        Ruleset root = session.cachedImport(filename);
        if (root == null) {
            String text = Parser.preprocess(resolved.getContents());
            session.addSource(new SourceText(filename, text));
            root = new Parser(text, importedInfo).parse();
            session.cacheImport(filename, root);
            LOG.fine("imported " + filename);
        }
        List<Node> rules = root.rulesCopy();
        evaluator.rulesets.evalImports(rules, context, blocks);
        if (features != null) {
            List<Node> result = new ArrayList<>();
            result.add(wrapInMedia(rules, features, node));
            return result;
        }
        return rules;
    }

    /**
     * 未标记 multiple 的导入：入口文件与已导入过的文件不再导入；同一个 @import 节点的结论不变
     */
    private static boolean skip(Import node, String filename, FileInfo parentInfo, EvalSession session) {
        if (node.getOptions().isMultiple()) {
            return false;
        }
        Boolean decided = session.skipDecision(node);
        if (decided != null) {
            return decided;
        }
        boolean skip = filename.equals(parentInfo.getRootFilename()) || !session.markImported(filename);
        session.recordSkip(node, skip);
        return skip;
    }

    /**
     * 输出用的路径：相对路径按所在文件的 rootpath 重写，url() 交给 Url 自身求值
     */
    private Node evalPath(Import node, EvalContext context) {
        Node path = evaluator.eval(node.getPath(), context);
        if (!(path instanceof Url)) {
            String text = Evaluator.textOf(path);
            if (text != null) {
                FileInfo fileInfo = node.getFileInfo();
                if (fileInfo != null && Evaluator.requiresRewrite(text, context)) {
                    path = Evaluator.withText(path, PathUtils.rewritePath(text, fileInfo.getRootpath()));
                } else {
                    path = Evaluator.withText(path, PathUtils.normalize(text));
                }
            }
        }
        return path;
    }

    private static Media wrapInMedia(List<Node> rules, Node features, Import node) {
        Value featureValue = features instanceof Value
                ? (Value) features
                : new Value(Collections.singletonList(features), node.getIndex(), node.getFileInfo());
        Ruleset body = new Ruleset(Selector.createEmptySelectors(node.getIndex(), node.getFileInfo()),
                new ArrayList<>(rules), false, node.getIndex(), node.getFileInfo());
        body.setAllowImports(true);
        List<Node> bodyRules = new ArrayList<>();
        bodyRules.add(body);
        return new Media(featureValue, bodyRules, node.getIndex(), node.getFileInfo());
    }
}
