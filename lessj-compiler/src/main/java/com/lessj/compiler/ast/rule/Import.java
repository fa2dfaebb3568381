package com.lessj.compiler.ast.rule;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Url;

import java.util.regex.Pattern;

/**
 * @import 指令
 *
 * <p>css 为 true 的导入原样保留在输出中；其余导入在求值时由导入解析器读入并展开。</p>
 */
public final class Import extends Node {
    private static final Pattern CSS_PATH = Pattern.compile("[#.&?]css([?;].*)?$");

    private final Node path;
    private final Node features;
    private final ImportOptions options;
    private final boolean css;

    public Import(Node path, Node features, ImportOptions options, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.path = path;
        this.features = features;
        this.options = options == null ? ImportOptions.DEFAULT : options;
        if (this.options.getLess() != null || this.options.isInline()) {
            this.css = !Boolean.TRUE.equals(this.options.getLess()) || this.options.isInline();
        } else {
            String pathValue = getPathValue();
            this.css = pathValue != null && CSS_PATH.matcher(pathValue).find();
        }
    }

    public Node getPath() {
        return path;
    }

    /** 媒体特性（Value），可能为 null */
    public Node getFeatures() {
        return features;
    }

    public ImportOptions getOptions() {
        return options;
    }

    public boolean isCss() {
        return css;
    }

    /**
     * 路径文本，路径尚含变量等未求值成分时返回 null
     */
    public String getPathValue() {
        Node p = path instanceof Url ? ((Url) path).getValue() : path;
        if (p instanceof Quoted) {
            return ((Quoted) p).getValue();
        }
        if (p instanceof Anonymous) {
            return ((Anonymous) p).getValue();
        }
        return null;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitImport(this, context);
    }
}
