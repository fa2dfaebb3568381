package com.lessj.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 编译选项
 */
public class CompileOptions {
    private MathMode math = MathMode.PARENS_DIVISION;
    private boolean strictUnits = false;
    private boolean compress = false;
    private boolean relativeUrls = false;
    private RewriteUrls rewriteUrls = RewriteUrls.OFF;
    private String rootpath = "";
    private String urlArgs = "";
    private boolean strictImports = false;
    private boolean sourceMap = false;
    private Map<String, String> globalVars = new LinkedHashMap<>();
    private Map<String, String> modifyVars = new LinkedHashMap<>();
    private List<String> paths = new ArrayList<>();

    public CompileOptions() {
    }

    public MathMode getMath() {
        return math;
    }

    public void setMath(MathMode math) {
        this.math = math;
    }

    public boolean isStrictUnits() {
        return strictUnits;
    }

    public void setStrictUnits(boolean strictUnits) {
        this.strictUnits = strictUnits;
    }

    public boolean isCompress() {
        return compress;
    }

    public void setCompress(boolean compress) {
        this.compress = compress;
    }

    public boolean isRelativeUrls() {
        return relativeUrls;
    }

    /** 旧选项，等价于 rewriteUrls = ALL */
    public void setRelativeUrls(boolean relativeUrls) {
        this.relativeUrls = relativeUrls;
    }

    public RewriteUrls getRewriteUrls() {
        return rewriteUrls;
    }

    public void setRewriteUrls(RewriteUrls rewriteUrls) {
        this.rewriteUrls = rewriteUrls;
    }

    /**
     * 实际生效的重写模式（relativeUrls 折算后）
     */
    public RewriteUrls effectiveRewriteUrls() {
        if (rewriteUrls == RewriteUrls.OFF && relativeUrls) {
            return RewriteUrls.ALL;
        }
        return rewriteUrls;
    }

    public String getRootpath() {
        return rootpath;
    }

    public void setRootpath(String rootpath) {
        this.rootpath = rootpath == null ? "" : rootpath;
    }

    /** 追加到每个 url() 的查询参数 */
    public String getUrlArgs() {
        return urlArgs;
    }

    public void setUrlArgs(String urlArgs) {
        this.urlArgs = urlArgs == null ? "" : urlArgs;
    }

    public boolean isStrictImports() {
        return strictImports;
    }

    public void setStrictImports(boolean strictImports) {
        this.strictImports = strictImports;
    }

    public boolean isSourceMap() {
        return sourceMap;
    }

    public void setSourceMap(boolean sourceMap) {
        this.sourceMap = sourceMap;
    }

    public Map<String, String> getGlobalVars() {
        return globalVars;
    }

    public void setGlobalVars(Map<String, String> globalVars) {
        this.globalVars = globalVars == null ? new LinkedHashMap<String, String>() : globalVars;
    }

    public Map<String, String> getModifyVars() {
        return modifyVars;
    }

    public void setModifyVars(Map<String, String> modifyVars) {
        this.modifyVars = modifyVars == null ? new LinkedHashMap<String, String>() : modifyVars;
    }

    /** 导入搜索目录，按顺序尝试 */
    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths == null ? new ArrayList<String>() : paths;
    }
}
