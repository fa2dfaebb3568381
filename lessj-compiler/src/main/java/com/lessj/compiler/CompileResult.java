package com.lessj.compiler;

import com.lessj.compiler.output.SourceMapping;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次编译的结果
 */
public final class CompileResult {
    private final String css;
    private final List<SourceMapping> mappings;
    private final List<String> importedFiles;
    private final Map<String, String> sources;

    CompileResult(String css, List<SourceMapping> mappings, List<String> importedFiles, Map<String, String> sources) {
        this.css = css;
        this.mappings = Collections.unmodifiableList(mappings);
        this.importedFiles = Collections.unmodifiableList(importedFiles);
        this.sources = Collections.unmodifiableMap(sources);
    }

    public String getCss() {
        return css;
    }

    /** 开启 sourceMap 选项时的映射，否则为空 */
    public List<SourceMapping> getMappings() {
        return mappings;
    }

    /** 按首次导入顺序排列的被导入文件 */
    public List<String> getImportedFiles() {
        return importedFiles;
    }

    /** 参与编译的源文件名到（预处理后的）源文本 */
    public Map<String, String> getSources() {
        return sources;
    }
}
