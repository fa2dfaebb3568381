package com.lessj.compiler.eval;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.MathMode;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Frame;
import com.lessj.compiler.ast.rule.FrameChain;
import com.lessj.compiler.ast.rule.NestedAtRule;
import com.lessj.compiler.output.CssEmitter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 求值上下文
 *
 * <p>帧链、括号深度、calc 深度与媒体查询栈属于当前上下文；mixin 与分离规则集调用通过
 * {@link #derive(FrameChain)} 派生新上下文，派生时共享会话、important 作用域与数学模式，
 * 其余状态重新开始。</p>
 */
public final class EvalContext {

    /** 一层 important 作用域，记录作用域内引用到的 !important 变量 */
    static final class ImportantScope {
        String important;
    }

    private final EvalSession session;
    private final Deque<ImportantScope> importantScope;
    private FrameChain frames;
    private MathMode math;
    private int parensDepth;
    private int calcDepth;
    private boolean inCalc;
    private boolean mathOn = true;
    private List<NestedAtRule> mediaBlocks;
    private List<NestedAtRule> mediaPath;

    public EvalContext(EvalSession session, FrameChain frames) {
        this(session, frames, new ArrayDeque<ImportantScope>(), session.getOptions().getMath());
    }

    private EvalContext(EvalSession session, FrameChain frames, Deque<ImportantScope> importantScope, MathMode math) {
        this.session = session;
        this.frames = frames;
        this.importantScope = importantScope;
        this.math = math;
    }

    /**
     * 以新的帧链派生上下文
     */
    public EvalContext derive(FrameChain newFrames) {
        return new EvalContext(session, newFrames, importantScope, math);
    }

    public EvalSession getSession() {
        return session;
    }

    public CompileOptions getOptions() {
        return session.getOptions();
    }

    // ============ 帧 ============

    public FrameChain getFrames() {
        return frames;
    }

    void pushFrame(Frame frame) {
        frames = frames.push(frame);
    }

    void popFrame() {
        frames = frames.rest();
    }

    // ============ important ============

    void pushImportantScope() {
        importantScope.push(new ImportantScope());
    }

    ImportantScope popImportantScope() {
        return importantScope.pop();
    }

    /** 标记当前 important 作用域，没有作用域时忽略 */
    void markImportant(String important) {
        ImportantScope top = importantScope.peek();
        if (top != null) {
            top.important = important;
        }
    }

    // ============ 数学模式 ============

    public MathMode getMath() {
        return math;
    }

    void setMath(MathMode math) {
        this.math = math;
    }

    void enterParens() {
        parensDepth++;
    }

    void exitParens() {
        parensDepth--;
    }

    void enterCalc() {
        calcDepth++;
        inCalc = true;
    }

    void exitCalc() {
        calcDepth--;
        if (calcDepth == 0) {
            inCalc = false;
        }
    }

    public boolean isInCalc() {
        return inCalc;
    }

    boolean isMathEnabled() {
        return mathOn;
    }

    void setMathEnabled(boolean mathOn) {
        this.mathOn = mathOn;
    }

    /**
     * 运算符 op 当前是否执行；op 为 null 时只检查数学模式与括号
     *
     * <p>除法 "/" 在非 always 模式下只在括号内执行，"./" 总是执行。
     * parens 模式下任何运算都只在括号内执行。</p>
     */
    public boolean isMathOn(String op) {
        if (!mathOn) {
            return false;
        }
        if ("/".equals(op) && math != MathMode.ALWAYS && parensDepth == 0) {
            return false;
        }
        if (math == MathMode.PARENS) {
            return parensDepth > 0;
        }
        return true;
    }

    public boolean isMathOn() {
        return isMathOn(null);
    }

    // ============ 媒体查询 ============

    List<NestedAtRule> getMediaBlocks() {
        return mediaBlocks;
    }

    List<NestedAtRule> getMediaPath() {
        return mediaPath;
    }

    void setMediaState(List<NestedAtRule> blocks, List<NestedAtRule> path) {
        this.mediaBlocks = blocks;
        this.mediaPath = path;
    }

    // ============ 输出 ============

    /** 求值阶段的 CSS 文本，遵循压缩与严格单位选项但不做数值舍入 */
    public String toCss(Node node) {
        CompileOptions options = session.getOptions();
        return CssEmitter.toCss(node, options.isCompress(), options.isStrictUnits());
    }
}
