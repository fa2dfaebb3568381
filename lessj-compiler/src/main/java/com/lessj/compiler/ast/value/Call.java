package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用 name(args)；未注册的函数按原样输出
 */
public final class Call extends Node {
    private final String name;
    private final List<Node> args;

    public Call(String name, List<Node> args, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.name = name;
        this.args = Collections.unmodifiableList(args);
    }

    public String getName() {
        return name;
    }

    public List<Node> getArgs() {
        return args;
    }

    /** calc() 内部关闭数学运算，仅替换变量 */
    public boolean isCalc() {
        return "calc".equals(name);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
