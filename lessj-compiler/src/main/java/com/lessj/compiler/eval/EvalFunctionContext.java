package com.lessj.compiler.eval;

import com.lessj.compiler.CompileOptions;
import com.lessj.compiler.ImportException;
import com.lessj.compiler.ImportResolver;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Call;
import com.lessj.compiler.function.FunctionContext;

/**
 * 一次函数调用的上下文，绑定到调用处的求值环境
 */
final class EvalFunctionContext implements FunctionContext {
    private final Evaluator evaluator;
    private final EvalContext context;
    private final Call call;

    EvalFunctionContext(Evaluator evaluator, EvalContext context, Call call) {
        this.evaluator = evaluator;
        this.context = context;
        this.call = call;
    }

    @Override
    public int getIndex() {
        return call.getIndex();
    }

    @Override
    public FileInfo getFileInfo() {
        return call.getFileInfo();
    }

    @Override
    public CompileOptions getOptions() {
        return context.getOptions();
    }

    @Override
    public Node evaluate(Node node) {
        return evaluator.eval(node, context);
    }

    @Override
    public String toCss(Node node) {
        return context.toCss(node);
    }

    @Override
    public byte[] loadFile(String path, String currentDirectory) {
        String filename = EvalException.filenameOf(call);
        ImportResolver resolver = context.getSession().getResolver();
        if (resolver == null) {
            throw new ImportException("no import resolver configured for '" + path + "'",
                    filename, call.getIndex(), null);
        }
        try {
            return resolver.resolveBinary(path, currentDirectory, context.getOptions().getPaths());
        } catch (ImportException e) {
            throw new ImportException(e.getRawMessage(), filename, call.getIndex(), e);
        }
    }

    @Override
    public Node defaultValue() {
        return context.getSession().getDefaultGuard().eval();
    }
}
