package com.lessj.compiler.function;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 函数注册表
 *
 * <p>内置函数集中在一个共享的只读注册表里；宿主通过 {@link #inherit()} 得到子表后注册自己的函数，
 * 子表中的同名函数覆盖内置函数。函数名大小写不敏感。</p>
 */
public final class FunctionRegistry {

    /**
     * 注册项
     */
    public static final class Entry {
        private final String name;
        private final LessFunction function;
        private final boolean evaluateArgs;
        private final boolean builtin;

        Entry(String name, LessFunction function, boolean evaluateArgs, boolean builtin) {
            this.name = name;
            this.function = function;
            this.evaluateArgs = evaluateArgs;
            this.builtin = builtin;
        }

        public String getName() {
            return name;
        }

        public LessFunction getFunction() {
            return function;
        }

        /** false 表示参数以原始节点传入，由函数自行求值 */
        public boolean isEvaluateArgs() {
            return evaluateArgs;
        }

        /** 内置函数的失败归为参数错误，宿主函数的失败归为插件错误 */
        public boolean isBuiltin() {
            return builtin;
        }
    }

    private static final FunctionRegistry BUILTINS = createBuiltins();

    private final FunctionRegistry parent;
    private final Map<String, Entry> functions = new ConcurrentHashMap<String, Entry>();
    private boolean frozen;

    private FunctionRegistry(FunctionRegistry parent) {
        this.parent = parent;
    }

    private static FunctionRegistry createBuiltins() {
        FunctionRegistry registry = new FunctionRegistry(null);
        TypeFunctions.register(registry);
        MathFunctions.register(registry);
        StringFunctions.register(registry);
        ListFunctions.register(registry);
        ColorFunctions.register(registry);
        ColorBlending.register(registry);
        LogicFunctions.register(registry);
        SvgFunctions.register(registry);
        ResourceFunctions.register(registry);
        registry.frozen = true;
        return registry;
    }

    /** 只含内置函数的共享注册表 */
    public static FunctionRegistry builtins() {
        return BUILTINS;
    }

    /** 以本表为父表创建可注册的子表 */
    public FunctionRegistry inherit() {
        return new FunctionRegistry(this);
    }

    /**
     * 注册宿主函数
     *
     * @throws IllegalStateException 在共享的内置注册表上调用
     */
    public FunctionRegistry add(String name, LessFunction function) {
        put(new Entry(key(name), function, true, false));
        return this;
    }

    void addBuiltin(String name, LessFunction function) {
        put(new Entry(key(name), function, true, true));
    }

    /** 参数不预先求值的内置函数（if、boolean、isdefined） */
    void addRaw(String name, LessFunction function) {
        put(new Entry(key(name), function, false, true));
    }

    private void put(Entry entry) {
        if (frozen) {
            throw new IllegalStateException("builtin function registry is read-only, use inherit()");
        }
        functions.put(entry.getName(), entry);
    }

    /**
     * 查找函数，本表没有时查父表
     *
     * @return 注册项，不存在时返回 null
     */
    public Entry get(String name) {
        Entry entry = functions.get(key(name));
        if (entry == null && parent != null) {
            return parent.get(name);
        }
        return entry;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
