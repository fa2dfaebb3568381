package com.lessj.compiler.function;

import com.lessj.compiler.ast.value.Anonymous;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest {

    @Test
    @DisplayName("内置函数名不区分大小写")
    void testBuiltinLookup() {
        FunctionRegistry builtins = FunctionRegistry.builtins();
        assertTrue(builtins.contains("lighten"));
        assertTrue(builtins.contains("RGBA"));
        assertTrue(builtins.get("percentage").isBuiltin());
        assertFalse(builtins.contains("no-such-function"));
    }

    @Test
    @DisplayName("if 以原始参数注册")
    void testRawFunction() {
        assertFalse(FunctionRegistry.builtins().get("if").isEvaluateArgs());
        assertTrue(FunctionRegistry.builtins().get("mix").isEvaluateArgs());
    }

    @Test
    @DisplayName("共享的内置注册表只读")
    void testBuiltinsReadOnly() {
        assertThrows(IllegalStateException.class,
                () -> FunctionRegistry.builtins().add("x", (ctx, args) -> new Anonymous("x")));
    }

    @Test
    @DisplayName("子表可以覆盖内置函数且不影响父表")
    void testInherit() {
        FunctionRegistry child = FunctionRegistry.builtins().inherit();
        child.add("lighten", (ctx, args) -> new Anonymous("custom"));
        assertFalse(child.get("lighten").isBuiltin());
        assertTrue(FunctionRegistry.builtins().get("lighten").isBuiltin());
        assertTrue(child.contains("darken"));
    }
}
