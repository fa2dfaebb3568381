package com.lessj.compiler;

import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.output.SourceMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译器端到端测试
 */
@DisplayName("LessCompiler 端到端测试")
class LessCompilerTest {

    private static String compile(String less) {
        return LessCompiler.create().compile(less, "main.less").getCss();
    }

    private static String compile(String less, CompileOptions options) {
        return LessCompiler.builder().options(options).build().compile(less, "main.less").getCss();
    }

    private static String compileWith(MapImportResolver resolver, String less) {
        return LessCompiler.builder().resolver(resolver).build().compile(less, "main.less").getCss();
    }

    private static LessException compileError(String less) {
        return assertThrows(LessException.class, () -> compile(less));
    }

    // ================================================================
    // 变量与嵌套
    // ================================================================

    @Nested
    @DisplayName("变量与嵌套")
    class VariableAndNestingTests {

        @Test
        @DisplayName("变量替换")
        void testVariable() {
            assertEquals("a {\n  color: red;\n}\n", compile("@c: red;\na { color: @c; }"));
        }

        @Test
        @DisplayName("变量惰性求值，后定义的值生效")
        void testLazyVariable() {
            assertEquals("a {\n  w: 2px;\n}\n", compile("a { w: @w; }\n@w: 1px;\n@w: 2px;"));
        }

        @Test
        @DisplayName("局部变量遮蔽全局变量")
        void testScope() {
            assertEquals("a {\n  w: 2;\n}\nb {\n  w: 1;\n}\n",
                    compile("@w: 1;\na { @w: 2; w: @w; }\nb { w: @w; }"));
        }

        @Test
        @DisplayName("嵌套选择器展开为后代选择器")
        void testNesting() {
            assertEquals(".a .b {\n  color: red;\n}\n", compile(".a { .b { color: red; } }"));
        }

        @Test
        @DisplayName("& 引用父选择器")
        void testParentSelector() {
            assertEquals(".a:hover {\n  x: 1;\n}\n", compile(".a { &:hover { x: 1; } }"));
        }

        @Test
        @DisplayName("父规则的声明先于子规则输出")
        void testDeclarationsBeforeChildren() {
            assertEquals(".a {\n  color: red;\n}\n.a .b {\n  color: blue;\n}\n",
                    compile(".a { color: red; .b { color: blue; } }"));
        }

        @Test
        @DisplayName("选择器插值")
        void testSelectorInterpolation() {
            assertEquals(".btn-primary {\n  x: 1;\n}\n", compile("@name: primary;\n.btn-@{name} { x: 1; }"));
        }
    }

    // ================================================================
    // 运算
    // ================================================================

    @Nested
    @DisplayName("运算")
    class OperationTests {

        @Test
        @DisplayName("括号内的算术运算保留单位")
        void testArithmetic() {
            assertEquals("a {\n  width: 30px;\n}\n", compile("a { width: (10px + 5) * 2; }"));
        }

        @Test
        @DisplayName("parens-division 模式下括号外的除法原样输出")
        void testDivisionOutsideParens() {
            assertEquals("a {\n  w: 10px / 2;\n  h: 5px;\n}\n", compile("a { w: 10px / 2; h: (10px / 2); }"));
        }

        @Test
        @DisplayName("非严格单位时取第一个操作数的单位")
        void testLooseUnits() {
            assertEquals("a {\n  w: 5px;\n}\n", compile("a { w: 2px + 3em; }"));
        }

        @Test
        @DisplayName("严格单位时不兼容单位报错")
        void testStrictUnits() {
            CompileOptions options = new CompileOptions();
            options.setStrictUnits(true);
            LessException e = assertThrows(LessException.class,
                    () -> compile("a { w: 2px + 3em; }", options));
            assertEquals(ErrorKind.OPERATION, e.getKind());
            assertTrue(e.getRawMessage().startsWith("Incompatible units"));
        }

        @Test
        @DisplayName("浮点误差在输出时消除")
        void testPrecision() {
            assertEquals("a {\n  w: 0.3;\n}\n", compile("a { w: (0.1 + 0.2); }"));
        }
    }

    // ================================================================
    // Mixin 与守卫
    // ================================================================

    @Nested
    @DisplayName("Mixin 与守卫")
    class MixinTests {

        @Test
        @DisplayName("带默认参数的 mixin 不输出定义")
        void testParametricMixin() {
            assertEquals("a {\n  border: 2px;\n}\nb {\n  border: 1px;\n}\n",
                    compile(".m(@a: 1px) { border: @a; }\na { .m(2px); }\nb { .m(); }"));
        }

        @Test
        @DisplayName("普通规则集可作为 mixin 调用")
        void testRulesetAsMixin() {
            assertEquals(".b {\n  c: d;\n}\na {\n  c: d;\n}\n", compile(".b { c: d; }\na { .b(); }"));
        }

        @Test
        @DisplayName("守卫与 default() 选择分支")
        void testGuards() {
            String less = ".m(@x) when (@x > 5) { big: @x; }\n"
                    + ".m(@x) when (default()) { small: @x; }\n"
                    + "a { .m(10); }\nb { .m(1); }";
            assertEquals("a {\n  big: 10;\n}\nb {\n  small: 1;\n}\n", compile(less));
        }

        @Test
        @DisplayName("!important 传递到 mixin 的所有声明")
        void testImportantMixin() {
            assertEquals("a {\n  c: d !important;\n}\n", compile(".m() { c: d; }\na { .m() !important; }"));
        }

        @Test
        @DisplayName("递归 mixin 实现循环")
        void testRecursiveLoop() {
            String less = ".loop(@i) when (@i > 0) { .w-@{i} { width: (@i * 10px); } .loop(@i - 1); }\n"
                    + ".loop(2);";
            assertEquals(".w-2 {\n  width: 20px;\n}\n.w-1 {\n  width: 10px;\n}\n", compile(less));
        }

        @Test
        @DisplayName("... 把列表展开为多个位置参数")
        void testArgumentExpansion() {
            assertEquals("a {\n  r: 1 2 3;\n}\n",
                    compile(".m(@a, @b, @c) { r: @a @b @c; }\n@x: 1, 2, 3;\na { .m(@x...); }"));
        }

        @Test
        @DisplayName("多个守卫同时成立时按声明顺序全部输出")
        void testGuardFanOut() {
            String less = ".m(@x) when (@x > 0) { a: 1; }\n"
                    + ".m(@x) when (@x > 5) { b: 2; }\n"
                    + "x { .m(10); }\ny { .m(1); }";
            assertEquals("x {\n  a: 1;\n  b: 2;\n}\ny {\n  a: 1;\n}\n", compile(less));
        }

        @Test
        @DisplayName("命名空间调用 #ns > .m() 与 #ns.m()")
        void testNamespaceCall() {
            String less = "#ns { .m() { c: d; } }\na { #ns > .m(); }\nb { #ns.m(); }";
            assertEquals("a {\n  c: d;\n}\nb {\n  c: d;\n}\n", compile(less));
        }

        @Test
        @DisplayName("多层命名空间")
        void testNestedNamespace() {
            String less = "#outer { #inner { .m() { e: f; } } }\nc { #outer > #inner > .m(); }";
            assertEquals("c {\n  e: f;\n}\n", compile(less));
        }

        @Test
        @DisplayName("mixin 体优先使用定义处的变量，而不是调用者的局部变量")
        void testClosureScope() {
            String less = "@v: global;\n.m() { r: @v; }\na { @v: local; .m(); }";
            assertEquals("a {\n  r: global;\n}\n", compile(less));
        }

        @Test
        @DisplayName("未定义的 mixin 报 NAME 错误")
        void testUndefinedMixin() {
            LessException e = compileError("a { .nope(); }");
            assertEquals(ErrorKind.NAME, e.getKind());
            assertEquals(".nope is undefined", e.getRawMessage());
        }
    }

    // ================================================================
    // 导入
    // ================================================================

    @Nested
    @DisplayName("导入")
    class ImportTests {

        @Test
        @DisplayName("导入的变量对入口文件可见")
        void testImportVariables() {
            MapImportResolver resolver = new MapImportResolver().add("vars.less", "@c: blue;");
            CompileResult result = LessCompiler.builder().resolver(resolver).build()
                    .compile("@import 'vars';\na { color: @c; }", "main.less");
            assertEquals("a {\n  color: blue;\n}\n", result.getCss());
            assertThat(result.getImportedFiles()).containsExactly("vars.less");
        }

        @Test
        @DisplayName("reference 导入只输出被使用的部分")
        void testReferenceImport() {
            MapImportResolver resolver = new MapImportResolver().add("lib.less", ".x { c: d; }\n.y { e: f; }");
            assertEquals("a {\n  c: d;\n}\n", compileWith(resolver, "@import (reference) 'lib';\na { .x(); }"));
        }

        @Test
        @DisplayName("同一文件默认只导入一次")
        void testImportOnce() {
            MapImportResolver resolver = new MapImportResolver().add("a.less", ".a { x: 1; }");
            assertEquals(".a {\n  x: 1;\n}\n", compileWith(resolver, "@import 'a';\n@import 'a';"));
        }

        @Test
        @DisplayName("找不到文件时报 File 错误")
        void testMissingImport() {
            LessException e = assertThrows(LessException.class,
                    () -> compileWith(new MapImportResolver(), "@import 'missing';"));
            assertEquals(ErrorKind.IMPORT, e.getKind());
            assertTrue(e.getRawMessage().contains("wasn't found"));
            assertEquals("main.less", e.getFilename());
        }

        @Test
        @DisplayName("optional 导入找不到文件时忽略")
        void testOptionalImport() {
            assertEquals("a {\n  x: 1;\n}\n", compileWith(new MapImportResolver(),
                    "@import (optional) 'missing';\na { x: 1; }"));
        }
    }

    // ================================================================
    // @media 冒泡、extend 与分离规则集
    // ================================================================

    @Nested
    @DisplayName("@media、extend 与分离规则集")
    class StructureTests {

        @Test
        @DisplayName("嵌套的 @media 冒泡到顶层")
        void testMediaBubbling() {
            assertEquals(".a {\n  color: red;\n}\n@media screen {\n  .a {\n    color: blue;\n  }\n}\n",
                    compile(".a { color: red; @media screen { color: blue; } }"));
        }

        @Test
        @DisplayName("嵌套 @media 合并为 and 连接的单个查询")
        void testNestedMediaPermutation() {
            String less = ".b { @media (min-width:1px) { @media (max-width:2px) { .a { color: red; } } } }";
            assertEquals("@media (min-width: 1px) and (max-width: 2px) {\n  .b .a {\n    color: red;\n  }\n}\n",
                    compile(less));
        }

        @Test
        @DisplayName("@container 冒泡到顶层")
        void testContainerBubbling() {
            assertEquals("@container (min-width: 10px) {\n  .a {\n    color: red;\n  }\n}\n",
                    compile(".a { @container (min-width: 10px) { color: red; } }"));
        }

        @Test
        @DisplayName("压缩模式下的 @media")
        void testCompressedMedia() {
            CompileOptions options = new CompileOptions();
            options.setCompress(true);
            assertEquals("@media screen{.a{color:blue}}",
                    compile(".a { @media screen { color: blue; } }", options));
        }

        @Test
        @DisplayName("没有声明的规则集不输出")
        void testEmptyRulesetElision() {
            assertEquals("d {\n  x: 1;\n}\n", compile("a { }\nb { .c { } }\nd { x: 1; }"));
        }

        @Test
        @DisplayName("相互 extend 时每个选择器只出现一次")
        void testCircularExtend() {
            assertEquals(".a,\n.b {\n  x: 1;\n}\n.b,\n.a {\n  y: 2;\n}\n",
                    compile(".a:extend(.b) { x: 1; }\n.b:extend(.a) { y: 2; }"));
        }

        @Test
        @DisplayName("同一源码多次编译输出完全一致")
        void testDeterminism() {
            String less = "@c: red;\n.m(@x) when (@x > 0) { w: @x; }\n"
                    + ".a { color: @c; .m(2); @media print { color: blue; } }\n"
                    + ".b:extend(.a) {}\n.c { &:hover { x: 1; } }";
            LessCompiler compiler = LessCompiler.create();
            String first = compiler.compile(less, "main.less").getCss();
            assertEquals(first, compiler.compile(less, "main.less").getCss());
            assertEquals(first, LessCompiler.create().compile(less, "main.less").getCss());
            assertThat(first).contains("@media print").doesNotContain("@@");
        }

        @Test
        @DisplayName("extend 把选择器追加到匹配的规则")
        void testExtend() {
            assertEquals(".a,\n.b {\n  color: red;\n}\n", compile(".a { color: red; }\n.b:extend(.a) {}"));
        }

        @Test
        @DisplayName("extend all 替换复合选择器中的匹配部分")
        void testExtendAll() {
            assertEquals(".x.y,\n.z.y {\n  c: d;\n}\n", compile(".x.y { c: d; }\n.z:extend(.x all) {}"));
        }

        @Test
        @DisplayName("分离规则集调用")
        void testDetachedRuleset() {
            assertEquals("a {\n  color: red;\n}\n", compile("@dr: { color: red; };\na { @dr(); }"));
        }

        @Test
        @DisplayName("属性合并")
        void testMerge() {
            assertEquals("a {\n  background: url(1.png), url(2.png);\n  transform: scale(2) rotate(15deg);\n}\n",
                    compile("a { background+: url(1.png); background+: url(2.png);"
                            + " transform+_: scale(2); transform+_: rotate(15deg); }"));
        }
    }

    // ================================================================
    // 函数
    // ================================================================

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("数学与单位函数")
        void testMathFunctions() {
            assertEquals("a {\n  p: 50%;\n  u: 5px;\n  r: 1.7;\n}\n",
                    compile("a { p: percentage(0.5); u: unit(5, px); r: round(1.67, 1); }"));
        }

        @Test
        @DisplayName("颜色函数")
        void testColorFunctions() {
            assertEquals("a {\n  c: #1a1a1a;\n}\n", compile("a { c: lighten(#000, 10%); }"));
        }

        @Test
        @DisplayName("列表函数")
        void testListFunctions() {
            assertEquals("a {\n  n: 3;\n  e: b;\n}\n", compile("@l: a b c;\na { n: length(@l); e: extract(@l, 2); }"));
        }

        @Test
        @DisplayName("if 只求值被选中的分支")
        void testIf() {
            assertEquals("a {\n  v: yes;\n}\n", compile("a { v: if((1 > 0), yes, @undefined); }"));
        }

        @Test
        @DisplayName("each 遍历列表")
        void testEach() {
            String less = "@list: a, b;\neach(@list, { .sel-@{value} { x: @index; } });";
            assertEquals(".sel-a {\n  x: 1;\n}\n.sel-b {\n  x: 2;\n}\n", compile(less));
        }

        @Test
        @DisplayName("宿主函数覆盖同名的内置函数")
        void testHostFunction() {
            LessCompiler compiler = LessCompiler.builder()
                    .function("double", (ctx, args) -> {
                        Dimension d = (Dimension) args.get(0);
                        return new Dimension(d.getValue() * 2, d.getUnit());
                    })
                    .build();
            assertEquals("a {\n  w: 8px;\n}\n", compiler.compile("a { w: double(4px); }").getCss());
        }

        @Test
        @DisplayName("svg-gradient 生成 SVG data URI")
        void testSvgGradient() {
            String css = compile("a { b: svg-gradient(to right, red, green 30%, blue); }");
            assertThat(css)
                    .startsWith("a {\n  b: url('data:image/svg+xml,%3Csvg%20xmlns%3D%22http%3A%2F%2Fwww.w3.org%2F2000%2Fsvg%22")
                    .contains("x2%3D%22100%25%22")
                    .contains("%3Cstop%20offset%3D%220%25%22%20stop-color%3D%22%23ff0000%22%2F%3E")
                    .contains("%3Cstop%20offset%3D%2230%25%22%20stop-color%3D%22%23008000%22%2F%3E")
                    .contains("%3Cstop%20offset%3D%22100%25%22%20stop-color%3D%22%230000ff%22%2F%3E")
                    .endsWith("%3C%2Fsvg%3E');\n}\n");
        }

        @Test
        @DisplayName("svg-gradient 方向不合法时报参数错误")
        void testSvgGradientDirection() {
            LessException e = compileError("a { b: svg-gradient(to left, red, blue); }");
            assertEquals(ErrorKind.ARGUMENT, e.getKind());
            assertThat(e.getRawMessage()).contains("svg-gradient direction must be");
        }

        @Test
        @DisplayName("data-uri 内联文件内容")
        void testDataUri() {
            MapImportResolver resolver = new MapImportResolver()
                    .add("img/dot.svg", "<svg></svg>")
                    .add("img/dot.png", new byte[]{1, 2, 3})
                    .add("note.txt", "hi");
            String less = "a { s: data-uri('img/dot.svg'); p: data-uri('img/dot.png#frag');"
                    + " t: data-uri('text/plain;base64', 'note.txt'); }";
            assertEquals("a {\n"
                    + "  s: url(\"data:image/svg+xml,%3Csvg%3E%3C%2Fsvg%3E\");\n"
                    + "  p: url(\"data:image/png;base64,AQID#frag\");\n"
                    + "  t: url(\"data:text/plain;base64,aGk=\");\n"
                    + "}\n", compileWith(resolver, less));
        }

        @Test
        @DisplayName("data-uri 找不到文件时退回普通 url()")
        void testDataUriFallback() {
            assertEquals("a {\n  b: url(\"missing.png\");\n}\n",
                    compileWith(new MapImportResolver(), "a { b: data-uri(\"missing.png\"); }"));
        }

        @Test
        @DisplayName("image-size 读取图片尺寸")
        void testImageSize() throws IOException {
            BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            ImageIO.write(image, "png", png);
            MapImportResolver resolver = new MapImportResolver()
                    .add("pic.png", png.toByteArray())
                    .add("icon.svg", "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"40\" height=\"20px\"></svg>");
            String less = "a { s: image-size('pic.png'); w: image-width('pic.png'); h: image-height('pic.png');"
                    + " v: image-size('icon.svg'); }";
            assertEquals("a {\n  s: 3px 2px;\n  w: 3px;\n  h: 2px;\n  v: 40px 20px;\n}\n",
                    compileWith(resolver, less));
        }

        @Test
        @DisplayName("image-size 找不到文件时报导入错误")
        void testImageSizeMissing() {
            LessException e = assertThrows(LessException.class,
                    () -> compileWith(new MapImportResolver(), "a { w: image-width('nope.png'); }"));
            assertEquals(ErrorKind.IMPORT, e.getKind());
            assertThat(e.getRawMessage()).contains("wasn't found");
        }

        @Test
        @DisplayName("未知函数原样输出")
        void testUnknownFunction() {
            assertEquals("a {\n  w: foo(1, 2);\n}\n", compile("a { w: foo(1, 2); }"));
        }
    }

    // ================================================================
    // 选项
    // ================================================================

    @Nested
    @DisplayName("选项")
    class OptionTests {

        @Test
        @DisplayName("压缩输出")
        void testCompress() {
            CompileOptions options = new CompileOptions();
            options.setCompress(true);
            assertEquals("a{x:1px;y:2px}b{z:3}", compile("a { x: 1px; y: 2px; }\nb { z: 3; }", options));
        }

        @Test
        @DisplayName("globalVars 可被样式表覆盖")
        void testGlobalVars() {
            CompileOptions options = new CompileOptions();
            Map<String, String> vars = new LinkedHashMap<>();
            vars.put("c", "red");
            vars.put("@d", "blue;");
            options.setGlobalVars(vars);
            assertEquals("a {\n  color: red;\n  bg: green;\n}\n",
                    compile("@d: green;\na { color: @c; bg: @d; }", options));
        }

        @Test
        @DisplayName("modifyVars 覆盖样式表中的变量")
        void testModifyVars() {
            CompileOptions options = new CompileOptions();
            options.setModifyVars(Collections.singletonMap("c", "blue"));
            assertEquals("a {\n  color: blue;\n}\n", compile("@c: red;\na { color: @c; }", options));
        }

        @Test
        @DisplayName("变量表序列化")
        void testSerializeVariables() {
            Map<String, String> vars = new LinkedHashMap<>();
            vars.put("a", "1px");
            vars.put("@b", "red;");
            assertEquals("@a: 1px;\n@b: red;\n", LessCompiler.serializeVariables(vars));
        }

        @Test
        @DisplayName("开启 sourceMap 时记录映射")
        void testSourceMappings() {
            CompileOptions options = new CompileOptions();
            options.setSourceMap(true);
            CompileResult result = LessCompiler.builder().options(options).build()
                    .compile("a {\n  color: red;\n}", "main.less");
            List<SourceMapping> mappings = result.getMappings();
            assertFalse(mappings.isEmpty());
            assertEquals("main.less", mappings.get(0).getSource());
            assertEquals(0, mappings.get(0).getOriginalLine());
            assertEquals(0, mappings.get(0).getGeneratedLine());
        }

        @Test
        @DisplayName("未开启 sourceMap 时没有映射")
        void testNoSourceMappings() {
            assertTrue(LessCompiler.create().compile("a { x: 1; }").getMappings().isEmpty());
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("未定义变量报 NAME 错误并给出行列")
        void testUndefinedVariable() {
            LessException e = compileError("a {\n  color: @nope;\n}");
            assertEquals(ErrorKind.NAME, e.getKind());
            assertEquals("variable @nope is undefined", e.getRawMessage());
            assertEquals(2, e.getLine());
            assertEquals("main.less", e.getFilename());
        }

        @Test
        @DisplayName("缺少右花括号报 PARSE 错误")
        void testUnclosedBlock() {
            LessException e = compileError("a { color: red;");
            assertEquals(ErrorKind.PARSE, e.getKind());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("根级声明报 SYNTAX 错误")
        void testRootDeclaration() {
            LessException e = compileError("color: red;");
            assertEquals(ErrorKind.SYNTAX, e.getKind());
            assertTrue(e.getRawMessage().startsWith("Properties must be inside selector blocks"));
        }

        @Test
        @DisplayName("错误消息包含源码行与定位")
        void testMessageRendering() {
            LessException e = compileError("a { w: @x; }");
            assertThat(e.getMessage())
                    .startsWith("NameError: variable @x is undefined")
                    .contains("--> main.less:1:8")
                    .contains("1 | a { w: @x; }");
        }
    }
}
