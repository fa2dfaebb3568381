package com.lessj.compiler.visitor;

import com.lessj.compiler.LessCompiler;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.rule.Declaration;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.output.CssEmitter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 输出前的 visitor 管线：选择器拼接、extend 与声明合并
 */
class VisitorPipelineTest {

    private static String compile(String less) {
        return LessCompiler.create().compile(less, "test.less").getCss();
    }

    @Nested
    @DisplayName("选择器拼接")
    class JoinTests {

        @Test
        @DisplayName("多个父选择器与子选择器做笛卡尔积")
        void testCartesianProduct() {
            assertEquals(".a .c,\n.b .c {\n  x: 1;\n}\n", compile(".a, .b { .c { x: 1; } }"));
        }

        @Test
        @DisplayName("& 出现多次时逐一替换")
        void testMultipleAmpersands() {
            assertEquals(".a + .a {\n  x: 1;\n}\n", compile(".a { & + & { x: 1; } }"));
        }

        @Test
        @DisplayName("& 放在后面时父选择器移到后面")
        void testTrailingAmpersand() {
            assertEquals(".no-js .a {\n  x: 1;\n}\n", compile(".a { .no-js & { x: 1; } }"));
        }

        @Test
        @DisplayName("& 后缀拼接类名")
        void testAmpersandSuffix() {
            assertEquals(".btn-large {\n  x: 1;\n}\n", compile(".btn { &-large { x: 1; } }"));
        }
    }

    @Nested
    @DisplayName("extend")
    class ExtendTests {

        @Test
        @DisplayName("链式 extend")
        void testChain() {
            assertEquals(".a,\n.b,\n.c {\n  x: 1;\n}\n",
                    compile(".a { x: 1; }\n.b:extend(.a) {}\n.c:extend(.b) {}"));
        }

        @Test
        @DisplayName("规则集内的 &:extend")
        void testRulesetExtend() {
            assertEquals(".a,\n.b {\n  x: 1;\n}\n.b {\n  y: 2;\n}\n",
                    compile(".a { x: 1; }\n.b { &:extend(.a); y: 2; }"));
        }

        @Test
        @DisplayName("@media 内的 extend 只匹配同一 @media 中的规则")
        void testMediaScope() {
            String less = ".a { x: 1; }\n@media print { .a { y: 2; } .b:extend(.a) {} }";
            assertEquals(".a {\n  x: 1;\n}\n@media print {\n  .a,\n  .b {\n    y: 2;\n  }\n}\n", compile(less));
        }

        @Test
        @DisplayName("没有匹配的 extend 记录警告")
        void testUnmatchedWarning() {
            Logger logger = Logger.getLogger(ProcessExtendsVisitor.class.getName());
            List<String> messages = new ArrayList<>();
            Handler handler = new Handler() {
                @Override
                public void publish(LogRecord record) {
                    if (record.getLevel() == Level.WARNING) {
                        messages.add(record.getMessage());
                    }
                }

                @Override
                public void flush() {
                }

                @Override
                public void close() {
                }
            };
            logger.addHandler(handler);
            try {
                compile(".b:extend(.nope) { x: 1; }");
            } finally {
                logger.removeHandler(handler);
            }
            assertEquals(1, messages.size());
            assertEquals("extend '.nope' has no matches", messages.get(0));
        }
    }

    @Nested
    @DisplayName("声明合并")
    class MergeTests {

        private Declaration merging(String name, String value, String merge) {
            return new Declaration(name, new Anonymous(value), null, merge, 0, null, false, false);
        }

        @Test
        @DisplayName("+ 以逗号连接，其余声明保持原位")
        void testCommaMerge() {
            List<Node> rules = new ArrayList<>();
            rules.add(merging("background", "a", "+"));
            rules.add(merging("color", "red", null));
            rules.add(merging("background", "b", "+"));
            ToCssVisitor.mergeRules(rules);

            assertEquals(2, rules.size());
            Declaration merged = (Declaration) rules.get(0);
            assertEquals("background", merged.getName());
            assertEquals("a, b", CssEmitter.toCss(merged.getValue(), false, false));
            assertEquals("color", ((Declaration) rules.get(1)).getName());
        }

        @Test
        @DisplayName("+_ 以空格连接")
        void testSpaceMerge() {
            List<Node> rules = new ArrayList<>();
            rules.add(merging("transform", "scale(2)", "+_"));
            rules.add(merging("transform", "rotate(1deg)", "+_"));
            ToCssVisitor.mergeRules(rules);

            assertEquals(1, rules.size());
            assertEquals("scale(2) rotate(1deg)", CssEmitter.toCss(((Declaration) rules.get(0)).getValue(), false, false));
        }
    }
}
