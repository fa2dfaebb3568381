package com.lessj.compiler.output;

import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 数值与颜色的输出格式
 */
class CssEmitterTest {

    @Nested
    @DisplayName("CssNumbers")
    class NumberTests {

        @Test
        @DisplayName("整数不带小数点")
        void testInteger() {
            assertEquals("5", CssNumbers.format(5.0));
            assertEquals("-3", CssNumbers.format(-3.0));
        }

        @Test
        @DisplayName("小数去掉末尾的 0")
        void testFraction() {
            assertEquals("0.25", CssNumbers.format(0.25));
            assertEquals("1.5", CssNumbers.format(1.50));
        }

        @Test
        @DisplayName("舍入消除浮点误差")
        void testRound() {
            assertEquals(0.3, CssNumbers.round(0.1 + 0.2));
            assertEquals(0.33333333, CssNumbers.round(1.0 / 3));
        }
    }

    @Nested
    @DisplayName("Dimension")
    class DimensionTests {

        @Test
        @DisplayName("普通输出")
        void testPlain() {
            assertEquals("0.5px", CssEmitter.toCss(new Dimension(0.5, "px"), false, false));
        }

        @Test
        @DisplayName("压缩时省略前导 0 与长度单位的 0")
        void testCompressed() {
            assertEquals(".5px", CssEmitter.toCss(new Dimension(0.5, "px"), true, false));
            assertEquals("0", CssEmitter.toCss(new Dimension(0, "px"), true, false));
            assertEquals("0%", CssEmitter.toCss(new Dimension(0, "%"), true, false));
        }
    }

    @Nested
    @DisplayName("Color")
    class ColorTests {

        @Test
        @DisplayName("不透明颜色输出十六进制")
        void testHex() {
            assertEquals("#ff0000", CssEmitter.toCss(new Color(new double[]{255, 0, 0}, 1, null), false, false));
        }

        @Test
        @DisplayName("压缩时缩写十六进制")
        void testShortHex() {
            assertEquals("#f00", CssEmitter.toCss(new Color(new double[]{255, 0, 0}, 1, null), true, false));
            assertEquals("#ff0001", CssEmitter.toCss(new Color(new double[]{255, 0, 1}, 1, null), true, false));
        }

        @Test
        @DisplayName("半透明颜色输出 rgba()")
        void testRgba() {
            assertEquals("rgba(255, 0, 0, 0.5)",
                    CssEmitter.toCss(new Color(new double[]{255, 0, 0}, 0.5, null), false, false));
        }
    }
}
