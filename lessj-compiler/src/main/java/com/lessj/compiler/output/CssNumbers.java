package com.lessj.compiler.output;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 数值的 CSS 文本形式
 */
public final class CssNumbers {
    /** 输出阶段保留的小数位数 */
    public static final int PRECISION = 8;

    private CssNumbers() {
    }

    /**
     * 舍入到 {@link #PRECISION} 位小数，消除 0.1 + 0.2 一类的浮点误差
     */
    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value + 2e-16).setScale(PRECISION, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 最短的十进制形式：整数不带小数点，极小的数不用科学计数法
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        if (Math.abs(value) < 0.000001) {
            String fixed = new BigDecimal(value).setScale(20, RoundingMode.HALF_UP).toPlainString();
            int end = fixed.length();
            while (end > 0 && fixed.charAt(end - 1) == '0') {
                end--;
            }
            return fixed.substring(0, end);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
