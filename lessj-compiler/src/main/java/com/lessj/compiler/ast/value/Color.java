package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Locale;

/**
 * 颜色值，内部以 RGB 三通道（0-255，可能越界）加 alpha 表示
 *
 * <p>value 记录原始写法（"#FFF"、"red"）或生成它的函数族（"rgb"、"hsl"），
 * 输出时据此决定使用原文、十六进制还是函数形式。</p>
 */
public final class Color extends Node {
    private final double[] rgb;
    private final double alpha;
    private final String value;

    public Color(double[] rgb, double alpha, String value) {
        this(rgb, alpha, value, 0, null);
    }

    public Color(double[] rgb, double alpha, String value, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        this.rgb = new double[]{rgb[0], rgb[1], rgb[2]};
        this.alpha = alpha;
        this.value = value;
    }

    /**
     * 从 3/4/6/8 位十六进制串（不含 #）构造
     */
    public static Color fromHex(String hex, String originalForm, int index, FileInfo fileInfo) {
        double[] channels = new double[3];
        double a = 1;
        if (hex.length() >= 6) {
            for (int i = 0; i < hex.length() / 2; i++) {
                int c = Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
                if (i < 3) {
                    channels[i] = c;
                } else {
                    a = c / 255.0;
                }
            }
        } else {
            for (int i = 0; i < hex.length(); i++) {
                char ch = hex.charAt(i);
                int c = Integer.parseInt("" + ch + ch, 16);
                if (i < 3) {
                    channels[i] = c;
                } else {
                    a = c / 255.0;
                }
            }
        }
        return new Color(channels, a, originalForm, index, fileInfo);
    }

    /**
     * 颜色关键字（含 transparent），未知关键字返回 null
     */
    public static Color fromKeyword(String keyword) {
        String key = keyword.toLowerCase(Locale.ROOT);
        String hex = NamedColors.hex(key);
        if (hex != null) {
            return fromHex(hex.substring(1), keyword, 0, null);
        }
        if ("transparent".equals(key)) {
            return new Color(new double[]{0, 0, 0}, 0, keyword);
        }
        return null;
    }

    public double[] getRgb() {
        return new double[]{rgb[0], rgb[1], rgb[2]};
    }

    public double channel(int i) {
        return rgb[i];
    }

    public double getAlpha() {
        return alpha;
    }

    /** 原始写法或函数族，可能为 null */
    public String getValue() {
        return value;
    }

    public Color withValue(String newValue) {
        return new Color(rgb, alpha, newValue, getIndex(), getFileInfo());
    }

    public double luma() {
        double r = linear(rgb[0] / 255);
        double g = linear(rgb[1] / 255);
        double b = linear(rgb[2] / 255);
        return 0.2126 * r + 0.7152 * g + 0.0722 * b;
    }

    private static double linear(double c) {
        return c <= 0.03928 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    /**
     * 转换为 HSL，返回 {h(0-360), s(0-1), l(0-1), a}
     */
    public double[] toHsl() {
        double r = rgb[0] / 255, g = rgb[1] / 255, b = rgb[2] / 255;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double h;
        double s;
        double l = (max + min) / 2;
        double d = max - min;
        if (max == min) {
            h = 0;
            s = 0;
        } else {
            s = l > 0.5 ? d / (2 - max - min) : d / (max + min);
            if (max == r) {
                h = (g - b) / d + (g < b ? 6 : 0);
            } else if (max == g) {
                h = (b - r) / d + 2;
            } else {
                h = (r - g) / d + 4;
            }
            h /= 6;
        }
        return new double[]{h * 360, s, l, alpha};
    }

    /**
     * 转换为 HSV，返回 {h(0-360), s(0-1), v(0-1), a}
     */
    public double[] toHsv() {
        double r = rgb[0] / 255, g = rgb[1] / 255, b = rgb[2] / 255;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double h;
        double v = max;
        double d = max - min;
        double s = max == 0 ? 0 : d / max;
        if (max == min) {
            h = 0;
        } else {
            if (max == r) {
                h = (g - b) / d + (g < b ? 6 : 0);
            } else if (max == g) {
                h = (b - r) / d + 2;
            } else {
                h = (r - g) / d + 4;
            }
            h /= 6;
        }
        return new double[]{h * 360, s, v, alpha};
    }

    /** #rrggbb，通道取整并截断到 0-255 */
    public String toRgbHex() {
        return toHex(new double[]{rgb[0], rgb[1], rgb[2]});
    }

    /** #aarrggbb（IE 滤镜格式） */
    public String toArgb() {
        return toHex(new double[]{Math.round(alpha * 255), rgb[0], rgb[1], rgb[2]});
    }

    private static String toHex(double[] values) {
        StringBuilder sb = new StringBuilder("#");
        for (double v : values) {
            long c = clamp(Math.round(v), 255);
            if (c < 16) {
                sb.append('0');
            }
            sb.append(Long.toHexString(c));
        }
        return sb.toString();
    }

    private static long clamp(long v, long max) {
        return Math.min(Math.max(v, 0), max);
    }

    /** 逐通道比较，相等返回 0，否则 null */
    public Integer compareTo(Color other) {
        if (other.rgb[0] == rgb[0] && other.rgb[1] == rgb[1] && other.rgb[2] == rgb[2]
                && other.alpha == alpha) {
            return 0;
        }
        return null;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitColor(this, context);
    }

    @Override
    public String toString() {
        return value != null ? value : toRgbHex();
    }
}
