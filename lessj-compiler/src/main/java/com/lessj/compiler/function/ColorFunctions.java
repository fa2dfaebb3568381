package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Keyword;
import com.lessj.compiler.ast.value.Operation;
import com.lessj.compiler.ast.value.Quoted;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 颜色定义、通道与颜色运算函数
 *
 * <p>参数不是数值的 rgb()/hsl() 调用（例如包含 var()）不做处理，按原样输出。</p>
 */
final class ColorFunctions {
    private static final Pattern HEX = Pattern.compile("^#([A-Fa-f0-9]{8}|[A-Fa-f0-9]{6}|[A-Fa-f0-9]{3,4})$");

    private ColorFunctions() {
    }

    static void register(FunctionRegistry registry) {
        // ---- 定义 ----
        registry.addBuiltin("rgb", (ctx, args) -> rgb(args));
        registry.addBuiltin("rgba", (ctx, args) ->
                rgba(Args.arg(args, 0), Args.arg(args, 1), Args.arg(args, 2), Args.arg(args, 3)));
        registry.addBuiltin("hsl", (ctx, args) -> hsl(args));
        registry.addBuiltin("hsla", (ctx, args) ->
                hsla(Args.arg(args, 0), Args.arg(args, 1), Args.arg(args, 2), Args.arg(args, 3)));
        registry.addBuiltin("hsv", (ctx, args) -> hsva(Args.arg(args, 0), Args.arg(args, 1), Args.arg(args, 2), 1));
        registry.addBuiltin("hsva", (ctx, args) -> hsva(Args.arg(args, 0), Args.arg(args, 1), Args.arg(args, 2),
                Args.number(Args.required(args, 3, "fourth"))));
        registry.addBuiltin("argb", (ctx, args) -> new Anonymous(Args.color(Args.arg(args, 0)).toArgb()));
        registry.addBuiltin("color", (ctx, args) -> color(Args.required(args, 0, "first")));

        // ---- 通道 ----
        registry.addBuiltin("hue", (ctx, args) -> new Dimension(hslOf(args)[0]));
        registry.addBuiltin("saturation", (ctx, args) -> new Dimension(hslOf(args)[1] * 100, "%"));
        registry.addBuiltin("lightness", (ctx, args) -> new Dimension(hslOf(args)[2] * 100, "%"));
        registry.addBuiltin("hsvhue", (ctx, args) -> new Dimension(hsvOf(args)[0]));
        registry.addBuiltin("hsvsaturation", (ctx, args) -> new Dimension(hsvOf(args)[1] * 100, "%"));
        registry.addBuiltin("hsvvalue", (ctx, args) -> new Dimension(hsvOf(args)[2] * 100, "%"));
        registry.addBuiltin("red", (ctx, args) -> new Dimension(Args.color(Args.arg(args, 0)).channel(0)));
        registry.addBuiltin("green", (ctx, args) -> new Dimension(Args.color(Args.arg(args, 0)).channel(1)));
        registry.addBuiltin("blue", (ctx, args) -> new Dimension(Args.color(Args.arg(args, 0)).channel(2)));
        registry.addBuiltin("alpha", (ctx, args) -> new Dimension(hslOf(args)[3]));
        registry.addBuiltin("luma", (ctx, args) -> {
            Color c = Args.color(Args.arg(args, 0));
            return new Dimension(c.luma() * c.getAlpha() * 100, "%");
        });
        registry.addBuiltin("luminance", (ctx, args) -> {
            Color c = Args.color(Args.arg(args, 0));
            double luminance = 0.2126 * c.channel(0) / 255 + 0.7152 * c.channel(1) / 255 + 0.0722 * c.channel(2) / 255;
            return new Dimension(luminance * c.getAlpha() * 100, "%");
        });

        // ---- 运算 ----
        registry.addBuiltin("saturate", (ctx, args) -> adjust(args, 1, 1));
        registry.addBuiltin("desaturate", (ctx, args) -> adjust(args, 1, -1));
        registry.addBuiltin("lighten", (ctx, args) -> adjust(args, 2, 1));
        registry.addBuiltin("darken", (ctx, args) -> adjust(args, 2, -1));
        registry.addBuiltin("fadein", (ctx, args) -> adjust(args, 3, 1));
        registry.addBuiltin("fadeout", (ctx, args) -> adjust(args, 3, -1));
        registry.addBuiltin("fade", (ctx, args) -> {
            Color c = Args.color(Args.arg(args, 0));
            double[] hsl = c.toHsl();
            hsl[3] = Args.clamp(Args.amount(Args.required(args, 1, "second")) / 100);
            return fromHsl(c, hsl);
        });
        registry.addBuiltin("spin", (ctx, args) -> {
            Color c = Args.color(Args.arg(args, 0));
            double[] hsl = c.toHsl();
            double hue = (hsl[0] + Args.amount(Args.required(args, 1, "second"))) % 360;
            hsl[0] = hue < 0 ? 360 + hue : hue;
            return fromHsl(c, hsl);
        });
        registry.addBuiltin("mix", (ctx, args) -> mix(Args.color(Args.arg(args, 0)), Args.color(Args.arg(args, 1)),
                Args.arg(args, 2)));
        registry.addBuiltin("tint", (ctx, args) ->
                mix(white(), Args.color(Args.arg(args, 0)), Args.arg(args, 1)));
        registry.addBuiltin("shade", (ctx, args) ->
                mix(black(), Args.color(Args.arg(args, 0)), Args.arg(args, 1)));
        registry.addBuiltin("greyscale", (ctx, args) -> {
            Color c = Args.color(Args.arg(args, 0));
            double[] hsl = c.toHsl();
            hsl[1] = 0;
            return fromHsl(c, hsl);
        });
        registry.addBuiltin("contrast", (ctx, args) -> contrast(args));
    }

    // ============ 定义 ============

    private static Node rgb(List<Node> args) {
        Node r = Args.arg(args, 0);
        Node g = Args.arg(args, 1);
        Node b = Args.arg(args, 2);
        Node a = new Dimension(1);
        // rgb(1 2 3 / 0.5)
        if (r instanceof Expression && ((Expression) r).getValue().size() >= 3) {
            List<Node> parts = ((Expression) r).getValue();
            r = parts.get(0);
            g = parts.get(1);
            b = parts.get(2);
            if (b instanceof Operation && "/".equals(((Operation) b).getOp())) {
                a = ((Operation) b).getRight();
                b = ((Operation) b).getLeft();
            }
        }
        Color color = rgba(r, g, b, a);
        return color == null ? null : color.withValue("rgb");
    }

    private static Color rgba(Node r, Node g, Node b, Node a) {
        if (r instanceof Color) {
            Color c = (Color) r;
            double alpha = g != null ? Args.number(g) : c.getAlpha();
            return new Color(c.getRgb(), alpha, "rgba");
        }
        if (!isNumber(r) || !isNumber(g) || !isNumber(b) || !isNumber(a)) {
            return null;
        }
        double[] rgb = {Args.scaled(r, 255), Args.scaled(g, 255), Args.scaled(b, 255)};
        return new Color(rgb, Args.number(a), "rgba");
    }

    private static Node hsl(List<Node> args) {
        Node h = Args.arg(args, 0);
        Node s = Args.arg(args, 1);
        Node l = Args.arg(args, 2);
        Node a = new Dimension(1);
        if (h instanceof Expression && ((Expression) h).getValue().size() >= 3) {
            List<Node> parts = ((Expression) h).getValue();
            h = parts.get(0);
            s = parts.get(1);
            l = parts.get(2);
            if (l instanceof Operation && "/".equals(((Operation) l).getOp())) {
                a = ((Operation) l).getRight();
                l = ((Operation) l).getLeft();
            }
        }
        Color color = hsla(h, s, l, a);
        return color == null ? null : color.withValue("hsl");
    }

    private static Color hsla(Node h, Node s, Node l, Node a) {
        if (h instanceof Color) {
            Color c = (Color) h;
            double alpha = s != null ? Args.number(s) : c.getAlpha();
            return new Color(c.getRgb(), alpha, "hsla");
        }
        if (!isNumber(h) || !isNumber(s) || !isNumber(l) || !isNumber(a)) {
            return null;
        }
        return hslToColor(Args.number(h), Args.clamp(Args.number(s)), Args.clamp(Args.number(l)),
                Args.clamp(Args.number(a)), "hsla");
    }

    static Color hslToColor(double hue, double s, double l, double a, String form) {
        double h = (hue % 360) / 360;
        double m2 = l <= 0.5 ? l * (s + 1) : l + s - l * s;
        double m1 = l * 2 - m2;
        double[] rgb = {
                hueToChannel(h + 1.0 / 3, m1, m2) * 255,
                hueToChannel(h, m1, m2) * 255,
                hueToChannel(h - 1.0 / 3, m1, m2) * 255
        };
        return new Color(rgb, a, form);
    }

    private static double hueToChannel(double h, double m1, double m2) {
        h = h < 0 ? h + 1 : (h > 1 ? h - 1 : h);
        if (h * 6 < 1) {
            return m1 + (m2 - m1) * h * 6;
        } else if (h * 2 < 1) {
            return m2;
        } else if (h * 3 < 2) {
            return m1 + (m2 - m1) * (2.0 / 3 - h) * 6;
        }
        return m1;
    }

    private static Color hsva(Node hNode, Node sNode, Node vNode, double a) {
        double h = ((Args.number(hNode) % 360) / 360) * 360;
        double s = Args.number(sNode);
        double v = Args.number(vNode);
        int i = (int) Math.floor((h / 60) % 6);
        double f = (h / 60) - i;
        double[] vs = {v, v * (1 - s), v * (1 - f * s), v * (1 - (1 - f) * s)};
        int[][] perm = {{0, 3, 1}, {2, 0, 1}, {1, 0, 3}, {1, 2, 0}, {3, 1, 0}, {0, 1, 2}};
        double[] rgb = {vs[perm[i][0]] * 255, vs[perm[i][1]] * 255, vs[perm[i][2]] * 255};
        return new Color(rgb, a, "rgba");
    }

    private static Color color(Node c) {
        if (c instanceof Quoted && HEX.matcher(((Quoted) c).getValue()).matches()) {
            String value = ((Quoted) c).getValue();
            return Color.fromHex(value.substring(1), value, 0, null);
        }
        if (c instanceof Color) {
            return ((Color) c).withValue(null);
        }
        String text = Args.text(c);
        Color keyword = text == null ? null : Color.fromKeyword(text);
        if (keyword != null) {
            return keyword.withValue(null);
        }
        throw new IllegalArgumentException("argument must be a color keyword or 3|4|6|8 digit hex e.g. #FFF");
    }

    private static boolean isNumber(Node n) {
        return n instanceof Dimension;
    }

    // ============ 通道 ============

    private static double[] hslOf(List<Node> args) {
        return Args.color(Args.arg(args, 0)).toHsl();
    }

    private static double[] hsvOf(List<Node> args) {
        return Args.color(Args.arg(args, 0)).toHsv();
    }

    // ============ 运算 ============

    /**
     * 按 HSL 分量调整：channel 为 1 饱和度、2 亮度、3 透明度；第三个参数为 relative 时按比例调整
     */
    private static Node adjust(List<Node> args, int channel, int sign) {
        Node first = Args.arg(args, 0);
        // filter: saturate(3.2) 之类的 CSS 滤镜函数
        if (channel == 1 && !(first instanceof Color)) {
            return null;
        }
        Color c = Args.color(first);
        double amount = Args.amount(Args.required(args, 1, "second"));
        double[] hsl = c.toHsl();
        Node method = Args.arg(args, 2);
        if (method instanceof Keyword && "relative".equals(((Keyword) method).getValue())) {
            hsl[channel] += sign * hsl[channel] * amount / 100;
        } else {
            hsl[channel] += sign * amount / 100;
        }
        hsl[channel] = Args.clamp(hsl[channel]);
        return fromHsl(c, hsl);
    }

    /** 运算结果沿用原颜色的 rgb/hsl 写法，其余写法输出为 rgb 形式 */
    private static Color fromHsl(Color original, double[] hsl) {
        String form = original.getValue() != null && (original.getValue().startsWith("rgb")
                || original.getValue().startsWith("hsl")) ? original.getValue() : "rgb";
        return hslToColor(hsl[0], hsl[1], hsl[2], hsl[3], form);
    }

    static Color mix(Color color1, Color color2, Node weightArg) {
        double weight = weightArg == null ? 50 : Args.amount(weightArg);
        double p = weight / 100.0;
        double w = p * 2 - 1;
        double a = color1.getAlpha() - color2.getAlpha();
        double w1 = (((w * a == -1) ? w : (w + a) / (1 + w * a)) + 1) / 2.0;
        double w2 = 1 - w1;
        double[] rgb = new double[3];
        for (int i = 0; i < 3; i++) {
            rgb[i] = color1.channel(i) * w1 + color2.channel(i) * w2;
        }
        double alpha = color1.getAlpha() * p + color2.getAlpha() * (1 - p);
        return new Color(rgb, alpha, null);
    }

    private static Node contrast(List<Node> args) {
        Node first = Args.arg(args, 0);
        if (!(first instanceof Color)) {
            return null;
        }
        Color color = (Color) first;
        Color dark = args.size() > 1 ? Args.color(args.get(1)) : black();
        Color light = args.size() > 2 ? Args.color(args.get(2)) : white();
        if (dark.luma() > light.luma()) {
            Color t = light;
            light = dark;
            dark = t;
        }
        double threshold = args.size() > 3 ? Args.number(args.get(3)) : 0.43;
        return color.luma() < threshold ? light : dark;
    }

    private static Color white() {
        return new Color(new double[]{255, 255, 255}, 1, "rgba");
    }

    private static Color black() {
        return new Color(new double[]{0, 0, 0}, 1, "rgba");
    }
}
