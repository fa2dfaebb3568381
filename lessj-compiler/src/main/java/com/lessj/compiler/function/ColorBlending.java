package com.lessj.compiler.function;

import com.lessj.compiler.ast.value.Color;

import java.util.function.DoubleBinaryOperator;

/**
 * 颜色混合模式（W3C compositing 定义），逐通道计算后按透明度合成
 */
final class ColorBlending {

    private ColorBlending() {
    }

    static void register(FunctionRegistry registry) {
        blend(registry, "multiply", ColorBlending::multiply);
        blend(registry, "screen", ColorBlending::screen);
        blend(registry, "overlay", ColorBlending::overlay);
        blend(registry, "softlight", (cb, cs) -> {
            double d = 1;
            double e = cb;
            if (cs > 0.5) {
                e = 1;
                d = cb > 0.25 ? Math.sqrt(cb) : ((16 * cb - 12) * cb + 4) * cb;
            }
            return cb - (1 - 2 * cs) * e * (d - cb);
        });
        blend(registry, "hardlight", (cb, cs) -> overlay(cs, cb));
        blend(registry, "difference", (cb, cs) -> Math.abs(cb - cs));
        blend(registry, "exclusion", (cb, cs) -> cb + cs - 2 * cb * cs);
        blend(registry, "average", (cb, cs) -> (cb + cs) / 2);
        blend(registry, "negation", (cb, cs) -> 1 - Math.abs(cb + cs - 1));
    }

    private static void blend(FunctionRegistry registry, String name, DoubleBinaryOperator mode) {
        registry.addBuiltin(name, (ctx, args) ->
                blend(mode, Args.color(Args.arg(args, 0)), Args.color(Args.arg(args, 1))));
    }

    static Color blend(DoubleBinaryOperator mode, Color backdrop, Color source) {
        double ab = backdrop.getAlpha();
        double as = source.getAlpha();
        double ar = as + ab * (1 - as);
        double[] rgb = new double[3];
        for (int i = 0; i < 3; i++) {
            double cb = backdrop.channel(i) / 255;
            double cs = source.channel(i) / 255;
            double cr = mode.applyAsDouble(cb, cs);
            if (ar != 0) {
                cr = (as * cs + ab * (cb - as * (cb + cs - cr))) / ar;
            }
            rgb[i] = cr * 255;
        }
        return new Color(rgb, ar, null);
    }

    private static double multiply(double cb, double cs) {
        return cb * cs;
    }

    private static double screen(double cb, double cs) {
        return cb + cs - cb * cs;
    }

    private static double overlay(double cb, double cs) {
        cb *= 2;
        return cb <= 1 ? multiply(cb, cs) : screen(cb - 1, cs);
    }
}
