package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Color;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Url;
import com.lessj.compiler.output.CssNumbers;

import java.util.List;

/**
 * svg-gradient：把渐变描述编码为 SVG data URI
 */
final class SvgFunctions {
    private static final String USAGE = "svg-gradient expects direction, start_color [start_position], "
            + "[color position,]..., end_color [end_position] or direction, color list";

    private SvgFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addBuiltin("svg-gradient", SvgFunctions::svgGradient);
    }

    private static Node svgGradient(FunctionContext ctx, List<Node> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(USAGE);
        }
        Node direction = args.get(0);
        String directionValue = direction instanceof Quoted
                ? ((Quoted) direction).getValue()
                : ctx.toCss(direction);

        List<Node> stops;
        if (args.size() == 2) {
            stops = Args.items(args.get(1));
            if (stops.size() < 2) {
                throw new IllegalArgumentException(USAGE);
            }
        } else if (args.size() < 3) {
            throw new IllegalArgumentException(USAGE);
        } else {
            stops = args.subList(1, args.size());
        }

        String gradientType = "linear";
        String rectangleDimension = "x=\"0\" y=\"0\" width=\"1\" height=\"1\"";
        String gradientDirection;
        switch (directionValue) {
            case "to bottom":
                gradientDirection = "x1=\"0%\" y1=\"0%\" x2=\"0%\" y2=\"100%\"";
                break;
            case "to right":
                gradientDirection = "x1=\"0%\" y1=\"0%\" x2=\"100%\" y2=\"0%\"";
                break;
            case "to bottom right":
                gradientDirection = "x1=\"0%\" y1=\"0%\" x2=\"100%\" y2=\"100%\"";
                break;
            case "to top right":
                gradientDirection = "x1=\"0%\" y1=\"100%\" x2=\"100%\" y2=\"0%\"";
                break;
            case "ellipse":
            case "ellipse at center":
                gradientType = "radial";
                gradientDirection = "cx=\"50%\" cy=\"50%\" r=\"75%\"";
                rectangleDimension = "x=\"-50\" y=\"-50\" width=\"101\" height=\"101\"";
                break;
            default:
                throw new IllegalArgumentException("svg-gradient direction must be 'to bottom', 'to right',"
                        + " 'to bottom right', 'to top right' or 'ellipse at center'");
        }

        StringBuilder svg = new StringBuilder();
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 1 1\"><")
                .append(gradientType).append("Gradient id=\"g\" ").append(gradientDirection).append('>');
        for (int i = 0; i < stops.size(); i++) {
            Node stop = stops.get(i);
            Node color = stop;
            Node position = null;
            if (stop instanceof Expression) {
                List<Node> parts = ((Expression) stop).getValue();
                color = parts.isEmpty() ? null : parts.get(0);
                position = parts.size() > 1 ? parts.get(1) : null;
            }
            boolean edge = i == 0 || i == stops.size() - 1;
            if (!(color instanceof Color)
                    || (position != null && !(position instanceof Dimension))
                    || (!edge && position == null)) {
                throw new IllegalArgumentException(USAGE);
            }
            Color c = (Color) color;
            String offset = position != null ? ctx.toCss(position) : (i == 0 ? "0%" : "100%");
            svg.append("<stop offset=\"").append(offset)
                    .append("\" stop-color=\"").append(c.toRgbHex()).append('"');
            if (c.getAlpha() < 1) {
                svg.append(" stop-opacity=\"").append(CssNumbers.format(c.getAlpha())).append('"');
            }
            svg.append("/>");
        }
        svg.append("</").append(gradientType).append("Gradient><rect ")
                .append(rectangleDimension).append(" fill=\"url(#g)\" /></svg>");

        String uri = "data:image/svg+xml," + StringFunctions.encode(svg.toString(), StringFunctions.COMPONENT_RESERVED);
        return new Url(new Quoted("'", uri, false, ctx.getIndex(), ctx.getFileInfo()),
                ctx.getIndex(), ctx.getFileInfo(), true);
    }
}
