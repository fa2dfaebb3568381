package com.lessj.compiler.function;

import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Anonymous;
import com.lessj.compiler.ast.value.Quoted;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字符串函数：e、escape、replace、%
 */
final class StringFunctions {
    private static final Pattern FORMAT_TOKEN = Pattern.compile("%[sda]", Pattern.CASE_INSENSITIVE);

    /** encodeURI 不编码的字符 */
    private static final String URI_RESERVED = ";,/?:@&=+$#-_.!~*'()";
    /** encodeURIComponent 不编码的字符 */
    static final String COMPONENT_RESERVED = "-_.!~*'()";

    private StringFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addBuiltin("e", (ctx, args) -> {
            Node str = Args.required(args, 0, "first");
            String text = Args.text(str);
            return new Quoted("\"", text != null ? text : ctx.toCss(str), true);
        });
        registry.addBuiltin("escape", (ctx, args) -> {
            String text = textOrCss(ctx, Args.required(args, 0, "first"));
            String escaped = encode(text, URI_RESERVED)
                    .replace("=", "%3D")
                    .replace(":", "%3A")
                    .replace("#", "%23")
                    .replace(";", "%3B")
                    .replace("(", "%28")
                    .replace(")", "%29");
            return new Anonymous(escaped);
        });
        registry.addBuiltin("replace", (ctx, args) -> {
            Node string = Args.required(args, 0, "first");
            String pattern = textOrCss(ctx, Args.required(args, 1, "second"));
            Node replacementArg = Args.required(args, 2, "third");
            String replacement = replacementArg instanceof Quoted
                    ? ((Quoted) replacementArg).getValue()
                    : ctx.toCss(replacementArg);
            Node flagsArg = Args.arg(args, 3);
            String flags = flagsArg == null ? "" : textOrCss(ctx, flagsArg);

            int patternFlags = flags.indexOf('i') >= 0 ? Pattern.CASE_INSENSITIVE : 0;
            Matcher m = Pattern.compile(pattern, patternFlags).matcher(textOrCss(ctx, string));
            String javaReplacement = replacement.replace("\\", "\\\\").replace("$&", "$0");
            String result = flags.indexOf('g') >= 0 ? m.replaceAll(javaReplacement) : m.replaceFirst(javaReplacement);
            return quotedLike(string, result);
        });
        registry.addBuiltin("%", (ctx, args) -> {
            Node string = Args.required(args, 0, "first");
            String result = textOrCss(ctx, string);
            for (int i = 1; i < args.size(); i++) {
                Matcher m = FORMAT_TOKEN.matcher(result);
                if (!m.find()) {
                    break;
                }
                String token = m.group();
                Node arg = args.get(i);
                String value = arg instanceof Quoted && token.toLowerCase(Locale.ROOT).equals("%s")
                        ? ((Quoted) arg).getValue()
                        : ctx.toCss(arg);
                if (Character.isUpperCase(token.charAt(1))) {
                    value = encode(value, COMPONENT_RESERVED);
                }
                result = result.substring(0, m.start()) + value + result.substring(m.end());
            }
            return quotedLike(string, result.replace("%%", "%"));
        });
    }

    private static String textOrCss(FunctionContext ctx, Node node) {
        String text = Args.text(node);
        return text != null ? text : ctx.toCss(node);
    }

    private static Quoted quotedLike(Node original, String value) {
        if (original instanceof Quoted) {
            Quoted q = (Quoted) original;
            return new Quoted(q.getQuote(), value, q.isEscaped());
        }
        return new Quoted("", value, false);
    }

    /**
     * 百分号编码，ASCII 字母数字与 keep 中的字符保持原样，其余按 UTF-8 编码
     */
    static String encode(String text, String keep) {
        StringBuilder sb = new StringBuilder();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            int c = b & 0xff;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || (c < 0x80 && keep.indexOf(c) >= 0)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(String.format("%02X", c));
            }
        }
        return sb.toString();
    }
}
