package com.lessj.compiler.function;

import com.lessj.compiler.ImportException;
import com.lessj.compiler.RewriteUrls;
import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.value.Dimension;
import com.lessj.compiler.ast.value.Expression;
import com.lessj.compiler.ast.value.Quoted;
import com.lessj.compiler.ast.value.Url;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 读取外部资源的函数：data-uri、image-size、image-width、image-height
 *
 * <p>文件通过 {@link FunctionContext#loadFile} 交给宿主的导入解析器读取。</p>
 */
final class ResourceFunctions {
    private static final Logger LOG = Logger.getLogger(ResourceFunctions.class.getName());

    private static final Pattern BASE64_SUFFIX = Pattern.compile(";base64$");
    private static final Pattern SVG_ROOT = Pattern.compile("<svg\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SVG_LENGTH = Pattern.compile("(?<![\\w-])(width|height)\\s*=\\s*[\"']\\s*([0-9.]+)\\s*(?:px)?\\s*[\"']");

    private static final Map<String, String> MIME_TYPES = new HashMap<>();

    static {
        MIME_TYPES.put("png", "image/png");
        MIME_TYPES.put("jpg", "image/jpeg");
        MIME_TYPES.put("jpeg", "image/jpeg");
        MIME_TYPES.put("gif", "image/gif");
        MIME_TYPES.put("webp", "image/webp");
        MIME_TYPES.put("bmp", "image/bmp");
        MIME_TYPES.put("ico", "image/x-icon");
        MIME_TYPES.put("svg", "image/svg+xml");
        MIME_TYPES.put("woff", "font/woff");
        MIME_TYPES.put("woff2", "font/woff2");
        MIME_TYPES.put("ttf", "font/ttf");
        MIME_TYPES.put("otf", "font/otf");
        MIME_TYPES.put("eot", "application/vnd.ms-fontobject");
        MIME_TYPES.put("css", "text/css");
        MIME_TYPES.put("less", "text/css");
        MIME_TYPES.put("txt", "text/plain");
        MIME_TYPES.put("html", "text/html");
        MIME_TYPES.put("xml", "text/xml");
        MIME_TYPES.put("json", "application/json");
        MIME_TYPES.put("js", "application/javascript");
    }

    private ResourceFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.addBuiltin("data-uri", ResourceFunctions::dataUri);
        registry.addBuiltin("image-size", (ctx, args) -> {
            int[] size = imageSize(ctx, Args.required(args, 0, "first"));
            return new Expression(Arrays.<Node>asList(
                    new Dimension(size[0], "px"), new Dimension(size[1], "px")));
        });
        registry.addBuiltin("image-width", (ctx, args) ->
                new Dimension(imageSize(ctx, Args.required(args, 0, "first"))[0], "px"));
        registry.addBuiltin("image-height", (ctx, args) ->
                new Dimension(imageSize(ctx, Args.required(args, 0, "first"))[1], "px"));
    }

    // ============ data-uri ============

    private static Node dataUri(FunctionContext ctx, List<Node> args) {
        Node mimetypeNode = Args.required(args, 0, "first");
        Node filePathNode = Args.arg(args, 1);
        if (filePathNode == null) {
            filePathNode = mimetypeNode;
            mimetypeNode = null;
        }
        if (!(filePathNode instanceof Quoted)) {
            return fallback(ctx, filePathNode);
        }

        String filePath = ((Quoted) filePathNode).getValue();
        String fragment = "";
        int hash = filePath.indexOf('#');
        if (hash >= 0) {
            fragment = filePath.substring(hash);
            filePath = filePath.substring(0, hash);
        }

        String mimetype;
        boolean useBase64;
        if (mimetypeNode == null) {
            mimetype = mimeLookup(filePath);
            useBase64 = !"image/svg+xml".equals(mimetype) && !mimetype.startsWith("text/");
            if (useBase64) {
                mimetype += ";base64";
            }
        } else {
            mimetype = mimetypeNode instanceof Quoted ? ((Quoted) mimetypeNode).getValue() : "";
            useBase64 = BASE64_SUFFIX.matcher(mimetype).find();
        }

        byte[] contents;
        try {
            contents = ctx.loadFile(filePath, resourceDirectory(ctx));
        } catch (ImportException e) {
            LOG.warning("Skipped data-uri embedding of " + filePath + " because file not found: " + e.getRawMessage());
            return fallback(ctx, filePathNode);
        }
        if (contents.length == 0) {
            LOG.warning("Skipped data-uri embedding of " + filePath + " because file is empty");
            return fallback(ctx, filePathNode);
        }

        String buf = useBase64
                ? Base64.getEncoder().encodeToString(contents)
                : StringFunctions.encode(new String(contents, StandardCharsets.UTF_8), StringFunctions.COMPONENT_RESERVED);
        String uri = "data:" + mimetype + "," + buf + fragment;
        return new Url(new Quoted("\"", uri, false, ctx.getIndex(), ctx.getFileInfo()),
                ctx.getIndex(), ctx.getFileInfo(), true);
    }

    /**
     * 开启 url 重写时相对当前文件查找，否则相对入口文件
     */
    private static String resourceDirectory(FunctionContext ctx) {
        FileInfo info = ctx.getFileInfo();
        if (info == null) {
            return "";
        }
        return ctx.getOptions().effectiveRewriteUrls() != RewriteUrls.OFF
                ? info.getCurrentDirectory()
                : info.getEntryPath();
    }

    private static Node fallback(FunctionContext ctx, Node node) {
        return ctx.evaluate(new Url(node, ctx.getIndex(), ctx.getFileInfo(), false));
    }

    static String mimeLookup(String filePath) {
        int slash = filePath.lastIndexOf('/');
        int dot = filePath.lastIndexOf('.');
        if (dot <= slash) {
            return "application/octet-stream";
        }
        String type = MIME_TYPES.get(filePath.substring(dot + 1).toLowerCase(Locale.ROOT));
        return type != null ? type : "application/octet-stream";
    }

    // ============ image-size ============

    private static int[] imageSize(FunctionContext ctx, Node filePathNode) {
        if (!(filePathNode instanceof Quoted)) {
            throw new IllegalArgumentException("image file path must be a string");
        }
        String filePath = ((Quoted) filePathNode).getValue();
        FileInfo info = ctx.getFileInfo();
        byte[] contents = ctx.loadFile(filePath, info == null ? "" : info.getCurrentDirectory());
        if ("image/svg+xml".equals(mimeLookup(filePath))) {
            return svgSize(new String(contents, StandardCharsets.UTF_8), filePath);
        }
        return rasterSize(contents, filePath);
    }

    private static int[] svgSize(String svg, String filePath) {
        Matcher root = SVG_ROOT.matcher(svg);
        if (!root.find()) {
            throw new IllegalArgumentException("'" + filePath + "' is not an svg image");
        }
        int[] size = {-1, -1};
        Matcher m = SVG_LENGTH.matcher(root.group());
        while (m.find()) {
            int value = (int) Math.round(Double.parseDouble(m.group(2)));
            size["width".equals(m.group(1)) ? 0 : 1] = value;
        }
        if (size[0] < 0 || size[1] < 0) {
            throw new IllegalArgumentException("'" + filePath + "' has no width and height");
        }
        return size;
    }

    private static int[] rasterSize(byte[] contents, String filePath) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(contents))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new IllegalArgumentException("unsupported image format '" + filePath + "'");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read image '" + filePath + "'", e);
        }
    }
}
