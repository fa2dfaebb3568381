package com.lessj.cli;

import com.lessj.cli.cache.BoundedCache;
import com.lessj.cli.cache.CacheStats;
import com.lessj.cli.cache.CaffeineCache;
import com.lessj.compiler.ImportException;
import com.lessj.compiler.ImportResolver;
import com.lessj.compiler.ResolvedImport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 从文件系统解析导入
 *
 * <p>依次在发起导入的文件所在目录和 include 路径中查找；文件标识为规范化的绝对路径（以 / 分隔）。
 * 读取过的文件按修改时间缓存，同一进程内的多次编译共享同一份缓存。</p>
 */
public class FileSystemImportResolver implements ImportResolver {
    private static final Logger LOG = Logger.getLogger(FileSystemImportResolver.class.getName());

    static final long DEFAULT_CACHE_SIZE = 256;

    private final BoundedCache<Path, CachedFile> cache;

    public FileSystemImportResolver() {
        this(new CaffeineCache<Path, CachedFile>(DEFAULT_CACHE_SIZE));
    }

    FileSystemImportResolver(BoundedCache<Path, CachedFile> cache) {
        this.cache = cache;
    }

    /**
     * 入口文件的标识，与被导入文件使用相同的形式，保证 once 判定一致
     */
    public static String identify(Path file) {
        return file.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    @Override
    public ResolvedImport resolve(String path, String currentDirectory, List<String> paths) {
        Path file = locate(path, ImportResolver.withLessExtension(path), currentDirectory, paths);
        return new ResolvedImport(identify(file), read(file));
    }

    /**
     * 资源文件不经过缓存，每次直接读取
     */
    @Override
    public byte[] resolveBinary(String path, String currentDirectory, List<String> paths) {
        Path file = locate(path, path, currentDirectory, paths);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ImportException("unable to read '" + identify(file) + "': " + e.getMessage(), e);
        }
    }

    private static Path locate(String path, String target, String currentDirectory, List<String> paths) {
        String name = stripQuery(target);
        List<String> directories = new ArrayList<>();
        directories.add(currentDirectory == null ? "" : currentDirectory);
        if (paths != null) {
            directories.addAll(paths);
        }

        List<String> tried = new ArrayList<>();
        for (String dir : directories) {
            Path candidate;
            try {
                candidate = (dir.isEmpty() ? Paths.get(name) : Paths.get(dir).resolve(name))
                        .toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                throw new ImportException("invalid import path '" + path + "'", e);
            }
            tried.add(identify(candidate));
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new ImportException("'" + path + "' wasn't found. Tried - " + String.join(",", tried));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    private String read(Path file) {
        try {
            long modified = Files.getLastModifiedTime(file).toMillis();
            CachedFile cached = cache.get(file);
            if (cached != null && cached.modified == modified) {
                return cached.contents;
            }
            if (cached != null) {
                LOG.fine("reloading modified file " + file);
                cache.invalidate(file);
            }
            return cache.computeIfAbsent(file, FileSystemImportResolver::load).contents;
        } catch (IOException e) {
            throw new ImportException("unable to read '" + identify(file) + "': " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new ImportException("unable to read '" + identify(file) + "': " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    private static CachedFile load(Path file) {
        try {
            long modified = Files.getLastModifiedTime(file).toMillis();
            String contents = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return new CachedFile(contents, modified);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stripQuery(String path) {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }

    /** 文件内容与读取时的修改时间 */
    static final class CachedFile {
        final String contents;
        final long modified;

        CachedFile(String contents, long modified) {
            this.contents = contents;
            this.modified = modified;
        }
    }
}
