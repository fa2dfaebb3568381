package com.lessj.cli.cache;

import java.util.function.Function;

/**
 * 有界缓存接口，导入解析器用它保存已读取的文件
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 不存在时用 loader 计算并缓存；loader 返回 null 时不缓存
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> loader);

    /** 移除单个条目，文件在磁盘上变化时使用 */
    void invalidate(K key);

    CacheStats getStats();
}
