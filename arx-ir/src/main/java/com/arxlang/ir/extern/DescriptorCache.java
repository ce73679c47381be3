package com.arxlang.ir.extern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 基于 Caffeine 的描述文件解析缓存。
 *
 * <p>键为绝对路径 + 修改时间 + 文件大小，文件变化后自然失效。线程安全。</p>
 */
public final class DescriptorCache {

    private static final DescriptorCache SHARED = new DescriptorCache(new DescriptorParser(), 256);

    private final DescriptorParser parser;
    private final Cache<String, ModuleDescriptor> cache;

    public DescriptorCache(DescriptorParser parser, long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.parser = parser;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /** 进程内共享实例 */
    public static DescriptorCache shared() {
        return SHARED;
    }

    public ModuleDescriptor get(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new DescriptorException("Cannot read descriptor", absolute.toString(), e);
        }
        String key = absolute + "|" + attrs.lastModifiedTime().toMillis() + "|" + attrs.size();
        try {
            return cache.get(key, k -> {
                try {
                    return parser.parse(absolute);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw new DescriptorException("Cannot read descriptor", absolute.toString(), e.getCause());
        }
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
