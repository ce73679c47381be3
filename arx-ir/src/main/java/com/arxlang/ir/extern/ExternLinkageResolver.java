package com.arxlang.ir.extern;

import com.arxlang.ir.runtime.ListLayout;
import com.arxlang.ir.ssa.IrModule;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 外部链接解析器。
 *
 * <p>按目录顺序扫描 {@code *.map} 描述文件（不递归，目录内按文件名排序），
 * 把 core 模块与被请求的模块合并进同一张重载表。任何描述文件错误都会中止解析，
 * 此时尚未降级任何函数。完成后在 IR 模块中登记 List 记录类型。</p>
 */
public class ExternLinkageResolver {

    private static final Logger LOG = Logger.getLogger(ExternLinkageResolver.class.getName());

    public static final String CORE_MODULE = "core";

    private final DescriptorCache cache;

    public ExternLinkageResolver() {
        this(DescriptorCache.shared());
    }

    public ExternLinkageResolver(DescriptorCache cache) {
        this.cache = cache;
    }

    public ExternLinkage resolve(List<Path> directories, Collection<String> requestedModules, IrModule module) {
        OverloadTable table = new OverloadTable();
        Set<String> loaded = new LinkedHashSet<>();

        for (Path dir : directories) {
            if (!Files.isDirectory(dir)) {
                LOG.fine("Descriptor directory not found: " + dir);
                continue;
            }
            for (Path file : listDescriptors(dir)) {
                ModuleDescriptor descriptor = cache.get(file);
                String name = descriptor.getModuleName();
                if (!CORE_MODULE.equals(name) && !requestedModules.contains(name)) {
                    LOG.fine("Skipping unused module '" + name + "' from " + file);
                    continue;
                }
                loaded.add(name);
                for (ExternOverload overload : descriptor.getOverloads()) {
                    table.put(overload);
                }
                LOG.fine("Loaded module '" + name + "' (" + descriptor.getOverloads().size()
                        + " overloads) from " + file);
            }
        }

        for (String requested : requestedModules) {
            if (!loaded.contains(requested)) {
                LOG.warning("No descriptor provides requested module '" + requested + "'");
            }
        }

        ListLayout.register(module);
        return new ExternLinkage(table, new ArrayList<>(loaded));
    }

    private static List<Path> listDescriptors(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.map")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) files.add(file);
            }
        } catch (IOException e) {
            throw new DescriptorException("Cannot list descriptor directory", dir.toString(), e);
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }
}
