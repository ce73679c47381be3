package com.arxlang.cli;

import com.arxlang.ir.CompilerOptions;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * build 与 emit 共用的选项（picocli mixin）
 */
public class SharedOptions {

    @Option(names = "--map-dir", description = "外部模块描述文件目录（可重复，默认 <home>/c_map）")
    List<Path> mapDirs = new ArrayList<>();

    @Option(names = "--target", description = "目标三元组（默认按宿主推断）")
    String target;

    @Option(names = "--opaque-pointers", description = "输出 opaque 指针（LLVM 15+）")
    boolean opaquePointers;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    CompilerOptions toCompilerOptions(BuildConfig config) {
        CompilerOptions options = new CompilerOptions();
        options.setDescriptorDirs(config.getMapDirs());
        if (target != null) {
            options.setTargetTriple(target);
        }
        options.setOpaquePointers(opaquePointers);
        return options;
    }

    BuildConfig toBuildConfig() {
        BuildConfig config = new BuildConfig();
        if (!mapDirs.isEmpty()) {
            config.setMapDirs(mapDirs);
        }
        return config;
    }
}
