package com.arxlang.cli;

import com.arxlang.ir.CompilerOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli build 子命令：编译 AST 并链接为可执行文件
 */
@Command(name = "build", description = "编译并链接为可执行文件")
public class BuildCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    SharedOptions shared = new SharedOptions();

    @Parameters(index = "0", description = "AST 文件（JSON）")
    Path astFile;

    @Option(names = "--lib-dir", description = "外部模块 C 源码目录（默认 <home>/c_lib）")
    Path libDir;

    @Option(names = "--work-dir", description = "build/ 与 out/ 所在目录（默认 <home>）")
    Path workDir;

    @Option(names = "--llc", description = "llc 路径（默认在 PATH 中查找）")
    String llc;

    @Option(names = "--cc", description = "C 编译器路径（默认在 PATH 中查找 gcc、cc）")
    String cc;

    BuildRunner runner = new BuildRunner();

    @Override
    public Integer call() {
        BuildConfig config = shared.toBuildConfig();
        if (libDir != null) config.setLibDir(libDir);
        if (workDir != null) config.setWorkDir(workDir);
        config.setLlc(llc);
        config.setCc(cc);
        CompilerOptions options = shared.toCompilerOptions(config);

        return CommandSupport.execute(spec.commandLine().getErr(), astFile, shared.verbose, () -> {
            Path executable = runner.build(astFile, options, config);
            spec.commandLine().getOut().println("已生成: " + executable);
        });
    }
}
