package com.arxlang.cli;

import com.arxlang.ir.CompilerOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli emit 子命令：只输出 LLVM 文本 IR
 */
@Command(name = "emit", description = "输出 LLVM 文本 IR")
public class EmitCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    SharedOptions shared = new SharedOptions();

    @Parameters(index = "0", description = "AST 文件（JSON）")
    Path astFile;

    @Option(names = {"-o", "--output"}, description = "输出 .ll 文件（默认标准输出）")
    Path output;

    BuildRunner runner = new BuildRunner();

    @Override
    public Integer call() {
        BuildConfig config = shared.toBuildConfig();
        CompilerOptions options = shared.toCompilerOptions(config);

        return CommandSupport.execute(spec.commandLine().getErr(), astFile, shared.verbose, () -> {
            String ir = runner.emit(astFile, options);
            if (output == null) {
                spec.commandLine().getOut().print(ir);
                spec.commandLine().getOut().flush();
            } else {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(output, ir.getBytes(StandardCharsets.UTF_8));
                spec.commandLine().getOut().println("已写入: " + output);
            }
        });
    }
}
