package com.arxlang.cli;

import com.arxlang.ir.ArxIrCompiler;
import com.arxlang.ir.CompilationResult;
import com.arxlang.ir.CompilerOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * 构建管线：AST → .ll → llc → 目标文件 → 与外部模块的 C 实现一起链接为可执行文件。
 *
 * <pre>
 *   build/&lt;name&gt;.ll
 *   llc build/&lt;name&gt;.ll -filetype=obj -o build/&lt;name&gt;.o
 *   cc -c -o build/&lt;module&gt;.o &lt;libDir&gt;/&lt;module&gt;.c     （每个已加载模块）
 *   cc build/&lt;name&gt;.o build/&lt;module&gt;.o... -o out/&lt;name&gt;
 * </pre>
 */
public class BuildRunner {

    private static final Logger LOG = Logger.getLogger(BuildRunner.class.getName());

    private final ArxIrCompiler compiler;
    private final ProcessRunner processes;
    private final Function<BuildConfig, Toolchain> toolchainLocator;

    public BuildRunner() {
        this(new ArxIrCompiler(), new ProcessRunner(), Toolchain::locate);
    }

    public BuildRunner(ArxIrCompiler compiler, ProcessRunner processes,
                       Function<BuildConfig, Toolchain> toolchainLocator) {
        this.compiler = compiler;
        this.processes = processes;
        this.toolchainLocator = toolchainLocator;
    }

    /**
     * 编译 AST 文件为可执行文件，返回其路径。
     * 工具链缺失时在写出任何文件之前失败。
     */
    public Path build(Path astFile, CompilerOptions options, BuildConfig config) throws IOException {
        String name = baseName(astFile);
        CompilationResult result = compile(astFile, options);
        Toolchain toolchain = toolchainLocator.apply(config);

        Path buildDir = config.getBuildDir();
        Path outDir = config.getOutDir();
        Files.createDirectories(buildDir);
        Files.createDirectories(outDir);

        Path llFile = buildDir.resolve(name + ".ll");
        Files.write(llFile, result.getIrText().getBytes(StandardCharsets.UTF_8));
        LOG.info("Wrote " + llFile);

        Path mainObject = buildDir.resolve(name + config.getObjectExtension());
        processes.run(Arrays.asList(toolchain.getLlc().toString(), llFile.toString(),
                "-filetype=obj", "-o", mainObject.toString()), config.getWorkDir());

        List<String> link = new ArrayList<>();
        link.add(toolchain.getCc().toString());
        link.add(mainObject.toString());
        for (String module : result.getLinkedModules()) {
            Path source = config.getLibDir().resolve(module + ".c");
            Path object = buildDir.resolve(module + config.getObjectExtension());
            processes.run(Arrays.asList(toolchain.getCc().toString(), "-c", "-o", object.toString(),
                    source.toString()), config.getWorkDir());
            link.add(object.toString());
        }

        Path executable = outDir.resolve(name + config.getExecutableExtension());
        link.add("-o");
        link.add(executable.toString());
        processes.run(link, config.getWorkDir());
        LOG.info("Built " + executable);
        return executable;
    }

    /**
     * 只生成 LLVM 文本 IR。
     */
    public String emit(Path astFile, CompilerOptions options) throws IOException {
        return compile(astFile, options).getIrText();
    }

    private CompilationResult compile(Path astFile, CompilerOptions options) throws IOException {
        return compiler.compileFile(astFile, options);
    }

    static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
