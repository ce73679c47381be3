package com.arxlang.ir.testing;

import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.ir.ArxIrCompiler;
import com.arxlang.ir.CompilationResult;
import com.arxlang.ir.CompilerOptions;
import com.arxlang.ir.extern.DescriptorCache;
import com.arxlang.ir.extern.DescriptorParser;
import com.arxlang.ir.extern.ExternLinkageResolver;
import com.arxlang.ir.pass.PassPipeline;

import java.nio.file.Path;

/**
 * 测试用编译入口：固定目标三元组，每次使用独立的描述文件缓存。
 */
public final class TestCompiler {

    public static final String TRIPLE = "x86_64-unknown-linux-gnu";

    private TestCompiler() {}

    public static CompilationResult compile(Program program, Path... descriptorDirs) {
        return compile(program, false, descriptorDirs);
    }

    public static CompilationResult compile(Program program, boolean opaquePointers, Path... descriptorDirs) {
        CompilerOptions options = new CompilerOptions();
        options.setTargetTriple(TRIPLE);
        options.setOpaquePointers(opaquePointers);
        options.setSourceFileName("test.arx");
        for (Path dir : descriptorDirs) {
            options.addDescriptorDir(dir);
        }
        ArxIrCompiler compiler = new ArxIrCompiler(
                new ExternLinkageResolver(new DescriptorCache(new DescriptorParser(), 16)),
                PassPipeline.createDefault());
        return compiler.compile(program, options);
    }

    /** 编译并返回 LLVM 文本 */
    public static String ir(Program program, Path... descriptorDirs) {
        return compile(program, descriptorDirs).getIrText();
    }

    /** 编译并用解释器执行指定函数 */
    public static Object run(Program program, String function, Object... args) {
        return new IrInterpreter(compile(program).getModule()).run(function, args);
    }
}
