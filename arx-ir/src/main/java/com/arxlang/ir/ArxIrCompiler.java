package com.arxlang.ir;

import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.compiler.parser.AstJsonReader;
import com.arxlang.ir.extern.ExternLinkage;
import com.arxlang.ir.extern.ExternLinkageResolver;
import com.arxlang.ir.lowering.AstToIrLowering;
import com.arxlang.ir.pass.PassPipeline;
import com.arxlang.ir.print.IrPrinter;
import com.arxlang.ir.ssa.IrModule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * 编译器门面。
 * 管线：AST → 外部链接解析 → IR 降级 → pass 管线 → LLVM 文本 IR。
 */
public class ArxIrCompiler {

    private static final Logger LOG = Logger.getLogger(ArxIrCompiler.class.getName());

    private final ExternLinkageResolver resolver;
    private final PassPipeline pipeline;

    public ArxIrCompiler() {
        this(new ExternLinkageResolver(), PassPipeline.createDefault());
    }

    public ArxIrCompiler(ExternLinkageResolver resolver, PassPipeline pipeline) {
        this.resolver = resolver;
        this.pipeline = pipeline;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 编译 AST。外部描述文件在降级任何函数之前全部解析完毕。
     */
    public CompilationResult compile(Program program, CompilerOptions options) {
        IrModule module = new IrModule(options.getModuleName());
        module.setSourceFileName(options.getSourceFileName());
        module.setTargetTriple(options.getTargetTriple());

        ExternLinkage linkage = resolver.resolve(options.getDescriptorDirs(), program.getUses(), module);
        LOG.fine("Extern modules: " + linkage.getLoadedModules()
                + ", overloads: " + linkage.getTable().size());

        new AstToIrLowering(module, linkage).lower(program);
        module = pipeline.run(module);

        String text = new IrPrinter(options.isOpaquePointers()).print(module);
        return new CompilationResult(module, text, linkage.getLoadedModules());
    }

    /**
     * 编译 JSON 形式的 AST 文件，source_filename 取文件名。
     */
    public CompilationResult compileFile(Path astFile, CompilerOptions options) throws IOException {
        Program program = new AstJsonReader(astFile.getFileName().toString()).read(astFile);
        options.setSourceFileName(astFile.getFileName().toString());
        return compile(program, options);
    }
}
