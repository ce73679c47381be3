package com.arxlang.ir;

import com.arxlang.ir.ssa.IrModule;

import java.util.List;

/**
 * 一次编译的产物：IR 模块、其文本形式、需要链接的外部模块。
 */
public class CompilationResult {
    private final IrModule module;
    private final String irText;
    private final List<String> linkedModules;

    public CompilationResult(IrModule module, String irText, List<String> linkedModules) {
        this.module = module;
        this.irText = irText;
        this.linkedModules = linkedModules;
    }

    public IrModule getModule() { return module; }

    /** LLVM 文本 IR */
    public String getIrText() { return irText; }

    /** 已加载的外部模块名（含 core），每个对应一个 C 源文件 */
    public List<String> getLinkedModules() { return linkedModules; }
}
