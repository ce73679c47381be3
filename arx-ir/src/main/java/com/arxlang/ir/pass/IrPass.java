package com.arxlang.ir.pass;

import com.arxlang.ir.ssa.IrModule;

/**
 * IR pass 接口。
 */
public interface IrPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 IR 模块执行变换或检查。
     */
    IrModule run(IrModule module);
}
