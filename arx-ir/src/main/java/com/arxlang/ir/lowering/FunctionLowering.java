package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.decl.FunDecl;
import com.arxlang.ir.ssa.BasicBlock;
import com.arxlang.ir.ssa.IrBuilder;
import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.ssa.IrParam;
import com.arxlang.ir.ssa.IrValue;

/**
 * 函数降级：入口块、形参栈槽、函数体，最后检查每个可达块都已终止。
 */
public class FunctionLowering {

    private final StatementLowering statements;

    public FunctionLowering(StatementLowering statements) {
        this.statements = statements;
    }

    /**
     * 降级函数体到已声明的 IR 函数中。
     */
    public void lower(FunDecl decl, IrFunction function) {
        FunctionContext ctx = new FunctionContext(function);
        IrBuilder builder = ctx.getBuilder();

        for (IrParam param : function.getParams()) {
            IrValue slot = builder.alloca(param.getType(), param.getName() + ".addr");
            builder.store(param.asValue(), slot);
            ctx.bind(new VariableBinding(param.getName(), slot, param.getType()));
        }

        statements.lowerBlock(decl.getBody(), ctx);

        for (BasicBlock block : function.reachableBlocks()) {
            if (!block.hasTerminator()) {
                throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                        "Function '" + decl.getName() + "' falls off the end without returning",
                        decl.getLocation());
            }
        }
    }
}
