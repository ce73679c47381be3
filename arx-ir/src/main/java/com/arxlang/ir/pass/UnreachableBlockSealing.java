package com.arxlang.ir.pass;

import com.arxlang.ir.ssa.BasicBlock;
import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.ssa.IrModule;
import com.arxlang.ir.ssa.IrTerminator;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 为不可达且未终止的基本块补上 {@code unreachable}。
 * 例如所有分支都返回的 if 链留下的 end 块。
 */
public class UnreachableBlockSealing implements IrPass {

    @Override
    public String getName() {
        return "UnreachableBlockSealing";
    }

    @Override
    public IrModule run(IrModule module) {
        for (IrFunction function : module.getFunctions()) {
            if (function.isDeclaration()) continue;
            seal(function);
        }
        return module;
    }

    private void seal(IrFunction function) {
        Set<BasicBlock> reachable = Collections.newSetFromMap(new IdentityHashMap<>());
        reachable.addAll(function.reachableBlocks());
        for (BasicBlock block : function.getBlocks()) {
            if (!block.hasTerminator() && !reachable.contains(block)) {
                block.setTerminator(new IrTerminator.Unreachable());
            }
        }
    }
}
