package com.arxlang.ir.pass;

import com.arxlang.ir.ssa.*;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 输出前的结构校验：每个块恰好一个终止指令、跳转目标属于同一函数、
 * 返回值类型与函数签名一致、被调函数已声明且实参个数与类型匹配。
 * 违反即为内部错误（{@link IllegalStateException}）。
 */
public class ModuleVerification implements IrPass {

    @Override
    public String getName() {
        return "ModuleVerification";
    }

    @Override
    public IrModule run(IrModule module) {
        for (IrFunction function : module.getFunctions()) {
            if (!function.isDeclaration()) {
                verify(module, function);
            }
        }
        return module;
    }

    private void verify(IrModule module, IrFunction function) {
        Set<BasicBlock> owned = Collections.newSetFromMap(new IdentityHashMap<>());
        owned.addAll(function.getBlocks());

        for (BasicBlock block : function.getBlocks()) {
            IrTerminator terminator = block.getTerminator();
            if (terminator == null) {
                throw malformed(function, block, "block has no terminator");
            }
            for (BasicBlock succ : terminator.getSuccessors()) {
                if (!owned.contains(succ)) {
                    throw malformed(function, block, "branch to foreign block '" + succ.getLabel() + "'");
                }
            }
            if (terminator instanceof IrTerminator.Return) {
                IrValue value = ((IrTerminator.Return) terminator).getValue();
                IrType actual = value == null ? IrType.VOID : value.getType();
                if (!actual.equals(function.getReturnType())) {
                    throw malformed(function, block, "returns " + actual + ", expected " + function.getReturnType());
                }
            }
            for (IrInst inst : block.getInstructions()) {
                if (inst.getOp() == IrOp.CALL) {
                    verifyCall(module, function, block, inst);
                }
            }
        }
    }

    private void verifyCall(IrModule module, IrFunction function, BasicBlock block, IrInst inst) {
        IrFunction callee = module.getFunction(inst.getCallee());
        if (callee == null) {
            throw malformed(function, block, "call to undeclared function @" + inst.getCallee());
        }
        List<IrValue> args = inst.getOperands();
        if (args.size() != callee.getParams().size()) {
            throw malformed(function, block, "call to @" + callee.getName() + " with " + args.size()
                    + " arguments, expected " + callee.getParams().size());
        }
        List<IrType> paramTypes = callee.getParamTypes();
        for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).getType().equals(paramTypes.get(i))) {
                throw malformed(function, block, "argument " + (i + 1) + " of call to @" + callee.getName()
                        + " is " + args.get(i).getType() + ", expected " + paramTypes.get(i));
            }
        }
    }

    private static IllegalStateException malformed(IrFunction function, BasicBlock block, String detail) {
        return new IllegalStateException("Malformed IR in @" + function.getName()
                + " block '" + block.getLabel() + "': " + detail);
    }
}
