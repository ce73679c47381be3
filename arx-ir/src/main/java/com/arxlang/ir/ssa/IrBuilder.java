package com.arxlang.ir.ssa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * IR 构建辅助类。
 * 封装创建指令、基本块、栈槽的便捷方法，并维护当前插入块。
 */
public class IrBuilder {

    private final IrFunction function;
    private BasicBlock currentBlock;

    public IrBuilder(IrFunction function) {
        this.function = function;
        this.currentBlock = function.newBlock("entry");
    }

    public IrFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock(String hint) {
        return function.newBlock(hint);
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    public boolean isTerminated() {
        return currentBlock.hasTerminator();
    }

    // ========== 内存 ==========

    /** 在入口块的 alloca 区分配栈槽，结果类型为 {@code type*} */
    public IrValue alloca(IrType type, String hint) {
        IrValue slot = IrValue.local(function.newValueName(hint), type.pointer());
        function.getEntryBlock().insertAlloca(
                new IrInst(IrOp.ALLOCA, slot, Collections.<IrValue>emptyList(), type, null, null));
        return slot;
    }

    public IrValue load(IrValue pointer, String hint) {
        IrValue dest = IrValue.local(function.newValueName(hint), pointer.getType().pointee());
        emit(new IrInst(IrOp.LOAD, dest, Collections.singletonList(pointer), null, null, null));
        return dest;
    }

    public void store(IrValue value, IrValue pointer) {
        if (!pointer.getType().pointee().equals(value.getType())) {
            throw new IllegalStateException("store of " + value.getType() + " into " + pointer.getType());
        }
        emit(new IrInst(IrOp.STORE, null, Arrays.asList(value, pointer), null, null, null));
    }

    /** {@code getelementptr elementType, base, indices...}，结果类型为 {@code elementType*} */
    public IrValue gep(IrType elementType, IrValue base, List<IrValue> indices, String hint) {
        IrValue dest = IrValue.local(function.newValueName(hint), elementType.pointer());
        List<IrValue> operands = new ArrayList<>(indices.size() + 1);
        operands.add(base);
        operands.addAll(indices);
        emit(new IrInst(IrOp.GEP, dest, operands, elementType, null, null));
        return dest;
    }

    public IrValue bitcast(IrValue value, IrType target, String hint) {
        IrValue dest = IrValue.local(function.newValueName(hint), target);
        emit(new IrInst(IrOp.BITCAST, dest, Collections.singletonList(value), null, null, null));
        return dest;
    }

    // ========== 运算 ==========

    public IrValue binary(IrOp op, IrValue left, IrValue right, String hint) {
        if (!op.isBinary()) {
            throw new IllegalArgumentException("not a binary op: " + op);
        }
        IrValue dest = IrValue.local(function.newValueName(hint), left.getType());
        emit(new IrInst(op, dest, Arrays.asList(left, right), null, null, null));
        return dest;
    }

    public IrValue icmp(CmpPredicate predicate, IrValue left, IrValue right, String hint) {
        IrValue dest = IrValue.local(function.newValueName(hint), IrType.I1);
        emit(new IrInst(IrOp.ICMP, dest, Arrays.asList(left, right), null, predicate, null));
        return dest;
    }

    public IrValue fcmp(CmpPredicate predicate, IrValue left, IrValue right, String hint) {
        IrValue dest = IrValue.local(function.newValueName(hint), IrType.I1);
        emit(new IrInst(IrOp.FCMP, dest, Arrays.asList(left, right), null, predicate, null));
        return dest;
    }

    /**
     * 直接调用。返回类型为 void 时返回 null。
     */
    public IrValue call(IrFunction callee, List<IrValue> args, String hint) {
        IrValue dest = null;
        if (!callee.getReturnType().isVoid()) {
            dest = IrValue.local(function.newValueName(hint), callee.getReturnType());
        }
        emit(new IrInst(IrOp.CALL, dest, new ArrayList<>(args), null, null, callee.getName()));
        return dest;
    }

    // ========== 终止指令 ==========

    public void br(BasicBlock target) {
        currentBlock.setTerminator(new IrTerminator.Goto(target));
    }

    public void condBr(IrValue condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        currentBlock.setTerminator(new IrTerminator.Branch(condition, thenBlock, elseBlock));
    }

    public void ret(IrValue value) {
        currentBlock.setTerminator(new IrTerminator.Return(value));
    }

    public void retVoid() {
        currentBlock.setTerminator(new IrTerminator.Return(null));
    }

    public void unreachable() {
        currentBlock.setTerminator(new IrTerminator.Unreachable());
    }

    private void emit(IrInst inst) {
        currentBlock.addInstruction(inst);
    }
}
