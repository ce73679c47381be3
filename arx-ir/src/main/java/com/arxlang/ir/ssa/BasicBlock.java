package com.arxlang.ir.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 基本块。
 *
 * <p>终止指令设置后块即封闭，再追加指令或第二个终止指令都会抛出
 * {@link IllegalStateException}。</p>
 */
public class BasicBlock {

    private final String label;
    private final List<IrInst> instructions = new ArrayList<>();
    /** 块首的 alloca 个数（仅入口块使用） */
    private int allocaCount;
    private IrTerminator terminator;

    public BasicBlock(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public List<IrInst> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public void addInstruction(IrInst inst) {
        ensureOpen("append instruction to");
        instructions.add(inst);
    }

    /**
     * 在块首的 alloca 区末尾插入栈槽分配。
     * 栈槽与所在语句无关，入口块封闭后仍可插入。
     */
    public void insertAlloca(IrInst inst) {
        if (inst.getOp() != IrOp.ALLOCA) {
            throw new IllegalArgumentException("expected alloca, got " + inst.getOp());
        }
        instructions.add(allocaCount++, inst);
    }

    public IrTerminator getTerminator() { return terminator; }

    public void setTerminator(IrTerminator terminator) {
        ensureOpen("terminate");
        this.terminator = terminator;
    }

    public boolean hasTerminator() {
        return terminator != null;
    }

    private void ensureOpen(String action) {
        if (terminator != null) {
            throw new IllegalStateException("cannot " + action + " terminated block '" + label + "'");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(":\n");
        for (IrInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        if (terminator != null) {
            sb.append("  ").append(terminator).append('\n');
        }
        return sb.toString();
    }
}
