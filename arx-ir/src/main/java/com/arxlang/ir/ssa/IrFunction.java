package com.arxlang.ir.ssa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * IR 函数。没有基本块时视为外部声明（declare）。
 *
 * <p>基本块标签与局部值名共享同一个函数内命名空间。</p>
 */
public class IrFunction {

    private final String name;
    private final IrType returnType;
    private final List<IrParam> params;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final NameAllocator names = new NameAllocator();

    public IrFunction(String name, IrType returnType, List<IrParam> params) {
        this.name = name;
        this.returnType = returnType;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        for (IrParam param : params) {
            names.reserve(param.getName());
        }
    }

    public String getName() { return name; }
    public IrType getReturnType() { return returnType; }
    public List<IrParam> getParams() { return params; }

    public List<IrType> getParamTypes() {
        List<IrType> types = new ArrayList<>(params.size());
        for (IrParam param : params) {
            types.add(param.getType());
        }
        return types;
    }

    public boolean hasSignature(IrType returnType, List<IrType> paramTypes) {
        return this.returnType.equals(returnType) && getParamTypes().equals(paramTypes);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    public BasicBlock getEntryBlock() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("function '" + name + "' has no body");
        }
        return blocks.get(0);
    }

    /** 创建并追加基本块，标签在函数内唯一 */
    public BasicBlock newBlock(String hint) {
        BasicBlock block = new BasicBlock(names.allocate(hint));
        blocks.add(block);
        return block;
    }

    /** 分配函数内唯一的局部值名 */
    public String newValueName(String hint) {
        return names.allocate(hint);
    }

    /**
     * 从入口块出发经终止指令可达的基本块（BFS 顺序）。未终止的块没有出边。
     */
    public List<BasicBlock> reachableBlocks() {
        List<BasicBlock> order = new ArrayList<>();
        if (blocks.isEmpty()) return order;
        Set<BasicBlock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        BasicBlock entry = blocks.get(0);
        seen.add(entry);
        worklist.add(entry);
        while (!worklist.isEmpty()) {
            BasicBlock block = worklist.poll();
            order.add(block);
            if (block.getTerminator() == null) continue;
            for (BasicBlock succ : block.getTerminator().getSuccessors()) {
                if (seen.add(succ)) worklist.add(succ);
            }
        }
        return order;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(isDeclaration() ? "declare " : "define ");
        sb.append(returnType).append(" @").append(name).append(params);
        if (!isDeclaration()) {
            sb.append(" {\n");
            for (BasicBlock block : blocks) {
                sb.append(block);
            }
            sb.append("}");
        }
        return sb.toString();
    }
}
