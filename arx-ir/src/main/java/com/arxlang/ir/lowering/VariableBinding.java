package com.arxlang.ir.lowering;

import com.arxlang.ir.ssa.IrType;
import com.arxlang.ir.ssa.IrValue;

/**
 * 变量绑定：名称 → (栈槽, 静态类型)。
 */
public class VariableBinding {
    private final String name;
    private final IrValue slot;   // 类型为 type*
    private final IrType type;

    public VariableBinding(String name, IrValue slot, IrType type) {
        this.name = name;
        this.slot = slot;
        this.type = type;
    }

    public String getName() { return name; }
    public IrValue getSlot() { return slot; }
    public IrType getType() { return type; }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
