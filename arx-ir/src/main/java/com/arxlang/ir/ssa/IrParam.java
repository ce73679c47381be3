package com.arxlang.ir.ssa;

/**
 * IR 函数参数
 */
public class IrParam {
    private final String name;
    private final IrType type;

    public IrParam(String name, IrType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() { return name; }
    public IrType getType() { return type; }

    public IrValue asValue() {
        return IrValue.argument(name, type);
    }

    @Override
    public String toString() {
        return type + " %" + name;
    }
}
