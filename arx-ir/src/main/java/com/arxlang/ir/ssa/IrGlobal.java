package com.arxlang.ir.ssa;

import java.util.Arrays;

/**
 * 模块级全局常量。目前只用于以 NUL 结尾的字符串字节数组。
 */
public class IrGlobal {

    private final String name;
    private final IrType type;
    private final byte[] data;

    public IrGlobal(String name, byte[] data) {
        this.name = name;
        this.data = data.clone();
        this.type = IrType.arrayOf(data.length, IrType.I8);
    }

    public String getName() { return name; }

    /** 内容类型，如 {@code [6 x i8]} */
    public IrType getType() { return type; }

    public byte[] getData() { return data.clone(); }

    @Override
    public String toString() {
        return "@" + name + " = " + type + " " + Arrays.toString(data);
    }
}
