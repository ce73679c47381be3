package com.arxlang.ir.ssa;

import java.util.Objects;

/**
 * IR 操作数：局部 SSA 值、函数参数、立即数常量或字符串常量指针。
 */
public final class IrValue {

    public enum Kind {
        /** 指令结果 %name */
        LOCAL,
        /** 函数形参 %name */
        ARGUMENT,
        /** 立即数（整数、浮点、布尔、null） */
        CONSTANT,
        /** 指向全局字节数组首元素的常量表达式 */
        STRING_POINTER
    }

    private final Kind kind;
    private final IrType type;
    private final String name;
    private final Object constant;   // CONSTANT: Long / Double / Boolean / null；STRING_POINTER: IrGlobal

    private IrValue(Kind kind, IrType type, String name, Object constant) {
        this.kind = kind;
        this.type = type;
        this.name = name;
        this.constant = constant;
    }

    public static IrValue local(String name, IrType type) {
        return new IrValue(Kind.LOCAL, type, name, null);
    }

    public static IrValue argument(String name, IrType type) {
        return new IrValue(Kind.ARGUMENT, type, name, null);
    }

    public static IrValue constInt(IrType type, long value) {
        return new IrValue(Kind.CONSTANT, type, null, value);
    }

    public static IrValue i32(int value) {
        return constInt(IrType.I32, value);
    }

    public static IrValue i64(long value) {
        return constInt(IrType.I64, value);
    }

    public static IrValue bool(boolean value) {
        return new IrValue(Kind.CONSTANT, IrType.I1, null, value);
    }

    public static IrValue constDouble(double value) {
        return new IrValue(Kind.CONSTANT, IrType.DOUBLE, null, value);
    }

    /** 字符串常量首字节指针，类型 i8* */
    public static IrValue stringPointer(IrGlobal global) {
        return new IrValue(Kind.STRING_POINTER, IrType.I8_PTR, global.getName(), global);
    }

    public Kind getKind() { return kind; }

    public IrType getType() { return type; }

    public String getName() { return name; }

    public Object getConstant() { return constant; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrValue)) return false;
        IrValue other = (IrValue) o;
        return kind == other.kind && type.equals(other.type)
                && Objects.equals(name, other.name)
                && (kind == Kind.STRING_POINTER || Objects.equals(constant, other.constant));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type, name);
    }

    @Override
    public String toString() {
        switch (kind) {
            case LOCAL:
            case ARGUMENT:
                return type + " %" + name;
            case STRING_POINTER:
                return type + " @" + name;
            default:
                return type + " " + (constant == null ? "null" : constant);
        }
    }
}
