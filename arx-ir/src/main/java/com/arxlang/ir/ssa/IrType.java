package com.arxlang.ir.ssa;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * IR 类型，对应 LLVM 一等类型的子集。
 *
 * <p>命名结构体按名称比较，其余类型按结构比较。</p>
 */
public final class IrType {

    public enum Kind {
        VOID, INT, DOUBLE, POINTER, ARRAY, STRUCT
    }

    public static final IrType VOID = new IrType(Kind.VOID, 0, null, null, null);
    public static final IrType I1 = ofInt(1);
    public static final IrType I8 = ofInt(8);
    public static final IrType I32 = ofInt(32);
    public static final IrType I64 = ofInt(64);
    public static final IrType DOUBLE = new IrType(Kind.DOUBLE, 0, null, null, null);
    public static final IrType I8_PTR = pointerTo(I8);
    public static final IrType I32_PTR = pointerTo(I32);

    private final Kind kind;
    private final int size;               // INT: 位宽；ARRAY: 元素个数
    private final IrType element;         // POINTER: 指向类型；ARRAY: 元素类型
    private final String structName;      // STRUCT 时使用
    private final List<IrType> fields;    // STRUCT 时使用

    private IrType(Kind kind, int size, IrType element, String structName, List<IrType> fields) {
        this.kind = kind;
        this.size = size;
        this.element = element;
        this.structName = structName;
        this.fields = fields;
    }

    public static IrType ofInt(int bits) {
        return new IrType(Kind.INT, bits, null, null, null);
    }

    public static IrType pointerTo(IrType pointee) {
        return new IrType(Kind.POINTER, 0, pointee, null, null);
    }

    public static IrType arrayOf(int count, IrType element) {
        return new IrType(Kind.ARRAY, count, element, null, null);
    }

    public static IrType struct(String name, List<IrType> fields) {
        return new IrType(Kind.STRUCT, 0, null, name, Collections.unmodifiableList(fields));
    }

    public Kind getKind() { return kind; }

    public int getBits() { return size; }

    public int getCount() { return size; }

    public IrType getElement() { return element; }

    public String getStructName() { return structName; }

    public List<IrType> getFields() { return fields; }

    public boolean isVoid() { return kind == Kind.VOID; }

    public boolean isPointer() { return kind == Kind.POINTER; }

    public boolean isInt(int bits) {
        return kind == Kind.INT && size == bits;
    }

    /** 指针所指类型，非指针调用时抛出 IllegalStateException */
    public IrType pointee() {
        if (kind != Kind.POINTER) {
            throw new IllegalStateException("not a pointer type: " + this);
        }
        return element;
    }

    public IrType pointer() {
        return pointerTo(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrType)) return false;
        IrType other = (IrType) o;
        if (kind != other.kind) return false;
        switch (kind) {
            case INT:
                return size == other.size;
            case POINTER:
                return element.equals(other.element);
            case ARRAY:
                return size == other.size && element.equals(other.element);
            case STRUCT:
                return structName.equals(other.structName);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, size, element, structName);
    }

    /**
     * 带类型指针的 LLVM 文本形式。
     */
    @Override
    public String toString() {
        switch (kind) {
            case VOID:    return "void";
            case INT:     return "i" + size;
            case DOUBLE:  return "double";
            case POINTER: return element + "*";
            case ARRAY:   return "[" + size + " x " + element + "]";
            case STRUCT:  return "%" + structName;
            default:      return kind.name();
        }
    }
}
