package com.arxlang.ir.runtime;

import com.arxlang.ir.ssa.IrType;

/**
 * 目标 ABI 下的类型字节数。指针宽度固定为 8；结构体按字段大小求和，不计填充。
 */
public final class TypeLayout {

    public static final int POINTER_SIZE = 8;

    private TypeLayout() {}

    public static long sizeOf(IrType type) {
        switch (type.getKind()) {
            case INT:
                return type.getBits() <= 8 ? 1 : (type.getBits() + 7) / 8;
            case DOUBLE:
                return 8;
            case POINTER:
                return POINTER_SIZE;
            case ARRAY:
                return type.getCount() * sizeOf(type.getElement());
            case STRUCT: {
                long total = 0;
                for (IrType field : type.getFields()) {
                    total += sizeOf(field);
                }
                return total;
            }
            default:
                throw new IllegalArgumentException("type has no size: " + type);
        }
    }

    /** 元素以指针形式存放（字符串、列表等），影响 {@code core_list_get} 结果的解释方式 */
    public static boolean isPointerElement(IrType type) {
        return type.isPointer();
    }
}
