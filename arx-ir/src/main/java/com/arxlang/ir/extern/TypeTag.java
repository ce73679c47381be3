package com.arxlang.ir.extern;

import com.arxlang.ir.runtime.ListLayout;
import com.arxlang.ir.ssa.IrType;

/**
 * 外部函数签名中的参数/返回类型标记。
 */
public enum TypeTag {
    INT("int", IrType.I32),
    BOOL("bool", IrType.I1),
    STR("str", IrType.I8_PTR),
    FLOAT("float", IrType.DOUBLE),
    INT_PTR("int*", IrType.I32_PTR),
    LIST("list", ListLayout.LIST_PTR),
    VOID("void", IrType.VOID);

    private final String tag;
    private final IrType irType;

    TypeTag(String tag, IrType irType) {
        this.tag = tag;
        this.irType = irType;
    }

    public String getTag() { return tag; }

    public IrType getIrType() { return irType; }

    /**
     * 由 IR 值的类型计算标记；无对应标记的类型归为 VOID。
     */
    public static TypeTag fromIrType(IrType type) {
        for (TypeTag t : values()) {
            if (t != VOID && t.irType.equals(type)) return t;
        }
        return VOID;
    }

    /**
     * 规范化描述文件中的标记文本：{@code string} 视同 {@code str}，
     * 以 {@code list} 开头的一律视为 {@code list}，无法识别的归为 VOID。
     */
    public static TypeTag canonicalize(String text) {
        String s = text.trim();
        if ("string".equals(s)) return STR;
        if (s.startsWith("list")) return LIST;
        for (TypeTag t : values()) {
            if (t.tag.equals(s)) return t;
        }
        return VOID;
    }

    @Override
    public String toString() {
        return tag;
    }
}
