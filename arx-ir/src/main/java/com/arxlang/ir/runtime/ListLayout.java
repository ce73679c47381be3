package com.arxlang.ir.runtime;

import com.arxlang.ir.ssa.IrModule;
import com.arxlang.ir.ssa.IrType;

import java.util.Arrays;

/**
 * 列表运行时记录 {@code %List = type { i8*, i32, i32, i64, i1 }}。
 *
 * <p>字段依次为：数据指针、长度、元素字节数、保留字段、元素是否为指针。
 * 列表值一律以 {@code %List*} 传递，由 {@code core_list_create} 产生。</p>
 */
public final class ListLayout {

    public static final String STRUCT_NAME = "List";

    public static final IrType LIST_TYPE = IrType.struct(STRUCT_NAME, Arrays.asList(
            IrType.I8_PTR, IrType.I32, IrType.I32, IrType.I64, IrType.I1));

    public static final IrType LIST_PTR = LIST_TYPE.pointer();

    private ListLayout() {}

    /** 在模块中登记 List 记录类型（幂等） */
    public static IrType register(IrModule module) {
        return module.registerStruct(LIST_TYPE);
    }

    public static boolean isListPointer(IrType type) {
        return LIST_PTR.equals(type);
    }
}
