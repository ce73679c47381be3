package com.arxlang.ir.runtime;

import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.ssa.IrModule;
import com.arxlang.ir.ssa.IrType;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 运行时库（core 模块的 C 实现与 libc）函数的声明。
 * 每个符号在模块中只声明一次。
 */
public final class RuntimeFunctions {

    public static final String MALLOC = "malloc";
    public static final String LIST_CREATE = "core_list_create";
    public static final String LIST_LEN = "core_list_len";
    public static final String LIST_GET = "core_list_get";
    public static final String STRING_EQUAL = "core_string_equal";
    public static final String STRING_CONCAT = "core_string_concat";

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            MALLOC, LIST_CREATE, LIST_LEN, LIST_GET, STRING_EQUAL, STRING_CONCAT));

    private RuntimeFunctions() {}

    /** 运行时占用的符号，程序函数不能使用 */
    public static boolean isReserved(String symbol) {
        return RESERVED.contains(symbol);
    }

    /**
     * 按符号名声明运行时函数，非运行时符号返回 null。
     */
    public static IrFunction declare(IrModule module, String symbol) {
        switch (symbol) {
            case MALLOC: return malloc(module);
            case LIST_CREATE: return listCreate(module);
            case LIST_LEN: return listLen(module);
            case LIST_GET: return listGet(module);
            case STRING_EQUAL: return stringEqual(module);
            case STRING_CONCAT: return stringConcat(module);
            default: return null;
        }
    }

    /** {@code i8* malloc(i64)} */
    public static IrFunction malloc(IrModule module) {
        return module.getOrDeclare(MALLOC, IrType.I8_PTR, Collections.singletonList(IrType.I64));
    }

    /** {@code %List* core_list_create(i8* data, i32 length, i32 elementSize, i1 pointerElements)} */
    public static IrFunction listCreate(IrModule module) {
        return module.getOrDeclare(LIST_CREATE, ListLayout.LIST_PTR,
                Arrays.asList(IrType.I8_PTR, IrType.I32, IrType.I32, IrType.I1));
    }

    /** {@code i32 core_list_len(%List*)} */
    public static IrFunction listLen(IrModule module) {
        return module.getOrDeclare(LIST_LEN, IrType.I32, Collections.singletonList(ListLayout.LIST_PTR));
    }

    /** {@code i8* core_list_get(%List*, i32)}，返回元素槽地址或指针元素本身 */
    public static IrFunction listGet(IrModule module) {
        return module.getOrDeclare(LIST_GET, IrType.I8_PTR, Arrays.asList(ListLayout.LIST_PTR, IrType.I32));
    }

    /** {@code i1 core_string_equal(i8*, i8*)} */
    public static IrFunction stringEqual(IrModule module) {
        return module.getOrDeclare(STRING_EQUAL, IrType.I1, Arrays.asList(IrType.I8_PTR, IrType.I8_PTR));
    }

    /** {@code i8* core_string_concat(i8*, i8*)} */
    public static IrFunction stringConcat(IrModule module) {
        return module.getOrDeclare(STRING_CONCAT, IrType.I8_PTR, Arrays.asList(IrType.I8_PTR, IrType.I8_PTR));
    }
}
