package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.type.TypeRef;
import com.arxlang.ir.runtime.ListLayout;
import com.arxlang.ir.ssa.IrType;

/**
 * 源码类型 → IR 类型。
 */
public final class SourceTypes {

    private SourceTypes() {}

    /**
     * 映射类型名，不支持的类型返回 null。
     */
    public static IrType toIrType(TypeRef type) {
        if (type.isList()) {
            return ListLayout.LIST_PTR;
        }
        switch (type.getName()) {
            case "int":    return IrType.I32;
            case "bool":   return IrType.I1;
            case "float":  return IrType.DOUBLE;
            case "string":
            case "str":    return IrType.I8_PTR;
            case "int*":   return IrType.I32_PTR;
            case "void":   return IrType.VOID;
            default:       return null;
        }
    }

    /** 变量、参数、列表元素的类型：必须可映射且不是 void */
    public static IrType requireValueType(TypeRef type, SourceLocation location) {
        IrType irType = toIrType(type);
        if (irType == null || irType.isVoid()) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Unsupported type '" + type + "'", location);
        }
        return irType;
    }

    /** 函数返回类型：允许 void */
    public static IrType requireReturnType(TypeRef type, SourceLocation location) {
        IrType irType = toIrType(type);
        if (irType == null) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Unsupported return type '" + type + "'", location);
        }
        return irType;
    }

    /** 错误信息中使用的类型名 */
    public static String describe(IrType type) {
        if (type.isInt(32)) return "int";
        if (type.isInt(1)) return "bool";
        if (type.equals(IrType.DOUBLE)) return "float";
        if (type.equals(IrType.I8_PTR)) return "str";
        if (type.equals(IrType.I32_PTR)) return "int*";
        if (ListLayout.isListPointer(type)) return "list";
        return type.toString();
    }
}
