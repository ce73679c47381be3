package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.SourceLocation;

/**
 * 降级异常。所有降级错误对整个编译单元都是致命的。
 */
public class LoweringException extends RuntimeException {

    public enum Kind {
        /** 未定义的变量、找不到的外部限定名 */
        UNRESOLVED_REFERENCE,
        /** 外部函数没有与参数类型精确匹配的重载 */
        OVERLOAD_MISMATCH,
        /** 赋值/声明/返回类型不符、不支持的类型、非 bool 条件、非列表迭代对象 */
        TYPE_MISMATCH,
        /** 运算符不支持该操作数类型 */
        UNIMPLEMENTED,
        /** 函数末尾缺少终止、循环外的 break/continue、重复定义的函数 */
        STRUCTURAL
    }

    private final Kind kind;
    private final SourceLocation location;

    public LoweringException(Kind kind, String message, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Kind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location.isKnown()) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
