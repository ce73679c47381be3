package com.arxlang.ir.ssa;

/**
 * IR 指令操作码（不含终止指令）。
 */
public enum IrOp {
    // 内存
    ALLOCA("alloca"),
    LOAD("load"),
    STORE("store"),
    GEP("getelementptr"),
    BITCAST("bitcast"),

    // 整数算术
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    SDIV("sdiv"),
    SREM("srem"),

    // 浮点算术
    FADD("fadd"),
    FSUB("fsub"),
    FMUL("fmul"),
    FDIV("fdiv"),
    FREM("frem"),

    // 位运算
    AND("and"),
    OR("or"),

    // 比较
    ICMP("icmp"),
    FCMP("fcmp"),

    CALL("call");

    private final String mnemonic;

    IrOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public boolean isBinary() {
        switch (this) {
            case ADD: case SUB: case MUL: case SDIV: case SREM:
            case FADD: case FSUB: case FMUL: case FDIV: case FREM:
            case AND: case OR:
                return true;
            default:
                return false;
        }
    }
}
