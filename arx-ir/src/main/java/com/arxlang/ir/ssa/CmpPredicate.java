package com.arxlang.ir.ssa;

/**
 * icmp / fcmp 谓词。整数比较一律有符号，浮点比较一律有序。
 */
public enum CmpPredicate {
    EQ("eq", "oeq"),
    NE("ne", "one"),
    LT("slt", "olt"),
    LE("sle", "ole"),
    GT("sgt", "ogt"),
    GE("sge", "oge");

    private final String intMnemonic;
    private final String floatMnemonic;

    CmpPredicate(String intMnemonic, String floatMnemonic) {
        this.intMnemonic = intMnemonic;
        this.floatMnemonic = floatMnemonic;
    }

    public String getIntMnemonic() { return intMnemonic; }

    public String getFloatMnemonic() { return floatMnemonic; }
}
