package com.arxlang.ir.extern;

import com.arxlang.ir.ssa.IrType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部函数的一个重载：限定名 + 参数标记元组 → 目标符号与返回类型。
 */
public class ExternOverload {

    private final String module;
    private final String function;
    private final List<TypeTag> argTags;
    private final String targetSymbol;
    private final String returnTag;    // 描述文件中的原始文本
    private final int line;

    public ExternOverload(String module, String function, List<TypeTag> argTags,
                          String targetSymbol, String returnTag, int line) {
        this.module = module;
        this.function = function;
        this.argTags = Collections.unmodifiableList(new ArrayList<>(argTags));
        this.targetSymbol = targetSymbol;
        this.returnTag = returnTag;
        this.line = line;
    }

    public String getModule() { return module; }
    public String getFunction() { return function; }
    public String getQualifiedName() { return module + "." + function; }
    public List<TypeTag> getArgTags() { return argTags; }
    public String getTargetSymbol() { return targetSymbol; }
    public String getReturnTag() { return returnTag; }
    public int getLine() { return line; }

    /** 返回值的 IR 类型；list 前缀的标记映射为 {@code %List*} */
    public IrType getReturnType() {
        return TypeTag.canonicalize(returnTag).getIrType();
    }

    /** 参数的 IR 类型，用于声明目标符号 */
    public List<IrType> getParamTypes() {
        List<IrType> types = new ArrayList<>(argTags.size());
        for (TypeTag tag : argTags) {
            types.add(tag.getIrType());
        }
        return types;
    }

    @Override
    public String toString() {
        return getQualifiedName() + argTags + " = " + targetSymbol + " > " + returnTag;
    }
}
