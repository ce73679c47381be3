package com.arxlang.ir.ssa;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR 模块：一次编译的顶层容器。
 *
 * <p>持有目标三元组、所有函数（定义与声明，名称唯一）、字符串全局常量、
 * 命名结构体类型。各集合保持插入顺序，保证输出确定。</p>
 */
public class IrModule {

    private final String name;
    private String sourceFileName;
    private String targetTriple;
    private final Map<String, IrType> structTypes = new LinkedHashMap<>();
    private final Map<String, IrGlobal> globals = new LinkedHashMap<>();
    private final Map<String, IrFunction> functions = new LinkedHashMap<>();
    private int stringCounter;

    public IrModule(String name) {
        this.name = name;
        this.sourceFileName = name;
    }

    public String getName() { return name; }

    public String getSourceFileName() { return sourceFileName; }
    public void setSourceFileName(String sourceFileName) { this.sourceFileName = sourceFileName; }

    public String getTargetTriple() { return targetTriple; }
    public void setTargetTriple(String targetTriple) { this.targetTriple = targetTriple; }

    // ========== 结构体类型 ==========

    /** 注册命名结构体；同名重复注册时返回已有类型 */
    public IrType registerStruct(IrType struct) {
        if (struct.getKind() != IrType.Kind.STRUCT) {
            throw new IllegalArgumentException("not a struct type: " + struct);
        }
        IrType existing = structTypes.putIfAbsent(struct.getStructName(), struct);
        return existing != null ? existing : struct;
    }

    public IrType getStruct(String structName) {
        return structTypes.get(structName);
    }

    public Collection<IrType> getStructTypes() {
        return Collections.unmodifiableCollection(structTypes.values());
    }

    // ========== 全局常量 ==========

    /**
     * 为字符串创建以 NUL 结尾的私有全局常量，名称形如 {@code str.N}。
     */
    public IrGlobal addStringConstant(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[utf8.length + 1];
        System.arraycopy(utf8, 0, data, 0, utf8.length);
        String globalName;
        do {
            globalName = "str." + stringCounter++;
        } while (globals.containsKey(globalName) || functions.containsKey(globalName));
        IrGlobal global = new IrGlobal(globalName, data);
        globals.put(globalName, global);
        return global;
    }

    public Collection<IrGlobal> getGlobals() {
        return Collections.unmodifiableCollection(globals.values());
    }

    // ========== 函数 ==========

    public IrFunction getFunction(String functionName) {
        return functions.get(functionName);
    }

    public boolean hasFunction(String functionName) {
        return functions.containsKey(functionName);
    }

    public Collection<IrFunction> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /**
     * 添加函数，名称已被占用时抛出 {@link IllegalStateException}。
     */
    public IrFunction addFunction(IrFunction function) {
        if (functions.containsKey(function.getName()) || globals.containsKey(function.getName())) {
            throw new IllegalStateException("duplicate symbol '" + function.getName() + "'");
        }
        functions.put(function.getName(), function);
        return function;
    }

    /**
     * 按符号名记忆化的外部声明：已存在时返回原函数，签名不一致时抛出 {@link IllegalStateException}。
     */
    public IrFunction getOrDeclare(String symbol, IrType returnType, List<IrType> paramTypes) {
        IrFunction existing = functions.get(symbol);
        if (existing != null) {
            if (!existing.hasSignature(returnType, paramTypes)) {
                throw new IllegalStateException("symbol '" + symbol + "' already declared as "
                        + existing.getReturnType() + existing.getParamTypes() + ", requested "
                        + returnType + paramTypes);
            }
            return existing;
        }
        List<IrParam> params = new ArrayList<>(paramTypes.size());
        for (int i = 0; i < paramTypes.size(); i++) {
            params.add(new IrParam("arg" + i, paramTypes.get(i)));
        }
        return addFunction(new IrFunction(symbol, returnType, params));
    }

    @Override
    public String toString() {
        return "IrModule{" + name + ", functions=" + functions.keySet() + "}";
    }
}
