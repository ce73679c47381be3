package com.arxlang.ir.lowering;

import com.arxlang.ir.ssa.BasicBlock;
import com.arxlang.ir.ssa.IrBuilder;
import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.ssa.IrType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * 单个函数的降级状态：当前插入块、扁平变量表、循环目标栈、标签计数器。
 *
 * <p>变量作用域是整个函数：分支或循环体内声明的变量在其后仍可见，
 * 重复声明覆盖原绑定（包括类型）。</p>
 */
public class FunctionContext {

    private final IrFunction function;
    private final IrBuilder builder;
    private final IrType returnType;
    private final Map<String, VariableBinding> variables = new HashMap<>();
    private final Deque<BasicBlock> continueTargets = new ArrayDeque<>();
    private final Deque<BasicBlock> breakTargets = new ArrayDeque<>();
    private int ifCounter;
    private int loopCounter;

    public FunctionContext(IrFunction function) {
        this.function = function;
        this.builder = new IrBuilder(function);
        this.returnType = function.getReturnType();
    }

    public IrFunction getFunction() { return function; }
    public IrBuilder getBuilder() { return builder; }
    public IrType getReturnType() { return returnType; }

    // ========== 变量 ==========

    public void bind(VariableBinding binding) {
        variables.put(binding.getName(), binding);
    }

    public VariableBinding lookup(String name) {
        return variables.get(name);
    }

    // ========== 循环 ==========

    public void pushLoop(BasicBlock continueTarget, BasicBlock breakTarget) {
        continueTargets.push(continueTarget);
        breakTargets.push(breakTarget);
    }

    public void popLoop() {
        continueTargets.pop();
        breakTargets.pop();
    }

    /** 最内层循环的 continue 目标，不在循环内时返回 null */
    public BasicBlock continueTarget() {
        return continueTargets.peek();
    }

    public BasicBlock breakTarget() {
        return breakTargets.peek();
    }

    // ========== 标签 ==========

    public int nextIfId() {
        return ifCounter++;
    }

    public int nextLoopId() {
        return loopCounter++;
    }
}
