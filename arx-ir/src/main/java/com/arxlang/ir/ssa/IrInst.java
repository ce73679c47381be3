package com.arxlang.ir.ssa;

import java.util.Collections;
import java.util.List;

/**
 * IR 指令（非终止）。
 *
 * <p>辅助字段按操作码解释：</p>
 * <ul>
 *   <li>ALLOCA: auxType = 被分配的类型</li>
 *   <li>GEP: auxType = 源元素类型，operands = [基址, 偏移...]</li>
 *   <li>ICMP / FCMP: predicate</li>
 *   <li>CALL: callee = 被调函数名，result 为 null 表示 void 调用</li>
 *   <li>STORE: operands = [值, 指针]，无结果</li>
 * </ul>
 */
public class IrInst {

    private final IrOp op;
    private final IrValue result;
    private final List<IrValue> operands;
    private final IrType auxType;
    private final CmpPredicate predicate;
    private final String callee;

    public IrInst(IrOp op, IrValue result, List<IrValue> operands,
                  IrType auxType, CmpPredicate predicate, String callee) {
        this.op = op;
        this.result = result;
        this.operands = Collections.unmodifiableList(operands);
        this.auxType = auxType;
        this.predicate = predicate;
        this.callee = callee;
    }

    public IrOp getOp() { return op; }
    public IrValue getResult() { return result; }
    public boolean hasResult() { return result != null; }
    public List<IrValue> getOperands() { return operands; }
    public IrValue getOperand(int index) { return operands.get(index); }
    public IrType getAuxType() { return auxType; }
    public CmpPredicate getPredicate() { return predicate; }
    public String getCallee() { return callee; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (result != null) {
            sb.append('%').append(result.getName()).append(" = ");
        }
        sb.append(op.getMnemonic());
        if (predicate != null) sb.append(' ').append(predicate.name().toLowerCase());
        if (callee != null) sb.append(" @").append(callee);
        if (auxType != null) sb.append(' ').append(auxType);
        for (IrValue operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }
}
