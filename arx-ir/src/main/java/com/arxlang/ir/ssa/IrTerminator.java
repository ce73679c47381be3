package com.arxlang.ir.ssa;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基本块终止指令。每个基本块必须恰好有一个终止指令；目标块按对象引用。
 */
public abstract class IrTerminator {

    /** 后继基本块（按出边顺序） */
    public abstract List<BasicBlock> getSuccessors();

    /**
     * 无条件跳转。
     */
    public static class Goto extends IrTerminator {
        private final BasicBlock target;

        public Goto(BasicBlock target) {
            this.target = target;
        }

        public BasicBlock getTarget() { return target; }

        @Override
        public List<BasicBlock> getSuccessors() {
            return Collections.singletonList(target);
        }

        @Override
        public String toString() {
            return "br label %" + target.getLabel();
        }
    }

    /**
     * 条件分支。
     */
    public static class Branch extends IrTerminator {
        private final IrValue condition;
        private final BasicBlock thenBlock;
        private final BasicBlock elseBlock;

        public Branch(IrValue condition, BasicBlock thenBlock, BasicBlock elseBlock) {
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public IrValue getCondition() { return condition; }
        public BasicBlock getThenBlock() { return thenBlock; }
        public BasicBlock getElseBlock() { return elseBlock; }

        @Override
        public List<BasicBlock> getSuccessors() {
            return Arrays.asList(thenBlock, elseBlock);
        }

        @Override
        public String toString() {
            return "br " + condition + ", label %" + thenBlock.getLabel()
                    + ", label %" + elseBlock.getLabel();
        }
    }

    /**
     * 返回。
     */
    public static class Return extends IrTerminator {
        private final IrValue value;   // null = ret void

        public Return(IrValue value) {
            this.value = value;
        }

        public IrValue getValue() { return value; }

        public boolean isVoid() { return value == null; }

        @Override
        public List<BasicBlock> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return value != null ? "ret " + value : "ret void";
        }
    }

    /**
     * 不可达。
     */
    public static class Unreachable extends IrTerminator {
        @Override
        public List<BasicBlock> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() { return "unreachable"; }
    }
}
