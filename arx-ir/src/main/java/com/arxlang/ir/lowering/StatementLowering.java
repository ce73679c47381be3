package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;
import com.arxlang.compiler.ast.expr.ListLiteral;
import com.arxlang.compiler.ast.stmt.*;
import com.arxlang.compiler.ast.type.TypeRef;
import com.arxlang.ir.runtime.ListLayout;
import com.arxlang.ir.runtime.ListRuntime;
import com.arxlang.ir.ssa.*;

import java.util.List;

/**
 * 语句降级。
 *
 * <p>块已终止后出现的语句降级到新的不可达块中，保证不会向已终止的块追加指令。</p>
 */
public class StatementLowering implements StatementVisitor<Void, FunctionContext> {

    private final ExpressionLowering expressions;
    private final ListRuntime lists;

    public StatementLowering(ExpressionLowering expressions) {
        this.expressions = expressions;
        this.lists = expressions.getListRuntime();
    }

    public void lowerBlock(List<Statement> statements, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        for (Statement stmt : statements) {
            if (builder.isTerminated()) {
                builder.switchToBlock(builder.newBlock("dead"));
            }
            stmt.accept(this, ctx);
        }
    }

    // ========== 简单语句 ==========

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FunctionContext ctx) {
        expressions.lower(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FunctionContext ctx) {
        IrType returnType = ctx.getReturnType();
        if (!node.hasValue()) {
            if (!returnType.isVoid()) {
                throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                        "Missing return value in function returning " + SourceTypes.describe(returnType),
                        node.getLocation());
            }
            ctx.getBuilder().retVoid();
            return null;
        }
        IrValue value = expressions.lowerValue(node.getValue(), ctx);
        if (returnType.isVoid()) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Cannot return a value from a void function", node.getLocation());
        }
        if (!value.getType().equals(returnType)) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Return type mismatch: expected " + SourceTypes.describe(returnType)
                            + ", got " + SourceTypes.describe(value.getType()), node.getLocation());
        }
        ctx.getBuilder().ret(value);
        return null;
    }

    @Override
    public Void visitDeclarationStmt(DeclarationStmt node, FunctionContext ctx) {
        IrType type = SourceTypes.requireValueType(node.getType(), node.getLocation());
        IrValue value;
        TypeRef elementType = node.getType().getElementType();
        if (node.getInitializer() instanceof ListLiteral && elementType != null) {
            IrType irElement = SourceTypes.requireValueType(elementType, node.getLocation());
            value = expressions.lowerListLiteral((ListLiteral) node.getInitializer(), irElement, ctx);
        } else {
            value = expressions.lowerValue(node.getInitializer(), ctx);
        }
        if (!value.getType().equals(type)) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Cannot initialize " + node.getType() + " variable '" + node.getName() + "' with "
                            + SourceTypes.describe(value.getType()), node.getLocation());
        }
        declare(node.getName(), type, value, ctx);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, FunctionContext ctx) {
        VariableBinding binding = ctx.lookup(node.getName());
        if (binding == null) {
            throw new LoweringException(LoweringException.Kind.UNRESOLVED_REFERENCE,
                    "Undefined variable: " + node.getName(), node.getLocation());
        }
        IrValue value = expressions.lowerValue(node.getValue(), ctx);
        if (!value.getType().equals(binding.getType())) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Cannot assign " + SourceTypes.describe(value.getType()) + " to '" + node.getName()
                            + "' of type " + SourceTypes.describe(binding.getType()), node.getLocation());
        }
        ctx.getBuilder().store(value, binding.getSlot());
        return null;
    }

    @Override
    public Void visitListDeclarationStmt(ListDeclarationStmt node, FunctionContext ctx) {
        IrValue value;
        if (node.getInitializer() instanceof ListLiteral) {
            IrType elementType = SourceTypes.requireValueType(node.getElementType(), node.getLocation());
            value = expressions.lowerListLiteral((ListLiteral) node.getInitializer(), elementType, ctx);
        } else {
            // 非字面量：直接以初始化表达式自身的类型绑定
            value = expressions.lowerValue(node.getInitializer(), ctx);
        }
        declare(node.getName(), value.getType(), value, ctx);
        return null;
    }

    private void declare(String name, IrType type, IrValue value, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        IrValue slot = builder.alloca(type, name + ".addr");
        builder.store(value, slot);
        ctx.bind(new VariableBinding(name, slot, type));
    }

    // ========== 控制流 ==========

    /**
     * if / else if / else 链。
     * <pre>
     *   [cond0] → then0 | next0
     *   next0:  [cond1] → then1 | end
     *   thenK:  body; br end
     * </pre>
     */
    @Override
    public Void visitIfChainStmt(IfChainStmt node, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        int id = ctx.nextIfId();
        String prefix = "if" + id;
        BasicBlock endBlock = builder.newBlock(prefix + ".end");
        List<IfBranch> branches = node.getBranches();
        boolean fellThrough = false;
        boolean lastHasCondition = false;

        for (int i = 0; i < branches.size(); i++) {
            IfBranch branch = branches.get(i);
            boolean last = i == branches.size() - 1;
            BasicBlock thenBlock = builder.newBlock(prefix + ".then" + i);
            BasicBlock nextBlock = last ? endBlock : builder.newBlock(prefix + ".next" + i);

            if (branch.hasCondition()) {
                IrValue cond = lowerCondition(branch.getCondition(), ctx);
                builder.condBr(cond, thenBlock, nextBlock);
                lastHasCondition = last;
            } else {
                builder.br(thenBlock);
            }

            builder.switchToBlock(thenBlock);
            lowerBlock(branch.getBody(), ctx);
            if (!builder.isTerminated()) {
                builder.br(endBlock);
                fellThrough = true;
            }
            if (!last) {
                builder.switchToBlock(nextBlock);
            }
        }

        // 所有分支都显式终止时 end 块不可达，保持当前（已终止的）块不变
        if (fellThrough || lastHasCondition) {
            builder.switchToBlock(endBlock);
        }
        return null;
    }

    /**
     * for (T x in list)
     * <pre>
     *   entry:    idx = 0; br cond
     *   cond:     idx < core_list_len(list) ? body : end
     *   body:     x = core_list_get(list, idx); ...; br continue
     *   continue: idx = idx + 1; br cond
     * </pre>
     */
    @Override
    public Void visitForInStmt(ForInStmt node, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        IrType elementType = SourceTypes.requireValueType(node.getElementType(), node.getLocation());
        IrValue list = expressions.lowerValue(node.getIterable(), ctx);
        if (!ListLayout.isListPointer(list.getType())) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Cannot iterate over " + SourceTypes.describe(list.getType()), node.getIterable().getLocation());
        }

        String prefix = "for" + ctx.nextLoopId();
        String var = node.getVariable();
        IrValue index = builder.alloca(IrType.I32, var + ".index");
        builder.store(IrValue.i32(0), index);

        BasicBlock condBlock = builder.newBlock(prefix + ".cond");
        BasicBlock bodyBlock = builder.newBlock(prefix + ".body");
        BasicBlock continueBlock = builder.newBlock(prefix + ".continue");
        BasicBlock endBlock = builder.newBlock(prefix + ".end");
        builder.br(condBlock);

        builder.switchToBlock(condBlock);
        IrValue current = builder.load(index, var + ".i");
        IrValue length = lists.length(builder, list);
        IrValue inRange = builder.icmp(CmpPredicate.LT, current, length, prefix + ".test");
        builder.condBr(inRange, bodyBlock, endBlock);

        builder.switchToBlock(bodyBlock);
        IrValue element = lists.loadElement(builder, list, builder.load(index, var + ".i"), elementType, var);
        declare(var, elementType, element, ctx);
        lowerLoopBody(node.getBody(), continueBlock, endBlock, ctx);

        builder.switchToBlock(continueBlock);
        IrValue next = builder.binary(IrOp.ADD, builder.load(index, var + ".i"), IrValue.i32(1), var + ".next");
        builder.store(next, index);
        builder.br(condBlock);

        builder.switchToBlock(endBlock);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        String prefix = "while" + ctx.nextLoopId();
        BasicBlock condBlock = builder.newBlock(prefix + ".cond");
        BasicBlock bodyBlock = builder.newBlock(prefix + ".body");
        BasicBlock continueBlock = builder.newBlock(prefix + ".continue");
        BasicBlock endBlock = builder.newBlock(prefix + ".end");
        builder.br(condBlock);

        builder.switchToBlock(condBlock);
        IrValue cond = lowerCondition(node.getCondition(), ctx);
        builder.condBr(cond, bodyBlock, endBlock);

        builder.switchToBlock(bodyBlock);
        lowerLoopBody(node.getBody(), continueBlock, endBlock, ctx);

        builder.switchToBlock(continueBlock);
        builder.br(condBlock);

        builder.switchToBlock(endBlock);
        return null;
    }

    private void lowerLoopBody(List<Statement> body, BasicBlock continueBlock, BasicBlock endBlock,
                               FunctionContext ctx) {
        ctx.pushLoop(continueBlock, endBlock);
        try {
            lowerBlock(body, ctx);
        } finally {
            ctx.popLoop();
        }
        if (!ctx.getBuilder().isTerminated()) {
            ctx.getBuilder().br(continueBlock);
        }
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FunctionContext ctx) {
        BasicBlock target = ctx.breakTarget();
        if (target == null) {
            throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                    "'break' outside of a loop", node.getLocation());
        }
        ctx.getBuilder().br(target);
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FunctionContext ctx) {
        BasicBlock target = ctx.continueTarget();
        if (target == null) {
            throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                    "'continue' outside of a loop", node.getLocation());
        }
        ctx.getBuilder().br(target);
        return null;
    }

    private IrValue lowerCondition(Expression condition, FunctionContext ctx) {
        IrValue value = expressions.lowerValue(condition, ctx);
        if (!value.getType().isInt(1)) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Condition must be bool, got " + SourceTypes.describe(value.getType()),
                    condition.getLocation());
        }
        return value;
    }
}
