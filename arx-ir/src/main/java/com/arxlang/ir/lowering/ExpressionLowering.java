package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.expr.*;
import com.arxlang.ir.extern.ExternOverload;
import com.arxlang.ir.extern.OverloadTable;
import com.arxlang.ir.extern.TypeTag;
import com.arxlang.ir.runtime.ListRuntime;
import com.arxlang.ir.runtime.RuntimeFunctions;
import com.arxlang.ir.ssa.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * 表达式降级：每个表达式产生恰好一个带类型的 IR 值（void 调用除外，返回 null）。
 */
public class ExpressionLowering implements ExpressionVisitor<IrValue, FunctionContext> {

    private static final Logger LOG = Logger.getLogger(ExpressionLowering.class.getName());

    private final IrModule module;
    private final OverloadTable externs;
    private final ListRuntime lists;

    public ExpressionLowering(IrModule module, OverloadTable externs) {
        this.module = module;
        this.externs = externs;
        this.lists = new ListRuntime(module);
    }

    /** 降级表达式，void 调用返回 null */
    public IrValue lower(Expression expr, FunctionContext ctx) {
        return expr.accept(this, ctx);
    }

    /** 降级必须产生值的表达式 */
    public IrValue lowerValue(Expression expr, FunctionContext ctx) {
        IrValue value = expr.accept(this, ctx);
        if (value == null) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Void value used in expression", expr.getLocation());
        }
        return value;
    }

    // ========== 字面量与变量 ==========

    @Override
    public IrValue visitLiteral(Literal node, FunctionContext ctx) {
        switch (node.getKind()) {
            case INT:
                return IrValue.i32(((Number) node.getValue()).intValue());
            case FLOAT:
                return IrValue.constDouble(((Number) node.getValue()).doubleValue());
            case BOOL:
                return IrValue.bool((Boolean) node.getValue());
            case STRING:
                return IrValue.stringPointer(module.addStringConstant((String) node.getValue()));
            default:
                throw new LoweringException(LoweringException.Kind.UNIMPLEMENTED,
                        "Unsupported literal kind " + node.getKind(), node.getLocation());
        }
    }

    @Override
    public IrValue visitIdentifier(Identifier node, FunctionContext ctx) {
        VariableBinding binding = ctx.lookup(node.getName());
        if (binding == null) {
            throw new LoweringException(LoweringException.Kind.UNRESOLVED_REFERENCE,
                    "Undefined variable: " + node.getName(), node.getLocation());
        }
        return ctx.getBuilder().load(binding.getSlot(), node.getName());
    }

    // ========== 二元运算 ==========

    @Override
    public IrValue visitBinaryExpr(BinaryExpr node, FunctionContext ctx) {
        IrValue left = lowerValue(node.getLeft(), ctx);
        IrValue right = lowerValue(node.getRight(), ctx);
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op == null) {
            throw unsupported(node, left.getType());
        }
        if (!left.getType().equals(right.getType())) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Operands of '" + node.getSymbol() + "' have different types: "
                            + SourceTypes.describe(left.getType()) + " and "
                            + SourceTypes.describe(right.getType()), node.getLocation());
        }

        IrType type = left.getType();
        IrBuilder builder = ctx.getBuilder();
        if (type.equals(IrType.I8_PTR)) {
            return lowerStringOp(node, op, left, right, builder);
        }
        if (type.isInt(32)) {
            return lowerIntOp(node, op, left, right, builder);
        }
        if (type.equals(IrType.DOUBLE)) {
            return lowerFloatOp(node, op, left, right, builder);
        }
        if (type.isInt(1)) {
            switch (op) {
                case AND: return builder.binary(IrOp.AND, left, right, "and");
                case OR:  return builder.binary(IrOp.OR, left, right, "or");
                case EQ:  return builder.icmp(CmpPredicate.EQ, left, right, "cmp");
                case NE:  return builder.icmp(CmpPredicate.NE, left, right, "cmp");
                default:  throw unsupported(node, type);
            }
        }
        if (type.isPointer()) {
            switch (op) {
                case EQ: return builder.icmp(CmpPredicate.EQ, left, right, "cmp");
                case NE: return builder.icmp(CmpPredicate.NE, left, right, "cmp");
                default: throw unsupported(node, type);
            }
        }
        throw unsupported(node, type);
    }

    /** 字符串只支持 == 与 +，分别转为运行时调用 */
    private IrValue lowerStringOp(BinaryExpr node, BinaryExpr.BinaryOp op, IrValue left, IrValue right,
                                  IrBuilder builder) {
        switch (op) {
            case EQ:
                return builder.call(RuntimeFunctions.stringEqual(module), Arrays.asList(left, right), "streq");
            case ADD:
                return builder.call(RuntimeFunctions.stringConcat(module), Arrays.asList(left, right), "strcat");
            default:
                throw unsupported(node, left.getType());
        }
    }

    private IrValue lowerIntOp(BinaryExpr node, BinaryExpr.BinaryOp op, IrValue left, IrValue right,
                               IrBuilder builder) {
        switch (op) {
            case ADD: return builder.binary(IrOp.ADD, left, right, "add");
            case SUB: return builder.binary(IrOp.SUB, left, right, "sub");
            case MUL: return builder.binary(IrOp.MUL, left, right, "mul");
            case DIV: return builder.binary(IrOp.SDIV, left, right, "div");
            case MOD: return builder.binary(IrOp.SREM, left, right, "rem");
            case AND:
            case OR:
                throw unsupported(node, left.getType());
            default:
                return builder.icmp(predicate(op), left, right, "cmp");
        }
    }

    private IrValue lowerFloatOp(BinaryExpr node, BinaryExpr.BinaryOp op, IrValue left, IrValue right,
                                 IrBuilder builder) {
        switch (op) {
            case ADD: return builder.binary(IrOp.FADD, left, right, "fadd");
            case SUB: return builder.binary(IrOp.FSUB, left, right, "fsub");
            case MUL: return builder.binary(IrOp.FMUL, left, right, "fmul");
            case DIV: return builder.binary(IrOp.FDIV, left, right, "fdiv");
            case MOD: return builder.binary(IrOp.FREM, left, right, "frem");
            case AND:
            case OR:
                throw unsupported(node, left.getType());
            default:
                return builder.fcmp(predicate(op), left, right, "fcmp");
        }
    }

    private static CmpPredicate predicate(BinaryExpr.BinaryOp op) {
        switch (op) {
            case EQ: return CmpPredicate.EQ;
            case NE: return CmpPredicate.NE;
            case LT: return CmpPredicate.LT;
            case LE: return CmpPredicate.LE;
            case GT: return CmpPredicate.GT;
            case GE: return CmpPredicate.GE;
            default: throw new IllegalArgumentException("not a comparison: " + op);
        }
    }

    private static LoweringException unsupported(BinaryExpr node, IrType type) {
        return new LoweringException(LoweringException.Kind.UNIMPLEMENTED,
                "Unsupported operator '" + node.getSymbol() + "' for type " + SourceTypes.describe(type),
                node.getLocation());
    }

    // ========== 调用 ==========

    @Override
    public IrValue visitCallExpr(CallExpr node, FunctionContext ctx) {
        List<IrValue> args = lowerArgs(node.getArgs(), ctx);
        IrFunction callee = existingFunction(node.getCallee());
        if (callee == null) {
            // 未声明的裸名调用：按首个调用点的实参类型声明为返回 i32 的外部函数
            List<IrType> argTypes = new ArrayList<>(args.size());
            for (IrValue arg : args) {
                argTypes.add(arg.getType());
            }
            callee = module.getOrDeclare(node.getCallee(), IrType.I32, argTypes);
            LOG.fine("Implicitly declared external function " + node.getCallee() + argTypes);
        } else {
            // 已有声明（程序函数、先前隐式声明或运行时函数）按其签名检查
            checkArguments(callee, args, node.getLocation());
        }
        return ctx.getBuilder().call(callee, args, "call");
    }

    /** 模块中已有的函数；运行时符号按其固定签名声明 */
    private IrFunction existingFunction(String symbol) {
        IrFunction function = module.getFunction(symbol);
        return function != null ? function : RuntimeFunctions.declare(module, symbol);
    }

    private void checkArguments(IrFunction callee, List<IrValue> args, SourceLocation location) {
        List<IrType> paramTypes = callee.getParamTypes();
        if (paramTypes.size() != args.size()) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Function " + callee.getName() + " expects " + paramTypes.size()
                            + " arguments, got " + args.size(), location);
        }
        for (int i = 0; i < args.size(); i++) {
            if (!paramTypes.get(i).equals(args.get(i).getType())) {
                throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                        "Argument " + (i + 1) + " of " + callee.getName() + " expects "
                                + SourceTypes.describe(paramTypes.get(i)) + ", got "
                                + SourceTypes.describe(args.get(i).getType()), location);
            }
        }
    }

    @Override
    public IrValue visitMethodCallExpr(MethodCallExpr node, FunctionContext ctx) {
        String qualifiedName = node.getQualifiedName();
        if (!externs.contains(qualifiedName)) {
            throw new LoweringException(LoweringException.Kind.UNRESOLVED_REFERENCE,
                    "Function " + qualifiedName + " not found in extern functions", node.getLocation());
        }
        List<IrValue> args = lowerArgs(node.getArgs(), ctx);
        List<TypeTag> tags = new ArrayList<>(args.size());
        for (IrValue arg : args) {
            tags.add(TypeTag.fromIrType(arg.getType()));
        }
        ExternOverload overload = externs.lookup(qualifiedName, tags);
        if (overload == null) {
            throw new LoweringException(LoweringException.Kind.OVERLOAD_MISMATCH,
                    "Function " + qualifiedName + " does not have " + tags + " arguments type match",
                    node.getLocation());
        }
        IrFunction target = existingFunction(overload.getTargetSymbol());
        if (target == null) {
            target = module.getOrDeclare(overload.getTargetSymbol(),
                    overload.getReturnType(), overload.getParamTypes());
        } else if (!target.hasSignature(overload.getReturnType(), overload.getParamTypes())) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Extern symbol " + overload.getTargetSymbol() + " of " + qualifiedName
                            + " conflicts with an existing declaration of a different signature",
                    node.getLocation());
        }
        return ctx.getBuilder().call(target, args, node.getMethod());
    }

    private List<IrValue> lowerArgs(List<Expression> args, FunctionContext ctx) {
        List<IrValue> values = new ArrayList<>(args.size());
        for (Expression arg : args) {
            values.add(lowerValue(arg, ctx));
        }
        return values;
    }

    // ========== 列表 ==========

    /**
     * 表达式位置的列表字面量：元素类型取首元素的类型。
     */
    @Override
    public IrValue visitListLiteral(ListLiteral node, FunctionContext ctx) {
        if (node.getElements().isEmpty()) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Cannot infer element type of empty list literal", node.getLocation());
        }
        List<IrValue> values = lowerArgs(node.getElements(), ctx);
        IrType elementType = values.get(0).getType();
        IrBuilder builder = ctx.getBuilder();
        IrValue data = lists.allocate(builder, elementType, values.size());
        for (int i = 0; i < values.size(); i++) {
            checkElement(values.get(i), elementType, node.getElements().get(i).getLocation());
            lists.storeElement(builder, data, elementType, i, values.get(i));
        }
        return lists.create(builder, data, elementType, values.size());
    }

    /**
     * 已知元素类型的列表字面量：先分配，再逐个降级并写入。
     */
    public IrValue lowerListLiteral(ListLiteral node, IrType elementType, FunctionContext ctx) {
        IrBuilder builder = ctx.getBuilder();
        List<Expression> elements = node.getElements();
        IrValue data = lists.allocate(builder, elementType, elements.size());
        for (int i = 0; i < elements.size(); i++) {
            IrValue value = lowerValue(elements.get(i), ctx);
            checkElement(value, elementType, elements.get(i).getLocation());
            lists.storeElement(builder, data, elementType, i, value);
        }
        return lists.create(builder, data, elementType, elements.size());
    }

    private static void checkElement(IrValue value, IrType elementType, SourceLocation location) {
        IrType type = value.getType();
        boolean matches = type.equals(elementType)
                || (type.isPointer() && type.pointee().equals(elementType));
        if (!matches) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "List element of type " + SourceTypes.describe(type) + " does not match "
                            + SourceTypes.describe(elementType), location);
        }
    }

    ListRuntime getListRuntime() {
        return lists;
    }
}
