package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final String symbol;
    private final BinaryOp operator;  // 前端给出未知符号时为 null，由降级阶段报错
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        this(location, left, operator.getSymbol(), right);
    }

    public BinaryExpr(SourceLocation location, Expression left, String symbol, Expression right) {
        super(location);
        this.left = left;
        this.symbol = symbol;
        this.operator = BinaryOp.fromSymbol(symbol);
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public String getSymbol() {
        return symbol;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑
        AND("&&"),
        OR("||");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * 按源码符号查找运算符，未知符号返回 null。
         */
        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            return null;
        }
    }
}
