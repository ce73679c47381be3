package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInt(SourceLocation location, int value) {
        return new Literal(location, value, LiteralKind.INT);
    }

    public static Literal ofFloat(SourceLocation location, double value) {
        return new Literal(location, value, LiteralKind.FLOAT);
    }

    public static Literal ofBool(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOL);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        BOOL,
        STRING
    }
}
