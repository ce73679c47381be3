package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

/**
 * 变量引用
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
