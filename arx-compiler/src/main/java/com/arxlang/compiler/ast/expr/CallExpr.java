package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 裸名函数调用：{@code f(a, b)}
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args != null ? args : Collections.emptyList();
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
