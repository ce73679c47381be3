package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 限定名调用：{@code module.function(args)}，通过 extern 重载表解析
 */
public class MethodCallExpr extends Expression {
    private final String target;
    private final String method;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, String target, String method, List<Expression> args) {
        super(location);
        this.target = target;
        this.method = method;
        this.args = args != null ? args : Collections.emptyList();
    }

    public String getTarget() {
        return target;
    }

    public String getMethod() {
        return method;
    }

    /** 重载表中的键，如 {@code io.print} */
    public String getQualifiedName() {
        return target + "." + method;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
