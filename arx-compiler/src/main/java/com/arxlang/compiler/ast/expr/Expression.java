package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
