package com.arxlang.compiler.ast;

import com.arxlang.compiler.ast.expr.*;

/**
 * 表达式访问者接口（无默认实现，保证穷尽处理）
 */
public interface ExpressionVisitor<R, C> {

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMethodCallExpr(MethodCallExpr node, C ctx);

    R visitListLiteral(ListLiteral node, C ctx);
}
