package com.arxlang.compiler.ast;

import com.arxlang.compiler.ast.stmt.*;

/**
 * 语句访问者接口
 *
 * <p>不提供默认实现，新增语句种类时所有降级访问者都必须显式处理。</p>
 */
public interface StatementVisitor<R, C> {

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitDeclarationStmt(DeclarationStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitIfChainStmt(IfChainStmt node, C ctx);

    R visitForInStmt(ForInStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitListDeclarationStmt(ListDeclarationStmt node, C ctx);
}
