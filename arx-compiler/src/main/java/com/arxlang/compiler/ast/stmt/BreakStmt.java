package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
