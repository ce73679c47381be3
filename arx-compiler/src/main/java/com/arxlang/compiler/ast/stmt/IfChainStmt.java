package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;

import java.util.List;

/**
 * if / else if / else 链
 */
public class IfChainStmt extends Statement {
    private final List<IfBranch> branches;

    public IfChainStmt(SourceLocation location, List<IfBranch> branches) {
        super(location);
        this.branches = branches;
    }

    public List<IfBranch> getBranches() {
        return branches;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitIfChainStmt(this, context);
    }
}
