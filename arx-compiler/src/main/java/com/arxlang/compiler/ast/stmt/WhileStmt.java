package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * While 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;

    public WhileStmt(SourceLocation location, Expression condition, List<Statement> body) {
        super(location);
        this.condition = condition;
        this.body = body != null ? body : Collections.emptyList();
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
