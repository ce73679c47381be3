package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;

/**
 * 赋值语句：目标必须是已声明的变量
 */
public class AssignStmt extends Statement {
    private final String name;
    private final Expression value;

    public AssignStmt(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
