package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * if 链中的一个分支。condition 为 null 表示无条件的 else 分支。
 */
public class IfBranch extends AstNode {
    private final Expression condition;
    private final List<Statement> body;

    public IfBranch(SourceLocation location, Expression condition, List<Statement> body) {
        super(location);
        this.condition = condition;
        this.body = body != null ? body : Collections.emptyList();
    }

    public Expression getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public List<Statement> getBody() {
        return body;
    }
}
