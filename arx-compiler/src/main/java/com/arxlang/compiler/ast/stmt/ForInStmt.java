package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;
import com.arxlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * For-in 语句：{@code for T x in list { ... }}
 */
public class ForInStmt extends Statement {
    private final TypeRef elementType;
    private final String variable;
    private final Expression iterable;
    private final List<Statement> body;

    public ForInStmt(SourceLocation location, TypeRef elementType, String variable,
                     Expression iterable, List<Statement> body) {
        super(location);
        this.elementType = elementType;
        this.variable = variable;
        this.iterable = iterable;
        this.body = body != null ? body : Collections.emptyList();
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitForInStmt(this, context);
    }
}
