package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;
import com.arxlang.compiler.ast.type.TypeRef;

/**
 * 变量声明：{@code int x = expr}
 */
public class DeclarationStmt extends Statement {
    private final TypeRef type;
    private final String name;
    private final Expression initializer;

    public DeclarationStmt(SourceLocation location, TypeRef type, String name, Expression initializer) {
        super(location);
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitDeclarationStmt(this, context);
    }
}
