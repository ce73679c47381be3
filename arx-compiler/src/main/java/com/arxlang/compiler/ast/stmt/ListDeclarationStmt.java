package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;
import com.arxlang.compiler.ast.expr.Expression;
import com.arxlang.compiler.ast.type.TypeRef;

/**
 * 列表变量声明：{@code list<T> name = [a, b, c]}
 *
 * <p>elementType 是元素类型 T，而不是 list&lt;T&gt; 本身。</p>
 */
public class ListDeclarationStmt extends Statement {
    private final TypeRef elementType;
    private final String name;
    private final Expression initializer;

    public ListDeclarationStmt(SourceLocation location, TypeRef elementType, String name,
                               Expression initializer) {
        super(location);
        this.elementType = elementType;
        this.name = name;
        this.initializer = initializer;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitListDeclarationStmt(this, context);
    }
}
