package com.arxlang.compiler.ast.expr;

import com.arxlang.compiler.ast.ExpressionVisitor;
import com.arxlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 列表字面量：{@code [a, b, c]}
 */
public class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements != null ? elements : Collections.emptyList();
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitListLiteral(this, context);
    }
}
