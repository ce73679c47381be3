package com.arxlang.compiler.ast.stmt;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.StatementVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
