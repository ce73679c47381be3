package com.arxlang.compiler.ast.decl;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final TypeRef type;
    private final String name;

    public Parameter(SourceLocation location, TypeRef type, String name) {
        super(location);
        this.type = type;
        this.name = name;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }
}
