package com.arxlang.compiler.ast.decl;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.stmt.Statement;
import com.arxlang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 */
public class FunDecl extends AstNode {
    private final String name;
    private final List<Parameter> params;
    private final TypeRef returnType;
    private final List<Statement> body;

    public FunDecl(SourceLocation location, String name, List<Parameter> params,
                   TypeRef returnType, List<Statement> body) {
        super(location);
        this.name = name;
        this.params = params != null ? params : Collections.emptyList();
        this.returnType = returnType;
        this.body = body != null ? body : Collections.emptyList();
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public List<Statement> getBody() {
        return body;
    }
}
