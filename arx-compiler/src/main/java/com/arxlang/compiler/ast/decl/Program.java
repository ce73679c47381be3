package com.arxlang.compiler.ast.decl;

import com.arxlang.compiler.ast.AstNode;
import com.arxlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 编译单元根节点
 */
public class Program extends AstNode {
    private final List<String> uses;        // 请求加载的 extern 模块名
    private final List<FunDecl> functions;

    public Program(SourceLocation location, List<String> uses, List<FunDecl> functions) {
        super(location);
        this.uses = uses != null ? uses : Collections.emptyList();
        this.functions = functions != null ? functions : Collections.emptyList();
    }

    public List<String> getUses() {
        return uses;
    }

    public List<FunDecl> getFunctions() {
        return functions;
    }
}
