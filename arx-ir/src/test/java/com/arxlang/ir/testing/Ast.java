package com.arxlang.ir.testing;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.decl.FunDecl;
import com.arxlang.compiler.ast.decl.Parameter;
import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.compiler.ast.expr.*;
import com.arxlang.compiler.ast.stmt.*;
import com.arxlang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用 AST 构造快捷方法
 */
public final class Ast {

    public static final SourceLocation LOC = new SourceLocation("test.arx", 1, 1);

    private Ast() {}

    public static Program program(FunDecl... functions) {
        return new Program(LOC, Collections.<String>emptyList(), Arrays.asList(functions));
    }

    public static Program program(List<String> uses, FunDecl... functions) {
        return new Program(LOC, uses, Arrays.asList(functions));
    }

    public static FunDecl fun(String name, String returnType, List<Parameter> params, Statement... body) {
        return new FunDecl(LOC, name, params, TypeRef.parse(returnType), Arrays.asList(body));
    }

    public static FunDecl fun(String name, String returnType, Statement... body) {
        return fun(name, returnType, Collections.<Parameter>emptyList(), body);
    }

    public static List<Parameter> params(String... typeNamePairs) {
        List<Parameter> params = new ArrayList<>();
        for (int i = 0; i < typeNamePairs.length; i += 2) {
            params.add(new Parameter(LOC, TypeRef.parse(typeNamePairs[i]), typeNamePairs[i + 1]));
        }
        return params;
    }

    // ========== 语句 ==========

    public static Statement ret(Expression value) {
        return new ReturnStmt(LOC, value);
    }

    public static Statement retVoid() {
        return new ReturnStmt(LOC, null);
    }

    public static Statement expr(Expression expression) {
        return new ExpressionStmt(LOC, expression);
    }

    public static Statement declare(String type, String name, Expression value) {
        return new DeclarationStmt(LOC, TypeRef.parse(type), name, value);
    }

    public static Statement assign(String name, Expression value) {
        return new AssignStmt(LOC, name, value);
    }

    public static Statement declareList(String elementType, String name, Expression value) {
        return new ListDeclarationStmt(LOC, TypeRef.parse(elementType), name, value);
    }

    public static Statement ifChain(IfBranch... branches) {
        return new IfChainStmt(LOC, Arrays.asList(branches));
    }

    public static IfBranch when(Expression condition, Statement... body) {
        return new IfBranch(LOC, condition, Arrays.asList(body));
    }

    public static IfBranch otherwise(Statement... body) {
        return new IfBranch(LOC, null, Arrays.asList(body));
    }

    public static Statement forIn(String elementType, String var, Expression iterable, Statement... body) {
        return new ForInStmt(LOC, TypeRef.parse(elementType), var, iterable, Arrays.asList(body));
    }

    public static Statement whileLoop(Expression condition, Statement... body) {
        return new WhileStmt(LOC, condition, Arrays.asList(body));
    }

    public static Statement brk() {
        return new BreakStmt(LOC);
    }

    public static Statement cont() {
        return new ContinueStmt(LOC);
    }

    // ========== 表达式 ==========

    public static Expression intLit(int value) {
        return Literal.ofInt(LOC, value);
    }

    public static Expression floatLit(double value) {
        return Literal.ofFloat(LOC, value);
    }

    public static Expression boolLit(boolean value) {
        return Literal.ofBool(LOC, value);
    }

    public static Expression str(String value) {
        return Literal.ofString(LOC, value);
    }

    public static Expression var(String name) {
        return new Identifier(LOC, name);
    }

    public static Expression bin(Expression left, String op, Expression right) {
        return new BinaryExpr(LOC, left, op, right);
    }

    public static Expression call(String name, Expression... args) {
        return new CallExpr(LOC, name, Arrays.asList(args));
    }

    public static Expression method(String target, String method, Expression... args) {
        return new MethodCallExpr(LOC, target, method, Arrays.asList(args));
    }

    public static ListLiteral list(Expression... elements) {
        return new ListLiteral(LOC, Arrays.asList(elements));
    }
}
