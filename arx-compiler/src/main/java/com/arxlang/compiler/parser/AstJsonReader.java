package com.arxlang.compiler.parser;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.decl.FunDecl;
import com.arxlang.compiler.ast.decl.Parameter;
import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.compiler.ast.expr.*;
import com.arxlang.compiler.ast.stmt.*;
import com.arxlang.compiler.ast.type.TypeRef;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取前端输出的 JSON 形式 AST。
 *
 * <p>文档结构：</p>
 * <pre>
 * {"uses": ["io"],
 *  "functions": [{"name": "main", "returnType": "int",
 *                 "params": [{"type": "int", "name": "a"}],
 *                 "body": [{"kind": "return", "value": {"kind": "int", "value": 0}}]}]}
 * </pre>
 * <p>任意节点可附带 {@code line} / {@code column}，用于错误定位。</p>
 */
public class AstJsonReader {

    private final String fileName;

    public AstJsonReader(String fileName) {
        this.fileName = fileName;
    }

    public Program read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public Program read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new AstFormatException("Invalid JSON: " + e.getMessage(), "", e);
        }
        return readProgram(root);
    }

    public Program read(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new AstFormatException("Invalid JSON: " + e.getMessage(), "", e);
        }
        return readProgram(root);
    }

    // ============ 声明 ============

    private Program readProgram(JsonElement element) {
        JsonObject obj = asObject(element, "");
        List<String> uses = new ArrayList<>();
        if (obj.has("uses")) {
            JsonArray arr = asArray(obj.get("uses"), "uses");
            for (int i = 0; i < arr.size(); i++) {
                uses.add(asString(arr.get(i), "uses[" + i + "]"));
            }
        }
        List<FunDecl> functions = new ArrayList<>();
        JsonArray funcs = asArray(require(obj, "functions", ""), "functions");
        for (int i = 0; i < funcs.size(); i++) {
            functions.add(readFunction(funcs.get(i), "functions[" + i + "]"));
        }
        return new Program(location(obj, ""), uses, functions);
    }

    private FunDecl readFunction(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String name = stringField(obj, "name", path);
        TypeRef returnType = obj.has("returnType")
                ? TypeRef.parse(stringField(obj, "returnType", path))
                : TypeRef.VOID;
        List<Parameter> params = new ArrayList<>();
        if (obj.has("params")) {
            JsonArray arr = asArray(obj.get("params"), path + ".params");
            for (int i = 0; i < arr.size(); i++) {
                String p = path + ".params[" + i + "]";
                JsonObject param = asObject(arr.get(i), p);
                params.add(new Parameter(location(param, p),
                        TypeRef.parse(stringField(param, "type", p)),
                        stringField(param, "name", p)));
            }
        }
        List<Statement> body = readBody(obj, "body", path);
        return new FunDecl(location(obj, path), name, params, returnType, body);
    }

    // ============ 语句 ============

    private List<Statement> readBody(JsonObject owner, String field, String path) {
        List<Statement> body = new ArrayList<>();
        if (!owner.has(field) || owner.get(field).isJsonNull()) {
            return body;
        }
        JsonArray arr = asArray(owner.get(field), path + "." + field);
        for (int i = 0; i < arr.size(); i++) {
            body.add(readStatement(arr.get(i), path + "." + field + "[" + i + "]"));
        }
        return body;
    }

    private Statement readStatement(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        SourceLocation loc = location(obj, path);
        String kind = stringField(obj, "kind", path);
        switch (kind) {
            case "expression":
                return new ExpressionStmt(loc, readExpression(require(obj, "expr", path), path + ".expr"));
            case "return":
                return new ReturnStmt(loc, readExpression(require(obj, "value", path), path + ".value"));
            case "return_void":
                return new ReturnStmt(loc, null);
            case "declare":
                return new DeclarationStmt(loc,
                        TypeRef.parse(stringField(obj, "type", path)),
                        stringField(obj, "name", path),
                        readExpression(require(obj, "value", path), path + ".value"));
            case "assign":
                return new AssignStmt(loc, stringField(obj, "name", path),
                        readExpression(require(obj, "value", path), path + ".value"));
            case "if_chain":
                return readIfChain(obj, loc, path);
            case "for_in":
                return new ForInStmt(loc,
                        TypeRef.parse(stringField(obj, "type", path)),
                        stringField(obj, "var", path),
                        readExpression(require(obj, "iterable", path), path + ".iterable"),
                        readBody(obj, "body", path));
            case "while":
                return new WhileStmt(loc,
                        readExpression(require(obj, "condition", path), path + ".condition"),
                        readBody(obj, "body", path));
            case "break":
                return new BreakStmt(loc);
            case "continue":
                return new ContinueStmt(loc);
            case "declare_list":
                return new ListDeclarationStmt(loc,
                        TypeRef.parse(stringField(obj, "elementType", path)),
                        stringField(obj, "name", path),
                        readExpression(require(obj, "value", path), path + ".value"));
            default:
                throw new AstFormatException("Unknown statement kind '" + kind + "'", path);
        }
    }

    private IfChainStmt readIfChain(JsonObject obj, SourceLocation loc, String path) {
        JsonArray arr = asArray(require(obj, "branches", path), path + ".branches");
        if (arr.size() == 0) {
            throw new AstFormatException("if_chain requires at least one branch", path);
        }
        List<IfBranch> branches = new ArrayList<>();
        for (int i = 0; i < arr.size(); i++) {
            String p = path + ".branches[" + i + "]";
            JsonObject branch = asObject(arr.get(i), p);
            Expression condition = null;
            if (branch.has("condition") && !branch.get("condition").isJsonNull()) {
                condition = readExpression(branch.get("condition"), p + ".condition");
            } else if (i < arr.size() - 1) {
                throw new AstFormatException("Only the last branch may omit its condition", p);
            }
            branches.add(new IfBranch(location(branch, p), condition, readBody(branch, "body", p)));
        }
        return new IfChainStmt(loc, branches);
    }

    // ============ 表达式 ============

    private Expression readExpression(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        SourceLocation loc = location(obj, path);
        String kind = stringField(obj, "kind", path);
        switch (kind) {
            case "int":
                return Literal.ofInt(loc, integer(require(obj, "value", path), path + ".value"));
            case "float":
                return Literal.ofFloat(loc, number(require(obj, "value", path), path + ".value").getAsDouble());
            case "bool":
                return Literal.ofBool(loc, bool(require(obj, "value", path), path + ".value"));
            case "string":
                return Literal.ofString(loc, stringField(obj, "value", path));
            case "var":
                return new Identifier(loc, stringField(obj, "name", path));
            case "binop":
                return new BinaryExpr(loc,
                        readExpression(require(obj, "left", path), path + ".left"),
                        stringField(obj, "op", path),
                        readExpression(require(obj, "right", path), path + ".right"));
            case "call":
                return new CallExpr(loc, stringField(obj, "name", path), readArgs(obj, "args", path));
            case "call_method":
                return new MethodCallExpr(loc, stringField(obj, "object", path),
                        stringField(obj, "method", path), readArgs(obj, "args", path));
            case "list":
                return new ListLiteral(loc, readArgs(obj, "elements", path));
            default:
                throw new AstFormatException("Unknown expression kind '" + kind + "'", path);
        }
    }

    private List<Expression> readArgs(JsonObject obj, String field, String path) {
        List<Expression> args = new ArrayList<>();
        if (!obj.has(field)) return args;
        JsonArray arr = asArray(obj.get(field), path + "." + field);
        for (int i = 0; i < arr.size(); i++) {
            args.add(readExpression(arr.get(i), path + "." + field + "[" + i + "]"));
        }
        return args;
    }

    // ============ 辅助 ============

    private SourceLocation location(JsonObject obj, String path) {
        int line = obj.has("line") ? integer(obj.get("line"), field(path, "line")) : 0;
        int column = obj.has("column") ? integer(obj.get("column"), field(path, "column")) : 0;
        return new SourceLocation(fileName, line, column);
    }

    private static String field(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static JsonElement require(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            throw new AstFormatException("Missing field '" + field + "'", path);
        }
        return value;
    }

    private static String stringField(JsonObject obj, String field, String path) {
        return asString(require(obj, field, path), path + "." + field);
    }

    private static JsonObject asObject(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new AstFormatException("Expected object", path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray asArray(JsonElement element, String path) {
        if (element == null || !element.isJsonArray()) {
            throw new AstFormatException("Expected array", path);
        }
        return element.getAsJsonArray();
    }

    private static JsonPrimitive number(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new AstFormatException("Expected number", path);
        }
        return element.getAsJsonPrimitive();
    }

    /** 必须恰好是 32 位有符号整数，不做截断 */
    private static int integer(JsonElement element, String path) {
        BigDecimal value = number(element, path).getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new AstFormatException("Expected 32-bit integer, got " + value.toPlainString(), path, e);
        }
    }

    private static boolean bool(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new AstFormatException("Expected boolean", path);
        }
        return element.getAsBoolean();
    }

    private static String asString(JsonElement element, String path) {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new AstFormatException("Expected string", path);
        }
        return element.getAsString();
    }
}
