package com.arxlang.compiler.parser;

/**
 * AST 交换文档格式错误
 */
public class AstFormatException extends RuntimeException {
    private final String path;   // 出错节点在文档中的路径，如 functions[0].body[2]

    public AstFormatException(String message, String path) {
        super(message);
        this.path = path;
    }

    public AstFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (path != null && !path.isEmpty()) {
            sb.append(" at ").append(path);
        }
        return sb.toString();
    }
}
