package com.arxlang.cli;

/**
 * 构建管线错误
 */
public class BuildException extends RuntimeException {

    public enum Kind {
        /** 找不到工具链程序，尚未写出任何文件 */
        ENVIRONMENT,
        /** 外部程序以非零状态退出，已生成的中间文件保留 */
        PROCESS_FAILURE
    }

    private final Kind kind;
    private final String output;   // 外部程序的输出，ENVIRONMENT 时为 null

    public BuildException(Kind kind, String message) {
        this(kind, message, (String) null);
    }

    public BuildException(Kind kind, String message, String output) {
        super(message);
        this.kind = kind;
        this.output = output;
    }

    public BuildException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.output = null;
    }

    public Kind getKind() {
        return kind;
    }

    public String getOutput() {
        return output;
    }
}
