package com.arxlang.ir.extern;

/**
 * 描述文件错误：格式错误的条目、缺少 meta 段或 name 键、无法读取。
 */
public class DescriptorException extends RuntimeException {
    private final String source;
    private final int line;

    public DescriptorException(String message, String source, int line) {
        super(message);
        this.source = source;
        this.line = line;
    }

    public DescriptorException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.line = 0;
    }

    public String getSource() { return source; }
    public int getLine() { return line; }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (source != null) {
            sb.append(" (").append(source);
            if (line > 0) sb.append(':').append(line);
            sb.append(')');
        }
        return sb.toString();
    }
}
