package com.arxlang.compiler.ast.type;

import java.util.Objects;

/**
 * 源码层面的类型引用。
 *
 * <p>名称保持前端给出的原样（如 {@code int}、{@code str}、{@code list<int>}），
 * 到 IR 类型的映射由降级阶段决定；不支持的类型名在那里才会报错。</p>
 */
public final class TypeRef {

    public static final TypeRef INT = new TypeRef("int", null);
    public static final TypeRef BOOL = new TypeRef("bool", null);
    public static final TypeRef FLOAT = new TypeRef("float", null);
    public static final TypeRef STRING = new TypeRef("string", null);
    public static final TypeRef VOID = new TypeRef("void", null);

    private final String name;
    private final TypeRef elementType;  // 仅 list 类型使用，可为 null

    private TypeRef(String name, TypeRef elementType) {
        this.name = name;
        this.elementType = elementType;
    }

    /**
     * 解析类型名。{@code list<T>} 递归解析元素类型；其他以 {@code list} 开头的名称
     * 视为元素类型未知的列表。
     */
    public static TypeRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("type name must not be null");
        }
        String name = text.trim();
        if (name.startsWith("list")) {
            int open = name.indexOf('<');
            if (open > 0 && name.endsWith(">")) {
                TypeRef element = parse(name.substring(open + 1, name.length() - 1));
                return new TypeRef("list<" + element + ">", element);
            }
            return new TypeRef(name, null);
        }
        return new TypeRef(name, null);
    }

    public static TypeRef listOf(TypeRef elementType) {
        return new TypeRef("list<" + elementType + ">", elementType);
    }

    public String getName() {
        return name;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public boolean isList() {
        return name.startsWith("list");
    }

    public boolean isVoid() {
        return "void".equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        return name.equals(((TypeRef) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
