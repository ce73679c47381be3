package com.arxlang.ir.extern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个描述文件的解析结果：模块名与按出现顺序排列的重载。
 */
public class ModuleDescriptor {
    private final String moduleName;
    private final String source;
    private final List<ExternOverload> overloads;

    public ModuleDescriptor(String moduleName, String source, List<ExternOverload> overloads) {
        this.moduleName = moduleName;
        this.source = source;
        this.overloads = Collections.unmodifiableList(new ArrayList<>(overloads));
    }

    public String getModuleName() { return moduleName; }
    public String getSource() { return source; }
    public List<ExternOverload> getOverloads() { return overloads; }
}
