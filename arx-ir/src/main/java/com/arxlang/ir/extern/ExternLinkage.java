package com.arxlang.ir.extern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析结果：只读重载表与已加载的模块名（按加载顺序，去重）。
 */
public class ExternLinkage {
    private final OverloadTable table;
    private final List<String> loadedModules;

    public ExternLinkage(OverloadTable table, List<String> loadedModules) {
        this.table = table;
        this.loadedModules = Collections.unmodifiableList(new ArrayList<>(loadedModules));
    }

    public OverloadTable getTable() { return table; }

    /** 需要编译并链接对应 C 源文件的模块 */
    public List<String> getLoadedModules() { return loadedModules; }
}
