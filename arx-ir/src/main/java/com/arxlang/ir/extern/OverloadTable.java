package com.arxlang.ir.extern;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 外部重载表：{@code "module.function"} → (参数标记元组 → 重载)。
 *
 * <p>解析阶段由 {@link ExternLinkageResolver} 填充，之后只读。
 * 后加载的同键条目覆盖先前条目，并记录警告。</p>
 */
public class OverloadTable {

    private static final Logger LOG = Logger.getLogger(OverloadTable.class.getName());

    private final Map<String, Map<List<TypeTag>, ExternOverload>> entries = new LinkedHashMap<>();

    void put(ExternOverload overload) {
        Map<List<TypeTag>, ExternOverload> byArgs =
                entries.computeIfAbsent(overload.getQualifiedName(), k -> new LinkedHashMap<>());
        ExternOverload previous = byArgs.put(overload.getArgTags(), overload);
        if (previous != null) {
            LOG.warning("Extern overload " + overload.getQualifiedName() + overload.getArgTags()
                    + " redefined: " + previous.getTargetSymbol() + " replaced by " + overload.getTargetSymbol());
        }
    }

    public boolean contains(String qualifiedName) {
        return entries.containsKey(qualifiedName);
    }

    /**
     * 精确匹配参数标记元组，没有匹配时返回 null。
     */
    public ExternOverload lookup(String qualifiedName, List<TypeTag> argTags) {
        Map<List<TypeTag>, ExternOverload> byArgs = entries.get(qualifiedName);
        return byArgs != null ? byArgs.get(argTags) : null;
    }

    public Collection<ExternOverload> overloadsOf(String qualifiedName) {
        Map<List<TypeTag>, ExternOverload> byArgs = entries.get(qualifiedName);
        if (byArgs == null) return Collections.emptyList();
        return Collections.unmodifiableCollection(byArgs.values());
    }

    public int size() {
        int n = 0;
        for (Map<List<TypeTag>, ExternOverload> byArgs : entries.values()) {
            n += byArgs.size();
        }
        return n;
    }
}
