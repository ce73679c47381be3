package com.arxlang.ir.ssa;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 函数内名称分配器：首次使用原名，冲突时追加 {@code .N} 后缀。
 * 分配顺序只取决于调用顺序，相同输入得到相同名称。
 */
public class NameAllocator {

    private final Set<String> used = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();

    public String allocate(String hint) {
        String base = hint == null || hint.isEmpty() ? "t" : hint;
        if (used.add(base)) {
            return base;
        }
        int n = counters.getOrDefault(base, 0);
        String candidate;
        do {
            n++;
            candidate = base + "." + n;
        } while (!used.add(candidate));
        counters.put(base, n);
        return candidate;
    }

    /** 预留名称（如形参名），使后续分配避开它 */
    public void reserve(String name) {
        used.add(name);
    }
}
