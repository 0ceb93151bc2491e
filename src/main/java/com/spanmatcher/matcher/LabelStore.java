package com.spanmatcher.matcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 标签字符串与数字编号的双向映射，仅供精确匹配引擎内部使用。
 */
final class LabelStore {
    private final Map<String, Integer> ids = new HashMap<>();
    private final List<String> labels = new ArrayList<>();

    int intern(String label) {
        return ids.computeIfAbsent(label, key -> {
            labels.add(key);
            return labels.size() - 1;
        });
    }

    String resolve(int id) {
        if (id < 0 || id >= labels.size()) {
            throw new IllegalArgumentException("未知标签编号: " + id);
        }
        return labels.get(id);
    }

    int size() {
        return labels.size();
    }
}
