package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 同类节点的存储，按全名和最后一段名称两级索引
 * 非线程安全，由 {@link KnowledgeGraph} 的读写锁保护
 *
 * @author afsun
 */
class NodeIndex<N extends GraphNode> {

    private final Map<String, N> byFullName = new LinkedHashMap<>();
    private final Map<String, Set<String>> byBareName = new HashMap<>();

    N get(String fullName) {
        return byFullName.get(fullName);
    }

    void put(N node) {
        byFullName.put(node.getFullName(), node);
        byBareName.computeIfAbsent(SqlIdentifiers.bareName(node.getFullName()), k -> new LinkedHashSet<>())
                .add(node.getFullName());
    }

    void remove(String fullName) {
        N removed = byFullName.remove(fullName);
        if (removed == null) {
            return;
        }
        String bare = SqlIdentifiers.bareName(fullName);
        Set<String> names = byBareName.get(bare);
        if (names != null) {
            names.remove(fullName);
            if (names.isEmpty()) {
                byBareName.remove(bare);
            }
        }
    }

    Collection<N> values() {
        return byFullName.values();
    }

    int size() {
        return byFullName.size();
    }

    void clear() {
        byFullName.clear();
        byBareName.clear();
    }

    /**
     * 名称解析：先按全名精确匹配，再按最后一段名称匹配；
     * 带限定的查询名只回退到无限定的节点。候选不唯一时视为未找到。
     */
    N resolve(String identifier) {
        return resolve(identifier, false);
    }

    /**
     * 同 {@link #resolve(String)}，但只在已登记（非占位）节点中查找，用于确定边的目标
     */
    N resolveRegistered(String identifier) {
        return resolve(identifier, true);
    }

    private N resolve(String identifier, boolean registeredOnly) {
        if (StringUtils.isBlank(identifier)) {
            return null;
        }
        String key = SqlIdentifiers.normalize(identifier);
        N exact = byFullName.get(key);
        if (exact != null && !(registeredOnly && exact.isPlaceholder())) {
            return exact;
        }
        String bare = SqlIdentifiers.bareName(key);
        boolean qualified = !bare.equals(key);
        List<N> matches = new ArrayList<>();
        for (String candidate : byBareName.getOrDefault(bare, Collections.emptySet())) {
            N node = byFullName.get(candidate);
            if (registeredOnly && node.isPlaceholder()) {
                continue;
            }
            if (!qualified || candidate.equals(bare)) {
                matches.add(node);
            }
        }
        return matches.size() == 1 ? matches.get(0) : null;
    }
}
