package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图谱统计
 *
 * @author afsun
 */
@Data
public class GraphStatistics {
    private int procedureCount;
    private int tableCount;
    private int fieldCount;
    private int placeholderCount;
    private int edgeCount;
    private Map<String, Integer> edgesByType = new LinkedHashMap<>();
    private int maxDependencyLevel;
    private double averageComplexity;
}
