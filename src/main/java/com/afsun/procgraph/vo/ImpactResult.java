package com.afsun.procgraph.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 过程变更影响分析结果
 *
 * @author afsun
 */
@Data
public class ImpactResult {
    private String procedure;
    private int maxDepth;
    /**
     * 反向可达的调用者，按跳数排序
     */
    private List<ImpactedCaller> callers = new ArrayList<>();
    private int callerCount;
    private int directCallerCount;
    /**
     * 该过程自身依赖的过程
     */
    private List<String> dependencies = new ArrayList<>();
    private List<String> affectedTables = new ArrayList<>();
    private double totalImpactScore;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImpactedCaller {
        private String name;
        private int hops;
        private int complexityScore;
    }
}
