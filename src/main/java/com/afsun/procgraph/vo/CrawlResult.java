package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 依赖爬取结果
 *
 * @author afsun
 */
@Data
public class CrawlResult {
    private String rootProcedure;
    private int maxDepth;
    private boolean includeTables;
    private DependencyNode dependenciesTree;
    /**
     * 按首次访问顺序，每个过程只出现一次
     */
    private List<String> proceduresFound = new ArrayList<>();
    private List<String> tablesFound = new ArrayList<>();
    /**
     * 被调用但图谱中不存在的过程
     */
    private List<String> unresolvedProcedures = new ArrayList<>();
    private int depthReached;
    private long crawlMillis;
}
