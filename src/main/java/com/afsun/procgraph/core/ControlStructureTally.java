package com.afsun.procgraph.core;

import lombok.Data;

/**
 * 控制结构统计，用于计算复杂度
 *
 * @author afsun
 */
@Data
public class ControlStructureTally {
    /**
     * IF 条件块
     */
    private int conditionals;
    /**
     * ELSIF / ELSE 分支
     */
    private int branches;
    /**
     * CASE 表达式或语句
     */
    private int caseBlocks;
    private int loops;
    /**
     * 主体之外的嵌套 BEGIN 块
     */
    private int nestedBlocks;
    private int exceptionHandlers;
    private int cursors;
    /**
     * BEGIN / IF / LOOP / CASE 的最大嵌套深度
     */
    private int maxNestingDepth;
}
