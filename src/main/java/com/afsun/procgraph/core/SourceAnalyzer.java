package com.afsun.procgraph.core;

/**
 * 存储过程源码分析器
 * 图谱与爬取只依赖该接口的结果结构，可替换为基于语法树的实现
 *
 * @author afsun
 */
public interface SourceAnalyzer {

    /**
     * 分析单个存储过程
     *
     * @param sourceText    过程源码
     * @param procedureName 展示名，记录到字段使用的 readBy/writtenBy 中
     * @return 分析结果，源码为空时返回空结果，不抛出异常
     */
    AnalysisResult analyze(String sourceText, String procedureName);
}
