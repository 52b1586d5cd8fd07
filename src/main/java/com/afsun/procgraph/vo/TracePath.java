package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段流转路径
 *
 * @author afsun
 */
@Data
public class TracePath {
    private String fieldName;
    private List<TraceStep> steps = new ArrayList<>();
    /**
     * 写入该字段的起点过程
     */
    private List<String> sources = new ArrayList<>();
    /**
     * 读取该字段的终点过程
     */
    private List<String> destinations = new ArrayList<>();
    private List<String> transformations = new ArrayList<>();
    /**
     * 含有该字段列的表
     */
    private List<String> sourceTables = new ArrayList<>();
    private int maxDepth;
}
