package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段来源、去向与流转路径的合并视图
 *
 * @author afsun
 */
@Data
public class FieldFlowAnalysis {
    private String fieldName;
    private List<FieldSource> sources = new ArrayList<>();
    private List<FieldSource> destinations = new ArrayList<>();
    private TracePath trace;
    private FieldUsageSummary summary;
}
