package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段在整个图谱中的读写汇总
 *
 * @author afsun
 */
@Data
public class FieldUsageSummary {
    private String fieldName;
    private List<String> readBy = new ArrayList<>();
    private List<String> writtenBy = new ArrayList<>();
    private List<String> transformations = new ArrayList<>();
    private List<String> procedures = new ArrayList<>();
    /**
     * 含有同名列的表
     */
    private List<String> tables = new ArrayList<>();
}
