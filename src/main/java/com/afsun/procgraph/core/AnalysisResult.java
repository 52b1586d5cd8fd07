package com.afsun.procgraph.core;

import com.alibaba.druid.DbType;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个存储过程的静态分析结果
 *
 * @author afsun
 */
@Data
public class AnalysisResult {
    /**
     * 分析时传入的过程名
     */
    private String procedureName;
    /**
     * 过程头中声明的模式名（未声明时为 null）
     */
    private String declaredSchema;
    /**
     * 过程头中声明的过程名（未声明时为 null）
     */
    private String declaredName;
    private DbType dialect;
    private Set<String> procedures = new LinkedHashSet<>();
    private Set<String> tables = new LinkedHashSet<>();
    private Map<String, FieldUsage> fields = new LinkedHashMap<>();
    private List<ParameterInfo> parameters = new ArrayList<>();
    private Set<String> variables = new LinkedHashSet<>();
    private ControlStructureTally controlStructures = new ControlStructureTally();
    private int complexityScore;

    public static AnalysisResult empty(String procedureName) {
        AnalysisResult result = new AnalysisResult();
        result.setProcedureName(procedureName);
        return result;
    }

    public boolean isEmpty() {
        return procedures.isEmpty() && tables.isEmpty() && fields.isEmpty()
                && parameters.isEmpty() && variables.isEmpty();
    }
}
