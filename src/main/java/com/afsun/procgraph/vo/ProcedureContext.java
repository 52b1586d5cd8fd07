package com.afsun.procgraph.vo;

import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.ParameterInfo;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 存储过程上下文（扁平视图）
 * 调用的过程与表为解析后的节点全名
 *
 * @author afsun
 */
@Data
public class ProcedureContext {
    private String name;
    private String schema;
    private String fullName;
    private List<ParameterInfo> parameters = new ArrayList<>();
    private List<String> calledProcedures = new ArrayList<>();
    private List<String> calledTables = new ArrayList<>();
    private String businessLogic;
    private int complexityScore;
    private int dependencyLevel;
    private Map<String, FieldUsage> fieldsUsed = new LinkedHashMap<>();
    private String sourceCode;
}
