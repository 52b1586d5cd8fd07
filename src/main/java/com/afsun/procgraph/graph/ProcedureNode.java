package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.ParameterInfo;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.util.SqlIdentifiers;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 存储过程节点
 *
 * @author afsun
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ProcedureNode extends GraphNode {
    private String sourceCode;
    private List<ParameterInfo> parameters = new ArrayList<>();
    /**
     * 源码中出现的被调用过程标识（规范化后，未经解析）
     */
    private Set<String> calledProcedures = new LinkedHashSet<>();
    private Set<String> calledTables = new LinkedHashSet<>();
    private Map<String, FieldUsage> fieldUsages = new LinkedHashMap<>();
    private int complexityScore;
    private int dependencyLevel;
    private String businessLogic;
    /**
     * 首次以真实信息注册的顺序号，占位节点为 0
     */
    private long registrationOrder;

    @Override
    public NodeType getType() {
        return NodeType.PROCEDURE;
    }

    /**
     * 合并注册信息：非空新值覆盖，空值不擦除已有值
     */
    public void merge(ProcedureFacts facts) {
        if (StringUtils.isNotEmpty(facts.getSourceCode())) {
            sourceCode = facts.getSourceCode();
        }
        if (facts.getComplexityScore() != null) {
            complexityScore = facts.getComplexityScore();
        }
        if (StringUtils.isNotBlank(facts.getBusinessLogic())) {
            businessLogic = facts.getBusinessLogic();
        }
        if (facts.getParameters() != null && !facts.getParameters().isEmpty()) {
            parameters = new ArrayList<>();
            facts.getParameters().forEach(p -> parameters.add(
                    ParameterInfo.of(p.getName(), p.getDirection(), p.getDataType())));
        }
        if (facts.getCalledProcedures() != null && !facts.getCalledProcedures().isEmpty()) {
            calledProcedures = normalizeAll(facts.getCalledProcedures());
        }
        if (facts.getCalledTables() != null && !facts.getCalledTables().isEmpty()) {
            calledTables = normalizeAll(facts.getCalledTables());
        }
        if (facts.getFieldUsages() != null && !facts.getFieldUsages().isEmpty()) {
            fieldUsages = new LinkedHashMap<>();
            facts.getFieldUsages().forEach((field, usage) -> {
                String key = field.toUpperCase(Locale.ROOT);
                FieldUsage copy = usage.copy();
                copy.setFieldName(key);
                fieldUsages.put(key, copy);
            });
        }
        setPlaceholder(false);
    }

    @Override
    public ProcedureNode copy() {
        ProcedureNode c = copyIdentityTo(new ProcedureNode());
        c.sourceCode = sourceCode;
        parameters.forEach(p -> c.parameters.add(ParameterInfo.of(p.getName(), p.getDirection(), p.getDataType())));
        c.calledProcedures.addAll(calledProcedures);
        c.calledTables.addAll(calledTables);
        fieldUsages.forEach((k, v) -> c.fieldUsages.put(k, v.copy()));
        c.complexityScore = complexityScore;
        c.dependencyLevel = dependencyLevel;
        c.businessLogic = businessLogic;
        c.registrationOrder = registrationOrder;
        return c;
    }

    private static Set<String> normalizeAll(List<String> identifiers) {
        Set<String> result = new LinkedHashSet<>();
        for (String id : identifiers) {
            if (StringUtils.isNotBlank(id)) {
                result.add(SqlIdentifiers.normalize(id));
            }
        }
        return result;
    }
}
