package com.afsun.procgraph.core.dto;

import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.ParameterInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 存储过程注册载荷
 * 可选字段缺省为空集合或 null，null 在合并时不会覆盖已有值
 *
 * @author afsun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcedureFacts {
    /**
     * 过程名（必填），可带模式前缀 SCHEMA.NAME
     */
    private String name;
    private String schema;
    private String sourceCode;
    private Integer complexityScore;
    @Builder.Default
    private List<String> calledProcedures = new ArrayList<>();
    @Builder.Default
    private List<String> calledTables = new ArrayList<>();
    @Builder.Default
    private List<ParameterInfo> parameters = new ArrayList<>();
    @Builder.Default
    private Map<String, FieldUsage> fieldUsages = new LinkedHashMap<>();
    /**
     * 外部补充的业务逻辑说明
     */
    private String businessLogic;

    public void validate() {
        Validate.isTrue(StringUtils.isNotBlank(name), "procedure name must not be blank");
        Validate.isTrue(complexityScore == null || complexityScore >= 0,
                "complexityScore must not be negative");
    }
}
