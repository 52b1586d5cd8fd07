package com.afsun.procgraph.core.dto;

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
 * 表注册载荷
 *
 * @author afsun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableFacts {
    private String name;
    private String schema;
    @Builder.Default
    private List<ColumnInfo> columns = new ArrayList<>();
    @Builder.Default
    private List<IndexInfo> indexes = new ArrayList<>();
    @Builder.Default
    private List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
    @Builder.Default
    private List<String> primaryKeyColumns = new ArrayList<>();
    /**
     * 被引用表 → 关系类型
     */
    @Builder.Default
    private Map<String, String> relationships = new LinkedHashMap<>();
    private String businessPurpose;
    private Integer complexityScore;
    private Long rowCount;

    public void validate() {
        Validate.isTrue(StringUtils.isNotBlank(name), "table name must not be blank");
    }
}
