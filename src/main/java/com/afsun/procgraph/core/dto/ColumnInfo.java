package com.afsun.procgraph.core.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 表字段元数据
 *
 * @author afsun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnInfo {
    private String name;
    private String dataType;
    @Builder.Default
    private boolean nullable = true;
    private boolean primaryKey;
    private boolean foreignKey;
    private String foreignKeyTable;
    private String foreignKeyColumn;
    private String defaultValue;
    private String comment;
}
