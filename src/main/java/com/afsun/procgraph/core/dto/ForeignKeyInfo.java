package com.afsun.procgraph.core.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 外键元数据
 *
 * @author afsun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForeignKeyInfo {
    private String name;
    @Builder.Default
    private List<String> columns = new ArrayList<>();
    private String referencedTable;
    @Builder.Default
    private List<String> referencedColumns = new ArrayList<>();
}
