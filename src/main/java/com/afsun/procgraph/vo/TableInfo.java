package com.afsun.procgraph.vo;

import com.afsun.procgraph.core.dto.ColumnInfo;
import com.afsun.procgraph.core.dto.ForeignKeyInfo;
import com.afsun.procgraph.core.dto.IndexInfo;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表信息（扁平视图）
 *
 * @author afsun
 */
@Data
public class TableInfo {
    private String name;
    private String schema;
    private String fullName;
    private List<ColumnInfo> columns = new ArrayList<>();
    private List<IndexInfo> indexes = new ArrayList<>();
    private List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
    private List<String> primaryKeyColumns = new ArrayList<>();
    private Map<String, String> relationships = new LinkedHashMap<>();
    private String businessPurpose;
    private int complexityScore;
    private Long rowCount;
    /**
     * 访问该表的过程
     */
    private List<String> accessedBy = new ArrayList<>();
    /**
     * 通过外键引用该表的表
     */
    private List<String> referencedBy = new ArrayList<>();
}
