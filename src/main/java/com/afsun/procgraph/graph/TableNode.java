package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.dto.ColumnInfo;
import com.afsun.procgraph.core.dto.ForeignKeyInfo;
import com.afsun.procgraph.core.dto.IndexInfo;
import com.afsun.procgraph.core.dto.TableFacts;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表节点
 *
 * @author afsun
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class TableNode extends GraphNode {
    private List<ColumnInfo> columns = new ArrayList<>();
    private List<IndexInfo> indexes = new ArrayList<>();
    private List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
    private List<String> primaryKeyColumns = new ArrayList<>();
    /**
     * 被引用表 → 关系类型
     */
    private Map<String, String> relationships = new LinkedHashMap<>();
    private String businessPurpose;
    private int complexityScore;
    private Long rowCount;
    private long registrationOrder;

    @Override
    public NodeType getType() {
        return NodeType.TABLE;
    }

    public void merge(TableFacts facts) {
        if (facts.getColumns() != null && !facts.getColumns().isEmpty()) {
            columns = new ArrayList<>();
            facts.getColumns().forEach(c -> columns.add(copyOf(c)));
        }
        if (facts.getIndexes() != null && !facts.getIndexes().isEmpty()) {
            indexes = new ArrayList<>();
            facts.getIndexes().forEach(i -> indexes.add(copyOf(i)));
        }
        if (facts.getForeignKeys() != null && !facts.getForeignKeys().isEmpty()) {
            foreignKeys = new ArrayList<>();
            facts.getForeignKeys().forEach(f -> foreignKeys.add(copyOf(f)));
        }
        if (facts.getPrimaryKeyColumns() != null && !facts.getPrimaryKeyColumns().isEmpty()) {
            primaryKeyColumns = new ArrayList<>(facts.getPrimaryKeyColumns());
        }
        if (facts.getRelationships() != null && !facts.getRelationships().isEmpty()) {
            relationships = new LinkedHashMap<>(facts.getRelationships());
        }
        if (StringUtils.isNotBlank(facts.getBusinessPurpose())) {
            businessPurpose = facts.getBusinessPurpose();
        }
        if (facts.getComplexityScore() != null) {
            complexityScore = facts.getComplexityScore();
        }
        if (facts.getRowCount() != null) {
            rowCount = facts.getRowCount();
        }
        // 主键列未显式给出时从列标记推导
        if (primaryKeyColumns.isEmpty()) {
            columns.stream().filter(ColumnInfo::isPrimaryKey).forEach(c -> primaryKeyColumns.add(c.getName()));
        }
        setPlaceholder(false);
    }

    @Override
    public TableNode copy() {
        TableNode c = copyIdentityTo(new TableNode());
        columns.forEach(col -> c.columns.add(copyOf(col)));
        indexes.forEach(i -> c.indexes.add(copyOf(i)));
        foreignKeys.forEach(f -> c.foreignKeys.add(copyOf(f)));
        c.primaryKeyColumns.addAll(primaryKeyColumns);
        c.relationships.putAll(relationships);
        c.businessPurpose = businessPurpose;
        c.complexityScore = complexityScore;
        c.rowCount = rowCount;
        c.registrationOrder = registrationOrder;
        return c;
    }

    static ColumnInfo copyOf(ColumnInfo c) {
        return ColumnInfo.builder().name(c.getName()).dataType(c.getDataType()).nullable(c.isNullable())
                .primaryKey(c.isPrimaryKey()).foreignKey(c.isForeignKey()).foreignKeyTable(c.getForeignKeyTable())
                .foreignKeyColumn(c.getForeignKeyColumn()).defaultValue(c.getDefaultValue())
                .comment(c.getComment()).build();
    }

    static IndexInfo copyOf(IndexInfo i) {
        return IndexInfo.builder().name(i.getName()).columns(listOf(i.getColumns()))
                .unique(i.isUnique()).build();
    }

    static ForeignKeyInfo copyOf(ForeignKeyInfo f) {
        return ForeignKeyInfo.builder().name(f.getName()).columns(listOf(f.getColumns()))
                .referencedTable(f.getReferencedTable())
                .referencedColumns(listOf(f.getReferencedColumns())).build();
    }

    private static List<String> listOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
