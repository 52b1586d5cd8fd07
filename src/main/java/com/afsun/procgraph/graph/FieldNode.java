package com.afsun.procgraph.graph;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 字段节点：表的列（schema 为表全名）或独立字段
 *
 * @author afsun
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class FieldNode extends GraphNode {
    /**
     * 所属表全名，独立字段为 null
     */
    private String table;
    private String dataType;
    private String description;

    @Override
    public NodeType getType() {
        return NodeType.FIELD;
    }

    @Override
    public FieldNode copy() {
        FieldNode c = copyIdentityTo(new FieldNode());
        c.table = table;
        c.dataType = dataType;
        c.description = description;
        return c;
    }
}
