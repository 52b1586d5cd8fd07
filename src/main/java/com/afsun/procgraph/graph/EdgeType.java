package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.FieldOperation;

/**
 * 图谱边类型，两端节点类型由边类型决定
 *
 * @author afsun
 */
public enum EdgeType {
    CALLS(NodeType.PROCEDURE, NodeType.PROCEDURE),
    ACCESSES(NodeType.PROCEDURE, NodeType.TABLE),
    READS(NodeType.PROCEDURE, NodeType.FIELD),
    WRITES(NodeType.PROCEDURE, NodeType.FIELD),
    TRANSFORMS(NodeType.PROCEDURE, NodeType.FIELD),
    /**
     * 外键引用
     */
    REFERENCES(NodeType.TABLE, NodeType.TABLE),
    /**
     * 列归属的表
     */
    BELONGS_TO(NodeType.FIELD, NodeType.TABLE);

    private final NodeType sourceType;
    private final NodeType targetType;

    EdgeType(NodeType sourceType, NodeType targetType) {
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    public NodeType getSourceType() {
        return sourceType;
    }

    public NodeType getTargetType() {
        return targetType;
    }

    public static EdgeType of(FieldOperation operation) {
        switch (operation) {
            case WRITE:
                return WRITES;
            case TRANSFORM:
                return TRANSFORMS;
            default:
                return READS;
        }
    }
}
