package com.afsun.procgraph.graph;

/**
 * 图谱节点类型
 *
 * @author afsun
 */
public enum NodeType {
    PROCEDURE,
    TABLE,
    FIELD
}
