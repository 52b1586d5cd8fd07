package com.afsun.procgraph.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 有向边，两端以节点全名标识
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {
    private String source;
    private String target;
    private EdgeType type;

    public String sourceKey() {
        return GraphNode.key(type.getSourceType(), source);
    }

    public String targetKey() {
        return GraphNode.key(type.getTargetType(), target);
    }

    @Override
    public String toString() {
        return source + " -[" + type + "]-> " + target;
    }
}
