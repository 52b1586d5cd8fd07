package com.afsun.procgraph.vo;

import com.afsun.procgraph.graph.NodeType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 依赖树节点
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
public class DependencyNode {
    private String name;
    private NodeType type;
    private int depth;
    private int complexityScore;
    /**
     * 图谱中找不到该过程时为 false，分支在此结束
     */
    private boolean resolved = true;
    /**
     * 已在本次爬取中出现过，不再展开
     */
    private boolean revisit;
    private List<DependencyNode> dependencies = new ArrayList<>();

    public DependencyNode(String name, NodeType type, int depth) {
        this.name = name;
        this.type = type;
        this.depth = depth;
    }
}
