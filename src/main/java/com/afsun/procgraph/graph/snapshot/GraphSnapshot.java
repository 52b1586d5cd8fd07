package com.afsun.procgraph.graph.snapshot;

import com.afsun.procgraph.graph.FieldNode;
import com.afsun.procgraph.graph.GraphEdge;
import com.afsun.procgraph.graph.ProcedureNode;
import com.afsun.procgraph.graph.TableNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 图谱的扁平快照：全部节点（含占位节点）与全部边
 *
 * @author afsun
 */
@Data
public class GraphSnapshot {

    /**
     * 快照格式版本，加载时版本不一致视为缓存失效
     */
    public static final String CURRENT_VERSION = "1.0.0";

    private String version;
    private long createdAt;
    private long registrationSequence;
    private List<ProcedureNode> procedures = new ArrayList<>();
    private List<TableNode> tables = new ArrayList<>();
    private List<FieldNode> fields = new ArrayList<>();
    private List<GraphEdge> edges = new ArrayList<>();
}
