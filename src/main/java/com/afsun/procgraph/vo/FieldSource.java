package com.afsun.procgraph.vo;

import com.afsun.procgraph.core.FieldOperation;
import com.afsun.procgraph.graph.NodeType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段的来源或去向：写入/读取它的过程，或含有该列的表
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
public class FieldSource {
    private String name;
    private NodeType type;
    private List<FieldOperation> operations = new ArrayList<>();
    private List<String> contexts = new ArrayList<>();
    private List<String> transformations = new ArrayList<>();

    public FieldSource(String name, NodeType type) {
        this.name = name;
        this.type = type;
    }
}
