package com.afsun.procgraph.core.exceptions;

import com.afsun.procgraph.graph.NodeType;
import lombok.Getter;
import org.slf4j.helpers.MessageFormatter;

/**
 * 图谱节点未找到异常
 * 核心层以空结果表达"未找到"，仅在接口层转换为该异常
 *
 * @author afsun
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final NodeType nodeType;

    /**
     * 查询时使用的名称
     */
    private final String name;

    public NodeNotFoundException(NodeType nodeType, String name) {
        super(MessageFormatter.format("{}不存在或名称有歧义: {}", label(nodeType), name).getMessage());
        this.nodeType = nodeType;
        this.name = name;
    }

    private static String label(NodeType nodeType) {
        switch (nodeType) {
            case TABLE:
                return "表";
            case FIELD:
                return "字段";
            default:
                return "存储过程";
        }
    }
}
