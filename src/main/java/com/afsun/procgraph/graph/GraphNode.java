package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 图谱节点基类
 * fullName 为大写的 SCHEMA.NAME（无模式时为 NAME），同类节点内唯一
 *
 * @author afsun
 */
@Data
public abstract class GraphNode {
    private String fullName;
    private String name;
    private String schema;
    /**
     * 仅因被引用而创建、尚未注册真实信息的节点
     */
    private boolean placeholder;

    @JsonIgnore
    public abstract NodeType getType();

    public abstract GraphNode copy();

    @JsonIgnore
    public String getKey() {
        return key(getType(), fullName);
    }

    /**
     * 以 SCHEMA.NAME 形式的标识初始化名称字段
     */
    public void setIdentity(String schema, String name) {
        this.schema = schema;
        this.name = name;
        this.fullName = SqlIdentifiers.fullName(schema, name);
    }

    public static String key(NodeType type, String fullName) {
        return type + ":" + fullName;
    }

    protected <T extends GraphNode> T copyIdentityTo(T target) {
        target.setFullName(fullName);
        target.setName(name);
        target.setSchema(schema);
        target.setPlaceholder(placeholder);
        return target;
    }
}
