package com.afsun.procgraph.core;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个字段在存储过程中的使用记录
 * 操作与上下文按首次出现顺序去重保存
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
public class FieldUsage {
    private String fieldName;
    private List<String> readBy = new ArrayList<>();
    private List<String> writtenBy = new ArrayList<>();
    private List<String> transformations = new ArrayList<>();
    private List<FieldOperation> operations = new ArrayList<>();
    /**
     * 所在子句类型：SELECT / WHERE / ON / SET / INSERT
     */
    private List<String> contexts = new ArrayList<>();

    public FieldUsage(String fieldName) {
        this.fieldName = fieldName;
    }

    public void record(FieldOperation operation, String context, String procedure) {
        addDistinct(operations, operation);
        addDistinct(contexts, context);
        if (procedure == null) {
            return;
        }
        if (operation == FieldOperation.WRITE) {
            addDistinct(writtenBy, procedure);
        } else {
            addDistinct(readBy, procedure);
        }
    }

    public void recordTransformation(String description, String context, String procedure) {
        record(FieldOperation.TRANSFORM, context, procedure);
        addDistinct(transformations, description);
    }

    public boolean hasOperation(FieldOperation operation) {
        return operations.contains(operation);
    }

    public FieldUsage copy() {
        FieldUsage c = new FieldUsage(fieldName);
        c.readBy.addAll(readBy);
        c.writtenBy.addAll(writtenBy);
        c.transformations.addAll(transformations);
        c.operations.addAll(operations);
        c.contexts.addAll(contexts);
        return c;
    }

    private static <T> void addDistinct(List<T> list, T value) {
        if (value != null && !list.contains(value)) {
            list.add(value);
        }
    }
}
