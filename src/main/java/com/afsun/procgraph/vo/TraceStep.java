package com.afsun.procgraph.vo;

import com.afsun.procgraph.core.FieldOperation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 字段流转中的一步
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TraceStep {
    private String procedure;
    private FieldOperation operation;
    private String context;
    /**
     * 距起点过程的调用跳数
     */
    private int depth;
}
