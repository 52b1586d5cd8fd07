package com.afsun.procgraph.vo;

import lombok.Data;

/**
 * 源码分析请求
 *
 * @author afsun
 */
@Data
public class AnalyzeRequest {
    /**
     * 过程名，可为空（取过程头声明的名称）
     */
    private String procedureName;
    private String sourceText;
}
