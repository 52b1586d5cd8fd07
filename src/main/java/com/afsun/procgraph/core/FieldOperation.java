package com.afsun.procgraph.core;

/**
 * 字段操作类型
 *
 * @author afsun
 */
public enum FieldOperation {
    READ,
    WRITE,
    TRANSFORM
}
