package com.afsun.procgraph.core;

import java.util.Locale;

/**
 * 存储过程参数方向
 *
 * @author afsun
 */
public enum ParameterDirection {
    IN,
    OUT,
    IN_OUT;

    /**
     * 解析方言中的方向关键字：IN / OUT / IN OUT / INOUT / OUTPUT
     * 无法识别时按 IN 处理
     */
    public static ParameterDirection parse(String token) {
        if (token == null) {
            return IN;
        }
        String t = token.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        switch (t) {
            case "OUT":
            case "OUTPUT":
                return OUT;
            case "IN OUT":
            case "INOUT":
            case "IN_OUT":
                return IN_OUT;
            default:
                return IN;
        }
    }
}
