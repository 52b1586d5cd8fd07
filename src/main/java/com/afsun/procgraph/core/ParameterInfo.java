package com.afsun.procgraph.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存储过程声明的参数
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParameterInfo {
    private String name;
    private ParameterDirection direction = ParameterDirection.IN;
    private String dataType;

    public static ParameterInfo of(String name, ParameterDirection direction, String dataType) {
        return new ParameterInfo(name, direction == null ? ParameterDirection.IN : direction, dataType);
    }
}
