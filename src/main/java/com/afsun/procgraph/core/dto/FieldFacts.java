package com.afsun.procgraph.core.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * 字段注册载荷：table 为空时是独立字段，否则是该表的列
 *
 * @author afsun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldFacts {
    private String name;
    private String table;
    private String dataType;
    private String description;

    public void validate() {
        Validate.isTrue(StringUtils.isNotBlank(name), "field name must not be blank");
    }
}
