package com.afsun.procgraph.vo;

import com.afsun.procgraph.core.FieldUsage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 某个过程对字段的使用
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldUsageEntry {
    private String procedure;
    private FieldUsage usage;
}
