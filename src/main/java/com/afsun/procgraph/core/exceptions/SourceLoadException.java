package com.afsun.procgraph.core.exceptions;

import java.nio.file.Path;

/**
 * 存储过程源码加载异常（目录不存在、文件不可读等）
 *
 * @author afsun
 */
public class SourceLoadException extends ProcGraphException {

    private static final String SUGGESTION = "请检查源码目录路径与文件编码（需为UTF-8）";

    public SourceLoadException(String message, Path location) {
        super("SOURCE_LOAD_ERROR", message, location, SUGGESTION, null);
    }

    public SourceLoadException(String message, Path location, Throwable cause) {
        super("SOURCE_LOAD_ERROR", message, location, SUGGESTION, cause);
    }
}
