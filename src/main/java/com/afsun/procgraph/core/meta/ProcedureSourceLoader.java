package com.afsun.procgraph.core.meta;

import java.nio.file.Path;
import java.util.Map;

/**
 * 存储过程源码来源
 *
 * @author afsun
 */
public interface ProcedureSourceLoader {

    /**
     * 加载目录下的全部过程源码
     *
     * @param directory 源码目录
     * @return 过程名（大写，可带模式前缀）→ 源码，按文件路径排序
     */
    Map<String, String> loadProcedures(Path directory);
}
