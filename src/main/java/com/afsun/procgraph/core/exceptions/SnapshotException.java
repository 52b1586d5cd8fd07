package com.afsun.procgraph.core.exceptions;

import java.nio.file.Path;

/**
 * 图谱快照写入异常
 * 读取失败按缓存未命中处理，不会抛出该异常
 *
 * @author afsun
 */
public class SnapshotException extends ProcGraphException {

    public SnapshotException(String message, Path location, Throwable cause) {
        super("SNAPSHOT_ERROR", message, location, "请检查快照目录是否存在且可写", cause);
    }
}
