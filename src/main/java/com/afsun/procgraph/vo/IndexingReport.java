package com.afsun.procgraph.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录批量索引结果
 *
 * @author afsun
 */
@Data
public class IndexingReport {
    private String directory;
    private int filesFound;
    private int proceduresIndexed;
    private List<String> failedFiles = new ArrayList<>();
    private boolean snapshotSaved;
    private long elapsedMillis;
}
