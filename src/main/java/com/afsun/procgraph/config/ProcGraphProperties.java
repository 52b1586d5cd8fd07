package com.afsun.procgraph.config;

import com.afsun.procgraph.core.meta.FileProcedureSourceLoader;
import com.afsun.procgraph.crawler.DependencyCrawler;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 存储过程图谱配置，对应 application.yml 中的 procgraph 节点
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "procgraph")
public class ProcGraphProperties {

    /**
     * 快照文件路径，为空时不做持久化
     */
    private String snapshotPath = "data/procgraph-snapshot.json";

    /**
     * 启动时是否从快照恢复图谱
     */
    private boolean autoLoad = true;

    /**
     * 目录索引完成后是否自动保存快照
     */
    private boolean autoSave = true;

    /**
     * 源码文件扩展名
     */
    private String sourceExtension = FileProcedureSourceLoader.DEFAULT_EXTENSION;

    /**
     * 爬取默认深度
     */
    private int defaultDepth = 5;

    /**
     * 字段流追踪深度
     */
    private int traceDepth = DependencyCrawler.DEFAULT_TRACE_DEPTH;

    /**
     * 接口允许的最大深度
     */
    private int maxDepth = 10;
}
