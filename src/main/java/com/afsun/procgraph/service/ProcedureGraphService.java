package com.afsun.procgraph.service;

import com.afsun.procgraph.core.AnalysisResult;
import com.afsun.procgraph.core.dto.FieldFacts;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.dto.TableFacts;
import com.afsun.procgraph.vo.CrawlResult;
import com.afsun.procgraph.vo.FieldFlowAnalysis;
import com.afsun.procgraph.vo.FieldSource;
import com.afsun.procgraph.vo.FieldUsageEntry;
import com.afsun.procgraph.vo.FieldUsageSummary;
import com.afsun.procgraph.vo.GraphStatistics;
import com.afsun.procgraph.vo.ImpactResult;
import com.afsun.procgraph.vo.IndexingReport;
import com.afsun.procgraph.vo.ProcedureContext;
import com.afsun.procgraph.vo.TableInfo;
import com.afsun.procgraph.vo.TracePath;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 存储过程图谱服务：源码分析入图、图谱查询与依赖爬取
 *
 * @author afsun
 */
public interface ProcedureGraphService {

    /**
     * 仅分析源码，不写入图谱
     */
    AnalysisResult analyze(String sourceText, String procedureName);

    /**
     * 分析源码并注册到图谱，随后重算依赖层级
     *
     * @param procedureName 过程名，可带模式前缀；为空时取过程头中声明的名称
     * @param sourceText    过程源码
     * @return 注册后的过程上下文
     */
    ProcedureContext analyzeAndRegister(String procedureName, String sourceText);

    /**
     * 批量索引目录下的源码文件
     *
     * @param directory 源码目录
     * @return 索引结果
     */
    IndexingReport indexDirectory(Path directory);

    String registerProcedure(ProcedureFacts facts);

    String registerTable(TableFacts facts);

    String registerField(FieldFacts facts);

    Optional<ProcedureContext> getProcedureContext(String name);

    Optional<TableInfo> getTableInfo(String name);

    Set<String> getCallers(String name);

    /**
     * 查询字段使用情况
     *
     * @param procedure 限定过程，为空时查询全部过程
     */
    List<FieldUsageEntry> queryFieldUsage(String fieldName, String procedure);

    FieldUsageSummary getFieldUsageSummary(String fieldName);

    CrawlResult crawlProcedure(String name, int maxDepth, boolean includeTables);

    Optional<ImpactResult> getProcedureImpact(String name, int maxDepth);

    List<FieldSource> findFieldSources(String fieldName, int maxResults);

    List<FieldSource> findFieldDestinations(String fieldName, int maxResults);

    TracePath traceFieldFlow(String fieldName, int maxDepth);

    Optional<TracePath> traceField(String fieldName, String startProcedure, int maxDepth);

    FieldFlowAnalysis analyzeFieldFlow(String fieldName, String startProcedure);

    List<String> listProcedures();

    Map<Integer, List<String>> getProcedureHierarchy();

    GraphStatistics getStatistics();

    /**
     * 保存快照到配置路径
     *
     * @return 未配置快照路径时返回 false
     */
    boolean saveSnapshot();

    /**
     * 从配置路径恢复图谱
     *
     * @return 快照不存在、版本不一致或无法读取时返回 false
     */
    boolean loadSnapshot();
}
