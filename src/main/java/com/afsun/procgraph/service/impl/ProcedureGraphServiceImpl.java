package com.afsun.procgraph.service.impl;

import com.afsun.procgraph.config.ProcGraphProperties;
import com.afsun.procgraph.core.AnalysisResult;
import com.afsun.procgraph.core.SourceAnalyzer;
import com.afsun.procgraph.core.dto.FieldFacts;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.dto.TableFacts;
import com.afsun.procgraph.core.meta.ProcedureSourceLoader;
import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.crawler.DependencyCrawler;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.snapshot.GraphSnapshotStore;
import com.afsun.procgraph.service.ProcedureGraphService;
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
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 存储过程图谱服务实现
 * 图谱保存在内存中，启动时按配置从快照恢复
 *
 * @author afsun
 */
@Service
@Slf4j
public class ProcedureGraphServiceImpl implements ProcedureGraphService, ApplicationRunner {

    private final SourceAnalyzer sourceAnalyzer;
    private final KnowledgeGraph knowledgeGraph;
    private final DependencyCrawler dependencyCrawler;
    private final ProcedureSourceLoader sourceLoader;
    private final GraphSnapshotStore snapshotStore;
    private final ProcGraphProperties properties;

    public ProcedureGraphServiceImpl(SourceAnalyzer sourceAnalyzer, KnowledgeGraph knowledgeGraph,
                                     DependencyCrawler dependencyCrawler, ProcedureSourceLoader sourceLoader,
                                     GraphSnapshotStore snapshotStore, ProcGraphProperties properties) {
        this.sourceAnalyzer = sourceAnalyzer;
        this.knowledgeGraph = knowledgeGraph;
        this.dependencyCrawler = dependencyCrawler;
        this.sourceLoader = sourceLoader;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
    }

    /**
     * 应用启动时从快照恢复图谱
     */
    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isAutoLoad()) {
            return;
        }
        log.info("应用启动，尝试从快照恢复图谱: {}", properties.getSnapshotPath());
        if (loadSnapshot()) {
            log.info("图谱恢复完成, 过程数={}", knowledgeGraph.procedureCount());
        }
    }

    @Override
    public AnalysisResult analyze(String sourceText, String procedureName) {
        return sourceAnalyzer.analyze(sourceText, procedureName);
    }

    @Override
    public ProcedureContext analyzeAndRegister(String procedureName, String sourceText) {
        String fullName = register(procedureName, sourceText);
        knowledgeGraph.recomputeDependencyLevels();
        return knowledgeGraph.getProcedureContext(fullName)
                .orElseThrow(() -> new IllegalStateException("registered procedure not found: " + fullName));
    }

    @Override
    public IndexingReport indexDirectory(Path directory) {
        long startTime = System.currentTimeMillis();
        IndexingReport report = new IndexingReport();
        report.setDirectory(String.valueOf(directory));

        Map<String, String> sources = sourceLoader.loadProcedures(directory);
        report.setFilesFound(sources.size());
        log.info("开始索引目录: {}, 文件数: {}", directory, sources.size());

        for (Map.Entry<String, String> entry : sources.entrySet()) {
            try {
                register(entry.getKey(), entry.getValue());
                report.setProceduresIndexed(report.getProceduresIndexed() + 1);
            } catch (IllegalArgumentException e) {
                log.warn("过程注册失败, 已跳过: {}, 原因: {}", entry.getKey(), e.getMessage());
                report.getFailedFiles().add(entry.getKey());
            }
        }
        knowledgeGraph.recomputeDependencyLevels();

        if (properties.isAutoSave()) {
            report.setSnapshotSaved(saveSnapshot());
        }
        report.setElapsedMillis(System.currentTimeMillis() - startTime);
        log.info("目录索引完成: {}, 成功={}, 失败={}, 耗时={}ms", directory, report.getProceduresIndexed(),
                report.getFailedFiles().size(), report.getElapsedMillis());
        return report;
    }

    @Override
    public String registerProcedure(ProcedureFacts facts) {
        String fullName = knowledgeGraph.addProcedure(facts);
        knowledgeGraph.recomputeDependencyLevels();
        return fullName;
    }

    @Override
    public String registerTable(TableFacts facts) {
        return knowledgeGraph.addTable(facts);
    }

    @Override
    public String registerField(FieldFacts facts) {
        return knowledgeGraph.addField(facts);
    }

    @Override
    public Optional<ProcedureContext> getProcedureContext(String name) {
        return knowledgeGraph.getProcedureContext(name);
    }

    @Override
    public Optional<TableInfo> getTableInfo(String name) {
        return knowledgeGraph.getTableInfo(name);
    }

    @Override
    public Set<String> getCallers(String name) {
        return knowledgeGraph.getCallers(name);
    }

    @Override
    public List<FieldUsageEntry> queryFieldUsage(String fieldName, String procedure) {
        if (StringUtils.isBlank(procedure)) {
            return knowledgeGraph.queryFieldUsage(fieldName);
        }
        return knowledgeGraph.queryFieldUsage(fieldName, procedure);
    }

    @Override
    public FieldUsageSummary getFieldUsageSummary(String fieldName) {
        return knowledgeGraph.getFieldUsageSummary(fieldName);
    }

    @Override
    public CrawlResult crawlProcedure(String name, int maxDepth, boolean includeTables) {
        return dependencyCrawler.crawlProcedure(name, maxDepth, includeTables);
    }

    @Override
    public Optional<ImpactResult> getProcedureImpact(String name, int maxDepth) {
        return dependencyCrawler.getProcedureImpact(name, maxDepth);
    }

    @Override
    public List<FieldSource> findFieldSources(String fieldName, int maxResults) {
        return dependencyCrawler.findFieldSources(fieldName, maxResults);
    }

    @Override
    public List<FieldSource> findFieldDestinations(String fieldName, int maxResults) {
        return dependencyCrawler.findFieldDestinations(fieldName, maxResults);
    }

    @Override
    public TracePath traceFieldFlow(String fieldName, int maxDepth) {
        return dependencyCrawler.traceFieldFlow(fieldName, maxDepth);
    }

    @Override
    public Optional<TracePath> traceField(String fieldName, String startProcedure, int maxDepth) {
        return dependencyCrawler.traceField(fieldName, startProcedure, maxDepth);
    }

    @Override
    public FieldFlowAnalysis analyzeFieldFlow(String fieldName, String startProcedure) {
        return dependencyCrawler.analyzeFieldFlow(fieldName, startProcedure);
    }

    @Override
    public List<String> listProcedures() {
        return knowledgeGraph.listProcedures();
    }

    @Override
    public Map<Integer, List<String>> getProcedureHierarchy() {
        return knowledgeGraph.getProcedureHierarchy();
    }

    @Override
    public GraphStatistics getStatistics() {
        return knowledgeGraph.getStatistics();
    }

    @Override
    public boolean saveSnapshot() {
        Path path = snapshotPath();
        if (path == null) {
            log.debug("未配置快照路径，跳过保存");
            return false;
        }
        snapshotStore.save(knowledgeGraph, path);
        return true;
    }

    @Override
    public boolean loadSnapshot() {
        Path path = snapshotPath();
        return path != null && snapshotStore.loadInto(knowledgeGraph, path);
    }

    /**
     * 分析并注册，不重算依赖层级
     *
     * @return 节点全名
     */
    private String register(String procedureName, String sourceText) {
        Validate.isTrue(StringUtils.isNotBlank(sourceText), "procedure source must not be blank");
        String name = StringUtils.isBlank(procedureName) ? null : SqlIdentifiers.normalize(procedureName);
        AnalysisResult result = sourceAnalyzer.analyze(sourceText, name);
        String resolved = resolveName(name, result);
        if (!resolved.equals(name)) {
            // 字段使用记录里的过程名与注册名保持一致
            result = sourceAnalyzer.analyze(sourceText, resolved);
        }
        return knowledgeGraph.addProcedure(toFacts(resolved, sourceText, result));
    }

    /**
     * 未给出名称时取过程头声明的名称；文件名未带模式且与声明同名时补上声明的模式
     */
    static String resolveName(String name, AnalysisResult result) {
        if (name == null) {
            Validate.isTrue(StringUtils.isNotBlank(result.getDeclaredName()),
                    "procedure name is missing and no routine header was found");
            return SqlIdentifiers.fullName(result.getDeclaredSchema(), result.getDeclaredName());
        }
        if (SqlIdentifiers.qualifier(name) == null && StringUtils.isNotBlank(result.getDeclaredSchema())
                && name.equals(result.getDeclaredName())) {
            return SqlIdentifiers.fullName(result.getDeclaredSchema(), name);
        }
        return name;
    }

    static ProcedureFacts toFacts(String name, String sourceText, AnalysisResult result) {
        return ProcedureFacts.builder()
                .name(name)
                .sourceCode(sourceText)
                .complexityScore(result.getComplexityScore())
                .calledProcedures(new ArrayList<>(result.getProcedures()))
                .calledTables(new ArrayList<>(result.getTables()))
                .parameters(new ArrayList<>(result.getParameters()))
                .fieldUsages(result.getFields())
                .build();
    }

    private Path snapshotPath() {
        return StringUtils.isBlank(properties.getSnapshotPath()) ? null : Paths.get(properties.getSnapshotPath());
    }
}
