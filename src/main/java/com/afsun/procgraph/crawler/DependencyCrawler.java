package com.afsun.procgraph.crawler;

import com.afsun.procgraph.core.FieldOperation;
import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.NodeType;
import com.afsun.procgraph.vo.CrawlResult;
import com.afsun.procgraph.vo.DependencyNode;
import com.afsun.procgraph.vo.FieldFlowAnalysis;
import com.afsun.procgraph.vo.FieldSource;
import com.afsun.procgraph.vo.FieldUsageEntry;
import com.afsun.procgraph.vo.ImpactResult;
import com.afsun.procgraph.vo.ProcedureContext;
import com.afsun.procgraph.vo.TracePath;
import com.afsun.procgraph.vo.TraceStep;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 依赖爬取与字段血缘
 * 只通过 {@link KnowledgeGraph} 的查询方法访问图谱，所有遍历状态都是单次调用的局部变量
 *
 * @author afsun
 */
@Slf4j
public class DependencyCrawler {

    public static final int DEFAULT_TRACE_DEPTH = 10;
    public static final int DEFAULT_MAX_RESULTS = 10;

    private final KnowledgeGraph graph;
    private final int traceDepth;

    public DependencyCrawler(KnowledgeGraph graph) {
        this(graph, DEFAULT_TRACE_DEPTH);
    }

    public DependencyCrawler(KnowledgeGraph graph, int traceDepth) {
        Validate.isTrue(graph != null, "graph must not be null");
        Validate.isTrue(traceDepth >= 0, "traceDepth must not be negative: %d", traceDepth);
        this.graph = graph;
        this.traceDepth = traceDepth;
    }

    /**
     * 从过程出发沿 CALLS 边做深度受限的遍历
     *
     * @param name          起点过程名
     * @param maxDepth      最大展开深度，0 表示只返回起点
     * @param includeTables 是否把访问的表作为叶子加入依赖树
     */
    public CrawlResult crawlProcedure(String name, int maxDepth, boolean includeTables) {
        Validate.isTrue(maxDepth >= 0, "maxDepth must not be negative: %d", maxDepth);
        long startTime = System.currentTimeMillis();

        CrawlResult result = new CrawlResult();
        result.setRootProcedure(name);
        result.setMaxDepth(maxDepth);
        result.setIncludeTables(includeTables);

        Optional<ProcedureContext> root = graph.getProcedureContext(name);
        if (!root.isPresent()) {
            log.debug("爬取起点不存在: {}", name);
            DependencyNode missing = new DependencyNode(SqlIdentifiers.normalize(name), NodeType.PROCEDURE, 0);
            missing.setResolved(false);
            result.setDependenciesTree(missing);
            result.getUnresolvedProcedures().add(missing.getName());
            result.setCrawlMillis(System.currentTimeMillis() - startTime);
            return result;
        }

        Crawl crawl = new Crawl(maxDepth, includeTables);
        result.setDependenciesTree(crawl.visit(root.get(), 0));
        result.getProceduresFound().addAll(crawl.procedures);
        result.getTablesFound().addAll(crawl.tables);
        result.getUnresolvedProcedures().addAll(crawl.unresolved);
        result.setDepthReached(crawl.depthReached);
        result.setCrawlMillis(System.currentTimeMillis() - startTime);
        log.debug("爬取完成: {}, 过程={}, 表={}, 深度={}/{}", name, crawl.procedures.size(), crawl.tables.size(),
                crawl.depthReached, maxDepth);
        return result;
    }

    /**
     * 字段来源：写入该字段的过程（注册顺序），其后是含有该列的表
     */
    public List<FieldSource> findFieldSources(String fieldName, int maxResults) {
        Validate.isTrue(maxResults >= 0, "maxResults must not be negative: %d", maxResults);
        List<FieldSource> sources = procedureUsages(fieldName, u -> u.hasOperation(FieldOperation.WRITE));
        for (String table : graph.getTablesWithColumn(fieldName)) {
            sources.add(new FieldSource(table, NodeType.TABLE));
        }
        return truncate(sources, maxResults);
    }

    /**
     * 字段去向：读取或变换该字段的过程
     */
    public List<FieldSource> findFieldDestinations(String fieldName, int maxResults) {
        Validate.isTrue(maxResults >= 0, "maxResults must not be negative: %d", maxResults);
        List<FieldSource> destinations = procedureUsages(fieldName,
                u -> u.hasOperation(FieldOperation.READ) || u.hasOperation(FieldOperation.TRANSFORM));
        return truncate(destinations, maxResults);
    }

    /**
     * 变更影响：maxDepth 跳以内的全部调用者及自身依赖
     * 影响分 = Σ (1 + 调用者复杂度) / 跳数
     *
     * @return 过程不存在时为空
     */
    public Optional<ImpactResult> getProcedureImpact(String name, int maxDepth) {
        Validate.isTrue(maxDepth >= 0, "maxDepth must not be negative: %d", maxDepth);
        Optional<ProcedureContext> origin = graph.getProcedureContext(name);
        if (!origin.isPresent()) {
            return Optional.empty();
        }
        String originName = origin.get().getFullName();

        ImpactResult impact = new ImpactResult();
        impact.setProcedure(originName);
        impact.setMaxDepth(maxDepth);

        Set<String> visited = new HashSet<>();
        visited.add(originName);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(originName);
        double score = 0;
        for (int hops = 1; hops <= maxDepth && !frontier.isEmpty(); hops++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String caller : graph.getCallers(current)) {
                    if (!visited.add(caller)) {
                        continue;
                    }
                    int complexity = graph.getProcedureContext(caller)
                            .map(ProcedureContext::getComplexityScore).orElse(0);
                    impact.getCallers().add(new ImpactResult.ImpactedCaller(caller, hops, complexity));
                    score += (1.0 + complexity) / hops;
                    next.add(caller);
                }
            }
            frontier = next;
        }
        impact.setCallerCount(impact.getCallers().size());
        impact.setDirectCallerCount((int) impact.getCallers().stream().filter(c -> c.getHops() == 1).count());
        impact.setTotalImpactScore(score);

        CrawlResult dependencies = crawlProcedure(originName, maxDepth, true);
        dependencies.getProceduresFound().stream()
                .filter(p -> !p.equals(originName))
                .forEach(impact.getDependencies()::add);
        impact.getAffectedTables().addAll(dependencies.getTablesFound());
        return Optional.of(impact);
    }

    public TracePath traceFieldFlow(String fieldName) {
        return traceFieldFlow(fieldName, traceDepth);
    }

    /**
     * 字段流转：从写入该字段的过程出发，沿调用者与被调用者逐层扩散，
     * 记录每个接触该字段的过程。没有写入者时从全部使用者出发。
     */
    public TracePath traceFieldFlow(String fieldName, int maxDepth) {
        Validate.isTrue(maxDepth >= 0, "maxDepth must not be negative: %d", maxDepth);
        TracePath path = newPath(fieldName, maxDepth);
        if (path.getFieldName() == null) {
            return path;
        }

        List<FieldUsageEntry> usages = graph.queryFieldUsage(fieldName);
        List<String> origins = new ArrayList<>();
        usages.stream().filter(e -> e.getUsage().hasOperation(FieldOperation.WRITE))
                .forEach(e -> origins.add(e.getProcedure()));
        if (origins.isEmpty()) {
            usages.forEach(e -> origins.add(e.getProcedure()));
        }

        Set<String> visited = new HashSet<>();
        Deque<TraceCursor> queue = new ArrayDeque<>();
        for (String origin : origins) {
            if (visited.add(origin)) {
                queue.add(new TraceCursor(origin, 0));
            }
        }
        while (!queue.isEmpty()) {
            TraceCursor cursor = queue.poll();
            Optional<ProcedureContext> ctx = graph.getProcedureContext(cursor.procedure);
            if (!ctx.isPresent()) {
                continue;
            }
            recordSteps(path, ctx.get(), cursor.depth);
            if (cursor.depth >= maxDepth) {
                continue;
            }
            Set<String> neighbours = new LinkedHashSet<>(graph.getCallers(cursor.procedure));
            neighbours.addAll(ctx.get().getCalledProcedures());
            for (String next : neighbours) {
                if (visited.add(next)) {
                    queue.add(new TraceCursor(next, cursor.depth + 1));
                }
            }
        }
        return path;
    }

    /**
     * 从指定过程出发，沿被调用过程深度优先追踪字段
     *
     * @return 起点过程不存在时为空
     */
    public Optional<TracePath> traceField(String fieldName, String startProcedure, int maxDepth) {
        Validate.isTrue(maxDepth >= 0, "maxDepth must not be negative: %d", maxDepth);
        Optional<ProcedureContext> start = graph.getProcedureContext(startProcedure);
        if (!start.isPresent()) {
            return Optional.empty();
        }
        TracePath path = newPath(fieldName, maxDepth);
        if (path.getFieldName() != null) {
            traceDown(path, start.get(), 0, maxDepth, new HashSet<>());
        }
        return Optional.of(path);
    }

    /**
     * 来源、去向、流转路径与汇总一次返回；给出起点过程时按起点追踪
     */
    public FieldFlowAnalysis analyzeFieldFlow(String fieldName, String startProcedure) {
        FieldFlowAnalysis analysis = new FieldFlowAnalysis();
        analysis.setFieldName(fieldKey(fieldName));
        analysis.setSources(findFieldSources(fieldName, DEFAULT_MAX_RESULTS));
        analysis.setDestinations(findFieldDestinations(fieldName, DEFAULT_MAX_RESULTS));
        if (StringUtils.isNotBlank(startProcedure)) {
            analysis.setTrace(traceField(fieldName, startProcedure, traceDepth).orElse(null));
        } else {
            analysis.setTrace(traceFieldFlow(fieldName));
        }
        analysis.setSummary(graph.getFieldUsageSummary(fieldName));
        return analysis;
    }

    private void traceDown(TracePath path, ProcedureContext ctx, int depth, int maxDepth, Set<String> visited) {
        if (depth > maxDepth || !visited.add(ctx.getFullName())) {
            return;
        }
        recordSteps(path, ctx, depth);
        for (String callee : ctx.getCalledProcedures()) {
            graph.getProcedureContext(callee).ifPresent(c -> traceDown(path, c, depth + 1, maxDepth, visited));
        }
    }

    private void recordSteps(TracePath path, ProcedureContext ctx, int depth) {
        FieldUsage usage = ctx.getFieldsUsed().get(path.getFieldName());
        if (usage == null) {
            return;
        }
        String context = String.join(",", usage.getContexts());
        for (FieldOperation operation : usage.getOperations()) {
            path.getSteps().add(new TraceStep(ctx.getFullName(), operation, context, depth));
        }
        if (usage.hasOperation(FieldOperation.WRITE)) {
            addDistinct(path.getSources(), ctx.getFullName());
        }
        if (usage.hasOperation(FieldOperation.READ) || usage.hasOperation(FieldOperation.TRANSFORM)) {
            addDistinct(path.getDestinations(), ctx.getFullName());
        }
        usage.getTransformations().forEach(t -> addDistinct(path.getTransformations(), t));
    }

    private TracePath newPath(String fieldName, int maxDepth) {
        TracePath path = new TracePath();
        path.setFieldName(fieldKey(fieldName));
        path.setMaxDepth(maxDepth);
        if (path.getFieldName() != null) {
            path.getSourceTables().addAll(graph.getTablesWithColumn(fieldName));
        }
        return path;
    }

    private List<FieldSource> procedureUsages(String fieldName, Predicate<FieldUsage> filter) {
        List<FieldSource> result = new ArrayList<>();
        for (FieldUsageEntry entry : graph.queryFieldUsage(fieldName)) {
            FieldUsage usage = entry.getUsage();
            if (filter.test(usage)) {
                FieldSource source = new FieldSource(entry.getProcedure(), NodeType.PROCEDURE);
                source.getOperations().addAll(usage.getOperations());
                source.getContexts().addAll(usage.getContexts());
                source.getTransformations().addAll(usage.getTransformations());
                result.add(source);
            }
        }
        return result;
    }

    private static <T> List<T> truncate(List<T> list, int maxResults) {
        return list.size() <= maxResults ? list : new ArrayList<>(list.subList(0, maxResults));
    }

    private static <T> void addDistinct(List<T> list, T value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }

    private static String fieldKey(String fieldName) {
        if (StringUtils.isBlank(fieldName)) {
            return null;
        }
        return SqlIdentifiers.bareName(SqlIdentifiers.normalize(fieldName));
    }

    /**
     * 单次爬取的遍历状态
     */
    private final class Crawl {
        private final int maxDepth;
        private final boolean includeTables;
        private final Map<String, VisitState> states = new HashMap<>();
        private final Set<String> procedures = new LinkedHashSet<>();
        private final Set<String> tables = new LinkedHashSet<>();
        private final Set<String> unresolved = new LinkedHashSet<>();
        private int depthReached;

        private Crawl(int maxDepth, boolean includeTables) {
            this.maxDepth = maxDepth;
            this.includeTables = includeTables;
        }

        private DependencyNode visit(ProcedureContext ctx, int depth) {
            String name = ctx.getFullName();
            DependencyNode node = new DependencyNode(name, NodeType.PROCEDURE, depth);
            node.setComplexityScore(ctx.getComplexityScore());
            states.put(name, VisitState.ON_PATH);
            procedures.add(name);
            depthReached = Math.max(depthReached, depth);

            if (depth < maxDepth) {
                for (String callee : ctx.getCalledProcedures()) {
                    node.getDependencies().add(expand(callee, depth + 1));
                }
                if (includeTables) {
                    for (String table : ctx.getCalledTables()) {
                        tables.add(table);
                        node.getDependencies().add(new DependencyNode(table, NodeType.TABLE, depth + 1));
                    }
                }
            }
            states.put(name, VisitState.DONE);
            return node;
        }

        private DependencyNode expand(String callee, int depth) {
            if (states.getOrDefault(callee, VisitState.UNVISITED) != VisitState.UNVISITED) {
                DependencyNode revisit = new DependencyNode(callee, NodeType.PROCEDURE, depth);
                revisit.setRevisit(true);
                return revisit;
            }
            Optional<ProcedureContext> ctx = graph.getProcedureContext(callee);
            if (!ctx.isPresent()) {
                states.put(callee, VisitState.DONE);
                unresolved.add(callee);
                DependencyNode missing = new DependencyNode(callee, NodeType.PROCEDURE, depth);
                missing.setResolved(false);
                return missing;
            }
            return visit(ctx.get(), depth);
        }
    }

    private static final class TraceCursor {
        private final String procedure;
        private final int depth;

        private TraceCursor(String procedure, int depth) {
            this.procedure = procedure;
            this.depth = depth;
        }
    }
}
