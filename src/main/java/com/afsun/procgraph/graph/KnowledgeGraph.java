package com.afsun.procgraph.graph;

import com.afsun.procgraph.core.FieldOperation;
import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.ParameterInfo;
import com.afsun.procgraph.core.dto.ColumnInfo;
import com.afsun.procgraph.core.dto.FieldFacts;
import com.afsun.procgraph.core.dto.ForeignKeyInfo;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.dto.TableFacts;
import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.graph.snapshot.GraphSnapshot;
import com.afsun.procgraph.vo.FieldUsageEntry;
import com.afsun.procgraph.vo.FieldUsageSummary;
import com.afsun.procgraph.vo.GraphStatistics;
import com.afsun.procgraph.vo.ProcedureContext;
import com.afsun.procgraph.vo.TableInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 内存知识图谱：过程、表、字段三类节点及其有向边
 * <p>
 * 名称解析规则：大小写不敏感；先按全名匹配，再按最后一段名称匹配，候选不唯一时视为未找到。
 * 写操作持有写锁，查询持有读锁，查询结果均为副本。
 *
 * @author afsun
 */
@Slf4j
public class KnowledgeGraph {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final NodeIndex<ProcedureNode> procedures = new NodeIndex<>();
    private final NodeIndex<TableNode> tables = new NodeIndex<>();
    private final NodeIndex<FieldNode> fields = new NodeIndex<>();

    /**
     * 节点键（类型:全名）→ 出边 / 入边
     */
    private final Map<String, Set<GraphEdge>> outgoing = new HashMap<>();
    private final Map<String, Set<GraphEdge>> incoming = new HashMap<>();

    private long registrationSequence;

    // ------------------------------------------------------------------ 写入

    /**
     * 注册或更新存储过程，重建其 CALLS / ACCESSES / READS / WRITES / TRANSFORMS 出边
     *
     * @return 节点全名
     */
    public String addProcedure(ProcedureFacts facts) {
        Validate.isTrue(facts != null, "procedure facts must not be null");
        facts.validate();
        String[] identity = splitIdentity(facts.getSchema(), facts.getName());

        lock.writeLock().lock();
        try {
            ProcedureNode node = upsertNode(procedures, identity[0], identity[1], ProcedureNode::new);
            node.merge(facts);
            if (node.getRegistrationOrder() == 0) {
                node.setRegistrationOrder(++registrationSequence);
            }
            rebuildProcedureEdges(node);
            relink(Collections.singleton(SqlIdentifiers.bareName(node.getFullName())));
            log.debug("注册存储过程: {}, 调用={}, 表={}, 字段={}", node.getFullName(),
                    node.getCalledProcedures().size(), node.getCalledTables().size(), node.getFieldUsages().size());
            return node.getFullName();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 注册或更新表，同时登记列字段节点与外键引用
     *
     * @return 节点全名
     */
    public String addTable(TableFacts facts) {
        Validate.isTrue(facts != null, "table facts must not be null");
        facts.validate();
        String[] identity = splitIdentity(facts.getSchema(), facts.getName());

        lock.writeLock().lock();
        try {
            TableNode node = upsertNode(tables, identity[0], identity[1], TableNode::new);
            node.merge(facts);
            if (node.getRegistrationOrder() == 0) {
                node.setRegistrationOrder(++registrationSequence);
            }
            rebuildTableEdges(node);
            Set<String> names = new HashSet<>();
            names.add(SqlIdentifiers.bareName(node.getFullName()));
            node.getColumns().stream().filter(c -> StringUtils.isNotBlank(c.getName()))
                    .forEach(c -> names.add(SqlIdentifiers.normalize(c.getName())));
            relink(names);
            log.debug("注册表: {}, 列={}, 外键={}", node.getFullName(), node.getColumns().size(),
                    node.getForeignKeys().size());
            return node.getFullName();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 注册字段；指定表时作为该表的列
     *
     * @return 节点全名
     */
    public String addField(FieldFacts facts) {
        Validate.isTrue(facts != null, "field facts must not be null");
        facts.validate();
        String name = SqlIdentifiers.normalize(facts.getName());

        lock.writeLock().lock();
        try {
            String table = null;
            if (StringUtils.isNotBlank(facts.getTable())) {
                table = ensureNode(tables, facts.getTable(), TableNode::new).getFullName();
            }
            FieldNode node = upsertNode(fields, table, name, FieldNode::new);
            node.setPlaceholder(false);
            node.setTable(table);
            if (StringUtils.isNotBlank(facts.getDataType())) {
                node.setDataType(facts.getDataType());
            }
            if (StringUtils.isNotBlank(facts.getDescription())) {
                node.setDescription(facts.getDescription());
            }
            removeOutgoing(node.getKey());
            if (table != null) {
                addEdge(node.getFullName(), table, EdgeType.BELONGS_TO);
            }
            relink(Collections.singleton(node.getName()));
            return node.getFullName();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 重新计算全部过程的依赖层级：不调用任何已登记过程为 0，否则为被调用过程最大层级 + 1。
     * 环上的回边不参与计算；遍历按全名排序，结果与注册顺序无关。
     */
    public void recomputeDependencyLevels() {
        lock.writeLock().lock();
        try {
            Map<String, Integer> levels = new HashMap<>();
            Set<String> onPath = new HashSet<>();
            List<ProcedureNode> roots = procedures.values().stream()
                    .filter(n -> !n.isPlaceholder())
                    .sorted(Comparator.comparing(ProcedureNode::getFullName))
                    .collect(Collectors.toList());
            for (ProcedureNode node : roots) {
                levelOf(node, levels, onPath);
            }
            for (ProcedureNode node : procedures.values()) {
                node.setDependencyLevel(levels.getOrDefault(node.getFullName(), 0));
            }
            log.debug("依赖层级计算完成, 过程数={}", levels.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            procedures.clear();
            tables.clear();
            fields.clear();
            outgoing.clear();
            incoming.clear();
            registrationSequence = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------ 查询

    /**
     * 过程上下文；未知、有歧义或仅为占位的名称返回空
     */
    public Optional<ProcedureContext> getProcedureContext(String name) {
        lock.readLock().lock();
        try {
            ProcedureNode node = procedures.resolve(name);
            if (node == null || node.isPlaceholder()) {
                return Optional.empty();
            }
            ProcedureContext ctx = new ProcedureContext();
            ctx.setName(node.getName());
            ctx.setSchema(node.getSchema());
            ctx.setFullName(node.getFullName());
            node.getParameters().forEach(p -> ctx.getParameters().add(
                    ParameterInfo.of(p.getName(), p.getDirection(), p.getDataType())));
            ctx.getCalledProcedures().addAll(targets(node.getKey(), EdgeType.CALLS));
            ctx.getCalledTables().addAll(targets(node.getKey(), EdgeType.ACCESSES));
            ctx.setBusinessLogic(node.getBusinessLogic());
            ctx.setComplexityScore(node.getComplexityScore());
            ctx.setDependencyLevel(node.getDependencyLevel());
            node.getFieldUsages().forEach((k, v) -> ctx.getFieldsUsed().put(k, v.copy()));
            ctx.setSourceCode(node.getSourceCode());
            return Optional.of(ctx);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<TableInfo> getTableInfo(String name) {
        lock.readLock().lock();
        try {
            TableNode node = tables.resolve(name);
            if (node == null || node.isPlaceholder()) {
                return Optional.empty();
            }
            TableNode copy = node.copy();
            TableInfo info = new TableInfo();
            info.setName(copy.getName());
            info.setSchema(copy.getSchema());
            info.setFullName(copy.getFullName());
            info.setColumns(copy.getColumns());
            info.setIndexes(copy.getIndexes());
            info.setForeignKeys(copy.getForeignKeys());
            info.setPrimaryKeyColumns(copy.getPrimaryKeyColumns());
            info.setRelationships(copy.getRelationships());
            info.setBusinessPurpose(copy.getBusinessPurpose());
            info.setComplexityScore(copy.getComplexityScore());
            info.setRowCount(copy.getRowCount());
            info.getAccessedBy().addAll(sources(node.getKey(), EdgeType.ACCESSES));
            info.getReferencedBy().addAll(sources(node.getKey(), EdgeType.REFERENCES));
            return Optional.of(info);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 调用了该过程的全部过程（占位过程也可查询其调用者）
     */
    public Set<String> getCallers(String name) {
        lock.readLock().lock();
        try {
            ProcedureNode node = procedures.resolve(name);
            if (node == null) {
                return Collections.emptySet();
            }
            return new LinkedHashSet<>(sources(node.getKey(), EdgeType.CALLS));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 扫描全部过程的字段使用记录，按过程注册顺序返回
     */
    public List<FieldUsageEntry> queryFieldUsage(String fieldName) {
        String field = fieldKey(fieldName);
        lock.readLock().lock();
        try {
            List<FieldUsageEntry> result = new ArrayList<>();
            if (field == null) {
                return result;
            }
            for (ProcedureNode node : registeredProcedures()) {
                FieldUsage usage = node.getFieldUsages().get(field);
                if (usage != null) {
                    result.add(new FieldUsageEntry(node.getFullName(), usage.copy()));
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 只查询一个过程对字段的使用
     */
    public List<FieldUsageEntry> queryFieldUsage(String fieldName, String procedure) {
        String field = fieldKey(fieldName);
        lock.readLock().lock();
        try {
            ProcedureNode node = procedures.resolve(procedure);
            if (field == null || node == null || node.isPlaceholder()) {
                return new ArrayList<>();
            }
            FieldUsage usage = node.getFieldUsages().get(field);
            List<FieldUsageEntry> result = new ArrayList<>();
            if (usage != null) {
                result.add(new FieldUsageEntry(node.getFullName(), usage.copy()));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public FieldUsageSummary getFieldUsageSummary(String fieldName) {
        FieldUsageSummary summary = new FieldUsageSummary();
        summary.setFieldName(fieldKey(fieldName));
        for (FieldUsageEntry entry : queryFieldUsage(fieldName)) {
            FieldUsage usage = entry.getUsage();
            summary.getProcedures().add(entry.getProcedure());
            if (usage.hasOperation(FieldOperation.WRITE)) {
                summary.getWrittenBy().add(entry.getProcedure());
            }
            if (usage.hasOperation(FieldOperation.READ) || usage.hasOperation(FieldOperation.TRANSFORM)) {
                summary.getReadBy().add(entry.getProcedure());
            }
            usage.getTransformations().stream()
                    .filter(t -> !summary.getTransformations().contains(t))
                    .forEach(summary.getTransformations()::add);
        }
        summary.getTables().addAll(getTablesWithColumn(fieldName));
        return summary;
    }

    /**
     * 含有该名称列的表，按注册顺序
     */
    public List<String> getTablesWithColumn(String fieldName) {
        String field = fieldKey(fieldName);
        lock.readLock().lock();
        try {
            if (field == null) {
                return new ArrayList<>();
            }
            return tables.values().stream()
                    .filter(t -> !t.isPlaceholder())
                    .sorted(Comparator.comparingLong(TableNode::getRegistrationOrder))
                    .filter(t -> t.getColumns().stream().anyMatch(c -> field.equalsIgnoreCase(c.getName())))
                    .map(TableNode::getFullName)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 已注册（非占位）过程全名，按注册顺序
     */
    public List<String> listProcedures() {
        lock.readLock().lock();
        try {
            return registeredProcedures().stream().map(ProcedureNode::getFullName).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 依赖层级 → 过程全名
     */
    public Map<Integer, List<String>> getProcedureHierarchy() {
        lock.readLock().lock();
        try {
            Map<Integer, List<String>> hierarchy = new TreeMap<>();
            for (ProcedureNode node : registeredProcedures()) {
                hierarchy.computeIfAbsent(node.getDependencyLevel(), k -> new ArrayList<>()).add(node.getFullName());
            }
            return hierarchy;
        } finally {
            lock.readLock().unlock();
        }
    }

    public GraphStatistics getStatistics() {
        lock.readLock().lock();
        try {
            GraphStatistics stats = new GraphStatistics();
            List<ProcedureNode> registered = registeredProcedures();
            stats.setProcedureCount(registered.size());
            stats.setTableCount((int) tables.values().stream().filter(t -> !t.isPlaceholder()).count());
            stats.setFieldCount((int) fields.values().stream().filter(f -> !f.isPlaceholder()).count());
            int placeholders = 0;
            for (GraphNode node : allNodes()) {
                if (node.isPlaceholder()) {
                    placeholders++;
                }
            }
            stats.setPlaceholderCount(placeholders);
            for (EdgeType type : EdgeType.values()) {
                stats.getEdgesByType().put(type.name(), 0);
            }
            int edgeCount = 0;
            for (Set<GraphEdge> edges : outgoing.values()) {
                for (GraphEdge edge : edges) {
                    stats.getEdgesByType().merge(edge.getType().name(), 1, Integer::sum);
                    edgeCount++;
                }
            }
            stats.setEdgeCount(edgeCount);
            stats.setMaxDependencyLevel(registered.stream().mapToInt(ProcedureNode::getDependencyLevel).max().orElse(0));
            stats.setAverageComplexity(registered.stream().mapToInt(ProcedureNode::getComplexityScore)
                    .average().orElse(0));
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int procedureCount() {
        lock.readLock().lock();
        try {
            return registeredProcedures().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------ 快照

    public GraphSnapshot toSnapshot() {
        lock.readLock().lock();
        try {
            GraphSnapshot snapshot = new GraphSnapshot();
            snapshot.setVersion(GraphSnapshot.CURRENT_VERSION);
            snapshot.setCreatedAt(System.currentTimeMillis());
            snapshot.setRegistrationSequence(registrationSequence);
            procedures.values().forEach(n -> snapshot.getProcedures().add(n.copy()));
            tables.values().forEach(n -> snapshot.getTables().add(n.copy()));
            fields.values().forEach(n -> snapshot.getFields().add(n.copy()));
            outgoing.values().forEach(edges -> edges.forEach(e ->
                    snapshot.getEdges().add(new GraphEdge(e.getSource(), e.getTarget(), e.getType()))));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 用快照替换整个图谱
     */
    public void restore(GraphSnapshot snapshot) {
        Validate.isTrue(snapshot != null, "snapshot must not be null");
        lock.writeLock().lock();
        try {
            procedures.clear();
            tables.clear();
            fields.clear();
            outgoing.clear();
            incoming.clear();
            snapshot.getProcedures().forEach(n -> procedures.put(n.copy()));
            snapshot.getTables().forEach(n -> tables.put(n.copy()));
            snapshot.getFields().forEach(n -> fields.put(n.copy()));
            snapshot.getEdges().forEach(e -> addEdge(e.getSource(), e.getTarget(), e.getType()));
            registrationSequence = snapshot.getRegistrationSequence();
            log.info("图谱已从快照恢复: 过程={}, 表={}, 字段={}, 边={}", procedures.size(), tables.size(),
                    fields.size(), snapshot.getEdges().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------ 内部

    private void rebuildProcedureEdges(ProcedureNode node) {
        removeOutgoing(node.getKey());
        for (String callee : node.getCalledProcedures()) {
            ProcedureNode target = ensureNode(procedures, callee, ProcedureNode::new);
            addEdge(node.getFullName(), target.getFullName(), EdgeType.CALLS);
        }
        for (String table : node.getCalledTables()) {
            TableNode target = ensureNode(tables, table, TableNode::new);
            addEdge(node.getFullName(), target.getFullName(), EdgeType.ACCESSES);
        }
        for (Map.Entry<String, FieldUsage> entry : node.getFieldUsages().entrySet()) {
            FieldNode target = ensureNode(fields, entry.getKey(), FieldNode::new);
            for (FieldOperation operation : entry.getValue().getOperations()) {
                addEdge(node.getFullName(), target.getFullName(), EdgeType.of(operation));
            }
        }
    }

    private void rebuildTableEdges(TableNode node) {
        linkTableReferences(node);
        for (ColumnInfo column : node.getColumns()) {
            if (StringUtils.isBlank(column.getName())) {
                continue;
            }
            FieldNode field = upsertNode(fields, node.getFullName(), SqlIdentifiers.normalize(column.getName()),
                    FieldNode::new);
            field.setPlaceholder(false);
            field.setTable(node.getFullName());
            if (StringUtils.isNotBlank(column.getDataType())) {
                field.setDataType(column.getDataType());
            }
            if (StringUtils.isNotBlank(column.getComment())) {
                field.setDescription(column.getComment());
            }
            removeOutgoing(field.getKey());
            addEdge(field.getFullName(), node.getFullName(), EdgeType.BELONGS_TO);
        }
    }

    private void linkTableReferences(TableNode node) {
        removeOutgoing(node.getKey());
        for (String ref : referencedTables(node)) {
            TableNode target = ensureNode(tables, ref, TableNode::new);
            addEdge(node.getFullName(), target.getFullName(), EdgeType.REFERENCES);
        }
    }

    private static Set<String> referencedTables(TableNode node) {
        Set<String> referenced = new LinkedHashSet<>();
        for (ForeignKeyInfo fk : node.getForeignKeys()) {
            if (StringUtils.isNotBlank(fk.getReferencedTable())) {
                referenced.add(fk.getReferencedTable());
            }
        }
        for (ColumnInfo column : node.getColumns()) {
            if (column.isForeignKey() && StringUtils.isNotBlank(column.getForeignKeyTable())) {
                referenced.add(column.getForeignKeyTable());
            }
        }
        referenced.addAll(node.getRelationships().keySet());
        return referenced;
    }

    /**
     * 某个最后一段名称下的已登记节点发生变化后，重新解析引用了该名称的过程与表的出边，
     * 再删除不再被任何边指向的占位节点。过程与表的出边因此只取决于已登记的事实。
     */
    private void relink(Set<String> bareNames) {
        for (ProcedureNode node : new ArrayList<>(procedures.values())) {
            if (node.isPlaceholder()) {
                continue;
            }
            List<String> refs = new ArrayList<>(node.getCalledProcedures());
            refs.addAll(node.getCalledTables());
            refs.addAll(node.getFieldUsages().keySet());
            if (refersTo(refs, bareNames)) {
                rebuildProcedureEdges(node);
            }
        }
        for (TableNode node : new ArrayList<>(tables.values())) {
            if (!node.isPlaceholder() && refersTo(referencedTables(node), bareNames)) {
                linkTableReferences(node);
            }
        }
        prunePlaceholders(procedures);
        prunePlaceholders(tables);
        prunePlaceholders(fields);
    }

    private static boolean refersTo(Collection<String> refs, Set<String> bareNames) {
        for (String ref : refs) {
            if (StringUtils.isNotBlank(ref) && bareNames.contains(SqlIdentifiers.bareName(SqlIdentifiers.normalize(ref)))) {
                return true;
            }
        }
        return false;
    }

    private <N extends GraphNode> void prunePlaceholders(NodeIndex<N> index) {
        List<N> orphans = index.values().stream()
                .filter(n -> n.isPlaceholder() && !incoming.containsKey(n.getKey()))
                .collect(Collectors.toList());
        for (N orphan : orphans) {
            log.debug("删除无引用的占位节点: {}", orphan.getFullName());
            index.remove(orphan.getFullName());
        }
    }

    /**
     * 取得或创建节点，新建的节点在合并事实之前仍是占位
     */
    private <N extends GraphNode> N upsertNode(NodeIndex<N> index, String schema, String name, Supplier<N> factory) {
        String fullName = SqlIdentifiers.fullName(schema, name);
        N node = index.get(fullName);
        if (node != null) {
            return node;
        }
        N created = factory.get();
        created.setIdentity(schema, name);
        created.setPlaceholder(true);
        index.put(created);
        return created;
    }

    /**
     * 解析边的目标：只匹配已登记节点；找不到或有歧义时使用与引用名完全相同的占位节点
     */
    private <N extends GraphNode> N ensureNode(NodeIndex<N> index, String identifier, Supplier<N> factory) {
        N node = index.resolveRegistered(identifier);
        if (node != null) {
            return node;
        }
        String normalized = SqlIdentifiers.normalize(identifier);
        N existing = index.get(normalized);
        if (existing != null) {
            return existing;
        }
        int dot = normalized.lastIndexOf('.');
        N placeholder = factory.get();
        placeholder.setIdentity(dot > 0 ? normalized.substring(0, dot) : null, SqlIdentifiers.bareName(normalized));
        placeholder.setPlaceholder(true);
        index.put(placeholder);
        return placeholder;
    }

    private void addEdge(String source, String target, EdgeType type) {
        GraphEdge edge = new GraphEdge(source, target, type);
        outgoing.computeIfAbsent(edge.sourceKey(), k -> new LinkedHashSet<>()).add(edge);
        incoming.computeIfAbsent(edge.targetKey(), k -> new LinkedHashSet<>()).add(edge);
    }

    private void removeOutgoing(String key) {
        Set<GraphEdge> edges = outgoing.remove(key);
        if (edges == null) {
            return;
        }
        for (GraphEdge edge : edges) {
            Set<GraphEdge> in = incoming.get(edge.targetKey());
            if (in != null) {
                in.remove(edge);
                if (in.isEmpty()) {
                    incoming.remove(edge.targetKey());
                }
            }
        }
    }

    private List<String> targets(String key, EdgeType type) {
        return edgeEnds(outgoing.get(key), type, GraphEdge::getTarget);
    }

    private List<String> sources(String key, EdgeType type) {
        return edgeEnds(incoming.get(key), type, GraphEdge::getSource);
    }

    private static List<String> edgeEnds(Set<GraphEdge> edges, EdgeType type, Function<GraphEdge, String> end) {
        if (edges == null) {
            return new ArrayList<>();
        }
        return edges.stream().filter(e -> e.getType() == type).map(end).distinct().collect(Collectors.toList());
    }

    private int levelOf(ProcedureNode node, Map<String, Integer> levels, Set<String> onPath) {
        Integer known = levels.get(node.getFullName());
        if (known != null) {
            return known;
        }
        if (!onPath.add(node.getFullName())) {
            return -1;
        }
        int deepest = -1;
        for (String callee : targets(node.getKey(), EdgeType.CALLS)) {
            ProcedureNode target = procedures.get(callee);
            if (target == null || target.isPlaceholder() || target == node) {
                continue;
            }
            int level = levelOf(target, levels, onPath);
            if (level >= 0) {
                deepest = Math.max(deepest, level);
            }
        }
        onPath.remove(node.getFullName());
        int level = deepest < 0 ? 0 : deepest + 1;
        levels.put(node.getFullName(), level);
        return level;
    }

    private List<ProcedureNode> registeredProcedures() {
        return procedures.values().stream()
                .filter(n -> !n.isPlaceholder())
                .sorted(Comparator.comparingLong(ProcedureNode::getRegistrationOrder))
                .collect(Collectors.toList());
    }

    private List<GraphNode> allNodes() {
        List<GraphNode> all = new ArrayList<>(procedures.values());
        all.addAll(tables.values());
        all.addAll(fields.values());
        return all;
    }

    private static String fieldKey(String fieldName) {
        if (StringUtils.isBlank(fieldName)) {
            return null;
        }
        return SqlIdentifiers.bareName(SqlIdentifiers.normalize(fieldName)).toUpperCase(Locale.ROOT);
    }

    /**
     * 拆分 [schema, name]；schema 为空而 name 带点号时按最后一个点拆分
     */
    private static String[] splitIdentity(String schema, String name) {
        String n = SqlIdentifiers.normalize(name);
        String s = StringUtils.isBlank(schema) ? null : SqlIdentifiers.normalize(schema);
        if (s == null) {
            int dot = n.lastIndexOf('.');
            if (dot > 0) {
                return new String[]{n.substring(0, dot), n.substring(dot + 1)};
            }
        }
        return new String[]{s, n};
    }
}
