package com.afsun.procgraph.service.impl;

import com.afsun.procgraph.config.ProcGraphProperties;
import com.afsun.procgraph.core.AnalysisResult;
import com.afsun.procgraph.core.DefaultSourceAnalyzer;
import com.afsun.procgraph.core.FieldOperation;
import com.afsun.procgraph.core.exceptions.SourceLoadException;
import com.afsun.procgraph.core.meta.FileProcedureSourceLoader;
import com.afsun.procgraph.crawler.DependencyCrawler;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.snapshot.GraphSnapshotStore;
import com.afsun.procgraph.vo.CrawlResult;
import com.afsun.procgraph.vo.FieldSource;
import com.afsun.procgraph.vo.FieldUsageEntry;
import com.afsun.procgraph.vo.IndexingReport;
import com.afsun.procgraph.vo.ProcedureContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProcedureGraphServiceImplTest {

    @TempDir
    Path tempDir;

    private Path fixtures;
    private ProcGraphProperties properties;
    private KnowledgeGraph graph;
    private ProcedureGraphServiceImpl service;

    @BeforeEach
    void setUp() throws URISyntaxException {
        fixtures = Paths.get(getClass().getResource("/procedures").toURI());
        properties = new ProcGraphProperties();
        properties.setSnapshotPath(tempDir.resolve("graph.json").toString());
        graph = new KnowledgeGraph();
        service = newService(graph);
    }

    @Test
    void testIndexDirectory() {
        IndexingReport report = service.indexDirectory(fixtures);

        assertEquals(4, report.getFilesFound());
        assertEquals(4, report.getProceduresIndexed());
        assertTrue(report.getFailedFiles().isEmpty());
        assertTrue(report.isSnapshotSaved());
        assertTrue(Files.isRegularFile(tempDir.resolve("graph.json")));

        assertEquals(Arrays.asList("APP.VALIDATE_ACCOUNT", "COMPLEX_PROC", "LOG_ERROR", "SIMPLE_PROC"),
                service.listProcedures());
        // LOG_ERROR 先作为被调用者占位，随后由自身源码补全
        assertTrue(service.getProcedureContext("LOG_ERROR").isPresent());
        assertEquals(Collections.singleton("COMPLEX_PROC"), service.getCallers("LOG_ERROR"));
        assertEquals(Collections.singleton("COMPLEX_PROC"), service.getCallers("validate_account"));

        ProcedureContext complex = service.getProcedureContext("complex_proc").orElseThrow(AssertionError::new);
        assertEquals(1, complex.getDependencyLevel());
        assertEquals(Arrays.asList("LOG_ERROR", "APP.VALIDATE_ACCOUNT", "NOTIFY_PKG.SEND_ALERT"),
                complex.getCalledProcedures());
        assertEquals(4, complex.getParameters().size());
        assertTrue(complex.getComplexityScore() > service.getProcedureContext("SIMPLE_PROC")
                .orElseThrow(AssertionError::new).getComplexityScore());

        assertEquals(Arrays.asList(0, 1), Arrays.asList(service.getProcedureHierarchy().keySet().toArray()));
        assertEquals(1, service.getStatistics().getMaxDependencyLevel());
    }

    @Test
    void testCrawlIndexedProcedures() {
        service.indexDirectory(fixtures);

        CrawlResult result = service.crawlProcedure("COMPLEX_PROC", 3, true);

        assertEquals(Arrays.asList("COMPLEX_PROC", "LOG_ERROR", "APP.VALIDATE_ACCOUNT"), result.getProceduresFound());
        assertEquals(Collections.singletonList("NOTIFY_PKG.SEND_ALERT"), result.getUnresolvedProcedures());
        assertTrue(result.getTablesFound().containsAll(Arrays.asList("ACCOUNTS", "AUDIT_LOG", "ERROR_LOG", "ORDERS")));
        assertEquals(1, result.getDepthReached());
    }

    @Test
    void testFieldQueriesOnIndexedProcedures() {
        service.indexDirectory(fixtures);

        List<FieldUsageEntry> balance = service.queryFieldUsage("balance", null);
        assertEquals(1, balance.size());
        assertEquals("COMPLEX_PROC", balance.get(0).getProcedure());
        assertTrue(balance.get(0).getUsage().hasOperation(FieldOperation.WRITE));
        assertTrue(balance.get(0).getUsage().getWrittenBy().contains("COMPLEX_PROC"));

        List<FieldSource> statusSources = service.findFieldSources("STATUS", 10);
        assertEquals(Collections.singletonList("SIMPLE_PROC"), statusSources.stream()
                .map(FieldSource::getName).collect(Collectors.toList()));
        assertTrue(service.getFieldUsageSummary("status").getReadBy().contains("APP.VALIDATE_ACCOUNT"));
        assertEquals(1, service.queryFieldUsage("STATUS", "validate_account").size());
    }

    @Test
    void testSnapshotSurvivesRestart() {
        service.indexDirectory(fixtures);
        ProcedureContext before = service.getProcedureContext("COMPLEX_PROC").orElseThrow(AssertionError::new);

        KnowledgeGraph freshGraph = new KnowledgeGraph();
        ProcedureGraphServiceImpl restarted = newService(freshGraph);
        restarted.run(new DefaultApplicationArguments());

        assertEquals(4, freshGraph.procedureCount());
        assertEquals(before, restarted.getProcedureContext("COMPLEX_PROC").orElseThrow(AssertionError::new));
        assertEquals(service.getCallers("LOG_ERROR"), restarted.getCallers("LOG_ERROR"));
    }

    @Test
    void testAutoLoadDisabled() {
        service.indexDirectory(fixtures);
        properties.setAutoLoad(false);

        KnowledgeGraph freshGraph = new KnowledgeGraph();
        newService(freshGraph).run(new DefaultApplicationArguments());

        assertEquals(0, freshGraph.procedureCount());
    }

    @Test
    void testIndexWithoutSnapshotPath() {
        properties.setSnapshotPath("");

        IndexingReport report = service.indexDirectory(fixtures);

        assertFalse(report.isSnapshotSaved());
        assertFalse(service.loadSnapshot());
    }

    @Test
    void testIndexMissingDirectory() {
        assertThrows(SourceLoadException.class, () -> service.indexDirectory(tempDir.resolve("absent")));
    }

    @Test
    void testAnalyzeAndRegisterUsesDeclaredName() {
        String source = "CREATE OR REPLACE PROCEDURE hr.raise_salary(p_emp_id IN NUMBER) IS\n"
                + "BEGIN\n"
                + "    UPDATE employees SET salary = salary * 1.1 WHERE emp_id = p_emp_id;\n"
                + "END;";

        ProcedureContext ctx = service.analyzeAndRegister(" ", source);

        assertEquals("HR.RAISE_SALARY", ctx.getFullName());
        assertEquals(Collections.singletonList("EMPLOYEES"), ctx.getCalledTables());
        assertTrue(ctx.getFieldsUsed().get("SALARY").getWrittenBy().contains("HR.RAISE_SALARY"));
        assertTrue(service.getProcedureContext("RAISE_SALARY").isPresent());
    }

    @Test
    void testAnalyzeAndRegisterRejectsBlankSource() {
        assertThrows(IllegalArgumentException.class, () -> service.analyzeAndRegister("P", "  "));
        assertThrows(IllegalArgumentException.class, () -> service.analyzeAndRegister(null, "SELECT 1 FROM dual"));
    }

    @Test
    void testResolveName() {
        AnalysisResult declared = new AnalysisResult();
        declared.setDeclaredSchema("APP");
        declared.setDeclaredName("VALIDATE_ACCOUNT");

        assertEquals("APP.VALIDATE_ACCOUNT", ProcedureGraphServiceImpl.resolveName("VALIDATE_ACCOUNT", declared));
        assertEquals("APP.VALIDATE_ACCOUNT", ProcedureGraphServiceImpl.resolveName(null, declared));
        assertEquals("OTHER_NAME", ProcedureGraphServiceImpl.resolveName("OTHER_NAME", declared));
        assertEquals("OPS.VALIDATE_ACCOUNT", ProcedureGraphServiceImpl.resolveName("OPS.VALIDATE_ACCOUNT", declared));
        assertThrows(IllegalArgumentException.class,
                () -> ProcedureGraphServiceImpl.resolveName(null, new AnalysisResult()));
    }

    private ProcedureGraphServiceImpl newService(KnowledgeGraph knowledgeGraph) {
        return new ProcedureGraphServiceImpl(new DefaultSourceAnalyzer(), knowledgeGraph,
                new DependencyCrawler(knowledgeGraph), new FileProcedureSourceLoader(),
                new GraphSnapshotStore(), properties);
    }
}
