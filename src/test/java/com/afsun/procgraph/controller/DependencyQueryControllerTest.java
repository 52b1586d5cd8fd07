package com.afsun.procgraph.controller;

import com.afsun.procgraph.config.ProcGraphProperties;
import com.afsun.procgraph.controller.handler.GlobalExceptionHandler;
import com.afsun.procgraph.core.DefaultSourceAnalyzer;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.meta.FileProcedureSourceLoader;
import com.afsun.procgraph.crawler.DependencyCrawler;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.snapshot.GraphSnapshotStore;
import com.afsun.procgraph.service.impl.ProcedureGraphServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.Arrays;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DependencyQueryControllerTest {

    @TempDir
    Path tempDir;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ProcGraphProperties properties = new ProcGraphProperties();
        properties.setSnapshotPath(tempDir.resolve("graph.json").toString());
        KnowledgeGraph graph = new KnowledgeGraph();
        ProcedureGraphServiceImpl service = new ProcedureGraphServiceImpl(new DefaultSourceAnalyzer(), graph,
                new DependencyCrawler(graph), new FileProcedureSourceLoader(), new GraphSnapshotStore(), properties);

        service.registerProcedure(ProcedureFacts.builder().name("PROC1").complexityScore(2).build());
        service.registerProcedure(ProcedureFacts.builder().name("PROC2").complexityScore(3)
                .calledProcedures(Arrays.asList("PROC1"))
                .calledTables(Arrays.asList("TABLE1"))
                .build());

        DependencyQueryController controller = new DependencyQueryController();
        ReflectionTestUtils.setField(controller, "procedureGraphService", service);
        ReflectionTestUtils.setField(controller, "properties", properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testProcedureContext() throws Exception {
        mockMvc.perform(get("/procgraph/query/procedure").param("name", "proc2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("200"))
                .andExpect(jsonPath("$.data.fullName").value("PROC2"))
                .andExpect(jsonPath("$.data.calledProcedures[0]").value("PROC1"))
                .andExpect(jsonPath("$.data.dependencyLevel").value(1));
    }

    @Test
    void testUnknownProcedureIsNotFound() throws Exception {
        mockMvc.perform(get("/procgraph/query/procedure").param("name", "MISSING"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("404"));
    }

    @Test
    void testPlaceholderTableIsNotFound() throws Exception {
        mockMvc.perform(get("/procgraph/query/table").param("name", "TABLE1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testCallers() throws Exception {
        mockMvc.perform(get("/procgraph/query/callers").param("name", "PROC1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0]").value("PROC2"));
    }

    @Test
    void testMissingParameter() throws Exception {
        mockMvc.perform(get("/procgraph/query/callers"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("400"));
    }

    @Test
    void testCrawl() throws Exception {
        mockMvc.perform(get("/procgraph/query/crawl").param("name", "PROC2").param("depth", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.proceduresFound[0]").value("PROC2"))
                .andExpect(jsonPath("$.data.proceduresFound[1]").value("PROC1"))
                .andExpect(jsonPath("$.data.tablesFound[0]").value("TABLE1"))
                .andExpect(jsonPath("$.data.depthReached").value(1));
    }

    @Test
    void testCrawlDepthOutOfRange() throws Exception {
        mockMvc.perform(get("/procgraph/query/crawl").param("name", "PROC2").param("depth", "99"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("400"));
        mockMvc.perform(get("/procgraph/query/impact").param("name", "PROC2").param("depth", "-1"))
                .andExpect(jsonPath("$.status").value("400"));
    }

    @Test
    void testImpact() throws Exception {
        mockMvc.perform(get("/procgraph/query/impact").param("name", "PROC1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.callerCount").value(1))
                .andExpect(jsonPath("$.data.totalImpactScore").value(4.0));
        mockMvc.perform(get("/procgraph/query/impact").param("name", "MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testNegativeMaxResultsIsBadRequest() throws Exception {
        mockMvc.perform(get("/procgraph/query/field/sources").param("field", "BALANCE").param("maxResults", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("400"));
    }

    @Test
    void testTraceFromUnknownStart() throws Exception {
        mockMvc.perform(get("/procgraph/query/field/trace").param("field", "BALANCE").param("start", "MISSING"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/procgraph/query/field/trace").param("field", "BALANCE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fieldName").value("BALANCE"));
    }
}
