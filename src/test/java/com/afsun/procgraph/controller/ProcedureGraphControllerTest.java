package com.afsun.procgraph.controller;

import com.afsun.procgraph.config.ProcGraphProperties;
import com.afsun.procgraph.controller.handler.GlobalExceptionHandler;
import com.afsun.procgraph.core.DefaultSourceAnalyzer;
import com.afsun.procgraph.core.meta.FileProcedureSourceLoader;
import com.afsun.procgraph.crawler.DependencyCrawler;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.snapshot.GraphSnapshotStore;
import com.afsun.procgraph.service.impl.ProcedureGraphServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProcedureGraphControllerTest {

    private static final String SIMPLE_PROC = "CREATE OR REPLACE PROCEDURE SIMPLE_PROC(p_id IN NUMBER) IS\\n"
            + "BEGIN\\n    UPDATE accounts SET status = 'ACTIVE' WHERE id = p_id;\\nEND;";

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

        ProcedureGraphController controller = new ProcedureGraphController();
        ReflectionTestUtils.setField(controller, "procedureGraphService", service);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testAnalyzeDoesNotRegister() throws Exception {
        mockMvc.perform(post("/procgraph/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"procedureName\":\"SIMPLE_PROC\",\"sourceText\":\"" + SIMPLE_PROC + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tables[0]").value("ACCOUNTS"))
                .andExpect(jsonPath("$.data.parameters[0].direction").value("IN"));

        mockMvc.perform(get("/procgraph/procedures"))
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void testRegisterFromSource() throws Exception {
        mockMvc.perform(post("/procgraph/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"procedureName\":\"simple_proc\",\"sourceText\":\"" + SIMPLE_PROC + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("200"))
                .andExpect(jsonPath("$.data.fullName").value("SIMPLE_PROC"))
                .andExpect(jsonPath("$.data.calledTables[0]").value("ACCOUNTS"));

        mockMvc.perform(get("/procgraph/procedures"))
                .andExpect(jsonPath("$.data[0]").value("SIMPLE_PROC"));
        mockMvc.perform(get("/procgraph/statistics"))
                .andExpect(jsonPath("$.data.procedureCount").value(1));
    }

    @Test
    void testRegisterBlankSource() throws Exception {
        mockMvc.perform(post("/procgraph/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"procedureName\":\"P\",\"sourceText\":\" \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("400"));
    }

    @Test
    void testRegisterFacts() throws Exception {
        mockMvc.perform(post("/procgraph/procedures")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"app.transfer\",\"calledProcedures\":[\"LOG_ERROR\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("APP.TRANSFER"));

        mockMvc.perform(post("/procgraph/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"ACCOUNTS\",\"columns\":[{\"name\":\"ID\",\"primaryKey\":true}]}"))
                .andExpect(jsonPath("$.data").value("ACCOUNTS"));

        mockMvc.perform(post("/procgraph/procedures")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testIndexMissingDirectory() throws Exception {
        mockMvc.perform(post("/procgraph/index").param("directory", tempDir.resolve("absent").toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("400"));
    }

    @Test
    void testSnapshotSaveAndLoad() throws Exception {
        mockMvc.perform(post("/procgraph/snapshot/save"))
                .andExpect(jsonPath("$.data").value(true));
        mockMvc.perform(post("/procgraph/snapshot/load"))
                .andExpect(jsonPath("$.data").value(true));
    }
}
