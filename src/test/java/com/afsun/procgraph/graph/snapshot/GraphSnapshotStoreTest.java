package com.afsun.procgraph.graph.snapshot;

import com.afsun.procgraph.core.FieldOperation;
import com.afsun.procgraph.core.FieldUsage;
import com.afsun.procgraph.core.ParameterDirection;
import com.afsun.procgraph.core.ParameterInfo;
import com.afsun.procgraph.core.dto.ColumnInfo;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.dto.TableFacts;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GraphSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private KnowledgeGraph graph;
    private GraphSnapshotStore store;

    @BeforeEach
    void setUp() {
        graph = new KnowledgeGraph();
        store = new GraphSnapshotStore();

        FieldUsage balance = new FieldUsage("BALANCE");
        balance.record(FieldOperation.WRITE, "SET", "APP.TRANSFER");
        balance.recordTransformation("NVL(BALANCE,0)", "SELECT", "APP.TRANSFER");
        Map<String, FieldUsage> usages = new LinkedHashMap<>();
        usages.put("BALANCE", balance);

        graph.addProcedure(ProcedureFacts.builder()
                .name("APP.TRANSFER")
                .sourceCode("BEGIN UPDATE accounts SET balance = 0; END;")
                .complexityScore(3)
                .parameters(Arrays.asList(ParameterInfo.of("P_AMOUNT", ParameterDirection.IN, "NUMBER")))
                .calledProcedures(Arrays.asList("LOG_ERROR"))
                .calledTables(Arrays.asList("ACCOUNTS"))
                .fieldUsages(usages)
                .build());
        graph.addProcedure(ProcedureFacts.builder()
                .name("BATCH_RUN")
                .calledProcedures(Arrays.asList("APP.TRANSFER"))
                .build());
        graph.addTable(TableFacts.builder()
                .name("ACCOUNTS")
                .columns(Arrays.asList(ColumnInfo.builder().name("ID").primaryKey(true).build(),
                        ColumnInfo.builder().name("BALANCE").dataType("NUMBER(18,2)").build()))
                .build());
        graph.recomputeDependencyLevels();
    }

    @Test
    void testSaveAndLoadRoundTrip() {
        Path path = tempDir.resolve("snapshot.json");
        store.save(graph, path);
        assertTrue(Files.isRegularFile(path));
        assertFalse(Files.exists(tempDir.resolve("snapshot.json.tmp")));

        KnowledgeGraph loaded = new KnowledgeGraph();
        assertTrue(store.loadInto(loaded, path));

        assertEquals(graph.getProcedureContext("APP.TRANSFER"), loaded.getProcedureContext("APP.TRANSFER"));
        assertEquals(graph.getTableInfo("ACCOUNTS"), loaded.getTableInfo("ACCOUNTS"));
        assertEquals(Collections.singleton("BATCH_RUN"), loaded.getCallers("TRANSFER"));
        assertEquals(graph.queryFieldUsage("BALANCE"), loaded.queryFieldUsage("BALANCE"));
        assertEquals(graph.getStatistics(), loaded.getStatistics());
    }

    @Test
    void testSaveCreatesParentDirectories() {
        Path path = tempDir.resolve("nested/dir/snapshot.json");
        store.save(graph, path);

        Optional<GraphSnapshot> snapshot = store.load(path);
        assertTrue(snapshot.isPresent());
        assertEquals(GraphSnapshot.CURRENT_VERSION, snapshot.get().getVersion());
    }

    @Test
    void testVersionMismatchIsCacheMiss() throws IOException {
        Path path = tempDir.resolve("old.json");
        GraphSnapshot old = graph.toSnapshot();
        old.setVersion("0.9.0");
        new ObjectMapper().writeValue(path.toFile(), old);

        assertFalse(store.load(path).isPresent());

        KnowledgeGraph target = new KnowledgeGraph();
        target.addProcedure(ProcedureFacts.builder().name("KEEP_ME").build());
        assertFalse(store.loadInto(target, path));
        assertEquals(Arrays.asList("KEEP_ME"), target.listProcedures());
    }

    @Test
    void testUnreadableFileIsCacheMiss() throws IOException {
        Path path = tempDir.resolve("broken.json");
        Files.write(path, "{ not json".getBytes(StandardCharsets.UTF_8));

        assertFalse(store.load(path).isPresent());
    }

    @Test
    void testMissingFileIsCacheMiss() {
        assertFalse(store.load(tempDir.resolve("absent.json")).isPresent());
        assertFalse(store.load(null).isPresent());
    }
}
