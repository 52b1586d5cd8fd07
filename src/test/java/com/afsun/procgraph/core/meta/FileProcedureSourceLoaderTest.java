package com.afsun.procgraph.core.meta;

import com.afsun.procgraph.core.exceptions.SourceLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileProcedureSourceLoaderTest {

    @TempDir
    Path tempDir;

    private Path fixtures;

    @BeforeEach
    void setUp() throws URISyntaxException {
        fixtures = Paths.get(getClass().getResource("/procedures").toURI());
    }

    @Test
    void testLoadFixtureDirectory() {
        Map<String, String> procedures = new FileProcedureSourceLoader().loadProcedures(fixtures);

        // 空文件被忽略，README.txt 扩展名不匹配
        assertEquals(Arrays.asList("APP.VALIDATE_ACCOUNT", "COMPLEX_PROC", "LOG_ERROR", "SIMPLE_PROC"),
                new ArrayList<>(procedures.keySet()));
        assertTrue(procedures.get("SIMPLE_PROC").toUpperCase().contains("UPDATE ACCOUNTS"));
        assertFalse(procedures.containsKey("EMPTY_PROC"));
    }

    @Test
    void testCustomExtensionAndSubdirectories() throws IOException {
        Path sub = Files.createDirectories(tempDir.resolve("billing"));
        Files.write(sub.resolve("close_month.sql"), "BEGIN NULL; END;".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("ignored.prc"), "BEGIN NULL; END;".getBytes(StandardCharsets.UTF_8));

        Map<String, String> procedures = new FileProcedureSourceLoader(".SQL").loadProcedures(tempDir);

        assertEquals(1, procedures.size());
        assertEquals("BEGIN NULL; END;", procedures.get("CLOSE_MONTH"));
    }

    @Test
    void testMissingDirectory() {
        FileProcedureSourceLoader loader = new FileProcedureSourceLoader();
        assertThrows(SourceLoadException.class, () -> loader.loadProcedures(tempDir.resolve("absent")));
        assertThrows(SourceLoadException.class, () -> loader.loadProcedures(null));
    }

    @Test
    void testPathIsNotDirectory() throws IOException {
        Path file = Files.write(tempDir.resolve("single.prc"), "BEGIN NULL; END;".getBytes(StandardCharsets.UTF_8));

        assertThrows(SourceLoadException.class, () -> new FileProcedureSourceLoader().loadProcedures(file));
    }

    @Test
    void testDirectoryWithoutMatchingFiles() throws IOException {
        Files.write(tempDir.resolve("notes.txt"), "nothing".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("blank.prc"), "   \n".getBytes(StandardCharsets.UTF_8));

        SourceLoadException e = assertThrows(SourceLoadException.class,
                () -> new FileProcedureSourceLoader().loadProcedures(tempDir));
        assertEquals("SOURCE_LOAD_ERROR", e.getErrorCode());
    }

    @Test
    void testInvalidEncoding() throws IOException {
        Files.write(tempDir.resolve("latin.prc"), new byte[]{(byte) 0xC3, (byte) 0x28, 0x41});

        assertThrows(SourceLoadException.class, () -> new FileProcedureSourceLoader().loadProcedures(tempDir));
    }

    @Test
    void testProcedureName() {
        assertEquals("APP.VALIDATE_ACCOUNT", FileProcedureSourceLoader.procedureName(Paths.get("app.validate_account.prc")));
        assertEquals("LOG_ERROR", FileProcedureSourceLoader.procedureName(Paths.get("dir", "log_error.sql")));
        assertEquals("NO_EXTENSION", FileProcedureSourceLoader.procedureName(Paths.get("no_extension")));
    }

    @Test
    void testBlankExtensionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FileProcedureSourceLoader(" "));
    }
}
