package com.afsun.procgraph.core;

import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSourceAnalyzerTest {

    private SourceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DefaultSourceAnalyzer();
    }

    @Test
    void testBuiltinFunctionsAreNotProcedureCalls() {
        AnalysisResult result = analyzer.analyze("SELECT COUNT(*), TO_DATE(x,'fmt') FROM T", "Q1");

        assertFalse(result.getProcedures().contains("COUNT"));
        assertFalse(result.getProcedures().contains("TO_DATE"));
        assertTrue(result.getProcedures().isEmpty());
        assertTrue(result.getTables().contains("T"));
    }

    @Test
    void testOracleParameterDirections() {
        String source = "CREATE OR REPLACE PROCEDURE P_DIRS(p_in IN NUMBER, p_out OUT VARCHAR2, "
                + "p_both IN OUT NUMBER) IS\nBEGIN\n  NULL;\nEND;";
        AnalysisResult result = analyzer.analyze(source, "P_DIRS");

        List<ParameterInfo> params = result.getParameters();
        assertEquals(3, params.size());
        assertEquals("P_IN", params.get(0).getName());
        assertEquals(ParameterDirection.IN, params.get(0).getDirection());
        assertEquals(ParameterDirection.OUT, params.get(1).getDirection());
        assertEquals(ParameterDirection.IN_OUT, params.get(2).getDirection());
        assertEquals("VARCHAR2", params.get(1).getDataType());
    }

    @Test
    void testParameterWithoutDirectionDefaultsToIn() {
        AnalysisResult result = analyzer.analyze(
                "CREATE PROCEDURE P_DEF(p_id NUMBER DEFAULT 0) IS\nBEGIN\n  NULL;\nEND;", "P_DEF");

        assertEquals(1, result.getParameters().size());
        assertEquals(ParameterDirection.IN, result.getParameters().get(0).getDirection());
        assertEquals("NUMBER", result.getParameters().get(0).getDataType());
    }

    @Test
    void testComplexFixture() throws Exception {
        AnalysisResult result = analyzer.analyze(fixture("COMPLEX_PROC.prc"), "COMPLEX_PROC");

        assertEquals(DbType.oracle, result.getDialect());
        assertEquals("COMPLEX_PROC", result.getDeclaredName());
        assertEquals(Arrays.asList("LOG_ERROR", "VALIDATE_ACCOUNT", "NOTIFY_PKG.SEND_ALERT"),
                Arrays.asList(result.getProcedures().toArray()));
        assertEquals(Arrays.asList("ORDERS", "ACCOUNTS", "AUDIT_LOG"), Arrays.asList(result.getTables().toArray()));
        assertFalse(result.getProcedures().contains("TRUNC"));
        assertFalse(result.getProcedures().contains("SYSDATE"));

        List<ParameterDirection> directions = result.getParameters().stream()
                .map(ParameterInfo::getDirection).collect(Collectors.toList());
        assertEquals(Arrays.asList(ParameterDirection.IN, ParameterDirection.IN, ParameterDirection.OUT,
                ParameterDirection.IN_OUT), directions);
        assertTrue(result.getVariables().containsAll(Arrays.asList("V_BALANCE", "V_COUNT", "C_ORDERS")));

        ControlStructureTally tally = result.getControlStructures();
        assertEquals(3, tally.getConditionals());
        assertEquals(2, tally.getBranches());
        assertEquals(1, tally.getLoops());
        assertEquals(1, tally.getCursors());
        assertEquals(1, tally.getExceptionHandlers());
        assertEquals(1, tally.getNestedBlocks());
        assertEquals(3, tally.getMaxNestingDepth());
    }

    @Test
    void testComplexFixtureScoresHigherThanSimple() throws Exception {
        AnalysisResult simple = analyzer.analyze(fixture("SIMPLE_PROC.prc"), "SIMPLE_PROC");
        AnalysisResult complex = analyzer.analyze(fixture("COMPLEX_PROC.prc"), "COMPLEX_PROC");

        assertEquals(1, simple.getComplexityScore());
        assertTrue(complex.getComplexityScore() > simple.getComplexityScore());
        assertTrue(complex.getComplexityScore() <= ComplexityCalculator.MAX_SCORE);
    }

    @Test
    void testFieldUsages() throws Exception {
        AnalysisResult result = analyzer.analyze(fixture("COMPLEX_PROC.prc"), "COMPLEX_PROC");

        FieldUsage balance = result.getFields().get("BALANCE");
        assertNotNull(balance);
        assertTrue(balance.hasOperation(FieldOperation.READ));
        assertTrue(balance.hasOperation(FieldOperation.WRITE));
        assertTrue(balance.getWrittenBy().contains("COMPLEX_PROC"));

        FieldUsage createdAt = result.getFields().get("CREATED_AT");
        assertNotNull(createdAt);
        assertEquals(Arrays.asList(FieldOperation.WRITE), createdAt.getOperations());
        assertEquals(Arrays.asList(FieldUsageExtractor.CTX_INSERT), createdAt.getContexts());

        assertTrue(result.getFields().get("LAST_UPDATE").hasOperation(FieldOperation.WRITE));
        assertTrue(result.getFields().get("ACCOUNT_ID").hasOperation(FieldOperation.READ));

        // 参数、变量、表名与内置函数都不是字段
        assertFalse(result.getFields().containsKey("P_ACCOUNT_ID"));
        assertFalse(result.getFields().containsKey("V_BALANCE"));
        assertFalse(result.getFields().containsKey("ACCOUNTS"));
        assertFalse(result.getFields().containsKey("SYSDATE"));
    }

    @Test
    void testPostgresFunctionWithTransformation() {
        String source = "CREATE OR REPLACE FUNCTION billing.refresh_totals(IN p_customer INT, INOUT p_total NUMERIC, "
                + "OUT p_count INT)\nRETURNS record AS $$\nBEGIN\n"
                + "    PERFORM billing.lock_customer(p_customer);\n"
                + "    SELECT SUM(amount), COUNT(*) INTO p_total, p_count FROM billing.invoices "
                + "WHERE customer_id = p_customer;\n"
                + "END;\n$$ LANGUAGE plpgsql;";
        AnalysisResult result = analyzer.analyze(source, "BILLING.REFRESH_TOTALS");

        assertEquals(DbType.postgresql, result.getDialect());
        assertEquals("BILLING", result.getDeclaredSchema());
        assertEquals("REFRESH_TOTALS", result.getDeclaredName());
        assertEquals(Arrays.asList("BILLING.LOCK_CUSTOMER"), Arrays.asList(result.getProcedures().toArray()));
        assertTrue(result.getTables().contains("BILLING.INVOICES"));

        List<ParameterDirection> directions = result.getParameters().stream()
                .map(ParameterInfo::getDirection).collect(Collectors.toList());
        assertEquals(Arrays.asList(ParameterDirection.IN, ParameterDirection.IN_OUT, ParameterDirection.OUT),
                directions);

        FieldUsage amount = result.getFields().get("AMOUNT");
        assertNotNull(amount);
        assertEquals(Arrays.asList(FieldOperation.READ, FieldOperation.TRANSFORM), amount.getOperations());
        assertTrue(amount.getTransformations().contains("SUM(AMOUNT)"));
        assertTrue(result.getFields().get("CUSTOMER_ID").getContexts().contains(FieldUsageExtractor.CTX_WHERE));
        assertFalse(result.getFields().containsKey("P_TOTAL"));
    }

    @Test
    void testTsqlProcedure() {
        String source = "CREATE PROCEDURE dbo.usp_transfer\n"
                + "    @from_id INT,\n"
                + "    @to_id INT,\n"
                + "    @amount DECIMAL(18,2),\n"
                + "    @status NVARCHAR(20) OUTPUT\n"
                + "AS\n"
                + "BEGIN\n"
                + "    SET NOCOUNT ON;\n"
                + "    DECLARE @balance DECIMAL(18,2);\n"
                + "    SELECT @balance = balance FROM dbo.accounts WHERE id = @from_id;\n"
                + "    IF @balance < @amount\n"
                + "    BEGIN\n"
                + "        SET @status = 'FAILED';\n"
                + "        RETURN;\n"
                + "    END\n"
                + "    BEGIN TRY\n"
                + "        UPDATE dbo.accounts SET balance = balance - @amount WHERE id = @from_id;\n"
                + "        EXEC dbo.usp_log_transfer @from_id, @to_id, @amount;\n"
                + "    END TRY\n"
                + "    BEGIN CATCH\n"
                + "        EXEC @rc = dbo.usp_log_error @from_id;\n"
                + "    END CATCH\n"
                + "END";
        AnalysisResult result = analyzer.analyze(source, "DBO.USP_TRANSFER");

        assertEquals(DbType.sqlserver, result.getDialect());
        assertEquals("DBO", result.getDeclaredSchema());
        assertEquals(Arrays.asList("DBO.USP_LOG_TRANSFER", "DBO.USP_LOG_ERROR"),
                Arrays.asList(result.getProcedures().toArray()));
        assertEquals(Arrays.asList("DBO.ACCOUNTS"), Arrays.asList(result.getTables().toArray()));

        assertEquals(4, result.getParameters().size());
        assertEquals("@FROM_ID", result.getParameters().get(0).getName());
        assertEquals("DECIMAL(18,2)", result.getParameters().get(2).getDataType());
        assertEquals(ParameterDirection.OUT, result.getParameters().get(3).getDirection());
        assertTrue(result.getVariables().contains("@BALANCE"));

        FieldUsage balance = result.getFields().get("BALANCE");
        assertTrue(balance.hasOperation(FieldOperation.READ));
        assertTrue(balance.hasOperation(FieldOperation.WRITE));
        assertTrue(result.getFields().keySet().stream().noneMatch(f -> f.startsWith("@")));
        assertEquals(1, result.getControlStructures().getExceptionHandlers());
    }

    @Test
    void testExecuteImmediateAndSystemPackagesIgnored() {
        String source = "CREATE PROCEDURE P_DYN IS\nBEGIN\n"
                + "  EXECUTE IMMEDIATE 'TRUNCATE TABLE stage_data';\n"
                + "  DBMS_OUTPUT.PUT_LINE('done');\n"
                + "  reporting.refresh_summary(SYSDATE);\n"
                + "END;";
        AnalysisResult result = analyzer.analyze(source, "P_DYN");

        assertEquals(Arrays.asList("REPORTING.REFRESH_SUMMARY"), Arrays.asList(result.getProcedures().toArray()));
        assertTrue(result.getTables().isEmpty());
    }

    @Test
    void testSelectIntoVariablesAndForUpdateAreNotTables() {
        String source = "CREATE PROCEDURE P_LOCK(p_id IN NUMBER) IS\n  v_qty NUMBER;\nBEGIN\n"
                + "  SELECT qty INTO v_qty FROM stock WHERE item_id = p_id FOR UPDATE;\n"
                + "  SELECT EXTRACT(YEAR FROM SYSDATE) INTO v_qty FROM dual;\n"
                + "END;";
        AnalysisResult result = analyzer.analyze(source, "P_LOCK");

        assertEquals(Arrays.asList("STOCK"), Arrays.asList(result.getTables().toArray()));
        assertTrue(result.getVariables().contains("V_QTY"));
    }

    @Test
    void testSetTargetsAreWrittenInSetContext() {
        String source = "CREATE PROCEDURE P_ACTIVATE(p_id IN NUMBER) IS\nBEGIN\n"
                + "  UPDATE accounts SET status = 'A', balance = balance + 1 WHERE account_id = p_id;\n"
                + "END;";
        AnalysisResult result = analyzer.analyze(source, "P_ACTIVATE");

        FieldUsage status = result.getFields().get("STATUS");
        assertEquals(Arrays.asList(FieldOperation.WRITE), status.getOperations());
        assertEquals(Arrays.asList(FieldUsageExtractor.CTX_SET), status.getContexts());

        FieldUsage balance = result.getFields().get("BALANCE");
        assertEquals(Arrays.asList(FieldOperation.WRITE, FieldOperation.READ), balance.getOperations());
        assertEquals(Arrays.asList(FieldUsageExtractor.CTX_SET), balance.getContexts());
        assertEquals(Arrays.asList(FieldUsageExtractor.CTX_WHERE),
                result.getFields().get("ACCOUNT_ID").getContexts());
    }

    @Test
    void testNonAsciiIdentifiers() {
        AnalysisResult result = analyzer.analyze("SELECT élève, note FROM tâble WHERE année = 2024", "Q_NOTES");

        assertEquals(Arrays.asList("TÂBLE"), Arrays.asList(result.getTables().toArray()));
        assertTrue(result.getFields().containsKey("ÉLÈVE"));
        assertTrue(result.getFields().containsKey("NOTE"));
        assertTrue(result.getFields().containsKey("ANNÉE"));
        assertFalse(result.getFields().containsKey("L"));
        assertFalse(result.getFields().containsKey("VE"));
        assertFalse(result.getFields().containsKey("TÂBLE"));
    }

    @Test
    void testEmptySource() {
        AnalysisResult result = analyzer.analyze("   \n  ", "EMPTY");

        assertTrue(result.isEmpty());
        assertEquals("EMPTY", result.getProcedureName());
        assertEquals(0, result.getComplexityScore());
    }

    @Test
    void testMalformedSourceDoesNotThrow() {
        AnalysisResult result = analyzer.analyze("CREATE PROCEDURE broken( BEGIN SELECT a FROM (", "BROKEN");

        assertNotNull(result);
        assertTrue(result.getComplexityScore() >= ComplexityCalculator.MIN_SCORE);
    }

    private String fixture(String name) throws Exception {
        return new String(Files.readAllBytes(Paths.get(getClass().getResource("/procedures/" + name).toURI())),
                StandardCharsets.UTF_8);
    }
}
