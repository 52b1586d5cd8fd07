package com.afsun.procgraph.core.util;

import com.alibaba.druid.DbType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlDialectDetectorTest {

    @Test
    void testDetectPostgres() {
        assertEquals(DbType.postgresql, SqlDialectDetector.detect(
                "CREATE FUNCTION f() RETURNS void AS $$ BEGIN PERFORM g(); END; $$ LANGUAGE plpgsql;"));
    }

    @Test
    void testDetectSqlServer() {
        assertEquals(DbType.sqlserver, SqlDialectDetector.detect(
                "CREATE PROCEDURE dbo.p AS BEGIN SET NOCOUNT ON; DECLARE @x INT; END"));
    }

    @Test
    void testDetectMySql() {
        assertEquals(DbType.mysql, SqlDialectDetector.detect(
                "CREATE PROCEDURE p() BEGIN DECLARE CONTINUE HANDLER FOR NOT FOUND SET done = 1; END"));
        assertTrue(SqlDialectDetector.supportsHashComments(DbType.mysql));
    }

    @Test
    void testDefaultsToOracle() {
        assertEquals(DbType.oracle, SqlDialectDetector.detect("CREATE PROCEDURE p IS BEGIN NULL; END;"));
        assertEquals(DbType.oracle, SqlDialectDetector.detect(""));
        assertFalse(SqlDialectDetector.supportsHashComments(DbType.oracle));
    }
}
