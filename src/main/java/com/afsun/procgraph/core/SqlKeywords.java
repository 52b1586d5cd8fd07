package com.afsun.procgraph.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 词法分析使用的固定关键字表
 *
 * @author afsun
 */
public final class SqlKeywords {

    private SqlKeywords() {
    }

    /**
     * 内置函数：出现在 name( 形式时不视为存储过程调用
     */
    public static final Set<String> BUILTIN_FUNCTIONS = setOf(
            "TO_DATE", "TO_CHAR", "TO_NUMBER", "TO_TIMESTAMP", "NVL", "NVL2", "COALESCE", "NULLIF",
            "DECODE", "CASE", "CAST", "CONVERT", "COUNT", "SUM", "AVG", "MAX", "MIN",
            "SUBSTR", "SUBSTRING", "TRIM", "LTRIM", "RTRIM", "UPPER", "LOWER", "INITCAP",
            "LENGTH", "LEN", "CONCAT", "REPLACE", "INSTR", "POSITION", "LPAD", "RPAD",
            "ROUND", "TRUNC", "FLOOR", "CEIL", "CEILING", "ABS", "MOD", "POWER", "SQRT", "SIGN",
            "SYSDATE", "SYSTIMESTAMP", "CURRENT_DATE", "CURRENT_TIMESTAMP", "NOW", "GETDATE",
            "ADD_MONTHS", "MONTHS_BETWEEN", "NEXT_DAY", "LAST_DAY", "EXTRACT", "DATEPART",
            "DATEDIFF", "DATEADD", "DATE_TRUNC", "DATE_FORMAT", "ISNULL", "IFNULL", "IIF",
            "ROW_NUMBER", "RANK", "DENSE_RANK", "LAG", "LEAD", "FIRST_VALUE", "LAST_VALUE",
            "LISTAGG", "STRING_AGG", "GROUP_CONCAT", "REGEXP_LIKE", "REGEXP_REPLACE",
            "REGEXP_SUBSTR", "GREATEST", "LEAST", "CHR", "ASCII", "RAISE_APPLICATION_ERROR",
            "SQLERRM", "SQLCODE", "OBJECT_ID", "SCOPE_IDENTITY", "NEWID", "UUID", "EXISTS",
            "FORMAT", "STUFF", "CHARINDEX", "LEFT", "RIGHT", "OVER", "PARTITION", "TABLE"
    );

    /**
     * 语法关键字：不会是过程名、表名或字段名
     */
    public static final Set<String> RESERVED = setOf(
            "SELECT", "FROM", "WHERE", "INSERT", "INTO", "UPDATE", "DELETE", "MERGE", "SET",
            "VALUES", "AND", "OR", "NOT", "NULL", "IS", "IN", "LIKE", "BETWEEN", "AS", "ON",
            "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "USING", "GROUP",
            "ORDER", "BY", "HAVING", "UNION", "ALL", "DISTINCT", "INTERSECT", "MINUS", "EXCEPT",
            "CASE", "WHEN", "THEN", "ELSE", "ELSIF", "ELSEIF", "END", "IF", "LOOP", "WHILE",
            "FOR", "DO", "REPEAT", "UNTIL", "EXIT", "CONTINUE", "RETURN", "RETURNS", "BEGIN",
            "DECLARE", "EXCEPTION", "RAISE", "COMMIT", "ROLLBACK", "SAVEPOINT", "OPEN",
            "CLOSE", "FETCH", "CURSOR", "TYPE", "SUBTYPE", "RECORD", "ROWTYPE", "PRAGMA",
            "PROCEDURE", "FUNCTION", "PACKAGE", "BODY", "CREATE", "REPLACE", "ALTER", "DROP",
            "TRUE", "FALSE", "ASC", "DESC", "LIMIT", "OFFSET", "TOP", "ROWNUM", "ROWID",
            "LEVEL", "PRIOR", "CONNECT", "START", "WITH", "OF", "NOWAIT", "WAIT", "SKIP",
            "LOCKED", "RETURNING", "BULK", "COLLECT", "FORALL", "IMMEDIATE", "EXECUTE", "EXEC",
            "CALL", "PERFORM", "TRY", "CATCH", "GOTO", "PRINT", "OUTPUT", "OUT", "INOUT",
            "DEFAULT", "CONSTANT", "NOCOPY", "MATCHED", "DUAL", "LATERAL", "ANY", "SOME",
            "OTHERS", "NO_DATA_FOUND", "TOO_MANY_ROWS", "SQL", "FOUND", "NOTFOUND", "ROWCOUNT",
            "ISOPEN", "INTERVAL", "DAY", "MONTH", "YEAR", "HOUR", "MINUTE", "SECOND", "NEXTVAL",
            "CURRVAL", "DUPLICATE", "KEY", "IGNORE", "LEADING", "TRAILING", "BOTH", "ESCAPE",
            "HANDLER", "SIGNAL", "LEAVE", "ITERATE", "NOCOUNT", "TRAN", "TRANSACTION", "NEXT",
            "QUERY", "CONFLICT", "NOTICE", "WINDOW", "XACT_ABORT"
    );

    /**
     * 数据类型名：CAST(x AS NUMBER) 中的类型不是字段
     */
    public static final Set<String> DATA_TYPES = setOf(
            "NUMBER", "VARCHAR2", "NVARCHAR2", "VARCHAR", "NVARCHAR", "CHAR", "NCHAR", "INT", "INTEGER",
            "SMALLINT", "BIGINT", "TINYINT", "DECIMAL", "NUMERIC", "FLOAT", "DOUBLE", "REAL", "DATE",
            "DATETIME", "DATETIME2", "TIMESTAMP", "TIME", "BOOLEAN", "BIT", "TEXT", "CLOB", "BLOB",
            "MONEY", "PRECISION", "SIGNED", "UNSIGNED"
    );

    /**
     * 系统包：package.proc( 形式中包名属于此集合时不计为依赖
     */
    public static final Set<String> SYSTEM_PACKAGES = setOf(
            "DBMS_OUTPUT", "DBMS_LOB", "DBMS_SQL", "DBMS_LOCK", "DBMS_UTILITY", "DBMS_RANDOM",
            "DBMS_SCHEDULER", "DBMS_JOB", "DBMS_STATS", "DBMS_APPLICATION_INFO", "UTL_FILE",
            "UTL_HTTP", "UTL_RAW", "UTL_MAIL", "UTL_SMTP", "APEX_UTIL", "SYS", "PG_CATALOG"
    );

    /**
     * 动态SQL入口：EXEC 之后出现时不计为依赖
     */
    public static final Set<String> DYNAMIC_SQL = setOf("IMMEDIATE", "SP_EXECUTESQL");

    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isBuiltinFunction(String word) {
        return word != null && BUILTIN_FUNCTIONS.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * 既不是关键字也不是内置函数
     */
    public static boolean isPlainIdentifier(String word) {
        return !isReserved(word) && !isBuiltinFunction(word);
    }

    private static Set<String> setOf(String... values) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
    }
}
