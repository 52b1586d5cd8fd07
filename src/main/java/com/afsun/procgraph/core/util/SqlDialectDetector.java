package com.afsun.procgraph.core.util;

import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * 存储过程方言检测器
 * 根据过程体的文本特征识别数据库方言类型
 *
 * @author afsun
 */
@Slf4j
public class SqlDialectDetector {

    private SqlDialectDetector() {
    }

    /**
     * 检测方言类型
     * 支持：Oracle(PL/SQL)、PostgreSQL(PL/pgSQL)、SQLServer(T-SQL)、MySQL
     *
     * @param sql 存储过程源码
     * @return 检测到的方言类型，无法判断时为 Oracle
     */
    public static DbType detect(String sql) {
        if (sql == null || sql.isEmpty()) {
            return DbType.oracle;
        }

        String s = sql.toLowerCase(Locale.ROOT);

        if (containsPostgreSQLFeatures(s)) {
            log.debug("检测到PostgreSQL方言特征");
            return DbType.postgresql;
        }

        if (containsSQLServerFeatures(s)) {
            log.debug("检测到SQLServer方言特征");
            return DbType.sqlserver;
        }

        if (containsMySQLFeatures(s)) {
            log.debug("检测到MySQL方言特征");
            return DbType.mysql;
        }

        // PL/SQL 是最常见的存储过程方言
        log.debug("使用默认Oracle方言");
        return DbType.oracle;
    }

    /**
     * 当前方言下 # 是否为单行注释起始
     */
    public static boolean supportsHashComments(DbType dbType) {
        return dbType == DbType.mysql;
    }

    private static boolean containsPostgreSQLFeatures(String sql) {
        return sql.contains("language plpgsql") ||
               sql.contains("$$") ||
               sql.contains("perform ") ||
               sql.contains("raise notice") ||
               sql.contains("::");
    }

    private static boolean containsSQLServerFeatures(String sql) {
        return sql.contains("begin try") ||
               sql.contains("nvarchar") ||
               sql.contains("[dbo]") ||
               sql.contains("dbo.") ||
               sql.contains("set nocount") ||
               sql.matches("(?s).*\\bdeclare\\s+@.*") ||
               sql.matches("(?s).*\\bexec(ute)?\\s+(@\\w+\\s*=\\s*)?[\\w.\\[\\]]+\\s+@.*");
    }

    private static boolean containsMySQLFeatures(String sql) {
        return sql.contains("delimiter") ||
               sql.contains("declare continue handler") ||
               sql.contains("declare exit handler") ||
               sql.contains("elseif") ||
               sql.contains("`");
    }
}
