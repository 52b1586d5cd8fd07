package com.afsun.procgraph.core;

import com.alibaba.druid.DbType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 控制结构统计
 * 按关键字顺序扫描过程体，维护一个块深度计数器
 *
 * @author afsun
 */
public class ControlStructureCounter {

    private static final Pattern TOKEN = Pattern.compile(
            "\\b(END\\s+IF|END\\s+LOOP|END\\s+CASE|END\\s+WHILE|END\\s+REPEAT|END\\s+TRY|END\\s+CATCH"
                    + "|BEGIN\\s+TRY|BEGIN\\s+CATCH|END|BEGIN|ELSIF|ELSEIF|ELSE|IF|CASE|LOOP|WHILE|REPEAT"
                    + "|EXCEPTION\\s+WHEN|CURSOR|HANDLER\\s+FOR)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ControlStructureTally count(String body, DbType dialect) {
        ControlStructureTally tally = new ControlStructureTally();
        if (body == null || body.isEmpty()) {
            return tally;
        }
        boolean tsql = dialect == DbType.sqlserver;
        boolean mysql = dialect == DbType.mysql;

        int depth = 0;
        int maxDepth = 0;
        int begins = 0;
        Matcher m = TOKEN.matcher(body);
        while (m.find()) {
            String token = WHITESPACE.matcher(m.group(1).toUpperCase(Locale.ROOT)).replaceAll(" ");
            switch (token) {
                case "BEGIN":
                case "BEGIN TRY":
                    begins++;
                    depth++;
                    break;
                case "BEGIN CATCH":
                    begins++;
                    depth++;
                    tally.setExceptionHandlers(tally.getExceptionHandlers() + 1);
                    break;
                case "IF":
                    tally.setConditionals(tally.getConditionals() + 1);
                    // T-SQL 的 IF 没有 END IF，由 BEGIN/END 承担块深度
                    if (!tsql) {
                        depth++;
                    }
                    break;
                case "ELSIF":
                case "ELSEIF":
                case "ELSE":
                    tally.setBranches(tally.getBranches() + 1);
                    break;
                case "CASE":
                    tally.setCaseBlocks(tally.getCaseBlocks() + 1);
                    depth++;
                    break;
                case "LOOP":
                    tally.setLoops(tally.getLoops() + 1);
                    depth++;
                    break;
                case "WHILE":
                case "REPEAT":
                    if (tsql) {
                        tally.setLoops(tally.getLoops() + 1);
                    } else if (mysql) {
                        tally.setLoops(tally.getLoops() + 1);
                        depth++;
                    }
                    break;
                case "EXCEPTION WHEN":
                case "HANDLER FOR":
                    tally.setExceptionHandlers(tally.getExceptionHandlers() + 1);
                    break;
                case "CURSOR":
                    tally.setCursors(tally.getCursors() + 1);
                    break;
                case "END WHILE":
                case "END REPEAT":
                    if (mysql) {
                        depth = Math.max(0, depth - 1);
                    }
                    break;
                default:
                    // END / END IF / END LOOP / END CASE / END TRY / END CATCH
                    depth = Math.max(0, depth - 1);
                    break;
            }
            maxDepth = Math.max(maxDepth, depth);
        }
        tally.setNestedBlocks(Math.max(0, begins - 1));
        tally.setMaxNestingDepth(maxDepth);
        return tally;
    }
}
