package com.afsun.procgraph.core.util;

import java.util.ArrayList;
import java.util.List;

/**
 * 存储过程源码的词法预处理工具
 *
 * @author afsun
 */
public class SqlScriptUtils {

    private SqlScriptUtils() {
    }

    /**
     * 移除SQL中的注释（保留字符串字面量中的内容）
     * 支持：
     * - 单行注释：-- comment
     * - 多行注释：/* comment *\/
     * - MySQL风格单行注释 # comment（仅当 hashComments 为 true，T-SQL 中 # 是临时表前缀）
     *
     * @param sql          原始SQL文本
     * @param hashComments 是否把 # 视为注释起始
     * @return 移除注释后的SQL，注释位置以空白代替，行号保持不变
     */
    public static String stripComments(String sql, boolean hashComments) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }

        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char c = sql.charAt(i);

            // 1. 字符串字面量（单引号），'' 为转义
            if (c == '\'') {
                int end = skipQuoted(sql, i, '\'');
                result.append(sql, i, end);
                i = end;
                continue;
            }

            // 2. 双引号标识符
            if (c == '"') {
                int end = skipQuoted(sql, i, '"');
                result.append(sql, i, end);
                i = end;
                continue;
            }

            // 3. 多行注释 /* ... */
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                i += 2;
                while (i < len) {
                    if (sql.charAt(i) == '*' && i + 1 < len && sql.charAt(i + 1) == '/') {
                        i += 2;
                        break;
                    }
                    // 保留换行符
                    result.append(sql.charAt(i) == '\n' ? '\n' : ' ');
                    i++;
                }
                result.append(' ');
                continue;
            }

            // 4. 单行注释 -- ... 与 # ...
            if ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || (hashComments && c == '#')) {
                while (i < len && sql.charAt(i) != '\n' && sql.charAt(i) != '\r') {
                    i++;
                }
                continue;
            }

            result.append(c);
            i++;
        }
        return result.toString();
    }

    /**
     * 将单引号字符串字面量的内容替换为空格，保留引号本身与整体长度。
     * 之后的正则匹配不会再把字面量中的文本误认为标识符。
     */
    public static String maskStringLiterals(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        StringBuilder result = new StringBuilder(sql);
        int len = sql.length();
        int i = 0;
        while (i < len) {
            if (sql.charAt(i) == '\'') {
                int end = skipQuoted(sql, i, '\'');
                for (int k = i + 1; k < end - 1; k++) {
                    if (result.charAt(k) != '\n') {
                        result.setCharAt(k, ' ');
                    }
                }
                i = end;
            } else {
                i++;
            }
        }
        return result.toString();
    }

    // 语句切分（保守策略：以分号切分，保留语句顺序；调用前应已屏蔽字面量）
    public static List<String> splitStatements(String text) {
        List<String> list = new ArrayList<>();
        if (text == null) {
            return list;
        }
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == ';') {
                addIfNotBlank(list, sb);
                sb.setLength(0);
            } else {
                sb.append(c);
            }
        }
        addIfNotBlank(list, sb);
        return list;
    }

    /**
     * 按顶层逗号切分（括号内的逗号不切分）
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                addIfNotBlank(parts, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addIfNotBlank(parts, current);
        return parts;
    }

    /**
     * 查找与 openIndex 处左括号匹配的右括号位置，找不到时返回 -1
     */
    public static int findMatchingParen(String text, int openIndex) {
        int depth = 0;
        for (int j = openIndex; j < text.length(); j++) {
            char c = text.charAt(j);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int len = sql.length();
        int i = start + 1;
        while (i < len) {
            char ch = sql.charAt(i);
            if (ch == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return len;
    }

    private static void addIfNotBlank(List<String> list, StringBuilder sb) {
        String s = sb.toString().trim();
        if (!s.isEmpty()) {
            list.add(s);
        }
    }
}
