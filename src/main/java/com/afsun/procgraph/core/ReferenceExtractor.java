package com.afsun.procgraph.core;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.core.util.SqlScriptUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提取过程调用与表引用
 * 输入为已去注释、已屏蔽字面量、已清空过程头的过程体
 *
 * @author afsun
 */
public class ReferenceExtractor {

    private static final String Q = SqlIdentifiers.QUALIFIED;
    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final Pattern KEYWORD_CALL = Pattern.compile(
            "\\b(?:EXEC(?:UTE)?|CALL|PERFORM)\\s+(?:@[\\p{L}\\p{N}_$#@]+\\s*=\\s*)?(" + Q + ")", CI);

    // 语句起始位置或赋值右侧的 name(
    private static final Pattern STATEMENT_CALL = Pattern.compile(
            "(?:;|:=|\\bBEGIN\\b|\\bTHEN\\b|\\bELSE\\b|\\bLOOP\\b|\\bRETURN\\b|\\bDO\\b)\\s*(" + Q + ")\\s*\\(", CI);

    // 无参数调用：BEGIN proc_a; END;
    private static final Pattern BARE_CALL = Pattern.compile(
            "(?:;|\\bBEGIN\\b|\\bTHEN\\b|\\bELSE\\b|\\bLOOP\\b)\\s*(" + Q + ")\\s*;", CI);

    private static final Pattern DOTTED_CALL = Pattern.compile(
            "(?<![\\p{L}\\p{N}_$#.@:])(" + SqlIdentifiers.PART + "\\." + SqlIdentifiers.PART
                    + "(?:\\." + SqlIdentifiers.PART + ")?)\\s*\\(", CI);

    private static final Pattern FROM = Pattern.compile("\\bFROM\\b", CI);
    private static final Pattern JOIN = Pattern.compile("\\bJOIN\\s+(" + Q + ")", CI);
    private static final Pattern INSERT_INTO = Pattern.compile(
            "\\b(?:INSERT|MERGE)\\s+(?:ALL\\s+|FIRST\\s+)?INTO\\s+(" + Q + ")", CI);
    private static final Pattern TSQL_INSERT = Pattern.compile("\\bINSERT\\s+(" + Q + ")", CI);
    private static final Pattern UPDATE = Pattern.compile("\\bUPDATE\\s+(" + Q + ")", CI);
    private static final Pattern DELETE = Pattern.compile("\\bDELETE\\s+(?:FROM\\s+)?(" + Q + ")", CI);
    private static final Pattern MERGE_USING = Pattern.compile(
            "\\bMERGE\\s+INTO\\s+" + Q + "(?:\\s+(?!USING\\b)[\\p{L}\\p{N}_]+)?\\s+USING\\s+(" + Q + ")", CI);
    private static final Pattern CTE_NAME = Pattern.compile(
            "(?:\\bWITH|,)\\s*(" + SqlIdentifiers.PART + ")\\s*(?:\\([^()]*\\))?\\s+AS\\s*\\(", CI);
    private static final Pattern IDENT_AT = Pattern.compile(Q);
    private static final Pattern ALIAS_AT = Pattern.compile("(?:AS\\s+)?([\\p{L}_][\\p{L}\\p{N}_$#]*)", CI);

    /**
     * 这些函数的参数中允许出现 FROM
     */
    private static final Set<String> FROM_FUNCTIONS = new HashSet<>(Arrays.asList(
            "EXTRACT", "TRIM", "SUBSTRING", "OVERLAY", "POSITION"));

    /**
     * 前一个单词为这些关键字时，dotted name( 是表名加列清单而不是调用
     */
    private static final Set<String> NON_CALL_PREFIXES = new HashSet<>(Arrays.asList(
            "INTO", "TABLE", "JOIN", "FROM", "UPDATE", "REFERENCES", "ON", "INSERT", "USING", "PROCEDURE",
            "FUNCTION", "PROC"));

    public Set<String> extractCalls(String body, Set<String> declaredNames) {
        if (StringUtils.isBlank(body)) {
            return Collections.emptySet();
        }
        Map<Integer, String> found = new TreeMap<>();
        collect(KEYWORD_CALL, body, found, name -> acceptCall(name, declaredNames));
        collect(STATEMENT_CALL, body, found, name -> acceptCall(name, declaredNames));
        collect(BARE_CALL, body, found, name -> acceptCall(name, declaredNames));

        Matcher m = DOTTED_CALL.matcher(body);
        while (m.find()) {
            String prev = previousWord(body, m.start(1));
            if (prev != null && NON_CALL_PREFIXES.contains(prev)) {
                continue;
            }
            String name = SqlIdentifiers.normalize(m.group(1));
            if (acceptCall(name, declaredNames)) {
                found.putIfAbsent(m.start(1), name);
            }
        }
        return new LinkedHashSet<>(found.values());
    }

    public Set<String> extractTables(String body, Set<String> excludedNames) {
        if (StringUtils.isBlank(body)) {
            return Collections.emptySet();
        }
        Set<String> excluded = new HashSet<>(excludedNames);
        Matcher cte = CTE_NAME.matcher(body);
        while (cte.find()) {
            excluded.add(SqlIdentifiers.normalize(cte.group(1)));
        }

        Map<Integer, String> found = new TreeMap<>();
        collectFromLists(body, found);
        collect(JOIN, body, found, n -> true);
        collect(INSERT_INTO, body, found, n -> true);
        collect(MERGE_USING, body, found, n -> true);

        Matcher t = TSQL_INSERT.matcher(body);
        while (t.find()) {
            String name = SqlIdentifiers.normalize(t.group(1));
            if (!"INTO".equals(name) && !"ALL".equals(name) && !"FIRST".equals(name)) {
                found.putIfAbsent(t.start(1), name);
            }
        }

        Matcher u = UPDATE.matcher(body);
        while (u.find()) {
            String prev = previousWord(body, u.start());
            if ("FOR".equals(prev) || "KEY".equals(prev) || "THEN".equals(prev)) {
                continue;
            }
            found.putIfAbsent(u.start(1), SqlIdentifiers.normalize(u.group(1)));
        }
        collect(DELETE, body, found, n -> true);

        Set<String> tables = new LinkedHashSet<>();
        for (String name : found.values()) {
            if (acceptTable(name, excluded)) {
                tables.add(name);
            }
        }
        return tables;
    }

    /**
     * FROM 之后的表清单：FROM a x, b y, (subquery) z
     */
    private void collectFromLists(String body, Map<Integer, String> found) {
        Matcher m = FROM.matcher(body);
        while (m.find()) {
            if ("DISTINCT".equals(previousWord(body, m.start()))) {
                continue;
            }
            String fn = enclosingFunction(body, m.start());
            if (fn != null && FROM_FUNCTIONS.contains(fn)) {
                continue;
            }
            int i = m.end();
            while (true) {
                i = skipWhitespace(body, i);
                if (i >= body.length()) {
                    break;
                }
                if (body.charAt(i) == '(') {
                    int close = SqlScriptUtils.findMatchingParen(body, i);
                    if (close < 0) {
                        break;
                    }
                    i = close + 1;
                } else {
                    Matcher id = IDENT_AT.matcher(body);
                    id.region(i, body.length());
                    if (!id.lookingAt()) {
                        break;
                    }
                    String name = SqlIdentifiers.normalize(id.group());
                    int after = skipWhitespace(body, id.end());
                    // TABLE(...)、LATERAL(...) 之类的表函数
                    if (after < body.length() && body.charAt(after) == '(') {
                        break;
                    }
                    found.putIfAbsent(i, name);
                    i = id.end();
                }
                i = skipAlias(body, i);
                i = skipWhitespace(body, i);
                if (i < body.length() && body.charAt(i) == ',') {
                    i++;
                    continue;
                }
                break;
            }
        }
    }

    private int skipAlias(String body, int from) {
        int i = skipWhitespace(body, from);
        Matcher alias = ALIAS_AT.matcher(body);
        alias.region(i, body.length());
        if (alias.lookingAt() && SqlKeywords.isPlainIdentifier(alias.group(1))) {
            return alias.end();
        }
        return from;
    }

    private static void collect(Pattern pattern, String body, Map<Integer, String> found,
                                Predicate<String> accept) {
        Matcher m = pattern.matcher(body);
        while (m.find()) {
            String name = SqlIdentifiers.normalize(m.group(1));
            if (accept.test(name)) {
                found.putIfAbsent(m.start(1), name);
            }
        }
    }

    private static boolean acceptCall(String name, Set<String> declaredNames) {
        if (StringUtils.isBlank(name) || name.startsWith("#") || name.startsWith("@")) {
            return false;
        }
        if (declaredNames.contains(name)) {
            return false;
        }
        String qualifier = SqlIdentifiers.qualifier(name);
        String bare = SqlIdentifiers.bareName(name);
        if (SqlKeywords.DYNAMIC_SQL.contains(bare)) {
            return false;
        }
        if (qualifier == null) {
            return SqlKeywords.isPlainIdentifier(bare);
        }
        return !SqlKeywords.SYSTEM_PACKAGES.contains(qualifier)
                && !declaredNames.contains(qualifier)
                && !SqlKeywords.isReserved(bare);
    }

    private static boolean acceptTable(String name, Set<String> excluded) {
        if (StringUtils.isBlank(name) || name.startsWith("@")) {
            return false;
        }
        return !SqlKeywords.isReserved(name) && !excluded.contains(name);
    }

    /**
     * 紧邻 index 之前的单词（大写），没有时返回 null
     */
    static String previousWord(String text, int index) {
        int end = index - 1;
        while (end >= 0 && Character.isWhitespace(text.charAt(end))) {
            end--;
        }
        int start = end;
        while (start >= 0 && (Character.isLetterOrDigit(text.charAt(start)) || text.charAt(start) == '_')) {
            start--;
        }
        if (start == end) {
            return null;
        }
        return text.substring(start + 1, end + 1).toUpperCase(Locale.ROOT);
    }

    /**
     * index 所在的未闭合括号前的函数名（大写），不在函数参数中时返回 null
     */
    static String enclosingFunction(String text, int index) {
        int depth = 0;
        for (int j = index - 1; j >= 0; j--) {
            char c = text.charAt(j);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    return previousWord(text, j);
                }
                depth--;
            } else if (c == ';') {
                return null;
            }
        }
        return null;
    }

    private static int skipWhitespace(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
