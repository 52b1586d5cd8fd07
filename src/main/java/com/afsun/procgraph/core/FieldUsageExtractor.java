package com.afsun.procgraph.core;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.core.util.SqlScriptUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字段使用提取
 * <ul>
 *     <li>SELECT 投影、WHERE/ON 谓词中的字段：READ</li>
 *     <li>UPDATE SET 目标与 INSERT 列清单：WRITE</li>
 *     <li>函数参数中的字段：额外记录 TRANSFORM，描述为 FN(FIELD)</li>
 * </ul>
 *
 * @author afsun
 */
public class FieldUsageExtractor {

    public static final String CTX_SELECT = "SELECT";
    public static final String CTX_WHERE = "WHERE";
    public static final String CTX_ON = "ON";
    public static final String CTX_SET = "SET";
    public static final String CTX_INSERT = "INSERT";

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final String Q = SqlIdentifiers.QUALIFIED;

    private static final Pattern SELECT = Pattern.compile("\\bSELECT\\b", CI);
    private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", CI);
    private static final Pattern ON = Pattern.compile("\\bON\\b", CI);
    private static final Pattern UPDATE_SET = Pattern.compile(
            "\\bUPDATE\\s+(?:" + Q + "(?:\\s+(?!SET\\b)[\\p{L}_][\\p{L}\\p{N}_$#]*)?\\s+)?SET\\b", CI);
    private static final Pattern DUPLICATE_KEY_UPDATE = Pattern.compile("\\bDUPLICATE\\s+KEY\\s+UPDATE\\b", CI);
    private static final Pattern INSERT_COLUMNS = Pattern.compile(
            "\\bINSERT\\s*(?:ALL\\s+)?(?:INTO\\s+" + Q + "(?:\\s+(?!VALUES\\b|SELECT\\b)[\\p{L}_][\\p{L}\\p{N}_$#]*)?\\s*)?\\(", CI);
    private static final Pattern LEADING_MODIFIER = Pattern.compile(
            "^\\s*(?:DISTINCT|ALL|TOP\\s*\\(?\\s*\\d+\\s*\\)?)\\b", CI);
    private static final Pattern AS_ALIAS = Pattern.compile("\\s+AS\\s+(\"[^\"]+\"|[\\p{L}\\p{N}_$#]+)\\s*$", CI);
    private static final Pattern BARE_ALIAS = Pattern.compile("^(.*[\\p{L}\\p{N}_)\\]\"'])\\s+([\\p{L}_][\\p{L}\\p{N}_$#]*)\\s*$",
            Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile(
            "(?<![\\p{L}\\p{N}_$#@:.%])([\\p{L}_][\\p{L}\\p{N}_$#]*(?:\\.[\\p{L}_][\\p{L}\\p{N}_$#]*)*)");
    private static final Pattern FUNCTION_CALL = Pattern.compile(
            "(?<![\\p{L}\\p{N}_$#@:.%])([\\p{L}_][\\p{L}\\p{N}_$#]*(?:\\.[\\p{L}_][\\p{L}\\p{N}_$#]*)*)\\s*\\(");

    private static final Set<String> STATEMENT_KEYWORDS = words(
            "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "IF", "BEGIN", "END", "EXEC", "EXECUTE",
            "RETURN", "DECLARE", "PRINT", "WHILE", "ELSE", "ELSIF", "LOOP");
    private static final Set<String> PROJECTION_STOPS = union(STATEMENT_KEYWORDS, words("FROM", "INTO", "SET"));
    private static final Set<String> WHERE_STOPS = union(STATEMENT_KEYWORDS, words(
            "GROUP", "ORDER", "HAVING", "UNION", "INTERSECT", "MINUS", "EXCEPT", "RETURNING", "CONNECT",
            "START", "LIMIT", "FOR", "WINDOW", "WHEN", "OUTPUT", "THEN", "INTO"));
    private static final Set<String> ON_STOPS = union(STATEMENT_KEYWORDS, words(
            "JOIN", "WHERE", "LEFT", "RIGHT", "INNER", "FULL", "CROSS", "OUTER", "GROUP", "ORDER", "WHEN",
            "UNION", "HAVING", "SET", "USING", "THEN"));
    private static final Set<String> SET_STOPS = union(STATEMENT_KEYWORDS, words(
            "WHERE", "RETURNING", "FROM", "WHEN", "OUTPUT"));

    /**
     * 不作为字段变换记录的函数形式
     */
    private static final Set<String> NON_TRANSFORMS = words("OVER", "PARTITION", "EXISTS", "TABLE", "CASE",
            "IN", "VALUES");

    /**
     * 提取字段使用并合并到 fields
     *
     * @param body      预处理后的过程体
     * @param procedure 记录到 readBy/writtenBy 的过程名
     * @param excluded  参数、变量、表名等非字段名（大写）
     * @param fields    字段名 → 使用记录
     */
    public void extract(String body, String procedure, Set<String> excluded, Map<String, FieldUsage> fields) {
        if (StringUtils.isBlank(body)) {
            return;
        }
        Recorder recorder = new Recorder(procedure, excluded, fields);

        Matcher s = SELECT.matcher(body);
        while (s.find()) {
            String projection = scanClause(body, s.end(), PROJECTION_STOPS);
            recordProjection(projection, recorder);
        }

        Matcher w = WHERE.matcher(body);
        while (w.find()) {
            recorder.expression(scanClause(body, w.end(), WHERE_STOPS), FieldOperation.READ, CTX_WHERE);
        }

        Matcher o = ON.matcher(body);
        while (o.find()) {
            String prev = ReferenceExtractor.previousWord(body, o.start());
            if ("NOCOUNT".equals(prev) || "XACT_ABORT".equals(prev) || "DELETE".equals(prev)) {
                continue;
            }
            recorder.expression(scanClause(body, o.end(), ON_STOPS), FieldOperation.READ, CTX_ON);
        }

        Matcher u = UPDATE_SET.matcher(body);
        while (u.find()) {
            recordAssignments(scanClause(body, u.end(), SET_STOPS), recorder);
        }
        Matcher d = DUPLICATE_KEY_UPDATE.matcher(body);
        while (d.find()) {
            recordAssignments(scanClause(body, d.end(), SET_STOPS), recorder);
        }

        Matcher i = INSERT_COLUMNS.matcher(body);
        while (i.find()) {
            int open = i.end() - 1;
            int close = SqlScriptUtils.findMatchingParen(body, open);
            if (close < 0) {
                continue;
            }
            String columns = body.substring(open + 1, close);
            if (startsWithWord(columns, "SELECT")) {
                continue;
            }
            for (String column : SqlScriptUtils.splitTopLevel(columns, ',')) {
                recorder.target(column, CTX_INSERT);
            }
        }
    }

    private void recordProjection(String projection, Recorder recorder) {
        String text = LEADING_MODIFIER.matcher(projection).replaceFirst(" ");
        for (String item : SqlScriptUtils.splitTopLevel(text, ',')) {
            recorder.expression(stripAlias(item.trim()), FieldOperation.READ, CTX_SELECT);
        }
    }

    private void recordAssignments(String setClause, Recorder recorder) {
        for (String assignment : SqlScriptUtils.splitTopLevel(setClause, ',')) {
            int eq = topLevelEquals(assignment);
            if (eq < 0) {
                continue;
            }
            String lhs = assignment.substring(0, eq).trim();
            if (lhs.startsWith("(") && lhs.endsWith(")")) {
                lhs = lhs.substring(1, lhs.length() - 1);
            }
            for (String target : SqlScriptUtils.splitTopLevel(lhs, ',')) {
                recorder.target(target, CTX_SET);
            }
            recorder.expression(assignment.substring(eq + 1), FieldOperation.READ, CTX_SET);
        }
    }

    static String stripAlias(String item) {
        Matcher as = AS_ALIAS.matcher(item);
        if (as.find()) {
            return item.substring(0, as.start());
        }
        Matcher bare = BARE_ALIAS.matcher(item);
        if (bare.matches() && SqlKeywords.isPlainIdentifier(bare.group(2))) {
            return bare.group(1);
        }
        return item;
    }

    /**
     * 从 from 开始截取子句，遇到顶层结束关键字、分号或外层右括号为止
     */
    static String scanClause(String text, int from, Set<String> stops) {
        int depth = 0;
        int caseDepth = 0;
        int j = from;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth < 0) {
                    break;
                }
            } else if (c == ';' && depth == 0) {
                break;
            } else if (Character.isLetter(c) && (j == 0 || !isWordChar(text.charAt(j - 1)))) {
                int k = j;
                while (k < text.length() && isWordChar(text.charAt(k))) {
                    k++;
                }
                if (depth == 0) {
                    String word = text.substring(j, k).toUpperCase(Locale.ROOT);
                    if ("CASE".equals(word)) {
                        caseDepth++;
                    } else if ("END".equals(word) && caseDepth > 0) {
                        caseDepth--;
                    } else if (stops.contains(word) && caseDepth == 0) {
                        break;
                    }
                }
                j = k;
                continue;
            }
            j++;
        }
        return text.substring(from, j);
    }

    private static int topLevelEquals(String assignment) {
        int depth = 0;
        for (int k = 0; k < assignment.length(); k++) {
            char c = assignment.charAt(k);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char before = k > 0 ? assignment.charAt(k - 1) : ' ';
                if (before != ':' && before != '<' && before != '>' && before != '!') {
                    return k;
                }
            }
        }
        return -1;
    }

    /**
     * 把 (SELECT ...) 子查询替换为空白，子查询由其自身的 SELECT/WHERE 匹配单独处理
     */
    static String blankSubqueries(String expr) {
        StringBuilder sb = new StringBuilder(expr);
        for (int k = 0; k < expr.length(); k++) {
            if (expr.charAt(k) == '(' && startsWithWord(expr.substring(k + 1), "SELECT")) {
                int close = SqlScriptUtils.findMatchingParen(expr, k);
                int end = close < 0 ? expr.length() - 1 : close;
                for (int x = k; x <= end; x++) {
                    sb.setCharAt(x, ' ');
                }
                k = end;
            }
        }
        return sb.toString();
    }

    private static boolean startsWithWord(String text, String word) {
        String t = text.trim();
        return t.length() >= word.length()
                && t.regionMatches(true, 0, word, 0, word.length())
                && (t.length() == word.length() || !isWordChar(t.charAt(word.length())));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    private static Set<String> words(String... values) {
        return new HashSet<>(Arrays.asList(values));
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> u = new HashSet<>(a);
        u.addAll(b);
        return u;
    }

    /**
     * 单次提取的记录上下文
     */
    private static final class Recorder {
        private final String procedure;
        private final Set<String> excluded;
        private final Map<String, FieldUsage> fields;

        private Recorder(String procedure, Set<String> excluded, Map<String, FieldUsage> fields) {
            this.procedure = procedure;
            this.excluded = excluded;
            this.fields = fields;
        }

        void expression(String expr, FieldOperation operation, String context) {
            if (StringUtils.isBlank(expr)) {
                return;
            }
            String text = blankSubqueries(expr);
            Matcher m = IDENTIFIER.matcher(text);
            while (m.find()) {
                if (isFunctionName(text, m.end()) || followedByDot(text, m.end())) {
                    continue;
                }
                String field = fieldName(m.group(1));
                if (field != null) {
                    usage(field).record(operation, context, procedure);
                }
            }

            Matcher f = FUNCTION_CALL.matcher(text);
            while (f.find()) {
                String function = SqlIdentifiers.normalize(f.group(1));
                if (NON_TRANSFORMS.contains(function)
                        || (SqlKeywords.isReserved(function) && !SqlKeywords.isBuiltinFunction(function))) {
                    continue;
                }
                int open = f.end() - 1;
                int close = SqlScriptUtils.findMatchingParen(text, open);
                String args = text.substring(open + 1, close < 0 ? text.length() : close);
                Matcher a = IDENTIFIER.matcher(args);
                while (a.find()) {
                    if (isFunctionName(args, a.end()) || followedByDot(args, a.end())) {
                        continue;
                    }
                    String field = fieldName(a.group(1));
                    if (field != null) {
                        usage(field).recordTransformation(function + "(" + field + ")", context, procedure);
                    }
                }
            }
        }

        void target(String column, String context) {
            String name = StringUtils.trim(column);
            if (StringUtils.isBlank(name) || name.startsWith("@") || name.startsWith(":")) {
                return;
            }
            String field = fieldName(name);
            if (field != null) {
                usage(field).record(FieldOperation.WRITE, context, procedure);
            }
        }

        private String fieldName(String token) {
            String normalized = SqlIdentifiers.normalize(token);
            if (StringUtils.isBlank(normalized) || excluded.contains(normalized)) {
                return null;
            }
            String bare = SqlIdentifiers.bareName(normalized);
            if (bare.isEmpty() || !Character.isLetter(bare.charAt(0)) && bare.charAt(0) != '_') {
                return null;
            }
            if (!SqlKeywords.isPlainIdentifier(bare) || SqlKeywords.DATA_TYPES.contains(bare)
                    || excluded.contains(bare)) {
                return null;
            }
            return bare;
        }

        private FieldUsage usage(String field) {
            return fields.computeIfAbsent(field, FieldUsage::new);
        }

        private static boolean isFunctionName(String text, int end) {
            int k = end;
            while (k < text.length() && Character.isWhitespace(text.charAt(k))) {
                k++;
            }
            return k < text.length() && text.charAt(k) == '(';
        }

        private static boolean followedByDot(String text, int end) {
            return end < text.length() && text.charAt(end) == '.';
        }
    }
}
