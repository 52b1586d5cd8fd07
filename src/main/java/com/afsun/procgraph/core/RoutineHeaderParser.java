package com.afsun.procgraph.core;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.core.util.SqlScriptUtils;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析过程头：名称、参数列表及头部范围
 * 支持 Oracle、PostgreSQL/MySQL 与 T-SQL 三种参数写法
 *
 * @author afsun
 */
public class RoutineHeaderParser {

    private static final Pattern HEADER = Pattern.compile(
            "\\b(?:CREATE\\s+(?:OR\\s+(?:REPLACE|ALTER)\\s+)?(?:DEFINER\\s*=\\s*\\S+\\s+)?)?"
                    + "(PROCEDURE|PROC|FUNCTION)\\s+(" + SqlIdentifiers.QUALIFIED + ")",
            Pattern.CASE_INSENSITIVE);

    // T-SQL 无括号参数列表的结束位置
    private static final Pattern HEADER_TERMINATOR = Pattern.compile(
            "\\b(AS|IS|BEGIN|RETURNS|RETURN|LANGUAGE|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern RETURN_CLAUSE = Pattern.compile(
            "^\\s*RETURNS?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern RETURN_TERMINATOR = Pattern.compile(
            "\\b(IS|AS|BEGIN|LANGUAGE)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DEFAULT_VALUE = Pattern.compile(
            "\\s*(?:\\bDEFAULT\\b|:=|=).*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public RoutineHeader parse(String maskedSource) {
        Matcher m = HEADER.matcher(maskedSource);
        if (!m.find()) {
            return null;
        }
        RoutineHeader header = new RoutineHeader();
        header.setStart(m.start());
        header.setFunction("FUNCTION".equalsIgnoreCase(m.group(1)));

        String qualified = SqlIdentifiers.normalize(m.group(2));
        header.setName(SqlIdentifiers.bareName(qualified));
        int dot = qualified.lastIndexOf('.');
        if (dot > 0) {
            header.setSchema(qualified.substring(0, dot));
        }

        int nameEnd = m.end();
        int i = nameEnd;
        while (i < maskedSource.length() && Character.isWhitespace(maskedSource.charAt(i))) {
            i++;
        }
        String paramText = "";
        int headerEnd;
        if (i < maskedSource.length() && maskedSource.charAt(i) == '(') {
            int close = SqlScriptUtils.findMatchingParen(maskedSource, i);
            if (close < 0) {
                close = maskedSource.length() - 1;
            }
            paramText = maskedSource.substring(i + 1, Math.max(i + 1, close));
            headerEnd = close + 1;
        } else {
            Matcher t = HEADER_TERMINATOR.matcher(maskedSource);
            headerEnd = t.find(nameEnd) ? t.start() : maskedSource.length();
            paramText = maskedSource.substring(nameEnd, headerEnd);
        }

        // 函数的返回类型也算在头部
        if (RETURN_CLAUSE.matcher(maskedSource.substring(headerEnd)).find()) {
            Matcher r = RETURN_TERMINATOR.matcher(maskedSource);
            int returnsAt = maskedSource.toUpperCase(Locale.ROOT).indexOf("RETURN", headerEnd);
            headerEnd = r.find(returnsAt + "RETURN".length()) ? r.start() : maskedSource.length();
        }
        header.setEnd(headerEnd);
        header.setParameters(parseParameters(paramText));
        return header;
    }

    List<ParameterInfo> parseParameters(String paramText) {
        List<ParameterInfo> result = new ArrayList<>();
        if (StringUtils.isBlank(paramText)) {
            return result;
        }
        for (String piece : SqlScriptUtils.splitTopLevel(paramText, ',')) {
            ParameterInfo p = parseParameter(DEFAULT_VALUE.matcher(piece.trim()).replaceFirst(""));
            if (p != null) {
                result.add(p);
            }
        }
        return result;
    }

    private ParameterInfo parseParameter(String declaration) {
        List<String> tokens = new ArrayList<>(Arrays.asList(StringUtils.split(declaration)));
        if (tokens.isEmpty()) {
            return null;
        }

        // T-SQL：@p INT OUTPUT
        if (tokens.get(0).startsWith("@")) {
            String name = tokens.remove(0).toUpperCase(Locale.ROOT);
            ParameterDirection direction = ParameterDirection.IN;
            tokens.removeIf(t -> "READONLY".equalsIgnoreCase(t));
            if (!tokens.isEmpty() && "AS".equalsIgnoreCase(tokens.get(0))) {
                tokens.remove(0);
            }
            if (!tokens.isEmpty()) {
                String last = tokens.get(tokens.size() - 1);
                if ("OUTPUT".equalsIgnoreCase(last) || "OUT".equalsIgnoreCase(last)) {
                    direction = ParameterDirection.OUT;
                    tokens.remove(tokens.size() - 1);
                }
            }
            return ParameterInfo.of(name, direction, joinType(tokens));
        }

        // PostgreSQL / MySQL：IN p INT、INOUT p INT、OUT p INT
        String first = tokens.get(0).toUpperCase(Locale.ROOT);
        if (tokens.size() >= 2 && ("IN".equals(first) || "OUT".equals(first) || "INOUT".equals(first))) {
            tokens.remove(0);
            String direction = first;
            if ("IN".equals(first) && "OUT".equalsIgnoreCase(tokens.get(0)) && tokens.size() >= 2) {
                tokens.remove(0);
                direction = "IN OUT";
            }
            String name = SqlIdentifiers.normalize(tokens.remove(0));
            return ParameterInfo.of(name, ParameterDirection.parse(direction), joinType(tokens));
        }

        // Oracle：p IN OUT NOCOPY type
        String name = SqlIdentifiers.normalize(tokens.remove(0));
        StringBuilder direction = new StringBuilder();
        while (!tokens.isEmpty()) {
            String t = tokens.get(0).toUpperCase(Locale.ROOT);
            if ("IN".equals(t) || "OUT".equals(t)) {
                direction.append(direction.length() == 0 ? "" : " ").append(t);
                tokens.remove(0);
            } else if ("NOCOPY".equals(t)) {
                tokens.remove(0);
            } else {
                break;
            }
        }
        return ParameterInfo.of(name, ParameterDirection.parse(direction.toString()), joinType(tokens));
    }

    private static String joinType(List<String> tokens) {
        return tokens.isEmpty() ? null : String.join(" ", tokens);
    }

    /**
     * 过程头解析结果
     * start/end 为头部在源码中的范围，分析过程体前会被清空
     */
    @Data
    public static class RoutineHeader {
        private String schema;
        private String name;
        private boolean function;
        private int start;
        private int end;
        private List<ParameterInfo> parameters = new ArrayList<>();
    }
}
