package com.afsun.procgraph.core;

import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.core.util.SqlScriptUtils;
import com.alibaba.druid.DbType;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提取局部变量与游标声明
 *
 * @author afsun
 */
public class DeclarationExtractor {

    private static final Pattern SECTION_START = Pattern.compile("^\\s*(IS|AS)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEGIN = Pattern.compile("\\bBEGIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DECLARE = Pattern.compile("\\bDECLARE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$\\w*\\$");
    private static final Pattern TSQL_CURSOR = Pattern.compile("^([\\p{L}_][\\p{L}\\p{N}_$#]*)\\s+(?:\\w+\\s+)*CURSOR\\b",
            Pattern.CASE_INSENSITIVE);

    public Set<String> extract(String body, int headerEnd, DbType dialect) {
        Set<String> variables = new LinkedHashSet<>();
        if (StringUtils.isBlank(body)) {
            return variables;
        }
        if (dialect == DbType.sqlserver) {
            extractTsql(body, variables);
            return variables;
        }

        // Oracle：IS/AS 与第一个 BEGIN 之间的声明段
        if (headerEnd > 0 && headerEnd < body.length()) {
            String rest = body.substring(headerEnd);
            Matcher s = SECTION_START.matcher(rest);
            if (s.find()) {
                Matcher b = BEGIN.matcher(rest);
                int end = b.find(s.end()) ? b.start() : rest.length();
                parseSection(rest.substring(s.end(), end), variables);
            }
        }

        Matcher d = DECLARE.matcher(body);
        while (d.find()) {
            int end;
            if (dialect == DbType.mysql) {
                int semi = body.indexOf(';', d.end());
                end = semi < 0 ? body.length() : semi;
            } else {
                Matcher b = BEGIN.matcher(body);
                end = b.find(d.end()) ? b.start() : body.length();
            }
            parseSection(body.substring(d.end(), end), variables);
        }
        return variables;
    }

    private void parseSection(String section, Set<String> variables) {
        String cleaned = DOLLAR_TAG.matcher(section).replaceAll(" ");
        for (String declaration : SqlScriptUtils.splitStatements(cleaned)) {
            String[] tokens = StringUtils.split(declaration);
            if (tokens.length < 2) {
                continue;
            }
            String first = tokens[0].toUpperCase(Locale.ROOT);
            if ("DECLARE".equals(first)) {
                tokens = StringUtils.split(declaration.trim().substring("DECLARE".length()));
                if (tokens.length < 2) {
                    continue;
                }
                first = tokens[0].toUpperCase(Locale.ROOT);
            }
            switch (first) {
                case "CURSOR":
                    addName(StringUtils.substringBefore(tokens[1], "("), variables);
                    break;
                case "TYPE":
                case "SUBTYPE":
                case "PRAGMA":
                case "PROCEDURE":
                case "FUNCTION":
                    break;
                default:
                    if ("CONTINUE".equals(first) || "EXIT".equals(first)) {
                        // MySQL handler 声明
                        break;
                    }
                    addName(tokens[0], variables);
                    break;
            }
        }
    }

    private void extractTsql(String body, Set<String> variables) {
        Matcher d = DECLARE.matcher(body);
        while (d.find()) {
            int semi = body.indexOf(';', d.end());
            int newline = body.indexOf('\n', d.end());
            int end = body.length();
            if (semi >= 0) {
                end = semi;
            }
            if (newline >= 0 && newline < end) {
                end = newline;
            }
            String declaration = body.substring(d.end(), end).trim();
            Matcher cursor = TSQL_CURSOR.matcher(declaration);
            if (cursor.find()) {
                addName(cursor.group(1), variables);
                continue;
            }
            for (String piece : SqlScriptUtils.splitTopLevel(declaration, ',')) {
                String name = StringUtils.substringBefore(piece.trim(), " ");
                if (name.startsWith("@")) {
                    variables.add(name.toUpperCase(Locale.ROOT));
                }
            }
        }
    }

    private static void addName(String token, Set<String> variables) {
        String name = SqlIdentifiers.normalize(token);
        if (StringUtils.isNotBlank(name) && SqlKeywords.isPlainIdentifier(name)
                && (Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            variables.add(name);
        }
    }
}
