package com.afsun.procgraph.core.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * 标识符的正则片段与规范化
 *
 * @author afsun
 */
public final class SqlIdentifiers {

    /**
     * 单段标识符：普通、"双引号"、[方括号]、`反引号`，允许 # 开头的临时表
     */
    public static final String PART = "(?:\"[^\"]+\"|\\[[^\\]]+\\]|`[^`]+`|[\\p{L}_#][\\p{L}\\p{N}_$#]*)";

    /**
     * 至多三段的限定名：db.schema.object
     */
    public static final String QUALIFIED = PART + "(?:\\." + PART + "){0,2}";

    private SqlIdentifiers() {
    }

    /**
     * 去掉引号与括号并转为大写
     */
    public static String normalize(String identifier) {
        if (StringUtils.isBlank(identifier)) {
            return identifier;
        }
        String s = StringUtils.deleteWhitespace(identifier);
        s = StringUtils.remove(s, '"');
        s = StringUtils.remove(s, '`');
        s = StringUtils.remove(s, '[');
        s = StringUtils.remove(s, ']');
        return s.toUpperCase(Locale.ROOT);
    }

    /**
     * 最后一段名称：SCHEMA.TABLE → TABLE
     */
    public static String bareName(String identifier) {
        if (identifier == null) {
            return null;
        }
        int dot = identifier.lastIndexOf('.');
        return dot < 0 ? identifier : identifier.substring(dot + 1);
    }

    /**
     * 第一段名称：PKG.PROC → PKG，无限定时返回 null
     */
    public static String qualifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        int dot = identifier.indexOf('.');
        return dot < 0 ? null : identifier.substring(0, dot);
    }

    /**
     * schema.name，schema 为空时只返回 name
     */
    public static String fullName(String schema, String name) {
        if (StringUtils.isBlank(schema)) {
            return name;
        }
        return schema + "." + name;
    }
}
