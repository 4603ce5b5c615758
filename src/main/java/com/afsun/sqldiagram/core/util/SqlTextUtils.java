package com.afsun.sqldiagram.core.util;

import com.alibaba.druid.DbType;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * SQL文本预处理：注释移除、解析失败后的清洗
 *
 * @author afsun
 * @date 2025-11-11日 10:42
 */
public class SqlTextUtils {

    // 可带 schema 限定的标识符，仅保留最后一段
    private static final String QUALIFIED_IDENTIFIER = "(?:\\[?[A-Za-z0-9_@#$-]+\\]?\\.)?(\\[?[A-Za-z0-9_@#$-]+\\]?)";

    private static final Pattern WITH_CTE_NAME =
            Pattern.compile("WITH\\s+" + QUALIFIED_IDENTIFIER + "\\s+AS", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEXT_CTE_NAME =
            Pattern.compile(",\\s+" + QUALIFIED_IDENTIFIER + "\\s+AS", Pattern.CASE_INSENSITIVE);
    private static final Pattern AT_TIME_ZONE =
            Pattern.compile("\\sAT\\s+TIME\\s+ZONE\\s+[^\\s,;)]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern OVER_CLAUSE =
            Pattern.compile("OVER\\s*\\([^)]*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int SHORT_SQL_LENGTH = 200;

    private SqlTextUtils() {
    }

    /**
     * 移除SQL中的注释（保留字符串字面量与引号标识符中的内容）
     * 支持：
     * - 单行注释：-- comment
     * - 多行注释：/* comment *\/
     * - # comment：仅 MySQL；T-SQL 中 # 是临时表前缀
     *
     * @param sql    原始SQL文本
     * @param dbType 方言，可为 null
     * @return 移除注释后的SQL
     */
    public static String stripComments(String sql, DbType dbType) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        boolean hashComment = dbType == DbType.mysql;

        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char c = sql.charAt(i);

            // 1. 字符串字面量与引号标识符原样保留
            if (c == '\'' || c == '"') {
                i = copyQuoted(sql, i, c, result);
                continue;
            }

            // 2. 多行注释 /* ... */
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                i += 2;
                while (i < len) {
                    if (sql.charAt(i) == '*' && i + 1 < len && sql.charAt(i + 1) == '/') {
                        i += 2;
                        break;
                    }
                    i++;
                }
                result.append(' ');
                continue;
            }

            // 3. 单行注释，保留换行符
            if ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || (c == '#' && hashComment)) {
                while (i < len && sql.charAt(i) != '\n' && sql.charAt(i) != '\r') {
                    i++;
                }
                if (i < len) {
                    result.append(sql.charAt(i));
                    i++;
                }
                continue;
            }

            result.append(c);
            i++;
        }
        return result.toString().trim();
    }

    // 复制引号包围的内容，'' 与 "" 视为转义；返回结束后的位置
    private static int copyQuoted(String sql, int start, char quote, StringBuilder out) {
        int len = sql.length();
        out.append(quote);
        int i = start + 1;
        while (i < len) {
            char ch = sql.charAt(i);
            out.append(ch);
            if (ch == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    out.append(quote);
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    /**
     * 清洗解析器难以处理、但不影响表引用的写法：
     * CTE 名的 schema 限定、AT TIME ZONE、OVER(...) 窗口子句，并合并空白
     */
    public static String sanitizeForParser(String sql) {
        if (sql == null) {
            return null;
        }
        String s = WITH_CTE_NAME.matcher(sql).replaceAll("WITH $1 AS");
        s = NEXT_CTE_NAME.matcher(s).replaceAll(", $1 AS");
        s = AT_TIME_ZONE.matcher(s).replaceAll("");
        s = OVER_CLAUSE.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /**
     * 截断的单行SQL，用于日志与异常信息
     */
    public static String shortSql(String sql) {
        if (sql == null) {
            return "";
        }
        String t = WHITESPACE.matcher(sql).replaceAll(" ").trim();
        if (t.length() <= SHORT_SQL_LENGTH) {
            return t;
        }
        return StringUtils.left(t, SHORT_SQL_LENGTH / 2) + " ... " + StringUtils.right(t, SHORT_SQL_LENGTH / 2);
    }
}
