package com.afsun.sqldiagram.core.util;

import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLTextLiteralExpr;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Method;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 标识符规范化：用于判断两个原始标识符是否指向同一阶段。
 * <p>
 * [dbo].[Orders]、"ORDERS"、orders 的规范名均为 orders；临时表前缀 # 保留。
 *
 * @author afsun
 */
@Slf4j
public final class IdentifierCanonicalizer {

    private static final Pattern IDENTIFIER_LIKE = Pattern.compile("[A-Za-z0-9_\\[\\]#.\"@$]+");

    // 兜底探测时按顺序尝试的访问器
    private static final String[] NAME_ACCESSORS = {"getName", "getTableName", "getAlias"};

    private IdentifierCanonicalizer() {
    }

    /**
     * 规范化原始标识符
     *
     * @param raw 原始标识符，如 mydb.dbo.[Orders]
     * @return 规范名；输入为空或规范化后为空时返回 null
     */
    public static String canonicalize(String raw) {
        if (raw == null) {
            return null;
        }
        String v = raw.trim();
        if (v.isEmpty()) {
            return null;
        }
        if (v.startsWith("[") && v.endsWith("]") && v.length() >= 2) {
            v = v.substring(1, v.length() - 1);
        }
        v = stripQuotes(v);
        // mydb.dbo.table -> table
        int lastDot = v.lastIndexOf('.');
        if (lastDot >= 0) {
            v = v.substring(lastDot + 1);
        }
        v = stripEnclosingMarks(v);
        if (v.isEmpty()) {
            return null;
        }
        return v.toLowerCase(Locale.ROOT);
    }

    /**
     * 从任意形态的AST节点中提取规范名
     *
     * @return 规范名；无法识别时返回 null，调用方应视为"非依赖候选"
     */
    public static String extractIdentifier(Object node) {
        return canonicalize(extractRawIdentifier(node));
    }

    /**
     * 按优先级探测节点形态，提取原始（未规范化）标识符，用于展示
     */
    public static String extractRawIdentifier(Object node) {
        if (node == null) {
            return null;
        }
        // 1. 直接字符串
        if (node instanceof String) {
            return StringUtils.trimToNull((String) node);
        }
        // 2. 表引用：FROM/JOIN/INTO 目标
        if (node instanceof SQLExprTableSource) {
            return extractRawIdentifier(((SQLExprTableSource) node).getExpr());
        }
        // 3. CTE 定义（Entry 也是 SQLTableSource，需先判断）
        if (node instanceof SQLWithSubqueryClause.Entry) {
            return StringUtils.trimToNull(((SQLWithSubqueryClause.Entry) node).getAlias());
        }
        // 4. 派生表（子查询）不是标识符
        if (node instanceof SQLTableSource) {
            return null;
        }
        // 5. 简单名
        if (node instanceof SQLIdentifierExpr) {
            return StringUtils.trimToNull(((SQLIdentifierExpr) node).getName());
        }
        // 6. db.schema.table 组合名
        if (node instanceof SQLPropertyExpr) {
            return qualifiedName((SQLPropertyExpr) node);
        }
        if (node instanceof SQLName) {
            return StringUtils.trimToNull(((SQLName) node).getSimpleName());
        }
        // 7. 文本字面量，如 INSERT INTO 'name'（部分方言）
        if (node instanceof SQLTextLiteralExpr) {
            return StringUtils.trimToNull(((SQLTextLiteralExpr) node).getText());
        }
        // 8. 兜底：浅层扫描名称类访问器
        return scanNameAccessors(node);
    }

    private static String qualifiedName(SQLPropertyExpr expr) {
        String name = expr.getName();
        SQLExpr owner = expr.getOwner();
        if (owner == null) {
            return StringUtils.trimToNull(name);
        }
        String ownerName = extractRawIdentifier(owner);
        return ownerName == null ? StringUtils.trimToNull(name) : ownerName + "." + name;
    }

    private static String scanNameAccessors(Object node) {
        for (String accessor : NAME_ACCESSORS) {
            Object value;
            try {
                Method m = node.getClass().getMethod(accessor);
                if (m.getParameterCount() != 0) {
                    continue;
                }
                value = m.invoke(node);
            } catch (NoSuchMethodException e) {
                continue;
            } catch (ReflectiveOperationException | RuntimeException e) {
                log.trace("探测 {}.{} 失败: {}", node.getClass().getSimpleName(), accessor, e.getMessage());
                continue;
            }
            String candidate = null;
            if (value instanceof String) {
                candidate = (String) value;
            } else if (value instanceof SQLName) {
                candidate = ((SQLName) value).getSimpleName();
            }
            if (candidate != null && IDENTIFIER_LIKE.matcher(candidate).find()) {
                return candidate.trim();
            }
        }
        return null;
    }

    // 反复去除首尾的空白、方括号与双引号，直到稳定
    private static String stripEnclosingMarks(String s) {
        String prev;
        String v = s;
        do {
            prev = v;
            v = StringUtils.strip(v.trim(), "[]\"");
        } while (!v.equals(prev));
        return v;
    }

    private static String stripQuotes(String s) {
        String v = s;
        if (v.startsWith("\"")) {
            v = v.substring(1);
        }
        if (v.endsWith("\"")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }
}
