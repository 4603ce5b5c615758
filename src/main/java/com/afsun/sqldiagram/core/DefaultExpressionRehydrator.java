package com.afsun.sqldiagram.core;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.SQLOrderBy;
import com.alibaba.druid.sql.ast.SQLOver;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.expr.SQLCaseExpr;
import com.alibaba.druid.sql.ast.expr.SQLCastExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLInListExpr;
import com.alibaba.druid.sql.ast.expr.SQLListExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLNCharExpr;
import com.alibaba.druid.sql.ast.expr.SQLNumericLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLTextLiteralExpr;
import com.alibaba.druid.sql.ast.statement.SQLSelectOrderByItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Druid AST 的表达式还原实现。
 * <p>
 * 识别的形态见 {@link ExpressionShape}；其余节点交给 {@link SqlUnparser}，仍失败则输出占位文本。
 */
@Slf4j
public class DefaultExpressionRehydrator implements ExpressionRehydrator {

    private final SqlUnparser unparser;

    public DefaultExpressionRehydrator(DbType dbType) {
        this(SqlUnparser.druid(dbType));
    }

    public DefaultExpressionRehydrator(SqlUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public String rehydrate(SQLObject node) {
        if (node == null) {
            return "";
        }
        try {
            if (node instanceof SQLExpr) {
                return rehydrateExpr((SQLExpr) node);
            }
            return unparse(node);
        } catch (RuntimeException e) {
            log.debug("表达式还原失败 {}: {}", node.getClass().getSimpleName(), e.getMessage());
            return COMPLEX_EXPRESSION;
        }
    }

    private String rehydrateExpr(SQLExpr expr) {
        switch (ExpressionShape.of(expr)) {
            case BINARY:
                return binary((SQLBinaryOpExpr) expr);
            case COLUMN_REF:
                return columnRef(expr);
            case NUMBER:
                return String.valueOf(((SQLNumericLiteralExpr) expr).getNumber());
            case STRING:
                // N'...' 保留 Unicode 前缀
                String literal = quote(((SQLTextLiteralExpr) expr).getText());
                return expr instanceof SQLNCharExpr ? "N" + literal : literal;
            case LIST:
                return "(" + joinArgs(((SQLListExpr) expr).getItems()) + ")";
            case IN_LIST:
                return inList((SQLInListExpr) expr);
            case AGGREGATE:
                return aggregate((SQLAggregateExpr) expr);
            case FUNCTION:
                return function((SQLMethodInvokeExpr) expr);
            case CASE:
                return caseWhen((SQLCaseExpr) expr);
            case CAST:
                return cast((SQLCastExpr) expr);
            case UNKNOWN:
            default:
                return unparse(expr);
        }
    }

    private String binary(SQLBinaryOpExpr b) {
        SQLBinaryOperator op = b.getOperator();
        String operator = op == null ? "" : op.name;
        return (operand(b.getLeft(), op, false) + " " + operator + " " + operand(b.getRight(), op, true)).trim();
    }

    // 子表达式在源码中带括号，或优先级低于父运算符时加括号；右侧同级也加，如 a - (b - c)
    private String operand(SQLExpr child, SQLBinaryOperator parent, boolean right) {
        String text = rehydrate(child);
        if (!(child instanceof SQLBinaryOpExpr)) {
            return text;
        }
        SQLBinaryOpExpr b = (SQLBinaryOpExpr) child;
        if (b.isParenthesized()) {
            return "(" + text + ")";
        }
        if (parent == null || b.getOperator() == null) {
            return text;
        }
        int childPriority = b.getOperator().priority;
        if (childPriority > parent.priority || (right && childPriority == parent.priority)) {
            return "(" + text + ")";
        }
        return text;
    }

    // t.col 或 col
    private String columnRef(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr) {
            return ((SQLIdentifierExpr) expr).getName();
        }
        SQLPropertyExpr pe = (SQLPropertyExpr) expr;
        if (pe.getOwner() == null) {
            return pe.getName();
        }
        return rehydrate(pe.getOwner()) + "." + pe.getName();
    }

    private String inList(SQLInListExpr in) {
        return rehydrate(in.getExpr()) + (in.isNot() ? " NOT IN " : " IN ")
                + "(" + joinArgs(in.getTargetList()) + ")";
    }

    private String function(SQLMethodInvokeExpr m) {
        List<SQLExpr> args = m.getArguments();
        // CONVERT(type, expr) 统一还原为 CAST 形式
        if ("CONVERT".equalsIgnoreCase(m.getMethodName()) && args != null && args.size() >= 2) {
            return "CAST(" + rehydrate(args.get(1)) + " AS " + rehydrate(args.get(0)) + ")";
        }
        return functionName(m) + "(" + joinArgs(args) + ")";
    }

    private String aggregate(SQLAggregateExpr ag) {
        StringBuilder sb = new StringBuilder();
        sb.append(ag.getMethodName()).append("(");
        if (ag.getOption() != null) {
            sb.append(ag.getOption().name()).append(" ");
        }
        sb.append(joinArgs(ag.getArguments())).append(")");
        SQLOver over = ag.getOver();
        if (over != null) {
            sb.append(" ").append(over(over));
        }
        return sb.toString();
    }

    private String over(SQLOver over) {
        List<String> parts = new ArrayList<>();
        List<SQLExpr> partitionBy = over.getPartitionBy();
        if (partitionBy != null && !partitionBy.isEmpty()) {
            parts.add("PARTITION BY " + joinArgs(partitionBy));
        }
        SQLOrderBy orderBy = over.getOrderBy();
        if (orderBy != null && orderBy.getItems() != null && !orderBy.getItems().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (SQLSelectOrderByItem item : orderBy.getItems()) {
                String text = rehydrate(item.getExpr());
                if (item.getType() != null) {
                    text += " " + item.getType().name();
                }
                items.add(text);
            }
            parts.add("ORDER BY " + String.join(", ", items));
        }
        return "OVER(" + String.join(" ", parts) + ")";
    }

    private String caseWhen(SQLCaseExpr c) {
        StringBuilder sb = new StringBuilder("CASE");
        if (c.getValueExpr() != null) {
            sb.append(" ").append(rehydrate(c.getValueExpr()));
        }
        for (SQLCaseExpr.Item item : c.getItems()) {
            sb.append(" WHEN ").append(rehydrate(item.getConditionExpr()))
                    .append(" THEN ").append(rehydrate(item.getValueExpr()));
        }
        if (c.getElseExpr() != null) {
            sb.append(" ELSE ").append(rehydrate(c.getElseExpr()));
        }
        return sb.append(" END").toString();
    }

    private String cast(SQLCastExpr c) {
        return "CAST(" + rehydrate(c.getExpr()) + " AS " + rehydrate(c.getDataType()) + ")";
    }

    private String functionName(SQLMethodInvokeExpr m) {
        if (m.getOwner() != null) {
            return rehydrate(m.getOwner()) + "." + m.getMethodName();
        }
        return m.getMethodName();
    }

    private String joinArgs(List<? extends SQLObject> args) {
        if (args == null || args.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>(args.size());
        for (SQLObject arg : args) {
            parts.add(rehydrate(arg));
        }
        return String.join(", ", parts);
    }

    private String quote(String text) {
        return "'" + (text == null ? "" : text.replace("'", "''")) + "'";
    }

    // 兜底：先尝试 unparse，失败或为空时返回占位文本
    private String unparse(SQLObject node) {
        String sql;
        try {
            sql = unparser.unparse(node);
        } catch (RuntimeException e) {
            log.debug("unparse 失败 {}: {}", node.getClass().getSimpleName(), e.getMessage());
            return COMPLEX_EXPRESSION;
        }
        if (StringUtils.isBlank(sql)) {
            return COMPLEX_EXPRESSION;
        }
        return sql.replaceAll("\\s+", " ").trim();
    }
}
