package com.afsun.sqldiagram.core.extract;

import com.afsun.sqldiagram.core.DiagramWarning;
import com.afsun.sqldiagram.core.ExpressionRehydrator;
import com.afsun.sqldiagram.core.model.ClauseCategory;
import com.afsun.sqldiagram.core.model.ClauseItem;
import com.afsun.sqldiagram.core.model.Stage;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExprGroup;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelectGroupByClause;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUnionQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 提取单个阶段的结构化子句：FROM、JOIN、WHERE、GROUP BY。
 * <p>
 * 子句文本统一经 {@link ExpressionRehydrator} 还原；UNION 的每个分支按顺序贡献子句。
 *
 * @author afsun
 */
@Slf4j
public class ClauseExtractor {

    static final String DERIVED_TABLE = "(SELECT ...)";

    private final ExpressionRehydrator rehydrator;

    public ClauseExtractor(ExpressionRehydrator rehydrator) {
        this.rehydrator = rehydrator;
    }

    /**
     * 将查询的子句追加到阶段
     *
     * @param query 阶段的查询体，可为 null（如 INSERT ... VALUES）
     * @param stage 目标阶段
     * @param warns 警告收集
     */
    public void extract(SQLSelectQuery query, Stage stage, List<DiagramWarning> warns) {
        if (query == null) {
            return;
        }
        if (query instanceof SQLSelectQueryBlock) {
            extractBlock((SQLSelectQueryBlock) query, stage, warns);
            return;
        }
        if (query instanceof SQLUnionQuery) {
            SQLUnionQuery union = (SQLUnionQuery) query;
            extract(union.getLeft(), stage, warns);
            extract(union.getRight(), stage, warns);
            return;
        }
        log.debug("阶段 {} 的查询结构未展开: {}", stage.getName(), query.getClass().getSimpleName());
    }

    private void extractBlock(SQLSelectQueryBlock qb, Stage stage, List<DiagramWarning> warns) {
        // 1) FROM / JOIN：按源码顺序展开连接树
        flattenFrom(qb.getFrom(), stage, warns);

        // 2) WHERE：AND 拆分，OR 整体保留
        List<SQLExpr> predicates = new ArrayList<>();
        flattenAnd(qb.getWhere(), predicates);
        for (SQLExpr p : predicates) {
            add(stage, ClauseCategory.WHERE, p, warns);
        }

        // 3) GROUP BY
        SQLSelectGroupByClause groupBy = qb.getGroupBy();
        if (groupBy != null && groupBy.getItems() != null && !groupBy.getItems().isEmpty()) {
            String wrapper = groupingWrapper(groupBy);
            if (wrapper == null) {
                for (SQLExpr item : groupBy.getItems()) {
                    add(stage, ClauseCategory.GROUP_BY, item, warns);
                }
            } else {
                // ROLLUP(a, b) / CUBE(a, b) 作为一个整体
                List<String> items = new ArrayList<>();
                for (SQLExpr item : groupBy.getItems()) {
                    items.add(text(item, groupBy, warns));
                }
                stage.addClause(ClauseItem.of(ClauseCategory.GROUP_BY,
                        wrapper + "(" + String.join(", ", items) + ")"));
            }
        }
    }

    static String groupingWrapper(SQLSelectGroupByClause groupBy) {
        if (groupBy.isWithRollUp()) {
            return "ROLLUP";
        }
        if (groupBy.isWithCube()) {
            return "CUBE";
        }
        return null;
    }

    private void flattenFrom(SQLTableSource from, Stage stage, List<DiagramWarning> warns) {
        if (from == null) {
            return;
        }
        if (from instanceof SQLJoinTableSource) {
            SQLJoinTableSource join = (SQLJoinTableSource) from;
            flattenFrom(join.getLeft(), stage, warns);
            if (join.getJoinType() == SQLJoinTableSource.JoinType.COMMA) {
                flattenFrom(join.getRight(), stage, warns);
            } else {
                stage.addClause(ClauseItem.of(ClauseCategory.JOIN, joinText(join, warns)));
            }
            return;
        }
        stage.addClause(ClauseItem.of(ClauseCategory.FROM, tableSourceText(from, warns)));
    }

    // INNER JOIN orders o ON c.id = o.customer_id
    private String joinText(SQLJoinTableSource join, List<DiagramWarning> warns) {
        StringBuilder sb = new StringBuilder();
        sb.append(joinKeyword(join.getJoinType())).append(" ").append(tableSourceText(join.getRight(), warns));
        if (join.getCondition() != null) {
            sb.append(" ON ").append(text(join.getCondition(), join, warns));
        } else if (join.getUsing() != null && !join.getUsing().isEmpty()) {
            List<String> cols = new ArrayList<>();
            for (SQLExpr u : join.getUsing()) {
                cols.add(text(u, join, warns));
            }
            sb.append(" USING (").append(String.join(", ", cols)).append(")");
        }
        return sb.toString();
    }

    // 括号内的嵌套连接：t2 INNER JOIN t3 ON t2.a = t3.a
    private String nestedJoinText(SQLJoinTableSource join, List<DiagramWarning> warns) {
        SQLTableSource l = join.getLeft();
        String left = l instanceof SQLJoinTableSource && l.getAlias() == null
                ? nestedJoinText((SQLJoinTableSource) l, warns) : tableSourceText(l, warns);
        if (join.getJoinType() == SQLJoinTableSource.JoinType.COMMA) {
            return left + ", " + tableSourceText(join.getRight(), warns);
        }
        return left + " " + joinText(join, warns);
    }

    static String joinKeyword(SQLJoinTableSource.JoinType type) {
        if (type == null || type == SQLJoinTableSource.JoinType.JOIN) {
            return "INNER JOIN";
        }
        String keyword = type.name;
        // CROSS APPLY / OUTER APPLY 原样保留
        if (keyword.contains("JOIN") || keyword.contains("APPLY")) {
            return keyword;
        }
        return keyword + " JOIN";
    }

    private String tableSourceText(SQLTableSource ts, List<DiagramWarning> warns) {
        String body;
        if (ts instanceof SQLExprTableSource) {
            body = text(((SQLExprTableSource) ts).getExpr(), ts, warns);
        } else if (ts instanceof SQLSubqueryTableSource) {
            body = DERIVED_TABLE;
        } else if (ts instanceof SQLJoinTableSource) {
            body = "(" + nestedJoinText((SQLJoinTableSource) ts, warns) + ")";
        } else {
            // 表函数等交给还原器兜底
            return text(ts, ts, warns);
        }
        String alias = ts.getAlias();
        return alias == null ? body : body + " " + alias;
    }

    private void flattenAnd(SQLExpr expr, List<SQLExpr> out) {
        if (expr == null) {
            return;
        }
        if (expr instanceof SQLBinaryOpExpr
                && ((SQLBinaryOpExpr) expr).getOperator() == SQLBinaryOperator.BooleanAnd) {
            flattenAnd(((SQLBinaryOpExpr) expr).getLeft(), out);
            flattenAnd(((SQLBinaryOpExpr) expr).getRight(), out);
            return;
        }
        if (expr instanceof SQLBinaryOpExprGroup
                && ((SQLBinaryOpExprGroup) expr).getOperator() == SQLBinaryOperator.BooleanAnd) {
            for (SQLExpr item : ((SQLBinaryOpExprGroup) expr).getItems()) {
                flattenAnd(item, out);
            }
            return;
        }
        out.add(expr);
    }

    private void add(Stage stage, ClauseCategory category, SQLExpr expr, List<DiagramWarning> warns) {
        stage.addClause(ClauseItem.of(category, text(expr, expr, warns)));
    }

    private String text(SQLObject node, SQLObject position, List<DiagramWarning> warns) {
        String sql = rehydrator.rehydrate(node);
        if (sql.contains(ExpressionRehydrator.COMPLEX_EXPRESSION) && warns != null) {
            warns.add(DiagramWarning.of(DiagramWarning.COMPLEX_EXPRESSION,
                    "表达式无法还原，已使用占位文本", position.getClass().getSimpleName(),
                    "可简化该表达式或检查方言设置"));
        }
        return sql;
    }
}
