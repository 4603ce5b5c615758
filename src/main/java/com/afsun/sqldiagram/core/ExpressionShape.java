package com.afsun.sqldiagram.core;

import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLCaseExpr;
import com.alibaba.druid.sql.ast.expr.SQLCastExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLInListExpr;
import com.alibaba.druid.sql.ast.expr.SQLListExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLNumericLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLTextLiteralExpr;

/**
 * 表达式还原时识别的节点形态，其余一律归为 UNKNOWN
 */
public enum ExpressionShape {
    BINARY,
    COLUMN_REF,
    NUMBER,
    STRING,
    LIST,
    IN_LIST,
    AGGREGATE,
    FUNCTION,
    CASE,
    CAST,
    UNKNOWN;

    public static ExpressionShape of(SQLExpr expr) {
        if (expr instanceof SQLBinaryOpExpr) {
            return BINARY;
        }
        if (expr instanceof SQLIdentifierExpr || expr instanceof SQLPropertyExpr) {
            return COLUMN_REF;
        }
        if (expr instanceof SQLNumericLiteralExpr) {
            return NUMBER;
        }
        if (expr instanceof SQLTextLiteralExpr) {
            return STRING;
        }
        if (expr instanceof SQLListExpr) {
            return LIST;
        }
        if (expr instanceof SQLInListExpr) {
            return IN_LIST;
        }
        // SQLAggregateExpr 是 SQLMethodInvokeExpr 的子类，需先判断
        if (expr instanceof SQLAggregateExpr) {
            return AGGREGATE;
        }
        if (expr instanceof SQLMethodInvokeExpr) {
            return FUNCTION;
        }
        if (expr instanceof SQLCaseExpr) {
            return CASE;
        }
        if (expr instanceof SQLCastExpr) {
            return CAST;
        }
        return UNKNOWN;
    }
}
