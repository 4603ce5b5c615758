package com.afsun.sqldiagram.core;

import com.alibaba.druid.sql.ast.SQLObject;

/**
 * SQL表达式还原器
 *
 * @author afsun
 */
public interface ExpressionRehydrator {

    /** 无法还原时的固定占位文本 */
    String COMPLEX_EXPRESSION = "[Complex Expression]";

    /**
     * 将表达式AST还原为SQL文本
     *
     * @param node 表达式节点，可为 null
     * @return SQL文本；null 返回空串，无法还原返回 {@link #COMPLEX_EXPRESSION}，不抛异常
     */
    String rehydrate(SQLObject node);
}
