package com.afsun.sqldiagram.core.model;

import lombok.Data;

/**
 * 阶段中的一个子句条目，sql 为还原后的原样文本
 */
@Data
public class ClauseItem {
    private final ClauseCategory category;
    private final String sql;

    private ClauseItem(ClauseCategory category, String sql) {
        this.category = category;
        this.sql = sql;
    }

    public static ClauseItem of(ClauseCategory category, String sql) {
        return new ClauseItem(category, sql);
    }

    /**
     * 节点标签，如 "WHERE: a = 1"（未转义）
     */
    public String label() {
        return category.getPrefix() + " " + sql;
    }
}
