package com.afsun.sqldiagram.core.model;

/**
 * 子句类别，声明顺序即节点在阶段子图中的输出顺序
 */
public enum ClauseCategory {
    FROM("FROM:"),
    JOIN("JOIN:"),
    WHERE("WHERE:"),
    GROUP_BY("GROUP BY:");

    private final String prefix;

    ClauseCategory(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
