package com.afsun.sqldiagram.core.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 查询中的一个逻辑阶段：CTE、临时表或最终 SELECT
 *
 * @author afsun
 */
@Data
public class Stage {
    /** S0, S1, ... 按发现顺序分配 */
    private String id;
    private final String name;
    private final StageKind kind;
    private final List<ClauseItem> fromItems = new ArrayList<>();
    private final List<ClauseItem> joinItems = new ArrayList<>();
    private final List<ClauseItem> whereItems = new ArrayList<>();
    private final List<ClauseItem> groupByItems = new ArrayList<>();
    /** 依赖的其他阶段的规范名，不含自身 */
    private final Set<String> dependencies = new LinkedHashSet<>();

    public Stage(String id, String name, StageKind kind) {
        this.id = id;
        this.name = name;
        this.kind = kind;
    }

    public void addClause(ClauseItem item) {
        switch (item.getCategory()) {
            case FROM:
                fromItems.add(item);
                break;
            case JOIN:
                joinItems.add(item);
                break;
            case WHERE:
                whereItems.add(item);
                break;
            case GROUP_BY:
                groupByItems.add(item);
                break;
            default:
                throw new IllegalArgumentException("未知子句类别: " + item.getCategory());
        }
    }

    /**
     * 按 FROM、JOIN、WHERE、GROUP BY 顺序返回全部子句
     */
    public List<ClauseItem> orderedClauses() {
        List<ClauseItem> all = new ArrayList<>(fromItems.size() + joinItems.size()
                + whereItems.size() + groupByItems.size());
        all.addAll(fromItems);
        all.addAll(joinItems);
        all.addAll(whereItems);
        all.addAll(groupByItems);
        return all;
    }

    /**
     * 子图标签，如 "recent (CTE)"（未转义）
     */
    public String label() {
        return name + " (" + kind.label() + ")";
    }
}
