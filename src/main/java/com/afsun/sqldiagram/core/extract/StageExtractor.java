package com.afsun.sqldiagram.core.extract;

import com.afsun.sqldiagram.core.DiagramWarning;
import com.afsun.sqldiagram.core.ExpressionRehydrator;
import com.afsun.sqldiagram.core.extract.visitor.AliasMappingVisitor;
import com.afsun.sqldiagram.core.extract.visitor.DependencyCollectingVisitor;
import com.afsun.sqldiagram.core.model.Stage;
import com.afsun.sqldiagram.core.model.StageKind;
import com.afsun.sqldiagram.core.util.IdentifierCanonicalizer;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLUnionQuery;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 阶段提取器：发现 CTE、临时表与最终 SELECT，提取子句并推断阶段间依赖。
 * <p>
 * 流程：
 * <ol>
 *     <li>按语句顺序发现阶段：先 WITH 中的 CTE（声明顺序），再语句本身</li>
 *     <li>建立 规范名 -> 原始名 的阶段名集合</li>
 *     <li>逐阶段提取子句，并通过访问器收集别名与依赖</li>
 * </ol>
 *
 * @author afsun
 */
@Slf4j
public class StageExtractor {

    public static final String FINAL_SELECT_NAME = "Final SELECT";

    private final ClauseExtractor clauseExtractor;

    public StageExtractor(ExpressionRehydrator rehydrator) {
        this.clauseExtractor = new ClauseExtractor(rehydrator);
    }

    /**
     * 从语句列表提取有序阶段
     *
     * @param statements Druid 解析得到的语句
     * @param warns      警告收集，可为 null
     * @return 有序阶段；发现阶段失败时返回空列表
     */
    public List<Stage> extract(List<SQLStatement> statements, List<DiagramWarning> warns) {
        if (statements == null || statements.isEmpty()) {
            return Collections.emptyList();
        }
        List<DiagramWarning> sink = warns != null ? warns : new ArrayList<>();

        // 1) 发现阶段
        List<StageSource> sources;
        try {
            sources = discover(statements, sink);
        } catch (RuntimeException e) {
            log.error("阶段发现失败: {}", e.getMessage(), e);
            sink.add(DiagramWarning.of(DiagramWarning.EXTRACTION_FAILED,
                    "阶段发现失败: " + e.getMessage(), "StageExtractor", "请简化SQL后重试"));
            return Collections.emptyList();
        }

        // 2) 阶段名集合
        Map<String, String> stageNames = new LinkedHashMap<>();
        for (StageSource src : sources) {
            String canonical = IdentifierCanonicalizer.canonicalize(src.stage.getName());
            if (canonical != null) {
                stageNames.put(canonical, src.stage.getName());
            }
        }

        // 3) 逐阶段提取子句与依赖
        List<Stage> stages = new ArrayList<>(sources.size());
        for (StageSource src : sources) {
            populate(src, stageNames, sink);
            stages.add(src.stage);
        }
        log.debug("提取阶段完成: 数量={} 阶段名={}", stages.size(), stageNames.values());
        return stages;
    }

    private List<StageSource> discover(List<SQLStatement> statements, List<DiagramWarning> warns) {
        List<StageSource> sources = new ArrayList<>();
        for (SQLStatement st : statements) {
            if (st instanceof SQLSelectStatement) {
                SQLSelect select = ((SQLSelectStatement) st).getSelect();
                if (select == null) {
                    continue;
                }
                addCtes(select.getWithSubQuery(), sources);
                SQLSelectQuery query = select.getQuery();
                SQLExprTableSource into = intoOf(query);
                if (into == null) {
                    add(sources, FINAL_SELECT_NAME, StageKind.FINAL_SELECT, query);
                } else {
                    addTarget(sources, into, StageKind.TEMP_TABLE, query, warns);
                }
                continue;
            }
            if (st instanceof SQLInsertStatement) {
                SQLInsertStatement insert = (SQLInsertStatement) st;
                addCtes(insert.getWith(), sources);
                SQLSelectQuery query = null;
                if (insert.getQuery() != null) {
                    if (insert.getQuery().getWithSubQuery() != insert.getWith()) {
                        addCtes(insert.getQuery().getWithSubQuery(), sources);
                    }
                    query = insert.getQuery().getQuery();
                }
                // INSERT ... VALUES 没有查询体，阶段保留但无子句
                addTarget(sources, insert.getTableSource(), StageKind.TEMP_TABLE_INSERT, query, warns);
                continue;
            }
            warns.add(DiagramWarning.of(DiagramWarning.UNSUPPORTED_STATEMENT,
                    "不支持的语句类型: " + st.getClass().getSimpleName(),
                    positionOf(st), "仅 SELECT、SELECT INTO 与 INSERT ... SELECT 会生成阶段"));
            log.debug("跳过语句: {}", st.getClass().getSimpleName());
        }
        for (int i = 0; i < sources.size(); i++) {
            sources.get(i).stage.setId("S" + i);
        }
        return sources;
    }

    private void addCtes(SQLWithSubqueryClause with, List<StageSource> sources) {
        if (with == null || with.getEntries() == null) {
            return;
        }
        for (SQLWithSubqueryClause.Entry entry : with.getEntries()) {
            String name = IdentifierCanonicalizer.extractRawIdentifier(entry);
            if (name == null) {
                continue;
            }
            SQLSelect sub = entry.getSubQuery();
            add(sources, name, StageKind.CTE, sub == null ? null : sub.getQuery());
        }
    }

    private void addTarget(List<StageSource> sources, SQLExprTableSource target, StageKind kind,
                           SQLSelectQuery query, List<DiagramWarning> warns) {
        String name = IdentifierCanonicalizer.extractRawIdentifier(target);
        if (IdentifierCanonicalizer.canonicalize(name) == null) {
            warns.add(DiagramWarning.of(DiagramWarning.UNNAMED_TARGET,
                    "无法识别写入目标名称，按最终 SELECT 处理", kind.name(), "请检查 INTO/INSERT 目标"));
            add(sources, FINAL_SELECT_NAME, StageKind.FINAL_SELECT, query);
            return;
        }
        add(sources, name, kind, query);
    }

    private void add(List<StageSource> sources, String name, StageKind kind, SQLSelectQuery query) {
        sources.add(new StageSource(new Stage(null, name, kind), query));
    }

    // SELECT ... INTO 目标；UNION 时取首个分支的 INTO
    private SQLExprTableSource intoOf(SQLSelectQuery query) {
        if (query instanceof SQLSelectQueryBlock) {
            return ((SQLSelectQueryBlock) query).getInto();
        }
        if (query instanceof SQLUnionQuery) {
            return intoOf(((SQLUnionQuery) query).getLeft());
        }
        return null;
    }

    private void populate(StageSource src, Map<String, String> stageNames, List<DiagramWarning> warns) {
        Stage stage = src.stage;
        if (src.query == null) {
            return;
        }
        StageScope scope = new StageScope(stageNames, IdentifierCanonicalizer.canonicalize(stage.getName()));
        try {
            clauseExtractor.extract(src.query, stage, warns);
            src.query.accept(new AliasMappingVisitor(scope));
            src.query.accept(new DependencyCollectingVisitor(scope));
        } catch (RuntimeException e) {
            log.warn("阶段 {} 提取失败: {}", stage.getName(), e.getMessage());
            warns.add(DiagramWarning.of(DiagramWarning.EXTRACTION_FAILED,
                    "阶段提取不完整: " + stage.getName(), positionOf(src.query), e.getMessage()));
        }
        stage.getDependencies().addAll(scope.getDependencies());
        log.debug("阶段 {}({}) 子句={} 依赖={}", stage.getId(), stage.getName(),
                stage.orderedClauses().size(), stage.getDependencies());
    }

    private String positionOf(Object ast) {
        return ast.getClass().getSimpleName();
    }

    // 阶段及其子句所在的查询体
    private static final class StageSource {
        private final Stage stage;
        private final SQLSelectQuery query;

        private StageSource(Stage stage, SQLSelectQuery query) {
            this.stage = stage;
            this.query = query;
        }
    }
}
