package com.afsun.sqldiagram.core.extract;

import com.afsun.sqldiagram.core.DefaultExpressionRehydrator;
import com.afsun.sqldiagram.core.DiagramWarning;
import com.afsun.sqldiagram.core.model.ClauseItem;
import com.afsun.sqldiagram.core.model.Stage;
import com.afsun.sqldiagram.core.model.StageKind;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StageExtractorTest {

    private StageExtractor extractor;
    private List<DiagramWarning> warns;

    @BeforeEach
    void setUp() {
        extractor = new StageExtractor(new DefaultExpressionRehydrator(DbType.sqlserver));
        warns = new ArrayList<>();
    }

    private List<Stage> extract(String sql) {
        return extractor.extract(SQLUtils.parseStatements(sql, DbType.sqlserver), warns);
    }

    private List<String> sqlOf(List<ClauseItem> items) {
        return items.stream().map(ClauseItem::getSql).collect(Collectors.toList());
    }

    @Test
    void testCteThenFinalSelect() {
        List<Stage> stages = extract("WITH recent AS (SELECT id FROM orders WHERE amount > 100) "
                + "SELECT r.id FROM recent r");

        assertEquals(2, stages.size());
        Stage cte = stages.get(0);
        assertEquals("S0", cte.getId());
        assertEquals("recent", cte.getName());
        assertEquals(StageKind.CTE, cte.getKind());
        assertEquals(Collections.singletonList("orders"), sqlOf(cte.getFromItems()));
        assertEquals(Collections.singletonList("amount > 100"), sqlOf(cte.getWhereItems()));
        assertTrue(cte.getDependencies().isEmpty());

        Stage last = stages.get(1);
        assertEquals("S1", last.getId());
        assertEquals(StageExtractor.FINAL_SELECT_NAME, last.getName());
        assertEquals(StageKind.FINAL_SELECT, last.getKind());
        assertEquals(Collections.singletonList("recent r"), sqlOf(last.getFromItems()));
        assertEquals(Collections.singleton("recent"), last.getDependencies());
    }

    @Test
    void testCteChainKeepsDeclarationOrder() {
        List<Stage> stages = extract("WITH a AS (SELECT * FROM base), b AS (SELECT * FROM a) SELECT * FROM b");

        assertEquals(3, stages.size());
        assertEquals("a", stages.get(0).getName());
        assertEquals("b", stages.get(1).getName());
        assertTrue(stages.get(0).getDependencies().isEmpty());
        assertEquals(Collections.singleton("a"), stages.get(1).getDependencies());
        assertEquals(Collections.singleton("b"), stages.get(2).getDependencies());
    }

    @Test
    void testSelectIntoThenSelectFromTempTable() {
        List<Stage> stages = extract("SELECT region, SUM(amount) AS total INTO #agg FROM sales GROUP BY region; "
                + "SELECT a.region FROM #agg a WHERE a.total > 10");

        assertEquals(2, stages.size());
        Stage temp = stages.get(0);
        assertEquals("#agg", temp.getName());
        assertEquals(StageKind.TEMP_TABLE, temp.getKind());
        assertEquals(Collections.singletonList("sales"), sqlOf(temp.getFromItems()));
        assertEquals(Collections.singletonList("region"), sqlOf(temp.getGroupByItems()));
        assertTrue(temp.getDependencies().isEmpty());

        Stage last = stages.get(1);
        assertEquals(StageKind.FINAL_SELECT, last.getKind());
        assertEquals(Collections.singleton("#agg"), last.getDependencies());
        assertEquals(Collections.singletonList("a.total > 10"), sqlOf(last.getWhereItems()));
    }

    @Test
    void testInsertSelectAndInsertValues() {
        List<Stage> stages = extract("INSERT INTO #t (id) SELECT id FROM src WHERE id > 0; "
                + "INSERT INTO #v (id) VALUES (1)");

        assertEquals(2, stages.size());
        assertEquals("#t", stages.get(0).getName());
        assertEquals(StageKind.TEMP_TABLE_INSERT, stages.get(0).getKind());
        assertEquals(Collections.singletonList("src"), sqlOf(stages.get(0).getFromItems()));

        assertEquals("#v", stages.get(1).getName());
        assertEquals(StageKind.TEMP_TABLE_INSERT, stages.get(1).getKind());
        assertTrue(stages.get(1).orderedClauses().isEmpty());
    }

    @Test
    void testJoinsNormalized() {
        List<Stage> stages = extract("SELECT c.id FROM customers c "
                + "JOIN orders o ON o.customer_id = c.id "
                + "LEFT JOIN payments p ON p.order_id = o.id "
                + "WHERE c.active = 1 AND (o.status = 'A' OR o.status = 'B') "
                + "GROUP BY c.id, c.region");

        assertEquals(1, stages.size());
        Stage stage = stages.get(0);
        assertEquals(Collections.singletonList("customers c"), sqlOf(stage.getFromItems()));
        assertEquals(2, stage.getJoinItems().size());
        assertEquals("INNER JOIN orders o ON o.customer_id = c.id", stage.getJoinItems().get(0).getSql());
        assertEquals("LEFT JOIN payments p ON p.order_id = o.id", stage.getJoinItems().get(1).getSql());
        assertEquals(2, stage.getWhereItems().size());
        assertEquals("c.active = 1", stage.getWhereItems().get(0).getSql());
        assertEquals("o.status = 'A' OR o.status = 'B'", stage.getWhereItems().get(1).getSql());
        assertEquals(2, stage.getGroupByItems().size());
        assertTrue(stage.getDependencies().isEmpty());
    }

    @Test
    void testJoinConditionKeepsParentheses() {
        List<Stage> stages = extract("SELECT t1.a FROM t1 JOIN t2 ON t1.a = t2.a AND (t1.b = 1 OR t2.c = 2) "
                + "WHERE a - (b - c) = 0");

        Stage stage = stages.get(0);
        assertEquals(Collections.singletonList("INNER JOIN t2 ON t1.a = t2.a AND (t1.b = 1 OR t2.c = 2)"),
                sqlOf(stage.getJoinItems()));
        assertEquals(Collections.singletonList("a - (b - c) = 0"), sqlOf(stage.getWhereItems()));
    }

    @Test
    void testNestedJoinTargetParenthesized() {
        List<Stage> stages = extract("SELECT t1.a FROM t1 JOIN (t2 JOIN t3 ON t2.a = t3.a) ON t1.a = t2.a");

        Stage stage = stages.get(0);
        assertEquals(Collections.singletonList("t1"), sqlOf(stage.getFromItems()));
        assertEquals(Collections.singletonList("INNER JOIN (t2 INNER JOIN t3 ON t2.a = t3.a) ON t1.a = t2.a"),
                sqlOf(stage.getJoinItems()));
    }

    @Test
    void testWhereConjunctsSplitInOrder() {
        List<Stage> stages = extract("SELECT x FROM t WHERE a = 1 AND b = 2 AND c = 3");

        assertEquals(Arrays.asList("a = 1", "b = 2", "c = 3"), sqlOf(stages.get(0).getWhereItems()));
    }

    @Test
    void testGroupByRollupKeptAsOneItem() {
        List<Stage> stages = extract("SELECT c.region, c.city, COUNT(*) FROM customers c "
                + "GROUP BY ROLLUP(c.region, c.city)");

        assertEquals(Collections.singletonList("ROLLUP(c.region, c.city)"), sqlOf(stages.get(0).getGroupByItems()));
    }

    @Test
    void testDerivedTableOverCte() {
        List<Stage> stages = extract("WITH src AS (SELECT id FROM raw_events), "
                + "final AS (SELECT t.id FROM (SELECT id FROM src) t) "
                + "SELECT * FROM final");

        assertEquals(3, stages.size());
        Stage fin = stages.get(1);
        assertEquals("final", fin.getName());
        assertEquals(Collections.singletonList("(SELECT ...) t"), sqlOf(fin.getFromItems()));
        assertEquals(Collections.singleton("src"), fin.getDependencies());
        assertEquals(Collections.singleton("final"), stages.get(2).getDependencies());
    }

    @Test
    void testCommaJoinYieldsFromItems() {
        List<Stage> stages = extract("SELECT a.id FROM t1 a, t2 b WHERE a.id = b.id");

        assertEquals(2, stages.get(0).getFromItems().size());
        assertEquals("t1 a", stages.get(0).getFromItems().get(0).getSql());
        assertEquals("t2 b", stages.get(0).getFromItems().get(1).getSql());
        assertTrue(stages.get(0).getJoinItems().isEmpty());
    }

    @Test
    void testDependencyInsideNestedSubqueries() {
        List<Stage> stages = extract("WITH big AS (SELECT id FROM orders), "
                + "vip AS (SELECT id FROM customers) "
                + "SELECT d.id FROM (SELECT x.id FROM (SELECT id FROM vip) x) d "
                + "WHERE d.id IN (SELECT id FROM big)");

        assertEquals(3, stages.size());
        Stage last = stages.get(2);
        assertEquals(Collections.singletonList("(SELECT ...) d"), sqlOf(last.getFromItems()));
        assertTrue(last.getDependencies().contains("big"));
        assertTrue(last.getDependencies().contains("vip"));
        assertEquals(2, last.getDependencies().size());
    }

    @Test
    void testSchemaQualifiedReferenceMatchesStage() {
        List<Stage> stages = extract("SELECT id INTO #stage FROM src; SELECT s.id FROM dbo.[#stage] s");

        assertEquals(Collections.singleton("#stage"), stages.get(1).getDependencies());
    }

    @Test
    void testUnionBranchesAllContribute() {
        List<Stage> stages = extract("SELECT x FROM t1 WHERE x > 1 UNION ALL SELECT x FROM t2");

        assertEquals(1, stages.size());
        assertEquals(2, stages.get(0).getFromItems().size());
        assertEquals("t1", stages.get(0).getFromItems().get(0).getSql());
        assertEquals("t2", stages.get(0).getFromItems().get(1).getSql());
        assertEquals(Collections.singletonList("x > 1"), sqlOf(stages.get(0).getWhereItems()));
    }

    @Test
    void testUnsupportedStatementAddsNoStage() {
        List<Stage> stages = extract("UPDATE t SET a = 1 WHERE b = 2");

        assertTrue(stages.isEmpty());
        assertEquals(1, warns.size());
        assertEquals(DiagramWarning.UNSUPPORTED_STATEMENT, warns.get(0).getCategory());
    }

    @Test
    void testSelfReferenceExcluded() {
        List<Stage> stages = extract("INSERT INTO #t (id) SELECT id FROM #t WHERE id > 1");

        assertEquals(1, stages.size());
        assertTrue(stages.get(0).getDependencies().isEmpty());
    }

    @Test
    void testEmptyInput() {
        assertTrue(extractor.extract(null, warns).isEmpty());
        assertTrue(extractor.extract(Collections.emptyList(), null).isEmpty());
    }
}
