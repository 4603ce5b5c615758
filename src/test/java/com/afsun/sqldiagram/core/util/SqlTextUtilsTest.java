package com.afsun.sqldiagram.core.util;

import com.alibaba.druid.DbType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlTextUtilsTest {

    @Test
    void testLineCommentRemovedLiteralKept() {
        String sql = "SELECT * FROM #t -- note\nWHERE a = '--x'";
        assertEquals("SELECT * FROM #t \nWHERE a = '--x'", SqlTextUtils.stripComments(sql, DbType.sqlserver));
    }

    @Test
    void testBlockComment() {
        assertEquals("SELECT   1", SqlTextUtils.stripComments("SELECT /* x */ 1", DbType.sqlserver));
    }

    @Test
    void testHashIsCommentOnlyForMysql() {
        String sql = "SELECT id FROM #stage # trailing\nWHERE id > 0";
        assertEquals(sql, SqlTextUtils.stripComments(sql, DbType.sqlserver));
        assertEquals("SELECT id FROM \nWHERE id > 0", SqlTextUtils.stripComments(sql, DbType.mysql));
    }

    @Test
    void testSanitizeCteSchemaQualifiers() {
        String sql = "WITH [dbo].recent AS (SELECT 1 AS x), dbo.other AS (SELECT 2 AS y)\n SELECT * FROM recent";
        assertEquals("WITH recent AS (SELECT 1 AS x), other AS (SELECT 2 AS y) SELECT * FROM recent",
                SqlTextUtils.sanitizeForParser(sql));
    }

    @Test
    void testSanitizeWindowAndTimeZone() {
        assertEquals("SELECT SUM(a) AS s FROM t",
                SqlTextUtils.sanitizeForParser("SELECT SUM(a) OVER (PARTITION BY b) AS s FROM t"));
        assertEquals("SELECT ts FROM t",
                SqlTextUtils.sanitizeForParser("SELECT ts AT TIME ZONE 'UTC' FROM t"));
    }

    @Test
    void testShortSql() {
        assertEquals("SELECT 1 FROM t", SqlTextUtils.shortSql("SELECT 1\n  FROM t"));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            sb.append("col").append(i).append(", ");
        }
        String s = SqlTextUtils.shortSql(sb.toString());
        assertTrue(s.contains(" ... "));
        assertEquals(205, s.length());
    }
}
