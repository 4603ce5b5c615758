package com.afsun.sqldiagram.core.parser;

import com.afsun.sqldiagram.core.exceptions.SqlParseFailedException;
import com.afsun.sqldiagram.core.util.SqlDialectDetector;
import com.afsun.sqldiagram.core.util.SqlTextUtils;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 基于 Druid 的SQL解析适配层。
 * <p>
 * 先移除注释后按原文解析；失败且允许清洗时，对清洗后的文本重试一次。
 *
 * @author afsun
 */
@Slf4j
public class DruidStatementParser {

    /**
     * @param sql               SQL脚本
     * @param dbType            方言，为 null 时按文本特征检测
     * @param sanitizeOnFailure 首次解析失败后是否清洗重试
     * @return 解析结果
     * @throws SqlParseFailedException 原文与清洗后的文本均无法解析
     */
    public ParsedSql parse(String sql, DbType dbType, boolean sanitizeOnFailure) {
        if (StringUtils.isBlank(sql)) {
            throw new SqlParseFailedException("", "SQL文本为空");
        }
        DbType dialect = dbType != null ? dbType : SqlDialectDetector.detect(sql);
        String cleaned = SqlTextUtils.stripComments(sql, dialect);
        try {
            return new ParsedSql(parseOrFail(cleaned, dialect), cleaned, dialect, false);
        } catch (RuntimeException first) {
            if (!sanitizeOnFailure) {
                throw new SqlParseFailedException(SqlTextUtils.shortSql(cleaned),
                        "SQL解析失败: {}", first.getMessage(), first);
            }
            log.debug("首次解析失败，清洗后重试: {}", first.getMessage());
            String sanitized = SqlTextUtils.sanitizeForParser(cleaned);
            try {
                return new ParsedSql(parseOrFail(sanitized, dialect), sanitized, dialect, true);
            } catch (RuntimeException second) {
                throw new SqlParseFailedException(SqlTextUtils.shortSql(sanitized),
                        "SQL解析失败(已清洗重试): {}", second.getMessage(), second);
            }
        }
    }

    private List<SQLStatement> parseOrFail(String sql, DbType dialect) {
        List<SQLStatement> statements = SQLUtils.parseStatements(sql, dialect);
        if (statements == null || statements.isEmpty()) {
            throw new IllegalStateException("未解析出任何语句");
        }
        return statements;
    }
}
