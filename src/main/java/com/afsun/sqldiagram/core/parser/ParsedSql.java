package com.afsun.sqldiagram.core.parser;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Data;

import java.util.List;

/**
 * 一次解析的结果：语句列表及实际用于解析的SQL
 */
@Data
public class ParsedSql {
    private final List<SQLStatement> statements;
    /** 实际交给解析器的SQL（去注释，可能已清洗） */
    private final String sqlUsed;
    private final DbType dbType;
    private final boolean sanitized;
}
