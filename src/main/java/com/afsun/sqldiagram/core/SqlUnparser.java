package com.afsun.sqldiagram.core;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLObject;

/**
 * 将任意AST节点输出为SQL文本，用于还原器无法识别的节点形态
 */
@FunctionalInterface
public interface SqlUnparser {

    /**
     * @param node AST节点
     * @return SQL文本；失败时可抛出运行时异常或返回空
     */
    String unparse(SQLObject node);

    /**
     * 基于 Druid 输出访问器的默认实现
     */
    static SqlUnparser druid(DbType dbType) {
        return node -> SQLUtils.toSQLString(node, dbType);
    }
}
