package com.afsun.sqldiagram.core.model;

/**
 * 阶段类型
 */
public enum StageKind {
    /** WITH 子句中的公用表表达式 */
    CTE,
    /** SELECT ... INTO 生成的临时表 */
    TEMP_TABLE,
    /** INSERT INTO ... SELECT 写入的临时表 */
    TEMP_TABLE_INSERT,
    /** 最终结果集 */
    FINAL_SELECT;

    /**
     * 图中展示用的名称，下划线替换为空格，如 TEMP TABLE INSERT
     */
    public String label() {
        return name().replace('_', ' ');
    }
}
