package com.afsun.sqldiagram.core;

import com.alibaba.druid.DbType;

/**
 * SQL流程图生成入口
 *
 * @author afsun
 */
public interface SqlDiagramGenerator {

    /**
     * 解析SQL文本，提取阶段并渲染流程图
     *
     * @param sqlText SQL脚本文本
     * @param dbType  方言，为 null 时自动检测
     * @return 生成结果；任何失败都体现为空阶段与错误图，不抛异常
     */
    DiagramResult generate(String sqlText, DbType dbType);
}
