package com.afsun.sqldiagram.service;

import com.afsun.sqldiagram.core.DiagramResult;

public interface SqlDiagramService {

    /**
     * 按配置的方言生成流程图
     */
    DiagramResult generate(String content);

    /**
     * @param dialect 方言名，如 sqlserver；为空时使用配置或自动检测
     */
    DiagramResult generate(String content, String dialect);
}
