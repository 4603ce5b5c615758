package com.afsun.sqldiagram.core.render;

import com.afsun.sqldiagram.core.model.DiagramSpec;

/**
 * 将阶段序列渲染为流程图文本
 *
 * @author afsun
 */
public interface DiagramRenderer {

    /**
     * @param spec 阶段序列，为空时输出单节点错误图
     * @return 流程图文本；相同输入输出完全一致
     */
    String render(DiagramSpec spec);
}
