package com.afsun.sqldiagram.core.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次请求提取出的阶段序列，顺序即发现顺序
 */
@Data
public class DiagramSpec {
    private final List<Stage> stages;

    public DiagramSpec(List<Stage> stages) {
        this.stages = stages == null ? new ArrayList<>() : new ArrayList<>(stages);
    }

    public static DiagramSpec empty() {
        return new DiagramSpec(Collections.emptyList());
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }
}
