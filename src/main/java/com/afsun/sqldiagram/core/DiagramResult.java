package com.afsun.sqldiagram.core;

import com.afsun.sqldiagram.core.model.DiagramSpec;
import lombok.Data;

import java.util.List;

@Data
public class DiagramResult {
    private DiagramSpec spec;
    private String mermaid;
    private List<DiagramWarning> warnings;
    /** 是否使用了清洗后的SQL完成解析 */
    private boolean sanitized;
    private String traceId;
    private long parseMillis;
}
