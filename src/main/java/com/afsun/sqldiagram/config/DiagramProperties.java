package com.afsun.sqldiagram.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 流程图生成配置
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "sql.diagram")
public class DiagramProperties {

    /**
     * SQL方言，如 sqlserver、mysql；为空时按SQL文本自动检测
     */
    private String dialect;

    /**
     * 首次解析失败后是否清洗SQL重试
     */
    private boolean sanitizeOnFailure = true;

    /**
     * 命令行模式下读取的SQL文件
     */
    private String input;

    /**
     * 命令行模式下写出的流程图文件，为空时输出到日志
     */
    private String output;
}
