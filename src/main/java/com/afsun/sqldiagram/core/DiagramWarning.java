package com.afsun.sqldiagram.core;

import lombok.Data;

/**
 * 生成过程中的非致命提示，随结果一并返回
 */
@Data
public class DiagramWarning {

    public static final String EMPTY_INPUT = "EMPTY_INPUT";
    public static final String PARSE_FAILED = "PARSE_FAILED";
    public static final String SANITIZED_RETRY = "SANITIZED_RETRY";
    public static final String UNSUPPORTED_STATEMENT = "UNSUPPORTED_STATEMENT";
    public static final String UNNAMED_TARGET = "UNNAMED_TARGET";
    public static final String COMPLEX_EXPRESSION = "COMPLEX_EXPRESSION";
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";

    private final String category;
    private final String summary;
    private final String position;
    private final String suggestion;

    private DiagramWarning(String category, String summary, String position, String suggestion) {
        this.category = category;
        this.summary = summary;
        this.position = position;
        this.suggestion = suggestion;
    }

    public static DiagramWarning of(String category, String summary, String position, String suggestion) {
        return new DiagramWarning(category, summary, position, suggestion);
    }
}
