package com.afsun.sqldiagram.core.exceptions;

import lombok.Getter;

/**
 * 流程图生成异常基类
 * 提供统一的错误码、建议方案与SQL片段信息
 *
 * @author afsun
 */
@Getter
public class DiagramException extends RuntimeException {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误详情
     */
    private final String errorDetail;

    /**
     * 建议解决方案
     */
    private final String suggestion;

    /**
     * SQL片段（可选）
     */
    private final String sqlFragment;

    public DiagramException(String message) {
        this("DIAGRAM_ERROR", message, null, null, null);
    }

    public DiagramException(String message, Throwable cause) {
        this("DIAGRAM_ERROR", message, null, null, cause);
    }

    public DiagramException(String errorCode, String message, String suggestion, String sqlFragment, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorDetail = message;
        this.suggestion = suggestion;
        this.sqlFragment = sqlFragment;
    }

    /**
     * 获取格式化的错误信息
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode).append("] ").append(errorDetail);
        if (sqlFragment != null && !sqlFragment.isEmpty()) {
            sb.append("\nSQL片段: ").append(sqlFragment);
        }
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n建议: ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
