package com.afsun.sqldiagram.core.exceptions;

import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

/**
 * SQL文本无法被解析为AST（原文与清洗后的文本均失败）
 *
 * @author afsun
 */
public class SqlParseFailedException extends DiagramException {

    public static final String ERROR_CODE = "SQL_PARSE_FAILED";

    /**
     * @param sqlFragment 出错的SQL片段（已截断）
     * @param message     支持 {} 占位符，最后一个参数若为 Throwable 则作为 cause
     */
    public SqlParseFailedException(String sqlFragment, String message, Object... args) {
        super(ERROR_CODE,
                MessageFormatter.arrayFormat(message, trimLastThrowable(args)).getMessage(),
                "请检查SQL语法，或拆分为更简单的语句",
                sqlFragment,
                extractThrowable(args));
    }

    private static Throwable extractThrowable(Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return null;
        }
        Object last = args[args.length - 1];
        if (last instanceof Throwable) {
            return (Throwable) last;
        }
        return null;
    }

    private static Object[] trimLastThrowable(Object[] args) {
        if (ArrayUtils.isEmpty(args) || extractThrowable(args) == null) {
            return args;
        }
        return ArrayUtils.remove(args, args.length - 1);
    }
}
