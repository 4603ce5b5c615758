package com.afsun.sqldiagram.core.util;

import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * SQL方言检测器
 * 输入以 T-SQL 为主；只有出现 MySQL 独有写法（反引号、# 注释等）时才切换，
 * 否则一律按 SQLServer 解析
 *
 * @author afsun
 */
@Slf4j
public class SqlDialectDetector {

    // 同时出现时以 T-SQL 为准，例如 "#temp" 临时表
    private static final String[] TSQL_MARKERS = {
            "[dbo]", "with (nolock)", " into #", "from #", "join #", "cross apply", "outer apply", "getdate("
    };

    private static final String[] MYSQL_MARKERS = {
            "`", "on duplicate key", "straight_join", "ifnull("
    };

    private SqlDialectDetector() {
    }

    /**
     * 检测SQL方言类型
     *
     * @param sql SQL文本
     * @return {@link DbType#mysql} 或默认的 {@link DbType#sqlserver}
     */
    public static DbType detect(String sql) {
        if (StringUtils.isBlank(sql)) {
            return DbType.sqlserver;
        }
        String s = sql.toLowerCase(Locale.ROOT);
        if (!StringUtils.containsAny(s, TSQL_MARKERS) && StringUtils.containsAny(s, MYSQL_MARKERS)) {
            log.debug("检测到MySQL方言特征");
            return DbType.mysql;
        }
        return DbType.sqlserver;
    }
}
