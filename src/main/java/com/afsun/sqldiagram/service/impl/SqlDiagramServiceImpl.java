package com.afsun.sqldiagram.service.impl;

import com.afsun.sqldiagram.config.DiagramProperties;
import com.afsun.sqldiagram.core.DefaultSqlDiagramGenerator;
import com.afsun.sqldiagram.core.DiagramResult;
import com.afsun.sqldiagram.core.SqlDiagramGenerator;
import com.afsun.sqldiagram.core.render.MermaidDiagramRenderer;
import com.afsun.sqldiagram.service.SqlDiagramService;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.Locale;

/**
 * @author afsun
 */
@Service
@Slf4j
public class SqlDiagramServiceImpl implements SqlDiagramService {

    @Resource
    private DiagramProperties diagramProperties;

    @Override
    public DiagramResult generate(String content) {
        return generate(content, diagramProperties.getDialect());
    }

    @Override
    public DiagramResult generate(String content, String dialect) {
        SqlDiagramGenerator generator = new DefaultSqlDiagramGenerator(
                new MermaidDiagramRenderer(), diagramProperties.isSanitizeOnFailure());
        return generator.generate(content, toDbType(dialect));
    }

    // 无法识别的方言名按自动检测处理
    private DbType toDbType(String dialect) {
        if (StringUtils.isBlank(dialect)) {
            return null;
        }
        String name = dialect.trim().toLowerCase(Locale.ROOT);
        for (DbType dbType : DbType.values()) {
            if (dbType.name().equals(name)) {
                return dbType;
            }
        }
        log.warn("未知方言 {}，改为自动检测", dialect);
        return null;
    }
}
