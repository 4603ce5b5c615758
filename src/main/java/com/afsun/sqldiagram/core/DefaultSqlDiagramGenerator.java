package com.afsun.sqldiagram.core;

import com.afsun.sqldiagram.core.exceptions.SqlParseFailedException;
import com.afsun.sqldiagram.core.extract.StageExtractor;
import com.afsun.sqldiagram.core.model.DiagramSpec;
import com.afsun.sqldiagram.core.model.Stage;
import com.afsun.sqldiagram.core.parser.DruidStatementParser;
import com.afsun.sqldiagram.core.parser.ParsedSql;
import com.afsun.sqldiagram.core.render.DiagramRenderer;
import com.afsun.sqldiagram.core.render.MermaidDiagramRenderer;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class DefaultSqlDiagramGenerator implements SqlDiagramGenerator {

    private final DruidStatementParser parser = new DruidStatementParser();

    private final DiagramRenderer renderer;

    private final boolean sanitizeOnFailure;

    public DefaultSqlDiagramGenerator() {
        this(new MermaidDiagramRenderer(), true);
    }

    public DefaultSqlDiagramGenerator(DiagramRenderer renderer, boolean sanitizeOnFailure) {
        this.renderer = renderer;
        this.sanitizeOnFailure = sanitizeOnFailure;
    }

    @Override
    public DiagramResult generate(String sqlText, DbType dbType) {
        long startTime = System.currentTimeMillis();
        String traceId = "DG-" + System.currentTimeMillis();
        List<DiagramWarning> warns = new ArrayList<>();

        if (StringUtils.isBlank(sqlText)) {
            warns.add(DiagramWarning.of(DiagramWarning.EMPTY_INPUT,
                    "SQL文本为空", "input", "请提供 SELECT / SELECT INTO / INSERT ... SELECT 语句"));
            return buildResult(traceId, startTime, DiagramSpec.empty(), false, warns);
        }
        try {
            // 1. 解析（必要时清洗后重试）
            ParsedSql parsed = parser.parse(sqlText, dbType, sanitizeOnFailure);
            if (parsed.isSanitized()) {
                warns.add(DiagramWarning.of(DiagramWarning.SANITIZED_RETRY,
                        "原始SQL解析失败，已使用清洗后的SQL", "parser", "清洗会移除窗口子句与 AT TIME ZONE"));
            }
            log.debug("解析完成, traceId={}, 方言={}, 语句数={}",
                    traceId, parsed.getDbType(), parsed.getStatements().size());

            // 2. 提取阶段
            StageExtractor extractor = new StageExtractor(new DefaultExpressionRehydrator(parsed.getDbType()));
            List<Stage> stages = extractor.extract(parsed.getStatements(), warns);

            // 3. 构建结果（渲染在其中完成）
            return buildResult(traceId, startTime, new DiagramSpec(stages), parsed.isSanitized(), warns);
        } catch (SqlParseFailedException e) {
            log.warn("SQL解析失败, traceId={}: {}", traceId, e.getFormattedMessage());
            warns.add(DiagramWarning.of(DiagramWarning.PARSE_FAILED,
                    e.getErrorDetail(), e.getSqlFragment(), e.getSuggestion()));
        } catch (Exception e) {
            log.error("流程图生成发生未预期异常, traceId={}", traceId, e);
            warns.add(DiagramWarning.of(DiagramWarning.EXTRACTION_FAILED,
                    "流程图生成异常: " + e.getMessage(), "generator", "traceId=" + traceId));
        }
        return buildResult(traceId, startTime, DiagramSpec.empty(), false, warns);
    }

    /**
     * 渲染并构建结果对象
     */
    private DiagramResult buildResult(String traceId, long startTime, DiagramSpec spec,
                                      boolean sanitized, List<DiagramWarning> warns) {
        String mermaid;
        try {
            mermaid = renderer.render(spec);
        } catch (RuntimeException e) {
            log.error("流程图渲染失败, traceId={}", traceId, e);
            spec = DiagramSpec.empty();
            mermaid = MermaidDiagramRenderer.errorDiagram(MermaidDiagramRenderer.NO_STAGES);
        }
        long elapsed = System.currentTimeMillis() - startTime;

        DiagramResult result = new DiagramResult();
        result.setTraceId(traceId);
        result.setSpec(spec);
        result.setMermaid(mermaid);
        result.setWarnings(warns);
        result.setSanitized(sanitized);
        result.setParseMillis(elapsed);

        log.info("流程图生成完成, traceId={}, 阶段={}, 警告={}, 清洗={}, 耗时={}ms",
                traceId, spec.getStages().size(), warns.size(), sanitized, elapsed);
        return result;
    }
}
