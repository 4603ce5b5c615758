package com.afsun.sqldiagram.runner;

import com.afsun.sqldiagram.config.DiagramProperties;
import com.afsun.sqldiagram.core.DiagramResult;
import com.afsun.sqldiagram.core.DiagramWarning;
import com.afsun.sqldiagram.service.SqlDiagramService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行模式：--sql.diagram.input=<file> [--sql.diagram.output=<file>]
 *
 * @author afsun
 */
@Component
@Slf4j
public class DiagramCommandLineRunner implements ApplicationRunner {

    @Resource
    private DiagramProperties diagramProperties;

    @Resource
    private SqlDiagramService sqlDiagramService;

    @Override
    public void run(ApplicationArguments args) {
        String input = diagramProperties.getInput();
        if (StringUtils.isBlank(input)) {
            log.info("未指定 sql.diagram.input，跳过命令行生成");
            return;
        }
        Path inputPath = Paths.get(input);
        String sql;
        try {
            sql = new String(Files.readAllBytes(inputPath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("读取SQL文件失败: " + inputPath, e);
        }

        DiagramResult result = sqlDiagramService.generate(sql);
        for (DiagramWarning w : result.getWarnings()) {
            log.warn("[{}] {} ({})", w.getCategory(), w.getSummary(), w.getPosition());
        }

        String output = diagramProperties.getOutput();
        if (StringUtils.isBlank(output)) {
            log.info("流程图, traceId={}:\n{}", result.getTraceId(), result.getMermaid());
            return;
        }
        Path outputPath = Paths.get(output);
        try {
            Files.write(outputPath, result.getMermaid().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("写出流程图失败: " + outputPath, e);
        }
        log.info("流程图已写出: {}, 阶段数={}", outputPath, result.getSpec().getStages().size());
    }
}
