package com.afsun.sqldiagram.core.render;

import com.afsun.sqldiagram.core.model.ClauseItem;
import com.afsun.sqldiagram.core.model.DiagramSpec;
import com.afsun.sqldiagram.core.model.Stage;
import com.afsun.sqldiagram.core.util.IdentifierCanonicalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Mermaid flowchart 渲染实现。
 * <p>
 * 每个阶段一个 subgraph，阶段内子句按 FROM、JOIN、WHERE、GROUP BY 顺序串联；
 * 阶段之间按依赖画血缘箭头，没有任何依赖时按发现顺序串联。
 *
 * @author afsun
 */
@Slf4j
public class MermaidDiagramRenderer implements DiagramRenderer {

    public static final String HEADER = "flowchart TD";
    public static final String NO_STAGES = "No stages found in SQL";
    public static final String NO_CLAUSES = "(No SQL clauses)";

    @Override
    public String render(DiagramSpec spec) {
        if (spec == null || spec.isEmpty()) {
            return errorDiagram(NO_STAGES);
        }
        List<Stage> stages = spec.getStages();
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        for (Stage stage : stages) {
            lines.add("");
            renderStage(stage, lines);
        }
        lines.add("");
        lines.addAll(lineage(stages));
        return String.join("\n", lines);
    }

    public static String errorDiagram(String message) {
        return HEADER + "\n    E[\"" + escape(message) + "\"]";
    }

    private void renderStage(Stage stage, List<String> lines) {
        String id = stage.getId();
        lines.add("subgraph " + id + "[\"" + escape(stage.label()) + "\"]");
        lines.add("    direction TB");
        List<String> nodeIds = new ArrayList<>();
        for (ClauseItem item : stage.orderedClauses()) {
            String nodeId = id + "_N" + nodeIds.size();
            lines.add("    " + nodeId + "[\"" + escape(item.label()) + "\"]");
            nodeIds.add(nodeId);
        }
        if (nodeIds.isEmpty()) {
            lines.add("    " + id + "_N0[\"" + NO_CLAUSES + "\"]");
        }
        for (int i = 1; i < nodeIds.size(); i++) {
            lines.add("    " + nodeIds.get(i - 1) + " --> " + nodeIds.get(i));
        }
        lines.add("end");
    }

    private List<String> lineage(List<Stage> stages) {
        List<String> arrows = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            Stage dependent = stages.get(i);
            // 生产者按阶段顺序输出，保证确定性
            TreeSet<Integer> producers = new TreeSet<>();
            for (String dep : dependent.getDependencies()) {
                int producer = producerOf(stages, i, dep);
                if (producer < 0) {
                    log.debug("依赖无法解析为阶段，忽略: {} <- {}", dependent.getId(), dep);
                    continue;
                }
                producers.add(producer);
            }
            for (Integer p : producers) {
                arrows.add(stages.get(p).getId() + " --> " + dependent.getId());
            }
        }
        if (arrows.isEmpty() && stages.size() > 1) {
            for (int i = 1; i < stages.size(); i++) {
                arrows.add(stages.get(i - 1).getId() + " --> " + stages.get(i).getId());
            }
        }
        return arrows;
    }

    /**
     * 依赖名对应的生产阶段：优先取依赖方之前最近的同名阶段，否则取全局最后一个同名阶段
     *
     * @return 阶段下标，找不到返回 -1
     */
    private int producerOf(List<Stage> stages, int dependentIndex, String dependency) {
        String key = IdentifierCanonicalizer.canonicalize(dependency);
        if (key == null) {
            return -1;
        }
        int latest = -1;
        int latestBefore = -1;
        for (int j = 0; j < stages.size(); j++) {
            if (j == dependentIndex || !key.equals(IdentifierCanonicalizer.canonicalize(stages.get(j).getName()))) {
                continue;
            }
            latest = j;
            if (j < dependentIndex) {
                latestBefore = j;
            }
        }
        return latestBefore >= 0 ? latestBefore : latest;
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", " ")
                .replace("\r", "");
    }
}
