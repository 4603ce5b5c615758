package com.afsun.sqldiagram.core;

import com.afsun.sqldiagram.core.model.Stage;
import com.afsun.sqldiagram.core.model.StageKind;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSqlDiagramGeneratorTest {

    private static final String ERROR_DIAGRAM = "flowchart TD\n    E[\"No stages found in SQL\"]";

    private DefaultSqlDiagramGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DefaultSqlDiagramGenerator();
    }

    @Test
    void testCteQueryEndToEnd() {
        String sql = "WITH recent AS (\n"
                + "  SELECT id FROM orders WHERE amount > 100\n"
                + ")\n"
                + "SELECT r.id FROM recent r";
        DiagramResult result = generator.generate(sql, DbType.sqlserver);

        assertNotNull(result);
        assertTrue(result.getTraceId().startsWith("DG-"));
        assertFalse(result.isSanitized());
        assertEquals(2, result.getSpec().getStages().size());
        String expected = "flowchart TD\n"
                + "\n"
                + "subgraph S0[\"recent (CTE)\"]\n"
                + "    direction TB\n"
                + "    S0_N0[\"FROM: orders\"]\n"
                + "    S0_N1[\"WHERE: amount > 100\"]\n"
                + "    S0_N0 --> S0_N1\n"
                + "end\n"
                + "\n"
                + "subgraph S1[\"Final SELECT (FINAL SELECT)\"]\n"
                + "    direction TB\n"
                + "    S1_N0[\"FROM: recent r\"]\n"
                + "end\n"
                + "\n"
                + "S0 --> S1";
        assertEquals(expected, result.getMermaid());
    }

    @Test
    void testTempTableScriptWithComments() {
        String sql = "-- load stage\n"
                + "SELECT id, amount INTO #stage FROM src /* raw feed */ WHERE amount > 0;\n"
                + "SELECT s.id FROM #stage s";
        DiagramResult result = generator.generate(sql, null);

        List<Stage> stages = result.getSpec().getStages();
        assertEquals(2, stages.size());
        assertEquals("#stage", stages.get(0).getName());
        assertEquals(StageKind.TEMP_TABLE, stages.get(0).getKind());
        assertTrue(result.getMermaid().endsWith("\nS0 --> S1"));
    }

    @Test
    void testSchemaQualifiedCteName() {
        String sql = "WITH dbo.recent AS (SELECT id FROM orders) SELECT id FROM recent";
        DiagramResult result = generator.generate(sql, DbType.sqlserver);

        List<Stage> stages = result.getSpec().getStages();
        assertEquals(2, stages.size());
        assertEquals(StageKind.CTE, stages.get(0).getKind());
        assertEquals(1, stages.get(1).getDependencies().size());
        assertTrue(result.getMermaid().endsWith("\nS0 --> S1"));
    }

    @Test
    void testBlankInput() {
        DiagramResult result = generator.generate("   ", null);

        assertTrue(result.getSpec().isEmpty());
        assertEquals(ERROR_DIAGRAM, result.getMermaid());
        assertEquals(DiagramWarning.EMPTY_INPUT, result.getWarnings().get(0).getCategory());
    }

    @Test
    void testGarbageNeverThrows() {
        DiagramResult result = generator.generate(")))(((", DbType.sqlserver);

        assertTrue(result.getSpec().isEmpty());
        assertEquals(ERROR_DIAGRAM, result.getMermaid());
        assertFalse(result.getWarnings().isEmpty());
    }

    @Test
    void testUnsupportedOnlyScript() {
        DiagramResult result = generator.generate("DELETE FROM t WHERE id = 1", DbType.sqlserver);

        assertTrue(result.getSpec().isEmpty());
        assertEquals(ERROR_DIAGRAM, result.getMermaid());
        assertEquals(DiagramWarning.UNSUPPORTED_STATEMENT, result.getWarnings().get(0).getCategory());
    }
}
