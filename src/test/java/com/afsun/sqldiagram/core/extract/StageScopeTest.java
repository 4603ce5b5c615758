package com.afsun.sqldiagram.core.extract;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageScopeTest {

    @Test
    void testAliasResolution() {
        Map<String, String> stages = new HashMap<>();
        stages.put("recent", "Recent");
        StageScope scope = new StageScope(stages, "final select");
        scope.addAlias("[R]", "recent");

        assertEquals("recent", scope.resolve("r"));
        assertEquals("orders", scope.resolve("dbo.Orders"));
        assertNull(scope.resolve(null));
    }

    @Test
    void testOnlyKnownStagesBecomeDependencies() {
        Map<String, String> stages = new HashMap<>();
        stages.put("a", "a");
        stages.put("b", "b");
        StageScope scope = new StageScope(stages, "b");

        assertTrue(scope.addDependency("a"));
        assertFalse(scope.addDependency("a"));
        assertFalse(scope.addDependency("b"));
        assertFalse(scope.addDependency("orders"));
        assertFalse(scope.addDependency(null));
        assertEquals(1, scope.getDependencies().size());
    }
}
