package io.github.yok.danp.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.danp.core.analysis.AnalysisMode;
import io.github.yok.danp.core.danp.DimensionWeighting;
import io.github.yok.danp.core.danp.SelfBlockPolicy;
import io.github.yok.danp.core.error.InvalidInputException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("設定値")
class DanpPropertiesTest {

    @Test
    @DisplayName("既定値")
    void defaults() {
        DanpProperties p = new DanpProperties();

        assertEquals(1e-12, p.getSolver().getSingularityTolerance());
        assertEquals(1e-9, p.getSolver().getResidualTolerance());
        assertEquals(SelfBlockPolicy.NORMALIZE, p.getSupermatrix().getSelfBlockPolicy());
        assertEquals(DimensionWeighting.TOTAL_INFLUENCE,
                p.getSupermatrix().getDimensionWeighting());
        assertEquals(1e-10, p.getLimit().getTolerance());
        assertEquals(64, p.getLimit().getMaxIterations());
        assertEquals(1e-8, p.getLimit().getColumnTolerance());
        assertEquals("./out", p.getOutput().getDir());
        assertTrue(p.getOutput().isEnabled());
    }

    @Test
    @DisplayName("YAML 風の整形にセクションとセッションが含まれる")
    void multilineString() {
        DanpProperties p = new DanpProperties();
        DanpProperties.Analysis a = new DanpProperties.Analysis();
        a.setName("dimensions");
        a.setMode(AnalysisMode.DIMENSIONS);
        a.setLabels(List.of("A", "B"));
        p.getAnalyses().add(a);

        String text = p.toMultilineString();

        assertTrue(text.contains("  solver:"));
        assertTrue(text.contains("    selfBlockPolicy: NORMALIZE"));
        assertTrue(text.contains("    maxIterations: 64"));
        assertTrue(text.contains("    dimensions: DIMENSIONS (2 factors)"));
        assertTrue(text.contains("    dir: ./out"));
    }

    @Test
    @DisplayName("ラベル未指定 (null) のセッションも 0 因子として整形できる")
    void multilineStringWithoutLabels() {
        DanpProperties p = new DanpProperties();
        DanpProperties.Analysis a = new DanpProperties.Analysis();
        a.setName("unlabelled");
        a.setMode(AnalysisMode.DIMENSIONS);
        a.setLabels(null);
        p.getAnalyses().add(a);

        String text = p.toMultilineString();

        assertTrue(text.contains("    unlabelled: DIMENSIONS (0 factors)"));
    }

    @Test
    @DisplayName("グルーピングは指定順の対応になり、重複した次元名は拒否する")
    void groupingAsMap() {
        DanpProperties.Analysis a = new DanpProperties.Analysis();
        assertNull(a.groupingAsMap());

        a.getGrouping().add(group("Y", "b"));
        a.getGrouping().add(group("X", "a"));
        assertEquals(List.of("Y", "X"), List.copyOf(a.groupingAsMap().keySet()));

        a.getGrouping().add(group("Y", "c"));
        assertEquals("grouping",
                assertThrows(InvalidInputException.class, a::groupingAsMap).getField());
    }

    private static DanpProperties.Group group(String dimension, String... indicators) {
        DanpProperties.Group g = new DanpProperties.Group();
        g.setDimension(dimension);
        g.setIndicators(List.of(indicators));
        return g;
    }
}
