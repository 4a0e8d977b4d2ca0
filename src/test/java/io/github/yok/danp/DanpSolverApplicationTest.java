package io.github.yok.danp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import io.github.yok.danp.app.DanpProperties;
import io.github.yok.danp.core.analysis.AnalysisMode;
import io.github.yok.danp.core.analysis.DematelAnalysisEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "danp.output.enabled=false")
@DisplayName("アプリケーション起動と application.yml の読み込み")
class DanpSolverApplicationTest {

    @Autowired
    private DanpProperties properties;

    @Autowired
    private DematelAnalysisEngine engine;

    @Test
    @DisplayName("2 つの解析セッションが読み込まれる")
    void bindsExampleSessions() {
        assertNotNull(engine);
        assertEquals(2, properties.getAnalyses().size());

        DanpProperties.Analysis dimensions = properties.getAnalyses().get(0);
        assertEquals(AnalysisMode.DIMENSIONS, dimensions.getMode());
        assertEquals(4, dimensions.getMatrix().size());
        assertEquals(3.5, dimensions.getMatrix().get(0).get(1).doubleValue());

        DanpProperties.Analysis indicators = properties.getAnalyses().get(1);
        assertEquals(AnalysisMode.INDICATORS, indicators.getMode());
        assertEquals(8, indicators.getLabels().size());
        assertEquals(8, indicators.getMatrix().get(7).size());
        assertEquals(4, indicators.groupingAsMap().size());
        assertEquals(5, indicators.groupingAsMap().get("Intangible assets").size());
    }
}
