package io.github.yok.danp.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.danp.core.analysis.AnalysisMode;
import io.github.yok.danp.core.analysis.AnalysisRequest;
import io.github.yok.danp.core.error.InvalidInputException;
import io.github.yok.danp.in.CsvMatrixReader;
import io.github.yok.danp.testutil.DanpFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CLI 実行")
class DanpCliRunnerTest {

    private DanpProperties properties;

    private List<String> written;

    private DanpCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new DanpProperties();
        written = new ArrayList<>();
        runner = new DanpCliRunner(properties, DanpFixtures.engine(), new CsvMatrixReader(),
                (name, result) -> written.add(name));
    }

    @Test
    @DisplayName("失敗したセッションがあっても残りのセッションを実行する")
    void continuesAfterFailures() {
        properties.getAnalyses().add(session("zero", AnalysisMode.DIMENSIONS,
                List.of("A", "B", "C", "D"), new double[4][4]));
        properties.getAnalyses().add(session("singular", AnalysisMode.DIMENSIONS,
                List.of("A", "B"), new double[][] {{0, 1}, {1, 0}}));
        properties.getAnalyses().add(session("dimensions", AnalysisMode.DIMENSIONS,
                DanpFixtures.DIMENSION_LABELS, DanpFixtures.dimensionMatrix()));

        runner.run();

        assertEquals(List.of("dimensions"), written);
    }

    @Test
    @DisplayName("成功なら true、入力エラー・内部エラーなら false")
    void sessionOutcome() {
        assertTrue(runner.runSession(session("ok", AnalysisMode.DIMENSIONS,
                DanpFixtures.DIMENSION_LABELS, DanpFixtures.dimensionMatrix())));
        assertFalse(runner.runSession(session("negative", AnalysisMode.DIMENSIONS,
                List.of("A", "B"), new double[][] {{0, -1}, {1, 0}})));
        assertFalse(runner.runSession(session("singular", AnalysisMode.DIMENSIONS,
                List.of("A", "B"), new double[][] {{0, 1}, {1, 0}})));
        assertEquals(List.of("ok"), written);
    }

    @Test
    @DisplayName("出力を無効にすると CSV を書かない")
    void outputCanBeDisabled() {
        properties.getOutput().setEnabled(false);

        assertTrue(runner.runSession(session("ok", AnalysisMode.DIMENSIONS,
                DanpFixtures.DIMENSION_LABELS, DanpFixtures.dimensionMatrix())));
        assertTrue(written.isEmpty());
    }

    @Test
    @DisplayName("指標のセッションはグルーピング付きの入力になる")
    void indicatorSessionCarriesGrouping() {
        DanpProperties.Analysis analysis = session("indicators", AnalysisMode.INDICATORS,
                DanpFixtures.INDICATOR_LABELS, DanpFixtures.indicatorMatrix());
        DanpFixtures.indicatorGrouping().forEach((dimension, indicators) -> {
            DanpProperties.Group g = new DanpProperties.Group();
            g.setDimension(dimension);
            g.setIndicators(indicators);
            analysis.getGrouping().add(g);
        });

        AnalysisRequest request = runner.toRequest(analysis);

        assertEquals(AnalysisMode.INDICATORS, request.getMode());
        assertEquals(DanpFixtures.indicatorGrouping(), request.getGrouping());
        assertTrue(runner.runSession(analysis));
    }

    @Test
    @DisplayName("行列は CSV ファイルからも読み込める")
    void readsMatrixFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("m.csv");
        Files.writeString(file, "factor,A,B\nA,0,2\nB,1,0\n", StandardCharsets.UTF_8);
        DanpProperties.Analysis analysis = new DanpProperties.Analysis();
        analysis.setName("file");
        analysis.setMode(AnalysisMode.DIMENSIONS);
        analysis.setMatrixFile(file.toString());

        AnalysisRequest request = runner.toRequest(analysis);

        assertEquals(List.of("A", "B"), request.getLabels());
        assertEquals(2.0, request.getMatrix()[0][1]);
        assertNull(request.getGrouping());
    }

    @Test
    @DisplayName("行列の指定が不正な場合は InvalidInputException")
    void invalidMatrixSpecification() {
        DanpProperties.Analysis neither = new DanpProperties.Analysis();
        neither.setName("neither");
        neither.setMode(AnalysisMode.DIMENSIONS);
        assertEquals("matrix",
                assertThrows(InvalidInputException.class, () -> runner.toRequest(neither))
                        .getField());

        DanpProperties.Analysis both = session("both", AnalysisMode.DIMENSIONS, List.of("A", "B"),
                new double[][] {{0, 1}, {1, 0}});
        both.setMatrixFile("m.csv");
        assertThrows(InvalidInputException.class, () -> runner.toRequest(both));

        DanpProperties.Analysis nullCell = session("null", AnalysisMode.DIMENSIONS,
                List.of("A", "B"), new double[][] {{0, 1}, {1, 0}});
        nullCell.getMatrix().set(1, Arrays.asList(1.0, null));
        assertEquals("matrix[1][1]",
                assertThrows(InvalidInputException.class, () -> runner.toRequest(nullCell))
                        .getField());
    }

    private static DanpProperties.Analysis session(String name, AnalysisMode mode,
            List<String> labels, double[][] matrix) {
        DanpProperties.Analysis analysis = new DanpProperties.Analysis();
        analysis.setName(name);
        analysis.setMode(mode);
        analysis.setLabels(new ArrayList<>(labels));
        List<List<Double>> rows = new ArrayList<>();
        for (double[] row : matrix) {
            List<Double> values = new ArrayList<>();
            for (double v : row) {
                values.add(v);
            }
            rows.add(values);
        }
        analysis.setMatrix(rows);
        return analysis;
    }
}
