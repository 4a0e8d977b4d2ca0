package io.github.yok.danp.core.dematel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.danp.core.error.DegenerateMatrixException;
import io.github.yok.danp.core.linearalgebra.Matrices;
import io.github.yok.danp.testutil.DanpFixtures;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("直接影響行列の正規化")
class DirectInfluenceNormalizerTest {

    private final DirectInfluenceNormalizer normalizer = new DirectInfluenceNormalizer();

    @Test
    @DisplayName("尺度は行和の最大と列和の最大の大きい方")
    void scaleIsMaxOfRowAndColumnSums() {
        // 行和の最大 = 2
        assertEquals(2.0, normalizer.normalize(
                Matrices.fromArray(new double[][] {{0, 1, 1}, {0, 0, 0}, {0, 0, 0}})).getScale());
        // 列和の最大 = 2（行和の最大は 1）
        assertEquals(2.0, normalizer.normalize(
                Matrices.fromArray(new double[][] {{0, 0, 1}, {0, 0, 1}, {0, 0, 0}})).getScale());
    }

    @Test
    @DisplayName("全体を同じ尺度で割り、入力は変更しない")
    void dividesByGlobalScale() {
        DMatrixRMaj x = Matrices.fromArray(DanpFixtures.dimensionMatrix());
        DMatrixRMaj copy = x.copy();

        NormalizedMatrix normalized = normalizer.normalize(x);

        assertEquals(11.0, normalized.getScale(), 1e-12);
        assertEquals(3.5 / 11.0, normalized.getMatrix().get(0, 1), 1e-15);
        assertTrue(Matrices.max(Matrices.rowSums(normalized.getMatrix())) <= 1.0 + 1e-15);
        assertTrue(Matrices.max(Matrices.columnSums(normalized.getMatrix())) <= 1.0 + 1e-15);
        assertEquals(0.0, Matrices.maxAbsDifference(x, copy));
    }

    @Test
    @DisplayName("すべて 0 の行列は DegenerateMatrixException")
    void allZeroIsDegenerate() {
        DegenerateMatrixException e = assertThrows(DegenerateMatrixException.class,
                () -> normalizer.normalize(new DMatrixRMaj(4, 4)));
        assertTrue(e.isUserCorrectable());
        assertFalse(e.getMessage().isEmpty());
    }
}
