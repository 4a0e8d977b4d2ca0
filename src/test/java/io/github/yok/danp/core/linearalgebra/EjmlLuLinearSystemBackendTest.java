package io.github.yok.danp.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.danp.core.linearalgebra.LinearSystemBackend.LinearSolveResult;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EJML LU 連立方程式バックエンド")
class EjmlLuLinearSystemBackendTest {

    private final EjmlLuLinearSystemBackend backend = new EjmlLuLinearSystemBackend();

    @Test
    @DisplayName("A X = B の解を返し、入力を書き換えない")
    void solvesWithoutMutatingInputs() {
        DMatrixRMaj a = Matrices.fromArray(new double[][] {{2, 1}, {1, 3}});
        DMatrixRMaj b = Matrices.fromArray(new double[][] {{3}, {5}});
        DMatrixRMaj aCopy = a.copy();
        DMatrixRMaj bCopy = b.copy();

        LinearSolveResult result = backend.solve(a, b);

        assertEquals(0.8, result.getSolution().get(0, 0), 1e-12);
        assertEquals(1.4, result.getSolution().get(1, 0), 1e-12);
        assertTrue(result.getQuality() > 0.1);
        assertEquals(0.0, Matrices.maxAbsDifference(a, aCopy));
        assertEquals(0.0, Matrices.maxAbsDifference(b, bCopy));
    }

    @Test
    @DisplayName("特異行列では品質が 0 になる")
    void singularMatrixHasZeroQuality() {
        DMatrixRMaj a = Matrices.fromArray(new double[][] {{1, -1}, {-1, 1}});
        DMatrixRMaj b = Matrices.fromArray(new double[][] {{1}, {1}});

        assertEquals(0.0, backend.solve(a, b).getQuality(), 1e-15);
    }

    @Test
    @DisplayName("形状が不正な場合は IllegalArgumentException")
    void rejectsShapeMismatch() {
        DMatrixRMaj a = new DMatrixRMaj(2, 3);
        DMatrixRMaj b = new DMatrixRMaj(2, 1);

        assertThrows(IllegalArgumentException.class, () -> backend.solve(a, b));
        assertThrows(IllegalArgumentException.class,
                () -> backend.solve(new DMatrixRMaj(2, 2), new DMatrixRMaj(3, 1)));
    }
}
