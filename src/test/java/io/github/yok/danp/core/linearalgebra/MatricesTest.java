package io.github.yok.danp.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("行列ユーティリティ")
class MatricesTest {

    @Test
    @DisplayName("配列からの変換はコピーを作る")
    void fromArrayCopies() {
        double[][] values = {{1, 2}, {3, 4}};
        DMatrixRMaj m = Matrices.fromArray(values);
        values[0][0] = 99;

        assertEquals(1.0, m.get(0, 0));
        assertArrayEquals(new double[] {3, 4}, Matrices.toArray(m)[1]);
    }

    @Test
    @DisplayName("行和・列和・総和・最大値")
    void sums() {
        DMatrixRMaj m = Matrices.fromArray(new double[][] {{1, 2, 3}, {4, 5, 6}});

        assertArrayEquals(new double[] {6, 15}, Matrices.rowSums(m), 1e-15);
        assertArrayEquals(new double[] {5, 7, 9}, Matrices.columnSums(m), 1e-15);
        assertEquals(21.0, Arrays.stream(Matrices.rowSums(m)).sum(), 1e-15);
        assertEquals(15.0, Matrices.max(Matrices.rowSums(m)));
    }

    @Test
    @DisplayName("矩形でない配列は拒否する")
    void rejectsRaggedArray() {
        assertThrows(IllegalArgumentException.class,
                () -> Matrices.fromArray(new double[][] {{1, 2}, {3}}));
    }
}
