package io.github.yok.danp.in;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.danp.core.error.InvalidInputException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("直接影響行列の CSV 読み込み")
class CsvMatrixReaderTest {

    private final CsvMatrixReader reader = new CsvMatrixReader();

    @Test
    @DisplayName("ヘッダのラベルと行列を読み込む")
    void readsLabelledMatrix(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("matrix.csv");
        Files.writeString(file, "factor,A,B,C\nA,0,3,1\nB,2,0,4.5\nC,1,1,0\n",
                StandardCharsets.UTF_8);

        LabelledMatrix m = reader.read(file);

        assertEquals(List.of("A", "B", "C"), m.getLabels());
        assertArrayEquals(new double[][] {{0, 3, 1}, {2, 0, 4.5}, {1, 1, 0}}, m.getMatrix());
    }

    @Test
    @DisplayName("引用符付きのラベルと前後の空白を扱える")
    void handlesQuotedLabels() throws IOException {
        LabelledMatrix m = reader.read(new StringReader(
                "factor,\"Brand, reputation\",B\n\"Brand, reputation\", 0, 2\nB, 1, 0\n"));

        assertEquals(List.of("Brand, reputation", "B"), m.getLabels());
        assertArrayEquals(new double[] {0, 2}, m.getMatrix()[0]);
    }

    @Test
    @DisplayName("数値でないセルはセル位置付きで InvalidInputException")
    void rejectsNonNumericCell() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> reader.read(new StringReader("factor,A,B\nA,0,x\nB,1,0\n")));
        assertEquals("matrix[0][1]", e.getField());
    }

    @Test
    @DisplayName("行ラベルの不一致や行数の不一致は labels の InvalidInputException")
    void rejectsLabelMismatch() {
        InvalidInputException order = assertThrows(InvalidInputException.class,
                () -> reader.read(new StringReader("factor,A,B\nB,0,1\nA,1,0\n")));
        assertEquals("labels[0]", order.getField());

        InvalidInputException count = assertThrows(InvalidInputException.class,
                () -> reader.read(new StringReader("factor,A,B,C\nA,0,1,1\nB,1,0,1\n")));
        assertEquals("labels", count.getField());
    }

    @Test
    @DisplayName("存在しないファイルは IllegalStateException")
    void missingFileIsIllegalState(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> reader.read(dir.resolve("none.csv")));
    }
}
