package io.github.yok.danp.in;

import io.github.yok.danp.core.error.InvalidInputException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * ラベル付きの直接影響行列を CSV から読み込むクラスです。
 *
 * <p>
 * 形式は次のとおりです（先頭列のヘッダ名は任意）。
 * </p>
 *
 * <pre>
 * factor,A,B,C
 * A,0,3,1
 * B,2,0,4
 * C,1,1,0
 * </pre>
 *
 * <p>
 * 行ラベルは列ラベルと同じ順序で並んでいる必要があります。 形状や値域の検証は解析エンジン側で行います。
 * </p>
 */
public final class CsvMatrixReader {

    /**
     * CSV ファイルを読み込みます。
     *
     * @param file CSV ファイルです
     * @return ラベル付きの行列です
     * @throws InvalidInputException ラベルの不一致や数値でないセルがある場合に発生します
     * @throws IllegalStateException ファイルの読み込みに失敗した場合に発生します
     */
    public LabelledMatrix read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 読み込みに失敗しました: " + file, e);
        }
    }

    /**
     * CSV を読み込みます。
     *
     * @param reader 入力です（クローズは呼び出し側が行います）
     * @return ラベル付きの行列です
     * @throws IOException 読み込みに失敗した場合に発生します
     * @throws InvalidInputException ラベルの不一致や数値でないセルがある場合に発生します
     */
    public LabelledMatrix read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true).build();

        List<CSVRecord> records;
        try (CSVParser parser = format.parse(reader)) {
            records = parser.getRecords();
        }

        if (records.isEmpty()) {
            throw new InvalidInputException("matrix", "CSV が空です");
        }

        // 1) ヘッダ（先頭セル以外が列ラベル）
        CSVRecord header = records.get(0);
        List<String> labels = new ArrayList<>(header.size() - 1);
        for (int j = 1; j < header.size(); j++) {
            labels.add(header.get(j));
        }

        // 2) データ行
        int n = records.size() - 1;
        if (n != labels.size()) {
            throw new InvalidInputException("labels",
                    "行数と列ラベル数が一致しません（行数=" + n + "、列ラベル数=" + labels.size() + "）");
        }

        double[][] matrix = new double[n][];
        for (int i = 0; i < n; i++) {
            CSVRecord row = records.get(i + 1);
            String rowLabel = row.get(0);
            if (!rowLabel.equals(labels.get(i))) {
                throw new InvalidInputException("labels[" + i + "]",
                        "行ラベルが列ラベルと一致しません: " + rowLabel + " != " + labels.get(i));
            }
            matrix[i] = new double[row.size() - 1];
            for (int j = 1; j < row.size(); j++) {
                matrix[i][j - 1] = parseCell(row.get(j), i, j - 1);
            }
        }

        return new LabelledMatrix(Collections.unmodifiableList(labels), matrix);
    }

    private static double parseCell(String cell, int i, int j) {
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("matrix[" + i + "][" + j + "]", "数値ではありません: " + cell, e);
        }
    }
}
