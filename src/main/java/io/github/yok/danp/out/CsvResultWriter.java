package io.github.yok.danp.out;

import io.github.yok.danp.core.analysis.AnalysisResult;
import io.github.yok.danp.core.analysis.DanpWeights;
import io.github.yok.danp.core.danp.RankedIndicator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 解析結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は解析セッション名）。
 * </p>
 *
 * <ul>
 * <li>{@code danp_totalInfluence_<name>.csv}</li>
 * <li>{@code danp_simplified_<name>.csv}</li>
 * <li>{@code danp_prominenceRelation_<name>.csv}</li>
 * <li>{@code danp_ranking_<name>.csv}（DANP を実行した場合のみ）</li>
 * <li>{@code danp_meta_<name>.csv}（尺度 s、閾値 α、反復回数など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "danp";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 解析結果を出力します。
     *
     * @param name 解析セッション名です（ファイル名に使用します）
     * @param result 解析結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String name, AnalysisResult result) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name は必須です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 総影響行列
            writeMatrixCsv(fileOf("totalInfluence", name), result.getLabels(),
                    result.getTotalInfluenceMatrix());

            // 2) 簡略化した総影響行列
            writeMatrixCsv(fileOf("simplified", name), result.getLabels(),
                    result.getSimplifiedTotalInfluenceMatrix());

            // 3) 中心度・関係度
            writeProminenceRelationCsv(fileOf("prominenceRelation", name), result);

            // 4) 優先順位
            if (result.getDanp() != null) {
                writeRankingCsv(fileOf("ranking", name), result.getRanking());
            }

            // 5) メタ
            writeMetaCsv(fileOf("meta", name), result);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * ラベル付きの正方行列を出力します。
     *
     * @param file 出力ファイルです
     * @param labels ラベルです
     * @param matrix 行列です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeMatrixCsv(Path file, List<String> labels, double[][] matrix)
            throws IOException {
        List<String> header = new ArrayList<>(labels.size() + 1);
        header.add("factor");
        header.addAll(labels);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(header.toArray(new String[0])).build().print(w)) {
            for (int i = 0; i < matrix.length; i++) {
                List<Object> row = new ArrayList<>(matrix[i].length + 1);
                row.add(labels.get(i));
                for (double v : matrix[i]) {
                    row.add(v);
                }
                pr.printRecord(row);
            }
        }
    }

    /**
     * 因子ごとの D・R・中心度・関係度・役割を出力します。
     *
     * @param file 出力ファイルです
     * @param result 解析結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeProminenceRelationCsv(Path file, AnalysisResult result)
            throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("label", "d", "r", "prominence", "relation", "role").build()
                        .print(w)) {
            for (int i = 0; i < result.size(); i++) {
                pr.printRecord(result.getLabels().get(i), result.getD()[i], result.getR()[i],
                        result.getProminence()[i], result.getRelation()[i], result.getRoles().get(i));
            }
        }
    }

    /**
     * DANP の優先順位を出力します。
     *
     * @param file 出力ファイルです
     * @param ranking 重みの大きい順の一覧です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeRankingCsv(Path file, List<RankedIndicator> ranking)
            throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("priority", "label", "dimension", "weight").build().print(w)) {
            for (RankedIndicator r : ranking) {
                pr.printRecord(r.getPriority(), r.getLabel(), r.getDimension(), r.getWeight());
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param file 出力ファイルです
     * @param result 解析結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeMetaCsv(Path file, AnalysisResult result) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("mode", result.getMode());
            pr.printRecord("n", result.size());
            pr.printRecord("scale", result.getScale());
            pr.printRecord("threshold", result.getThreshold());

            DanpWeights danp = result.getDanp();
            if (danp != null) {
                pr.printRecord("dimensions", danp.getGrouping().dimensionCount());
                pr.printRecord("limit.iterations", danp.getIterations());
            }
        }
    }

    /**
     * 命名規約に従って出力ファイルのパスを作成します。
     *
     * @param kind 量の識別子です
     * @param name 解析セッション名です
     * @return 出力ファイルのパスです
     */
    private Path fileOf(String kind, String name) {
        return outputDir.resolve(FILE_HEAD + "_" + kind + "_" + name + ".csv");
    }
}
