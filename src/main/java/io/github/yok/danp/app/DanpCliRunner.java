package io.github.yok.danp.app;

import io.github.yok.danp.core.analysis.AnalysisRequest;
import io.github.yok.danp.core.analysis.AnalysisResult;
import io.github.yok.danp.core.analysis.DematelAnalysisEngine;
import io.github.yok.danp.core.danp.RankedIndicator;
import io.github.yok.danp.core.error.DanpAnalysisException;
import io.github.yok.danp.core.error.InvalidInputException;
import io.github.yok.danp.in.CsvMatrixReader;
import io.github.yok.danp.in.LabelledMatrix;
import io.github.yok.danp.out.ResultWriter;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で danp-solver を実行するクラスです。
 *
 * <p>
 * 設定された解析セッションを記載順に実行し、結果をコンソールと CSV に出力します。 1 つのセッションが失敗しても、残りのセッションは続けて実行します。
 * </p>
 *
 * <ul>
 * <li>入力起因の失敗（検証エラー、影響関係がすべて 0 など）: WARN ログと利用者向けメッセージ</li>
 * <li>内部の失敗（特異行列、未収束など）: ERROR ログに詳細、コンソールには「解析に失敗しました」のみ</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DanpCliRunner implements CommandLineRunner {

    /**
     * danp-solver の設定値（danp.*）です。
     */
    private final DanpProperties properties;

    /**
     * 解析エンジンです。
     */
    private final DematelAnalysisEngine engine;

    /**
     * 直接影響行列の CSV 読み込みロジックです。
     */
    private final CsvMatrixReader csvMatrixReader;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== danp-solver start: DEMATEL / DANP analysis ===");
        System.out.print(properties.toMultilineString());

        List<DanpProperties.Analysis> analyses = properties.getAnalyses();
        if (analyses == null || analyses.isEmpty()) {
            log.warn("解析セッションが設定されていません（danp.analyses）");
            return;
        }

        int failed = 0;
        for (int i = 0; i < analyses.size(); i++) {
            DanpProperties.Analysis analysis = analyses.get(i);
            System.out.println("=== 解析セッション: " + analysis.getName() + "（" + analysis.getMode()
                    + ", step=" + (i + 1) + "/" + analyses.size() + "）===");
            if (!runSession(analysis)) {
                failed++;
            }
        }

        System.out.println("=== danp-solver end: 成功=" + (analyses.size() - failed) + ", 失敗="
                + failed + " ===");
    }

    /**
     * 解析セッションを 1 件実行します。
     *
     * @param analysis セッション設定です
     * @return 成功した場合は true です
     */
    boolean runSession(DanpProperties.Analysis analysis) {
        try {
            AnalysisResult result = engine.analyze(toRequest(analysis));
            print(result);
            if (properties.getOutput().isEnabled()) {
                resultWriter.write(analysis.getName(), result);
            }
            return true;
        } catch (DanpAnalysisException e) {
            if (e.isUserCorrectable()) {
                log.warn("入力を確認してください: session={}, {}", analysis.getName(), e.getMessage());
                System.out.println("入力エラー: " + e.getMessage());
            } else {
                log.error("解析に失敗しました: session={}", analysis.getName(), e);
                System.out.println("解析に失敗しました");
            }
            return false;
        } catch (IllegalStateException e) {
            log.error("解析に失敗しました: session={}", analysis.getName(), e);
            System.out.println("解析に失敗しました");
            return false;
        }
    }

    /**
     * セッション設定から解析の入力を作ります。
     *
     * @param analysis セッション設定です
     * @return 解析の入力です
     * @throws InvalidInputException 行列の指定が不正な場合に発生します
     */
    AnalysisRequest toRequest(DanpProperties.Analysis analysis) {
        boolean inline = analysis.getMatrix() != null && !analysis.getMatrix().isEmpty();
        boolean file = analysis.getMatrixFile() != null && !analysis.getMatrixFile().isBlank();

        if (inline == file) {
            throw new InvalidInputException("matrix",
                    "matrix と matrix-file はどちらか一方を指定してください");
        }

        List<String> labels = analysis.getLabels();
        double[][] matrix;
        if (file) {
            LabelledMatrix read = csvMatrixReader.read(Paths.get(analysis.getMatrixFile()));
            if (labels != null && !labels.isEmpty() && !labels.equals(read.getLabels())) {
                throw new InvalidInputException("labels",
                        "設定のラベルと CSV のラベルが一致しません: " + labels + " vs " + read.getLabels());
            }
            labels = read.getLabels();
            matrix = read.getMatrix();
        } else {
            matrix = toArray(analysis.getMatrix());
        }

        switch (analysis.getMode()) {
            case DIMENSIONS:
                if (analysis.groupingAsMap() != null) {
                    throw new InvalidInputException("grouping", "DIMENSIONS ではグルーピングを指定できません");
                }
                return AnalysisRequest.dimensions(labels, matrix);
            case INDICATORS:
                return AnalysisRequest.indicators(labels, matrix, analysis.groupingAsMap());
            default:
                throw new IllegalStateException("未対応の解析の種類です: " + analysis.getMode());
        }
    }

    /**
     * 解析結果をコンソールに出力します。
     *
     * @param result 解析結果です
     */
    private static void print(AnalysisResult result) {
        System.out.println("結果: n=" + result.size() + ", s=" + fmt5(result.getScale()) + ", α="
                + fmt5(result.getThreshold()));
        for (int i = 0; i < result.size(); i++) {
            System.out.println("  " + result.getLabels().get(i) + ": D=" + fmt5(result.getD()[i])
                    + ", R=" + fmt5(result.getR()[i]) + ", D+R=" + fmt5(result.getProminence()[i])
                    + ", D-R=" + fmt5(result.getRelation()[i]) + ", " + result.getRoles().get(i));
        }
        for (RankedIndicator r : result.getRanking()) {
            System.out.println("  #" + r.getPriority() + " " + r.getLabel() + " [" + r.getDimension()
                    + "] weight=" + fmt5(r.getWeight()));
        }
    }

    /**
     * 設定の行列を 2 次元配列に変換します。
     *
     * @param rows 行列の各行です
     * @return 2 次元配列です
     * @throws InvalidInputException null の行またはセルがある場合に発生します
     */
    private static double[][] toArray(List<List<Double>> rows) {
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null) {
                throw new InvalidInputException("matrix[" + i + "]", "行が指定されていません");
            }
            out[i] = new double[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Double v = row.get(j);
                if (v == null) {
                    throw new InvalidInputException("matrix[" + i + "][" + j + "]", "値が指定されていません");
                }
                out[i][j] = v;
            }
        }
        return out;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
