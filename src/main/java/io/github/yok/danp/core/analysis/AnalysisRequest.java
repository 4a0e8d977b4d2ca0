package io.github.yok.danp.core.analysis;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * 解析 1 回分の入力です。
 *
 * <p>
 * 行列とラベルはエンジン側でコピーしてから使うため、呼び出し側の配列が書き換えられることはありません。
 * </p>
 */
@Value
public class AnalysisRequest {

    /**
     * 解析の種類です。
     */
    AnalysisMode mode;

    /**
     * 因子ラベルです（行列の行・列と同じ順序）。
     */
    List<String> labels;

    /**
     * 直接影響行列 X です。
     */
    double[][] matrix;

    /**
     * 次元名 → 指標ラベル一覧 のグルーピングです（{@link AnalysisMode#DIMENSIONS} では null）。
     */
    Map<String, List<String>> grouping;

    /**
     * 次元の解析（DEMATEL のみ）の入力を作ります。
     *
     * @param labels 因子ラベルです
     * @param matrix 直接影響行列です
     * @return 入力です
     */
    public static AnalysisRequest dimensions(List<String> labels, double[][] matrix) {
        return new AnalysisRequest(AnalysisMode.DIMENSIONS, labels, matrix, null);
    }

    /**
     * 指標の解析（DEMATEL + DANP）の入力を作ります。
     *
     * @param labels 指標ラベルです
     * @param matrix 直接影響行列です
     * @param grouping 次元名 → 指標ラベル一覧 です
     * @return 入力です
     */
    public static AnalysisRequest indicators(List<String> labels, double[][] matrix,
            Map<String, List<String>> grouping) {
        return new AnalysisRequest(AnalysisMode.INDICATORS, labels, matrix, grouping);
    }
}
