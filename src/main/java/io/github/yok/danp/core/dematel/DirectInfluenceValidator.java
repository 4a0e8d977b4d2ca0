package io.github.yok.danp.core.dematel;

import io.github.yok.danp.core.error.InvalidInputException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * 直接影響行列 X とラベルの入力を検証するクラスです。
 *
 * <p>
 * 数値計算を始める前に、形状（正方・ラベル数との一致・2 以上）と値域（有限かつ 0 以上）を確認します。 対角成分 {@code X[i][i] = 0}
 * は慣例であり、違反していても失敗にはせず警告ログのみ出力します。
 * </p>
 */
@Slf4j
public final class DirectInfluenceValidator {

    /**
     * 解析に必要な最小の因子数です。
     */
    private static final int MIN_FACTORS = 2;

    /**
     * 直接影響行列とラベルを検証します。
     *
     * @param matrix 直接影響行列 X です
     * @param labels 因子ラベルです（行列の行・列と同じ順序）
     * @throws InvalidInputException 入力が不正な場合に発生します
     */
    public void validate(double[][] matrix, List<String> labels) {
        if (matrix == null || matrix.length == 0) {
            throw new InvalidInputException("matrix", "行列が空です");
        }
        if (labels == null) {
            throw new InvalidInputException("labels", "ラベルが指定されていません");
        }

        int n = matrix.length;

        for (int i = 0; i < n; i++) {
            if (matrix[i] == null || matrix[i].length != n) {
                int width = matrix[i] == null ? 0 : matrix[i].length;
                throw new InvalidInputException("matrix[" + i + "]",
                        "正方行列ではありません（行数=" + n + "、列数=" + width + "）");
            }
        }

        if (n < MIN_FACTORS) {
            throw new InvalidInputException("matrix", "因子数は " + MIN_FACTORS + " 以上が必要です: " + n);
        }

        if (labels.size() != n) {
            throw new InvalidInputException("labels",
                    "ラベル数と行列サイズが一致しません（ラベル数=" + labels.size() + "、行列=" + n + "x" + n + "）");
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < n; i++) {
            String label = labels.get(i);
            if (label == null || label.isBlank()) {
                throw new InvalidInputException("labels[" + i + "]", "ラベルが空です");
            }
            if (!seen.add(label)) {
                throw new InvalidInputException("labels[" + i + "]", "ラベルが重複しています: " + label);
            }
        }

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double v = matrix[i][j];
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException(cell(i, j), "有限の数値ではありません: " + v);
                }
                if (v < 0.0) {
                    throw new InvalidInputException(cell(i, j), "負の値は指定できません: " + v);
                }
            }
        }

        for (int i = 0; i < n; i++) {
            if (matrix[i][i] != 0.0) {
                log.warn("対角成分が 0 ではありません（自己影響は 0 とするのが慣例です）。因子={}、値={}", labels.get(i),
                        matrix[i][i]);
            }
        }
    }

    private static String cell(int i, int j) {
        return "matrix[" + i + "][" + j + "]";
    }
}
