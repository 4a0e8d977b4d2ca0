package io.github.yok.danp.core.analysis;

import io.github.yok.danp.core.danp.RankedIndicator;
import io.github.yok.danp.core.dematel.FactorRole;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 解析 1 回分の結果です。
 *
 * <p>
 * 配列はすべてラベルと同じ順序です。 DANP は {@link AnalysisMode#INDICATORS} の場合にのみ実行され、それ以外では {@link #getDanp()} は
 * null、{@link #getRanking()} は空です。
 * </p>
 */
@Value
public class AnalysisResult {

    /**
     * 解析の種類です。
     */
    AnalysisMode mode;

    /**
     * 因子ラベルです。
     */
    List<String> labels;

    /**
     * 正規化尺度 s です。
     */
    double scale;

    /**
     * 総影響行列 T です。
     */
    double[][] totalInfluenceMatrix;

    /**
     * 表示用に簡略化した総影響行列です。
     */
    double[][] simplifiedTotalInfluenceMatrix;

    /**
     * 簡略化の閾値 α（T の平均）です。
     */
    double threshold;

    /**
     * 影響度 D です。
     */
    double[] d;

    /**
     * 被影響度 R です。
     */
    double[] r;

    /**
     * 中心度 D+R です。
     */
    double[] prominence;

    /**
     * 関係度 D-R です。
     */
    double[] relation;

    /**
     * 因子ごとの役割（原因 / 結果）です。
     */
    List<FactorRole> roles;

    /**
     * DANP の結果です（DIMENSIONS では null）。
     */
    DanpWeights danp;

    /**
     * 重みの大きい順の一覧を返します。
     *
     * @return DANP を実行した場合はその一覧、それ以外は空リストです
     */
    public List<RankedIndicator> getRanking() {
        return danp == null ? Collections.emptyList() : danp.getRanking();
    }

    /**
     * 因子数を返します。
     *
     * @return 因子数 n です
     */
    public int size() {
        return labels.size();
    }
}
