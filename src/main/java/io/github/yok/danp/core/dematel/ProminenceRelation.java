package io.github.yok.danp.core.dematel;

import java.util.List;
import lombok.Value;

/**
 * 総影響行列から求めた、因子ごとの影響度・被影響度・中心度・関係度です。
 *
 * <p>
 * いずれの配列もラベルと同じ順序で並びます。
 * </p>
 */
@Value
public class ProminenceRelation {

    /**
     * 影響度 D（行和、因子が与える影響）です。
     */
    double[] d;

    /**
     * 被影響度 R（列和、因子が受ける影響）です。
     */
    double[] r;

    /**
     * 中心度 {@code D + R} です。
     */
    double[] prominence;

    /**
     * 関係度 {@code D - R} です。
     */
    double[] relation;

    /**
     * 関係度から決めた因子の役割です。
     */
    List<FactorRole> roles;
}
