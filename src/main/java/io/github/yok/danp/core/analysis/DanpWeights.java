package io.github.yok.danp.core.analysis;

import io.github.yok.danp.core.danp.DimensionGrouping;
import io.github.yok.danp.core.danp.RankedIndicator;
import java.util.List;
import lombok.Value;

/**
 * DANP による重み付けの結果です。
 */
@Value
public class DanpWeights {

    /**
     * 使用した次元グルーピングです。
     */
    DimensionGrouping grouping;

    /**
     * 非加重超行列です。
     */
    double[][] unweightedSupermatrix;

    /**
     * 次元レベルの総影響行列（k×k）です。
     */
    double[][] dimensionInfluence;

    /**
     * 重み付き超行列です。
     */
    double[][] weightedSupermatrix;

    /**
     * 極限超行列です。
     */
    double[][] limitingSupermatrix;

    /**
     * 正規化した重みです（ラベル順）。
     */
    double[] weights;

    /**
     * 重みの大きい順の一覧です。
     */
    List<RankedIndicator> ranking;

    /**
     * 極限超行列を求めるのに要した二乗の回数です。
     */
    int iterations;
}
