package io.github.yok.danp.core.danp;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 極限超行列と、そこから取り出した重みです。
 */
@Value
public class LimitingSupermatrix {

    /**
     * 極限超行列 W∞ です。
     */
    DMatrixRMaj matrix;

    /**
     * 正規化した重みです（ラベル順、和が 1）。
     */
    double[] weights;

    /**
     * 実行した二乗の回数です。
     */
    int iterations;

    /**
     * 最終反復での最大変化量です。
     */
    double lastMaxChange;
}
